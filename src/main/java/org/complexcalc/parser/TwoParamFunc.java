package org.complexcalc.parser;

import org.complexcalc.math.Complex;

/**
 * Convenience base class for evaluators of binary operators. {@code p[0]} is
 * the left operand and {@code p[1]} the right one.
 */
public abstract class TwoParamFunc implements IFunction {
  public int getNumberOfParams() {
    return 2;
  }

  public abstract Complex run(Complex[] p);
}
