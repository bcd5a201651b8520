package org.complexcalc.parser;

import org.complexcalc.math.Complex;

/**
 * Convenience base class for evaluators of one argument, such as sin(z).
 */
public abstract class OneParamFunc implements IFunction {
  public int getNumberOfParams() {
    return 1;
  }

  public abstract Complex run(Complex[] p);
}
