package org.complexcalc.parser;

import org.complexcalc.math.Complex;

/**
 * Numeric evaluator behind an operator or function of the operation table.
 * During evaluation the stack machine pops {@link #getNumberOfParams()}
 * operands, passes them left to right in {@code p} and pushes the result.
 */
public interface IFunction {
  Complex run(Complex[] p);

  /**
   * Length of the parameter array passed to {@link #run(Complex[])}: 1 for
   * functions, 2 for binary operators.
   */
  int getNumberOfParams();
}
