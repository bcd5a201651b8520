package org.complexcalc.parser;

/**
 * Thrown when a function without a derivative table entry (re, im, abs, arg,
 * conj, deriv) has to be differentiated.
 */
public class UnknownDerivativeException extends OperationNotFoundException {
  private static final long serialVersionUID = 1290562312474810532L;

  UnknownDerivativeException(String msg, String errPart, String expression) {
    super(msg, errPart, expression);
  }
}
