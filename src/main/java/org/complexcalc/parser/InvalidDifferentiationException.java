package org.complexcalc.parser;

/**
 * Thrown when differentiation reaches a token it has no rule for, or when the
 * subexpression locator runs off the start of a malformed postfix slice.
 */
public class InvalidDifferentiationException extends ParserException {
  private static final long serialVersionUID = 8846017735329026103L;

  InvalidDifferentiationException(String msg, String errPart, String expression) {
    super(msg, errPart, expression);
  }
}
