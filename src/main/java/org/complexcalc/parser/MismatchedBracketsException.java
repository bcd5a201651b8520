package org.complexcalc.parser;

/**
 * Thrown by the postfix conversion when an opening bracket is never closed or
 * a closing bracket has no opening partner.
 */
public class MismatchedBracketsException extends ParserException {
  private static final long serialVersionUID = 5120978834455291077L;

  MismatchedBracketsException(String msg, String errPart, String expression) {
    super(msg, errPart, expression);
  }
}
