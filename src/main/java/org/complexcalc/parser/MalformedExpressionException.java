package org.complexcalc.parser;

/**
 * Thrown by the postfix conversion when operators and operands do not pair
 * up, as in {@code z+}, {@code 2z} or {@code ()}. The brackets of such an
 * expression match but the result would not be a single postfix expression.
 */
public class MalformedExpressionException extends ParserException {
  private static final long serialVersionUID = -6046739812317592234L;

  MalformedExpressionException(String msg, String errPart, String expression) {
    super(msg, errPart, expression);
  }
}
