package org.complexcalc.parser;

/**
 * Thrown when the input text cannot be split into tokens: an escaped function
 * name without a terminator, a number with two decimal points, a malformed
 * complex literal or a character that is not part of the vocabulary.
 */
public class LexException extends ParserException {
  private static final long serialVersionUID = -2260416630893107345L;

  private final int m_position;

  LexException(String msg, String errPart, String expression, int position) {
    super(msg, errPart, expression);
    m_position = position;
  }

  /**
   * Index into {@link #getSubExpression()} at which the offending token starts.
   */
  public int getPosition() {
    return m_position;
  }
}
