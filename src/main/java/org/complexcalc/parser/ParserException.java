package org.complexcalc.parser;

/**
 * ParserException is the root of the checked exceptions thrown by
 * {@link IComplexParser} when an expression cannot be tokenized, converted
 * or differentiated. The failure is a deterministic function of the input:
 * retrying the same call fails the same way.
 */
public class ParserException extends Exception {
  private static final long serialVersionUID = 3817745290116519442L;

  private final String m_err;
  private final String m_exp;

  ParserException(String msg, String errPart, String expression) {
    super(msg);
    m_err = errPart;
    m_exp = expression;
  }

  /**
   * Returns the part of the input that could not be handled, for example the
   * unrecognized character, the unmatched bracket or the rendered postfix
   * slice that failed to differentiate.
   */
  public String getInvalidPortionOfExpression() {
    return m_err;
  }

  /**
   * Returns the expression the invalid portion was found in. For tokenizer
   * errors this is the input with whitespace removed; for later stages it is
   * the rendered token sequence.
   */
  public String getSubExpression() {
    return m_exp;
  }
}
