package org.complexcalc.parser;

/**
 * Kind of a {@link Token}. Leaves are {@code VARIABLE} and {@code CONSTANT};
 * {@code FUNCTION} consumes one operand and {@code BINARY_OP} two.
 */
public enum TokenType {
  VARIABLE(0),
  CONSTANT(0),
  BINARY_OP(2),
  FUNCTION(1),
  BRACKET(0);

  private final int arity;

  TokenType(int arity) {
    this.arity = arity;
  }

  /**
   * Number of operands a token of this kind consumes in a postfix sequence.
   */
  public int getArity() {
    return arity;
  }
}
