package org.complexcalc.parser;

import java.util.Objects;

import org.complexcalc.math.Complex;

/**
 * One element of an expression: the variable {@code z}, a complex constant,
 * an operator, a function or a bracket. The operator is set exactly when the
 * token is not a leaf; the value is meaningful only for constants.
 */
public final class Token {

  private static final Token VARIABLE = new Token(TokenType.VARIABLE, null, Complex.ZERO);

  private final TokenType type;
  private final Operation op;
  private final Complex value;

  private Token(TokenType type, Operation op, Complex value) {
    this.type = type;
    this.op = op;
    this.value = value;
  }

  public static Token variable() {
    return VARIABLE;
  }

  public static Token constant(Complex value) {
    if (value == null) {
      throw new IllegalArgumentException("Constant value cannot be null.");
    }
    return new Token(TokenType.CONSTANT, null, value);
  }

  public static Token constant(double value) {
    return constant(Complex.valueOf(value));
  }

  public static Token operator(Operation op) {
    if (op == null) {
      throw new IllegalArgumentException("Operation cannot be null.");
    }
    return new Token(op.getType(), op, null);
  }

  public TokenType getType() {
    return type;
  }

  /**
   * Returns the operation, or null for variables and constants.
   */
  public Operation getOperation() {
    return op;
  }

  /**
   * Returns the constant's value, zero for the variable and null for operators.
   */
  public Complex getValue() {
    return value;
  }

  public boolean isVariable() {
    return type == TokenType.VARIABLE;
  }

  public boolean isConstant() {
    return type == TokenType.CONSTANT;
  }

  public boolean is(Operation operation) {
    return op == operation;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Token)) {
      return false;
    }
    Token other = (Token) obj;
    return type == other.type && op == other.op && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, op, value);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.render(this);
  }
}
