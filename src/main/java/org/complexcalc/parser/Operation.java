package org.complexcalc.parser;

/**
 * Closed set of operators, functions and brackets. Each constant carries its
 * display symbol, shunting-yard precedence and token kind; evaluators and
 * derivative fragments live in {@link OperationTable}.
 */
public enum Operation {
  L_BRACKET("(", 4, TokenType.BRACKET),
  R_BRACKET(")", 4, TokenType.BRACKET),
  ADD("+", 0, TokenType.BINARY_OP),
  SUB("-", 0, TokenType.BINARY_OP),
  NEG("~", 1, TokenType.FUNCTION),
  MUL("*", 1, TokenType.BINARY_OP),
  DIV("/", 1, TokenType.BINARY_OP),
  POW("^", 2, TokenType.BINARY_OP),
  RE("re", 3, TokenType.FUNCTION),
  IM("im", 3, TokenType.FUNCTION),
  ABS("abs", 3, TokenType.FUNCTION),
  ARG("arg", 3, TokenType.FUNCTION),
  CONJ("conj", 3, TokenType.FUNCTION),
  EXP("exp", 3, TokenType.FUNCTION),
  LOG("log", 3, TokenType.FUNCTION),
  COS("cos", 3, TokenType.FUNCTION),
  SIN("sin", 3, TokenType.FUNCTION),
  TAN("tan", 3, TokenType.FUNCTION),
  SEC("sec", 3, TokenType.FUNCTION),
  CSC("csc", 3, TokenType.FUNCTION),
  COT("cot", 3, TokenType.FUNCTION),
  ACOS("acos", 3, TokenType.FUNCTION),
  ASIN("asin", 3, TokenType.FUNCTION),
  ATAN("atan", 3, TokenType.FUNCTION),
  COSH("cosh", 3, TokenType.FUNCTION),
  SINH("sinh", 3, TokenType.FUNCTION),
  TANH("tanh", 3, TokenType.FUNCTION),
  ACOSH("acosh", 3, TokenType.FUNCTION),
  ASINH("asinh", 3, TokenType.FUNCTION),
  ATANH("atanh", 3, TokenType.FUNCTION),
  DERIV("deriv", 3, TokenType.FUNCTION);

  private final String symbol;
  private final int precedence;
  private final TokenType type;

  Operation(String symbol, int precedence, TokenType type) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.type = type;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getPrecedence() {
    return precedence;
  }

  public TokenType getType() {
    return type;
  }
}
