package org.complexcalc.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered sequence of tokens, tagged as infix or postfix. The tree
 * structure of a postfix expression is not stored; it is recovered on demand
 * by {@link SubexpressionLocator}.
 */
public final class Expression {

  private final List<Token> tokens;
  private final boolean postfix;

  Expression(List<Token> tokens, boolean postfix) {
    this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
    this.postfix = postfix;
  }

  public static Expression postfix(Token... tokens) {
    return new Expression(Arrays.asList(tokens), true);
  }

  public static Expression postfix(List<Token> tokens) {
    return new Expression(tokens, true);
  }

  public static Expression infix(List<Token> tokens) {
    return new Expression(tokens, false);
  }

  public boolean isPostfix() {
    return postfix;
  }

  public int size() {
    return tokens.size();
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public Token get(int index) {
    return tokens.get(index);
  }

  public Token last() {
    return tokens.get(tokens.size() - 1);
  }

  /**
   * Returns the unmodifiable token list.
   */
  public List<Token> tokens() {
    return tokens;
  }

  /**
   * Returns the tokens {@code [begin, end)} as a new postfix expression.
   */
  public Expression subExpression(int begin, int end) {
    return new Expression(tokens.subList(begin, end), true);
  }

  /**
   * Checks the postfix arity invariant: counting +1 per leaf, 0 per function
   * and -1 per binary operator, the running count stays positive and ends at
   * exactly one. Brackets never occur in a well-formed postfix sequence.
   */
  public boolean isWellFormedPostfix() {
    return isWellFormedPostfix(tokens, 0, tokens.size());
  }

  static boolean isWellFormedPostfix(List<Token> tokens, int begin, int end) {
    int pending = 0;
    for (int i = begin; i < end; i++) {
      TokenType type = tokens.get(i).getType();
      if (type == TokenType.BRACKET) {
        return false;
      }
      pending -= type.getArity();
      if (pending < 0) {
        return false;
      }
      ++pending;
    }
    return pending == 1;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Expression)) {
      return false;
    }
    Expression other = (Expression) obj;
    return postfix == other.postfix && tokens.equals(other.tokens);
  }

  @Override
  public int hashCode() {
    return tokens.hashCode() * 31 + (postfix ? 1 : 0);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.render(this);
  }
}
