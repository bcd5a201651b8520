package org.complexcalc.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import org.complexcalc.util.StrUtil;

/**
 * Converts an infix token sequence to postfix with the shunting-yard
 * algorithm. All binary operators are left associative: an operator pops
 * every stacked operator of the same or higher precedence. A function is
 * emitted when the bracket that closes its argument is reached, so
 * {@code \sin(z+1)} becomes {@code [z 1 + sin]}. Input whose operators
 * and operands do not add up to a single postfix expression is rejected.
 */
class ShuntingYard {

  private static final Logger logger = Logger.getLogger(ShuntingYard.class.getName());

  private final StrUtil m_Translate;

  ShuntingYard(StrUtil translate) {
    m_Translate = translate;
  }

  Expression toPostfix(Expression infix)
      throws MismatchedBracketsException, MalformedExpressionException {
    if (infix == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    if (infix.isPostfix()) {
      return infix;
    }

    List<Token> postfix = new ArrayList<Token>(infix.size());
    Deque<Token> stack = new ArrayDeque<Token>();

    for (Token t : infix.tokens()) {
      switch (t.getType()) {
        case VARIABLE:
        case CONSTANT:
          postfix.add(t);
          break;
        case FUNCTION:
          stack.push(t);
          break;
        case BINARY_OP:
          int precedence = t.getOperation().getPrecedence();
          while (!stack.isEmpty() && !stack.peek().is(Operation.L_BRACKET)
              && stack.peek().getOperation().getPrecedence() >= precedence) {
            postfix.add(stack.pop());
          }
          stack.push(t);
          break;
        case BRACKET:
          if (t.is(Operation.L_BRACKET)) {
            stack.push(t);
          }
          else {
            closeBracket(infix, postfix, stack);
          }
          break;
      }
    }

    while (!stack.isEmpty()) {
      Token t = stack.pop();
      if (t.is(Operation.L_BRACKET)) {
        String expression = infix.toString();
        throw new MismatchedBracketsException(m_Translate.getMessage("MisBrckt", expression),
            t.toString(), expression);
      }
      postfix.add(t);
    }

    if (!Expression.isWellFormedPostfix(postfix, 0, postfix.size())) {
      String expression = infix.toString();
      String rendered = ExpressionPrinter.render(postfix);
      throw new MalformedExpressionException(m_Translate.getMessage("ExpMalf", expression, rendered),
          rendered, expression);
    }

    logger.fine("Converted " + infix.size() + " infix tokens to " + postfix.size() + " postfix tokens");
    return Expression.postfix(postfix);
  }

  /**
   * Pops operators up to the matching opening bracket, drops both brackets
   * and emits the function the bracket belonged to, if any.
   */
  private void closeBracket(Expression infix, List<Token> postfix, Deque<Token> stack)
      throws MismatchedBracketsException {
    while (!stack.isEmpty() && !stack.peek().is(Operation.L_BRACKET)) {
      postfix.add(stack.pop());
    }
    if (stack.isEmpty()) {
      String expression = infix.toString();
      throw new MismatchedBracketsException(m_Translate.getMessage("BrcktMis", expression),
          Operation.R_BRACKET.getSymbol(), expression);
    }
    stack.pop();
    if (!stack.isEmpty() && stack.peek().getType() == TokenType.FUNCTION) {
      postfix.add(stack.pop());
    }
  }
}
