package org.complexcalc.parser;

import java.util.ArrayDeque;
import java.util.Deque;

import org.complexcalc.math.Complex;

/**
 * Stack machine that evaluates a postfix expression at a point. Constants
 * push their value and the variable pushes the argument; a function pops one
 * operand and a binary operator pops two, the first pop being the right
 * operand.
 */
class Evaluator {

  private Evaluator() {
  }

  static Complex evaluate(Expression postfix, Complex z) {
    if (postfix == null || z == null) {
      throw new IllegalArgumentException("Expression and argument cannot be null.");
    }
    if (!postfix.isPostfix()) {
      throw new IllegalArgumentException("Only postfix expressions can be evaluated: " + postfix);
    }

    Deque<Complex> stack = new ArrayDeque<Complex>();
    for (Token t : postfix.tokens()) {
      switch (t.getType()) {
        case CONSTANT:
          stack.push(t.getValue());
          break;
        case VARIABLE:
          stack.push(z);
          break;
        case FUNCTION:
          Complex arg = pop(stack, postfix);
          stack.push(functionOf(t).run(new Complex[] {arg}));
          break;
        case BINARY_OP:
          Complex right = pop(stack, postfix);
          Complex left = pop(stack, postfix);
          stack.push(functionOf(t).run(new Complex[] {left, right}));
          break;
        default:
          throw new IllegalArgumentException("Bracket in postfix expression: " + postfix);
      }
    }
    if (stack.size() != 1) {
      throw new IllegalArgumentException("Malformed postfix expression: " + postfix);
    }
    return stack.pop();
  }

  private static Complex pop(Deque<Complex> stack, Expression postfix) {
    if (stack.isEmpty()) {
      throw new IllegalArgumentException("Missing operand in postfix expression: " + postfix);
    }
    return stack.pop();
  }

  private static IFunction functionOf(Token t) {
    try {
      return OperationTable.getFunction(t.getOperation());
    } catch (OperationNotFoundException ex) {
      // every non-bracket operation has an evaluator
      throw new IllegalStateException(ex.getMessage(), ex);
    }
  }
}
