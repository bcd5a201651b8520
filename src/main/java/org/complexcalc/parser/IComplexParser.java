package org.complexcalc.parser;

import java.util.Locale;

import org.complexcalc.math.Complex;

/**
 * IComplexParser gives access to the tokenizer, the postfix converter, the
 * evaluator and the differentiation engine for expressions in the single
 * complex variable z. Use {@link ComplexParserFactory#create()} to get an
 * instance.
 * <p>
 * Expressions are written in infix notation, for example
 * <pre>
 *   3 + 4*2
 *   \sin(z)^2 + [1,2]*z
 *   -\exp(2i*z) / (z - pi)
 * </pre>
 * Functions are escaped with a backslash. Available names are listed by
 * {@link OperationTable#getFunctionNames()}.
 * <p>
 * Expressions are immutable and every method returns a new one, so an
 * expression can be shared between threads. A parser instance only holds the
 * locale of its messages; do not change the locale while another thread uses
 * the same instance.
 */
public interface IComplexParser {

  /**
   * Splits the text into an infix token sequence.
   *
   * @throws LexException if the text contains an unterminated function name,
   *         a malformed number or an unknown character
   * @throws OperationNotFoundException if an escaped function name is unknown
   */
  Expression parse(String text) throws LexException, OperationNotFoundException;

  /**
   * Converts an infix expression to postfix. A postfix expression is returned
   * unchanged.
   *
   * @throws MismatchedBracketsException if brackets do not pair up
   * @throws MalformedExpressionException if operators and operands do not
   *         pair up, for example {@code z+} or {@code 2z}
   */
  Expression toPostfix(Expression expression)
      throws MismatchedBracketsException, MalformedExpressionException;

  /**
   * Shortcut for {@code toPostfix(parse(text))}.
   */
  Expression compile(String text) throws ParserException;

  /**
   * Evaluates a well-formed postfix expression at z.
   *
   * @throws IllegalArgumentException if the expression is infix or malformed
   */
  Complex evaluate(Expression postfix, Complex z);

  /**
   * Returns the postfix derivative of a postfix expression with respect to z.
   *
   * @throws UnknownDerivativeException if a function without a known
   *         derivative has to be differentiated
   * @throws InvalidDifferentiationException if the expression is not a single
   *         well-formed postfix expression
   */
  Expression differentiate(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException;

  /**
   * Replaces every {@code \deriv(...)} in a postfix expression by the
   * derivative of its argument.
   */
  Expression expandDerivatives(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException;

  /**
   * Returns the index of the first token of the smallest complete
   * subexpression that ends right before {@code end}.
   *
   * @throws InvalidDifferentiationException if no complete subexpression ends
   *         at {@code end}
   */
  int locateStart(Expression postfix, int end) throws InvalidDifferentiationException;

  /**
   * Returns the bracketed, space separated display form of an expression.
   */
  String render(Expression expression);

  Locale getLocale();

  /**
   * Selects the language of exception messages.
   */
  void setLocale(Locale locale);
}
