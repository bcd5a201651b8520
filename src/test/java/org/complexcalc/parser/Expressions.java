package org.complexcalc.parser;

import java.util.Locale;

import org.complexcalc.math.Complex;
import org.complexcalc.util.StrUtil;

/**
 * Shortcuts for building expressions in tests.
 */
final class Expressions {

  static final StrUtil ENGLISH = Messages.forLocale(Locale.ENGLISH);

  private Expressions() {
  }

  static Expression infix(String text) throws ParserException {
    return new Tokenizer(ENGLISH).tokenize(text);
  }

  static Expression postfix(String text) throws ParserException {
    return new ShuntingYard(ENGLISH).toPostfix(infix(text));
  }

  static Complex at(Expression postfix, double re, double im) {
    return Evaluator.evaluate(postfix, new Complex(re, im));
  }

  static Token z() {
    return Token.variable();
  }

  static Token c(double value) {
    return Token.constant(value);
  }

  static Token op(Operation op) {
    return Token.operator(op);
  }
}
