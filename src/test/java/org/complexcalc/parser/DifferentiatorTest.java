package org.complexcalc.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.complexcalc.math.ComplexAssertions.assertClose;
import static org.complexcalc.parser.Expressions.ENGLISH;
import static org.complexcalc.parser.Expressions.at;
import static org.complexcalc.parser.Expressions.c;
import static org.complexcalc.parser.Expressions.infix;
import static org.complexcalc.parser.Expressions.op;
import static org.complexcalc.parser.Expressions.postfix;
import static org.complexcalc.parser.Expressions.z;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.complexcalc.math.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DifferentiatorTest {

  private static final double STEP = 1e-6;

  private final Differentiator differentiator = new Differentiator(ENGLISH);

  private Expression derivative(String text) throws ParserException {
    return differentiator.differentiate(postfix(text));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
    "z              | [1]",
    "5              | [0]",
    "[1,2]          | [0]",
    "z+z            | [1 1 +]",
    "z-z            | [1 1 -]",
    "2+z            | [1]",
    "2-z            | [-1]",
    "z+2            | [1]",
    "z-2            | [1]",
    "2-z*z          | [z z + ~]",
    "z*z            | [z z +]",
    "3*z            | [3]",
    "z*3            | [3]",
    "z/2            | [1 0.5 *]",
    "1/z            | [1 ~ z z * /]",
    "z/(z+1)        | [z 1 + 1 z * - z 1 + z 1 + * /]",
    "z^3            | [3 z 2 ^ *]",
    "2^z            | [2 log 2 z ^ *]",
    "0^z            | [0]",
    "2^3            | [0]",
    "z^z            | [z z z 1 - ^ * z log z z ^ * +]",
    "\\sin(z)^2     | [z cos 2 z sin 1 ^ * *]",
    "\\sin(z)       | [z cos]",
    "\\cos(z)       | [z sin ~]",
    "\\sin(5)       | [0]",
    "\\re(5)        | [0]",
    "\\sin(2*z)     | [2 2 z * cos *]",
    "-z             | [-1]",
    "-(z*z)         | [z z + -1 *]",
    "0^\\re(z)      | [0]",
  })
  void shortcutsKeepTheResultSmall(String text, String expected) throws ParserException {
    Expression d = derivative(text);
    assertThat(d.isPostfix()).isTrue();
    assertThat(d.isWellFormedPostfix()).isTrue();
    assertThat(d).hasToString(expected);
  }

  @Test
  void productRuleAtPoints() throws ParserException {
    Expression d = derivative("z*z");
    assertClose(at(d, 3, 0), 6, 0);
    assertClose(at(d, 1, 1), 2, 2);
  }

  @Test
  void powerRuleAtPoint() throws ParserException {
    assertClose(at(derivative("z^3"), 2, 0), 12, 0);
  }

  @Test
  void cosineAtPoints() throws ParserException {
    Expression d = derivative("\\cos(z)");
    assertClose(at(d, 0, 0), 0, 0);
    assertClose(at(d, Math.PI / 2, 0), -1, 0);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "z*z", "z^3", "\\cos(z)", "\\sin(z)*\\exp(z)", "z/(z+1)", "(z+1)^z", "\\log(z)*z", "2^z",
    "\\tan(z^2)", "\\sec(z)", "\\csc(z)", "\\cot(z)", "\\asin(z/2)", "\\acos(z/2)", "\\atan(z)",
    "\\sinh(z)", "\\cosh(z)", "\\tanh(z)", "\\asinh(z)", "\\acosh(z+2)", "\\atanh(z/2)", "-z^2",
    "-\\sin(z)*z", "[1,2]*z^2 - 3i*z", "1/(z*z+1)", "\\exp(\\sin(z))", "z^z", "e^(2*z)",
    "(z-1)/(z+1)^2", "pi*z", "\\sin(z)^2", "\\log(z^2+1)/z", "2-\\cos(z)", "(z^2)^(1/2)",
  })
  void agreesWithCentralDifferences(String text) throws ParserException {
    Expression f = postfix(text);
    Expression d = differentiator.differentiate(f);
    for (Complex z : new Complex[] {new Complex(0.7, 0.3), new Complex(1.3, -0.4)}) {
      Complex numeric = centralDifference(f, z);
      double tolerance = 1e-6 * Math.max(1.0, numeric.abs());
      assertClose(Evaluator.evaluate(d, z), numeric, tolerance);
    }
  }

  private static Complex centralDifference(Expression f, Complex z) {
    Complex h = Complex.valueOf(STEP);
    Complex forward = Evaluator.evaluate(f, z.add(h));
    Complex backward = Evaluator.evaluate(f, z.subtract(h));
    return forward.subtract(backward).scale(1.0 / (2.0 * STEP));
  }

  @Test
  void functionWithoutDerivative() {
    assertThatThrownBy(() -> derivative("\\abs(z)"))
        .isInstanceOfSatisfying(UnknownDerivativeException.class,
            ex -> assertThat(ex.getInvalidPortionOfExpression()).isEqualTo("abs"));
    assertThatThrownBy(() -> derivative("z*\\re(z+1)")).isInstanceOf(UnknownDerivativeException.class);
    assertThatThrownBy(() -> derivative("\\deriv(z)")).isInstanceOf(UnknownDerivativeException.class);
  }

  @Test
  void incompletePostfix() {
    assertThatThrownBy(() -> differentiator.differentiate(Expression.postfix(z(), z())))
        .isInstanceOf(InvalidDifferentiationException.class);
    assertThatThrownBy(() -> differentiator.differentiate(Expression.postfix(z(), op(Operation.ADD))))
        .isInstanceOf(InvalidDifferentiationException.class);
    assertThatThrownBy(() -> differentiator.differentiate(Expression.postfix()))
        .isInstanceOf(InvalidDifferentiationException.class);
  }

  @Test
  void bracketInPostfix() {
    Expression e = Expression.postfix(c(1), op(Operation.R_BRACKET));
    assertThatThrownBy(() -> differentiator.differentiate(e))
        .isInstanceOf(InvalidDifferentiationException.class);
  }

  @Test
  void infixIsRejected() throws ParserException {
    Expression e = infix("z*z");
    assertThatThrownBy(() -> differentiator.differentiate(e)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void inputIsNotModified() throws ParserException {
    Expression f = postfix("\\sin(z)*z^2");
    String before = f.toString();
    differentiator.differentiate(f);
    assertThat(f).hasToString(before);
  }

  @Test
  void expandsDerivOperators() throws ParserException {
    Expression e = differentiator.expandDerivatives(postfix("\\deriv(z^2)+z"));
    assertThat(e).hasToString("[2 z 1 ^ * z +]");
    assertClose(at(e, 3, 0), 9, 0);
  }

  @Test
  void expandsNestedDerivOperatorsInnermostFirst() throws ParserException {
    Expression e = differentiator.expandDerivatives(postfix("\\deriv(\\deriv(z^3))"));
    assertThat(e).hasToString("[2 z 1 ^ * 3 *]");
    assertClose(at(e, 2, 0), 12, 0);
  }

  @Test
  void expandingWithoutDerivOperatorsChangesNothing() throws ParserException {
    Expression f = postfix("\\sin(z)+1");
    assertThat(differentiator.expandDerivatives(f)).isEqualTo(f);
  }

  @Test
  void expandedExpressionCanBeDifferentiated() throws ParserException {
    Expression e = differentiator.expandDerivatives(postfix("\\deriv(z^3)"));
    assertClose(at(differentiator.differentiate(e), 2, 0), 12, 0);
  }

  @Test
  void derivOfFunctionWithoutDerivative() {
    assertThatThrownBy(() -> differentiator.expandDerivatives(postfix("\\deriv(\\im(z))")))
        .isInstanceOf(UnknownDerivativeException.class);
  }

  @Test
  void longSum() throws ParserException {
    int terms = 10000;
    Expression f = postfix(String.join("+", Collections.nCopies(terms, "z")));
    Expression d = differentiator.differentiate(f);
    assertThat(d.size()).isEqualTo(2 * terms - 1);
    assertThat(d.isWellFormedPostfix()).isTrue();
    assertClose(at(d, 0.5, 0.5), terms, 0);
  }

  @Test
  void deeplyNestedFunctions() throws InvalidDifferentiationException, UnknownDerivativeException {
    int depth = 10000;
    List<Token> tokens = new ArrayList<Token>();
    tokens.add(z());
    for (int i = 0; i < depth; i++) {
      tokens.add(op(Operation.NEG));
    }
    Expression d = differentiator.differentiate(Expression.postfix(tokens));
    assertThat(d.isWellFormedPostfix()).isTrue();
    assertClose(at(d, 1, 0), 1, 0);
  }

  @Test
  void structuralZero() {
    assertThat(Differentiator.isStructuralZero(List.of(c(0)))).isTrue();
    assertThat(Differentiator.isStructuralZero(List.of(c(1)))).isFalse();
    assertThat(Differentiator.isStructuralZero(List.of(c(0), c(0), op(Operation.ADD)))).isFalse();
  }
}
