package org.complexcalc.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.complexcalc.math.ComplexAssertions.assertClose;

import java.util.EnumSet;
import java.util.Set;

import org.complexcalc.math.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OperationTableTest {

  private static final double STEP = 1e-6;

  private static final Set<Operation> WITHOUT_DERIVATIVE = EnumSet.of(Operation.RE, Operation.IM,
      Operation.ABS, Operation.ARG, Operation.CONJ, Operation.DERIV);

  @Test
  void precedences() {
    assertThat(Operation.ADD.getPrecedence()).isEqualTo(Operation.SUB.getPrecedence()).isZero();
    assertThat(Operation.MUL.getPrecedence()).isEqualTo(Operation.DIV.getPrecedence()).isEqualTo(1);
    assertThat(Operation.NEG.getPrecedence()).isEqualTo(1);
    assertThat(Operation.POW.getPrecedence()).isEqualTo(2);
    assertThat(Operation.SIN.getPrecedence()).isEqualTo(3);
    assertThat(Operation.L_BRACKET.getPrecedence()).isEqualTo(Operation.R_BRACKET.getPrecedence())
        .isEqualTo(4);
  }

  @Test
  void arities() {
    assertThat(TokenType.VARIABLE.getArity()).isZero();
    assertThat(TokenType.CONSTANT.getArity()).isZero();
    assertThat(TokenType.BRACKET.getArity()).isZero();
    assertThat(TokenType.FUNCTION.getArity()).isEqualTo(1);
    assertThat(TokenType.BINARY_OP.getArity()).isEqualTo(2);
  }

  @Test
  void symbols() throws OperationNotFoundException {
    assertThat(OperationTable.forSymbol("(")).isEqualTo(Operation.L_BRACKET);
    assertThat(OperationTable.forSymbol("}")).isEqualTo(Operation.R_BRACKET);
    assertThat(OperationTable.forSymbol("^")).isEqualTo(Operation.POW);
    assertThat(OperationTable.isSymbol('*')).isTrue();
    assertThat(OperationTable.isSymbol('%')).isFalse();
    assertThatThrownBy(() -> OperationTable.forSymbol("%")).isInstanceOf(OperationNotFoundException.class);
  }

  @Test
  void functionNames() throws OperationNotFoundException {
    assertThat(OperationTable.getFunctionNames()).containsExactly("abs", "acos", "acosh", "arg", "asin",
        "asinh", "atan", "atanh", "conj", "cos", "cosh", "cot", "csc", "deriv", "exp", "im", "log", "re",
        "sec", "sin", "sinh", "tan", "tanh");
    assertThat(OperationTable.forName("Sinh")).isEqualTo(Operation.SINH);
    assertThatThrownBy(() -> OperationTable.forName("sine")).isInstanceOf(OperationNotFoundException.class);
  }

  @Test
  void negationHasNoName() {
    assertThatThrownBy(() -> OperationTable.forName("~")).isInstanceOf(OperationNotFoundException.class);
  }

  @Test
  void identifiers() throws OperationNotFoundException {
    assertThat(OperationTable.forId("ATANH")).isEqualTo(Operation.ATANH);
    assertThatThrownBy(() -> OperationTable.forId("atanh")).isInstanceOf(OperationNotFoundException.class);
    assertThatThrownBy(() -> OperationTable.forId(null)).isInstanceOf(OperationNotFoundException.class);
  }

  @ParameterizedTest
  @EnumSource(value = Operation.class, names = {"L_BRACKET", "R_BRACKET"}, mode = EnumSource.Mode.EXCLUDE)
  void everyOperationHasAnEvaluatorOfMatchingArity(Operation op) throws OperationNotFoundException {
    assertThat(OperationTable.getFunction(op).getNumberOfParams()).isEqualTo(op.getType().getArity());
  }

  @Test
  void bracketsHaveNoEvaluator() {
    assertThatThrownBy(() -> OperationTable.getFunction(Operation.L_BRACKET))
        .isInstanceOf(OperationNotFoundException.class);
  }

  @ParameterizedTest
  @EnumSource(value = Operation.class, names = {"NEG", "EXP", "LOG", "SIN", "COS", "TAN", "SEC", "CSC",
    "COT", "ASIN", "ACOS", "ATAN", "SINH", "COSH", "TANH", "ASINH", "ACOSH", "ATANH"})
  void derivativeFragmentsMatchCentralDifferences(Operation op) throws ParserException {
    assertThat(OperationTable.hasDerivative(op)).isTrue();
    Expression fragment = OperationTable.getDerivative(op);
    assertThat(fragment.isWellFormedPostfix()).isTrue();

    IFunction f = OperationTable.getFunction(op);
    for (Complex z : new Complex[] {new Complex(0.4, 0.3), new Complex(1.7, -0.2)}) {
      Complex h = Complex.valueOf(STEP);
      Complex numeric = f.run(new Complex[] {z.add(h)}).subtract(f.run(new Complex[] {z.subtract(h)}))
          .scale(1.0 / (2.0 * STEP));
      double tolerance = 1e-6 * Math.max(1.0, numeric.abs());
      assertClose(Evaluator.evaluate(fragment, z), numeric, tolerance);
    }
  }

  @Test
  void nonHolomorphicFunctionsHaveNoDerivative() {
    for (Operation op : WITHOUT_DERIVATIVE) {
      assertThat(OperationTable.hasDerivative(op)).as(op.name()).isFalse();
      assertThatThrownBy(() -> OperationTable.getDerivative(op)).isInstanceOf(UnknownDerivativeException.class);
    }
  }

  @Test
  void binaryOperatorsTakeTheLeftOperandFirst() throws OperationNotFoundException {
    Complex[] p = {Complex.valueOf(2), Complex.valueOf(8)};
    assertThat(OperationTable.getFunction(Operation.SUB).run(p)).isEqualTo(Complex.valueOf(-6));
    assertThat(OperationTable.getFunction(Operation.DIV).run(p)).isEqualTo(Complex.valueOf(0.25));
    assertThat(OperationTable.getFunction(Operation.POW).run(p)).isEqualTo(Complex.valueOf(256));
  }
}
