package org.complexcalc.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.complexcalc.parser.Expressions.c;
import static org.complexcalc.parser.Expressions.op;
import static org.complexcalc.parser.Expressions.postfix;
import static org.complexcalc.parser.Expressions.z;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class ExpressionTest {

  @Test
  void wellFormedPostfix() {
    assertThat(Expression.postfix(z()).isWellFormedPostfix()).isTrue();
    assertThat(Expression.postfix(z(), c(2), op(Operation.POW), op(Operation.NEG)).isWellFormedPostfix()).isTrue();
    assertThat(Expression.postfix().isWellFormedPostfix()).isFalse();
    assertThat(Expression.postfix(z(), z()).isWellFormedPostfix()).isFalse();
    assertThat(Expression.postfix(z(), op(Operation.MUL)).isWellFormedPostfix()).isFalse();
    assertThat(Expression.postfix(op(Operation.SIN)).isWellFormedPostfix()).isFalse();
    assertThat(Expression.postfix(op(Operation.L_BRACKET), z()).isWellFormedPostfix()).isFalse();
  }

  @Test
  void subExpressionIsPostfixSlice() throws ParserException {
    Expression e = postfix("5-3*4");
    Expression product = e.subExpression(1, 4);
    assertThat(product.isPostfix()).isTrue();
    assertThat(product).hasToString("[3 4 *]");
    assertThat(product.isWellFormedPostfix()).isTrue();
    assertThat(e.last()).isEqualTo(op(Operation.SUB));
  }

  @Test
  void copiesAndProtectsItsTokens() {
    List<Token> tokens = new ArrayList<Token>(List.of(z(), c(1), op(Operation.ADD)));
    Expression e = Expression.postfix(tokens);
    tokens.clear();
    assertThat(e.size()).isEqualTo(3);
    assertThat(e.isEmpty()).isFalse();
    assertThatThrownBy(() -> e.tokens().add(z())).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void notationTakesPartInEquality() {
    List<Token> tokens = List.of(z());
    assertThat(Expression.postfix(tokens)).isEqualTo(Expression.postfix(z()))
        .hasSameHashCodeAs(Expression.postfix(z()))
        .isNotEqualTo(Expression.infix(tokens));
  }

  @Test
  void tokenEquality() {
    assertThat(c(2)).isEqualTo(Token.constant(2.0)).isNotEqualTo(c(3));
    assertThat(Token.variable()).isSameAs(z());
    assertThat(op(Operation.SIN)).isEqualTo(op(Operation.SIN)).isNotEqualTo(op(Operation.COS));
    assertThat(op(Operation.NEG).getType()).isEqualTo(TokenType.FUNCTION);
    assertThat(op(Operation.SIN).is(Operation.SIN)).isTrue();
    assertThat(z().getOperation()).isNull();
  }

  @Test
  void nullArguments() {
    assertThatThrownBy(() -> Token.constant(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Token.operator(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
