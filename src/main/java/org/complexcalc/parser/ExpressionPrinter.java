package org.complexcalc.parser;

import java.util.List;

/**
 * Renders tokens for display: operators by their symbol, constants in the
 * short form of {@link org.complexcalc.math.Complex#toString()}, the variable
 * as {@code z}, and whole sequences as {@code [z 2 ^ ~]}.
 */
public final class ExpressionPrinter {

  private ExpressionPrinter() {
  }

  public static String render(Token t) {
    switch (t.getType()) {
      case VARIABLE:
        return "z";
      case CONSTANT:
        return t.getValue().toString();
      default:
        return t.getOperation().getSymbol();
    }
  }

  public static String render(Expression expression) {
    return render(expression.tokens());
  }

  public static String render(List<Token> tokens) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < tokens.size(); i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(render(tokens.get(i)));
    }
    return sb.append(']').toString();
  }
}
