package org.complexcalc.parser;

import java.util.List;

import org.complexcalc.util.StrUtil;

/**
 * Recovers the implicit tree of a postfix sequence. Given an end boundary it
 * finds where the smallest complete subexpression ending right before that
 * boundary starts. For {@code [5 3 4 * -]} and the boundary before {@code -}
 * that is the {@code 3}, since {@code [3 4 *]} is complete and {@code [4 *]}
 * is not.
 */
final class SubexpressionLocator {

  private SubexpressionLocator() {
  }

  /**
   * Walks backwards from {@code end} counting the operands still needed: one
   * for the subexpression itself, one more per function and two more per
   * binary operator, minus one for every token consumed.
   *
   * @param tokens postfix tokens
   * @param begin lowest index the subexpression may start at
   * @param end index one past the last token of the subexpression
   * @return index of the first token of the subexpression
   * @throws InvalidDifferentiationException if the walk reaches {@code begin}
   *         without completing, or meets a bracket
   */
  static int locateStart(List<Token> tokens, int begin, int end, StrUtil translate)
      throws InvalidDifferentiationException {
    int start = end;
    int k = 1;
    while (k > 0) {
      --start;
      if (start < begin || tokens.get(start).getType() == TokenType.BRACKET) {
        String slice = ExpressionPrinter.render(tokens.subList(begin, end));
        throw new InvalidDifferentiationException(translate.getMessage("SubExpInv", slice), slice,
            ExpressionPrinter.render(tokens));
      }
      k += tokens.get(start).getType().getArity();
      --k;
    }
    return start;
  }
}
