package org.complexcalc.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.complexcalc.math.Complex;
import org.complexcalc.util.StrUtil;

/**
 * Splits an infix expression string into tokens.
 * <p>
 * Whitespace carries no meaning and is removed before scanning. Function names
 * are escaped with a backslash ({@code \sin(z)}) and run up to the next
 * operator, opening bracket or backslash. Numbers are digit runs with at most
 * one decimal point, optionally followed by {@code i} to make them imaginary;
 * {@code [re,im]} is a complex literal. {@code z}, {@code i}, {@code e} and
 * {@code pi} are predefined. A minus sign at the start or right after an
 * opening bracket is a negation, not a subtraction.
 */
class Tokenizer {

  private static final Logger logger = Logger.getLogger(Tokenizer.class.getName());

  static final char ESCAPE = '\\';

  private final StrUtil m_Translate;

  Tokenizer(StrUtil translate) {
    m_Translate = translate;
  }

  Expression tokenize(String text) throws LexException, OperationNotFoundException {
    if (text == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    String formula = removeWhitespace(text);
    if (formula.length() == 0) {
      throw new LexException(m_Translate.getMessage("ExpEmpty"), text, text, 0);
    }

    List<Token> tokens = new ArrayList<Token>();
    int len = formula.length();
    for (int i = 0; i < len; i++) {
      char ch = formula.charAt(i);
      if (ch == ESCAPE) {
        int end = findNameEnd(formula, i);
        String name = formula.substring(i + 1, end);
        tokens.add(Token.operator(OperationTable.forName(name, m_Translate)));
        i = end - 1;
      }
      else if (ch == '-' && (i == 0 || isOpeningBracket(formula.charAt(i - 1)))) {
        tokens.add(Token.operator(Operation.NEG));
      }
      else if (isDigit(ch) || ch == '.') {
        i = readNumber(formula, i, tokens) - 1;
      }
      else if (ch == '[') {
        i = readComplexLiteral(formula, i, tokens) - 1;
      }
      else if (ch == 'i') {
        tokens.add(Token.constant(Complex.I));
      }
      else if (ch == 'e') {
        tokens.add(Token.constant(Complex.E));
      }
      else if (formula.startsWith("pi", i)) {
        tokens.add(Token.constant(Complex.PI));
        ++i;
      }
      else if (ch == 'z') {
        tokens.add(Token.variable());
      }
      else if (OperationTable.isSymbol(ch)) {
        tokens.add(Token.operator(OperationTable.forSymbol(String.valueOf(ch), m_Translate)));
      }
      else {
        throw new LexException(m_Translate.getMessage("ChrNtRcg", ch, i, formula),
            String.valueOf(ch), formula, i);
      }
    }
    logger.fine("Tokenized \"" + formula + "\" into " + tokens.size() + " tokens");
    return Expression.infix(tokens);
  }

  private static String removeWhitespace(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (!Character.isWhitespace(ch)) {
        sb.append(ch);
      }
    }
    return sb.toString();
  }

  /**
   * Returns the index one past the escaped name that starts at {@code start}.
   * The name has to be followed by an operator, an opening bracket or
   * another escape.
   */
  private int findNameEnd(String formula, int start) throws LexException {
    for (int i = start + 1; i < formula.length(); i++) {
      if (isNameTerminator(formula.charAt(i))) {
        return i;
      }
    }
    throw new LexException(m_Translate.getMessage("EscNtTrm", start, formula),
        formula.substring(start), formula, start);
  }

  private static boolean isNameTerminator(char ch) {
    switch (ch) {
      case ESCAPE:
      case '-':
      case '+':
      case '*':
      case '/':
      case '^':
      case '{':
      case '(':
      case '[':
        return true;
      default:
        return false;
    }
  }

  /**
   * Reads a real or imaginary number starting at {@code start} and returns
   * the index after it.
   */
  private int readNumber(String formula, int start, List<Token> tokens) throws LexException {
    boolean periodFound = false;
    int j = start;
    while (j < formula.length() && (isDigit(formula.charAt(j)) || formula.charAt(j) == '.')) {
      if (formula.charAt(j) == '.') {
        if (periodFound) {
          String number = formula.substring(start, j + 1);
          throw new LexException(m_Translate.getMessage("NumFmt", number, formula), number, formula, start);
        }
        periodFound = true;
      }
      ++j;
    }

    String number = formula.substring(start, j);
    double value;
    try {
      value = Double.parseDouble(number);
    } catch (NumberFormatException ex) {
      throw new LexException(m_Translate.getMessage("NumFmt", number, formula), number, formula, start);
    }

    if (j < formula.length() && formula.charAt(j) == 'i') {
      tokens.add(Token.constant(Complex.valueOf(0.0, value)));
      ++j;
    }
    else {
      tokens.add(Token.constant(value));
    }
    return j;
  }

  /**
   * Reads a {@code [re,im]} literal starting at {@code start} and returns the
   * index after the closing bracket.
   */
  private int readComplexLiteral(String formula, int start, List<Token> tokens) throws LexException {
    int comma = formula.indexOf(',', start + 1);
    int close = comma < 0 ? -1 : formula.indexOf(']', comma + 1);
    if (close < 0) {
      String literal = formula.substring(start);
      throw new LexException(m_Translate.getMessage("CplxFmt", literal, formula), literal, formula, start);
    }
    String literal = formula.substring(start, close + 1);
    try {
      double re = parseLiteralPart(formula.substring(start + 1, comma));
      double im = parseLiteralPart(formula.substring(comma + 1, close));
      tokens.add(Token.constant(Complex.valueOf(re, im)));
    } catch (NumberFormatException ex) {
      throw new LexException(m_Translate.getMessage("CplxFmt", literal, formula), literal, formula, start);
    }
    return close + 1;
  }

  /**
   * Parses one part of a complex literal: an optional sign followed by digits
   * with at most one period.
   */
  private static double parseLiteralPart(String part) {
    String text = part.trim();
    int i = 0;
    if (text.startsWith("-") || text.startsWith("+")) {
      ++i;
    }
    boolean periodFound = false;
    boolean digitFound = false;
    for (; i < text.length(); ++i) {
      char ch = text.charAt(i);
      if (isDigit(ch)) {
        digitFound = true;
      }
      else if (ch == '.' && !periodFound) {
        periodFound = true;
      }
      else {
        throw new NumberFormatException(part);
      }
    }
    if (!digitFound) {
      throw new NumberFormatException(part);
    }
    return Double.parseDouble(text);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isOpeningBracket(char ch) {
    return ch == '(' || ch == '{';
  }
}
