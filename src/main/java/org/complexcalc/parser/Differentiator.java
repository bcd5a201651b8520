package org.complexcalc.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import org.complexcalc.math.Complex;
import org.complexcalc.util.StrUtil;

/**
 * Symbolic differentiation of postfix expressions with respect to z.
 * <p>
 * Postfix order lists every operand before the operator applied to it, so
 * one left to right pass with an operand stack sees each subexpression after
 * its operands. Every stack entry remembers where its subexpression lies and
 * carries its derivative, spliced together from copies of the operands, their
 * derivatives and new operator tokens. The stack takes the place of
 * recursion, so the nesting depth of an expression is only limited by memory.
 * Operands that are a single constant or the bare variable take shortcuts
 * that avoid multiplying by 0 or 1. A term is recognised as zero only when it
 * is a single constant token equal to 0; no other simplification is done.
 */
class Differentiator {

  private static final Logger logger = Logger.getLogger(Differentiator.class.getName());

  private final StrUtil m_Translate;

  Differentiator(StrUtil translate) {
    m_Translate = translate;
  }

  Expression differentiate(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    List<Token> tokens = checkComplete(postfix);
    List<Token> derivative = derivative(tokens);
    logger.fine("Differentiated " + tokens.size() + " tokens into " + derivative.size() + " tokens");
    return Expression.postfix(derivative);
  }

  /**
   * Replaces every {@code [g] deriv} by the derivative of {@code g}. Tokens are
   * copied left to right, so a nested deriv has already been expanded when
   * the enclosing one is reached.
   */
  Expression expandDerivatives(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    List<Token> tokens = checkComplete(postfix);
    List<Token> out = new ArrayList<Token>(tokens.size());
    int expanded = 0;
    for (Token t : tokens) {
      if (!t.is(Operation.DERIV)) {
        out.add(t);
        continue;
      }
      int start = SubexpressionLocator.locateStart(out, 0, out.size(), m_Translate);
      List<Token> derivative = derivative(new ArrayList<Token>(out.subList(start, out.size())));
      out.subList(start, out.size()).clear();
      out.addAll(derivative);
      ++expanded;
    }
    logger.fine("Expanded " + expanded + " derivative operators");
    return Expression.postfix(out);
  }

  private List<Token> checkComplete(Expression postfix) throws InvalidDifferentiationException {
    if (postfix == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    if (!postfix.isPostfix()) {
      throw new IllegalArgumentException("Only postfix expressions can be differentiated: " + postfix);
    }
    List<Token> tokens = postfix.tokens();
    // the whole sequence has to be exactly one subexpression
    if (SubexpressionLocator.locateStart(tokens, 0, tokens.size(), m_Translate) != 0) {
      String expression = postfix.toString();
      throw new InvalidDifferentiationException(m_Translate.getMessage("SubExpInv", expression),
          expression, expression);
    }
    return tokens;
  }

  /**
   * Differentiates the complete postfix sequence {@code tokens}. The returned
   * list is a fresh copy owned by the caller.
   */
  private List<Token> derivative(List<Token> tokens)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    Deque<Operand> stack = new ArrayDeque<Operand>();
    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      switch (t.getType()) {
        case VARIABLE:
          stack.push(new Operand(tokens, i, i + 1, constant(Complex.ONE)));
          break;
        case CONSTANT:
          stack.push(new Operand(tokens, i, i + 1, constant(Complex.ZERO)));
          break;
        case FUNCTION: {
          Operand g = pop(stack, tokens, i);
          Operand node = new Operand(tokens, g.begin, i + 1);
          try {
            node.derivative = function(t.getOperation(), g);
          } catch (UnknownDerivativeException ex) {
            // raised once an enclosing rule asks for this derivative
            node.failure = ex;
          }
          stack.push(node);
          break;
        }
        case BINARY_OP: {
          Operand g = pop(stack, tokens, i);
          Operand f = pop(stack, tokens, i);
          Operand node = new Operand(tokens, f.begin, i + 1);
          try {
            node.derivative = binaryOperator(t.getOperation(), f, g);
          } catch (UnknownDerivativeException ex) {
            node.failure = ex;
          }
          stack.push(node);
          break;
        }
        default:
          String slice = ExpressionPrinter.render(tokens);
          throw new InvalidDifferentiationException(m_Translate.getMessage("DiffTkn", t, slice),
              t.toString(), slice);
      }
    }
    if (stack.size() != 1) {
      String slice = ExpressionPrinter.render(tokens);
      throw new InvalidDifferentiationException(m_Translate.getMessage("SubExpInv", slice), slice, slice);
    }
    return stack.pop().derivative();
  }

  private Operand pop(Deque<Operand> stack, List<Token> tokens, int index)
      throws InvalidDifferentiationException {
    if (stack.isEmpty()) {
      String slice = ExpressionPrinter.render(tokens.subList(0, index + 1));
      throw new InvalidDifferentiationException(m_Translate.getMessage("SubExpInv", slice), slice,
          ExpressionPrinter.render(tokens));
    }
    return stack.pop();
  }

  /**
   * Chain rule for {@code [g] f}: {@code [g'] [f'(g)] *}, where f'(g) is the
   * table fragment of f with its placeholder replaced by g.
   */
  private List<Token> function(Operation f, Operand g) throws UnknownDerivativeException {
    if (g.isBareConstant()) {
      return constant(Complex.ZERO);
    }
    Expression fragment = OperationTable.getDerivative(f, m_Translate);
    if (g.isBareVariable()) {
      return new ArrayList<Token>(fragment.tokens());
    }

    List<Token> result = g.derivative();
    for (Token t : fragment.tokens()) {
      if (t.isVariable()) {
        g.appendTo(result);
      }
      else {
        result.add(t);
      }
    }
    result.add(Token.operator(Operation.MUL));
    return result;
  }

  private List<Token> binaryOperator(Operation op, Operand f, Operand g)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    switch (op) {
      case ADD:
      case SUB:
        return addOrSubtract(op, f, g);
      case MUL:
        return multiply(f, g);
      case DIV:
        return divide(f, g);
      case POW:
        return power(f, g);
      default:
        String slice = ExpressionPrinter.render(f.tokens.subList(f.begin, g.end + 1));
        throw new InvalidDifferentiationException(m_Translate.getMessage("DiffOp", op.getSymbol(), slice),
            op.getSymbol(), slice);
    }
  }

  // (f +- g)' = f' +- g'
  private List<Token> addOrSubtract(Operation op, Operand f, Operand g)
      throws UnknownDerivativeException {
    if (f.isBareConstant()) {
      List<Token> gd = g.derivative();
      if (op == Operation.ADD) {
        return gd;
      }
      if (gd.size() == 1 && gd.get(0).isConstant()) {
        return constant(negate(gd.get(0).getValue()));
      }
      gd.add(Token.operator(Operation.NEG));
      return gd;
    }
    if (g.isBareConstant()) {
      return f.derivative();
    }
    List<Token> result = f.derivative();
    result.addAll(g.derivative());
    result.add(Token.operator(op));
    return result;
  }

  // (f g)' = f' g + g' f
  private List<Token> multiply(Operand f, Operand g) throws UnknownDerivativeException {
    List<Token> p1;
    if (f.isBareConstant()) {
      p1 = constant(Complex.ZERO);
    }
    else if (f.isBareVariable()) {
      p1 = g.copy();
    }
    else {
      p1 = f.derivative();
      g.appendTo(p1);
      p1.add(Token.operator(Operation.MUL));
    }

    List<Token> p2;
    if (g.isBareConstant()) {
      p2 = constant(Complex.ZERO);
    }
    else if (g.isBareVariable()) {
      p2 = f.copy();
    }
    else {
      p2 = g.derivative();
      f.appendTo(p2);
      p2.add(Token.operator(Operation.MUL));
    }
    return sum(p1, p2);
  }

  // (f / g)' = (f' g - g' f) / (g g)
  private List<Token> divide(Operand f, Operand g) throws UnknownDerivativeException {
    if (g.isBareConstant()) {
      List<Token> result = f.derivative();
      result.add(Token.constant(g.value().reciprocal()));
      result.add(Token.operator(Operation.MUL));
      return result;
    }

    List<Token> p1;
    if (f.isBareConstant()) {
      p1 = constant(Complex.ZERO);
    }
    else if (f.isBareVariable()) {
      p1 = g.copy();
    }
    else {
      p1 = f.derivative();
      g.appendTo(p1);
      p1.add(Token.operator(Operation.MUL));
    }

    List<Token> p2;
    if (g.isBareVariable()) {
      p2 = f.copy();
    }
    else {
      p2 = g.derivative();
      f.appendTo(p2);
      p2.add(Token.operator(Operation.MUL));
    }

    List<Token> result;
    if (isStructuralZero(p1)) {
      result = p2;
      result.add(Token.operator(Operation.NEG));
    }
    else {
      result = p1;
      result.addAll(p2);
      result.add(Token.operator(Operation.SUB));
    }
    g.appendTo(result);
    g.appendTo(result);
    result.add(Token.operator(Operation.MUL));
    result.add(Token.operator(Operation.DIV));
    return result;
  }

  // (f^g)' = f' g f^(g-1) + g' ln(f) f^g
  private List<Token> power(Operand f, Operand g) throws UnknownDerivativeException {
    if (f.isBareConstant()) {
      if (f.value().isZero()) {
        return constant(Complex.ZERO);
      }
      return exponentTerm(f, g);
    }

    List<Token> p1;
    if (f.isBareVariable()) {
      p1 = g.copy();
    }
    else {
      p1 = f.derivative();
      g.appendTo(p1);
    }
    f.appendTo(p1);
    if (g.isBareConstant()) {
      p1.add(Token.constant(g.value().subtract(Complex.ONE)));
    }
    else {
      g.appendTo(p1);
      p1.add(Token.constant(Complex.ONE));
      p1.add(Token.operator(Operation.SUB));
    }
    p1.add(Token.operator(Operation.POW));
    p1.add(Token.operator(Operation.MUL));
    if (!f.isBareVariable()) {
      p1.add(Token.operator(Operation.MUL));
    }

    return sum(p1, exponentTerm(f, g));
  }

  /**
   * The {@code g' ln(f) f^g} term of the power rule.
   */
  private List<Token> exponentTerm(Operand f, Operand g) throws UnknownDerivativeException {
    if (g.isBareConstant()) {
      return constant(Complex.ZERO);
    }
    List<Token> p2 = g.isBareVariable() ? new ArrayList<Token>() : g.derivative();
    f.appendTo(p2);
    p2.add(Token.operator(Operation.LOG));
    f.appendTo(p2);
    g.appendTo(p2);
    p2.add(Token.operator(Operation.POW));
    p2.add(Token.operator(Operation.MUL));
    if (!g.isBareVariable()) {
      p2.add(Token.operator(Operation.MUL));
    }
    return p2;
  }

  /**
   * {@code p1 + p2}, or just one of them if the other is a structural zero.
   */
  private static List<Token> sum(List<Token> p1, List<Token> p2) {
    if (isStructuralZero(p1)) {
      return p2;
    }
    if (isStructuralZero(p2)) {
      return p1;
    }
    p1.addAll(p2);
    p1.add(Token.operator(Operation.ADD));
    return p1;
  }

  static boolean isStructuralZero(List<Token> tokens) {
    return tokens.size() == 1 && tokens.get(0).isConstant() && tokens.get(0).getValue().isZero();
  }

  // 0 - value keeps the zero components positive
  private static Complex negate(Complex value) {
    return Complex.ZERO.subtract(value);
  }

  private static List<Token> constant(Complex value) {
    List<Token> result = new ArrayList<Token>(1);
    result.add(Token.constant(value));
    return result;
  }
}

//a complete subexpression tokens[begin, end) and its derivative
class Operand {
  final List<Token> tokens;
  final int begin;
  final int end;
  List<Token> derivative;
  UnknownDerivativeException failure;

  Operand(List<Token> tokens, int begin, int end) {
    this.tokens = tokens;
    this.begin = begin;
    this.end = end;
  }

  Operand(List<Token> tokens, int begin, int end, List<Token> derivative) {
    this(tokens, begin, end);
    this.derivative = derivative;
  }

  /**
   * Hands the derivative over to the enclosing rule, which may append to it.
   * Each derivative is taken at most once.
   */
  List<Token> derivative() throws UnknownDerivativeException {
    if (failure != null) {
      throw failure;
    }
    return derivative;
  }

  boolean isBareConstant() {
    return end - begin == 1 && tokens.get(begin).isConstant();
  }

  boolean isBareVariable() {
    return end - begin == 1 && tokens.get(begin).isVariable();
  }

  Complex value() {
    return tokens.get(begin).getValue();
  }

  List<Token> copy() {
    return new ArrayList<Token>(tokens.subList(begin, end));
  }

  void appendTo(List<Token> target) {
    target.addAll(tokens.subList(begin, end));
  }
}
