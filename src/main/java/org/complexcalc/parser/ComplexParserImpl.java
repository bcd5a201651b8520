package org.complexcalc.parser;

import java.util.Locale;
import java.util.logging.Logger;

import org.complexcalc.math.Complex;
import org.complexcalc.util.StrUtil;

class ComplexParserImpl implements IComplexParser {

  private static final Logger logger = Logger.getLogger(ComplexParserImpl.class.getName());

  private Locale m_Locale;
  private StrUtil m_Translate;
  private Tokenizer m_Tokenizer;
  private ShuntingYard m_ShuntingYard;
  private Differentiator m_Differentiator;

  ComplexParserImpl() {
    setLocale(Locale.getDefault());
  }

  public Locale getLocale() {
    return m_Locale;
  }

  public void setLocale(Locale l) {
    if (l == null) {
      throw new IllegalArgumentException("Locale==null");
    }
    m_Locale = l;
    //the stages only hold the translator, rebuilding them is cheap:
    m_Translate = Messages.forLocale(l);
    m_Tokenizer = new Tokenizer(m_Translate);
    m_ShuntingYard = new ShuntingYard(m_Translate);
    m_Differentiator = new Differentiator(m_Translate);
  }

  public Expression parse(String text) throws LexException, OperationNotFoundException {
    return m_Tokenizer.tokenize(text);
  }

  public Expression toPostfix(Expression expression)
      throws MismatchedBracketsException, MalformedExpressionException {
    return m_ShuntingYard.toPostfix(expression);
  }

  public Expression compile(String text) throws ParserException {
    Expression postfix = toPostfix(parse(text));
    logger.fine("Compiled \"" + text + "\" to " + postfix);
    return postfix;
  }

  public Complex evaluate(Expression postfix, Complex z) {
    return Evaluator.evaluate(postfix, z);
  }

  public Expression differentiate(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    return m_Differentiator.differentiate(postfix);
  }

  public Expression expandDerivatives(Expression postfix)
      throws UnknownDerivativeException, InvalidDifferentiationException {
    return m_Differentiator.expandDerivatives(postfix);
  }

  public int locateStart(Expression postfix, int end) throws InvalidDifferentiationException {
    if (postfix == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    if (end < 0 || end > postfix.size()) {
      throw new IllegalArgumentException("End " + end + " is outside of " + postfix);
    }
    return SubexpressionLocator.locateStart(postfix.tokens(), 0, end, m_Translate);
  }

  public String render(Expression expression) {
    if (expression == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    return ExpressionPrinter.render(expression);
  }
}
