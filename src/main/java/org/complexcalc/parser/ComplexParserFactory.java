package org.complexcalc.parser;

/**
 * Creates implementations of {@link IComplexParser}.
 */
public abstract class ComplexParserFactory {
  private ComplexParserFactory() {
  }

  /**
   * Creates a parser whose messages use the default locale.
   */
  public static IComplexParser create() {
    return new ComplexParserImpl();
  }
}
