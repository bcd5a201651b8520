package org.complexcalc.parser;

/**
 * Thrown when a symbol or function name has no entry in the operation table.
 */
public class OperationNotFoundException extends ParserException {
  private static final long serialVersionUID = -6414390475190352706L;

  OperationNotFoundException(String msg, String errPart, String expression) {
    super(msg, errPart, expression);
  }
}
