package org.complexcalc.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.complexcalc.math.Complex;
import org.complexcalc.util.StrUtil;

/**
 * Static lookup tables of the parser: operator symbols and function names,
 * numeric evaluators and derivative fragments. The tables are filled once by
 * the static initializer and are read-only afterwards, so they can be shared
 * by any number of threads.
 * <p>
 * A derivative fragment is the postfix derivative of a function applied to
 * the bare variable, e.g. {@code [z cos]} for sin. The variable in a fragment
 * is a placeholder: to differentiate {@code sin(g)} every variable token is
 * replaced with the tokens of {@code g}.
 */
public final class OperationTable {

  ////////////////////////////////////////////////////////////////////////////////
  //Evaluators do not keep state, one instance of each is shared by all parsers.
  static final __add      add_      = new __add();
  static final __subtract subtract_ = new __subtract();
  static final __multiply multiply_ = new __multiply();
  static final __divide   divide_   = new __divide();
  static final __power    power_    = new __power();
  static final __negate   negate_   = new __negate();
  static final __re       re_       = new __re();
  static final __im       im_       = new __im();
  static final __abs      abs_      = new __abs();
  static final __arg      arg_      = new __arg();
  static final __conj     conj_     = new __conj();
  static final __exp      exp_      = new __exp();
  static final __log      log_      = new __log();
  static final __cos      cos_      = new __cos();
  static final __sin      sin_      = new __sin();
  static final __tan      tan_      = new __tan();
  static final __sec      sec_      = new __sec();
  static final __csc      csc_      = new __csc();
  static final __cot      cot_      = new __cot();
  static final __acos     acos_     = new __acos();
  static final __asin     asin_     = new __asin();
  static final __atan     atan_     = new __atan();
  static final __cosh     cosh_     = new __cosh();
  static final __sinh     sinh_     = new __sinh();
  static final __tanh     tanh_     = new __tanh();
  static final __acosh    acosh_    = new __acosh();
  static final __asinh    asinh_    = new __asinh();
  static final __atanh    atanh_    = new __atanh();
  static final __deriv    deriv_    = new __deriv();

  private static final Map<String, Operation> NAMES;
  private static final Map<String, Operation> SYMBOLS;
  private static final Map<Operation, IFunction> FUNCTIONS;
  private static final Map<Operation, Expression> DERIVATIVES;

  static {
    Map<String, Operation> symbols = new HashMap<String, Operation>();
    symbols.put("{", Operation.L_BRACKET);
    symbols.put("}", Operation.R_BRACKET);
    symbols.put("(", Operation.L_BRACKET);
    symbols.put(")", Operation.R_BRACKET);
    symbols.put("+", Operation.ADD);
    symbols.put("-", Operation.SUB);
    symbols.put("*", Operation.MUL);
    symbols.put("/", Operation.DIV);
    symbols.put("^", Operation.POW);
    SYMBOLS = Collections.unmodifiableMap(symbols);

    //every function is reachable by its own name:
    Map<String, Operation> names = new HashMap<String, Operation>();
    for (Operation op : Operation.values()) {
      if (op.getType() == TokenType.FUNCTION && op != Operation.NEG) {
        names.put(op.getSymbol(), op);
      }
    }
    NAMES = Collections.unmodifiableMap(names);

    Map<Operation, IFunction> functions = new EnumMap<Operation, IFunction>(Operation.class);
    functions.put(Operation.ADD, add_);
    functions.put(Operation.SUB, subtract_);
    functions.put(Operation.MUL, multiply_);
    functions.put(Operation.DIV, divide_);
    functions.put(Operation.POW, power_);
    functions.put(Operation.NEG, negate_);
    functions.put(Operation.RE, re_);
    functions.put(Operation.IM, im_);
    functions.put(Operation.ABS, abs_);
    functions.put(Operation.ARG, arg_);
    functions.put(Operation.CONJ, conj_);
    functions.put(Operation.EXP, exp_);
    functions.put(Operation.LOG, log_);
    functions.put(Operation.COS, cos_);
    functions.put(Operation.SIN, sin_);
    functions.put(Operation.TAN, tan_);
    functions.put(Operation.SEC, sec_);
    functions.put(Operation.CSC, csc_);
    functions.put(Operation.COT, cot_);
    functions.put(Operation.ACOS, acos_);
    functions.put(Operation.ASIN, asin_);
    functions.put(Operation.ATAN, atan_);
    functions.put(Operation.COSH, cosh_);
    functions.put(Operation.SINH, sinh_);
    functions.put(Operation.TANH, tanh_);
    functions.put(Operation.ACOSH, acosh_);
    functions.put(Operation.ASINH, asinh_);
    functions.put(Operation.ATANH, atanh_);
    functions.put(Operation.DERIV, deriv_);
    FUNCTIONS = Collections.unmodifiableMap(functions);

    Map<Operation, Expression> derivatives = new EnumMap<Operation, Expression>(Operation.class);
    derivatives.put(Operation.NEG,   fragment(c(-1)));
    derivatives.put(Operation.EXP,   fragment(z(), op(Operation.EXP)));
    derivatives.put(Operation.LOG,   fragment(c(1), z(), op(Operation.DIV)));
    derivatives.put(Operation.SIN,   fragment(z(), op(Operation.COS)));
    derivatives.put(Operation.COS,   fragment(z(), op(Operation.SIN), op(Operation.NEG)));
    // 1 / cos(z)^2
    derivatives.put(Operation.TAN,   fragment(c(1), z(), op(Operation.COS), c(2), op(Operation.POW),
        op(Operation.DIV)));
    derivatives.put(Operation.SEC,   fragment(z(), op(Operation.SEC), z(), op(Operation.TAN),
        op(Operation.MUL)));
    derivatives.put(Operation.CSC,   fragment(z(), op(Operation.CSC), z(), op(Operation.COT),
        op(Operation.MUL), op(Operation.NEG)));
    derivatives.put(Operation.COT,   fragment(c(1), z(), op(Operation.SIN), c(2), op(Operation.POW),
        op(Operation.DIV), op(Operation.NEG)));
    // 1 / (1 - z^2)^0.5
    derivatives.put(Operation.ASIN,  fragment(c(1), c(1), z(), c(2), op(Operation.POW),
        op(Operation.SUB), c(0.5), op(Operation.POW), op(Operation.DIV)));
    derivatives.put(Operation.ACOS,  fragment(c(1), c(1), z(), c(2), op(Operation.POW),
        op(Operation.SUB), c(0.5), op(Operation.POW), op(Operation.DIV), op(Operation.NEG)));
    derivatives.put(Operation.ATAN,  fragment(c(1), c(1), z(), c(2), op(Operation.POW),
        op(Operation.ADD), op(Operation.DIV)));
    derivatives.put(Operation.SINH,  fragment(z(), op(Operation.COSH)));
    derivatives.put(Operation.COSH,  fragment(z(), op(Operation.SINH)));
    derivatives.put(Operation.TANH,  fragment(c(1), z(), op(Operation.COSH), c(2), op(Operation.POW),
        op(Operation.DIV)));
    derivatives.put(Operation.ASINH, fragment(c(1), z(), c(2), op(Operation.POW), c(1),
        op(Operation.ADD), c(0.5), op(Operation.POW), op(Operation.DIV)));
    // 1 / ((z - 1)^0.5 * (z + 1)^0.5)
    derivatives.put(Operation.ACOSH, fragment(c(1), z(), c(1), op(Operation.SUB), c(0.5),
        op(Operation.POW), z(), c(1), op(Operation.ADD), c(0.5), op(Operation.POW),
        op(Operation.MUL), op(Operation.DIV)));
    derivatives.put(Operation.ATANH, fragment(c(1), c(1), z(), c(2), op(Operation.POW),
        op(Operation.SUB), op(Operation.DIV)));
    DERIVATIVES = Collections.unmodifiableMap(derivatives);
  }

  private OperationTable() {
  }

  private static Expression fragment(Token... tokens) {
    return Expression.postfix(tokens);
  }

  private static Token z() {
    return Token.variable();
  }

  private static Token c(double value) {
    return Token.constant(value);
  }

  private static Token op(Operation op) {
    return Token.operator(op);
  }

  /**
   * Looks up an escaped function name such as {@code sin}. Names are
   * matched case-insensitively.
   */
  public static Operation forName(String name) throws OperationNotFoundException {
    return forName(name, Messages.forDefaultLocale());
  }

  static Operation forName(String name, StrUtil translate) throws OperationNotFoundException {
    if (name == null) {
      throw new IllegalArgumentException("Function name cannot be null.");
    }
    Operation op = NAMES.get(name.toLowerCase(Locale.US));
    if (op == null) {
      throw new OperationNotFoundException(translate.getMessage("OpNtFnd", name), name, name);
    }
    return op;
  }

  /**
   * Looks up a one character operator or bracket symbol such as {@code +}.
   */
  public static Operation forSymbol(String symbol) throws OperationNotFoundException {
    return forSymbol(symbol, Messages.forDefaultLocale());
  }

  static Operation forSymbol(String symbol, StrUtil translate) throws OperationNotFoundException {
    if (symbol == null) {
      throw new IllegalArgumentException("Symbol cannot be null.");
    }
    Operation op = SYMBOLS.get(symbol);
    if (op == null) {
      throw new OperationNotFoundException(translate.getMessage("OpNtFnd", symbol), symbol, symbol);
    }
    return op;
  }

  /**
   * Looks up an operation by its constant name, e.g. {@code "L_BRACKET"}, as
   * written by the JSON interchange format.
   */
  public static Operation forId(String id) throws OperationNotFoundException {
    StrUtil translate = Messages.forDefaultLocale();
    if (id != null) {
      for (Operation op : Operation.values()) {
        if (op.name().equals(id)) {
          return op;
        }
      }
    }
    throw new OperationNotFoundException(translate.getMessage("OpNtFnd", id), id, id);
  }

  public static boolean isSymbol(char ch) {
    return SYMBOLS.containsKey(String.valueOf(ch));
  }

  public static IFunction getFunction(Operation op) throws OperationNotFoundException {
    return getFunction(op, Messages.forDefaultLocale());
  }

  static IFunction getFunction(Operation op, StrUtil translate) throws OperationNotFoundException {
    IFunction f = FUNCTIONS.get(op);
    if (f == null) {
      String name = String.valueOf(op);
      throw new OperationNotFoundException(translate.getMessage("OpNtFnd", name), name, name);
    }
    return f;
  }

  public static boolean hasDerivative(Operation op) {
    return DERIVATIVES.containsKey(op);
  }

  /**
   * Returns the derivative fragment of a function over the placeholder
   * variable.
   */
  public static Expression getDerivative(Operation op) throws UnknownDerivativeException {
    return getDerivative(op, Messages.forDefaultLocale());
  }

  static Expression getDerivative(Operation op, StrUtil translate) throws UnknownDerivativeException {
    Expression fragment = DERIVATIVES.get(op);
    if (fragment == null) {
      String name = op == null ? "null" : op.getSymbol();
      throw new UnknownDerivativeException(translate.getMessage("DrvNtFnd", name), name, name);
    }
    return fragment;
  }

  /**
   * Returns the names accepted after the escape character, sorted.
   */
  public static Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(new TreeSet<String>(NAMES.keySet()));
  }
}

////////////////////////////////////////////////////////////////////////////////
//Evaluators of the binary operators. p[0] is the left operand.
class __add extends TwoParamFunc {
  public Complex run(Complex[] p) {
    return p[0].add(p[1]);
  }
}

class __subtract extends TwoParamFunc {
  public Complex run(Complex[] p) {
    return p[0].subtract(p[1]);
  }
}

class __multiply extends TwoParamFunc {
  public Complex run(Complex[] p) {
    return p[0].multiply(p[1]);
  }
}

class __divide extends TwoParamFunc {
  public Complex run(Complex[] p) {
    return p[0].divide(p[1]);
  }
}

class __power extends TwoParamFunc {
  public Complex run(Complex[] p) {
    return p[0].pow(p[1]);
  }
}

//Evaluators of the functions:
class __negate extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].negate();
  }
}

class __re extends OneParamFunc {
  public Complex run(Complex[] p) {
    return Complex.valueOf(p[0].real());
  }
}

class __im extends OneParamFunc {
  public Complex run(Complex[] p) {
    return Complex.valueOf(p[0].imag());
  }
}

class __abs extends OneParamFunc {
  public Complex run(Complex[] p) {
    return Complex.valueOf(p[0].abs());
  }
}

class __arg extends OneParamFunc {
  public Complex run(Complex[] p) {
    return Complex.valueOf(p[0].arg());
  }
}

class __conj extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].conjugate();
  }
}

class __exp extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].exp();
  }
}

class __log extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].log();
  }
}

class __cos extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].cos();
  }
}

class __sin extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].sin();
  }
}

class __tan extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].tan();
  }
}

class __sec extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].sec();
  }
}

class __csc extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].csc();
  }
}

class __cot extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].cot();
  }
}

class __acos extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].acos();
  }
}

class __asin extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].asin();
  }
}

class __atan extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].atan();
  }
}

class __cosh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].cosh();
  }
}

class __sinh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].sinh();
  }
}

class __tanh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].tanh();
  }
}

class __acosh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].acosh();
  }
}

class __asinh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].asinh();
  }
}

class __atanh extends OneParamFunc {
  public Complex run(Complex[] p) {
    return p[0].atanh();
  }
}

//deriv(g) is only a marker for expandDerivatives; numerically it is zero.
class __deriv extends OneParamFunc {
  public Complex run(Complex[] p) {
    return Complex.ZERO;
  }
}
