package org.complexcalc;

import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.complexcalc.math.Complex;
import org.complexcalc.parser.ComplexParserFactory;
import org.complexcalc.parser.Expression;
import org.complexcalc.parser.IComplexParser;
import org.complexcalc.parser.ParserException;

/**
 * Command line front end. Usage:
 * <pre>
 *   java -jar complex-calculus.jar [--at re,im] [--json] expression
 * </pre>
 * Prints the infix, postfix and derivative forms of the expression and, with
 * {@code --at}, their values at that point.
 */
public class Main {

	private static final Logger logger = Logger.getLogger(Main.class.getName());

	static final int OK = 0;
	static final int PARSE_ERROR = 1;
	static final int USAGE_ERROR = 2;

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		String text = null;
		Complex at = null;
		boolean json = false;

		for (int i = 0; i < args.length; i++) {
			if ("--json".equals(args[i])) json = true;
			else if ("--at".equals(args[i]) && i + 1 < args.length) {
				at = parsePoint(args[++i]);
				if (at == null) {
					err.println("Invalid point: " + args[i]);
					return USAGE_ERROR;
				}
			}
			else if (text == null && !args[i].startsWith("--")) text = args[i];
			else {
				usage(err);
				return USAGE_ERROR;
			}
		}
		if (text == null) {
			usage(err);
			return USAGE_ERROR;
		}

		IComplexParser parser = ComplexParserFactory.create();
		try {
			Expression infix = parser.parse(text);
			Expression postfix = parser.expandDerivatives(parser.toPostfix(infix));
			Expression derivative = parser.differentiate(postfix);
			if (json) {
				out.println(ExpressionJson.toJson(postfix));
				out.println(ExpressionJson.toJson(derivative));
			} else {
				out.println("infix:      " + parser.render(infix));
				out.println("postfix:    " + parser.render(postfix));
				out.println("derivative: " + parser.render(derivative));
			}
			if (at != null) {
				out.println("f(" + at + ")  = " + parser.evaluate(postfix, at));
				out.println("f'(" + at + ") = " + parser.evaluate(derivative, at));
			}
			return OK;
		} catch (ParserException e) {
			logger.log(Level.FINE, "Rejected expression " + text, e);
			err.println(e.getMessage());
			return PARSE_ERROR;
		}
	}

	/**
	 * Reads {@code re} or {@code re,im}; returns null if malformed.
	 */
	static Complex parsePoint(String s) {
		String[] parts = s.split(",");
		if (parts.length > 2) return null;
		try {
			double re = Double.parseDouble(parts[0].trim());
			double im = parts.length == 2 ? Double.parseDouble(parts[1].trim()) : 0.0;
			return Complex.valueOf(re, im);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static void usage(PrintStream err) {
		err.println("Usage: complex-calculus [--at re,im] [--json] expression");
		err.println("Example: complex-calculus --at 1,1 \"\\sin(z)^2 + [1,2]*z\"");
	}
}
