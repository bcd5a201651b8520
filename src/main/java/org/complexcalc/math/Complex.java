package org.complexcalc.math;

/**
 * Immutable complex number with the elementary functions needed by the
 * operation table. Multi-valued functions return their principal branch.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);
    public static final Complex E = new Complex(Math.E, 0.0);
    public static final Complex PI = new Complex(Math.PI, 0.0);

    // integral exponents up to this magnitude are computed by repeated squaring
    private static final double MAX_EXACT_EXPONENT = 1024;

    private final double real;
    private final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex valueOf(double real) {
        return new Complex(real, 0.0);
    }

    public static Complex valueOf(double real, double imag) {
        return new Complex(real, imag);
    }

    public double real() {
        return real;
    }

    public double imag() {
        return imag;
    }

    public boolean isZero() {
        return real == 0.0 && imag == 0.0;
    }

    public boolean isReal() {
        return imag == 0.0;
    }

    public boolean isNaN() {
        return Double.isNaN(real) || Double.isNaN(imag);
    }

    public Complex add(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex multiply(Complex other) {
        return new Complex(real * other.real - imag * other.imag,
                real * other.imag + imag * other.real);
    }

    public Complex divide(Complex other) {
        double denominator = other.real * other.real + other.imag * other.imag;
        return new Complex((real * other.real + imag * other.imag) / denominator,
                (imag * other.real - real * other.imag) / denominator);
    }

    public Complex scale(double factor) {
        return new Complex(real * factor, imag * factor);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    public Complex reciprocal() {
        return ONE.divide(this);
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    public double abs() {
        return Math.hypot(real, imag);
    }

    public double arg() {
        return Math.atan2(imag, real);
    }

    public Complex exp() {
        double modulus = Math.exp(real);
        return new Complex(modulus * Math.cos(imag), modulus * Math.sin(imag));
    }

    public Complex log() {
        return new Complex(Math.log(abs()), arg());
    }

    public Complex sqrt() {
        if (isZero()) {
            return ZERO;
        }
        double t = Math.sqrt((Math.abs(real) + abs()) / 2.0);
        if (real >= 0.0) {
            return new Complex(t, imag / (2.0 * t));
        }
        return new Complex(Math.abs(imag) / (2.0 * t), Math.copySign(t, imag));
    }

    public Complex pow(Complex exponent) {
        if (exponent.isReal() && exponent.real == Math.rint(exponent.real)
                && Math.abs(exponent.real) <= MAX_EXACT_EXPONENT) {
            return intPow((long) exponent.real);
        }
        if (isZero()) {
            if (exponent.real > 0.0) {
                return ZERO;
            }
            return new Complex(Double.NaN, Double.NaN);
        }
        return exponent.multiply(log()).exp();
    }

    private Complex intPow(long n) {
        boolean invert = n < 0;
        long remaining = Math.abs(n);
        Complex result = ONE;
        Complex base = this;
        while (remaining > 0) {
            if ((remaining & 1L) == 1L) {
                result = result.multiply(base);
            }
            base = base.multiply(base);
            remaining >>= 1;
        }
        return invert ? result.reciprocal() : result;
    }

    public Complex sin() {
        return new Complex(Math.sin(real) * Math.cosh(imag), Math.cos(real) * Math.sinh(imag));
    }

    public Complex cos() {
        return new Complex(Math.cos(real) * Math.cosh(imag), -Math.sin(real) * Math.sinh(imag));
    }

    public Complex tan() {
        return sin().divide(cos());
    }

    public Complex sec() {
        return cos().reciprocal();
    }

    public Complex csc() {
        return sin().reciprocal();
    }

    public Complex cot() {
        return cos().divide(sin());
    }

    public Complex sinh() {
        return new Complex(Math.sinh(real) * Math.cos(imag), Math.cosh(real) * Math.sin(imag));
    }

    public Complex cosh() {
        return new Complex(Math.cosh(real) * Math.cos(imag), Math.sinh(real) * Math.sin(imag));
    }

    public Complex tanh() {
        return sinh().divide(cosh());
    }

    // asin(z) = -i log(iz + sqrt(1 - z^2))
    public Complex asin() {
        Complex root = ONE.subtract(multiply(this)).sqrt();
        return I.multiply(this).add(root).log().multiply(I).negate();
    }

    public Complex acos() {
        return new Complex(Math.PI / 2.0, 0.0).subtract(asin());
    }

    // atan(z) = i/2 (log(1 - iz) - log(1 + iz))
    public Complex atan() {
        Complex iz = I.multiply(this);
        return ONE.subtract(iz).log().subtract(ONE.add(iz).log()).multiply(I).scale(0.5);
    }

    public Complex asinh() {
        return add(multiply(this).add(ONE).sqrt()).log();
    }

    public Complex acosh() {
        return add(add(ONE).sqrt().multiply(subtract(ONE).sqrt())).log();
    }

    public Complex atanh() {
        return ONE.add(this).log().subtract(ONE.subtract(this).log()).scale(0.5);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Complex)) {
            return false;
        }
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }

    /**
     * Formats as {@code 3}, {@code 2.5}, {@code 2i} or {@code (1+2i)}.
     */
    @Override
    public String toString() {
        if (imag == 0.0) {
            return format(real);
        }
        if (real == 0.0) {
            return format(imag) + "i";
        }
        return "(" + format(real) + (imag < 0 ? "-" : "+") + format(Math.abs(imag)) + "i)";
    }

    private static String format(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
