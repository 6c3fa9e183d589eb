package com.NTG.mawarith.util;

/**
 * Exact rational number, always stored in lowest terms with a positive denominator.
 * Arithmetic overflow throws {@link ArithmeticException} rather than losing precision.
 */
public record Fraction(long numerator, long denominator) implements Comparable<Fraction> {

    public static final Fraction ZERO = new Fraction(0, 1);
    public static final Fraction ONE = new Fraction(1, 1);

    public Fraction {
        if (denominator == 0) {
            throw new ArithmeticException("Denominator must not be zero");
        }
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        long g = gcd(Math.abs(numerator), denominator);
        if (g > 1) {
            numerator /= g;
            denominator /= g;
        }
    }

    public static Fraction of(long numerator, long denominator) {
        return new Fraction(numerator, denominator);
    }

    public static Fraction of(long whole) {
        return new Fraction(whole, 1);
    }

    public Fraction add(Fraction other) {
        long common = lcm(denominator, other.denominator);
        return new Fraction(
                Math.addExact(
                        Math.multiplyExact(numerator, common / denominator),
                        Math.multiplyExact(other.numerator, common / other.denominator)),
                common);
    }

    public Fraction subtract(Fraction other) {
        return add(other.negate());
    }

    public Fraction multiply(Fraction other) {
        // cross-reduce first to keep the intermediate values small
        long g1 = gcd(Math.abs(numerator), other.denominator);
        long g2 = gcd(Math.abs(other.numerator), denominator);
        return new Fraction(
                Math.multiplyExact(numerator / g1, other.numerator / g2),
                Math.multiplyExact(denominator / g2, other.denominator / g1));
    }

    public Fraction multiply(long factor) {
        return multiply(of(factor));
    }

    public Fraction divide(Fraction other) {
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        return multiply(new Fraction(other.denominator, other.numerator));
    }

    public Fraction divide(long divisor) {
        return divide(of(divisor));
    }

    public Fraction negate() {
        return new Fraction(Math.negateExact(numerator), denominator);
    }

    public boolean isZero() {
        return numerator == 0;
    }

    public boolean isPositive() {
        return numerator > 0;
    }

    public boolean isGreaterThan(Fraction other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Fraction other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Fraction other) {
        return Long.compare(
                Math.multiplyExact(numerator, other.denominator),
                Math.multiplyExact(other.numerator, denominator));
    }

    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }

    // ==================== دوال مساعدة ====================

    public static long lcm(long a, long b) {
        return Math.multiplyExact(a, b / gcd(a, b));
    }

    public static long gcd(long a, long b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
