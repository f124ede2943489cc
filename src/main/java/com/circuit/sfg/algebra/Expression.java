package com.circuit.sfg.algebra;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable symbolic expression: a sum of rational-coefficient terms over
 * named symbols, with {@code j} as the imaginary unit.
 *
 * <p>
 * Terms are stored in canonical order (by degree, then by symbol text), so two
 * expressions that are algebraically equal as polynomials render to the same
 * string and compare equal regardless of the order in which they were summed
 * or multiplied.
 *
 * <p>
 * Edge weights arrive as strings; {@link #multiply(String)} parses them with
 * {@link ExpressionParser}.
 */
public final class Expression {
    private static final Expression ZERO = new Expression(Collections.emptyMap());
    private static final Expression ONE = constant(Rational.ONE);

    /** Largest exponent accepted by {@link #pow(int)}, in either sign. */
    public static final int MAX_EXPONENT = 64;

    // Never holds zero coefficients
    private final Map<Monomial, Rational> terms;

    private Expression(Map<Monomial, Rational> terms) {
        this.terms = terms;
    }

    public static Expression zero() {
        return ZERO;
    }

    public static Expression one() {
        return ONE;
    }

    public static Expression constant(long n) {
        return constant(Rational.of(n));
    }

    public static Expression constant(Rational n) {
        if (n.isZero())
            return ZERO;
        TreeMap<Monomial, Rational> t = new TreeMap<>();
        t.put(Monomial.UNIT, n);
        return new Expression(t);
    }

    public static Expression symbol(String name) {
        TreeMap<Monomial, Rational> t = new TreeMap<>();
        Monomial.Product p = Monomial.symbol(name).times(Monomial.UNIT);
        t.put(p.monomial(), p.negated() ? Rational.MINUS_ONE : Rational.ONE);
        return new Expression(t);
    }

    /** Parses a weight such as {@code -0.001*R1/(3)} or {@code 10*w*j}. */
    public static Expression parse(String text) {
        return new ExpressionParser(text).parse();
    }

    public Expression add(Expression other) {
        if (other.isZero())
            return this;
        TreeMap<Monomial, Rational> sum = new TreeMap<>(terms);
        for (Map.Entry<Monomial, Rational> e : other.terms.entrySet())
            accumulate(sum, e.getKey(), e.getValue());
        return new Expression(sum);
    }

    public Expression add(long n) {
        return add(constant(n));
    }

    public Expression subtract(Expression other) {
        return add(other.negate());
    }

    public Expression subtract(long n) {
        return add(constant(-n));
    }

    public Expression negate() {
        TreeMap<Monomial, Rational> neg = new TreeMap<>();
        for (Map.Entry<Monomial, Rational> e : terms.entrySet())
            neg.put(e.getKey(), e.getValue().negate());
        return new Expression(neg);
    }

    public Expression multiply(Expression other) {
        TreeMap<Monomial, Rational> product = new TreeMap<>();
        for (Map.Entry<Monomial, Rational> a : terms.entrySet()) {
            for (Map.Entry<Monomial, Rational> b : other.terms.entrySet()) {
                Monomial.Product p = a.getKey().times(b.getKey());
                Rational c = a.getValue().multiply(b.getValue());
                accumulate(product, p.monomial(), p.negated() ? c.negate() : c);
            }
        }
        return new Expression(product);
    }

    /** Multiplies by a weight string, parsed the way edge weights are. */
    public Expression multiply(String weight) {
        return multiply(parse(weight));
    }

    /**
     * Divides by a single-term expression.
     *
     * @throws ExpressionException if the divisor is zero or has several terms.
     */
    public Expression divide(Expression divisor) {
        if (divisor.isZero())
            throw new ExpressionException("Division by zero");
        if (divisor.terms.size() != 1)
            throw new ExpressionException("Cannot divide by multi-term expression: " + divisor);
        Map.Entry<Monomial, Rational> only = divisor.terms.entrySet().iterator().next();
        Monomial.Product inv = only.getKey().inverse();
        Rational c = Rational.ONE.divide(only.getValue());
        TreeMap<Monomial, Rational> t = new TreeMap<>();
        t.put(inv.monomial(), inv.negated() ? c.negate() : c);
        return multiply(new Expression(t));
    }

    /**
     * Integer power by repeated squaring.
     *
     * @throws ExpressionException if {@code |exponent| > MAX_EXPONENT}
     */
    public Expression pow(int exponent) {
        if (exponent > MAX_EXPONENT || exponent < -MAX_EXPONENT)
            throw new ExpressionException("Exponent out of range: " + exponent);
        if (exponent < 0)
            return ONE.divide(pow(-exponent));
        Expression result = ONE;
        Expression base = this;
        for (int e = exponent; e > 0; e >>= 1) {
            if ((e & 1) != 0)
                result = result.multiply(base);
            if (e > 1)
                base = base.multiply(base);
        }
        return result;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public int termCount() {
        return terms.size();
    }

    /** Coefficient of the given monomial, zero when absent. */
    public Rational coefficient(Monomial monomial) {
        return terms.getOrDefault(monomial, Rational.ZERO);
    }

    public Map<Monomial, Rational> terms() {
        return Collections.unmodifiableMap(terms);
    }

    /** Terms free of {@code j}. */
    public Expression realPart() {
        TreeMap<Monomial, Rational> t = new TreeMap<>();
        for (Map.Entry<Monomial, Rational> e : terms.entrySet())
            if (!e.getKey().isImaginary())
                t.put(e.getKey(), e.getValue());
        return new Expression(t);
    }

    /** Coefficient of {@code j}, with {@code j} itself removed. */
    public Expression imaginaryPart() {
        TreeMap<Monomial, Rational> t = new TreeMap<>();
        for (Map.Entry<Monomial, Rational> e : terms.entrySet())
            if (e.getKey().isImaginary())
                t.put(e.getKey().withoutImaginaryUnit(), e.getValue());
        return new Expression(t);
    }

    /** Magnitude formula as a string; functions are not part of the algebra. */
    public String magnitude() {
        Expression im = imaginaryPart();
        if (im.isZero())
            return "abs(" + realPart() + ")";
        return "sqrt((" + realPart() + ")^2 + (" + im + ")^2)";
    }

    /** Phase formula as a string. */
    public String phase() {
        return "atan2(" + imaginaryPart() + ", " + realPart() + ")";
    }

    private static void accumulate(TreeMap<Monomial, Rational> into, Monomial m, Rational c) {
        Rational next = into.getOrDefault(m, Rational.ZERO).add(c);
        if (next.isZero())
            into.remove(m);
        else
            into.put(m, next);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Expression e && terms.equals(e.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty())
            return "0";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Monomial, Rational> e : terms.entrySet()) {
            Rational c = e.getValue();
            if (sb.length() == 0) {
                if (c.signum() < 0)
                    sb.append('-');
            } else {
                sb.append(c.signum() < 0 ? " - " : " + ");
            }
            Rational abs = c.abs();
            Monomial m = e.getKey();
            if (m.isUnit())
                sb.append(abs);
            else if (abs.isOne())
                sb.append(m);
            else
                sb.append(abs).append('*').append(m);
        }
        return sb.toString();
    }
}
