package com.circuit.sfg.algebra;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Product of symbols raised to non-zero integer powers. The imaginary unit
 * {@code j} is kept at power 0 or 1; higher powers fold into the sign of the
 * owning term.
 */
public final class Monomial implements Comparable<Monomial> {
    public static final String IMAGINARY_UNIT = "j";
    public static final Monomial UNIT = new Monomial(Collections.emptyMap());

    private final Map<String, Integer> powers;
    private final String text;
    private final int degree;

    private Monomial(Map<String, Integer> powers) {
        this.powers = powers;
        StringBuilder sb = new StringBuilder();
        int deg = 0;
        for (Map.Entry<String, Integer> e : powers.entrySet()) {
            if (sb.length() > 0)
                sb.append('*');
            sb.append(e.getKey());
            if (e.getValue() != 1)
                sb.append('^').append(e.getValue());
            deg += Math.abs(e.getValue());
        }
        this.text = sb.toString();
        this.degree = deg;
    }

    public static Monomial symbol(String name) {
        return new Monomial(Collections.singletonMap(name, 1));
    }

    public boolean isUnit() {
        return powers.isEmpty();
    }

    public int degree() {
        return degree;
    }

    public int power(String symbol) {
        return powers.getOrDefault(symbol, 0);
    }

    public Map<String, Integer> powers() {
        return Collections.unmodifiableMap(powers);
    }

    public boolean isImaginary() {
        return power(IMAGINARY_UNIT) == 1;
    }

    /** Drops the imaginary unit, leaving the real-valued symbols. */
    public Monomial withoutImaginaryUnit() {
        if (!powers.containsKey(IMAGINARY_UNIT))
            return this;
        TreeMap<String, Integer> next = new TreeMap<>(powers);
        next.remove(IMAGINARY_UNIT);
        return new Monomial(next);
    }

    /**
     * Multiplies two monomials. {@code j^2 = -1} is applied here, so the
     * caller must fold {@link Product#negated()} into the coefficient.
     */
    public Product times(Monomial other) {
        TreeMap<String, Integer> next = new TreeMap<>(powers);
        for (Map.Entry<String, Integer> e : other.powers.entrySet())
            next.merge(e.getKey(), e.getValue(), Integer::sum);
        return normalize(next);
    }

    /** Reciprocal, with the same sign convention as {@link #times(Monomial)}. */
    public Product inverse() {
        TreeMap<String, Integer> next = new TreeMap<>();
        for (Map.Entry<String, Integer> e : powers.entrySet())
            next.put(e.getKey(), -e.getValue());
        return normalize(next);
    }

    private static Product normalize(TreeMap<String, Integer> raw) {
        raw.values().removeIf(p -> p == 0);
        boolean negated = false;
        Integer j = raw.get(IMAGINARY_UNIT);
        if (j != null) {
            switch (Math.floorMod(j, 4)) {
                case 0 -> raw.remove(IMAGINARY_UNIT);
                case 1 -> raw.put(IMAGINARY_UNIT, 1);
                case 2 -> {
                    raw.remove(IMAGINARY_UNIT);
                    negated = true;
                }
                default -> {
                    raw.put(IMAGINARY_UNIT, 1);
                    negated = true;
                }
            }
        }
        return new Product(raw.isEmpty() ? UNIT : new Monomial(raw), negated);
    }

    /** Orders by total degree, then by rendered text. */
    @Override
    public int compareTo(Monomial o) {
        int c = Integer.compare(degree, o.degree);
        return c != 0 ? c : text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Monomial m && text.equals(m.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    public record Product(Monomial monomial, boolean negated) {
    }
}
