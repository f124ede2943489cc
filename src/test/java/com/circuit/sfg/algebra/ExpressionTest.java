package com.circuit.sfg.algebra;

import org.junit.Test;

import static org.junit.Assert.*;

public class ExpressionTest {

    @Test
    public void testOneMinusSymbol() {
        Expression e = Expression.one().subtract(Expression.parse("f"));
        assertEquals("1 - f", e.toString());
    }

    @Test
    public void testCanonicalOrderIndependentOfSummationOrder() {
        Expression g1 = Expression.parse("g1");
        Expression g2 = Expression.parse("g2");

        Expression a = Expression.one().subtract(g1).subtract(g2).add(g1.multiply(g2));
        Expression b = g2.multiply(g1).subtract(g2).add(1).subtract(g1);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("1 - g1 - g2 + g1*g2", a.toString());
        assertEquals("1 - g1 - g2 + g1*g2", b.toString());
    }

    @Test
    public void testMultiplyIsCommutative() {
        assertEquals(Expression.parse("a*b"), Expression.parse("b*a"));
        assertEquals("a*b", Expression.one().multiply("b").multiply("a").toString());
    }

    @Test
    public void testZero() {
        Expression x = Expression.parse("x");
        assertTrue(x.subtract(x).isZero());
        assertEquals("0", Expression.zero().toString());
        assertEquals(Expression.zero(), Expression.constant(0));
    }

    @Test
    public void testDecimalsBecomeExactFractions() {
        assertEquals("1/2*x", Expression.parse("0.5*x").toString());
        assertEquals("1/1250000", Expression.parse("8e-7").toString());
        assertEquals(Expression.parse("x / (3)"), Expression.parse("x").multiply(Expression.parse("1/3")));
    }

    @Test
    public void testImaginaryUnitSquaresToMinusOne() {
        assertEquals(Expression.constant(-1), Expression.parse("j*j"));
        assertEquals(Expression.parse("-j"), Expression.parse("1/j"));
        assertEquals(Expression.one(), Expression.parse("j^4"));
    }

    @Test
    public void testDivisionByMonomial() {
        Expression e = Expression.parse("1/R1").multiply("R1");
        assertEquals(Expression.one(), e);
        assertEquals("x*y^-1", Expression.parse("x/y").toString());
        // The rendered form parses back to the same expression
        assertEquals(Expression.parse("x/y"), Expression.parse("x*y^-1"));
    }

    @Test(expected = ExpressionException.class)
    public void testDivisionByMultiTermRejected() {
        Expression.parse("a / (b + c)");
    }

    @Test(expected = ExpressionException.class)
    public void testDivisionByZeroRejected() {
        Expression.parse("a / 0");
    }

    @Test
    public void testMalformedInput() {
        String[] bad = { "", "a +", "(a", "a b", "3 $ 4", "x^" };
        for (String s : bad) {
            try {
                Expression.parse(s);
                fail("Expected failure for '" + s + "'");
            } catch (ExpressionException e) {
                assertTrue(e.getMessage(), e.getMessage().contains("pos"));
            }
        }
    }

    @Test(timeout = 5000)
    public void testExponentOutOfRange() {
        String[] bad = { "w^99999999999", "w^200000000", "w^-200000000", "(a+b)^65" };
        for (String s : bad) {
            try {
                Expression.parse(s);
                fail("Expected failure for '" + s + "'");
            } catch (ExpressionException e) {
                assertTrue(e.getMessage(), e.getMessage().contains("Exponent out of range"));
                assertTrue(e.getMessage(), e.getMessage().contains("pos"));
            }
        }
    }

    @Test
    public void testPowerBySquaring() {
        assertEquals("w^64", Expression.parse("w^64").toString());
        assertEquals("w^-13", Expression.parse("w^-13").toString());
        assertEquals(Expression.parse("(a+b)*(a+b)*(a+b)*(a+b)*(a+b)"), Expression.parse("(a+b)^5"));
        assertEquals("1", Expression.parse("x^0").toString());
        assertEquals("-j", Expression.parse("j^7").toString());
    }

    @Test(expected = ExpressionException.class)
    public void testPowRejectsHugeExponent() {
        Expression.symbol("w").pow(Expression.MAX_EXPONENT + 1);
    }

    @Test
    public void testRealAndImaginaryParts() {
        Expression e = Expression.parse("3 + 4*j");
        assertEquals("3", e.realPart().toString());
        assertEquals("4", e.imaginaryPart().toString());
        assertEquals("sqrt((3)^2 + (4)^2)", e.magnitude());
        assertEquals("atan2(4, 3)", e.phase());
    }

    @Test
    public void testMagnitudeOfRealExpression() {
        Expression e = Expression.parse("-2*R");
        assertEquals("abs(-2*R)", e.magnitude());
        assertEquals("atan2(0, -2*R)", e.phase());
    }

    @Test
    public void testNegativeWeightsAndParentheses() {
        Expression e = Expression.parse("-(a - b)*2");
        assertEquals("-2*a + 2*b", e.toString());
        assertEquals(Expression.parse("(a+b)^2"), Expression.parse("a^2 + 2*a*b + b^2"));
    }

    @Test
    public void testCoefficientLookup() {
        Expression e = Expression.parse("3*x + 5");
        assertEquals(Rational.of(3), e.coefficient(Monomial.symbol("x")));
        assertEquals(Rational.of(5), e.coefficient(Monomial.UNIT));
        assertEquals(Rational.ZERO, e.coefficient(Monomial.symbol("y")));
        assertEquals(2, e.termCount());
    }
}
