package com.ryuqq.wick.core.number;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * 정확한 유리수 (분수) 값 객체.
 *
 * <p>Term 계수, Expression 내적 등 모든 계수 연산에 사용되는 타입입니다.
 * 부동소수점 오차 없이 교환·결합 법칙이 정확히 성립합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>항상 기약분수 (gcd(numerator, denominator) == 1)</li>
 *   <li>분모는 항상 양수 (부호는 분자가 가짐)</li>
 *   <li>0은 항상 0/1로 표현</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RationalNumber half = RationalNumber.of(1, 2);
 * RationalNumber threeHalves = half.add(RationalNumber.ONE);   // 3/2
 * RationalNumber parsed = RationalNumber.parse("-3/4");
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class RationalNumber implements Comparable<RationalNumber> {

    public static final RationalNumber ZERO = new RationalNumber(BigInteger.ZERO, BigInteger.ONE);
    public static final RationalNumber ONE = new RationalNumber(BigInteger.ONE, BigInteger.ONE);
    public static final RationalNumber MINUS_ONE = new RationalNumber(BigInteger.ONE.negate(), BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private RationalNumber(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * 정수 값 생성.
     *
     * @param value 정수
     * @return RationalNumber 인스턴스
     */
    public static RationalNumber of(long value) {
        return of(BigInteger.valueOf(value), BigInteger.ONE);
    }

    /**
     * 분수 값 생성 (자동 약분).
     *
     * @param numerator 분자
     * @param denominator 분모 (0 불가)
     * @return RationalNumber 인스턴스
     * @throws ArithmeticException 분모가 0인 경우
     */
    public static RationalNumber of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * 분수 값 생성 (자동 약분).
     *
     * @param numerator 분자
     * @param denominator 분모 (0 불가)
     * @return RationalNumber 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ArithmeticException 분모가 0인 경우
     */
    public static RationalNumber of(BigInteger numerator, BigInteger denominator) {
        if (numerator == null || denominator == null) {
            throw new IllegalArgumentException("numerator and denominator cannot be null");
        }
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator (numerator: " + numerator + ")");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new RationalNumber(numerator, denominator);
    }

    /**
     * 문자열 파싱 ("3", "-3/4", "+1/2").
     *
     * @param text 파싱할 문자열
     * @return RationalNumber 인스턴스
     * @throws NumberFormatException 형식이 잘못된 경우
     * @throws ArithmeticException 분모가 0인 경우
     */
    public static RationalNumber parse(String text) {
        if (text == null || text.isBlank()) {
            throw new NumberFormatException("Rational text cannot be null or blank");
        }
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return of(new BigInteger(trimmed), BigInteger.ONE);
        }
        return of(new BigInteger(trimmed.substring(0, slash).trim()),
            new BigInteger(trimmed.substring(slash + 1).trim()));
    }

    /**
     * 1/n! 계산 (BCH 계수용).
     *
     * @param n 0 이상의 정수
     * @return 1/n!
     * @throws IllegalArgumentException n이 음수인 경우
     */
    public static RationalNumber inverseFactorial(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative (current: " + n + ")");
        }
        BigInteger factorial = BigInteger.ONE;
        for (int i = 2; i <= n; i++) {
            factorial = factorial.multiply(BigInteger.valueOf(i));
        }
        return of(BigInteger.ONE, factorial);
    }

    public RationalNumber add(RationalNumber other) {
        requireNonNull(other);
        if (denominator.equals(other.denominator)) {
            return of(numerator.add(other.numerator), denominator);
        }
        return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
            denominator.multiply(other.denominator));
    }

    public RationalNumber subtract(RationalNumber other) {
        requireNonNull(other);
        return add(other.negate());
    }

    public RationalNumber multiply(RationalNumber other) {
        requireNonNull(other);
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public RationalNumber multiply(long factor) {
        return multiply(of(factor));
    }

    /**
     * 나눗셈.
     *
     * @param other 나누는 수
     * @return this / other
     * @throws ArithmeticException other가 0인 경우
     */
    public RationalNumber divide(RationalNumber other) {
        requireNonNull(other);
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero rational");
        }
        return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public RationalNumber negate() {
        return isZero() ? this : new RationalNumber(numerator.negate(), denominator);
    }

    public RationalNumber abs() {
        return signum() < 0 ? negate() : this;
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    /**
     * double 근사값 (norm 계산용).
     *
     * @return 근사값
     */
    public double toDouble() {
        return new BigDecimal(numerator)
            .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
            .doubleValue();
    }

    @Override
    public int compareTo(RationalNumber other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RationalNumber that = (RationalNumber) o;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * numerator.hashCode() + denominator.hashCode();
    }

    /**
     * 정수는 "3", 분수는 "3/2" 형태로 출력.
     */
    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }

    private static void requireNonNull(RationalNumber other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
    }
}
