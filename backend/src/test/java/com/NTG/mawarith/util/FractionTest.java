package com.NTG.mawarith.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FractionTest {

    @Test
    void reducesAndNormalisesSign() {
        Fraction f = Fraction.of(6, -8);

        assertThat(f.numerator()).isEqualTo(-3);
        assertThat(f.denominator()).isEqualTo(4);
        assertThat(Fraction.of(0, 7)).isEqualTo(Fraction.ZERO);
    }

    @Test
    void rejectsZeroDenominator() {
        assertThatThrownBy(() -> Fraction.of(1, 0)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> Fraction.ONE.divide(Fraction.ZERO)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void addsExactly() {
        Fraction sum = Fraction.of(1, 2).add(Fraction.of(1, 6)).add(Fraction.of(1, 3));

        assertThat(sum).isEqualTo(Fraction.ONE);
    }

    @Test
    void multipliesAndDivides() {
        assertThat(Fraction.of(2, 3).multiply(Fraction.of(3, 4))).isEqualTo(Fraction.of(1, 2));
        assertThat(Fraction.of(1, 2).divide(Fraction.of(7, 6))).isEqualTo(Fraction.of(3, 7));
        assertThat(Fraction.of(7, 8).multiply(2).divide(3)).isEqualTo(Fraction.of(7, 12));
    }

    @Test
    void comparesByValue() {
        assertThat(Fraction.of(7, 6).isGreaterThan(Fraction.ONE)).isTrue();
        assertThat(Fraction.of(2, 3).isLessThan(Fraction.of(3, 4))).isTrue();
        assertThat(Fraction.of(2, 4).compareTo(Fraction.of(1, 2))).isZero();
    }

    @Test
    void printsCompactForm() {
        assertThat(Fraction.of(3, 7)).hasToString("3/7");
        assertThat(Fraction.of(4, 2)).hasToString("2");
    }

    @Test
    void computesLeastCommonMultiple() {
        assertThat(Fraction.lcm(4, 6)).isEqualTo(12);
        assertThat(Fraction.lcm(8, 3)).isEqualTo(24);
    }
}
