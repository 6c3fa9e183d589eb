package com.NTG.mawarith.Entity.Enum;

import com.NTG.mawarith.util.Fraction;
import lombok.Getter;


@Getter
public enum FixedShare {
    HALF(1, 2),
    QUARTER(1, 4),
    EIGHTH(1, 8),
    TWO_THIRDS(2, 3),
    THIRD(1, 3),
    SIXTH(1, 6),
    // ثلث الباقي بعد فرض الزوج/الزوجة (العمريتان)
    THIRD_OF_REMAINDER(1, 3);

    private final int numerator;
    private final int denominator;

    FixedShare(int numerator, int denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public Fraction toFraction() {
        return Fraction.of(numerator, denominator);
    }
}
