package com.NTG.mawarith.Entity.Enum;

public enum Adjustment {
    NONE,
    // العول
    AWL,
    // الرد
    RADD
}
