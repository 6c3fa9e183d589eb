package com.NTG.mawarith.Entity.Enum;

public enum Gender {
    MALE,
    FEMALE
}
