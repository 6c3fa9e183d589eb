package com.NTG.mawarith.Entity.Enum;

public enum AsabaType {
    BY_SELF("عصبة بالنفس"),
    BY_ANOTHER("عصبة بالغير"),
    WITH_ANOTHER("عصبة مع الغير"),
    NONE("ليس بعاصب");

    private final String arabicName;

    AsabaType(String arabicName) {
        this.arabicName = arabicName;
    }

    public String getArabicName() {
        return arabicName;
    }
}
