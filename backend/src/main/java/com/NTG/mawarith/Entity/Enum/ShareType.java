package com.NTG.mawarith.Entity.Enum;

public enum ShareType {
    // فرض
    FIXED,
    // تعصيب
    RESIDUAL,
    // فرض وتعصيب معاً (الأب أو الجد مع فرع وارث أنثى)
    MIXED
}
