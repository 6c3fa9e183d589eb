package com.NTG.mawarith.Entity.Enum;

public enum IneligibilityReason {
    // died before (or with) the deceased
    PREDECEASED,
    // related through marriage only
    AFFINITY,
    // اختلاف الدين
    DIFFERENT_RELIGION
}
