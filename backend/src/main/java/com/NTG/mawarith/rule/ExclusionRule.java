package com.NTG.mawarith.rule;

import com.NTG.mawarith.Entity.Enum.HeirType;

import java.util.Set;

public record ExclusionRule(
        HeirType excluder,
        Set<HeirType> excluded,
        ExclusionCondition condition,
        String note
) {
    public ExclusionRule {
        excluded = Set.copyOf(excluded);
    }
}
