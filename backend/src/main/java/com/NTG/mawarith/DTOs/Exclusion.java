package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.PersonId;

import java.util.List;

/**
 * Audit record of a heir removed by hajb: who was removed, by which category and which
 * persons of that category.
 */
public record Exclusion(
        PersonId personId,
        HeirType heirType,
        HeirType excludedBy,
        List<PersonId> excluders,
        String note
) {
    public Exclusion {
        excluders = List.copyOf(excluders);
    }
}
