package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.HeirType;

import java.util.List;

/**
 * Heirs that survived exclusion, plus the exclusions that removed the others.
 */
public record PrunedHeirs(
        List<ClassifiedHeir> heirs,
        List<Exclusion> exclusions
) {
    public PrunedHeirs {
        heirs = List.copyOf(heirs);
        exclusions = List.copyOf(exclusions);
    }

    public boolean has(HeirType type) {
        return heirs.stream().anyMatch(h -> h.heirType() == type);
    }

    public long excludedCount(HeirType type) {
        return exclusions.stream().filter(e -> e.heirType() == type).count();
    }
}
