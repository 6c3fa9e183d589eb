package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.IneligibilityReason;
import com.NTG.mawarith.Entity.PersonId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ClassificationResult(
        PersonId deceased,
        List<ClassifiedHeir> heirs,
        Map<PersonId, IneligibilityReason> ineligible
) {
    public ClassificationResult {
        heirs = List.copyOf(heirs);
        ineligible = Map.copyOf(ineligible);
    }

    public Optional<ClassifiedHeir> heir(PersonId id) {
        return heirs.stream().filter(h -> h.personId().equals(id)).findFirst();
    }

    public Optional<IneligibilityReason> ineligibility(PersonId id) {
        return Optional.ofNullable(ineligible.get(id));
    }
}
