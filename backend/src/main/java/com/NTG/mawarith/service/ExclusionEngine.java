package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.Exclusion;
import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.rule.ExclusionRule;
import com.NTG.mawarith.rule.ExclusionTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes heirs blocked by a closer relative. The table is walked once in priority order
 * and only heirs still present act as excluders.
 */
@Component
@RequiredArgsConstructor
public class ExclusionEngine {

    private final ExclusionTable exclusionTable;

    public PrunedHeirs exclude(List<ClassifiedHeir> heirs) {
        List<ClassifiedHeir> present = new ArrayList<>(heirs);
        List<Exclusion> exclusions = new ArrayList<>();

        for (ExclusionRule rule : exclusionTable.rules()) {
            List<ClassifiedHeir> excluders = present.stream()
                    .filter(h -> h.heirType() == rule.excluder())
                    .toList();
            if (excluders.isEmpty()) {
                continue;
            }

            // كل قاعدة تُقيَّم على حال الورثة قبل تطبيقها
            List<ClassifiedHeir> before = List.copyOf(present);
            List<ClassifiedHeir> removed = before.stream()
                    .filter(target -> rule.excluded().contains(target.heirType()))
                    .filter(target -> rule.condition().holds(target, excluders, before))
                    .toList();

            List<PersonId> excluderIds = excluders.stream().map(ClassifiedHeir::personId).toList();
            for (ClassifiedHeir target : removed) {
                present.remove(target);
                exclusions.add(new Exclusion(target.personId(), target.heirType(), rule.excluder(), excluderIds, rule.note()));
            }
        }
        return new PrunedHeirs(present, exclusions);
    }
}
