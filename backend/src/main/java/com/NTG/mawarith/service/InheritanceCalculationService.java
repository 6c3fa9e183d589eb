package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.ClassificationResult;
import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.DTOs.RawShares;
import com.NTG.mawarith.DTOs.response.EstateDivision;
import com.NTG.mawarith.Entity.FamilyTree;
import com.NTG.mawarith.exceptionHandler.NoEligibleHeirException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the engine: family tree in, estate division out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InheritanceCalculationService {

    private final HeirClassifier heirClassifier;
    private final ExclusionEngine exclusionEngine;
    private final ShareCalculator shareCalculator;
    private final ShareNormalizer shareNormalizer;

    public EstateDivision divide(FamilyTree tree) {
        // نسخة ثابتة حتى لا تؤثر تعديلات الشجرة على الحساب
        FamilyTree snapshot = tree.snapshot();

        ClassificationResult classification = heirClassifier.classify(snapshot);
        if (classification.heirs().isEmpty()) {
            throw new NoEligibleHeirException("No living, eligible heir for " + classification.deceased());
        }

        PrunedHeirs pruned = exclusionEngine.exclude(classification.heirs());
        RawShares raw = shareCalculator.computeShares(pruned);
        EstateDivision division = shareNormalizer.normalize(raw, pruned);

        // تسجيل معلومات التصحيح
        logCaseInfo(classification, pruned, division);
        return division;
    }

    private void logCaseInfo(ClassificationResult classification, PrunedHeirs pruned, EstateDivision division) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Deceased {}: {} heirs classified, {} ineligible, {} excluded",
                classification.deceased(),
                classification.heirs().size(),
                classification.ineligible().size(),
                pruned.exclusions().size());
        log.debug("Adjustment {} with fixed total {}, origin {}",
                division.adjustment(), division.fixedTotal(), division.origin());
        division.entries().forEach(entry -> log.debug("  {} {} -> {} ({} of {})",
                entry.personId(), entry.heirType(), entry.share(), entry.units(), division.origin()));
    }
}
