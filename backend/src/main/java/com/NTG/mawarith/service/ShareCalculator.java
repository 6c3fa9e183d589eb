package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.DTOs.RawShare;
import com.NTG.mawarith.DTOs.RawShares;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.config.MawarithProperties;
import com.NTG.mawarith.rule.InheritanceRule;
import com.NTG.mawarith.util.Fraction;
import com.NTG.mawarith.util.InheritanceCase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Fixed shares first, then the residue to the highest-ranked residuary group.
 */
@Component
@RequiredArgsConstructor
public class ShareCalculator {

    private final List<InheritanceRule> rules;
    private final MawarithProperties properties;

    public RawShares computeShares(PrunedHeirs pruned) {
        InheritanceCase c = new InheritanceCase(pruned, properties.isUmariyya());

        // تطبيق جميع القواعد
        List<ShareClaim> claims = new ArrayList<>();
        for (InheritanceRule rule : rules) {
            if (rule.canApply(c)) {
                claims.addAll(rule.calculate(c));
            }
        }

        Map<PersonId, Fraction> fixed = computeFixedShares(claims);
        Fraction fixedTotal = fixed.values().stream().reduce(Fraction.ZERO, Fraction::add);
        Fraction residue = fixedTotal.isLessThan(Fraction.ONE) ? Fraction.ONE.subtract(fixedTotal) : Fraction.ZERO;
        Map<PersonId, Fraction> residual = distributeAsaba(claims, residue);

        List<RawShare> shares = new ArrayList<>();
        for (ShareClaim claim : claims) {
            for (ClassifiedHeir heir : claim.heirs()) {
                shares.add(new RawShare(
                        heir,
                        claim.shareType(),
                        fixed.getOrDefault(heir.personId(), Fraction.ZERO),
                        residual.getOrDefault(heir.personId(), Fraction.ZERO),
                        claim.asabaType(),
                        claim.reason()));
            }
        }
        boolean residuaryPresent = claims.stream().anyMatch(ShareClaim::hasResidualPart);
        return new RawShares(shares, residuaryPresent);
    }

    // ==================== الفروض ====================

    private Map<PersonId, Fraction> computeFixedShares(List<ShareClaim> claims) {
        Fraction spouseTotal = claims.stream()
                .filter(ShareClaim::hasFixedPart)
                .filter(claim -> claim.heirs().stream().allMatch(h -> h.heirType().isSpouse()))
                .map(claim -> claim.fixedShare().toFraction())
                .reduce(Fraction.ZERO, Fraction::add);

        Map<PersonId, Fraction> fixed = new HashMap<>();
        for (ShareClaim claim : claims) {
            if (!claim.hasFixedPart()) {
                continue;
            }
            Fraction portion = claim.fixedShare() == FixedShare.THIRD_OF_REMAINDER
                    ? Fraction.ONE.subtract(spouseTotal).divide(3)
                    : claim.fixedShare().toFraction();
            Fraction perHeir = portion.divide(claim.heirs().size());
            claim.heirs().forEach(h -> fixed.put(h.personId(), perHeir));
        }
        return fixed;
    }

    // ==================== العصبات ====================

    private Map<PersonId, Fraction> distributeAsaba(List<ShareClaim> claims, Fraction residue) {
        List<ClassifiedHeir> residuaries = claims.stream()
                .filter(ShareClaim::hasResidualPart)
                .flatMap(claim -> claim.heirs().stream())
                .toList();
        OptionalInt topRank = residuaries.stream()
                .mapToInt(h -> h.heirType().getResiduaryRank())
                .min();

        Map<PersonId, Fraction> residual = new HashMap<>();
        if (topRank.isEmpty() || residue.isZero()) {
            return residual;
        }

        List<ClassifiedHeir> group = residuaries.stream()
                .filter(h -> h.heirType().getResiduaryRank() == topRank.getAsInt())
                .toList();
        int totalUnits = group.stream().mapToInt(ClassifiedHeir::residuaryUnits).sum();
        for (ClassifiedHeir heir : group) {
            residual.put(heir.personId(), residue.multiply(heir.residuaryUnits()).divide(totalUnits));
        }
        return residual;
    }
}
