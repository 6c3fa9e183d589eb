package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.DTOs.RawShare;
import com.NTG.mawarith.DTOs.RawShares;
import com.NTG.mawarith.DTOs.response.EstateDivision;
import com.NTG.mawarith.DTOs.response.ShareEntry;
import com.NTG.mawarith.Entity.Enum.Adjustment;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.ShareType;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.util.Fraction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brings the raw shares to a whole estate: awl when the fixed shares exceed it, radd when
 * they fall short and nobody takes the residue.
 */
@Component
public class ShareNormalizer {

    private record Adjusted(RawShare raw, Fraction fixed, Fraction residual) {
        Fraction total() {
            return fixed.add(residual);
        }
    }

    public EstateDivision normalize(RawShares raw, PrunedHeirs pruned) {
        Fraction fixedTotal = raw.fixedTotal();
        Adjustment adjustment;
        List<Adjusted> adjusted;

        if (fixedTotal.isGreaterThan(Fraction.ONE)) {
            adjustment = Adjustment.AWL;
            adjusted = applyAwl(raw, fixedTotal);
        } else if (fixedTotal.isLessThan(Fraction.ONE) && !raw.residuaryPresent()) {
            adjustment = Adjustment.RADD;
            adjusted = applyRadd(raw, fixedTotal);
        } else {
            adjustment = Adjustment.NONE;
            adjusted = raw.shares().stream().map(s -> new Adjusted(s, s.fixed(), s.residual())).toList();
        }

        Fraction total = adjusted.stream().map(Adjusted::total).reduce(Fraction.ZERO, Fraction::add);
        if (!total.equals(Fraction.ONE)) {
            throw new IllegalStateException("Shares sum to " + total + " instead of 1");
        }

        List<Adjusted> inheriting = adjusted.stream()
                .filter(a -> a.total().isPositive())
                .sorted(Comparator.comparing((Adjusted a) -> a.raw().heir().heirType())
                        .thenComparing(a -> a.raw().heir().personId()))
                .toList();
        List<PersonId> exhausted = raw.exhausted().stream().sorted().toList();

        long origin = calculateOrigin(inheriting);
        List<ShareEntry> entries = new ArrayList<>();
        for (Adjusted a : inheriting) {
            Fraction share = a.total();
            entries.add(new ShareEntry(
                    a.raw().heir().personId(),
                    a.raw().heir().heirType(),
                    share,
                    shareTypeOf(a),
                    a.residual().isPositive() ? a.raw().asabaType() : AsabaType.NONE,
                    a.raw().reason(),
                    share.numerator() * (origin / share.denominator())));
        }
        return new EstateDivision(entries, adjustment, origin, fixedTotal, pruned.exclusions(), exhausted);
    }

    // ==================== العول والرد ====================

    private List<Adjusted> applyAwl(RawShares raw, Fraction fixedTotal) {
        return raw.shares().stream()
                .map(s -> new Adjusted(s, s.fixed().divide(fixedTotal), Fraction.ZERO))
                .toList();
    }

    private List<Adjusted> applyRadd(RawShares raw, Fraction fixedTotal) {
        Fraction shortfall = Fraction.ONE.subtract(fixedTotal);
        Fraction nonSpouseTotal = raw.shares().stream()
                .filter(s -> !s.heir().heirType().isSpouse())
                .map(RawShare::fixed)
                .reduce(Fraction.ZERO, Fraction::add);

        // لا يرد على الزوجين إلا عند انفرادهما
        boolean spousesOnly = nonSpouseTotal.isZero();
        Fraction base = spousesOnly ? fixedTotal : nonSpouseTotal;

        return raw.shares().stream()
                .map(s -> {
                    boolean receives = spousesOnly || !s.heir().heirType().isSpouse();
                    Fraction extra = receives ? shortfall.multiply(s.fixed()).divide(base) : Fraction.ZERO;
                    return new Adjusted(s, s.fixed().add(extra), Fraction.ZERO);
                })
                .toList();
    }

    // ==================== دوال مساعدة ====================

    private ShareType shareTypeOf(Adjusted a) {
        if (a.fixed().isPositive() && a.residual().isPositive()) {
            return ShareType.MIXED;
        }
        return a.fixed().isPositive() ? ShareType.FIXED : ShareType.RESIDUAL;
    }

    // أصل المسألة: المضاعف المشترك الأصغر للمقامات
    private long calculateOrigin(List<Adjusted> shares) {
        return shares.stream()
                .map(a -> a.total().denominator())
                .reduce(Fraction::lcm)
                .orElse(1L);
    }
}
