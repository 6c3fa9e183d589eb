package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Sons' sons and sons' daughters at any depth. Daughters' levels are walked nearest first:
 * the first level takes 1/2 or 2/3, the next one completes 2/3 with 1/6, and once 2/3 is
 * taken a level only inherits as residuary beside a son's son at its degree or below.
 */
@Component
public class SonsChildrenRule implements InheritanceRule {

    private enum Quota { NONE, HALF, FULL }

    @Override
    public boolean canApply(InheritanceCase c) {
        return !c.has(HeirType.SON)
                && (c.has(HeirType.SON_OF_SON) || c.has(HeirType.DAUGHTER_OF_SON));
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ShareClaim> claims = new ArrayList<>();
        List<ClassifiedHeir> grandsons = c.heirs(HeirType.SON_OF_SON);
        OptionalInt partnerDegree = grandsons.stream().mapToInt(ClassifiedHeir::degree).min();

        if (!grandsons.isEmpty()) {
            claims.add(ShareClaim.residual(grandsons, AsabaType.BY_SELF,
                    "يرث ابن الابن الباقي تعصيبًا لعدم وجود الابن"));
        }

        int daughters = c.count(HeirType.DAUGHTER);
        Quota quota = daughters == 0 ? Quota.NONE : daughters == 1 ? Quota.HALF : Quota.FULL;

        Map<Integer, List<ClassifiedHeir>> levels = c.heirs(HeirType.DAUGHTER_OF_SON).stream()
                .collect(Collectors.groupingBy(ClassifiedHeir::degree, TreeMap::new, Collectors.toList()));

        for (Map.Entry<Integer, List<ClassifiedHeir>> level : levels.entrySet()) {
            List<ClassifiedHeir> granddaughters = level.getValue();
            boolean hasPartner = partnerDegree.isPresent() && partnerDegree.getAsInt() >= level.getKey();

            if (hasPartner && partnerDegree.getAsInt() == level.getKey()) {
                claims.add(ShareClaim.residual(granddaughters, AsabaType.BY_ANOTHER,
                        "ترث بنت الابن تعصيبًا مع ابن الابن الذي في درجتها"));
                continue;
            }

            switch (quota) {
                case NONE -> {
                    boolean single = granddaughters.size() == 1;
                    claims.add(ShareClaim.fixed(granddaughters, single ? FixedShare.HALF : FixedShare.TWO_THIRDS,
                            single ? "ترث بنت الابن النصف لانفرادها وعدم وجود فرع أعلى منها"
                                    : "ترث بنات الابن الثلثين لتعددهن وعدم وجود فرع أعلى منهن"));
                    quota = single ? Quota.HALF : Quota.FULL;
                }
                case HALF -> {
                    claims.add(ShareClaim.fixed(granddaughters, FixedShare.SIXTH,
                            "ترث بنت الابن السدس تكملة للثلثين"));
                    quota = Quota.FULL;
                }
                case FULL -> {
                    // القريب المبارك
                    if (hasPartner) {
                        claims.add(ShareClaim.residual(granddaughters, AsabaType.BY_ANOTHER,
                                "ترث بنت الابن تعصيبًا مع ابن الابن الأنزل منها بعد استكمال الثلثين"));
                    }
                }
            }
        }
        return claims;
    }
}
