package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Brothers' sons, uncles and uncles' sons. They only ever take the residue.
 */
@Component
public class AgnaticCollateralRule implements InheritanceRule {

    private static final List<HeirType> COLLATERALS = List.of(
            HeirType.SON_OF_FULL_BROTHER,
            HeirType.SON_OF_PATERNAL_BROTHER,
            HeirType.FULL_UNCLE,
            HeirType.PATERNAL_UNCLE,
            HeirType.SON_OF_FULL_UNCLE,
            HeirType.SON_OF_PATERNAL_UNCLE
    );

    @Override
    public boolean canApply(InheritanceCase c) {
        return COLLATERALS.stream().anyMatch(c::has);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        return COLLATERALS.stream()
                .filter(c::has)
                .map(type -> ShareClaim.residual(c.heirs(type), AsabaType.BY_SELF,
                        "يرث " + type.getArabicName() + " الباقي تعصيبًا"))
                .toList();
    }
}
