package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DistantKindredRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.DISTANT_KINDRED);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        return List.of(ShareClaim.residual(c.heirs(HeirType.DISTANT_KINDRED), AsabaType.NONE,
                "يرث ذوو الأرحام لعدم وجود صاحب فرض غير الزوجين ولا عاصب"));
    }
}
