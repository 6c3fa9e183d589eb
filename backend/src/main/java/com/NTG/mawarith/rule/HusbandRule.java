package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HusbandRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.HUSBAND);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        if (c.hasDescendant()) {
            return List.of(ShareClaim.fixed(c.heirs(HeirType.HUSBAND), FixedShare.QUARTER,
                    "يرث الزوج الربع لوجود فرع وارث"));
        }
        return List.of(ShareClaim.fixed(c.heirs(HeirType.HUSBAND), FixedShare.HALF,
                "يرث الزوج النصف لعدم وجود فرع وارث"));
    }
}
