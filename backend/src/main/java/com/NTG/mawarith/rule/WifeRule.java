package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WifeRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.WIFE);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        // الزوجات يشتركن في فرض واحد
        if (c.hasDescendant()) {
            return List.of(ShareClaim.fixed(c.heirs(HeirType.WIFE), FixedShare.EIGHTH,
                    "ترث الزوجة الثمن لوجود فرع وارث"));
        }
        return List.of(ShareClaim.fixed(c.heirs(HeirType.WIFE), FixedShare.QUARTER,
                "ترث الزوجة الربع لعدم وجود فرع وارث"));
    }
}
