package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FatherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.FATHER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ClassifiedHeir> father = c.heirs(HeirType.FATHER);

        if (c.hasMaleDescendant()) {
            return List.of(ShareClaim.fixed(father, FixedShare.SIXTH,
                    "يرث الأب السدس فقط لوجود فرع وارث ذكر"));
        }
        if (c.hasFemaleDescendant()) {
            return List.of(ShareClaim.mixed(father, FixedShare.SIXTH,
                    "يرث الأب السدس فرضًا والباقي تعصيبًا لوجود فرع وارث أنثى"));
        }
        return List.of(ShareClaim.residual(father, AsabaType.BY_SELF,
                "يرث الأب الباقي تعصيبًا لعدم وجود فرع وارث"));
    }
}
