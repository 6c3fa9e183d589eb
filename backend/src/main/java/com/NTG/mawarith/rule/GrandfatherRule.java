package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The grandfather stands in the father's place when the father is absent.
 */
@Component
public class GrandfatherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.GRANDFATHER) && !c.has(HeirType.FATHER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ClassifiedHeir> grandfather = c.heirs(HeirType.GRANDFATHER);

        if (c.hasMaleDescendant()) {
            return List.of(ShareClaim.fixed(grandfather, FixedShare.SIXTH,
                    "يرث الجد السدس فقط لوجود فرع وارث ذكر"));
        }
        if (c.hasFemaleDescendant()) {
            return List.of(ShareClaim.mixed(grandfather, FixedShare.SIXTH,
                    "يرث الجد السدس فرضًا والباقي تعصيبًا لوجود فرع وارث أنثى"));
        }
        return List.of(ShareClaim.residual(grandfather, AsabaType.BY_SELF,
                "يرث الجد الباقي تعصيبًا لعدم وجود الأب والفرع الوارث"));
    }
}
