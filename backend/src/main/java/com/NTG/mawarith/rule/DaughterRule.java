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
public class DaughterRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.DAUGHTER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ClassifiedHeir> daughters = c.heirs(HeirType.DAUGHTER);

        if (c.has(HeirType.SON)) {
            // مع وجود ابن: تعصيب بالغير
            return List.of(ShareClaim.residual(daughters, AsabaType.BY_ANOTHER,
                    "ترث البنت تعصيبًا مع الابن للذكر مثل حظ الأنثيين"));
        }
        if (daughters.size() == 1) {
            return List.of(ShareClaim.fixed(daughters, FixedShare.HALF,
                    "ترث البنت النصف فرضًا لانفرادها وعدم وجود ابن"));
        }
        return List.of(ShareClaim.fixed(daughters, FixedShare.TWO_THIRDS,
                "ترث البنتان فأكثر الثلثين فرضًا لعدم وجود ابن"));
    }
}
