package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MotherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.MOTHER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ClassifiedHeir> mother = c.heirs(HeirType.MOTHER);

        // ====== السدس ======
        if (c.hasDescendant() || c.countSiblingsIncludingExcluded() >= 2) {
            return List.of(ShareClaim.fixed(mother, FixedShare.SIXTH,
                    "ترث الأم السدس عند وجود الفرع الوارث أو عند وجود اثنين من الإخوة فأكثر"));
        }
        // ====== المسألة العمرية ======
        if (c.isUmariyyaCase()) {
            return List.of(ShareClaim.fixed(mother, FixedShare.THIRD_OF_REMAINDER,
                    "ترث الأم ثلث الباقي بعد نصيب الزوج/الزوجة (المسألة العمرية)"));
        }
        // ====== الثلث ======
        return List.of(ShareClaim.fixed(mother, FixedShare.THIRD,
                "ترث الأم الثلث لعدم وجود فرع وارث ولا جمع من الإخوة"));
    }
}
