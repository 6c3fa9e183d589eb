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

@Component
public class PaternalSiblingsRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.PATERNAL_BROTHER) || c.has(HeirType.PATERNAL_SISTER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        List<ClassifiedHeir> brothers = c.heirs(HeirType.PATERNAL_BROTHER);
        List<ClassifiedHeir> sisters = c.heirs(HeirType.PATERNAL_SISTER);
        List<ShareClaim> claims = new ArrayList<>();

        if (!brothers.isEmpty()) {
            claims.add(ShareClaim.residual(brothers, AsabaType.BY_SELF,
                    "يرث الإخوة لأب الباقي تعصيبًا"));
            if (!sisters.isEmpty()) {
                claims.add(ShareClaim.residual(sisters, AsabaType.BY_ANOTHER,
                        "ترث الأخت لأب تعصيبًا مع أخيها للذكر مثل حظ الأنثيين"));
            }
            return claims;
        }

        if (c.hasFemaleDescendant()) {
            claims.add(ShareClaim.residual(sisters, AsabaType.WITH_ANOTHER,
                    "ترث الأخت لأب الباقي تعصيبًا مع البنت أو بنت الابن"));
            return claims;
        }

        if (c.count(HeirType.FULL_SISTER) == 1) {
            claims.add(ShareClaim.fixed(sisters, FixedShare.SIXTH,
                    "ترث الأخت لأب السدس مع الأخت الشقيقة تكملة للثلثين"));
        } else if (sisters.size() == 1) {
            claims.add(ShareClaim.fixed(sisters, FixedShare.HALF,
                    "ترث الأخت لأب النصف لانفرادها"));
        } else {
            claims.add(ShareClaim.fixed(sisters, FixedShare.TWO_THIRDS,
                    "ترث الأختان لأب فأكثر الثلثين"));
        }
        return claims;
    }
}
