package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MaternalSiblingsRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.MATERNAL_BROTHER) || c.has(HeirType.MATERNAL_SISTER);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        // الذكر والأنثى سواء
        List<ClassifiedHeir> siblings = c.heirs(HeirType.MATERNAL_BROTHER, HeirType.MATERNAL_SISTER);

        if (siblings.size() == 1) {
            return List.of(ShareClaim.fixed(siblings, FixedShare.SIXTH,
                    "يرث الأخ أو الأخت لأم السدس لانفراده"));
        }
        return List.of(ShareClaim.fixed(siblings, FixedShare.THIRD,
                "يشترك الإخوة لأم في الثلث بالتساوي"));
    }
}
