package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GrandmotherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(HeirType.GRANDMOTHER_PATERNAL) || c.has(HeirType.GRANDMOTHER_MATERNAL);
    }

    @Override
    public List<ShareClaim> calculate(InheritanceCase c) {
        return List.of(ShareClaim.fixed(
                c.heirs(HeirType.GRANDMOTHER_PATERNAL, HeirType.GRANDMOTHER_MATERNAL),
                FixedShare.SIXTH,
                "ترث الجدة السدس، وتشترك فيه الجدات المتساويات في الدرجة"));
    }
}
