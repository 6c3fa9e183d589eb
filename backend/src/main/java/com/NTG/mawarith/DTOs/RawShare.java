package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.ShareType;
import com.NTG.mawarith.util.Fraction;

public record RawShare(
        ClassifiedHeir heir,
        ShareType shareType,
        Fraction fixed,
        Fraction residual,
        AsabaType asabaType,
        String reason
) {
    public Fraction total() {
        return fixed.add(residual);
    }

    public boolean isResiduary() {
        return shareType != ShareType.FIXED;
    }
}
