package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.FixedShare;
import com.NTG.mawarith.Entity.Enum.ShareType;

import java.util.List;

/**
 * What one rule grants a group of heirs. A fixed share is split equally inside the group;
 * a residual claim joins the residue distribution of its rank.
 *
 * @param fixedShare the group's fard, {@code null} for a pure residual claim
 */
public record ShareClaim(
        List<ClassifiedHeir> heirs,
        ShareType shareType,
        FixedShare fixedShare,
        AsabaType asabaType,
        String reason
) {
    public ShareClaim {
        heirs = List.copyOf(heirs);
    }

    public static ShareClaim fixed(List<ClassifiedHeir> heirs, FixedShare share, String reason) {
        return new ShareClaim(heirs, ShareType.FIXED, share, AsabaType.NONE, reason);
    }

    public static ShareClaim residual(List<ClassifiedHeir> heirs, AsabaType asabaType, String reason) {
        return new ShareClaim(heirs, ShareType.RESIDUAL, null, asabaType, reason);
    }

    public static ShareClaim mixed(List<ClassifiedHeir> heirs, FixedShare share, String reason) {
        return new ShareClaim(heirs, ShareType.MIXED, share, AsabaType.BY_SELF, reason);
    }

    public boolean hasFixedPart() {
        return fixedShare != null;
    }

    public boolean hasResidualPart() {
        return shareType != ShareType.FIXED;
    }
}
