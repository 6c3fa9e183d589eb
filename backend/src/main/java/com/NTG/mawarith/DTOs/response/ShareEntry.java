package com.NTG.mawarith.DTOs.response;

import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.Enum.ShareType;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.util.Fraction;

/**
 * One heir's final share.
 *
 * @param units the share expressed in units of the division's origin
 */
public record ShareEntry(
        PersonId personId,
        HeirType heirType,
        Fraction share,
        ShareType shareType,
        AsabaType asabaType,
        String reason,
        long units
) {
    public String label() {
        return heirType.getArabicName();
    }
}
