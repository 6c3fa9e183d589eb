package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.util.Fraction;

import java.util.List;

/**
 * Shares before awl or radd. {@code residuaryPresent} is true when any heir took part in
 * the residue distribution, even if the residue turned out to be zero.
 */
public record RawShares(
        List<RawShare> shares,
        boolean residuaryPresent
) {
    public RawShares {
        shares = List.copyOf(shares);
    }

    public Fraction fixedTotal() {
        return shares.stream().map(RawShare::fixed).reduce(Fraction.ZERO, Fraction::add);
    }

    public Fraction total() {
        return shares.stream().map(RawShare::total).reduce(Fraction.ZERO, Fraction::add);
    }

    // عصبة لم يبق لها شيء
    public List<PersonId> exhausted() {
        return shares.stream()
                .filter(s -> s.isResiduary() && s.total().isZero())
                .map(s -> s.heir().personId())
                .toList();
    }
}
