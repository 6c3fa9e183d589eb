package com.NTG.mawarith.DTOs.response;

import com.NTG.mawarith.DTOs.Exclusion;
import com.NTG.mawarith.Entity.Enum.Adjustment;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.util.Fraction;

import java.util.List;
import java.util.Optional;

/**
 * The final division of an estate.
 *
 * @param origin     asl al-mas'ala, the common denominator of every share
 * @param fixedTotal the sum of the fixed shares before awl or radd
 * @param exhausted  residuaries that received nothing
 */
public record EstateDivision(
        List<ShareEntry> entries,
        Adjustment adjustment,
        long origin,
        Fraction fixedTotal,
        List<Exclusion> exclusions,
        List<PersonId> exhausted
) {
    public EstateDivision {
        entries = List.copyOf(entries);
        exclusions = List.copyOf(exclusions);
        exhausted = List.copyOf(exhausted);
    }

    public Optional<ShareEntry> entry(PersonId id) {
        return entries.stream().filter(e -> e.personId().equals(id)).findFirst();
    }

    public Fraction shareOf(PersonId id) {
        return entry(id).map(ShareEntry::share).orElse(Fraction.ZERO);
    }

    public Fraction total() {
        return entries.stream().map(ShareEntry::share).reduce(Fraction.ZERO, Fraction::add);
    }

    public boolean isExcluded(PersonId id) {
        return exclusions.stream().anyMatch(e -> e.personId().equals(id));
    }
}
