package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.PersonId;

import java.util.List;

/**
 * A living, eligible relative with the single category their strongest relation gives them.
 * {@code degree} is the generational distance compared by nearer-excludes-farther rules.
 * {@code ancestry} lists the deceased's own ancestors the blood path climbs through, nearest
 * first: the father's brother has {@code [father]}, the father's father's mother has
 * {@code [father, grandfather]}. It is empty for spouses, descendants and the deceased's
 * siblings with their lines.
 */
public record ClassifiedHeir(
        PersonId personId,
        HeirType heirType,
        Gender gender,
        int degree,
        List<PersonId> ancestry
) {
    public ClassifiedHeir {
        ancestry = List.copyOf(ancestry);
    }

    public ClassifiedHeir(PersonId personId, HeirType heirType, Gender gender, int degree) {
        this(personId, heirType, gender, degree, List.of());
    }

    // للذكر مثل حظ الأنثيين
    public int residuaryUnits() {
        return gender == Gender.MALE ? 2 : 1;
    }

    /**
     * How many generations up the relation is rooted: 1 for the deceased's uncles and their
     * sons, 2 for the father's uncles and theirs.
     */
    public int ascent() {
        return ancestry.size();
    }

    public boolean connectsThrough(PersonId ancestor) {
        return ancestry.contains(ancestor);
    }
}
