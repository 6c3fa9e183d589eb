package com.NTG.mawarith.DTOs;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.RelationshipKind;
import com.NTG.mawarith.Entity.Enum.Religion;

import java.util.List;

/**
 * JSON form of a family tree. Persons keep their ids so edges and the deceased marker can
 * refer to them.
 */
public record FamilyTreeDocument(
        Long deceased,
        List<PersonDocument> persons,
        List<RelationshipDocument> relationships
) {
    public record PersonDocument(
            long id,
            String name,
            Gender gender,
            Boolean alive,
            Religion religion
    ) {
    }

    public record RelationshipDocument(
            long from,
            long to,
            RelationshipKind kind
    ) {
    }
}
