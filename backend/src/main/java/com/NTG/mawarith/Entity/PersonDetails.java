package com.NTG.mawarith.Entity;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.Religion;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Attributes supplied when a person is added to a {@link FamilyTree}.
 */
@Value
@Builder
public class PersonDetails {
    String name;
    @NonNull
    Gender gender;
    @Builder.Default
    boolean alive = true;
    @Builder.Default
    @NonNull
    Religion religion = Religion.ISLAM;

    public static PersonDetails male(String name) {
        return PersonDetails.builder().name(name).gender(Gender.MALE).build();
    }

    public static PersonDetails female(String name) {
        return PersonDetails.builder().name(name).gender(Gender.FEMALE).build();
    }
}
