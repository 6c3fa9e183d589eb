package com.NTG.mawarith.Entity;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.Religion;

public record Person(
    PersonId id,
    String name,
    Gender gender,
    boolean alive,
    Religion religion
) {
    public static Person from(PersonId id, PersonDetails details) {
        return new Person(id, details.getName(), details.getGender(), details.isAlive(), details.getReligion());
    }

    public boolean isMale() {
        return gender == Gender.MALE;
    }

    public String displayName() {
        return name == null || name.isBlank() ? id.toString() : name;
    }
}
