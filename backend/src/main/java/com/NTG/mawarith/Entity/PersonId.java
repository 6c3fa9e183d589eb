package com.NTG.mawarith.Entity;

public record PersonId(long value) implements Comparable<PersonId> {

    public static PersonId of(long value) {
        return new PersonId(value);
    }

    @Override
    public int compareTo(PersonId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "P" + value;
    }
}
