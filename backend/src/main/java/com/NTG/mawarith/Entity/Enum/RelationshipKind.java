package com.NTG.mawarith.Entity.Enum;

/**
 * Typed edges of the family tree. For {@link #PARENT} the first person of the pair is the
 * parent of the second; every other kind is symmetric.
 */
public enum RelationshipKind {
    PARENT,
    SPOUSE,
    FULL_SIBLING,
    PATERNAL_SIBLING,
    MATERNAL_SIBLING;

    public boolean isSibling() {
        return this == FULL_SIBLING || this == PATERNAL_SIBLING || this == MATERNAL_SIBLING;
    }
}
