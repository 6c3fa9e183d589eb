package com.NTG.mawarith.Entity;

import com.NTG.mawarith.Entity.Enum.RelationshipKind;

/**
 * A declared edge. For {@link RelationshipKind#PARENT} {@code from} is the parent.
 */
public record Relationship(PersonId from, PersonId to, RelationshipKind kind) {}
