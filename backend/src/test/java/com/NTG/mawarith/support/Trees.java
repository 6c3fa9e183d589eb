package com.NTG.mawarith.support;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.RelationshipKind;
import com.NTG.mawarith.Entity.Enum.Religion;
import com.NTG.mawarith.Entity.FamilyTree;
import com.NTG.mawarith.Entity.PersonDetails;
import com.NTG.mawarith.Entity.PersonId;

/**
 * Shorthand for building family trees in tests.
 */
public final class Trees {

    private Trees() {
    }

    public static PersonId male(FamilyTree tree, String name) {
        return tree.addPerson(PersonDetails.male(name));
    }

    public static PersonId female(FamilyTree tree, String name) {
        return tree.addPerson(PersonDetails.female(name));
    }

    public static PersonId dead(FamilyTree tree, String name, Gender gender) {
        return tree.addPerson(PersonDetails.builder().name(name).gender(gender).alive(false).build());
    }

    public static PersonId ofReligion(FamilyTree tree, String name, Gender gender, Religion religion) {
        return tree.addPerson(PersonDetails.builder().name(name).gender(gender).religion(religion).build());
    }

    public static PersonId deceasedMale(FamilyTree tree) {
        PersonId id = dead(tree, "Deceased", Gender.MALE);
        tree.setDeceased(id);
        return id;
    }

    public static PersonId deceasedFemale(FamilyTree tree) {
        PersonId id = dead(tree, "Deceased", Gender.FEMALE);
        tree.setDeceased(id);
        return id;
    }

    public static PersonId childOf(FamilyTree tree, PersonId parent, String name, Gender gender) {
        PersonId child = tree.addPerson(PersonDetails.builder().name(name).gender(gender).build());
        tree.addRelationship(parent, child, RelationshipKind.PARENT);
        return child;
    }

    public static PersonId son(FamilyTree tree, PersonId parent, String name) {
        return childOf(tree, parent, name, Gender.MALE);
    }

    public static PersonId daughter(FamilyTree tree, PersonId parent, String name) {
        return childOf(tree, parent, name, Gender.FEMALE);
    }

    public static PersonId parentOf(FamilyTree tree, PersonId child, String name, Gender gender) {
        PersonId parent = tree.addPerson(PersonDetails.builder().name(name).gender(gender).build());
        tree.addRelationship(parent, child, RelationshipKind.PARENT);
        return parent;
    }

    public static PersonId spouseOf(FamilyTree tree, PersonId person, String name, Gender gender) {
        PersonId spouse = tree.addPerson(PersonDetails.builder().name(name).gender(gender).build());
        tree.addRelationship(person, spouse, RelationshipKind.SPOUSE);
        return spouse;
    }

    public static PersonId siblingOf(FamilyTree tree, PersonId person, String name, Gender gender, RelationshipKind kind) {
        PersonId sibling = tree.addPerson(PersonDetails.builder().name(name).gender(gender).build());
        tree.addRelationship(person, sibling, kind);
        return sibling;
    }
}
