package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.FamilyTreeDocument;
import com.NTG.mawarith.Entity.Enum.Religion;
import com.NTG.mawarith.Entity.FamilyTree;
import com.NTG.mawarith.Entity.Person;
import com.NTG.mawarith.Entity.PersonDetails;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.exceptionHandler.InvalidFamilyTreeException;
import com.NTG.mawarith.exceptionHandler.InvalidRelationshipException;
import com.NTG.mawarith.support.Engines;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.NTG.mawarith.Entity.Enum.Gender.FEMALE;
import static com.NTG.mawarith.Entity.Enum.Gender.MALE;
import static com.NTG.mawarith.Entity.Enum.RelationshipKind.FULL_SIBLING;
import static com.NTG.mawarith.Entity.Enum.RelationshipKind.PARENT;
import static com.NTG.mawarith.support.Trees.daughter;
import static com.NTG.mawarith.support.Trees.dead;
import static com.NTG.mawarith.support.Trees.deceasedMale;
import static com.NTG.mawarith.support.Trees.ofReligion;
import static com.NTG.mawarith.support.Trees.parentOf;
import static com.NTG.mawarith.support.Trees.siblingOf;
import static com.NTG.mawarith.support.Trees.spouseOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FamilyTreeJsonServiceTest {

    private final FamilyTreeJsonService jsonService = new FamilyTreeJsonService(new ObjectMapper());

    private FamilyTree sampleTree() {
        FamilyTree tree = new FamilyTree();
        PersonId deceased = deceasedMale(tree);
        spouseOf(tree, deceased, "Wife", FEMALE);
        parentOf(tree, deceased, "Mother", FEMALE);
        daughter(tree, deceased, "Daughter");
        siblingOf(tree, deceased, "Brother", MALE, FULL_SIBLING);
        PersonId deadSon = dead(tree, "Son", MALE);
        tree.addRelationship(deceased, deadSon, PARENT);
        PersonId convert = ofReligion(tree, "Grandson", MALE, Religion.CHRISTIANITY);
        tree.addRelationship(deadSon, convert, PARENT);
        return tree;
    }

    @Test
    void roundTripKeepsPersonsRelationshipsAndDeceased() {
        FamilyTree original = sampleTree();

        FamilyTree copy = jsonService.read(jsonService.write(original));

        assertThat(copy.persons()).isEqualTo(original.persons());
        assertThat(copy.relationships()).containsExactlyInAnyOrderElementsOf(original.relationships());
        assertThat(copy.deceased()).isEqualTo(original.deceased());
    }

    @Test
    void roundTripGivesTheSameDivision() {
        FamilyTree original = sampleTree();
        InheritanceCalculationService service = Engines.calculationService();

        FamilyTree copy = jsonService.read(jsonService.write(original));

        assertThat(service.divide(copy)).isEqualTo(service.divide(original));
    }

    @Test
    void newPersonsContinueAfterTheHighestReadId() {
        FamilyTree copy = jsonService.read(jsonService.write(sampleTree()));
        long highest = copy.persons().stream().mapToLong(p -> p.id().value()).max().orElseThrow();

        PersonId added = copy.addPerson(PersonDetails.male("Newcomer"));

        assertThat(added.value()).isGreaterThan(highest);
    }

    @Test
    void missingAliveAndReligionFallBackToDefaults() {
        String json = """
                {"deceased": 1,
                 "persons": [
                   {"id": 1, "name": "Deceased", "gender": "MALE", "alive": false},
                   {"id": 2, "name": "Son", "gender": "MALE"}
                 ],
                 "relationships": [{"from": 1, "to": 2, "kind": "PARENT"}]}
                """;

        FamilyTree tree = jsonService.read(json);

        Person son = tree.requirePerson(PersonId.of(2));
        assertThat(son.alive()).isTrue();
        assertThat(son.religion()).isEqualTo(Religion.ISLAM);
        assertThat(tree.children(PersonId.of(1))).containsExactly(PersonId.of(2));
    }

    @Test
    void documentWithoutDeceasedStaysOpen() {
        FamilyTreeDocument document = jsonService.toDocument(new FamilyTree());

        assertThat(document.deceased()).isNull();
        assertThat(jsonService.fromDocument(document).deceased()).isEmpty();
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> jsonService.read("{\"persons\": [")).isInstanceOf(InvalidFamilyTreeException.class);
        assertThatThrownBy(() -> jsonService.read("null")).isInstanceOf(InvalidFamilyTreeException.class);
    }

    @Test
    void rejectsPersonWithoutGender() {
        String json = """
                {"persons": [{"id": 1, "name": "Nobody"}]}
                """;

        assertThatThrownBy(() -> jsonService.read(json))
                .isInstanceOf(InvalidFamilyTreeException.class)
                .hasMessageContaining("gender");
    }

    @Test
    void rejectsRelationshipWithoutKind() {
        String json = """
                {"persons": [{"id": 1, "gender": "MALE"}, {"id": 2, "gender": "MALE"}],
                 "relationships": [{"from": 1, "to": 2}]}
                """;

        assertThatThrownBy(() -> jsonService.read(json)).isInstanceOf(InvalidFamilyTreeException.class);
    }

    @Test
    void rejectsUnknownDeceased() {
        String json = """
                {"deceased": 9, "persons": [{"id": 1, "gender": "FEMALE"}]}
                """;

        assertThatThrownBy(() -> jsonService.read(json)).isInstanceOf(InvalidFamilyTreeException.class);
    }

    @Test
    void rejectsDocumentWithAncestryCycle() {
        String json = """
                {"persons": [{"id": 1, "gender": "MALE"}, {"id": 2, "gender": "MALE"}, {"id": 3, "gender": "MALE"}],
                 "relationships": [
                   {"from": 1, "to": 2, "kind": "PARENT"},
                   {"from": 2, "to": 3, "kind": "PARENT"},
                   {"from": 3, "to": 1, "kind": "PARENT"}
                 ]}
                """;

        assertThatThrownBy(() -> jsonService.read(json)).isInstanceOf(InvalidRelationshipException.class);
    }
}
