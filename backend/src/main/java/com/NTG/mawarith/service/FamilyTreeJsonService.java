package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.FamilyTreeDocument;
import com.NTG.mawarith.DTOs.FamilyTreeDocument.PersonDocument;
import com.NTG.mawarith.DTOs.FamilyTreeDocument.RelationshipDocument;
import com.NTG.mawarith.Entity.Enum.Religion;
import com.NTG.mawarith.Entity.FamilyTree;
import com.NTG.mawarith.Entity.Person;
import com.NTG.mawarith.Entity.PersonDetails;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.exceptionHandler.InvalidFamilyTreeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Saves and restores family trees as JSON documents. Restoring replays every person and
 * edge through the tree API, so a malformed document fails with the same errors as a bad edit.
 */
@Service
@RequiredArgsConstructor
public class FamilyTreeJsonService {

    private final ObjectMapper objectMapper;

    public String write(FamilyTree tree) {
        try {
            return objectMapper.writeValueAsString(toDocument(tree));
        } catch (JsonProcessingException e) {
            throw new InvalidFamilyTreeException("Could not write family tree", e);
        }
    }

    public FamilyTree read(String json) {
        FamilyTreeDocument document;
        try {
            document = objectMapper.readValue(json, FamilyTreeDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidFamilyTreeException("Malformed family tree document: " + e.getOriginalMessage(), e);
        }
        return fromDocument(document);
    }

    public FamilyTreeDocument toDocument(FamilyTree tree) {
        FamilyTree snapshot = tree.snapshot();
        List<PersonDocument> persons = snapshot.persons().stream()
                .map(FamilyTreeJsonService::toDocument)
                .toList();
        List<RelationshipDocument> relationships = snapshot.relationships().stream()
                .map(r -> new RelationshipDocument(r.from().value(), r.to().value(), r.kind()))
                .toList();
        Long deceased = snapshot.deceased().map(PersonId::value).orElse(null);
        return new FamilyTreeDocument(deceased, persons, relationships);
    }

    public FamilyTree fromDocument(FamilyTreeDocument document) {
        if (document == null) {
            throw new InvalidFamilyTreeException("Family tree document is empty");
        }
        FamilyTree tree = new FamilyTree();

        for (PersonDocument person : nullToEmpty(document.persons())) {
            if (person.gender() == null) {
                throw new InvalidFamilyTreeException("Person " + PersonId.of(person.id()) + " has no gender");
            }
            tree.addPerson(PersonId.of(person.id()), PersonDetails.builder()
                    .name(person.name())
                    .gender(person.gender())
                    .alive(person.alive() == null || person.alive())
                    .religion(person.religion() == null ? Religion.ISLAM : person.religion())
                    .build());
        }
        for (RelationshipDocument relationship : nullToEmpty(document.relationships())) {
            if (relationship.kind() == null) {
                throw new InvalidFamilyTreeException("Relationship " + PersonId.of(relationship.from())
                        + " -> " + PersonId.of(relationship.to()) + " has no kind");
            }
            tree.addRelationship(PersonId.of(relationship.from()), PersonId.of(relationship.to()), relationship.kind());
        }
        if (document.deceased() != null) {
            tree.setDeceased(PersonId.of(document.deceased()));
        }
        return tree;
    }

    private static PersonDocument toDocument(Person person) {
        return new PersonDocument(person.id().value(), person.name(), person.gender(), person.alive(), person.religion());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
