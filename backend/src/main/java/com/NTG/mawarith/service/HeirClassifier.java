package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.ClassificationResult;
import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.Enum.IneligibilityReason;
import com.NTG.mawarith.Entity.Enum.RelationshipKind;
import com.NTG.mawarith.Entity.FamilyTree;
import com.NTG.mawarith.Entity.Person;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.config.MawarithProperties;
import com.NTG.mawarith.exceptionHandler.InvalidFamilyTreeException;
import com.NTG.mawarith.exceptionHandler.UnclassifiablePersonException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Gives every relative of the deceased a single heir category, or the reason they cannot
 * inherit. A relative reached by several paths keeps the strongest relation: lowest tier
 * first, then the lowest degree.
 *
 * <p>Degrees: descendants and ancestors count generations from the deceased, uncles count
 * the generations up to the ancestor they are a brother of, nephews and cousins count
 * generations below their brother or uncle, and distant kindred count every parent/child
 * step of the blood path.
 */
@Component
@RequiredArgsConstructor
public class HeirClassifier {

    private final MawarithProperties properties;

    private enum Line { ALL_MALE, FEMALE_TAIL, BROKEN }

    private record Candidate(HeirType type, int degree, List<PersonId> ancestry) {
        boolean beats(Candidate other) {
            if (type.getTier() != other.type.getTier()) {
                return type.getTier() < other.type.getTier();
            }
            return degree < other.degree;
        }
    }

    public ClassificationResult classify(FamilyTree tree) {
        PersonId deceasedId = tree.deceased()
                .orElseThrow(() -> new InvalidFamilyTreeException("The family tree has no deceased"));
        Person deceased = tree.requirePerson(deceasedId);

        Map<PersonId, Candidate> best = new HashMap<>();
        Map<PersonId, List<PersonId>> ancestors = new HashMap<>();

        for (PersonId spouse : tree.spouses(deceasedId)) {
            offer(best, spouse, tree.requirePerson(spouse).isMale() ? HeirType.HUSBAND : HeirType.WIFE, 0, List.of());
        }
        walkDescendants(tree, best, deceasedId, 0, true);
        walkAncestors(tree, best, ancestors, deceasedId, List.of(), Line.ALL_MALE, null);
        classifySiblings(tree, best, deceasedId);

        // أي قريب آخر من جهة الأصول فهو من ذوي الأرحام
        ancestors.forEach((ancestor, climbed) -> walkKindred(tree, best, ancestor, climbed));
        best.remove(deceasedId);

        List<ClassifiedHeir> heirs = new ArrayList<>();
        Map<PersonId, IneligibilityReason> ineligible = new TreeMap<>();
        Set<PersonId> reachable = tree.reachableFrom(deceasedId);

        for (Person person : tree.persons()) {
            PersonId id = person.id();
            if (id.equals(deceasedId)) {
                continue;
            }
            if (!reachable.contains(id)) {
                throw new UnclassifiablePersonException(id,
                        person.displayName() + " is not connected to the deceased " + deceased.displayName());
            }

            Candidate candidate = best.get(id);
            if (!person.alive()) {
                ineligible.put(id, IneligibilityReason.PREDECEASED);
            } else if (properties.isReligionImpediment() && person.religion() != deceased.religion()) {
                ineligible.put(id, IneligibilityReason.DIFFERENT_RELIGION);
            } else if (candidate == null) {
                ineligible.put(id, IneligibilityReason.AFFINITY);
            } else {
                heirs.add(new ClassifiedHeir(id, candidate.type(), person.gender(), candidate.degree(), candidate.ancestry()));
            }
        }

        heirs.sort(Comparator.comparing(ClassifiedHeir::heirType).thenComparing(ClassifiedHeir::personId));
        return new ClassificationResult(deceasedId, heirs, ineligible);
    }

    // ==================== الفروع ====================

    private void walkDescendants(FamilyTree tree, Map<PersonId, Candidate> best,
                                 PersonId node, int generation, boolean agnatic) {
        for (PersonId child : tree.children(node)) {
            boolean male = tree.requirePerson(child).isMale();
            int degree = generation + 1;
            HeirType type;
            if (generation == 0) {
                type = male ? HeirType.SON : HeirType.DAUGHTER;
            } else if (agnatic) {
                type = male ? HeirType.SON_OF_SON : HeirType.DAUGHTER_OF_SON;
            } else {
                type = HeirType.DISTANT_KINDRED;
            }
            offer(best, child, type, degree, List.of());
            walkDescendants(tree, best, child, degree, agnatic && male);
        }
    }

    // ==================== الأصول ====================

    /**
     * {@code climbed} is the chain of ancestors from the deceased up to {@code node}, nearest
     * first; it is empty while {@code node} is the deceased.
     */
    private void walkAncestors(FamilyTree tree, Map<PersonId, Candidate> best, Map<PersonId, List<PersonId>> ancestors,
                               PersonId node, List<PersonId> climbed, Line line, Boolean paternalSide) {
        tree.father(node).ifPresent(father -> {
            Line next = line == Line.ALL_MALE ? Line.ALL_MALE : Line.BROKEN;
            boolean side = paternalSide == null || paternalSide;
            visitAncestor(tree, best, ancestors, father, climbed, next, side);
        });
        tree.mother(node).ifPresent(mother -> {
            Line next = line == Line.BROKEN ? Line.BROKEN : Line.FEMALE_TAIL;
            boolean side = paternalSide != null && paternalSide;
            visitAncestor(tree, best, ancestors, mother, climbed, next, side);
        });
    }

    private void visitAncestor(FamilyTree tree, Map<PersonId, Candidate> best, Map<PersonId, List<PersonId>> ancestors,
                               PersonId ancestor, List<PersonId> below, Line line, boolean paternalSide) {
        int degree = below.size() + 1;
        HeirType type;
        if (degree == 1) {
            type = tree.requirePerson(ancestor).isMale() ? HeirType.FATHER : HeirType.MOTHER;
        } else if (line == Line.ALL_MALE) {
            type = HeirType.GRANDFATHER;
        } else if (line == Line.FEMALE_TAIL) {
            // جدة صحيحة: لا يتوسط بينها وبين الميت ذكر بين أنثيين
            type = paternalSide ? HeirType.GRANDMOTHER_PATERNAL : HeirType.GRANDMOTHER_MATERNAL;
        } else {
            type = HeirType.DISTANT_KINDRED;
        }
        offer(best, ancestor, type, degree, below);

        List<PersonId> climbed = new ArrayList<>(below);
        climbed.add(ancestor);
        ancestors.merge(ancestor, climbed, (kept, found) -> found.size() < kept.size() ? found : kept);

        classifyAncestorSiblings(tree, best, ancestor, climbed, line);
        walkAncestors(tree, best, ancestors, ancestor, climbed, line, paternalSide);
    }

    // ==================== الحواشي ====================

    private void classifySiblings(FamilyTree tree, Map<PersonId, Candidate> best, PersonId deceasedId) {
        tree.siblings(deceasedId).forEach((sibling, kind) -> {
            boolean male = tree.requirePerson(sibling).isMale();
            HeirType type = switch (kind) {
                case FULL_SIBLING -> male ? HeirType.FULL_BROTHER : HeirType.FULL_SISTER;
                case PATERNAL_SIBLING -> male ? HeirType.PATERNAL_BROTHER : HeirType.PATERNAL_SISTER;
                default -> male ? HeirType.MATERNAL_BROTHER : HeirType.MATERNAL_SISTER;
            };
            offer(best, sibling, type, 1, List.of());

            HeirType nephew = null;
            if (male && kind == RelationshipKind.FULL_SIBLING) {
                nephew = HeirType.SON_OF_FULL_BROTHER;
            } else if (male && kind == RelationshipKind.PATERNAL_SIBLING) {
                nephew = HeirType.SON_OF_PATERNAL_BROTHER;
            }
            walkCollateralLine(tree, best, sibling, nephew, 2, 0, true, List.of());
        });
    }

    /**
     * Brothers of an all-male-line ancestor are agnatic uncles of the matching depth: the
     * father's brothers, then the grandfather's, and so on. Their male lines are cousins.
     * Every other sibling of an ancestor is distant kindred.
     */
    private void classifyAncestorSiblings(FamilyTree tree, Map<PersonId, Candidate> best, PersonId ancestor,
                                          List<PersonId> climbed, Line line) {
        int rootDistance = climbed.size() + 2;
        tree.siblings(ancestor).forEach((sibling, kind) -> {
            boolean agnatic = line == Line.ALL_MALE && tree.requirePerson(sibling).isMale();
            if (agnatic && kind == RelationshipKind.FULL_SIBLING) {
                offer(best, sibling, HeirType.FULL_UNCLE, climbed.size(), climbed);
                walkCollateralLine(tree, best, sibling, HeirType.SON_OF_FULL_UNCLE, rootDistance, 0, true, climbed);
            } else if (agnatic && kind == RelationshipKind.PATERNAL_SIBLING) {
                offer(best, sibling, HeirType.PATERNAL_UNCLE, climbed.size(), climbed);
                walkCollateralLine(tree, best, sibling, HeirType.SON_OF_PATERNAL_UNCLE, rootDistance, 0, true, climbed);
            } else {
                offer(best, sibling, HeirType.DISTANT_KINDRED, rootDistance, climbed);
                walkCollateralLine(tree, best, sibling, null, rootDistance, 0, false, climbed);
            }
        });
    }

    /**
     * Descendants of a collateral root. The all-male line gets {@code agnaticType} with the
     * degree counted below the root; everyone else is distant kindred.
     */
    private void walkCollateralLine(FamilyTree tree, Map<PersonId, Candidate> best, PersonId node,
                                    HeirType agnaticType, int rootDistance, int generation, boolean agnatic,
                                    List<PersonId> ancestry) {
        for (PersonId child : tree.children(node)) {
            boolean male = tree.requirePerson(child).isMale();
            int degree = generation + 1;
            boolean childAgnatic = agnatic && male && agnaticType != null;
            if (childAgnatic) {
                offer(best, child, agnaticType, degree, ancestry);
            } else {
                offer(best, child, HeirType.DISTANT_KINDRED, rootDistance + degree, ancestry);
            }
            walkCollateralLine(tree, best, child, agnaticType, rootDistance, degree, childAgnatic, ancestry);
        }
    }

    private void walkKindred(FamilyTree tree, Map<PersonId, Candidate> best, PersonId ancestor, List<PersonId> climbed) {
        for (PersonId descendant : tree.descendants(ancestor)) {
            int generations = generationsBelow(tree, ancestor, descendant);
            offer(best, descendant, HeirType.DISTANT_KINDRED, climbed.size() + generations, climbed);
        }
    }

    private int generationsBelow(FamilyTree tree, PersonId ancestor, PersonId descendant) {
        int shortest = Integer.MAX_VALUE;
        for (PersonId parent : tree.parents(descendant)) {
            if (parent.equals(ancestor)) {
                return 1;
            }
            if (tree.isAncestor(ancestor, parent)) {
                shortest = Math.min(shortest, generationsBelow(tree, ancestor, parent) + 1);
            }
        }
        return shortest;
    }

    private void offer(Map<PersonId, Candidate> best, PersonId id, HeirType type, int degree, List<PersonId> ancestry) {
        Candidate candidate = new Candidate(type, degree, ancestry);
        Candidate current = best.get(id);
        if (current == null || candidate.beats(current)) {
            best.put(id, candidate);
        }
    }
}
