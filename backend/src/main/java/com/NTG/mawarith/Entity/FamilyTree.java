package com.NTG.mawarith.Entity;

import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.Enum.RelationshipKind;
import com.NTG.mawarith.exceptionHandler.InvalidFamilyTreeException;
import com.NTG.mawarith.exceptionHandler.InvalidRelationshipException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The deceased and every declared relative, linked by typed edges.
 *
 * <p>Each instance is self-contained. Edits are checked against the current state and
 * serialised on the instance, so a rejected edit never leaves a partial change behind.
 * {@link #snapshot()} returns a frozen copy that the calculation reads while the caller
 * keeps editing the original.
 */
public class FamilyTree {

    private final Map<PersonId, Person> persons = new TreeMap<>();
    private final Map<PersonId, PersonId> fathers = new TreeMap<>();
    private final Map<PersonId, PersonId> mothers = new TreeMap<>();
    private final Map<PersonId, Set<PersonId>> children = new TreeMap<>();
    private final Map<PersonId, Set<PersonId>> spouses = new TreeMap<>();
    private final Map<PersonId, Map<PersonId, RelationshipKind>> declaredSiblings = new TreeMap<>();
    private final boolean frozen;
    private PersonId deceased;
    private long nextId = 1;

    public FamilyTree() {
        this.frozen = false;
    }

    private FamilyTree(FamilyTree source) {
        this.frozen = true;
        this.persons.putAll(source.persons);
        this.fathers.putAll(source.fathers);
        this.mothers.putAll(source.mothers);
        source.children.forEach((id, set) -> this.children.put(id, new TreeSet<>(set)));
        source.spouses.forEach((id, set) -> this.spouses.put(id, new TreeSet<>(set)));
        source.declaredSiblings.forEach((id, map) -> this.declaredSiblings.put(id, new TreeMap<>(map)));
        this.deceased = source.deceased;
        this.nextId = source.nextId;
    }

    // ==================== التعديل ====================

    public synchronized PersonId addPerson(PersonDetails details) {
        checkEditable();
        PersonId id = new PersonId(nextId++);
        while (persons.containsKey(id)) {
            id = new PersonId(nextId++);
        }
        persons.put(id, Person.from(id, details));
        return id;
    }

    /**
     * Adds a person under a caller-chosen id, used when a stored tree is rebuilt.
     */
    public synchronized PersonId addPerson(PersonId id, PersonDetails details) {
        checkEditable();
        if (persons.containsKey(id)) {
            throw new InvalidFamilyTreeException("Duplicate person id " + id);
        }
        persons.put(id, Person.from(id, details));
        nextId = Math.max(nextId, id.value() + 1);
        return id;
    }

    public synchronized void setDeceased(PersonId id) {
        checkEditable();
        if (!persons.containsKey(id)) {
            throw new InvalidFamilyTreeException("Unknown person " + id + " cannot be the deceased");
        }
        deceased = id;
    }

    public synchronized void addRelationship(PersonId a, PersonId b, RelationshipKind kind) {
        checkEditable();
        Person first = requirePerson(a);
        Person second = requirePerson(b);
        if (a.equals(b)) {
            throw new InvalidRelationshipException(first.displayName() + " cannot be related to themselves");
        }
        if (isAlreadyDeclared(a, b, kind)) {
            return;
        }

        switch (kind) {
            case PARENT -> addParent(first, second);
            case SPOUSE -> addSpouse(first, second);
            case FULL_SIBLING, PATERNAL_SIBLING, MATERNAL_SIBLING -> addSibling(first, second, kind);
        }
    }

    private boolean isAlreadyDeclared(PersonId a, PersonId b, RelationshipKind kind) {
        boolean aParentOfB = isParentOf(a, b);
        boolean bParentOfA = isParentOf(b, a);
        boolean married = spousesOf(a).contains(b);
        RelationshipKind siblingKind = declaredSiblings.getOrDefault(a, Map.of()).get(b);

        if (kind == RelationshipKind.PARENT && aParentOfB) return true;
        if (kind == RelationshipKind.SPOUSE && married) return true;
        if (kind.isSibling() && kind == siblingKind) return true;

        if (aParentOfB || bParentOfA) {
            throw new InvalidRelationshipException(describe(a, b) + " are already declared parent and child");
        }
        if (married) {
            throw new InvalidRelationshipException(describe(a, b) + " are already declared spouses");
        }
        if (siblingKind != null) {
            throw new InvalidRelationshipException(describe(a, b) + " are already declared " + siblingKind);
        }
        return false;
    }

    private void addParent(Person parent, Person child) {
        PersonId p = parent.id();
        PersonId c = child.id();
        if (ancestorsOf(p).contains(c)) {
            throw new InvalidRelationshipException(
                    child.displayName() + " would become their own ancestor through " + parent.displayName());
        }

        Map<PersonId, PersonId> side = parent.gender() == Gender.MALE ? fathers : mothers;
        PersonId current = side.get(c);
        if (current != null && !current.equals(p)) {
            throw new InvalidRelationshipException(child.displayName() + " already has a "
                    + (parent.gender() == Gender.MALE ? "father" : "mother") + ": " + persons.get(current).displayName());
        }

        PersonId newFather = parent.gender() == Gender.MALE ? p : fathers.get(c);
        PersonId newMother = parent.gender() == Gender.FEMALE ? p : mothers.get(c);
        for (Map.Entry<PersonId, RelationshipKind> sibling : declaredSiblings.getOrDefault(c, Map.of()).entrySet()) {
            PersonId s = sibling.getKey();
            if (!parentsAgree(sibling.getValue(), newFather, newMother, fathers.get(s), mothers.get(s))) {
                throw new InvalidRelationshipException(parent.displayName() + " as parent of " + child.displayName()
                        + " contradicts the declared " + sibling.getValue() + " " + persons.get(s).displayName());
            }
        }

        Set<PersonId> newAncestors = new TreeSet<>(ancestorsOf(p));
        newAncestors.add(p);
        Set<PersonId> subtree = new TreeSet<>(descendantsOf(c));
        subtree.add(c);
        for (PersonId member : subtree) {
            for (PersonId partner : spousesOf(member)) {
                if (newAncestors.contains(partner)) {
                    throw new InvalidRelationshipException(describe(member, partner)
                            + " are spouses and cannot become lineal relatives");
                }
            }
            for (PersonId sibling : declaredSiblings.getOrDefault(member, Map.of()).keySet()) {
                if (newAncestors.contains(sibling)) {
                    throw new InvalidRelationshipException(describe(member, sibling)
                            + " are siblings and cannot become lineal relatives");
                }
            }
        }

        side.put(c, p);
        children.computeIfAbsent(p, k -> new TreeSet<>()).add(c);
    }

    private void addSpouse(Person a, Person b) {
        if (a.gender() == b.gender()) {
            throw new InvalidRelationshipException("Spouses must be of opposite gender: " + describe(a.id(), b.id()));
        }
        if (isLineal(a.id(), b.id())) {
            throw new InvalidRelationshipException(describe(a.id(), b.id()) + " are lineal relatives and cannot be spouses");
        }
        if (siblingKindOf(a.id(), b.id()).isPresent()) {
            throw new InvalidRelationshipException(describe(a.id(), b.id()) + " are siblings and cannot be spouses");
        }
        Person wife = a.gender() == Gender.FEMALE ? a : b;
        Person husband = a.gender() == Gender.MALE ? a : b;
        // الحد يسري على الأزواج الأحياء فقط
        if (husband.alive() && livingSpouses(wife.id()) >= HeirType.HUSBAND.getMaxAllowed()) {
            throw new InvalidRelationshipException(wife.displayName() + " already has a living husband");
        }
        if (wife.alive() && livingSpouses(husband.id()) >= HeirType.WIFE.getMaxAllowed()) {
            throw new InvalidRelationshipException(husband.displayName() + " already has "
                    + HeirType.WIFE.getMaxAllowed() + " living wives");
        }

        spouses.computeIfAbsent(a.id(), k -> new TreeSet<>()).add(b.id());
        spouses.computeIfAbsent(b.id(), k -> new TreeSet<>()).add(a.id());
    }

    private void addSibling(Person a, Person b, RelationshipKind kind) {
        if (isLineal(a.id(), b.id())) {
            throw new InvalidRelationshipException(describe(a.id(), b.id()) + " are lineal relatives and cannot be siblings");
        }
        if (!parentsAgree(kind, fathers.get(a.id()), mothers.get(a.id()), fathers.get(b.id()), mothers.get(b.id()))) {
            throw new InvalidRelationshipException(describe(a.id(), b.id())
                    + " cannot be " + kind + " given their declared parents");
        }
        declaredSiblings.computeIfAbsent(a.id(), k -> new TreeMap<>()).put(b.id(), kind);
        declaredSiblings.computeIfAbsent(b.id(), k -> new TreeMap<>()).put(a.id(), kind);
    }

    // A sibling subtype only constrains parents that are declared on both sides.
    private static boolean parentsAgree(RelationshipKind kind,
                                        PersonId fatherA, PersonId motherA,
                                        PersonId fatherB, PersonId motherB) {
        return switch (kind) {
            case FULL_SIBLING -> !differ(fatherA, fatherB) && !differ(motherA, motherB);
            case PATERNAL_SIBLING -> !differ(fatherA, fatherB) && !same(motherA, motherB);
            case MATERNAL_SIBLING -> !differ(motherA, motherB) && !same(fatherA, fatherB);
            default -> true;
        };
    }

    private static boolean differ(PersonId a, PersonId b) {
        return a != null && b != null && !a.equals(b);
    }

    private static boolean same(PersonId a, PersonId b) {
        return a != null && a.equals(b);
    }

    // ==================== الاستعلام ====================

    public synchronized Optional<Person> person(PersonId id) {
        return Optional.ofNullable(persons.get(id));
    }

    public synchronized Person requirePerson(PersonId id) {
        Person person = persons.get(id);
        if (person == null) {
            throw new InvalidRelationshipException("Unknown person " + id);
        }
        return person;
    }

    public synchronized List<Person> persons() {
        return List.copyOf(persons.values());
    }

    public synchronized Optional<PersonId> deceased() {
        return Optional.ofNullable(deceased);
    }

    public synchronized Optional<PersonId> father(PersonId id) {
        return Optional.ofNullable(fathers.get(id));
    }

    public synchronized Optional<PersonId> mother(PersonId id) {
        return Optional.ofNullable(mothers.get(id));
    }

    public synchronized List<PersonId> parents(PersonId id) {
        List<PersonId> result = new ArrayList<>(2);
        father(id).ifPresent(result::add);
        mother(id).ifPresent(result::add);
        return result;
    }

    public synchronized List<PersonId> children(PersonId id) {
        return List.copyOf(children.getOrDefault(id, Collections.emptySet()));
    }

    public synchronized List<PersonId> spouses(PersonId id) {
        return List.copyOf(spousesOf(id));
    }

    /**
     * Siblings of a person with their subtype: declared sibling edges plus children of the
     * declared father or mother. A derived sibling is full only when both parents are declared
     * and shared; a declared edge always wins over the derived subtype.
     */
    public synchronized Map<PersonId, RelationshipKind> siblings(PersonId id) {
        Map<PersonId, RelationshipKind> result = new TreeMap<>();
        PersonId father = fathers.get(id);
        PersonId mother = mothers.get(id);

        Set<PersonId> candidates = new TreeSet<>();
        if (father != null) candidates.addAll(children.getOrDefault(father, Collections.emptySet()));
        if (mother != null) candidates.addAll(children.getOrDefault(mother, Collections.emptySet()));
        candidates.remove(id);

        for (PersonId candidate : candidates) {
            boolean sharesFather = same(father, fathers.get(candidate));
            boolean sharesMother = same(mother, mothers.get(candidate));
            RelationshipKind kind = sharesFather && sharesMother
                    ? RelationshipKind.FULL_SIBLING
                    : sharesFather ? RelationshipKind.PATERNAL_SIBLING : RelationshipKind.MATERNAL_SIBLING;
            result.put(candidate, kind);
        }
        result.putAll(declaredSiblings.getOrDefault(id, Map.of()));
        return result;
    }

    public synchronized Optional<RelationshipKind> siblingKind(PersonId a, PersonId b) {
        return siblingKindOf(a, b);
    }

    public synchronized Set<PersonId> ancestors(PersonId id) {
        return Collections.unmodifiableSet(ancestorsOf(id));
    }

    public synchronized Set<PersonId> descendants(PersonId id) {
        return Collections.unmodifiableSet(descendantsOf(id));
    }

    public synchronized boolean isAncestor(PersonId ancestor, PersonId person) {
        return ancestorsOf(person).contains(ancestor);
    }

    /**
     * Whether {@code to} can be reached from {@code from} over any edge, in any direction.
     */
    public synchronized boolean isReachable(PersonId from, PersonId to) {
        return reachableFrom(from).contains(to);
    }

    public synchronized Set<PersonId> reachableFrom(PersonId start) {
        Set<PersonId> seen = new TreeSet<>();
        Deque<PersonId> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            PersonId current = queue.poll();
            List<PersonId> neighbours = new ArrayList<>(parents(current));
            neighbours.addAll(children.getOrDefault(current, Collections.emptySet()));
            neighbours.addAll(spousesOf(current));
            neighbours.addAll(declaredSiblings.getOrDefault(current, Map.of()).keySet());
            for (PersonId next : neighbours) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    /**
     * Every declared edge once: parent edges, then spouses and declared siblings with the
     * lower id first.
     */
    public synchronized List<Relationship> relationships() {
        List<Relationship> result = new ArrayList<>();
        fathers.forEach((child, father) -> result.add(new Relationship(father, child, RelationshipKind.PARENT)));
        mothers.forEach((child, mother) -> result.add(new Relationship(mother, child, RelationshipKind.PARENT)));
        spouses.forEach((a, set) -> set.stream()
                .filter(b -> a.compareTo(b) < 0)
                .forEach(b -> result.add(new Relationship(a, b, RelationshipKind.SPOUSE))));
        declaredSiblings.forEach((a, map) -> map.forEach((b, kind) -> {
            if (a.compareTo(b) < 0) {
                result.add(new Relationship(a, b, kind));
            }
        }));
        return result;
    }

    public synchronized FamilyTree snapshot() {
        return frozen ? this : new FamilyTree(this);
    }

    public boolean isFrozen() {
        return frozen;
    }

    // ==================== دوال مساعدة ====================

    private void checkEditable() {
        if (frozen) {
            throw new UnsupportedOperationException("Family tree snapshots are read-only");
        }
    }

    private boolean isParentOf(PersonId parent, PersonId child) {
        return parent.equals(fathers.get(child)) || parent.equals(mothers.get(child));
    }

    private boolean isLineal(PersonId a, PersonId b) {
        return ancestorsOf(a).contains(b) || ancestorsOf(b).contains(a);
    }

    private Set<PersonId> spousesOf(PersonId id) {
        return spouses.getOrDefault(id, Collections.emptySet());
    }

    private long livingSpouses(PersonId id) {
        return spousesOf(id).stream().filter(spouse -> persons.get(spouse).alive()).count();
    }

    private Optional<RelationshipKind> siblingKindOf(PersonId a, PersonId b) {
        return Optional.ofNullable(siblings(a).get(b));
    }

    private Set<PersonId> ancestorsOf(PersonId id) {
        Set<PersonId> result = new TreeSet<>();
        Deque<PersonId> stack = new ArrayDeque<>();
        if (fathers.containsKey(id)) stack.push(fathers.get(id));
        if (mothers.containsKey(id)) stack.push(mothers.get(id));
        while (!stack.isEmpty()) {
            PersonId current = stack.pop();
            if (result.add(current)) {
                if (fathers.containsKey(current)) stack.push(fathers.get(current));
                if (mothers.containsKey(current)) stack.push(mothers.get(current));
            }
        }
        return result;
    }

    private Set<PersonId> descendantsOf(PersonId id) {
        Set<PersonId> result = new TreeSet<>();
        Deque<PersonId> stack = new ArrayDeque<>(children.getOrDefault(id, Collections.emptySet()));
        while (!stack.isEmpty()) {
            PersonId current = stack.pop();
            if (result.add(current)) {
                stack.addAll(children.getOrDefault(current, Collections.emptySet()));
            }
        }
        return result;
    }

    private String describe(PersonId a, PersonId b) {
        return persons.get(a).displayName() + " and " + persons.get(b).displayName();
    }
}
