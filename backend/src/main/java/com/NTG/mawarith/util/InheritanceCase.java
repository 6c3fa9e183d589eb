package com.NTG.mawarith.util;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.Entity.Enum.HeirType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only view of the heirs left after exclusion, as the share rules query it.
 */
public class InheritanceCase {
    private final Map<HeirType, List<ClassifiedHeir>> heirs;
    private final PrunedHeirs pruned;
    private final boolean umariyyaEnabled;

    public InheritanceCase(PrunedHeirs pruned, boolean umariyyaEnabled) {
        this.pruned = pruned;
        this.umariyyaEnabled = umariyyaEnabled;
        this.heirs = new EnumMap<>(HeirType.class);
        pruned.heirs().stream()
                .collect(Collectors.groupingBy(ClassifiedHeir::heirType))
                .forEach((type, list) -> heirs.put(type, List.copyOf(list)));
    }

    // ==================== دوال العد والتحقق ====================
    public int count(HeirType type) {
        return heirs.getOrDefault(type, List.of()).size();
    }

    public boolean has(HeirType type) {
        return count(type) > 0;
    }

    public List<ClassifiedHeir> heirs(HeirType... types) {
        return Arrays.stream(types)
                .flatMap(type -> heirs.getOrDefault(type, List.of()).stream())
                .toList();
    }

    public boolean hasDescendant() {
        return has(HeirType.SON) || has(HeirType.DAUGHTER)
                || has(HeirType.SON_OF_SON)
                || has(HeirType.DAUGHTER_OF_SON);
    }

    public boolean hasMaleDescendant() {
        return has(HeirType.SON) || has(HeirType.SON_OF_SON);
    }

    public boolean hasFemaleDescendant() {
        return has(HeirType.DAUGHTER) || has(HeirType.DAUGHTER_OF_SON);
    }

    public boolean hasSpouse() {
        return has(HeirType.HUSBAND) || has(HeirType.WIFE);
    }

    // الإخوة يحجبون الأم حجب نقصان وإن كانوا محجوبين
    public long countSiblingsIncludingExcluded() {
        return Arrays.stream(HeirType.values())
                .filter(HeirType::isSibling)
                .mapToLong(type -> count(type) + pruned.excludedCount(type))
                .sum();
    }

    // ==================== دوال إضافية ====================

    // المسألة العمرية: زوج/زوجة + أب + أم فقط
    public boolean isUmariyyaCase() {
        return umariyyaEnabled
                && has(HeirType.FATHER)
                && has(HeirType.MOTHER)
                && hasSpouse()
                && allHeirsAreOfTypes(HeirType.HUSBAND, HeirType.WIFE, HeirType.FATHER, HeirType.MOTHER);
    }

    public boolean allHeirsAreOfTypes(HeirType... types) {
        if (heirs.isEmpty()) return false;
        List<HeirType> allowed = List.of(types);
        return allowed.containsAll(heirs.keySet());
    }

    @Override
    public String toString() {
        return "InheritanceCase{" +
                "heirs=" + heirs.entrySet().stream()
                        .map(e -> e.getKey() + "x" + e.getValue().size())
                        .collect(Collectors.joining(", ")) +
                ", excluded=" + pruned.exclusions().size() +
                '}';
    }
}
