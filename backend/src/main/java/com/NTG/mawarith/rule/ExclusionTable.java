package com.NTG.mawarith.rule;

import com.NTG.mawarith.Entity.Enum.HeirType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.NTG.mawarith.Entity.Enum.HeirType.*;
import static com.NTG.mawarith.rule.ExclusionCondition.*;

/**
 * Hajb al-hirman table, applied top to bottom. Where the schools differ the Hanafi
 * position is taken: the grandfather excludes the siblings, a grandmother is excluded by
 * the father or grandfather she connects through, and the nearer grandmother of either
 * side excludes the farther one. Uncles and their sons are ordered by line first (the
 * deceased's uncles, then the father's uncles) and by generation within a line.
 */
@Component
public class ExclusionTable {

    private static final Set<HeirType> NEPHEWS = EnumSet.of(SON_OF_FULL_BROTHER, SON_OF_PATERNAL_BROTHER);
    private static final Set<HeirType> UNCLES = EnumSet.of(FULL_UNCLE, PATERNAL_UNCLE);
    private static final Set<HeirType> COUSINS = EnumSet.of(SON_OF_FULL_UNCLE, SON_OF_PATERNAL_UNCLE);
    private static final Set<HeirType> MATERNAL_SIBLINGS = EnumSet.of(MATERNAL_BROTHER, MATERNAL_SISTER);
    private static final Set<HeirType> GRANDMOTHERS = EnumSet.of(GRANDMOTHER_PATERNAL, GRANDMOTHER_MATERNAL);

    private static final Set<HeirType> SIBLINGS_AND_BELOW = union(
            EnumSet.of(FULL_BROTHER, FULL_SISTER, PATERNAL_BROTHER, PATERNAL_SISTER),
            MATERNAL_SIBLINGS, NEPHEWS, UNCLES, COUSINS);
    private static final Set<HeirType> PATERNAL_SIBLINGS_AND_BELOW = union(
            EnumSet.of(PATERNAL_BROTHER, PATERNAL_SISTER), NEPHEWS, UNCLES, COUSINS);

    private final List<ExclusionRule> rules;

    public ExclusionTable() {
        List<ExclusionRule> table = new ArrayList<>();

        // ====== الفروع ======
        table.add(rule(SON, union(EnumSet.of(SON_OF_SON, DAUGHTER_OF_SON), SIBLINGS_AND_BELOW), ALWAYS,
                "الابن يحجب أولاد الابن والإخوة ومن دونهم"));
        table.add(rule(SON_OF_SON, EnumSet.of(SON_OF_SON, DAUGHTER_OF_SON), NEARER_DEGREE,
                "ابن الابن يحجب من هو أنزل منه من أولاد الابن"));
        table.add(rule(SON_OF_SON, SIBLINGS_AND_BELOW, ALWAYS,
                "ابن الابن يحجب الإخوة ومن دونهم"));

        // ====== الأصول ======
        table.add(rule(FATHER, union(EnumSet.of(GRANDFATHER, GRANDMOTHER_PATERNAL), SIBLINGS_AND_BELOW), ALWAYS,
                "الأب يحجب الجد والجدة لأب والإخوة ومن دونهم"));
        table.add(rule(GRANDFATHER, EnumSet.of(GRANDFATHER), NEARER_DEGREE,
                "الجد الأقرب يحجب الجد الأبعد"));
        table.add(rule(GRANDFATHER, EnumSet.of(GRANDMOTHER_PATERNAL), CONNECTED_THROUGH_EXCLUDER,
                "الجد يحجب الجدة التي تدلي به"));
        table.add(rule(GRANDFATHER, SIBLINGS_AND_BELOW, ALWAYS,
                "الجد يحجب الإخوة ومن دونهم على مذهب أبي حنيفة"));
        table.add(rule(MOTHER, GRANDMOTHERS, ALWAYS,
                "الأم تحجب الجدات من كل جهة"));
        table.add(rule(GRANDMOTHER_MATERNAL, GRANDMOTHERS, NEARER_DEGREE,
                "الجدة القربى تحجب البعدى من أي جهة كانت"));
        table.add(rule(GRANDMOTHER_PATERNAL, GRANDMOTHERS, NEARER_DEGREE,
                "الجدة القربى تحجب البعدى من أي جهة كانت"));

        // ====== البنات وبنات الابن ======
        table.add(rule(DAUGHTER, MATERNAL_SIBLINGS, ALWAYS,
                "الفرع الوارث يحجب الإخوة لأم"));
        table.add(rule(DAUGHTER, EnumSet.of(DAUGHTER_OF_SON), TWO_OR_MORE_WITHOUT_AGNATIC_PARTNER,
                "البنتان فأكثر تحجبان بنات الابن ما لم يعصبهن ابن ابن"));
        table.add(rule(DAUGHTER_OF_SON, MATERNAL_SIBLINGS, ALWAYS,
                "الفرع الوارث يحجب الإخوة لأم"));
        table.add(rule(DAUGHTER_OF_SON, EnumSet.of(DAUGHTER_OF_SON), NEARER_DEGREE_WITHOUT_AGNATIC_PARTNER,
                "استكمال الثلثين يحجب بنات الابن الأنزل ما لم يعصبهن ابن ابن"));

        // ====== الإخوة ======
        table.add(rule(FULL_BROTHER, PATERNAL_SIBLINGS_AND_BELOW, ALWAYS,
                "الأخ الشقيق يحجب الإخوة لأب ومن دونهم"));
        table.add(rule(FULL_SISTER, EnumSet.of(PATERNAL_SISTER), TWO_OR_MORE_WITHOUT_AGNATIC_PARTNER,
                "الشقيقتان فأكثر تحجبان الأخوات لأب ما لم يعصبهن أخ لأب"));
        table.add(rule(FULL_SISTER, PATERNAL_SIBLINGS_AND_BELOW, RESIDUARY_WITH_FEMALE_DESCENDANT,
                "الأخت الشقيقة العصبة مع الغير تحجب الإخوة لأب ومن دونهم"));
        table.add(rule(PATERNAL_BROTHER, union(NEPHEWS, UNCLES, COUSINS), ALWAYS,
                "الأخ لأب يحجب أبناء الإخوة والأعمام وأبناءهم"));
        table.add(rule(PATERNAL_SISTER, union(NEPHEWS, UNCLES, COUSINS), RESIDUARY_WITH_FEMALE_DESCENDANT,
                "الأخت لأب العصبة مع الغير تحجب أبناء الإخوة والأعمام وأبناءهم"));

        // ====== أبناء الإخوة ======
        table.add(rule(SON_OF_FULL_BROTHER, EnumSet.of(SON_OF_FULL_BROTHER), NEARER_DEGREE,
                "ابن الأخ الأقرب يحجب الأبعد"));
        table.add(rule(SON_OF_FULL_BROTHER, EnumSet.of(SON_OF_PATERNAL_BROTHER), NOT_FARTHER_DEGREE,
                "ابن الأخ الشقيق يحجب ابن الأخ لأب المساوي له أو الأنزل"));
        table.add(rule(SON_OF_FULL_BROTHER, union(UNCLES, COUSINS), ALWAYS,
                "ابن الأخ يحجب الأعمام وأبناءهم"));
        table.add(rule(SON_OF_PATERNAL_BROTHER, NEPHEWS, NEARER_DEGREE,
                "ابن الأخ الأقرب يحجب الأبعد"));
        table.add(rule(SON_OF_PATERNAL_BROTHER, union(UNCLES, COUSINS), ALWAYS,
                "ابن الأخ يحجب الأعمام وأبناءهم"));

        // ====== الأعمام وأبناؤهم ======
        table.add(rule(FULL_UNCLE, EnumSet.of(FULL_UNCLE), NEARER_ASCENT,
                "عم الميت يحجب عم أبيه"));
        table.add(rule(FULL_UNCLE, EnumSet.of(PATERNAL_UNCLE), NOT_FARTHER_ASCENT,
                "العم الشقيق يحجب العم لأب من جهته أو أبعد"));
        table.add(rule(FULL_UNCLE, COUSINS, NOT_FARTHER_ASCENT,
                "العم يحجب أبناء الأعمام من جهته أو أبعد"));
        table.add(rule(PATERNAL_UNCLE, UNCLES, NEARER_ASCENT,
                "عم الميت يحجب عم أبيه"));
        table.add(rule(PATERNAL_UNCLE, COUSINS, NOT_FARTHER_ASCENT,
                "العم يحجب أبناء الأعمام من جهته أو أبعد"));
        table.add(rule(SON_OF_FULL_UNCLE, UNCLES, NEARER_ASCENT,
                "ابن عم الميت يحجب عم أبيه"));
        table.add(rule(SON_OF_FULL_UNCLE, EnumSet.of(SON_OF_FULL_UNCLE), NEARER_ASCENT_THEN_DEGREE,
                "ابن العم الأقرب يحجب الأبعد"));
        table.add(rule(SON_OF_FULL_UNCLE, EnumSet.of(SON_OF_PATERNAL_UNCLE), NOT_FARTHER_ASCENT_THEN_DEGREE,
                "ابن العم الشقيق يحجب ابن العم لأب المساوي له أو الأنزل"));
        table.add(rule(SON_OF_PATERNAL_UNCLE, UNCLES, NEARER_ASCENT,
                "ابن عم الميت يحجب عم أبيه"));
        table.add(rule(SON_OF_PATERNAL_UNCLE, COUSINS, NEARER_ASCENT_THEN_DEGREE,
                "ابن العم الأقرب يحجب الأبعد"));

        // ====== ذوو الأرحام ======
        for (HeirType type : HeirType.values()) {
            if (!type.isSpouse() && type != DISTANT_KINDRED) {
                table.add(rule(type, EnumSet.of(DISTANT_KINDRED), ALWAYS,
                        "لا يرث ذوو الأرحام مع صاحب فرض غير الزوجين أو عاصب"));
            }
        }
        table.add(rule(DISTANT_KINDRED, EnumSet.of(DISTANT_KINDRED), NEARER_DEGREE,
                "الأقرب من ذوي الأرحام يحجب الأبعد"));

        this.rules = Collections.unmodifiableList(table);
    }

    public List<ExclusionRule> rules() {
        return rules;
    }

    public List<ExclusionRule> rulesFor(HeirType excluder) {
        return rules.stream().filter(r -> r.excluder() == excluder).toList();
    }

    private static ExclusionRule rule(HeirType excluder, Set<HeirType> excluded, ExclusionCondition condition, String note) {
        return new ExclusionRule(excluder, excluded, condition, note);
    }

    @SafeVarargs
    private static Set<HeirType> union(Set<HeirType>... sets) {
        Set<HeirType> result = EnumSet.noneOf(HeirType.class);
        for (Set<HeirType> set : sets) {
            result.addAll(set);
        }
        return result;
    }
}
