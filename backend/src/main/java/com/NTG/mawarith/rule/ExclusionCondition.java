package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.Entity.Enum.HeirType;

import java.util.List;

/**
 * When an excluder category actually removes a target. Each check sees the target, the
 * present heirs of the excluder category and every heir still present.
 */
public enum ExclusionCondition {

    ALWAYS {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return true;
        }
    },

    NEARER_DEGREE {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> e.degree() < target.degree());
        }
    },

    NOT_FARTHER_DEGREE {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> e.degree() <= target.degree());
        }
    },

    // الجدة تحجب بمن تدلي به
    CONNECTED_THROUGH_EXCLUDER {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> target.connectsThrough(e.personId()));
        }
    },

    // جهة العمومة: عمومة الميت ثم عمومة أبيه ثم عمومة جده
    NEARER_ASCENT {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> e.ascent() < target.ascent());
        }
    },

    NOT_FARTHER_ASCENT {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> e.ascent() <= target.ascent());
        }
    },

    /**
     * Within the same category, the nearer line wins and then the nearer generation below
     * the uncle.
     */
    NEARER_ASCENT_THEN_DEGREE {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> compareLine(e, target) < 0);
        }
    },

    NOT_FARTHER_ASCENT_THEN_DEGREE {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.stream().anyMatch(e -> compareLine(e, target) <= 0);
        }
    },

    // البنتان تحجبان بنات الابن والشقيقتان تحجبان الأخوات لأب ما لم يوجد معصب
    TWO_OR_MORE_WITHOUT_AGNATIC_PARTNER {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return excluders.size() >= 2 && !hasAgnaticPartner(target, present);
        }
    },

    /**
     * Nearer females of the same line, counted together with the daughters, have completed
     * two thirds and no male counterpart lifts the target.
     */
    NEARER_DEGREE_WITHOUT_AGNATIC_PARTNER {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            long nearer = excluders.stream().filter(e -> e.degree() < target.degree()).count();
            long daughters = present.stream().filter(h -> h.heirType() == HeirType.DAUGHTER).count();
            return nearer > 0 && nearer + daughters >= 2 && !hasAgnaticPartner(target, present);
        }
    },

    // عصبة مع الغير
    RESIDUARY_WITH_FEMALE_DESCENDANT {
        @Override
        public boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present) {
            return present.stream().anyMatch(h ->
                    h.heirType() == HeirType.DAUGHTER || h.heirType() == HeirType.DAUGHTER_OF_SON);
        }
    };

    public abstract boolean holds(ClassifiedHeir target, List<ClassifiedHeir> excluders, List<ClassifiedHeir> present);

    static int compareLine(ClassifiedHeir a, ClassifiedHeir b) {
        if (a.ascent() != b.ascent()) {
            return Integer.compare(a.ascent(), b.ascent());
        }
        return Integer.compare(a.degree(), b.degree());
    }

    static boolean hasAgnaticPartner(ClassifiedHeir target, List<ClassifiedHeir> present) {
        return switch (target.heirType()) {
            case DAUGHTER_OF_SON -> present.stream().anyMatch(h ->
                    h.heirType() == HeirType.SON_OF_SON && h.degree() >= target.degree());
            case PATERNAL_SISTER -> present.stream().anyMatch(h -> h.heirType() == HeirType.PATERNAL_BROTHER);
            default -> false;
        };
    }
}
