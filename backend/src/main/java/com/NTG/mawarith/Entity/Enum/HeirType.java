package com.NTG.mawarith.Entity.Enum;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Closed set of heir categories. {@code tier} is the classification precedence (a person
 * reachable by several paths keeps the lowest tier), {@code residuaryRank} orders the
 * residuary groups (0 means the category never takes the residue).
 */
@Getter
@AllArgsConstructor
public enum HeirType {
    // ====== الأزواج ======
    HUSBAND("زوج", 1, 3, 0),
    WIFE("زوجة", 4, 3, 0),

    // ====== الأصول ======
    FATHER("أب", 1, 2, 3),
    MOTHER("أم", 1, 2, 0),
    GRANDFATHER("جد", null, 5, 4),
    GRANDMOTHER_PATERNAL("جدة لأب", null, 5, 0),
    GRANDMOTHER_MATERNAL("جدة لأم", null, 5, 0),

    // ====== الفروع ======
    SON("ابن", null, 1, 1),
    DAUGHTER("بنت", null, 1, 1),
    SON_OF_SON("ابن الابن", null, 1, 2),
    DAUGHTER_OF_SON("بنت الابن", null, 1, 2),

    // ====== الإخوة الأشقاء ======
    FULL_BROTHER("أخ شقيق", null, 4, 5),
    FULL_SISTER("أخت شقيقة", null, 4, 5),

    // ====== الإخوة لأب ======
    PATERNAL_BROTHER("أخ لأب", null, 4, 6),
    PATERNAL_SISTER("أخت لأب", null, 4, 6),

    // ====== الإخوة لأم ======
    MATERNAL_BROTHER("أخ لأم", null, 4, 0),
    MATERNAL_SISTER("أخت لأم", null, 4, 0),

    // ====== أبناء الإخوة ======
    SON_OF_FULL_BROTHER("ابن الأخ الشقيق", null, 6, 7),
    SON_OF_PATERNAL_BROTHER("ابن الأخ لأب", null, 6, 8),

    // ====== الأعمام ======
    FULL_UNCLE("عم شقيق", null, 6, 9),
    PATERNAL_UNCLE("عم لأب", null, 6, 10),

    // ====== أبناء الأعمام ======
    SON_OF_FULL_UNCLE("ابن العم الشقيق", null, 6, 11),
    SON_OF_PATERNAL_UNCLE("ابن العم لأب", null, 6, 12),

    // ====== ذوو الأرحام ======
    DISTANT_KINDRED("ذو رحم", null, 7, 13);

    private final String arabicName;
    private final Integer maxAllowed;
    private final int tier;
    private final int residuaryRank;

    public boolean isSpouse() {
        return this == HUSBAND || this == WIFE;
    }

    public boolean isSibling() {
        return this == FULL_BROTHER || this == FULL_SISTER
                || this == PATERNAL_BROTHER || this == PATERNAL_SISTER
                || this == MATERNAL_BROTHER || this == MATERNAL_SISTER;
    }
}
