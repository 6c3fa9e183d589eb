package com.NTG.mawarith.service;

import com.NTG.mawarith.DTOs.ClassifiedHeir;
import com.NTG.mawarith.DTOs.PrunedHeirs;
import com.NTG.mawarith.DTOs.RawShare;
import com.NTG.mawarith.DTOs.RawShares;
import com.NTG.mawarith.DTOs.response.EstateDivision;
import com.NTG.mawarith.DTOs.response.ShareEntry;
import com.NTG.mawarith.Entity.Enum.Adjustment;
import com.NTG.mawarith.Entity.Enum.AsabaType;
import com.NTG.mawarith.Entity.Enum.Gender;
import com.NTG.mawarith.Entity.Enum.HeirType;
import com.NTG.mawarith.Entity.Enum.ShareType;
import com.NTG.mawarith.Entity.PersonId;
import com.NTG.mawarith.util.Fraction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShareNormalizerTest {

    private final ShareNormalizer normalizer = new ShareNormalizer();
    private final PrunedHeirs nothingExcluded = new PrunedHeirs(List.of(), List.of());
    private long nextId = 1;

    private ClassifiedHeir male(HeirType type) {
        return new ClassifiedHeir(PersonId.of(nextId++), type, Gender.MALE, 1);
    }

    private ClassifiedHeir female(HeirType type) {
        return new ClassifiedHeir(PersonId.of(nextId++), type, Gender.FEMALE, 1);
    }

    private RawShare fixed(ClassifiedHeir heir, Fraction share) {
        return new RawShare(heir, ShareType.FIXED, share, Fraction.ZERO, AsabaType.NONE, "فرض");
    }

    private RawShare residual(ClassifiedHeir heir, Fraction share) {
        return new RawShare(heir, ShareType.RESIDUAL, Fraction.ZERO, share, AsabaType.BY_SELF, "تعصيب");
    }

    private EstateDivision normalize(boolean residuaryPresent, RawShare... shares) {
        return normalizer.normalize(new RawShares(List.of(shares), residuaryPresent), nothingExcluded);
    }

    @Test
    void awlScalesEveryFixedShareByTheFixedTotal() {
        ClassifiedHeir husband = male(HeirType.HUSBAND);
        ClassifiedHeir sister1 = female(HeirType.FULL_SISTER);
        ClassifiedHeir sister2 = female(HeirType.FULL_SISTER);

        EstateDivision division = normalize(false,
                fixed(husband, Fraction.of(1, 2)),
                fixed(sister1, Fraction.of(1, 3)),
                fixed(sister2, Fraction.of(1, 3)));

        assertThat(division.adjustment()).isEqualTo(Adjustment.AWL);
        assertThat(division.fixedTotal()).isEqualTo(Fraction.of(7, 6));
        assertThat(division.origin()).isEqualTo(7);
        assertThat(division.shareOf(husband.personId())).isEqualTo(Fraction.of(3, 7));
        assertThat(division.shareOf(sister1.personId())).isEqualTo(Fraction.of(2, 7));
        assertThat(division.entries()).extracting(ShareEntry::units).containsExactly(3L, 2L, 2L);
    }

    @Test
    void raddGoesToTheSoleSpouse() {
        ClassifiedHeir wife = female(HeirType.WIFE);

        EstateDivision division = normalize(false, fixed(wife, Fraction.of(1, 4)));

        assertThat(division.adjustment()).isEqualTo(Adjustment.RADD);
        assertThat(division.shareOf(wife.personId())).isEqualTo(Fraction.ONE);
        assertThat(division.origin()).isEqualTo(1);
    }

    @Test
    void raddSkipsSpouseWhenOtherFixedHeirsExist() {
        ClassifiedHeir wife = female(HeirType.WIFE);
        ClassifiedHeir mother = female(HeirType.MOTHER);

        EstateDivision division = normalize(false,
                fixed(wife, Fraction.of(1, 4)),
                fixed(mother, Fraction.of(1, 3)));

        assertThat(division.adjustment()).isEqualTo(Adjustment.RADD);
        assertThat(division.shareOf(wife.personId())).isEqualTo(Fraction.of(1, 4));
        assertThat(division.shareOf(mother.personId())).isEqualTo(Fraction.of(3, 4));
        assertThat(division.origin()).isEqualTo(4);
    }

    @Test
    void raddIsProportionalToFixedShares() {
        ClassifiedHeir mother = female(HeirType.MOTHER);
        ClassifiedHeir daughter = female(HeirType.DAUGHTER);

        EstateDivision division = normalize(false,
                fixed(mother, Fraction.of(1, 6)),
                fixed(daughter, Fraction.of(1, 2)));

        assertThat(division.shareOf(mother.personId())).isEqualTo(Fraction.of(1, 4));
        assertThat(division.shareOf(daughter.personId())).isEqualTo(Fraction.of(3, 4));
    }

    @Test
    void leavesSharesAloneWhenResiduaryTakesTheRest() {
        ClassifiedHeir mother = female(HeirType.MOTHER);
        ClassifiedHeir son = male(HeirType.SON);

        EstateDivision division = normalize(true,
                fixed(mother, Fraction.of(1, 3)),
                residual(son, Fraction.of(2, 3)));

        assertThat(division.adjustment()).isEqualTo(Adjustment.NONE);
        assertThat(division.shareOf(son.personId())).isEqualTo(Fraction.of(2, 3));
        assertThat(division.entry(son.personId())).get()
                .extracting(ShareEntry::shareType, ShareEntry::asabaType)
                .containsExactly(ShareType.RESIDUAL, AsabaType.BY_SELF);
    }

    @Test
    void rejectsSharesThatDoNotCoverTheEstate() {
        RawShares broken = new RawShares(List.of(
                fixed(female(HeirType.MOTHER), Fraction.of(1, 3)),
                residual(male(HeirType.SON), Fraction.of(1, 3))), true);

        assertThatThrownBy(() -> normalizer.normalize(broken, nothingExcluded))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("2/3");
    }

    @Test
    void reportsResiduariesLeftWithNothing() {
        ClassifiedHeir husband = male(HeirType.HUSBAND);
        ClassifiedHeir mother = female(HeirType.MOTHER);
        ClassifiedHeir maternalBrother = male(HeirType.MATERNAL_BROTHER);
        ClassifiedHeir maternalSister = female(HeirType.MATERNAL_SISTER);
        ClassifiedHeir brother = male(HeirType.FULL_BROTHER);

        EstateDivision division = normalize(true,
                fixed(husband, Fraction.of(1, 2)),
                fixed(mother, Fraction.of(1, 6)),
                fixed(maternalBrother, Fraction.of(1, 6)),
                fixed(maternalSister, Fraction.of(1, 6)),
                residual(brother, Fraction.ZERO));

        assertThat(division.adjustment()).isEqualTo(Adjustment.NONE);
        assertThat(division.exhausted()).containsExactly(brother.personId());
        assertThat(division.entry(brother.personId())).isEmpty();
        assertThat(division.origin()).isEqualTo(6);
    }

    @Test
    void classifiesMixedAndFixedEntriesByTheirParts() {
        ClassifiedHeir father = male(HeirType.FATHER);
        ClassifiedHeir daughter = female(HeirType.DAUGHTER);

        EstateDivision division = normalize(true,
                new RawShare(father, ShareType.MIXED, Fraction.of(1, 6), Fraction.of(1, 3), AsabaType.BY_SELF, "فرض وتعصيب"),
                fixed(daughter, Fraction.of(1, 2)));

        ShareEntry fatherEntry = division.entry(father.personId()).orElseThrow();
        assertThat(fatherEntry.shareType()).isEqualTo(ShareType.MIXED);
        assertThat(fatherEntry.asabaType()).isEqualTo(AsabaType.BY_SELF);
        assertThat(fatherEntry.label()).isEqualTo("أب");
    }

    @Test
    void mixedHeirWithoutResidueIsReportedAsFixed() {
        ClassifiedHeir father = male(HeirType.FATHER);
        ClassifiedHeir mother = female(HeirType.MOTHER);
        ClassifiedHeir daughter1 = female(HeirType.DAUGHTER);
        ClassifiedHeir daughter2 = female(HeirType.DAUGHTER);

        EstateDivision division = normalize(true,
                new RawShare(father, ShareType.MIXED, Fraction.of(1, 6), Fraction.ZERO, AsabaType.BY_SELF, "فرض وتعصيب"),
                fixed(mother, Fraction.of(1, 6)),
                fixed(daughter1, Fraction.of(1, 3)),
                fixed(daughter2, Fraction.of(1, 3)));

        ShareEntry fatherEntry = division.entry(father.personId()).orElseThrow();
        assertThat(fatherEntry.shareType()).isEqualTo(ShareType.FIXED);
        assertThat(fatherEntry.asabaType()).isEqualTo(AsabaType.NONE);
        assertThat(division.exhausted()).isEmpty();
    }
}
