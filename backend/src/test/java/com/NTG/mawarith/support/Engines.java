package com.NTG.mawarith.support;

import com.NTG.mawarith.config.MawarithProperties;
import com.NTG.mawarith.rule.AgnaticCollateralRule;
import com.NTG.mawarith.rule.DaughterRule;
import com.NTG.mawarith.rule.DistantKindredRule;
import com.NTG.mawarith.rule.ExclusionTable;
import com.NTG.mawarith.rule.FatherRule;
import com.NTG.mawarith.rule.FullSiblingsRule;
import com.NTG.mawarith.rule.GrandfatherRule;
import com.NTG.mawarith.rule.GrandmotherRule;
import com.NTG.mawarith.rule.HusbandRule;
import com.NTG.mawarith.rule.InheritanceRule;
import com.NTG.mawarith.rule.MaternalSiblingsRule;
import com.NTG.mawarith.rule.MotherRule;
import com.NTG.mawarith.rule.PaternalSiblingsRule;
import com.NTG.mawarith.rule.SonRule;
import com.NTG.mawarith.rule.SonsChildrenRule;
import com.NTG.mawarith.rule.WifeRule;
import com.NTG.mawarith.service.ExclusionEngine;
import com.NTG.mawarith.service.HeirClassifier;
import com.NTG.mawarith.service.InheritanceCalculationService;
import com.NTG.mawarith.service.ShareCalculator;
import com.NTG.mawarith.service.ShareNormalizer;

import java.util.List;

/**
 * Builds the calculation pipeline by hand for tests that do not need a Spring context.
 */
public final class Engines {

    private Engines() {
    }

    public static List<InheritanceRule> rules() {
        return List.of(
                new HusbandRule(),
                new WifeRule(),
                new FatherRule(),
                new GrandfatherRule(),
                new MotherRule(),
                new GrandmotherRule(),
                new SonRule(),
                new DaughterRule(),
                new SonsChildrenRule(),
                new FullSiblingsRule(),
                new PaternalSiblingsRule(),
                new MaternalSiblingsRule(),
                new AgnaticCollateralRule(),
                new DistantKindredRule());
    }

    public static ExclusionEngine exclusionEngine() {
        return new ExclusionEngine(new ExclusionTable());
    }

    public static ShareCalculator shareCalculator(MawarithProperties properties) {
        return new ShareCalculator(rules(), properties);
    }

    public static InheritanceCalculationService calculationService() {
        return calculationService(new MawarithProperties());
    }

    public static InheritanceCalculationService calculationService(MawarithProperties properties) {
        return new InheritanceCalculationService(
                new HeirClassifier(properties),
                exclusionEngine(),
                shareCalculator(properties),
                new ShareNormalizer());
    }
}
