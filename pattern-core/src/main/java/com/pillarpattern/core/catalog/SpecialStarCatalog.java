package com.pillarpattern.core.catalog;

import com.pillarpattern.core.model.BadgeType;
import com.pillarpattern.core.model.DomainEvent;
import com.pillarpattern.core.model.DomainSentiment;
import com.pillarpattern.core.model.EventMapping;
import com.pillarpattern.core.model.LifeDomain;
import com.pillarpattern.core.model.NodeFilter;
import com.pillarpattern.core.model.PatternCategory;
import com.pillarpattern.core.model.PatternSpec;
import com.pillarpattern.core.model.PillarMeanings;
import com.pillarpattern.core.model.Sentiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static com.pillarpattern.core.model.LifeDomain.*;

/**
 * Context-dependent single-branch patterns (神煞). Each star is keyed either by the Day Master
 * stem or by the Year Branch and targets one branch; the specs are generated from the classical
 * lookup tables below, one spec per (key, target branch).
 *
 * <p>Identifiers read {@code CATEGORY~key~targetBranch}, e.g. {@code KONG_WANG~Jia~Xu}.
 */
public final class SpecialStarCatalog {

    private static final String CLASSICAL_SOURCE = "三命通會";

    // ── Day Master keyed ─────────────────────────────────────────────────────

    static final Map<String, List<String>> KONG_WANG_LOOKUP = multi(
        "Jia", "Xu", "Hai",   "Yi", "Xu", "Hai",
        "Bing", "Shen", "You", "Ding", "Shen", "You",
        "Wu", "Wu", "Wei",    "Ji", "Wu", "Wei",
        "Geng", "Chen", "Si", "Xin", "Chen", "Si",
        "Ren", "Yin", "Mao",  "Gui", "Yin", "Mao");

    static final Map<String, List<String>> GUI_REN_LOOKUP = multi(
        "Jia", "Chou", "Wei",  "Yi", "Zi", "Shen",
        "Bing", "Hai", "You",  "Ding", "Hai", "You",
        "Wu", "Chou", "Wei",   "Ji", "Zi", "Shen",
        "Geng", "Chou", "Wei", "Xin", "Yin", "Wu",
        "Ren", "Mao", "Si",    "Gui", "Mao", "Si");

    // Yang stems only
    static final Map<String, String> YANG_REN_LOOKUP = single(
        "Jia", "Mao", "Bing", "Wu", "Wu", "Wu", "Geng", "You", "Ren", "Zi");

    static final Map<String, String> LU_SHEN_LOOKUP = single(
        "Jia", "Yin", "Yi", "Mao", "Bing", "Si", "Ding", "Wu", "Wu", "Si",
        "Ji", "Wu", "Geng", "Shen", "Xin", "You", "Ren", "Hai", "Gui", "Zi");

    // ── Year Branch keyed ────────────────────────────────────────────────────

    static final Map<String, String> TAO_HUA_LOOKUP = single(
        "Yin", "Mao", "Wu", "Mao", "Xu", "Mao",
        "Shen", "You", "Zi", "You", "Chen", "You",
        "Si", "Wu", "You", "Wu", "Chou", "Wu",
        "Hai", "Zi", "Mao", "Zi", "Wei", "Zi");

    static final Map<String, String> YI_MA_LOOKUP = single(
        "Yin", "Shen", "Wu", "Shen", "Xu", "Shen",
        "Shen", "Yin", "Zi", "Yin", "Chen", "Yin",
        "Si", "Hai", "You", "Hai", "Chou", "Hai",
        "Hai", "Si", "Mao", "Si", "Wei", "Si");

    static final Map<String, String> HUA_GAI_LOOKUP = single(
        "Yin", "Xu", "Wu", "Xu", "Xu", "Xu",
        "Shen", "Chen", "Zi", "Chen", "Chen", "Chen",
        "Si", "Chou", "You", "Chou", "Chou", "Chou",
        "Hai", "Wei", "Mao", "Wei", "Wei", "Wei");

    static final Map<String, String> GU_CHEN_LOOKUP = single(
        "Zi", "Yin", "Chou", "Yin", "Yin", "Si", "Mao", "Si", "Chen", "Si",
        "Si", "Shen", "Wu", "Shen", "Wei", "Shen", "Shen", "Hai", "You", "Hai",
        "Xu", "Hai", "Hai", "Yin");

    static final Map<String, String> GUA_SU_LOOKUP = single(
        "Zi", "Xu", "Chou", "Xu", "Yin", "Chou", "Mao", "Chou", "Chen", "Chou",
        "Si", "Chen", "Wu", "Chen", "Wei", "Chen", "Shen", "Wei", "You", "Wei",
        "Xu", "Wei", "Hai", "Xu");

    // ── star templates ───────────────────────────────────────────────────────

    private static final StarTemplate KONG_WANG = new StarTemplate(
        PatternCategory.KONG_WANG, 300, "空亡", "Void Star", 8.0, List.of(1.0, 0.8, 0.6),
        BadgeType.COMBINATION, List.of(CAREER, RELATIONSHIP, FAMILY),
        new PillarMeanings(
            "Ancestral void - detachment from family legacy",
            "Career void - unconventional career path",
            "Spouse void - late marriage or unique partnership",
            "Children void - fewer children or spiritual focus"),
        null,
        "Day Master %1$s has void in %2$s - emptiness in that domain",
        "Context-dependent: Only applies when Day Stem is %1$s");

    private static final StarTemplate GUI_REN = new StarTemplate(
        PatternCategory.GUI_REN, 310, "貴人", "Noble Person", 12.0, List.of(1.0, 0.85, 0.7),
        BadgeType.COMBINATION, List.of(CAREER, RELATIONSHIP, WEALTH),
        new PillarMeanings(
            "Noble ancestry - helpful family connections",
            "Noble career - mentors and sponsors at work",
            "Noble partner - spouse brings good fortune",
            "Noble children - children bring honor"),
        new EventMapping(
            List.of(CAREER, RELATIONSHIP),
            List.of(event(CAREER, "promotion"), event(CAREER, "recognition"),
                    event(RELATIONSHIP, "new_relationship"), event(WEALTH, "windfall")),
            List.of(),
            List.of(sentiment(CAREER, Sentiment.POSITIVE), sentiment(RELATIONSHIP, Sentiment.POSITIVE),
                    sentiment(WEALTH, Sentiment.POSITIVE))),
        "Day Master %1$s has noble person in %2$s - benefactors and helpers",
        "Context-dependent: Only applies when Day Stem is %1$s");

    private static final StarTemplate TAO_HUA = new StarTemplate(
        PatternCategory.TAO_HUA, 320, "桃花", "Peach Blossom", 10.0, List.of(1.0, 0.8, 0.6),
        BadgeType.COMBINATION, List.of(RELATIONSHIP, CAREER),
        new PillarMeanings(
            "Family romance karma - attractive lineage",
            "Career charisma - popular at work",
            "Personal charm - romantic nature",
            "Late life romance - continued attraction"),
        new EventMapping(
            List.of(RELATIONSHIP),
            List.of(event(RELATIONSHIP, "new_relationship"), event(RELATIONSHIP, "marriage"),
                    event(CAREER, "recognition")),
            List.of(event(RELATIONSHIP, "breakup"), event(RELATIONSHIP, "conflict_partner")),
            List.of(sentiment(RELATIONSHIP, Sentiment.CONDITIONAL))),
        "Year/Day Branch %1$s has Peach Blossom in %2$s - romance and attraction",
        "Context-dependent: Only applies when Year or Day Branch is %1$s");

    private static final StarTemplate YI_MA = new StarTemplate(
        PatternCategory.YI_MA, 330, "驛馬", "Traveling Horse", 10.0, List.of(1.0, 0.8, 0.6),
        BadgeType.COMBINATION, List.of(TRAVEL, CAREER),
        new PillarMeanings(
            "Ancestral travel - family immigration history",
            "Career travel - work-related moves",
            "Personal movement - restless nature",
            "Late life travel - retirement relocations"),
        new EventMapping(
            List.of(TRAVEL),
            List.of(event(TRAVEL, "relocation_major"), event(TRAVEL, "immigration"), event(CAREER, "job_new")),
            List.of(),
            List.of(sentiment(TRAVEL, Sentiment.CONDITIONAL), sentiment(CAREER, Sentiment.CONDITIONAL))),
        "Year/Day Branch %1$s has Travel Horse in %2$s - movement and change",
        "Context-dependent: Only applies when Year or Day Branch is %1$s");

    private static final StarTemplate YANG_REN = new StarTemplate(
        PatternCategory.YANG_REN, 340, "羊刃", "Yang Blade", 12.0, List.of(1.0, 0.85, 0.7),
        BadgeType.CLASH, List.of(HEALTH, CAREER, LEGAL),
        new PillarMeanings(
            "Ancestral blade - aggressive family nature",
            "Career blade - competitive work environment",
            "Personal blade - aggressive personality",
            "Late blade - sharp tongue in old age"),
        new EventMapping(
            List.of(HEALTH, CAREER),
            List.of(event(CAREER, "promotion"), event(CAREER, "business_start")),
            List.of(event(HEALTH, "injury_accident"), event(HEALTH, "surgery"), event(LEGAL, "lawsuit_filed")),
            List.of(sentiment(HEALTH, Sentiment.NEGATIVE), sentiment(CAREER, Sentiment.CONDITIONAL),
                    sentiment(LEGAL, Sentiment.NEGATIVE))),
        "Day Master %1$s has Yang Blade in %2$s - aggressive/cutting energy",
        "Context-dependent: Only applies when Day Stem is %1$s (Yang stems only)");

    private static final StarTemplate LU_SHEN = new StarTemplate(
        PatternCategory.LU_SHEN, 350, "祿神", "Prosperity God", 12.0, List.of(1.0, 0.85, 0.7),
        BadgeType.COMBINATION, List.of(WEALTH, CAREER),
        new PillarMeanings(
            "Ancestral prosperity - inherited wealth",
            "Career prosperity - good salary",
            "Personal prosperity - self-made wealth",
            "Late prosperity - comfortable retirement"),
        new EventMapping(
            List.of(WEALTH, CAREER),
            List.of(event(WEALTH, "income_increase"), event(WEALTH, "investment_gain"), event(CAREER, "promotion")),
            List.of(),
            List.of(sentiment(WEALTH, Sentiment.POSITIVE), sentiment(CAREER, Sentiment.POSITIVE))),
        "Day Master %1$s has Prosperity God in %2$s - self-made wealth",
        "Context-dependent: Only applies when Day Stem is %1$s");

    private static final StarTemplate HUA_GAI = new StarTemplate(
        PatternCategory.HUA_GAI, 360, "華蓋", "Canopy Star", 8.0, List.of(1.0, 0.8, 0.6),
        BadgeType.COMBINATION, List.of(EDUCATION, CAREER),
        new PillarMeanings(
            "Ancestral canopy - artistic/spiritual lineage",
            "Career canopy - creative profession",
            "Personal canopy - artistic/spiritual nature",
            "Late canopy - contemplative old age"),
        new EventMapping(
            List.of(EDUCATION),
            List.of(event(EDUCATION, "certification"), event(CAREER, "recognition")),
            List.of(),
            List.of(sentiment(EDUCATION, Sentiment.POSITIVE), sentiment(CAREER, Sentiment.POSITIVE))),
        "Year/Day Branch %1$s has Canopy in %2$s - artistic/spiritual inclination",
        "Context-dependent: Only applies when Year or Day Branch is %1$s");

    private static final StarTemplate GU_CHEN = new StarTemplate(
        PatternCategory.GU_CHEN, 370, "孤辰", "Lonely Star", 10.0, List.of(1.0, 0.85, 0.7),
        BadgeType.CLASH, List.of(RELATIONSHIP, FAMILY),
        new PillarMeanings(
            "Ancestral loneliness - isolated family history",
            "Career loneliness - works alone, independent",
            "Personal loneliness - difficulty finding/keeping spouse",
            "Late loneliness - solitary in old age"),
        new EventMapping(
            List.of(RELATIONSHIP),
            List.of(),
            List.of(event(RELATIONSHIP, "breakup"), event(RELATIONSHIP, "divorce"), event(FAMILY, "separation")),
            List.of(sentiment(RELATIONSHIP, Sentiment.NEGATIVE), sentiment(FAMILY, Sentiment.NEGATIVE))),
        "Year Branch %1$s has Lonely Star in %2$s - isolation tendency",
        "Context-dependent: Only applies when Year Branch is %1$s. In Spouse Palace indicates marriage difficulty.");

    private static final StarTemplate GUA_SU = new StarTemplate(
        PatternCategory.GUA_SU, 375, "寡宿", "Widow Star", 10.0, List.of(1.0, 0.85, 0.7),
        BadgeType.CLASH, List.of(RELATIONSHIP, FAMILY),
        new PillarMeanings(
            "Ancestral widow - widowhood in family history",
            "Career solitude - professional independence",
            "Personal widow - risk of losing partner or no marriage",
            "Late solitude - alone in old age"),
        new EventMapping(
            List.of(RELATIONSHIP),
            List.of(),
            List.of(event(RELATIONSHIP, "breakup"), event(RELATIONSHIP, "divorce"), event(FAMILY, "loss_death")),
            List.of(sentiment(RELATIONSHIP, Sentiment.NEGATIVE), sentiment(FAMILY, Sentiment.NEGATIVE))),
        "Year Branch %1$s has Widow Star in %2$s - solitude tendency",
        "Context-dependent: Only applies when Year Branch is %1$s. In Spouse Palace indicates widowhood risk.");

    private static final List<PatternSpec> ALL = generateAll();

    private SpecialStarCatalog() {}

    /** Every generated star spec, grouped by star in catalog order. */
    public static List<PatternSpec> all() {
        return ALL;
    }

    /**
     * Stars applicable to a Day Master stem: void, noble helper, blade, prosperity.
     * Empty for an unknown stem.
     */
    public static List<PatternSpec> forDayMaster(String dayStem) {
        List<PatternSpec> stars = new ArrayList<>();
        if (dayStem == null) {
            return stars;
        }
        for (String branch : KONG_WANG_LOOKUP.getOrDefault(dayStem, List.of())) {
            stars.add(KONG_WANG.toSpec(dayStem, branch));
        }
        for (String branch : GUI_REN_LOOKUP.getOrDefault(dayStem, List.of())) {
            stars.add(GUI_REN.toSpec(dayStem, branch));
        }
        addIfPresent(stars, YANG_REN, YANG_REN_LOOKUP, dayStem);
        addIfPresent(stars, LU_SHEN, LU_SHEN_LOOKUP, dayStem);
        return stars;
    }

    /**
     * Stars applicable to a Year Branch: lonely, widow, canopy, romance, travel horse.
     * Empty for an unknown or blank branch.
     */
    public static List<PatternSpec> forYearBranch(String yearBranch) {
        List<PatternSpec> stars = new ArrayList<>();
        if (yearBranch == null || yearBranch.isEmpty()) {
            return stars;
        }
        addIfPresent(stars, GU_CHEN, GU_CHEN_LOOKUP, yearBranch);
        addIfPresent(stars, GUA_SU, GUA_SU_LOOKUP, yearBranch);
        addIfPresent(stars, HUA_GAI, HUA_GAI_LOOKUP, yearBranch);
        addIfPresent(stars, TAO_HUA, TAO_HUA_LOOKUP, yearBranch);
        addIfPresent(stars, YI_MA, YI_MA_LOOKUP, yearBranch);
        return stars;
    }

    private static void addIfPresent(List<PatternSpec> stars, StarTemplate template,
                                     Map<String, String> lookup, String key) {
        String branch = lookup.get(key);
        if (branch != null) {
            stars.add(template.toSpec(key, branch));
        }
    }

    private static List<PatternSpec> generateAll() {
        List<PatternSpec> specs = new ArrayList<>();
        KONG_WANG_LOOKUP.forEach((stem, branches) -> branches.forEach(b -> specs.add(KONG_WANG.toSpec(stem, b))));
        GUI_REN_LOOKUP.forEach((stem, branches) -> branches.forEach(b -> specs.add(GUI_REN.toSpec(stem, b))));
        TAO_HUA_LOOKUP.forEach((key, b) -> specs.add(TAO_HUA.toSpec(key, b)));
        YI_MA_LOOKUP.forEach((key, b) -> specs.add(YI_MA.toSpec(key, b)));
        YANG_REN_LOOKUP.forEach((key, b) -> specs.add(YANG_REN.toSpec(key, b)));
        LU_SHEN_LOOKUP.forEach((key, b) -> specs.add(LU_SHEN.toSpec(key, b)));
        HUA_GAI_LOOKUP.forEach((key, b) -> specs.add(HUA_GAI.toSpec(key, b)));
        GU_CHEN_LOOKUP.forEach((key, b) -> specs.add(GU_CHEN.toSpec(key, b)));
        GUA_SU_LOOKUP.forEach((key, b) -> specs.add(GUA_SU.toSpec(key, b)));
        return List.copyOf(specs);
    }

    // ── table helpers ────────────────────────────────────────────────────────

    /** key, target pairs */
    private static Map<String, String> single(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    /** key, target, target triples */
    private static Map<String, List<String>> multi(String... triples) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < triples.length; i += 3) {
            map.put(triples[i], List.of(triples[i + 1], triples[i + 2]));
        }
        return Collections.unmodifiableMap(map);
    }

    private static DomainEvent event(LifeDomain domain, String event) {
        return new DomainEvent(domain, event);
    }

    private static DomainSentiment sentiment(LifeDomain domain, Sentiment sentiment) {
        return new DomainSentiment(domain, sentiment);
    }

    private record StarTemplate(
        PatternCategory category,
        int priority,
        String nativeName,
        String englishPrefix,
        double baseScore,
        List<Double> distanceMultipliers,
        BadgeType badgeType,
        List<LifeDomain> lifeDomains,
        PillarMeanings pillarMeanings,
        EventMapping eventMapping,
        String descriptionFormat,
        String notesFormat
    ) {
        PatternSpec toSpec(String key, String targetBranch) {
            return new PatternSpec(
                category.name() + "~" + key + "~" + targetBranch,
                category,
                priority,
                nativeName,
                englishPrefix + " (" + targetBranch + ")",
                List.of(NodeFilter.ofBranches(targetBranch)),
                1,
                null,
                null,
                null,
                null,
                baseScore,
                null,
                distanceMultipliers,
                List.of(),
                badgeType,
                new LinkedHashSet<>(lifeDomains),
                pillarMeanings,
                eventMapping,
                String.format(descriptionFormat, key, targetBranch),
                CLASSICAL_SOURCE,
                String.format(notesFormat, key),
                null,
                null);
        }
    }
}
