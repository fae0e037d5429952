package com.pillarpattern.core.taxonomy;

import java.util.List;
import java.util.Map;

/**
 * Traditional organ pairing per element, used by the health deep-dive.
 */
public enum OrganSystem {
    WOOD("Wood", "Liver", "Gallbladder", "肝", "膽",
        List.of("eyes", "tendons", "nails", "sinews"), "anger", "Spring", "green",
        "Support %s through gentle exercise, avoid anger, eat green vegetables"),
    FIRE("Fire", "Heart", "Small Intestine", "心", "小腸",
        List.of("tongue", "blood_vessels", "complexion", "sweat"), "joy/anxiety", "Summer", "red",
        "Protect %s through adequate rest, manage anxiety, avoid excessive heat"),
    EARTH("Earth", "Spleen", "Stomach", "脾", "胃",
        List.of("muscles", "mouth", "lips", "flesh"), "worry", "Late Summer", "yellow",
        "Strengthen %s through regular meals, reduce worry, avoid dampness"),
    METAL("Metal", "Lungs", "Large Intestine", "肺", "大腸",
        List.of("skin", "nose", "body_hair", "pores"), "grief", "Autumn", "white",
        "Support %s through breathing exercises, process grief, protect from cold"),
    WATER("Water", "Kidneys", "Bladder", "腎", "膀胱",
        List.of("bones", "ears", "head_hair", "marrow", "brain"), "fear", "Winter", "black",
        "Nourish %s through adequate hydration, manage fear, get sufficient rest");

    private static final Map<String, OrganSystem> BY_ELEMENT = Map.of(
        "Wood",  WOOD,
        "Fire",  FIRE,
        "Earth", EARTH,
        "Metal", METAL,
        "Water", WATER
    );

    private final String element;
    private final String zangOrgan;
    private final String fuOrgan;
    private final String nativeZang;
    private final String nativeFu;
    private final List<String> bodyParts;
    private final String emotion;
    private final String season;
    private final String color;
    private final String careTemplate;

    OrganSystem(String element, String zangOrgan, String fuOrgan, String nativeZang, String nativeFu,
                List<String> bodyParts, String emotion, String season, String color, String careTemplate) {
        this.element = element;
        this.zangOrgan = zangOrgan;
        this.fuOrgan = fuOrgan;
        this.nativeZang = nativeZang;
        this.nativeFu = nativeFu;
        this.bodyParts = bodyParts;
        this.emotion = emotion;
        this.season = season;
        this.color = color;
        this.careTemplate = careTemplate;
    }

    /** Returns null for anything that is not one of the five element names. */
    public static OrganSystem forElement(String element) {
        return element == null ? null : BY_ELEMENT.get(element);
    }

    public String element()        { return element; }
    public String zangOrgan()      { return zangOrgan; }
    public String fuOrgan()        { return fuOrgan; }
    public String nativeZang()     { return nativeZang; }
    public String nativeFu()       { return nativeFu; }
    public List<String> bodyParts() { return bodyParts; }
    public String emotion()        { return emotion; }
    public String season()         { return season; }
    public String color()          { return color; }

    /** Self-care advice naming the zang organ. */
    public String careAdvice() {
        return String.format(careTemplate, zangOrgan);
    }
}
