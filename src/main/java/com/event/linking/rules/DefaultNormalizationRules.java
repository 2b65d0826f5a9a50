package com.event.linking.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules and aliases for Greek and English labour news.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules and aliases.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getCommonRules());
        rules.addAll(getSectorRules());
        rules.addAll(getActorRules());
        rules.addAll(getLocationRules());
        return new NormalizationEngine(rules, getDefaultAliases());
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Dotted acronyms: Γ.Σ.Ε.Ε. becomes γσεε
                NormalizationRule.builder()
                        .name("actor-acronym-dots")
                        .pattern("(?<=\\p{L})\\.(?=\\p{L}|\\s|$)")
                        .replacement("")
                        .applicableKinds(AttributeKind.ACTOR)
                        .priority(4)
                        .build(),

                NormalizationRule.builder()
                        .name("strip-punctuation")
                        .pattern("[\"'`«»“”‘’.,;:!?()\\[\\]{}]")
                        .replacement(" ")
                        .applicableKinds(AttributeKind.SECTOR, AttributeKind.ACTOR, AttributeKind.LOCATION)
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getSectorRules() {
        return List.of(
                // Label vocabulary uses snake_case (public_services, food_industry)
                NormalizationRule.builder()
                        .name("sector-underscore")
                        .pattern("[_\\-]+")
                        .replacement(" ")
                        .applicableKinds(AttributeKind.SECTOR)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("sector-suffix")
                        .pattern("\\s+(sector|industry workers|workers)$")
                        .replacement("")
                        .applicableKinds(AttributeKind.SECTOR)
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("sector-prefix-greek")
                        .pattern("^(κλαδοσ|τομεασ)\\s+")
                        .replacement("")
                        .applicableKinds(AttributeKind.SECTOR)
                        .priority(30)
                        .build()
        );
    }

    public static List<NormalizationRule> getActorRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("actor-leading-article")
                        .pattern("^(the|ο|η|το|οι|τα)\\s+")
                        .replacement("")
                        .applicableKinds(AttributeKind.ACTOR)
                        .priority(30)
                        .build()
        );
    }

    public static List<NormalizationRule> getLocationRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("location-prefix")
                        .pattern("^(city of|municipality of|region of|port of|δημοσ|περιφερεια|νομοσ|λιμανι)\\s+")
                        .replacement("")
                        .applicableKinds(AttributeKind.LOCATION)
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("location-suffix")
                        .pattern("\\s+(city|prefecture|region|port|greece)$")
                        .replacement("")
                        .applicableKinds(AttributeKind.LOCATION)
                        .priority(30)
                        .build()
        );
    }

    public static AliasTable getDefaultAliases() {
        return AliasTable.builder()
                // Sectors, canonical names follow the label vocabulary
                .alias(AttributeKind.SECTOR, "transport", "μεταφορες", "transportation", "συγκοινωνιες")
                .alias(AttributeKind.SECTOR, "education", "εκπαιδευση", "παιδεια", "schools", "teachers")
                .alias(AttributeKind.SECTOR, "health", "υγεια", "healthcare", "hospitals", "νοσοκομεια")
                .alias(AttributeKind.SECTOR, "manufacturing", "βιομηχανια", "industry")
                .alias(AttributeKind.SECTOR, "construction", "οικοδομη", "κατασκευες")
                .alias(AttributeKind.SECTOR, "public services", "δημοσιο", "δημοσιοσ τομεασ", "public sector", "civil service")
                .alias(AttributeKind.SECTOR, "retail", "εμπορειο", "λιανικη")
                .alias(AttributeKind.SECTOR, "food industry", "επισιτισμοσ", "food")
                .alias(AttributeKind.SECTOR, "energy", "ενεργεια")
                .alias(AttributeKind.SECTOR, "telecommunications", "τηλεπικοινωνιεσ", "telecoms")
                .alias(AttributeKind.SECTOR, "finance", "τραπεζεσ", "banking", "banks")
                .alias(AttributeKind.SECTOR, "tourism", "τουρισμοσ")
                .alias(AttributeKind.SECTOR, "agriculture", "αγροτεσ", "farmers", "γεωργια")
                .alias(AttributeKind.SECTOR, "maritime", "ναυτιλια", "shipping", "ναυτεσ", "seafarers")
                .alias(AttributeKind.SECTOR, "other", "αλλο")
                // Confederations and federations
                .alias(AttributeKind.ACTOR, "gsee", "γσεε", "general confederation of greek workers")
                .alias(AttributeKind.ACTOR, "adedy", "αδεδυ", "civil servants confederation")
                .alias(AttributeKind.ACTOR, "pame", "παμε", "all workers militant front")
                .alias(AttributeKind.ACTOR, "pno", "πνο", "panhellenic seamen's federation", "panhellenic seamens federation")
                .alias(AttributeKind.ACTOR, "olme", "ολμε")
                .alias(AttributeKind.ACTOR, "doe", "δοε")
                .alias(AttributeKind.ACTOR, "poedin", "ποεδην")
                // Places
                .alias(AttributeKind.LOCATION, "athens", "αθηνα", "athina", "αθηνων")
                .alias(AttributeKind.LOCATION, "thessaloniki", "θεσσαλονικη", "salonica", "thessalonica")
                .alias(AttributeKind.LOCATION, "piraeus", "πειραιασ", "πειραια", "peiraias")
                .alias(AttributeKind.LOCATION, "patras", "πατρα", "patra")
                .alias(AttributeKind.LOCATION, "heraklion", "ηρακλειο", "iraklio")
                .alias(AttributeKind.LOCATION, "attica", "αττικη", "attiki")
                .alias(AttributeKind.LOCATION, "greece", "ελλαδα", "hellas", "nationwide", "πανελλαδικα")
                .build();
    }
}
