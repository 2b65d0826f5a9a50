package com.event.linking.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes extracted attribute values and article text so that variant spellings compare equal.
 *
 * <p>Every value is first folded: Unicode decomposition with combining marks removed (which strips
 * Greek tonos and dialytika), lowercasing, final sigma mapped to sigma, and whitespace collapsed.
 * Rules then run in priority order (lower number first), filtered by {@link AttributeKind}, and
 * finally the result is looked up in the {@link AliasTable}.</p>
 *
 * <p>The rule list is replaced atomically on modification, so a configured engine can be shared
 * between ingestion threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOPWORDS = Set.of(
            // English
            "the", "a", "an", "and", "or", "of", "in", "on", "at", "to", "for", "by", "with",
            "from", "is", "are", "was", "were", "be", "has", "have", "will", "that", "this", "as", "it",
            // Greek, folded
            "και", "το", "τα", "τη", "την", "της", "του", "των", "τον", "τις", "τους", "ο", "η", "οι",
            "σε", "στο", "στη", "στην", "στα", "στις", "στους", "στον", "απο", "για", "με", "να", "θα",
            "που", "ειναι", "ενα", "μια", "ως", "κατα", "μετα", "προς", "δεν", "ή");

    private volatile List<NormalizationRule> rules;
    private volatile AliasTable aliases;

    public NormalizationEngine() {
        this(List.of(), AliasTable.empty());
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this(rules, AliasTable.empty());
    }

    public NormalizationEngine(List<NormalizationRule> rules, AliasTable aliases) {
        this.rules = sorted(rules);
        this.aliases = aliases != null ? aliases : AliasTable.empty();
    }

    public synchronized void addRule(NormalizationRule rule) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        next.add(rule);
        rules = sorted(next);
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        next.addAll(newRules);
        rules = sorted(next);
    }

    public synchronized boolean removeRule(String ruleName) {
        List<NormalizationRule> next = new ArrayList<>(rules);
        boolean removed = next.removeIf(r -> r.getName().equals(ruleName));
        rules = List.copyOf(next);
        return removed;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    public AliasTable getAliases() {
        return aliases;
    }

    /**
     * Overlays additional aliases on the current table.
     */
    public synchronized void addAliases(AliasTable more) {
        aliases = aliases.mergedWith(more);
    }

    /**
     * Case, accent and whitespace folding shared by the engine and the alias table.
     */
    public static String fold(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lower = stripped.toLowerCase(Locale.ROOT).replace('ς', 'σ');
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    /**
     * Normalizes a value of the given kind. Blank input gives an empty string.
     */
    public String normalize(String value, AttributeKind kind) {
        String result = fold(value);
        if (result.isEmpty()) {
            return result;
        }
        if (kind != null) {
            Optional<String> direct = aliases.lookup(kind, result);
            if (direct.isPresent()) {
                return direct.get();
            }
        }

        for (NormalizationRule rule : rules) {
            if (kind == null || rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("normalize.rule name={} before='{}' after='{}'", rule.getName(), before, result);
                }
            }
        }

        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        return kind != null ? aliases.resolve(kind, result) : result;
    }

    public String normalizeSector(String sector) {
        return normalize(sector, AttributeKind.SECTOR);
    }

    public String normalizeActor(String actor) {
        return normalize(actor, AttributeKind.ACTOR);
    }

    public String normalizeLocation(String location) {
        return normalize(location, AttributeKind.LOCATION);
    }

    /**
     * Checks if two values are equivalent after normalization.
     */
    public boolean areEquivalent(String a, String b, AttributeKind kind) {
        String na = normalize(a, kind);
        return !na.isEmpty() && na.equals(normalize(b, kind));
    }

    /**
     * Splits text into folded word tokens with stopwords and single characters removed.
     * Token order is preserved.
     */
    public List<String> tokenize(String text) {
        String folded = fold(text);
        if (folded.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : NON_WORD.split(folded)) {
            if (token.length() > 1 && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static List<NormalizationRule> sorted(List<NormalizationRule> rules) {
        List<NormalizationRule> copy = new ArrayList<>(rules);
        copy.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        return List.copyOf(copy);
    }
}
