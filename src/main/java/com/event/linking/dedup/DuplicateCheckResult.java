package com.event.linking.dedup;

/**
 * Outcome of a duplicate check.
 *
 * @param articleId          the checked article
 * @param duplicate          whether a duplicate was found
 * @param canonicalArticleId canonical article of the matched group, null for originals
 * @param matchedArticleId   the indexed article that matched, null for originals
 * @param matchKind          how the duplicate was found
 * @param hammingDistance    SimHash distance to the match, 0 for exact matches, -1 for originals
 * @param fingerprint        fingerprints computed for the article
 */
public record DuplicateCheckResult(
        String articleId,
        boolean duplicate,
        String canonicalArticleId,
        String matchedArticleId,
        MatchKind matchKind,
        int hammingDistance,
        Fingerprint fingerprint
) {
    public enum MatchKind {
        CANONICAL_URL,
        CONTENT_HASH,
        SIMHASH,
        NONE
    }

    public static DuplicateCheckResult original(String articleId, Fingerprint fingerprint) {
        return new DuplicateCheckResult(articleId, false, null, null, MatchKind.NONE, -1, fingerprint);
    }

    public static DuplicateCheckResult duplicateOf(String articleId, String canonicalArticleId,
                                                   String matchedArticleId, MatchKind kind,
                                                   int hammingDistance, Fingerprint fingerprint) {
        return new DuplicateCheckResult(articleId, true, canonicalArticleId, matchedArticleId,
                kind, hammingDistance, fingerprint);
    }
}
