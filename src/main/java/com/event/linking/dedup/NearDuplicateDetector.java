package com.event.linking.dedup;

import com.event.linking.core.model.ArticleRecord;
import com.event.linking.dedup.DuplicateCheckResult.MatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Decides whether an incoming article repeats one already seen.
 *
 * <p>Exact canonical URL and content hash matches are checked first, then SimHash neighbours
 * from the LSH index. A candidate counts only when published within the configured window.
 * The best candidate has the smallest distance, then the closest publication time, then the
 * lowest id. A duplicate joins the group of the candidate's canonical article, and every
 * registered article stays indexed so that duplicates of duplicates resolve to the same
 * canonical id.</p>
 *
 * <p>Articles without usable text skip detection, canonical URL included, and are treated as
 * originals. Their URL is not indexed.</p>
 */
public class NearDuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(NearDuplicateDetector.class);

    private final TextFingerprinter fingerprinter;
    private final DuplicateDetectionConfig config;
    private final FingerprintIndex index;
    private final DuplicateGroupRepository groups;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public NearDuplicateDetector(TextFingerprinter fingerprinter, DuplicateDetectionConfig config) {
        this(fingerprinter, config, new DuplicateGroupRepository());
    }

    public NearDuplicateDetector(TextFingerprinter fingerprinter, DuplicateDetectionConfig config,
                                 DuplicateGroupRepository groups) {
        this.fingerprinter = fingerprinter;
        this.config = config;
        this.index = new FingerprintIndex(config.bands());
        this.groups = groups;
    }

    /**
     * Checks an article without registering it.
     */
    public DuplicateCheckResult check(ArticleRecord article) {
        Fingerprint fingerprint = fingerprintOf(article);
        lock.readLock().lock();
        try {
            return findDuplicate(article, fingerprint);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks an article and registers it, as a new group's canonical member or as a duplicate,
     * in one step under the write lock.
     *
     * @throws IllegalStateException if the article is already registered
     */
    public DuplicateCheckResult checkAndRegister(ArticleRecord article) {
        Fingerprint fingerprint = fingerprintOf(article);
        lock.writeLock().lock();
        try {
            if (index.contains(article.getId())) {
                throw new IllegalStateException("Article already registered: " + article.getId());
            }
            DuplicateCheckResult result = findDuplicate(article, fingerprint);
            if (result.duplicate()) {
                groups.addDuplicate(result.canonicalArticleId(), article.getId());
            } else {
                groups.seed(article.getId());
            }
            String url = fingerprint.isEmpty() ? null : article.getCanonicalUrl();
            index.add(new IndexedArticle(article.getId(), url,
                    fingerprint.contentHash(), fingerprint.simHash(), article.getPublishedAt()));

            if (result.duplicate()) {
                log.info("dedup.duplicate articleId={} canonicalId={} kind={} distance={}",
                        article.getId(), result.canonicalArticleId(), result.matchKind(), result.hammingDistance());
            } else {
                log.debug("dedup.original articleId={} emptyText={}", article.getId(), fingerprint.isEmpty());
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reverses {@link #checkAndRegister(ArticleRecord)} for a failed ingestion.
     */
    public void unregister(String articleId) {
        lock.writeLock().lock();
        try {
            index.remove(articleId);
            groups.remove(articleId);
            log.debug("dedup.unregistered articleId={}", articleId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<String> canonicalOf(String articleId) {
        lock.readLock().lock();
        try {
            return groups.canonicalOf(articleId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> duplicateMapping() {
        lock.readLock().lock();
        try {
            return groups.duplicateMapping();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int indexedCount() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Fingerprint fingerprintOf(ArticleRecord article) {
        Fingerprint computed = fingerprinter.fingerprint(article);
        // Upstream-provided fingerprints win over computed ones
        String hash = article.getContentHash() != null ? article.getContentHash() : computed.contentHash();
        Long simHash = article.getSimHash() != null ? article.getSimHash() : computed.simHash();
        return new Fingerprint(hash, simHash);
    }

    private DuplicateCheckResult findDuplicate(ArticleRecord article, Fingerprint fingerprint) {
        if (fingerprint.isEmpty()) {
            return DuplicateCheckResult.original(article.getId(), fingerprint);
        }
        Instant publishedAt = article.getPublishedAt();

        Optional<Candidate> exact = bestOf(index.byCanonicalUrl(article.getCanonicalUrl()), publishedAt,
                MatchKind.CANONICAL_URL, fingerprint, article.getId());
        if (exact.isEmpty()) {
            exact = bestOf(index.byContentHash(fingerprint.contentHash()), publishedAt,
                    MatchKind.CONTENT_HASH, fingerprint, article.getId());
        }
        if (exact.isPresent()) {
            return toResult(article, exact.get(), fingerprint);
        }

        if (fingerprint.simHash() == null) {
            return DuplicateCheckResult.original(article.getId(), fingerprint);
        }
        return bestOf(index.nearCandidates(fingerprint.simHash()), publishedAt,
                MatchKind.SIMHASH, fingerprint, article.getId())
                .map(candidate -> toResult(article, candidate, fingerprint))
                .orElseGet(() -> DuplicateCheckResult.original(article.getId(), fingerprint));
    }

    private Optional<Candidate> bestOf(List<IndexedArticle> indexed, Instant publishedAt, MatchKind kind,
                                       Fingerprint fingerprint, String articleId) {
        return indexed.stream()
                .filter(other -> !other.articleId().equals(articleId))
                .filter(other -> withinWindow(publishedAt, other.publishedAt()))
                .map(other -> new Candidate(other, kind, distance(kind, fingerprint, other),
                        Duration.between(publishedAt, other.publishedAt()).abs()))
                .filter(candidate -> candidate.distance() <= config.maxHammingDistance())
                .min(Comparator.comparingInt(Candidate::distance)
                        .thenComparing(Candidate::timeGap)
                        .thenComparing(candidate -> candidate.article().articleId()));
    }

    private static int distance(MatchKind kind, Fingerprint fingerprint, IndexedArticle other) {
        if (kind != MatchKind.SIMHASH) {
            return 0;
        }
        if (other.simHash() == null) {
            return Integer.MAX_VALUE;
        }
        return TextFingerprinter.hammingDistance(fingerprint.simHash(), other.simHash());
    }

    private boolean withinWindow(Instant a, Instant b) {
        return Duration.between(a, b).abs().compareTo(config.window()) <= 0;
    }

    private DuplicateCheckResult toResult(ArticleRecord article, Candidate candidate, Fingerprint fingerprint) {
        String matchedId = candidate.article().articleId();
        String canonicalId = groups.canonicalOf(matchedId).orElse(matchedId);
        return DuplicateCheckResult.duplicateOf(article.getId(), canonicalId, matchedId,
                candidate.kind(), candidate.distance(), fingerprint);
    }

    private record Candidate(IndexedArticle article, MatchKind kind, int distance, Duration timeGap) {
    }
}
