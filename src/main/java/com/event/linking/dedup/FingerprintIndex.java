package com.event.linking.dedup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lookup structures for duplicate candidates: exact canonical URL, exact content hash, and a
 * banded LSH index over SimHash values.
 *
 * <p>The 64-bit SimHash is cut into {@code bands} slices; two hashes within Hamming distance
 * {@code bands - 1} agree on at least one slice, so probing each slice's bucket finds every
 * such neighbour without scanning the index.</p>
 *
 * <p>Not thread-safe. {@link NearDuplicateDetector} guards it with its read/write lock.</p>
 */
public class FingerprintIndex {

    private final int bands;
    private final int bitsPerBand;
    private final long bandMask;

    private final Map<String, IndexedArticle> articles = new HashMap<>();
    private final Map<String, Set<String>> byUrl = new HashMap<>();
    private final Map<String, Set<String>> byContentHash = new HashMap<>();
    private final List<Map<Long, Set<String>>> bandBuckets;

    public FingerprintIndex(int bands) {
        if (bands < 1 || DuplicateDetectionConfig.SIMHASH_BITS % bands != 0) {
            throw new IllegalArgumentException("bands must divide 64, got " + bands);
        }
        this.bands = bands;
        this.bitsPerBand = DuplicateDetectionConfig.SIMHASH_BITS / bands;
        this.bandMask = bitsPerBand == 64 ? -1L : (1L << bitsPerBand) - 1;
        this.bandBuckets = new ArrayList<>(bands);
        for (int i = 0; i < bands; i++) {
            bandBuckets.add(new HashMap<>());
        }
    }

    public void add(IndexedArticle article) {
        if (articles.containsKey(article.articleId())) {
            throw new IllegalStateException("Article already indexed: " + article.articleId());
        }
        articles.put(article.articleId(), article);
        if (article.canonicalUrl() != null) {
            byUrl.computeIfAbsent(article.canonicalUrl(), k -> new LinkedHashSet<>()).add(article.articleId());
        }
        if (article.contentHash() != null) {
            byContentHash.computeIfAbsent(article.contentHash(), k -> new LinkedHashSet<>()).add(article.articleId());
        }
        if (article.simHash() != null) {
            for (int band = 0; band < bands; band++) {
                bandBuckets.get(band)
                        .computeIfAbsent(bandValue(article.simHash(), band), k -> new LinkedHashSet<>())
                        .add(article.articleId());
            }
        }
    }

    /**
     * Removes an article from every structure. Used to roll back a failed registration.
     */
    public boolean remove(String articleId) {
        IndexedArticle article = articles.remove(articleId);
        if (article == null) {
            return false;
        }
        removeFrom(byUrl, article.canonicalUrl(), articleId);
        removeFrom(byContentHash, article.contentHash(), articleId);
        if (article.simHash() != null) {
            for (int band = 0; band < bands; band++) {
                removeFrom(bandBuckets.get(band), bandValue(article.simHash(), band), articleId);
            }
        }
        return true;
    }

    public Optional<IndexedArticle> get(String articleId) {
        return Optional.ofNullable(articles.get(articleId));
    }

    public boolean contains(String articleId) {
        return articles.containsKey(articleId);
    }

    public List<IndexedArticle> byCanonicalUrl(String canonicalUrl) {
        return resolve(canonicalUrl == null ? null : byUrl.get(canonicalUrl));
    }

    public List<IndexedArticle> byContentHash(String contentHash) {
        return resolve(contentHash == null ? null : byContentHash.get(contentHash));
    }

    /**
     * Articles sharing at least one band with the hash, in id order.
     */
    public List<IndexedArticle> nearCandidates(long simHash) {
        Set<String> ids = new TreeSet<>();
        for (int band = 0; band < bands; band++) {
            Set<String> bucket = bandBuckets.get(band).get(bandValue(simHash, band));
            if (bucket != null) {
                ids.addAll(bucket);
            }
        }
        return resolve(ids);
    }

    public int size() {
        return articles.size();
    }

    long bandValue(long simHash, int band) {
        return (simHash >>> (band * bitsPerBand)) & bandMask;
    }

    private List<IndexedArticle> resolve(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<IndexedArticle> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(articles.get(id));
        }
        return result;
    }

    private static <K> void removeFrom(Map<K, Set<String>> map, K key, String articleId) {
        if (key == null) {
            return;
        }
        Set<String> ids = map.get(key);
        if (ids != null) {
            ids.remove(articleId);
            if (ids.isEmpty()) {
                map.remove(key);
            }
        }
    }
}
