package com.event.linking.dedup;

import com.event.linking.core.model.ArticleRecord;
import com.event.linking.rules.NormalizationEngine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Computes content hashes and SimHash values of article text.
 *
 * <p>Text is folded line by line, boilerplate lines and fragments are removed, and the remaining
 * words are tokenized. The content hash covers the cleaned token stream, so whitespace,
 * punctuation and accent differences do not change it.</p>
 */
public class TextFingerprinter {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final NormalizationEngine engine;
    private final int shingleSize;
    private final List<Pattern> boilerplate;

    public TextFingerprinter(NormalizationEngine engine, DuplicateDetectionConfig config) {
        this.engine = engine;
        this.shingleSize = config.shingleSize();
        this.boilerplate = config.boilerplatePatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    public Fingerprint fingerprint(ArticleRecord article) {
        List<String> tokens = engine.tokenize(stripBoilerplate(article.fullText()));
        if (tokens.isEmpty()) {
            return Fingerprint.empty();
        }
        return new Fingerprint(sha256(String.join(" ", tokens)), simHash(tokens));
    }

    /**
     * Folds each line and removes boilerplate. Line structure is kept for line-anchored patterns.
     */
    public String stripBoilerplate(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        StringBuilder folded = new StringBuilder();
        for (String line : text.split("\\R")) {
            folded.append(NormalizationEngine.fold(line)).append('\n');
        }
        String result = folded.toString();
        for (Pattern pattern : boilerplate) {
            result = pattern.matcher(result).replaceAll(" ");
        }
        return result;
    }

    /**
     * SimHash over word shingles. Texts shorter than one shingle hash as a single shingle.
     */
    public long simHash(List<String> tokens) {
        int[] votes = new int[DuplicateDetectionConfig.SIMHASH_BITS];
        for (String shingle : shingles(tokens)) {
            long hash = hash64(shingle);
            for (int bit = 0; bit < votes.length; bit++) {
                votes[bit] += ((hash >>> bit) & 1L) == 1L ? 1 : -1;
            }
        }
        long result = 0L;
        for (int bit = 0; bit < votes.length; bit++) {
            if (votes[bit] > 0) {
                result |= 1L << bit;
            }
        }
        return result;
    }

    List<String> shingles(List<String> tokens) {
        List<String> shingles = new ArrayList<>();
        if (tokens.size() <= shingleSize) {
            shingles.add(String.join(" ", tokens));
            return shingles;
        }
        for (int i = 0; i + shingleSize <= tokens.size(); i++) {
            shingles.add(String.join(" ", tokens.subList(i, i + shingleSize)));
        }
        return shingles;
    }

    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    /**
     * FNV-1a over UTF-8 bytes followed by a 64-bit finalizer to spread short-input bits.
     */
    static long hash64(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        hash ^= hash >>> 33;
        hash *= 0xff51afd7ed558ccdL;
        hash ^= hash >>> 33;
        hash *= 0xc4ceb9fe1a85ec53L;
        hash ^= hash >>> 33;
        return hash;
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
