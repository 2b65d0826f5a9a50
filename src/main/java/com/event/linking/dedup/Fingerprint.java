package com.event.linking.dedup;

/**
 * Text fingerprints of an article.
 *
 * @param contentHash SHA-256 of the cleaned text, null when there is no usable text
 * @param simHash     64-bit SimHash of word shingles, null when there is no usable text
 */
public record Fingerprint(String contentHash, Long simHash) {

    public static Fingerprint empty() {
        return new Fingerprint(null, null);
    }

    public boolean isEmpty() {
        return contentHash == null && simHash == null;
    }
}
