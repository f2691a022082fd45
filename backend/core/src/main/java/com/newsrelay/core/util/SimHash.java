package com.newsrelay.core.util;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SimHash {
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final int TITLE_WEIGHT = 2;
    private static final int TEXT_WEIGHT = 1;

    private SimHash() {
    }

    public static long fingerprint(String title, String text) {
        Map<String, Integer> features = new LinkedHashMap<>();
        addFeatures(features, TextNormalizer.words(title), TITLE_WEIGHT);
        addFeatures(features, TextNormalizer.words(text), TEXT_WEIGHT);

        long[] vector = new long[64];
        for (Map.Entry<String, Integer> feature : features.entrySet()) {
            long hash = hash64(feature.getKey());
            int weight = feature.getValue();
            for (int bit = 0; bit < 64; bit++) {
                vector[bit] += ((hash >>> bit) & 1L) == 1L ? weight : -weight;
            }
        }

        long fingerprint = 0L;
        for (int bit = 0; bit < 64; bit++) {
            if (vector[bit] > 0) {
                fingerprint |= 1L << bit;
            }
        }
        return fingerprint;
    }

    public static int distance(long left, long right) {
        return Long.bitCount(left ^ right);
    }

    private static void addFeatures(Map<String, Integer> features, List<String> words, int weight) {
        for (int i = 0; i < words.size(); i++) {
            features.merge(words.get(i), weight, Integer::sum);
            if (i + 1 < words.size()) {
                features.merge(words.get(i) + " " + words.get(i + 1), weight, Integer::sum);
            }
        }
    }

    // FNV-1a followed by the murmur3 finalizer to spread bits.
    static long hash64(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        hash ^= hash >>> 33;
        hash *= 0xff51afd7ed558ccdL;
        hash ^= hash >>> 33;
        hash *= 0xc4ceb9fe1a85ec53L;
        hash ^= hash >>> 33;
        return hash;
    }
}
