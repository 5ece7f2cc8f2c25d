package com.example.clusteragent.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Vector math and text helpers shared by the stores and the ranking.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity between two vectors, in [-1, 1]; 0 when undefined.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        return denom == 0 ? 0.0 : dot / denom;
    }

    public static String serialize(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10);
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.toString();
    }

    public static float[] parse(String csv) {
        if (csv == null || csv.isBlank()) {
            return new float[0];
        }
        String[] parts = csv.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    /**
     * Lower-cased words longer than two characters, in order of appearance, without duplicates.
     */
    public static List<String> keywords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9.\\-]+")) {
            if (word.length() > 2 && !words.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Fraction of the keywords contained in the text.
     */
    public static double keywordScore(List<String> keywords, String text) {
        if (keywords.isEmpty() || text == null) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        long matched = keywords.stream().filter(haystack::contains).count();
        return (double) matched / keywords.size();
    }
}
