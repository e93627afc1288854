package io.pagetree.core.validate;

import io.pagetree.core.spi.TypeVocabulary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ranks known type tags by similarity to an unrecognized one.
 *
 * <p>
 * For every known tag the edit distance is taken against the full name and against the short name
 * (input short name vs. tag short name); the smaller distance counts, and its pair's longer length
 * normalizes the score: {@code (maxLen - distance + bonus) / maxLen}. The bonus applies when one
 * short name contains the other. Candidates at or above {@link #THRESHOLD}, or with a bonus, are
 * kept; the best {@link #MAX_SUGGESTIONS} are returned. Comparison is case-insensitive. Equal
 * scores keep vocabulary order, so results are deterministic.
 *
 * <p>
 * Immutable, thread-safe.
 */
public final class TypeSuggester {

    static final double THRESHOLD = 0.5;
    static final int SUBSTRING_BONUS = 2;
    static final int MIN_SUBSTRING_LENGTH = 3;
    static final int MAX_SUGGESTIONS = 3;

    private final TypeVocabulary vocabulary;

    public TypeSuggester(TypeVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
    }

    /** Up to three known tags similar to {@code type}, best first; empty when nothing is close. */
    public List<String> suggest(String type) {
        if (type == null || type.isBlank()) {
            return List.of();
        }
        String input = type.trim().toLowerCase(Locale.ROOT);
        String inputShort = vocabulary.shortName(type.trim()).toLowerCase(Locale.ROOT);

        List<Candidate> candidates = new ArrayList<>();
        List<String> known = vocabulary.types();
        for (int i = 0; i < known.size(); i++) {
            String full = known.get(i);
            double score = score(input, inputShort, full);
            if (score >= THRESHOLD) {
                candidates.add(new Candidate(full, score, i));
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::score)
                .reversed()
                .thenComparingInt(Candidate::order));
        return candidates.stream()
                .limit(MAX_SUGGESTIONS)
                .map(Candidate::type)
                .toList();
    }

    /** Similarity of {@code input} to the known tag {@code full}; a bonus-carrying pair always passes. */
    double score(String input, String inputShort, String full) {
        String fullLower = full.toLowerCase(Locale.ROOT);
        String shortLower = vocabulary.shortName(full).toLowerCase(Locale.ROOT);

        int shortDistance = levenshtein(inputShort, shortLower);
        int fullDistance = levenshtein(input, fullLower);

        int distance;
        int maxLen;
        if (fullDistance < shortDistance) {
            distance = fullDistance;
            maxLen = Math.max(input.length(), fullLower.length());
        } else {
            distance = shortDistance;
            maxLen = Math.max(inputShort.length(), shortLower.length());
        }
        if (maxLen == 0) {
            return 0;
        }

        boolean substring = inputShort.length() >= MIN_SUBSTRING_LENGTH
                && shortLower.length() >= MIN_SUBSTRING_LENGTH
                && (inputShort.contains(shortLower) || shortLower.contains(inputShort));
        int bonus = substring ? SUBSTRING_BONUS : 0;
        double score = (double) (maxLen - distance + bonus) / maxLen;
        return substring ? Math.max(score, THRESHOLD) : score;
    }

    /** Classic edit distance (insert, delete, substitute; unit costs), two-row table. */
    static int levenshtein(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Candidate(String type, double score, int order) {}
}
