package com.gt.vocab.fuzzy;

import com.gt.vocab.util.TermNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

// Decides whether a typed answer is close enough to one of the accepted answers to count as a typo
@Component
public class TypingJudge {

    static final int DEFAULT_NEAR_MATCH_THRESHOLD = 85;

    private final int nearMatchThreshold;

    @Autowired
    public TypingJudge(@Value("${vocab.fuzzy.nearMatchThreshold:" + DEFAULT_NEAR_MATCH_THRESHOLD + "}") int nearMatchThreshold) {
        this.nearMatchThreshold = nearMatchThreshold;
    }

    public boolean isNearCorrect(String userAnswer, Collection<String> candidates) {
        return isNearCorrect(userAnswer, candidates, nearMatchThreshold);
    }

    public boolean isNearCorrect(String userAnswer, Collection<String> candidates, int threshold) {
        String answer = TermNormalizer.normalize(userAnswer);
        if (answer.isEmpty() || candidates == null) {
            return false;
        }

        List<String> normalizedCandidates = candidates.stream()
                .map(TermNormalizer::normalize)
                .filter(candidate -> !candidate.isEmpty())
                .toList();
        if (normalizedCandidates.isEmpty()) {
            return false;
        }

        if (normalizedCandidates.contains(answer)) {
            return true;
        }

        double bestScore = normalizedCandidates.stream()
                .mapToDouble(candidate -> Math.max(similarity(answer, candidate), partialSimilarity(answer, candidate)))
                .max()
                .orElse(0);

        return bestScore >= threshold;
    }

    // 0..100 from the insert/delete distance over the combined length; 100 means identical
    static double similarity(String left, String right) {
        int totalLength = left.length() + right.length();
        if (totalLength == 0) {
            return 100;
        }
        return 100.0 * (1.0 - (double) indelDistance(left, right) / totalLength);
    }

    // Best similarity of the shorter string against every equally long window of the longer one
    static double partialSimilarity(String left, String right) {
        String shorter = left.length() <= right.length() ? left : right;
        String longer = left.length() <= right.length() ? right : left;
        if (shorter.isEmpty()) {
            return longer.isEmpty() ? 100 : 0;
        }

        double best = 0;
        for (int start = 0; start + shorter.length() <= longer.length(); start++) {
            best = Math.max(best, similarity(shorter, longer.substring(start, start + shorter.length())));
            if (best == 100) {
                break;
            }
        }
        return best;
    }

    // Insertions plus deletions needed to turn one string into the other; a swap of two letters costs 2
    static int indelDistance(String left, String right) {
        return left.length() + right.length() - 2 * longestCommonSubsequence(left, right);
    }

    // Two-row dynamic programming table
    static int longestCommonSubsequence(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];

        for (int i = 0; i < left.length(); i++) {
            current[0] = 0;
            for (int j = 0; j < right.length(); j++) {
                current[j + 1] = left.charAt(i) == right.charAt(j)
                        ? previous[j] + 1
                        : Integer.max(previous[j + 1], current[j]);
            }

            int[] temp = previous;
            previous = current;
            current = temp;
        }

        return previous[right.length()];
    }
}
