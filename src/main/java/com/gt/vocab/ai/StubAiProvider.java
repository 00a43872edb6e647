package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

// Deterministic local provider; used when no remote key is configured and as the fallback for remote failures
public class StubAiProvider implements AiProvider {

    public static final String PROVIDER_NAME = "stub";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @Override
    public ObjectNode enrich(String term, List<String> meanings, EnrichMissing missing) {
        ObjectNode data = NODES.objectNode();

        if (missing.needExamples()) {
            ObjectNode example = data.putArray("examples").addObject();
            example.put("en", "I used '" + term + "' in a sentence today.");
            example.put("vi", "Hom nay toi da dung tu '" + term + "' trong mot cau.");
        }
        if (missing.needMnemonics()) {
            data.putArray("mnemonics").add("Think of '" + term + "' as a keyword tied to a memorable scene.");
        }
        if (missing.needMeaningVariants()) {
            String seed = meanings.isEmpty() ? term : meanings.get(0);
            data.putArray("meaningVariants").add(seed).add(seed + " (alternate)");
        }
        if (missing.needIpa()) {
            String stripped = term.strip();
            if (stripped.isEmpty()) {
                data.putNull("ipa");
            } else {
                data.put("ipa", "/" + stripped.toLowerCase(Locale.ROOT) + "/");
            }
        }

        return data;
    }

    @Override
    public ObjectNode judgeEquivalence(String term, String userAnswer, List<String> meanings) {
        String answer = userAnswer == null ? "" : userAnswer.strip().toLowerCase(Locale.ROOT);
        boolean equivalent = !answer.isEmpty() && meanings.stream()
                .filter(Objects::nonNull)
                .anyMatch(meaning -> meaning.toLowerCase(Locale.ROOT).contains(answer));

        ObjectNode result = NODES.objectNode();
        result.put("isEquivalent", equivalent);
        result.put("reasonShort", "stub semantic check");
        return result;
    }

    @Override
    public ObjectNode validateEntry(String term, List<String> meanings) {
        String rawTerm = term == null ? "" : term.strip();
        boolean hasDigits = rawTerm.chars().anyMatch(Character::isDigit);
        boolean looksInvalidTerm = rawTerm.length() < 2 || hasDigits;

        List<String> cleanedMeanings = meanings.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(meaning -> !meaning.isEmpty())
                .toList();
        boolean looksInvalidMeanings = cleanedMeanings.stream().anyMatch(meaning -> meaning.length() < 2);

        ObjectNode result = NODES.objectNode();
        result.put("isTermValid", !looksInvalidTerm);
        result.put("isMeaningPlausible", !looksInvalidMeanings);
        result.put("suggestedTerm", looksInvalidTerm ? rawTerm.toLowerCase(Locale.ROOT) : rawTerm);
        ArrayNode suggestedMeanings = result.putArray("suggestedMeanings");
        cleanedMeanings.forEach(suggestedMeanings::add);
        result.put("reasonShort", "stub lexical check");
        return result;
    }

    @Override
    public ObjectNode speakingFeedback(String prompt, String responseText, List<String> targetWords) {
        String response = responseText == null ? "" : responseText;
        List<String> words = Arrays.stream(response.strip().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .toList();
        long uniqueWords = words.stream().map(word -> word.toLowerCase(Locale.ROOT)).distinct().count();
        double uniqueRatio = (double) uniqueWords / Math.max(words.size(), 1);
        double lexicalScore = roundHalfEven(Math.min(9.0, Math.max(3.0, 4.5 + uniqueRatio * 4.0)), 1);

        String normalizedResponse = response.toLowerCase(Locale.ROOT);
        List<String> usedTargets = targetWords.stream()
                .filter(word -> normalizedResponse.contains(word.toLowerCase(Locale.ROOT)))
                .toList();

        ObjectNode result = NODES.objectNode();
        result.put("estimatedBand", lexicalScore);
        result.put("targetCoverage", targetWords.isEmpty()
                ? 0.0
                : roundHalfEven((double) usedTargets.size() / targetWords.size(), 2));
        ArrayNode usedTargetWords = result.putArray("usedTargetWords");
        usedTargets.forEach(usedTargetWords::add);
        ArrayNode strengths = result.putArray("strengths");
        if (!words.isEmpty()) {
            strengths.add("clear response");
        }
        result.putArray("improvements")
                .add("use more precise IELTS topic vocabulary")
                .add("add one collocation and one complex sentence");
        result.put("reasonShort", "stub speaking feedback");
        return result;
    }

    private static double roundHalfEven(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
