package com.gt.vocab.ai;

import com.gt.vocab.util.StableHash;
import com.gt.vocab.util.TermNormalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Keys have the form <operation>:<version>:<normalized term>[:<content hash>]
public class AiCacheKeys {

    public static final String CACHE_VERSION = "v1";

    public static String enrichKey(String termNormalized) {
        return "enrich:" + CACHE_VERSION + ":" + termNormalized;
    }

    public static String judgeKey(String termNormalized, String userAnswer, List<String> meanings) {
        Map<String, Object> hashInput = new LinkedHashMap<>();
        hashInput.put("userAnswer", TermNormalizer.normalize(userAnswer));
        hashInput.put("meanings", sortedNormalized(meanings));
        return "judge:" + CACHE_VERSION + ":" + termNormalized + ":" + StableHash.hash(hashInput);
    }

    public static String validateKey(String termNormalized, String term, List<String> meanings) {
        Map<String, Object> hashInput = new LinkedHashMap<>();
        hashInput.put("term", term.strip());
        hashInput.put("meanings", sortedNormalized(meanings));
        return "validate:" + CACHE_VERSION + ":" + termNormalized + ":" + StableHash.hash(hashInput);
    }

    private static List<String> sortedNormalized(List<String> values) {
        return values.stream().map(TermNormalizer::normalize).sorted().toList();
    }
}
