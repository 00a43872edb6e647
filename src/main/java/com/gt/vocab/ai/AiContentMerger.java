package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.util.StableHash;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds freshly generated content into what is already cached for a term.
 * <ul>
 *   <li>List keys are unioned, deduplicated by the {@link StableHash} of each element, existing items first.
 *   A list key whose value is not an array contributes nothing.</li>
 *   <li>{@code judge} is replaced wholesale.</li>
 *   <li>{@code ipa} is replaced only by a non-blank value, stored trimmed.</li>
 * </ul>
 * Neither argument is modified.
 */
public class AiContentMerger {

    static final List<String> LIST_KEYS = List.of("examples", "mnemonics", "meaningVariants", "synonymGroups", "distractors");
    static final String JUDGE_KEY = "judge";
    static final String IPA_KEY = "ipa";

    public static ObjectNode mergeContent(ObjectNode existing, ObjectNode incoming) {
        ObjectNode merged = existing == null ? JsonNodeFactory.instance.objectNode() : existing.deepCopy();
        if (incoming == null) {
            return merged;
        }

        for (String key : LIST_KEYS) {
            if (incoming.has(key)) {
                merged.set(key, mergeListUnique(merged.get(key), incoming.get(key)));
            }
        }

        if (incoming.has(JUDGE_KEY)) {
            merged.set(JUDGE_KEY, incoming.get(JUDGE_KEY).deepCopy());
        }

        JsonNode ipa = incoming.get(IPA_KEY);
        if (ipa != null && !ipa.isNull() && !ipa.asText("").isBlank()) {
            merged.put(IPA_KEY, ipa.asText().strip());
        }

        return merged;
    }

    private static ArrayNode mergeListUnique(JsonNode existing, JsonNode incoming) {
        ArrayNode merged = JsonNodeFactory.instance.arrayNode();
        Set<String> seen = new HashSet<>();

        for (JsonNode source : new JsonNode[] { existing, incoming }) {
            if (source == null || !source.isArray()) {
                continue;
            }
            for (JsonNode item : source) {
                if (seen.add(StableHash.hash(item))) {
                    merged.add(item.deepCopy());
                }
            }
        }

        return merged;
    }
}
