package com.gt.vocab.util;

import java.util.*;

// Union helpers for the list and word-family content of a card. Items are trimmed, blanks dropped, and
// duplicates removed case-sensitively, keeping first-seen order.
public class ContentLists {

    public static List<String> uniqueStrings(Collection<String> values) {
        if (values == null) {
            return List.of();
        }

        Set<String> seen = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String text = value.strip();
            if (!text.isEmpty()) {
                seen.add(text);
            }
        }
        return List.copyOf(seen);
    }

    public static List<String> mergeUniqueStrings(Collection<String> existing, Collection<String> incoming) {
        List<String> combined = new ArrayList<>();
        if (existing != null) {
            combined.addAll(existing);
        }
        if (incoming != null) {
            combined.addAll(incoming);
        }
        return uniqueStrings(combined);
    }

    // Roles are trimmed and lowercased; empty roles are dropped
    public static Map<String, List<String>> normalizeWordFamily(Map<String, ? extends Collection<String>> wordFamily) {
        if (wordFamily == null) {
            return Map.of();
        }

        Map<String, List<String>> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : wordFamily.entrySet()) {
            String role = entry.getKey() == null ? "" : entry.getKey().strip().toLowerCase(Locale.ROOT);
            if (role.isEmpty()) {
                continue;
            }
            normalized.put(role, mergeUniqueStrings(normalized.get(role), entry.getValue()));
        }
        return normalized;
    }

    public static Map<String, List<String>> mergeWordFamily(Map<String, ? extends Collection<String>> existing,
                                                            Map<String, ? extends Collection<String>> incoming) {
        Map<String, List<String>> merged = new LinkedHashMap<>(normalizeWordFamily(existing));
        for (Map.Entry<String, List<String>> entry : normalizeWordFamily(incoming).entrySet()) {
            merged.put(entry.getKey(), mergeUniqueStrings(merged.get(entry.getKey()), entry.getValue()));
        }
        return merged;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String stripToNull(String value) {
        return isBlank(value) ? null : value.strip();
    }
}
