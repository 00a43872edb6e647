package com.gt.vocab.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.exception.AiProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Remote provider backed by the OpenAI Responses API
public class OpenAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiProvider.class);

    public static final String PROVIDER_NAME = "openai";

    private static final String RESPONSES_PATH = "/v1/responses";

    private static final int ENRICH_MAX_TOKENS = 220;
    private static final int JUDGE_MAX_TOKENS = 120;
    private static final int VALIDATE_MAX_TOKENS = 180;
    private static final int SPEAKING_MAX_TOKENS = 220;

    private static final double DEFAULT_BAND = 5.0;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public OpenAiProvider(RestClient restClient, ObjectMapper objectMapper, String apiKey, String model) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @Override
    public ObjectNode enrich(String term, List<String> meanings, EnrichMissing missing) {
        String prompt = "Return JSON only. Do not include markdown. " +
                "term=" + term + "; meanings=" + meanings + "; " +
                "need_examples=" + missing.needExamples() + "; need_mnemonics=" + missing.needMnemonics() + "; " +
                "need_meaning_variants=" + missing.needMeaningVariants() + "; need_ipa=" + missing.needIpa() + ". " +
                "Allowed keys: examples, mnemonics, meaningVariants, ipa. " +
                "examples is array of {en,vi}; mnemonics is array of strings; meaningVariants is array of strings; ipa is string.";
        JsonNode parsed = callResponsesApi(prompt, ENRICH_MAX_TOKENS);

        ObjectNode result = objectMapper.createObjectNode();
        if (missing.needExamples()) {
            result.set("examples", normalizeExamples(parsed.path("examples"), term));
        }
        if (missing.needMnemonics()) {
            result.set("mnemonics", toArrayNode(normalizeStrings(parsed.path("mnemonics"))));
        }
        if (missing.needMeaningVariants()) {
            result.set("meaningVariants", toArrayNode(normalizeStrings(parsed.path("meaningVariants"))));
        }
        if (missing.needIpa()) {
            String ipa = parsed.path("ipa").asText("").strip();
            if (ipa.isEmpty()) {
                result.putNull("ipa");
            } else {
                result.put("ipa", ipa);
            }
        }
        return result;
    }

    @Override
    public ObjectNode judgeEquivalence(String term, String userAnswer, List<String> meanings) {
        String prompt = "Return JSON only in format {isEquivalent:boolean, reasonShort:string}. " +
                "term=" + term + "; userAnswer=" + userAnswer + "; referenceMeanings=" + meanings + ".";
        JsonNode parsed = callResponsesApi(prompt, JUDGE_MAX_TOKENS);

        ObjectNode result = objectMapper.createObjectNode();
        result.put("isEquivalent", parsed.path("isEquivalent").asBoolean(false));
        result.put("reasonShort", textOrDefault(parsed.path("reasonShort"), "openai semantic check"));
        return result;
    }

    @Override
    public ObjectNode validateEntry(String term, List<String> meanings) {
        String prompt = "Return JSON only in this exact format: " +
                "{isTermValid:boolean,isMeaningPlausible:boolean,suggestedTerm:string,suggestedMeanings:string[],reasonShort:string}. " +
                "Input term=" + term + "; meanings=" + meanings + ". " +
                "Check if term spelling looks valid English and meanings are plausible for this term.";
        JsonNode parsed = callResponsesApi(prompt, VALIDATE_MAX_TOKENS);

        ObjectNode result = objectMapper.createObjectNode();
        result.put("isTermValid", parsed.path("isTermValid").asBoolean(true));
        result.put("isMeaningPlausible", parsed.path("isMeaningPlausible").asBoolean(true));
        result.put("suggestedTerm", textOrDefault(parsed.path("suggestedTerm"), term).strip());
        result.set("suggestedMeanings", toArrayNode(normalizeStrings(parsed.path("suggestedMeanings"))));
        result.put("reasonShort", textOrDefault(parsed.path("reasonShort"), "openai vocab validation"));
        return result;
    }

    @Override
    public ObjectNode speakingFeedback(String prompt, String responseText, List<String> targetWords) {
        String formatHint = "{estimatedBand:number,targetCoverage:number,usedTargetWords:string[]," +
                "strengths:string[],improvements:string[],reasonShort:string}";
        String input = "Return JSON only. Format=" + formatHint + ". " +
                "IELTS speaking prompt=" + prompt + "; userResponse=" + responseText + "; targetWords=" + targetWords + ". " +
                "Score lexical resource only.";
        JsonNode parsed = callResponsesApi(input, SPEAKING_MAX_TOKENS);

        double estimatedBand = parsed.path("estimatedBand").asDouble(DEFAULT_BAND);
        estimatedBand = Math.min(9.0, Math.max(1.0, Math.round(estimatedBand * 10) / 10.0));

        ObjectNode result = objectMapper.createObjectNode();
        result.put("estimatedBand", estimatedBand);
        result.put("targetCoverage", parsed.path("targetCoverage").asDouble(0.0));
        result.set("usedTargetWords", toArrayNode(normalizeStrings(parsed.path("usedTargetWords"))));
        result.set("strengths", toArrayNode(normalizeStrings(parsed.path("strengths"))));
        result.set("improvements", toArrayNode(normalizeStrings(parsed.path("improvements"))));
        result.put("reasonShort", textOrDefault(parsed.path("reasonShort"), "openai speaking feedback"));
        return result;
    }

    private JsonNode callResponsesApi(String input, int maxOutputTokens) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("input", input);
        payload.put("temperature", 0);
        payload.put("max_output_tokens", maxOutputTokens);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(RESPONSES_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new AiProviderException("OpenAI API error: " + ex.getMessage(), ex);
        }

        if (response == null) {
            throw new AiProviderException("OpenAI response is empty");
        }

        return parseJsonObject(extractText(response));
    }

    static String extractText(JsonNode response) {
        String outputText = response.path("output_text").asText("");
        if (!outputText.isBlank()) {
            return outputText;
        }

        List<String> textParts = new ArrayList<>();
        for (JsonNode block : response.path("output")) {
            for (JsonNode content : block.path("content")) {
                String text = content.path("text").asText("");
                if (!text.isBlank()) {
                    textParts.add(text);
                }
            }
        }
        return String.join("\n", textParts);
    }

    // Models sometimes wrap the object in prose or code fences; keep the outermost braces
    JsonNode parseJsonObject(String rawText) {
        String candidate = rawText.strip();
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start >= 0 && end > start) {
            candidate = candidate.substring(start, end + 1);
        }

        try {
            JsonNode parsed = objectMapper.readTree(candidate);
            return parsed != null && parsed.isObject() ? parsed : objectMapper.createObjectNode();
        } catch (JsonProcessingException ex) {
            log.warn("OpenAI returned text that is not a json object");
            return objectMapper.createObjectNode();
        }
    }

    private ArrayNode normalizeExamples(JsonNode value, String term) {
        ArrayNode examples = objectMapper.createArrayNode();
        for (JsonNode item : value) {
            if (!item.isObject()) {
                continue;
            }
            String en = item.path("en").asText("").strip();
            String vi = item.path("vi").asText("").strip();
            if (!en.isEmpty() && !vi.isEmpty()) {
                examples.addObject().put("en", en).put("vi", vi);
            }
        }

        if (examples.isEmpty()) {
            examples.addObject()
                    .put("en", "I used '" + term + "' in a sentence today.")
                    .put("vi", "Hom nay toi da dung tu '" + term + "'.");
        }
        return examples;
    }

    private static List<String> normalizeStrings(JsonNode value) {
        Set<String> seen = new LinkedHashSet<>();
        if (value.isArray()) {
            for (JsonNode item : value) {
                String text = item.asText("").strip();
                if (!text.isEmpty()) {
                    seen.add(text);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    private ArrayNode toArrayNode(List<String> values) {
        ArrayNode arrayNode = objectMapper.createArrayNode();
        values.forEach(arrayNode::add);
        return arrayNode;
    }

    private static String textOrDefault(JsonNode value, String defaultValue) {
        String text = value.asText("");
        return text.isBlank() ? defaultValue : text;
    }
}
