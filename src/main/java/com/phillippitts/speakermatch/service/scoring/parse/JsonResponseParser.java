package com.phillippitts.speakermatch.service.scoring.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.speakermatch.exception.ResponseParseException;
import com.phillippitts.speakermatch.util.LogSanitizer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object from a model's free-text reply.
 *
 * <p>Candidate selection, in order:
 * <ol>
 *   <li>interior of the first fenced block tagged {@code json} (tag matched case-insensitively)</li>
 *   <li>otherwise the interior of the first fenced block, minus a one-word language tag</li>
 *   <li>otherwise the whole reply</li>
 * </ol>
 * The candidate is parsed strictly. If it is not valid JSON, the span from its first {@code '{'}
 * to its last {@code '}'} is tried once more, which recovers objects embedded in unfenced prose.
 * Valid JSON that is not an object (an array or a scalar) is rejected as is.
 * Anything still malformed is a {@link ResponseParseException}; nothing is coerced.
 *
 * <p>Thread-safe: all methods are static and the mapper is only used for reads.
 */
public final class JsonResponseParser {

    private static final String FENCE = "```";
    private static final Pattern JSON_FENCE = Pattern.compile("```json", Pattern.CASE_INSENSITIVE);
    private static final int PREVIEW_CHARS = 200;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private JsonResponseParser() {
    }

    /**
     * Locates and parses the JSON object in a model reply.
     *
     * @param text raw model reply
     * @return the parsed object
     * @throws ResponseParseException if no valid JSON object can be located
     */
    public static ObjectNode extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new ResponseParseException("Empty model reply", "");
        }
        String candidate = selectCandidate(text);

        JsonProcessingException failure;
        try {
            ObjectNode direct = parseObject(candidate);
            if (direct != null) {
                return direct;
            }
            failure = null;
        } catch (JsonProcessingException e) {
            failure = e;
        }

        // a candidate that parsed cleanly as an array or scalar is final
        if (failure != null) {
            int open = candidate.indexOf('{');
            int close = candidate.lastIndexOf('}');
            if (open >= 0 && close > open) {
                try {
                    ObjectNode embedded = parseObject(candidate.substring(open, close + 1));
                    if (embedded != null) {
                        return embedded;
                    }
                } catch (JsonProcessingException e) {
                    failure = e;
                }
            }
        }

        String preview = LogSanitizer.preview(text, PREVIEW_CHARS);
        if (failure == null) {
            throw new ResponseParseException("Model reply is not a JSON object", preview);
        }
        throw new ResponseParseException(
                "No valid JSON object found in model reply: " + failure.getOriginalMessage(),
                preview,
                failure
        );
    }

    /**
     * Applies the fenced-block tiers and returns the trimmed candidate text.
     */
    static String selectCandidate(String text) {
        Matcher jsonFence = JSON_FENCE.matcher(text);
        if (jsonFence.find()) {
            return interior(text, jsonFence.end());
        }
        int fence = text.indexOf(FENCE);
        if (fence >= 0) {
            return stripLanguageTag(interior(text, fence + FENCE.length()));
        }
        return text.strip();
    }

    private static String interior(String text, int start) {
        int end = text.indexOf(FENCE, start);
        String body = end >= 0 ? text.substring(start, end) : text.substring(start);
        return body.strip();
    }

    private static String stripLanguageTag(String body) {
        int newline = body.indexOf('\n');
        if (newline <= 0) {
            return body;
        }
        String firstLine = body.substring(0, newline).strip();
        if (firstLine.matches("[A-Za-z0-9_+-]+")) {
            return body.substring(newline + 1).strip();
        }
        return body;
    }

    /**
     * Strict parse; returns null when the text is valid JSON but not an object.
     */
    private static ObjectNode parseObject(String candidate) throws JsonProcessingException {
        if (candidate.isEmpty()) {
            return null;
        }
        JsonNode node = MAPPER.readTree(candidate);
        return node instanceof ObjectNode obj ? obj : null;
    }
}
