package com.archflow.core.cache;

import com.archflow.core.model.DesignRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Computes the cache key for a request: SHA-256 over the case-folded,
 * whitespace-collapsed requirements, the canonical configuration and any user
 * answers, truncated to 16 hex characters.
 */
public final class Fingerprinter {

    private static final int LENGTH = 16;
    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();
    // every Unicode space, including the no-break ones Character.isWhitespace skips
    private static final Pattern WHITESPACE = Pattern.compile("[\\p{javaWhitespace}\\p{Z}\\x{85}]+");

    private Fingerprinter() {}

    public static String fingerprint(DesignRequest request) {
        SortedMap<String, Object> input = new TreeMap<>();
        input.put("requirements", normalize(request.text()));
        input.put("configuration", request.configuration().canonical());
        if (request.hasUserAnswers()) {
            input.put("user_answers", normalize(request.userAnswers()));
        }
        try {
            return sha256(CANONICAL_JSON.writeValueAsString(input)).substring(0, LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize fingerprint input", e);
        }
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
