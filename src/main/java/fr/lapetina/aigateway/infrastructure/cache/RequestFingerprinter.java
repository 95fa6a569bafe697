package fr.lapetina.aigateway.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Computes the cache key of a request.
 *
 * The fingerprint is the SHA-256 of a canonical JSON document holding the normalized messages,
 * the model hint, the effective temperature and the effective max tokens. The provider override
 * is not part of it: any provider's answer satisfies the same question.
 */
public final class RequestFingerprinter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    static final String DEFAULT_SCOPE = "default";

    private final ObjectMapper objectMapper;

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String fingerprint(CompletionRequest request) {
        ObjectNode canonical = objectMapper.createObjectNode();
        ArrayNode messages = canonical.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", normalize(message.content()));
        }
        canonical.put("model", request.model() != null ? request.model() : "");
        canonical.put("temperature", request.effectiveTemperature());
        canonical.put("maxTokens", request.effectiveMaxTokens());

        try {
            byte[] json = objectMapper.writeValueAsBytes(canonical);
            return HexFormat.of().formatHex(sha256().digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request for fingerprinting", e);
        }
    }

    /**
     * Text the similarity tier embeds: every normalized message, one per line.
     */
    public static String embeddingText(CompletionRequest request) {
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : request.messages()) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(normalize(message.content()));
        }
        return text.toString();
    }

    /**
     * Similarity lookups only compare entries within the same scope.
     */
    public static String scopeOf(CompletionRequest request) {
        String model = request.model();
        return model != null && !model.isBlank() ? model : DEFAULT_SCOPE;
    }

    static String normalize(String content) {
        return WHITESPACE.matcher(content.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
