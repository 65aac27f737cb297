package com.queryguard.service.core.shape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives query shape keys: literals are replaced by type placeholders, object keys are sorted,
 * and the canonical JSON is hashed with SHA-256 (uppercase hex).
 *
 * <p>Operators, field paths and {@code $field} references are structural and kept; arrays made
 * only of literals collapse to a single placeholder so {@code $in} lists of any length share a
 * shape.
 */
@Service
@Slf4j
public class QueryShapeHasher {

    private static final int CACHE_SIZE = 10_000;
    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Cache<String, String> templateToHash =
            Caffeine.newBuilder().maximumSize(CACHE_SIZE).build();
    private final Cache<String, String> hashToTemplate =
            Caffeine.newBuilder().maximumSize(CACHE_SIZE).build();

    public String shapeKey(JsonNode query) {
        if (query == null || query.isNull() || query.isMissingNode()) {
            throw new IllegalArgumentException("query document is required");
        }
        String template = template(query);
        String hash = templateToHash.get(template, QueryShapeHasher::computeHash);
        hashToTemplate.put(hash, template);
        return hash;
    }

    /** Canonical template of a recently hashed shape, if still cached. */
    public Optional<String> templateFor(String shapeKey) {
        if (shapeKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hashToTemplate.getIfPresent(ShapeKeys.normalize(shapeKey)));
    }

    public String template(JsonNode query) {
        try {
            return CANONICAL_JSON.writeValueAsString(elide(query));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode query shape", e);
        }
    }

    private static JsonNode elide(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = NODES.objectNode();
            TreeSet<String> names = new TreeSet<>();
            node.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, elide(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            if (isLiteralArray(node)) {
                return TextNode.valueOf("?array");
            }
            ArrayNode elements = NODES.arrayNode();
            node.forEach(element -> elements.add(elide(element)));
            return elements;
        }
        if (node.isTextual() && node.asText().startsWith("$")) {
            return node;
        }
        return TextNode.valueOf(placeholder(node));
    }

    private static boolean isLiteralArray(JsonNode array) {
        if (array.isEmpty()) {
            return true;
        }
        for (JsonNode element : array) {
            if (element.isContainerNode() || (element.isTextual() && element.asText().startsWith("$"))) {
                return false;
            }
        }
        return true;
    }

    private static String placeholder(JsonNode literal) {
        if (literal.isNumber()) {
            return "?number";
        }
        if (literal.isBoolean()) {
            return "?bool";
        }
        if (literal.isNull()) {
            return "?null";
        }
        return "?string";
    }

    private static String computeHash(String template) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(template.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().withUpperCase().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
