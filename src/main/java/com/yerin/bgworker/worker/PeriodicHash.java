package com.yerin.bgworker.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Content hash of a periodic job definition: the first 8 bytes of SHA-256 over
 * {@code workerName \n schedule \n canonicalArgs}, where object keys are sorted recursively.
 * Numbers keep their JSON text, so {@code 1} and {@code 1.0} hash differently.
 */
public final class PeriodicHash {
    private PeriodicHash() {}

    public static long hash(ObjectMapper mapper, String workerName, String schedule, JsonNode args) {
        String canonical;
        try {
            canonical = mapper.writeValueAsString(canonicalize(mapper, args));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize periodic args of " + workerName, e);
        }

        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        String source = workerName + "\n" + schedule + "\n" + canonical;
        byte[] bytes = digest.digest(source.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(bytes, 0, Long.BYTES).getLong();
    }

    static JsonNode canonicalize(ObjectMapper mapper, JsonNode node) {
        if (node == null) return mapper.nullNode();
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) names.add(it.next());
            names.sort(null);

            ObjectNode sorted = mapper.createObjectNode();
            for (String name : names) sorted.set(name, canonicalize(mapper, node.get(name)));
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = mapper.createArrayNode();
            for (JsonNode element : node) array.add(canonicalize(mapper, element));
            return array;
        }
        return node;
    }
}
