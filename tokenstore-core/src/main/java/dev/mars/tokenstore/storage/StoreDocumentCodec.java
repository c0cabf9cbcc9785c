/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tokenstore.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of the store file.
 * <p>
 * Writes are always pretty-printed in the current format:
 * <pre>
 * {
 *   "salt" : "9f2c...",
 *   "tokens" : [ { "refresh_token" : "...", ... } ]
 * }
 * </pre>
 * Reads accept both the current and the legacy (bare array) format and
 * report which one was found via {@link StoreDocument}.
 */
public final class StoreDocumentCodec {

    public static final String SALT_FIELD = "salt";
    public static final String TOKENS_FIELD = "tokens";

    private final ObjectMapper mapper;

    public StoreDocumentCodec() {
        this(new ObjectMapper());
    }

    public StoreDocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Decodes raw file content.
     * <p>
     * Empty content is read as an empty object, i.e. a current-format document
     * with neither salt nor records.
     *
     * @param content UTF-8 file content
     * @return the decoded shape
     * @throws IOException if the content is not valid JSON
     */
    public StoreDocument decode(byte[] content) throws IOException {
        String text = new String(content, StandardCharsets.UTF_8);
        JsonNode root = text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        if (root == null || root.isMissingNode()) {
            root = mapper.createObjectNode();
        }

        if (root.isArray()) {
            ArrayNode array = (ArrayNode) root;
            return new StoreDocument.Legacy(array, toRecords(array));
        }
        if (root.isObject()) {
            ObjectNode object = (ObjectNode) root;
            JsonNode saltNode = object.get(SALT_FIELD);
            String salt = saltNode != null && saltNode.isTextual() && !saltNode.asText().isBlank()
                    ? saltNode.asText()
                    : null;
            JsonNode tokensNode = object.get(TOKENS_FIELD);
            List<TokenRecord> tokens = tokensNode != null && tokensNode.isArray()
                    ? toRecords((ArrayNode) tokensNode)
                    : null;
            return new StoreDocument.Wrapped(object, salt, tokens);
        }
        return new StoreDocument.Unrecognized(root.getNodeType().name());
    }

    /**
     * Encodes a current-format document.
     */
    public byte[] encode(String salt, List<TokenRecord> tokens) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put(SALT_FIELD, salt);
        ArrayNode array = root.putArray(TOKENS_FIELD);
        for (TokenRecord token : tokens) {
            array.add(token.toJson());
        }
        return encode(root);
    }

    /**
     * Encodes an arbitrary JSON tree with the store's formatting.
     */
    public byte[] encode(JsonNode root) throws IOException {
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @return the records, or null if any element is not a JSON object
     */
    private static List<TokenRecord> toRecords(ArrayNode array) {
        List<TokenRecord> records = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isObject()) {
                return null;
            }
            records.add(TokenRecord.of((ObjectNode) element));
        }
        return records;
    }
}
