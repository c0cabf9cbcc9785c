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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One token (account) entry.
 * <p>
 * A record is an opaque, immutable set of named JSON fields. Exactly one field,
 * {@value #KEY_FIELD}, identifies the record when merging. The
 * {@value #SESSION_FIELD} field exists only in the in-memory view and is
 * stripped before anything reaches disk.
 * <p>
 * All accessors hand out copies; the wrapped node is never exposed.
 */
public final class TokenRecord {

    /** Identity field used to match records during merge. */
    public static final String KEY_FIELD = "refresh_token";

    /** Session-scoped field that is never persisted. */
    public static final String SESSION_FIELD = "sessionId";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode fields;

    private TokenRecord(ObjectNode fields) {
        this.fields = fields;
    }

    /**
     * Creates a record from a JSON object. The node is copied.
     *
     * @param node the JSON object holding the record's fields
     * @return the record
     */
    public static TokenRecord of(ObjectNode node) {
        Objects.requireNonNull(node, "node");
        return new TokenRecord(node.deepCopy());
    }

    /**
     * Creates a record from plain Java values (strings, numbers, booleans,
     * nested maps and lists).
     *
     * @param values field name to value
     * @return the record
     */
    public static TokenRecord of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> node.set(name, MAPPER.valueToTree(value)));
        return new TokenRecord(node);
    }

    /**
     * @return the key field value, or null when absent or not a string
     */
    public String refreshToken() {
        JsonNode key = fields.get(KEY_FIELD);
        return key != null && key.isTextual() ? key.asText() : null;
    }

    /**
     * @return the in-memory session id, if this record carries one
     */
    public Optional<String> sessionId() {
        JsonNode session = fields.get(SESSION_FIELD);
        return session == null || session.isNull() ? Optional.empty() : Optional.of(session.asText());
    }

    public boolean has(String field) {
        return fields.has(field);
    }

    /**
     * @return a copy of the field's value, or null when absent
     */
    public JsonNode get(String field) {
        JsonNode value = fields.get(field);
        return value == null ? null : value.deepCopy();
    }

    /**
     * @return the field as text, or null when absent or JSON null
     */
    public String text(String field) {
        JsonNode value = fields.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        Iterator<String> it = fields.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Returns a copy of this record with one field set.
     */
    public TokenRecord with(String field, Object value) {
        ObjectNode copy = fields.deepCopy();
        copy.set(field, MAPPER.valueToTree(value));
        return new TokenRecord(copy);
    }

    /**
     * Returns this record without the {@value #SESSION_FIELD} field.
     */
    public TokenRecord withoutSession() {
        if (!fields.has(SESSION_FIELD)) {
            return this;
        }
        ObjectNode copy = fields.deepCopy();
        copy.remove(SESSION_FIELD);
        return new TokenRecord(copy);
    }

    /**
     * Overlays the fields of {@code update} onto this record, field by field.
     * Fields of this record that {@code update} does not mention survive. The
     * update's session field is never copied.
     *
     * @param update the record whose fields win
     * @return the merged record
     */
    public TokenRecord overlay(TokenRecord update) {
        ObjectNode merged = fields.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> it = update.fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!SESSION_FIELD.equals(field.getKey())) {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return new TokenRecord(merged);
    }

    /**
     * @return a copy of the record as a JSON object
     */
    public ObjectNode toJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenRecord)) return false;
        return fields.equals(((TokenRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    /**
     * Lists field names only; the key is masked since it is a credential.
     */
    @Override
    public String toString() {
        return "TokenRecord{" +
                "key=" + mask(refreshToken()) +
                ", fields=" + fieldNames() +
                '}';
    }

    private static String mask(String key) {
        if (key == null) {
            return "(none)";
        }
        return key.length() <= 8 ? "***" : key.substring(0, 4) + "***" + key.substring(key.length() - 4);
    }
}
