package com.forumapi.domain;

import com.forumapi.commons.exceptions.ValidationException;
import com.forumapi.commons.exceptions.ValidationException.Kind;

import java.util.Map;

/**
 * Raw key-value input for an entity. Presence of every required key is checked before any type
 * check, so a payload that is both incomplete and mistyped reports the missing property.
 * Empty strings count as missing.
 */
public final class Payload {

    private final String entity;
    private final Map<String, ?> values;

    private Payload(String entity, Map<String, ?> values) {
        this.entity = entity;
        this.values = values == null ? Map.of() : values;
    }

    public static Payload of(String entity, Map<String, ?> values) {
        return new Payload(entity, values);
    }

    public Payload requireStrings(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value == null || "".equals(value)) {
                throw new ValidationException(entity, Kind.NOT_CONTAIN_NEEDED_PROPERTY, key);
            }
        }
        for (String key : keys) {
            if (!(values.get(key) instanceof String)) {
                throw new ValidationException(entity, Kind.NOT_MEET_DATA_TYPE_SPECIFICATION, key);
            }
        }
        return this;
    }

    public String string(String key) {
        return (String) values.get(key);
    }
}
