package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.codegen.exception.ConstraintFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts constraints to and from their wire form.
 *
 * <p>The wire form is a flat map tagged by {@code kind}:
 * <pre>
 * {"kind": "loop_constraint", "severity": "error", "description": "...",
 *  "search_type": "first_match", "requirement": "early_return"}
 * </pre>
 * Optional fields are omitted when absent. {@code fromMap(toMap(c))} equals {@code c}
 * for every variant.
 *
 * <p><b>Thread Safety:</b> Stateless apart from a shared, immutable {@link ObjectMapper}.
 *
 * @since 1.0.0
 */
public final class ConstraintCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ConstraintCodec() {
    }

    public static Map<String, Object> toMap(Constraint constraint) {
        Preconditions.checkNotNull(constraint, "Constraint cannot be null");
        return MAPPER.convertValue(constraint, MAP_TYPE);
    }

    public static Constraint fromMap(Map<String, ?> data) {
        Preconditions.checkNotNull(data, "Constraint data cannot be null");
        Object kind = data.get("kind");
        if (!(kind instanceof String) || ConstraintKind.fromWireName((String) kind).isEmpty()) {
            throw new ConstraintFormatException("Unknown constraint kind: " + kind);
        }
        try {
            return MAPPER.convertValue(data, Constraint.class);
        } catch (IllegalArgumentException e) {
            throw new ConstraintFormatException("Malformed " + kind + ": " + e.getMessage(), e);
        }
    }

    public static List<Map<String, Object>> toMaps(List<? extends Constraint> constraints) {
        List<Map<String, Object>> maps = new ArrayList<>(constraints.size());
        for (Constraint constraint : constraints) {
            maps.add(toMap(constraint));
        }
        return maps;
    }

    public static List<Constraint> fromMaps(List<? extends Map<String, ?>> data) {
        List<Constraint> constraints = new ArrayList<>(data.size());
        for (Map<String, ?> entry : data) {
            constraints.add(fromMap(entry));
        }
        return constraints;
    }

    public static String toJson(Constraint constraint) {
        try {
            return MAPPER.writeValueAsString(constraint);
        } catch (JsonProcessingException e) {
            throw new ConstraintFormatException("Failed to serialize " + constraint.getKind(), e);
        }
    }

    public static Constraint fromJson(String json) {
        Preconditions.checkNotNull(json, "JSON cannot be null");
        try {
            return fromMap(MAPPER.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new ConstraintFormatException("Invalid constraint JSON: " + e.getOriginalMessage(), e);
        }
    }
}
