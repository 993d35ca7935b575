package abrazar.casework.jobs;

import abrazar.casework.exceptions.PermanentJobFailureException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to job payload fields.
 *
 * <p>
 * Payloads come back from JSON, so numbers may be Integer or Long and nested objects are maps. A missing or
 * mistyped required field is a malformed payload and fails the job permanently.
 */
public final class JobPayloads {

    private JobPayloads() {
    }

    public static String requireString(Map<String, Object> payload, String field) {
        return optionalString(payload, field)
                .orElseThrow(() -> new PermanentJobFailureException("Missing required payload field: " + field));
    }

    public static Optional<String> optionalString(Map<String, Object> payload, String field) {
        Object value = payload == null ? null : payload.get(field);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> optionalMap(Map<String, Object> payload, String field) {
        Object value = payload == null ? null : payload.get(field);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new PermanentJobFailureException("Payload field " + field + " must be an object");
        }
        return (Map<String, Object>) map;
    }

    public static List<?> requireList(Map<String, Object> payload, String field) {
        Object value = payload == null ? null : payload.get(field);
        if (!(value instanceof List<?> list)) {
            throw new PermanentJobFailureException("Payload field " + field + " must be a list");
        }
        return list;
    }
}
