package uk.gegc.contentunlock.features.unlock.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emits unlock lifecycle events as {@code [event] {json}} lines. Null and blank fields are
 * dropped; the event name and trace id are also put into MDC while the line is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnlockTraceLogger {

    public static final String TRACE_PREFIX = "ut_";

    private final ObjectMapper objectMapper;

    public static String newTraceId() {
        return TRACE_PREFIX + UUID.randomUUID();
    }

    /**
     * Returns {@code traceId} when it is usable, otherwise a fresh one.
     */
    public static String ensureTraceId(String traceId) {
        return traceId == null || traceId.isBlank() ? newTraceId() : traceId.trim();
    }

    public void info(String event, Map<String, ?> payload) {
        emit("info", event, payload);
    }

    public void warn(String event, Map<String, ?> payload) {
        emit("warn", event, payload);
    }

    private void emit(String level, String event, Map<String, ?> payload) {
        Map<String, Object> clean = sanitize(payload);
        Object traceId = clean.get("trace_id");
        MDC.put("unlock.event", event);
        MDC.put("unlock.traceId", traceId != null ? traceId.toString() : null);
        try {
            String json = toJson(clean);
            if ("warn".equals(level)) {
                log.warn("[{}] {}", event, json);
            } else {
                log.info("[{}] {}", event, json);
            }
        } finally {
            MDC.remove("unlock.event");
            MDC.remove("unlock.traceId");
        }
    }

    static Map<String, Object> sanitize(Map<String, ?> payload) {
        Map<String, Object> clean = new LinkedHashMap<>();
        if (payload == null) {
            return clean;
        }
        payload.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof String s && s.isBlank()) {
                return;
            }
            clean.put(key, value);
        });
        return clean;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }
}
