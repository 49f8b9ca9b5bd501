package net.spotter.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class JdbcUtil {
    private JdbcUtil() {}

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    private static final TypeReference<LinkedHashMap<String, String>> ATTRIBUTES = new TypeReference<>() {};

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static Long millis(Duration d) { return d == null ? null : d.toMillis(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    /** 속성 맵 → JSON 객체 (키 정렬). 비어 있으면 null */
    public static String encodeAttributes(Map<String, String> attrs) {
        if (attrs == null || attrs.isEmpty()) return null;
        try {
            return JSON.writeValueAsString(attrs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sighting attributes", e);
        }
    }

    public static Map<String, String> decodeAttributes(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return JSON.readValue(json, ATTRIBUTES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable sighting attributes: " + json, e);
        }
    }

    /** 알 수 없는 코드값은 fallback 으로 읽는다 */
    public static <E extends Enum<E>> E enumOr(Class<E> type, String code, E fallback) {
        if (code == null) return fallback;
        try {
            return Enum.valueOf(type, code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
