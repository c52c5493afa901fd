package it.piero.refnum.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Lettura, scrittura e presentazione della mappa numero → etichetta.
 * Il formato è JSON piatto: {@code {"100": "flexible main body"}}.
 */
@Slf4j
public final class NumeralLabelMapUtils {

    private static final Pattern NUMERAL = Pattern.compile("\\d{1,4}");

    public static final Comparator<String> NUMERIC_ORDER =
            Comparator.<String>comparingInt(Integer::parseInt).thenComparing(Comparator.naturalOrder());

    private NumeralLabelMapUtils() {}

    public static boolean isNumeral(String s) {
        return s != null && NUMERAL.matcher(s).matches();
    }

    public static String toJson(Map<String, String> labels, ObjectMapper mapper) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(sortedNumerically(labels));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione della mappa fallita", e);
        }
    }

    /**
     * Le chiavi che non sono numeri di riferimento e le etichette vuote vengono scartate.
     */
    public static Map<String, String> fromJson(String json, ObjectMapper mapper) {
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Mappa numeri/etichette non leggibile: " + e.getOriginalMessage(), e);
        }
        Map<String, String> labels = new LinkedHashMap<>();
        if (raw == null) return labels;
        raw.forEach((key, value) -> {
            if (isNumeral(key) && value instanceof String s && !s.isBlank()) {
                labels.put(key, s.trim());
            } else {
                log.debug("voce scartata dalla mappa: {} -> {}", key, value);
            }
        });
        return labels;
    }

    public static Map<String, String> sortedNumerically(Map<String, String> labels) {
        Map<String, String> sorted = new TreeMap<>(NUMERIC_ORDER);
        labels.forEach((k, v) -> {
            if (isNumeral(k)) sorted.put(k, v);
        });
        return new LinkedHashMap<>(sorted);
    }

    public static String format(Map<String, String> labels) {
        StringBuilder out = new StringBuilder();
        sortedNumerically(labels).forEach((num, label) ->
                out.append(String.format("%5s → %s%n", num, label)));
        return out.toString();
    }
}
