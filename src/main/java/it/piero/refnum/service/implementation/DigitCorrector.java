package it.piero.refnum.service.implementation;

import it.piero.refnum.config.CorrelationProperties;
import it.piero.refnum.model.Detection;
import it.piero.refnum.model.Point;
import it.piero.refnum.model.ValidatedNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Corregge le letture OCR dei numeri (b→6, O→0, l→1, ...) e tiene solo quelle numeriche e affidabili.
 */
@Slf4j
@Component
public class DigitCorrector {

    private static final Map<Character, Character> CONFUSABLE = Map.ofEntries(
            entry('b', '6'), entry('B', '6'),
            entry('o', '0'), entry('O', '0'), entry('D', '0'),
            entry('l', '1'), entry('I', '1'), entry('i', '1'),
            entry('S', '5'), entry('s', '5'),
            entry('Z', '2'), entry('z', '2'),
            entry('g', '9'), entry('G', '9'), entry('q', '9'), entry('Q', '9'),
            entry('T', '7'), entry('t', '7')
    );

    private static final Pattern NON_WORD = Pattern.compile("[^\\w.]");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final double confidenceThreshold;
    private final double digitRatio;

    public DigitCorrector(CorrelationProperties properties) {
        this.confidenceThreshold = properties.getConfidenceThreshold();
        this.digitRatio = properties.getDigitRatio();
    }

    public String correct(String raw) {
        if (raw == null) return "";
        StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = CONFUSABLE.getOrDefault(raw.charAt(i), raw.charAt(i));
            if ((c >= '0' && c <= '9') || c == '.') out.append(c);
        }
        return out.toString();
    }

    public boolean isNumber(String text) {
        if (text == null) return false;
        String cleaned = NON_WORD.matcher(text).replaceAll("");
        if (cleaned.isEmpty()) return false;
        if (DECIMAL.matcher(cleaned).matches()) return true;

        long digits = cleaned.chars().filter(c -> c >= '0' && c <= '9').count();
        return (double) digits / cleaned.length() >= digitRatio;
    }

    public List<ValidatedNumber> filterValid(List<Detection> detections) {
        List<ValidatedNumber> valid = new ArrayList<>();
        if (detections == null) return valid;

        for (Detection d : detections) {
            if (!isWellFormed(d)) {
                log.debug("lettura OCR malformata scartata: {}", d);
                continue;
            }
            if (d.getConfidence() < confidenceThreshold) continue;

            String corrected = correct(d.getText());
            if (corrected.isEmpty() || !isNumber(corrected) || !DECIMAL.matcher(corrected).matches()) continue;

            valid.add(ValidatedNumber.builder()
                    .box(d.getBox())
                    .originalText(d.getText())
                    .correctedText(corrected)
                    .value(Double.parseDouble(corrected))
                    .confidence(d.getConfidence())
                    .build());
        }
        return valid;
    }

    static boolean isWellFormed(Detection d) {
        if (d == null || d.getText() == null || d.getConfidence() == null) return false;
        double conf = d.getConfidence();
        if (Double.isNaN(conf) || conf < 0 || conf > 1) return false;
        List<Point> box = d.getBox();
        if (box == null || box.size() != 4) return false;
        for (Point p : box) {
            if (p == null || p.getX() == null || p.getY() == null) return false;
            if (!Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) return false;
        }
        return true;
    }
}
