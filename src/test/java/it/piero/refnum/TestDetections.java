package it.piero.refnum;

import it.piero.refnum.model.Detection;
import it.piero.refnum.model.Point;
import it.piero.refnum.model.ValidatedNumber;

import java.util.List;

public final class TestDetections {

    private TestDetections() {}

    public static List<Point> rect(double left, double top, double width, double height) {
        return List.of(
                Point.of(left, top),
                Point.of(left + width, top),
                Point.of(left + width, top + height),
                Point.of(left, top + height)
        );
    }

    public static Detection detection(String text, double confidence, double left, double top, double width, double height) {
        return Detection.builder()
                .box(rect(left, top, width, height))
                .text(text)
                .confidence(confidence)
                .build();
    }

    public static ValidatedNumber number(String text, double confidence, double left, double top, double width, double height) {
        return ValidatedNumber.builder()
                .box(rect(left, top, width, height))
                .originalText(text)
                .correctedText(text)
                .value(Double.parseDouble(text))
                .confidence(confidence)
                .build();
    }
}
