package it.piero.refnum.config;

import it.piero.refnum.model.LabelSelectionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Soglie e politiche del motore di correlazione (prefisso {@code refnum}).
 */
@Data
@ConfigurationProperties(prefix = "refnum")
public class CorrelationProperties {

    /**
     * Confidenza OCR minima perché una lettura venga considerata.
     */
    private double confidenceThreshold = 0.6;

    /**
     * IoU oltre la quale due rilevamenti sono lo stesso gruppo di cifre.
     */
    private double overlapThreshold = 0.5;

    /**
     * Quota minima di cifre per accettare un token non convertibile in numero.
     */
    private double digitRatio = 0.7;

    private LabelSelectionPolicy labelPolicy = LabelSelectionPolicy.SHORTEST;

    private Nlp nlp = new Nlp();

    private Ocr ocr = new Ocr();

    @Data
    public static class Nlp {
        private boolean enabled = true;
        private String annotators = "tokenize,ssplit,pos,lemma,parse";
        private int parseMaxLength = 80;
    }

    @Data
    public static class Ocr {
        private String provider = "textract";
        private int pdfDpi = 300;
    }
}
