package it.piero.refnum.model;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorrelateRequest {

    /**
     * Testo della descrizione brevettuale.
     */
    private String text;

    /**
     * Letture OCR della tavola; assenti o vuote per la sola analisi del testo.
     */
    private List<Detection> detections;
}
