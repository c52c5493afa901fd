package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Regione di testo letta dal motore OCR su una tavola.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Detection {

    /**
     * Quattro vertici del poligono, nell'ordine restituito dall'OCR.
     */
    private List<Point> box;
    private String text;

    /**
     * Confidenza in [0,1].
     */
    private Double confidence;
}
