package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorrelationResult {

    /**
     * Numero di riferimento → etichetta scelta.
     */
    private Map<String, String> labels;

    /**
     * Numeri letti sulla tavola e descritti nel testo.
     */
    private List<String> detectedNumerals;

    /**
     * Numeri descritti nel testo ma non letti sulla tavola.
     */
    private List<String> textOnlyNumerals;

    /**
     * Numeri letti sulla tavola senza alcuna descrizione nel testo.
     */
    private List<String> unlabeledNumerals;
}
