package it.piero.refnum.service.definition;

import it.piero.refnum.model.CorrelationResult;
import it.piero.refnum.model.Detection;
import it.piero.refnum.model.ValidatedNumber;

import java.util.List;
import java.util.Map;

public interface CorrelationService {

    Map<String, String> extractAndNormalize(String documentText);

    Map<String, String> correlate(String documentText, List<Detection> detections);

    CorrelationResult analyze(String documentText, List<Detection> detections);

    /**
     * Come {@link #analyze(String, List)} ma con le letture separate per tavola:
     * la soppressione dei duplicati avviene all'interno di ciascuna tavola.
     */
    CorrelationResult analyzeSheets(String documentText, List<List<Detection>> sheets);

    List<ValidatedNumber> detectNumbers(List<Detection> detections);

}
