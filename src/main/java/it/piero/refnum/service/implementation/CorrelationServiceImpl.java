package it.piero.refnum.service.implementation;

import it.piero.refnum.config.CorrelationProperties;
import it.piero.refnum.model.CorrelationResult;
import it.piero.refnum.model.Detection;
import it.piero.refnum.model.ValidatedNumber;
import it.piero.refnum.service.definition.CorrelationService;
import it.piero.refnum.utils.NumeralLabelMapUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationServiceImpl implements CorrelationService {

    private final ReferenceNumeralExtractor extractor;
    private final DigitCorrector digitCorrector;
    private final DetectionDeduplicator deduplicator;
    private final CorrelationProperties properties;

    @Override
    public Map<String, String> extractAndNormalize(String documentText) {
        return analyzeSheets(documentText, List.of()).getLabels();
    }

    @Override
    public Map<String, String> correlate(String documentText, List<Detection> detections) {
        return analyze(documentText, detections).getLabels();
    }

    @Override
    public CorrelationResult analyze(String documentText, List<Detection> detections) {
        List<List<Detection>> sheets = new ArrayList<>();
        if (detections != null) sheets.add(detections);
        return analyzeSheets(documentText, sheets);
    }

    @Override
    public CorrelationResult analyzeSheets(String documentText, List<List<Detection>> sheets) {
        Map<String, List<String>> candidates = extractor.extract(documentText);

        Set<String> present = new LinkedHashSet<>();
        if (sheets != null) {
            for (List<Detection> sheet : sheets) {
                detectNumbers(sheet).forEach(n -> present.add(n.getCorrectedText()));
            }
        }

        Map<String, String> labels = new LinkedHashMap<>();
        List<String> detected = new ArrayList<>();
        List<String> unlabeled = new ArrayList<>();
        for (String numeral : present) {
            String label = choose(candidates.get(numeral));
            if (label != null) {
                labels.put(numeral, label);
                detected.add(numeral);
            } else if (NumeralLabelMapUtils.isNumeral(numeral)) {
                unlabeled.add(numeral);
            }
        }

        List<String> textOnly = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : candidates.entrySet()) {
            if (labels.containsKey(e.getKey())) continue;
            String label = choose(e.getValue());
            if (label != null) {
                labels.put(e.getKey(), label);
                textOnly.add(e.getKey());
            }
        }

        log.info("correlazione: {} etichette ({} lette sulle tavole, {} solo dal testo, {} senza descrizione)",
                labels.size(), detected.size(), textOnly.size(), unlabeled.size());
        if (log.isDebugEnabled()) {
            log.debug("mappa numeri/etichette:\n{}", NumeralLabelMapUtils.format(labels));
        }

        return CorrelationResult.builder()
                .labels(labels)
                .detectedNumerals(detected)
                .textOnlyNumerals(textOnly)
                .unlabeledNumerals(unlabeled)
                .build();
    }

    @Override
    public List<ValidatedNumber> detectNumbers(List<Detection> detections) {
        return deduplicator.dedup(digitCorrector.filterValid(detections));
    }

    private String choose(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) return null;
        return properties.getLabelPolicy().select(candidates);
    }
}
