package it.piero.refnum.service.implementation;

import it.piero.refnum.config.CorrelationProperties;
import it.piero.refnum.model.BBox;
import it.piero.refnum.model.ValidatedNumber;
import it.piero.refnum.utils.BoxUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tiene una sola lettura per gruppo di cifre: a parità di area vince la più sicura.
 * La sovrapposizione è misurata sui rettangoli che contengono i poligoni.
 */
@Component
public class DetectionDeduplicator {

    private final double overlapThreshold;

    public DetectionDeduplicator(CorrelationProperties properties) {
        this.overlapThreshold = properties.getOverlapThreshold();
    }

    public List<ValidatedNumber> dedup(List<ValidatedNumber> numbers) {
        return dedup(numbers, overlapThreshold);
    }

    public List<ValidatedNumber> dedup(List<ValidatedNumber> numbers, double threshold) {
        if (numbers == null || numbers.isEmpty()) return List.of();

        // List.sort è stabile: a parità di confidenza resta l'ordine di ingresso
        List<ValidatedNumber> sorted = new ArrayList<>(numbers);
        sorted.sort(Comparator.comparing(ValidatedNumber::getConfidence).reversed());

        List<ValidatedNumber> kept = new ArrayList<>();
        List<BBox> keptBoxes = new ArrayList<>();
        for (ValidatedNumber candidate : sorted) {
            BBox box = BBox.of(candidate.getBox());
            boolean duplicate = keptBoxes.stream().anyMatch(k -> BoxUtils.iou(box, k) > threshold);
            if (!duplicate) {
                kept.add(candidate);
                keptBoxes.add(box);
            }
        }
        return kept;
    }
}
