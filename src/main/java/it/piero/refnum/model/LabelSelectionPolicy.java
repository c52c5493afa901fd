package it.piero.refnum.model;

import java.util.List;

/**
 * Scelta di una sola etichetta tra quelle trovate nel testo per lo stesso numero.
 */
public enum LabelSelectionPolicy {

    /**
     * Etichetta più corta; a parità di lunghezza vince la prima incontrata.
     */
    SHORTEST {
        @Override
        public String select(List<String> candidates) {
            String best = null;
            for (String candidate : candidates) {
                if (candidate == null || candidate.isEmpty()) continue;
                if (best == null || candidate.length() < best.length()) best = candidate;
            }
            return best;
        }
    },

    FIRST_SEEN {
        @Override
        public String select(List<String> candidates) {
            return candidates.stream()
                    .filter(c -> c != null && !c.isEmpty())
                    .findFirst()
                    .orElse(null);
        }
    };

    /**
     * @return l'etichetta scelta, oppure {@code null} se non ci sono candidati utilizzabili
     */
    public abstract String select(List<String> candidates);
}
