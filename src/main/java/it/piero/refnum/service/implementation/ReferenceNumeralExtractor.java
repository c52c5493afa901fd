package it.piero.refnum.service.implementation;

import it.piero.refnum.service.definition.PhraseNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrae dal testo le coppie (frase descrittiva, numeri di riferimento), ad esempio
 * "a flexible main body 100" oppure "hinges 150, 152".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceNumeralExtractor {

    private static final Pattern REFERENCE = Pattern.compile(
            "(?:[\\w\\s\\-,;:()]*?\\s(?:indicated\\s+(?:generally\\s+)?as|identified\\s+as|as|no\\.?|reference\\s+numerals?|shown\\s+as)\\s+)?"
                    + "([\\w\\s\\-.,;:()]+?)\\s*(?<!\\d)(\\d{1,4}(?:,\\s*\\d{1,4})*)(?!\\d)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERAL = Pattern.compile("\\d{1,4}");

    private final PhraseNormalizer normalizer;

    public record TextMatch(String rawPhrase, Set<String> numerals, int start, int end) {}

    /**
     * Numero → etichette candidate, nell'ordine in cui compaiono nel testo.
     */
    public Map<String, List<String>> extract(String text) {
        Map<String, List<String>> candidates = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return candidates;

        List<TextMatch> matches = scan(text);
        for (TextMatch match : matches) {
            String label = normalizer.normalize(match.rawPhrase());
            if (label == null || label.isEmpty()) continue;
            for (String numeral : match.numerals()) {
                candidates.computeIfAbsent(numeral, k -> new ArrayList<>()).add(label);
            }
        }

        log.debug("{} corrispondenze, {} numeri con etichetta", matches.size(), candidates.size());
        return candidates;
    }

    /**
     * Corrispondenze grezze, già private dei riferimenti a figure ("FIG. 3", "figs 2a").
     */
    public List<TextMatch> scan(String text) {
        List<TextMatch> matches = new ArrayList<>();
        if (text == null) return matches;

        Matcher m = REFERENCE.matcher(text);
        while (m.find()) {
            String phrase = m.group(1);
            String numbers = m.group(2);

            // il numero subito dopo "FIG." è la figura stessa
            if (CoreNlpPhraseNormalizer.FIGURE.matcher(phrase + " " + numbers).find()) continue;

            Set<String> numerals = new LinkedHashSet<>();
            for (String num : numbers.split(",")) {
                num = num.trim();
                if (NUMERAL.matcher(num).matches()) numerals.add(num);
            }
            if (!numerals.isEmpty()) {
                matches.add(new TextMatch(phrase, numerals, m.start(1), m.end(2)));
            }
        }
        return matches;
    }
}
