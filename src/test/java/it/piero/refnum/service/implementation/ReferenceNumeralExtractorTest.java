package it.piero.refnum.service.implementation;

import it.piero.refnum.service.definition.PhraseNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceNumeralExtractorTest {

    // solo lettere: la regex si verifica senza il parser
    private static final PhraseNormalizer LETTERS_ONLY = phrase ->
            phrase.toLowerCase().replaceAll("[^a-z ]", " ").trim().replaceAll("\\s+", " ");

    private final ReferenceNumeralExtractor extractor = new ReferenceNumeralExtractor(LETTERS_ONLY);

    @Test
    void phraseFollowedByNumeral() {
        Map<String, List<String>> candidates = extractor.extract("front flap 120");

        assertThat(candidates).containsExactly(Map.entry("120", List.of("front flap")));
    }

    @Test
    void commaSeparatedNumeralsShareTheLabel() {
        Map<String, List<String>> candidates = extractor.extract("hinges 150, 152 and a lid 160");

        assertThat(candidates).containsOnlyKeys("150", "152", "160");
        assertThat(candidates.get("150")).containsExactly("hinges");
        assertThat(candidates.get("152")).containsExactly("hinges");
        assertThat(candidates.get("160")).containsExactly("and a lid");
    }

    @Test
    void labelsAreCollectedInTextOrder() {
        Map<String, List<String>> candidates = extractor.extract("a lid 100 is hinged; the cover 100 closes");

        assertThat(candidates.get("100")).containsExactly("a lid", "is hinged the cover");
    }

    @Test
    void fiveDigitTokensAreNeverNumerals() {
        Map<String, List<String>> candidates = extractor.extract("serial 12345 and part 77 of US10602821");

        assertThat(candidates).containsOnlyKeys("77");
    }

    @Test
    void figureCaptionsAreSkipped() {
        Map<String, List<String>> candidates = extractor.extract("FIG. 3 shows a bag 100. FIGS. 4, 5 are views of the bag 100");

        assertThat(candidates).containsOnlyKeys("100");
    }

    @Test
    void figureWithLetterSuffixIsNotANumeral() {
        Map<String, List<String>> candidates = extractor.extract("as seen in Fig. 2a the strap 300");

        assertThat(candidates).containsOnlyKeys("300");
        assertThat(candidates.get("300")).containsExactly("a the strap");
    }

    @Test
    void letterSuffixedNumeralsKeepTheirDigits() {
        Map<String, List<String>> candidates = extractor.extract("a first leg 12a and a second leg 14");

        assertThat(candidates).containsOnlyKeys("12", "14");
        assertThat(candidates.get("12")).containsExactly("a first leg");
    }

    @Test
    void suffixedNumeralListYieldsTheBaseNumeral() {
        Map<String, List<String>> candidates = extractor.extract("a frame 10 has arms 16a, 16b");

        assertThat(candidates).containsOnlyKeys("10", "16");
        assertThat(candidates.get("16")).startsWith("has arms");
    }

    @Test
    void numeralGluedToAWordIsFound() {
        Map<String, List<String>> candidates = extractor.extract("the housing100 holds a lid 20");

        assertThat(candidates).containsOnlyKeys("100", "20");
        assertThat(candidates.get("100")).containsExactly("the housing");
    }

    @Test
    void emptyLabelsAreDiscarded() {
        ReferenceNumeralExtractor nothingUseful = new ReferenceNumeralExtractor(phrase -> "");

        assertThat(nothingUseful.extract("front flap 120")).isEmpty();
    }

    @Test
    void scanReportsSpans() {
        String text = "a base 10 and a top 20, 22";
        List<ReferenceNumeralExtractor.TextMatch> matches = extractor.scan(text);

        assertThat(matches).hasSize(2);
        assertThat(matches.get(1).numerals()).containsExactly("20", "22");
        assertThat(text.substring(matches.get(1).start(), matches.get(1).end())).isEqualTo(" and a top 20, 22");
    }

    @Test
    void blankText() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }
}
