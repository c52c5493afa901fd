package it.piero.refnum.service.implementation;

import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.trees.CollinsHeadFinder;
import edu.stanford.nlp.trees.HeadFinder;
import edu.stanford.nlp.trees.Tree;
import it.piero.refnum.service.definition.PhraseNormalizer;
import it.piero.refnum.utils.NlpModelHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CoreNlpPhraseNormalizer implements PhraseNormalizer {

    private static final Pattern STOPWORDS = Pattern.compile(
            "\\b(?:wherein|each|the|and|a|an|when|all|of|may be|is|are|with|such as|general(?:ly)?|indicated|identified|numeral|no|shown|"
                    + "that defines|controlled be|may be made of|or includes|i\\.e\\.|e\\.g\\.|as by|in use|considering again|be it|some other|one embodiment|"
                    + "roughly|such that|whether by|to the extent that|as suggested by|mounted|attached|respectively|similarly|or|this|that|these|those|"
                    + "some|any|every|either|neither|both|few|many|much|more|most|other|such|what|however|within|without)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern FIGURE = Pattern.compile("\\bfigs?\\.?\\s*\\d+\\w*\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_WORD = Pattern.compile("\\b(\\w+)\\b(?: \\1\\b)+");
    private static final String TRIM_CHARS = " ,.-:;";

    private static final Set<String> GENERIC_HEADS = Set.of(
            "it", "access", "extent", "width", "ends", "structure", "point", "form",
            "define", "has", "portion", "side", "area", "view", "figure");

    // "side" e "area" restano accettabili come ultima scelta
    private static final Set<String> GENERIC_TOKENS = Set.of(
            "it", "access", "extent", "width", "ends", "structure", "point", "form",
            "define", "has", "portion", "view", "figure");

    private final NlpModelHolder nlpModel;
    private final HeadFinder headFinder = new CollinsHeadFinder();

    @Override
    public String normalize(String phrase) {
        if (phrase == null) return "";

        Optional<StanfordCoreNLP> model = nlpModel.get();
        if (model.isEmpty()) {
            return phrase.toLowerCase(Locale.ROOT).trim();
        }

        String cleaned = clean(phrase);
        if (cleaned.isEmpty()) return "";

        String head = selectHeadPhrase(model.get(), cleaned);
        if (head.isEmpty()) {
            log.debug("nessun nome utile in '{}'", cleaned);
            return "";
        }

        String label = collapseRepeats(buildLabel(model.get(), head.toLowerCase(Locale.ROOT)));
        return label.length() > 1 ? label : "";
    }

    static String collapseRepeats(String label) {
        return REPEATED_WORD.matcher(label).replaceAll("$1");
    }

    static String clean(String phrase) {
        String s = STOPWORDS.matcher(phrase.toLowerCase(Locale.ROOT)).replaceAll("");
        s = FIGURE.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return strip(s);
    }

    private static String strip(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && TRIM_CHARS.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && TRIM_CHARS.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end);
    }

    /**
     * Il sintagma nominale più a destra è di norma il referente del numero.
     */
    private String selectHeadPhrase(StanfordCoreNLP pipeline, String text) {
        CoreDocument doc = new CoreDocument(text);
        pipeline.annotate(doc);

        List<Tree> nounPhrases = new ArrayList<>();
        for (CoreSentence sentence : doc.sentences()) {
            Tree tree = sentence.constituencyParse();
            if (tree != null) collectBaseNounPhrases(tree, nounPhrases);
        }

        for (int i = nounPhrases.size() - 1; i >= 0; i--) {
            Tree np = nounPhrases.get(i);
            Tree head = np.headPreTerminal(headFinder);
            if (head == null || !isNoun(head.value())) continue;
            String headWord = head.firstChild().value().toLowerCase(Locale.ROOT);
            if (GENERIC_HEADS.contains(headWord)) continue;
            return np.yieldWords().stream()
                    .map(w -> w.word())
                    .collect(Collectors.joining(" "));
        }

        List<CoreLabel> tokens = doc.tokens();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            CoreLabel token = tokens.get(i);
            if (isNoun(token.tag()) && !GENERIC_TOKENS.contains(token.word().toLowerCase(Locale.ROOT))) {
                return token.word();
            }
        }
        return "";
    }

    /**
     * Raccoglie in ordine di testo i sintagmi nominali che non ne contengono altri.
     *
     * @return true se il sottoalbero contiene almeno un NP
     */
    private static boolean collectBaseNounPhrases(Tree node, List<Tree> out) {
        if (node.isLeaf()) return false;
        boolean nested = false;
        for (Tree child : node.children()) {
            nested |= collectBaseNounPhrases(child, out);
        }
        boolean nounPhrase = "NP".equals(node.value());
        if (nounPhrase && !nested) out.add(node);
        return nested || nounPhrase;
    }

    private static String buildLabel(StanfordCoreNLP pipeline, String headPhrase) {
        CoreDocument doc = new CoreDocument(headPhrase);
        pipeline.annotate(doc);
        List<CoreLabel> tokens = doc.tokens();

        List<String> words = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            CoreLabel token = tokens.get(i);
            String tag = token.tag();
            if (isNoun(tag)) {
                words.add(isPlural(tag) ? singular(token) : token.word());
            } else if (isAdjective(tag)) {
                words.add(token.word());
            } else if (isParticipleModifier(tag) && i < tokens.size() - 1) {
                words.add(token.word());
            }
        }
        return String.join(" ", words);
    }

    private static String singular(CoreLabel token) {
        String lemma = token.lemma();
        return lemma == null || lemma.isEmpty() ? token.word() : lemma;
    }

    private static boolean isNoun(String tag) {
        return "NN".equals(tag) || "NNS".equals(tag) || "NNP".equals(tag) || "NNPS".equals(tag);
    }

    private static boolean isPlural(String tag) {
        return "NNS".equals(tag) || "NNPS".equals(tag);
    }

    private static boolean isAdjective(String tag) {
        return "JJ".equals(tag) || "JJR".equals(tag) || "JJS".equals(tag);
    }

    // "insulated" in "insulated compartments": participio usato come aggettivo
    private static boolean isParticipleModifier(String tag) {
        return "VBN".equals(tag) || "VBG".equals(tag);
    }
}
