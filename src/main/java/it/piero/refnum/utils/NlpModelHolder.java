package it.piero.refnum.utils;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import it.piero.refnum.config.CorrelationProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Carica la pipeline CoreNLP una sola volta e la condivide in sola lettura.
 * Se il caricamento fallisce il risultato resta vuoto per tutta la vita del processo.
 */
@Slf4j
public class NlpModelHolder implements Supplier<Optional<StanfordCoreNLP>> {

    private final CorrelationProperties.Nlp settings;

    private volatile boolean initialized;
    private StanfordCoreNLP pipeline;

    public NlpModelHolder(CorrelationProperties.Nlp settings) {
        this.settings = settings;
    }

    @Override
    public Optional<StanfordCoreNLP> get() {
        if (!initialized) {
            synchronized (this) {
                if (!initialized) {
                    pipeline = load();
                    initialized = true;
                }
            }
        }
        return Optional.ofNullable(pipeline);
    }

    private StanfordCoreNLP load() {
        if (!settings.isEnabled()) {
            log.info("modello linguistico disabilitato, normalizzazione ridotta");
            return null;
        }
        Properties props = new Properties();
        props.setProperty("annotators", settings.getAnnotators());
        props.setProperty("tokenize.language", "en");
        props.setProperty("ssplit.isOneSentence", "true");
        props.setProperty("parse.maxlen", String.valueOf(settings.getParseMaxLength()));
        long start = System.currentTimeMillis();
        try {
            StanfordCoreNLP loaded = new StanfordCoreNLP(props);
            log.info("pipeline CoreNLP caricata in {} ms ({})", System.currentTimeMillis() - start, settings.getAnnotators());
            return loaded;
        } catch (RuntimeException e) {
            log.warn("impossibile caricare il modello linguistico, normalizzazione ridotta: {}", e.getMessage());
            return null;
        }
    }
}
