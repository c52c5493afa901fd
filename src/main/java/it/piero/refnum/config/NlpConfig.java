package it.piero.refnum.config;

import it.piero.refnum.utils.NlpModelHolder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NlpConfig {

    /**
     * Unica istanza del modello linguistico per processo; la pipeline viene caricata al primo uso.
     */
    @Bean
    public NlpModelHolder nlpModelHolder(CorrelationProperties properties) {
        return new NlpModelHolder(properties.getNlp());
    }
}
