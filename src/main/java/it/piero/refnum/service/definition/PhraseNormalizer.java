package it.piero.refnum.service.definition;

@FunctionalInterface
public interface PhraseNormalizer {

    /**
     * Riduce una frase descrittiva a un'etichetta breve (es. "a flexible main body" → "flexible main body").
     *
     * @return l'etichetta, oppure stringa vuota se la frase non contiene un nome utilizzabile
     */
    String normalize(String phrase);

}
