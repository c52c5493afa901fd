package it.piero.refnum.exception;

/**
 * Tavola caricata che non è né un'immagine leggibile né un PDF.
 */
public class DrawingReadException extends RuntimeException {

    public DrawingReadException(String message) {
        super(message);
    }
}
