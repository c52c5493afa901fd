package it.piero.refnum.exception;

import it.piero.refnum.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import software.amazon.awssdk.core.exception.SdkException;

import java.io.IOException;
import java.time.LocalDateTime;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("richiesta non valida su {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("corpo della richiesta non leggibile su {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_JSON", "Corpo della richiesta non leggibile", request);
    }

    @ExceptionHandler(DrawingReadException.class)
    public ResponseEntity<ErrorResponse> handleDrawing(DrawingReadException ex, HttpServletRequest request) {
        log.warn("tavola non leggibile: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "UNREADABLE_DRAWING", ex.getMessage(), request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException ex, HttpServletRequest request) {
        log.warn("errore di lettura del file su {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "UNREADABLE_DRAWING", ex.getMessage(), request);
    }

    @ExceptionHandler(SdkException.class)
    public ResponseEntity<ErrorResponse> handleOcr(SdkException ex, HttpServletRequest request) {
        log.error("servizio OCR non disponibile", ex);
        return build(HttpStatus.BAD_GATEWAY, "OCR_UNAVAILABLE", ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                       HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(code)
                .message(message)
                .status(status.value())
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
