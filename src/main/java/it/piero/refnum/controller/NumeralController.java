package it.piero.refnum.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.piero.refnum.model.CorrelateRequest;
import it.piero.refnum.model.CorrelationResult;
import it.piero.refnum.model.ExtractRequest;
import it.piero.refnum.service.definition.CorrelationService;
import it.piero.refnum.utils.NumeralLabelMapUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("api/numerals")
@CrossOrigin(origins = "*")
public class NumeralController {

    private final CorrelationService correlationService;
    private final ObjectMapper mapper;

    public NumeralController(CorrelationService correlationService, ObjectMapper mapper) {
        this.correlationService = correlationService;
        this.mapper = mapper;
    }

    @PostMapping("extract")
    public ResponseEntity<Map<String, String>> extract(@RequestBody ExtractRequest request) {
        requireText(request.getText());
        return ResponseEntity.ok(correlationService.extractAndNormalize(request.getText()));
    }

    @PostMapping("correlate")
    public ResponseEntity<CorrelationResult> correlate(@RequestBody CorrelateRequest request) {
        requireText(request.getText());
        return ResponseEntity.ok(correlationService.analyze(request.getText(), request.getDetections()));
    }

    @PostMapping("sorted")
    public ResponseEntity<Map<String, String>> sorted(@RequestBody String labels) {
        return ResponseEntity.ok(NumeralLabelMapUtils.sortedNumerically(NumeralLabelMapUtils.fromJson(labels, mapper)));
    }

    static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Il testo del documento è obbligatorio");
        }
    }
}
