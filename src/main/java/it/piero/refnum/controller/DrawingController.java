package it.piero.refnum.controller;

import it.piero.refnum.config.CorrelationProperties;
import it.piero.refnum.model.CorrelationResult;
import it.piero.refnum.model.Detection;
import it.piero.refnum.model.DrawingAnalysisRequest;
import it.piero.refnum.model.DrawingAnalysisResult;
import it.piero.refnum.model.SheetResult;
import it.piero.refnum.service.definition.CorrelationService;
import it.piero.refnum.service.definition.DrawingOcrService;
import it.piero.refnum.utils.PdfUtils;
import it.piero.refnum.utils.PdfUtils.PageImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("api/drawings")
@CrossOrigin(origins = "*")
public class DrawingController {

    private final DrawingOcrService drawingOcrService;
    private final CorrelationService correlationService;
    private final PdfUtils pdfUtils;
    private final int pdfDpi;

    public DrawingController(DrawingOcrService drawingOcrService, CorrelationService correlationService,
                             PdfUtils pdfUtils, CorrelationProperties properties) {
        this.drawingOcrService = drawingOcrService;
        this.correlationService = correlationService;
        this.pdfUtils = pdfUtils;
        this.pdfDpi = properties.getOcr().getPdfDpi();
    }

    @PostMapping(
            value = "/analyze",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE
    )
    public ResponseEntity<DrawingAnalysisResult> analyze(@ModelAttribute DrawingAnalysisRequest request) throws IOException {
        NumeralController.requireText(request.getText());
        List<MultipartFile> files = request.getFiles() == null ? List.of() : request.getFiles();
        log.info("avvio analisi tavole ({} file)", files.size());

        List<List<Detection>> detectionsBySheet = new ArrayList<>();
        List<SheetResult> sheets = new ArrayList<>();

        for (MultipartFile fileItem : files) {
            String origin = fileItem.getOriginalFilename();
            int pageNumber = 1;
            for (PageImage page : pdfUtils.toPageImages(fileItem, pdfDpi)) {
                List<Detection> detections = drawingOcrService.detect(page);
                detectionsBySheet.add(detections);
                sheets.add(SheetResult.builder()
                        .origin(origin)
                        .page(pageNumber)
                        .width(page.width())
                        .height(page.height())
                        .numbers(correlationService.detectNumbers(detections))
                        .build());
                pageNumber++;
            }
        }

        CorrelationResult correlation = correlationService.analyzeSheets(request.getText(), detectionsBySheet);
        return ResponseEntity.ok(DrawingAnalysisResult.builder()
                .correlation(correlation)
                .sheets(sheets)
                .build());
    }
}
