package it.piero.refnum.service.implementation;

import it.piero.refnum.model.BBox;
import it.piero.refnum.model.Detection;
import it.piero.refnum.model.Point;
import it.piero.refnum.service.definition.DrawingOcrService;
import it.piero.refnum.utils.BoxUtils;
import it.piero.refnum.utils.PdfUtils.PageImage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.*;

import java.util.List;
import java.util.Objects;

/**
 * Letture a livello di parola: sulle tavole ogni numero di riferimento è una parola isolata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refnum.ocr", name = "provider", havingValue = "textract", matchIfMissing = true)
public class TextractDrawingOcrService implements DrawingOcrService {

    private final TextractClient textractClient;

    @Override
    public List<Detection> detect(PageImage page) {
        Document document = Document.builder()
                .bytes(SdkBytes.fromByteArray(page.bytes()))
                .build();

        DetectDocumentTextRequest req = DetectDocumentTextRequest.builder()
                .document(document)
                .build();

        DetectDocumentTextResponse resp = textractClient.detectDocumentText(req);

        List<Detection> detections = resp.blocks().stream()
                .filter(b -> b.blockType() == BlockType.WORD)
                .map(b -> toDetection(b, page))
                .filter(Objects::nonNull)
                .toList();

        log.info("textract: {} parole su {} blocchi", detections.size(), resp.blocks().size());
        return detections;
    }

    private static Detection toDetection(Block b, PageImage page) {
        if (b.text() == null || b.confidence() == null || b.geometry() == null) return null;
        List<Point> polygon = polygonOf(b.geometry());
        if (polygon == null) return null;
        return Detection.builder()
                .box(BoxUtils.scale(polygon, page.width(), page.height()))
                .text(b.text())
                .confidence(b.confidence() / 100.0)
                .build();
    }

    private static List<Point> polygonOf(Geometry geometry) {
        if (geometry.hasPolygon() && geometry.polygon().size() == 4) {
            return geometry.polygon().stream()
                    .map(p -> Point.of(p.x(), p.y()))
                    .toList();
        }
        BoundingBox bb = geometry.boundingBox();
        if (bb == null) return null;
        return BoxUtils.corners(BBox.builder()
                .left((double) bb.left())
                .top((double) bb.top())
                .width((double) bb.width())
                .height((double) bb.height())
                .build());
    }
}
