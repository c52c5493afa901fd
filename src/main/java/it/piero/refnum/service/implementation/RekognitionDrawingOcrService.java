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
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.rekognition.model.BoundingBox;
import software.amazon.awssdk.services.rekognition.model.DetectTextRequest;
import software.amazon.awssdk.services.rekognition.model.DetectTextResponse;
import software.amazon.awssdk.services.rekognition.model.Geometry;
import software.amazon.awssdk.services.rekognition.model.Image;
import software.amazon.awssdk.services.rekognition.model.TextDetection;
import software.amazon.awssdk.services.rekognition.model.TextTypes;

import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refnum.ocr", name = "provider", havingValue = "rekognition")
public class RekognitionDrawingOcrService implements DrawingOcrService {

    private final RekognitionClient rekognitionClient;

    @Override
    public List<Detection> detect(PageImage page) {
        DetectTextRequest req = DetectTextRequest.builder()
                .image(Image.builder().bytes(SdkBytes.fromByteArray(page.bytes())).build())
                .build();

        DetectTextResponse resp = rekognitionClient.detectText(req);

        List<Detection> detections = resp.textDetections().stream()
                .filter(t -> t.type() == TextTypes.WORD)
                .map(t -> toDetection(t, page))
                .filter(Objects::nonNull)
                .toList();

        log.info("rekognition: {} parole su {} rilevamenti", detections.size(), resp.textDetections().size());
        return detections;
    }

    private static Detection toDetection(TextDetection t, PageImage page) {
        if (t.detectedText() == null || t.confidence() == null || t.geometry() == null) return null;
        List<Point> polygon = polygonOf(t.geometry());
        if (polygon == null) return null;
        return Detection.builder()
                .box(BoxUtils.scale(polygon, page.width(), page.height()))
                .text(t.detectedText())
                .confidence(t.confidence() / 100.0)
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
