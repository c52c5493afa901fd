package it.piero.refnum.service.implementation;

import it.piero.refnum.model.Detection;
import it.piero.refnum.utils.PdfUtils.PageImage;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.rekognition.model.BoundingBox;
import software.amazon.awssdk.services.rekognition.model.DetectTextRequest;
import software.amazon.awssdk.services.rekognition.model.DetectTextResponse;
import software.amazon.awssdk.services.rekognition.model.Geometry;
import software.amazon.awssdk.services.rekognition.model.TextDetection;
import software.amazon.awssdk.services.rekognition.model.TextTypes;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RekognitionDrawingOcrServiceTest {

    private final RekognitionClient client = mock(RekognitionClient.class);
    private final RekognitionDrawingOcrService service = new RekognitionDrawingOcrService(client);

    @Test
    void keepsOnlyWordsScaledToThePage() {
        Geometry geometry = Geometry.builder()
                .boundingBox(BoundingBox.builder().left(0.25f).top(0.5f).width(0.25f).height(0.125f).build())
                .build();
        TextDetection line = TextDetection.builder()
                .type(TextTypes.LINE).detectedText("100 120").confidence(99f).geometry(geometry).build();
        TextDetection word = TextDetection.builder()
                .type(TextTypes.WORD).detectedText("1OO").confidence(75f).geometry(geometry).build();
        TextDetection noGeometry = TextDetection.builder()
                .type(TextTypes.WORD).detectedText("120").confidence(90f).build();
        when(client.detectText(any(DetectTextRequest.class)))
                .thenReturn(DetectTextResponse.builder().textDetections(line, word, noGeometry).build());

        List<Detection> detections = service.detect(new PageImage(new byte[]{9}, 400, 800));

        assertThat(detections).singleElement().satisfies(d -> {
            assertThat(d.getText()).isEqualTo("1OO");
            assertThat(d.getConfidence()).isCloseTo(0.75, within(1e-9));
            assertThat(d.getBox().get(0).getX()).isCloseTo(100.0, within(1e-6));
            assertThat(d.getBox().get(2).getY()).isCloseTo(500.0, within(1e-6));
        });
    }
}
