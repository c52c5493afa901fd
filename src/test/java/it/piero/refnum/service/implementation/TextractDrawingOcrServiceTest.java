package it.piero.refnum.service.implementation;

import it.piero.refnum.model.Detection;
import it.piero.refnum.utils.PdfUtils.PageImage;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Geometry;
import software.amazon.awssdk.services.textract.model.Point;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TextractDrawingOcrServiceTest {

    private final TextractClient client = mock(TextractClient.class);
    private final TextractDrawingOcrService service = new TextractDrawingOcrService(client);
    private final PageImage page = new PageImage(new byte[]{1, 2, 3}, 1000, 500);

    @Test
    void keepsWordsInPixelsWithConfidenceInUnitRange() {
        Block word = Block.builder()
                .blockType(BlockType.WORD)
                .text("1OO")
                .confidence(92.5f)
                .geometry(Geometry.builder().polygon(
                        point(0.1f, 0.2f), point(0.2f, 0.2f), point(0.2f, 0.3f), point(0.1f, 0.3f)).build())
                .build();
        Block line = Block.builder()
                .blockType(BlockType.LINE)
                .text("1OO")
                .confidence(92.5f)
                .geometry(word.geometry())
                .build();
        when(client.detectDocumentText(any(DetectDocumentTextRequest.class)))
                .thenReturn(DetectDocumentTextResponse.builder().blocks(line, word).build());

        List<Detection> detections = service.detect(page);

        assertThat(detections).hasSize(1);
        Detection d = detections.get(0);
        assertThat(d.getText()).isEqualTo("1OO");
        assertThat(d.getConfidence()).isCloseTo(0.925, within(1e-6));
        assertThat(d.getBox()).hasSize(4);
        assertThat(d.getBox().get(0).getX()).isCloseTo(100.0, within(1e-3));
        assertThat(d.getBox().get(2).getY()).isCloseTo(150.0, within(1e-3));
    }

    @Test
    void fallsBackToBoundingBoxWithoutPolygon() {
        Block word = Block.builder()
                .blockType(BlockType.WORD)
                .text("120")
                .confidence(80f)
                .geometry(Geometry.builder().boundingBox(BoundingBox.builder()
                        .left(0.5f).top(0.5f).width(0.1f).height(0.1f).build()).build())
                .build();
        when(client.detectDocumentText(any(DetectDocumentTextRequest.class)))
                .thenReturn(DetectDocumentTextResponse.builder().blocks(word).build());

        Detection d = service.detect(page).get(0);

        assertThat(d.getBox().get(0).getX()).isCloseTo(500.0, within(1e-3));
        assertThat(d.getBox().get(2).getY()).isCloseTo(300.0, within(1e-3));
    }

    private static Point point(float x, float y) {
        return Point.builder().x(x).y(y).build();
    }
}
