package it.piero.refnum.utils;

import it.piero.refnum.model.BBox;
import it.piero.refnum.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static it.piero.refnum.TestDetections.rect;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BoxUtilsTest {

    @Test
    void identicalBoxesOverlapCompletely() {
        assertThat(BoxUtils.iou(rect(0, 0, 10, 10), rect(0, 0, 10, 10))).isEqualTo(1.0);
    }

    @Test
    void disjointOrTouchingBoxesDoNotOverlap() {
        assertThat(BoxUtils.iou(rect(0, 0, 10, 10), rect(20, 0, 10, 10))).isZero();
        assertThat(BoxUtils.iou(rect(0, 0, 10, 10), rect(10, 0, 10, 10))).isZero();
    }

    @Test
    void partialOverlap() {
        // 50 / (100 + 100 - 50)
        assertThat(BoxUtils.iou(rect(0, 0, 10, 10), rect(5, 0, 10, 10))).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    void rotatedPolygonUsesEnclosingRectangle() {
        List<Point> diamond = List.of(Point.of(5, 0), Point.of(10, 5), Point.of(5, 10), Point.of(0, 5));

        BBox box = BBox.of(diamond);

        assertThat(box.getLeft()).isEqualTo(0.0);
        assertThat(box.getWidth()).isEqualTo(10.0);
        assertThat(BoxUtils.iou(diamond, rect(0, 0, 10, 10))).isEqualTo(1.0);
    }

    @Test
    void degenerateBoxHasNoArea() {
        assertThat(BoxUtils.iou(rect(3, 3, 0, 0), rect(3, 3, 0, 0))).isZero();
    }

    @Test
    void scalesNormalizedPolygonToPixels() {
        List<Point> scaled = BoxUtils.scale(List.of(Point.of(0.5, 0.25)), 200, 100);

        assertThat(scaled).containsExactly(Point.of(100.0, 25.0));
    }

    @Test
    void cornersGoClockwiseFromTopLeft() {
        BBox box = BBox.builder().left(1.0).top(2.0).width(3.0).height(4.0).build();

        assertThat(BoxUtils.corners(box)).containsExactly(
                Point.of(1.0, 2.0), Point.of(4.0, 2.0), Point.of(4.0, 6.0), Point.of(1.0, 6.0));
    }
}
