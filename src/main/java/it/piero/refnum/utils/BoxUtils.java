package it.piero.refnum.utils;

import it.piero.refnum.model.BBox;
import it.piero.refnum.model.Point;

import java.util.List;

/**
 * Geometria sui rettangoli allineati agli assi che contengono i poligoni OCR.
 */
public final class BoxUtils {

    private BoxUtils() {}

    public static double area(BBox b) {
        if (b == null) return 0;
        return Math.max(0, b.getWidth()) * Math.max(0, b.getHeight());
    }

    public static double intersectionArea(BBox a, BBox b) {
        if (a == null || b == null) return 0;
        double ax1 = a.getLeft(), ay1 = a.getTop();
        double ax2 = a.getLeft() + a.getWidth(), ay2 = a.getTop() + a.getHeight();
        double bx1 = b.getLeft(), by1 = b.getTop();
        double bx2 = b.getLeft() + b.getWidth(), by2 = b.getTop() + b.getHeight();
        double ix = Math.max(0, Math.min(ax2, bx2) - Math.max(ax1, bx1));
        double iy = Math.max(0, Math.min(ay2, by2) - Math.max(ay1, by1));
        return ix * iy;
    }

    public static double iou(BBox a, BBox b) {
        double inter = intersectionArea(a, b);
        if (inter <= 0) return 0;
        double union = area(a) + area(b) - inter;
        return union > 0 ? inter / union : 0;
    }

    public static double iou(List<Point> a, List<Point> b) {
        return iou(BBox.of(a), BBox.of(b));
    }

    /**
     * Riporta un poligono in coordinate normalizzate [0,1] alla dimensione in pixel della pagina.
     */
    public static List<Point> scale(List<Point> polygon, int width, int height) {
        if (width <= 0 || height <= 0) return polygon;
        return polygon.stream()
                .map(p -> Point.of(p.getX() * width, p.getY() * height))
                .toList();
    }

    /**
     * Vertici del rettangolo in senso orario a partire da quello in alto a sinistra.
     */
    public static List<Point> corners(BBox b) {
        double right = b.getLeft() + b.getWidth();
        double bottom = b.getTop() + b.getHeight();
        return List.of(
                Point.of(b.getLeft(), b.getTop()),
                Point.of(right, b.getTop()),
                Point.of(right, bottom),
                Point.of(b.getLeft(), bottom)
        );
    }
}
