package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BBox {
    private Double left;
    private Double top;
    private Double width;
    private Double height;

    public static BBox of(List<Point> polygon) {
        if (polygon == null || polygon.isEmpty()) return null;
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (Point p : polygon) {
            minX = Math.min(minX, p.getX());
            minY = Math.min(minY, p.getY());
            maxX = Math.max(maxX, p.getX());
            maxY = Math.max(maxY, p.getY());
        }
        return BBox.builder()
                .left(minX)
                .top(minY)
                .width(maxX - minX)
                .height(maxY - minY)
                .build();
    }
}
