package it.piero.refnum.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Point {
    private Double x;
    private Double y;

    public static Point of(double x, double y) {
        return new Point(x, y);
    }
}
