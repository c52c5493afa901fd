package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValidatedNumber {
    private List<Point> box;
    private String originalText;
    private String correctedText;
    private Double value;
    private Double confidence;
}
