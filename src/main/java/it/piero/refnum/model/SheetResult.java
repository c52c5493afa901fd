package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SheetResult {
    private String origin;
    private Integer page;
    private Integer width;
    private Integer height;
    private List<ValidatedNumber> numbers;
}
