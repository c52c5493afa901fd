package it.piero.refnum.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DrawingAnalysisResult {
    private CorrelationResult correlation;
    private List<SheetResult> sheets;
}
