package it.piero.refnum.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractRequest {
    private String text;
}
