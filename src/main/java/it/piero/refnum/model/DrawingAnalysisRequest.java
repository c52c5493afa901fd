package it.piero.refnum.model;

import lombok.Data;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Data
public class DrawingAnalysisRequest {

    private String text;
    private List<MultipartFile> files;

}
