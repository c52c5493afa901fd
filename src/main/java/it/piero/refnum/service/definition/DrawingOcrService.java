package it.piero.refnum.service.definition;

import it.piero.refnum.model.Detection;
import it.piero.refnum.utils.PdfUtils.PageImage;

import java.util.List;

public interface DrawingOcrService {

    /**
     * Letture OCR di una tavola, con i poligoni in pixel della pagina.
     */
    List<Detection> detect(PageImage page);

}
