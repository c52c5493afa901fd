package it.piero.refnum.utils;

import it.piero.refnum.exception.DrawingReadException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
public class PdfUtils {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};

    public record PageImage(byte[] bytes, int width, int height) {}

    /**
     * Una tavola per pagina se il file è un PDF, altrimenti l'immagine così com'è.
     */
    public List<PageImage> toPageImages(MultipartFile file, int dpi) throws IOException {
        byte[] bytes = file.getBytes();
        if (isPdf(bytes)) {
            return renderPdfToImages(bytes, dpi);
        }
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(bytes));
        if (img == null) {
            throw new DrawingReadException("Formato non supportato per " + file.getOriginalFilename());
        }
        return List.of(new PageImage(bytes, img.getWidth(), img.getHeight()));
    }

    public List<PageImage> renderPdfToImages(byte[] pdfBytes, int dpi) throws IOException {

        try (PDDocument doc = Loader.loadPDF(pdfBytes)) {

            PDFRenderer renderer = new PDFRenderer(doc);
            renderer.setSubsamplingAllowed(false);

            List<PageImage> pages = new ArrayList<>();
            for (int i = 0; i < doc.getNumberOfPages(); i++) {
                BufferedImage img = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);

                ByteArrayOutputStream baos = new ByteArrayOutputStream();
                ImageWriter writer = ImageIO.getImageWritersByFormatName("png").next();
                try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                    writer.setOutput(ios);
                    ImageWriteParam param = writer.getDefaultWriteParam();

                    if (param.canWriteCompressed()) {
                        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                        param.setCompressionQuality(0.8f);
                    }

                    writer.write(null, new IIOImage(img, null, null), param);
                } finally {
                    writer.dispose();
                }

                pages.add(new PageImage(baos.toByteArray(), img.getWidth(), img.getHeight()));
            }
            return pages;
        }
    }

    static boolean isPdf(byte[] bytes) {
        if (bytes == null || bytes.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (bytes[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }
}
