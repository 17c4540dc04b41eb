package com.fundrecon.reconciliation.statement.document;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Renders every PDF page with PDFBox and runs Tesseract over the images.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final String datapath;
    private final String language;
    private final float dpi;

    public TesseractOcrEngine(String datapath, String language, float dpi) {
        this.datapath = datapath;
        this.language = language;
        this.dpi = dpi;
    }

    @Override
    public String recognize(byte[] pdfBytes) throws OcrFailedException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFRenderer renderer = new PDFRenderer(document);
            ITesseract tesseract = newTesseract();

            StringBuilder text = new StringBuilder();
            for (int page = 0; page < document.getNumberOfPages(); page++) {
                BufferedImage image = renderer.renderImageWithDPI(page, dpi, ImageType.GRAY);
                text.append(tesseract.doOCR(image)).append('\n');
            }

            log.info("OCR recognised {} characters from {} pages", text.length(), document.getNumberOfPages());
            return text.toString();
        } catch (IOException | TesseractException e) {
            throw new OcrFailedException("OCR of statement document failed: " + e.getMessage(), e);
        }
    }

    private ITesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(language);
        return tesseract;
    }
}
