package com.fundrecon.reconciliation.statement.document;

import com.fundrecon.reconciliation.exception.StatementDocumentException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;

/**
 * Produces plain statement text from a PDF. The PDF text layer is used when it
 * holds enough text; scanned or unparseable documents go through OCR when an
 * engine is configured.
 */
@Slf4j
public class StatementDocumentReader {

    private final OcrEngine ocrEngine;
    private final int minimumTextLength;

    /**
     * @param ocrEngine engine for scanned documents, or {@code null} to disable OCR
     * @param minimumTextLength text layers shorter than this (after trimming) count as scanned
     */
    public StatementDocumentReader(OcrEngine ocrEngine, int minimumTextLength) {
        this.ocrEngine = ocrEngine;
        this.minimumTextLength = minimumTextLength;
    }

    public String readText(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new StatementDocumentException("Statement document is empty");
        }

        IOException textLayerFailure = null;
        try {
            String text = extractTextLayer(pdfBytes);
            if (text.trim().length() >= minimumTextLength) {
                return text;
            }
            log.info("Statement text layer holds {} characters, treating document as scanned", text.trim().length());
        } catch (IOException e) {
            log.warn("Text extraction failed, falling back to OCR: {}", e.getMessage());
            textLayerFailure = e;
        }

        return recognize(pdfBytes, textLayerFailure);
    }

    private String extractTextLayer(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document);
        }
    }

    private String recognize(byte[] pdfBytes, IOException textLayerFailure) {
        if (ocrEngine == null) {
            if (textLayerFailure != null) {
                throw new StatementDocumentException("Statement document could not be parsed", textLayerFailure);
            }
            throw new StatementDocumentException("Statement document has no text layer and OCR is disabled");
        }
        try {
            return ocrEngine.recognize(pdfBytes);
        } catch (OcrEngine.OcrFailedException e) {
            if (textLayerFailure != null) {
                e.addSuppressed(textLayerFailure);
            }
            throw new StatementDocumentException("Statement document could not be read", e);
        }
    }
}
