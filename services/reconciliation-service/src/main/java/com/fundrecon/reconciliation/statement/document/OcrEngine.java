package com.fundrecon.reconciliation.statement.document;

/**
 * Recognises text in scanned statement documents.
 */
public interface OcrEngine {

    /**
     * @param pdfBytes the complete PDF document
     * @return recognised text of all pages, pages separated by line breaks
     * @throws OcrFailedException when recognition cannot be performed
     */
    String recognize(byte[] pdfBytes) throws OcrFailedException;

    class OcrFailedException extends Exception {

        public OcrFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
