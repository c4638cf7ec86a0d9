package com.example.docxdiff;

public class MissingPartException extends DocxDiffException {
    public MissingPartException(String message) {
        super(message);
    }
}
