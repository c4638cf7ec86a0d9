package com.example.docxdiff;

/** 致命错误的基类：本次比对中止，不返回任何部分结果 */
public class DocxDiffException extends Exception {
    public DocxDiffException(String message) {
        super(message);
    }

    public DocxDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
