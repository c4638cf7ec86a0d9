package com.example.docxdiff;

/** zip 超出资源上限或不是合法的压缩包 */
public class ArchiveException extends DocxDiffException {
    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
