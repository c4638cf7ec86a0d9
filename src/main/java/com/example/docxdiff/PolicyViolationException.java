package com.example.docxdiff;

/** existingTrackedRevisions=FAIL 且修订稿已带修订标记 */
public class PolicyViolationException extends DocxDiffException {
    public PolicyViolationException(String message) {
        super(message);
    }
}
