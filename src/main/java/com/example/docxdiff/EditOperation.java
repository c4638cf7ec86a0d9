package com.example.docxdiff;

import lombok.Value;

/** 编辑脚本中的一步 */
@Value
public class EditOperation {

    public enum Type { EQUAL, INSERT, DELETE }

    Type type;
    String token;

    public static EditOperation equal(String token) { return new EditOperation(Type.EQUAL, token); }
    public static EditOperation insert(String token) { return new EditOperation(Type.INSERT, token); }
    public static EditOperation delete(String token) { return new EditOperation(Type.DELETE, token); }
}
