package com.example.docxdiff;

import lombok.Value;

import java.util.List;

/** 输出包字节 + 非致命警告 */
@Value
public class DiffResult {
    byte[] bytes;
    List<String> warnings;
}
