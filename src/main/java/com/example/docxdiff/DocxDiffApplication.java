package com.example.docxdiff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxDiffApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxDiffApplication.class, args);
        System.out.println("DOCX Track-Diff 启动成功！");
        System.out.println("POST http://localhost:8080/api/diff");
    }
}
