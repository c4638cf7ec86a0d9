package com.example.docxdiff;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;

/** 兜底错误页：DiffController 没接住的异常都落到这里，返回与 422 相同结构的 JSON */
@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleError(HttpServletRequest request) {
        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");

        int status = statusCode != null ? statusCode : 500;
        Map<String, Object> errorDetails = body(status, status >= 500 ? "Internal Server Error" : "Request Failed",
                errorMessage != null && !errorMessage.isEmpty() ? errorMessage : "An unexpected error occurred", exception);

        if (exception != null) {
            log.error("request failed: {}", errorDetails, exception);
        } else {
            log.warn("request failed: {}", errorDetails);
        }
        return ResponseEntity.status(status).body(errorDetails);
    }

    static Map<String, Object> body(int status, String error, String message, Throwable exception) {
        Map<String, Object> errorDetails = new LinkedHashMap<>();
        errorDetails.put("status", status);
        errorDetails.put("error", error);
        errorDetails.put("message", message);
        if (exception != null) {
            errorDetails.put("exception", exception.getClass().getSimpleName());
            errorDetails.put("details", exception.getMessage());
        }
        return errorDetails;
    }
}
