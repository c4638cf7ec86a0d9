package com.example.docxdiff;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class DiffController {

    static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");
    static final String WARNING_HEADER = "X-Diff-Warning";

    @Autowired
    private TrackedDiffService trackedDiffService;

    @GetMapping("/")
    public String home() {
        return "DOCX Track-Diff is running!";
    }

    /** 两份 DOCX → 带修订标记的 DOCX；警告逐条放在 X-Diff-Warning 响应头里 */
    @PostMapping("/diff")
    public ResponseEntity<byte[]> diff(
            @RequestParam("base") MultipartFile base,
            @RequestParam("revised") MultipartFile revised,
            @RequestParam(value = "author", required = false, defaultValue = "AutoDiff") String author,
            @RequestParam(value = "outputFileName", required = false, defaultValue = "diff.docx") String outputFileName,
            @RequestParam(value = "granularity", required = false, defaultValue = "word") String granularity,
            @RequestParam(value = "suppressWhitespaceOnly", required = false, defaultValue = "true") boolean suppressWhitespaceOnly,
            @RequestParam(value = "includeLists", required = false, defaultValue = "true") boolean includeLists,
            @RequestParam(value = "includeTables", required = false, defaultValue = "true") boolean includeTables,
            @RequestParam(value = "includeTextBoxes", required = false, defaultValue = "true") boolean includeTextBoxes,
            @RequestParam(value = "includeHeadersFooters", required = false, defaultValue = "false") boolean includeHeadersFooters,
            @RequestParam(value = "existingTrackedRevisions", required = false, defaultValue = "ignore") String existingTrackedRevisions,
            @RequestParam(value = "maxTotalUnzippedBytes", required = false) Long maxTotalUnzippedBytes,
            @RequestParam(value = "maxEntries", required = false) Integer maxEntries,
            @RequestParam(value = "maxEntrySize", required = false) Long maxEntrySize,
            @RequestParam(value = "maxTokensPerParagraph", required = false) Integer maxTokensPerParagraph
    ) throws DocxDiffException, IOException {
        log.info("diff request: base={}, revised={}, author={}", base.getOriginalFilename(), revised.getOriginalFilename(), author);

        ResourceLimits.Builder limits = ResourceLimits.defaults().toBuilder();
        if (maxTotalUnzippedBytes != null) limits.maxTotalUnzippedBytes(maxTotalUnzippedBytes);
        if (maxEntries != null) limits.maxEntries(maxEntries);
        if (maxEntrySize != null) limits.maxEntrySize(maxEntrySize);
        if (maxTokensPerParagraph != null) limits.maxTokensPerParagraph(maxTokensPerParagraph);

        DiffOptions options = DiffOptions.builder()
                .granularity(Granularity.parse(granularity))
                .suppressWhitespaceOnly(suppressWhitespaceOnly)
                .includeLists(includeLists)
                .includeTables(includeTables)
                .includeTextBoxes(includeTextBoxes)
                .includeHeadersFooters(includeHeadersFooters)
                .existingTrackedRevisions(TrackedRevisionsPolicy.parse(existingTrackedRevisions))
                .limits(limits.build())
                .build();

        DiffResult result = trackedDiffService.diff(base.getBytes(), revised.getBytes(), author, options);

        String fileName = (outputFileName == null || outputFileName.isBlank()) ? "diff.docx" : outputFileName;
        return ResponseEntity.ok()
                .contentType(DOCX)
                .header("Content-Disposition", "attachment; filename=" + fileName)
                .header(WARNING_HEADER, result.getWarnings().toArray(new String[0]))
                .body(result.getBytes());
    }

    @ExceptionHandler(DocxDiffException.class)
    public ResponseEntity<Map<String, Object>> onDiffFailure(DocxDiffException e) {
        log.warn("diff failed: {}", e.getMessage());
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorController.body(status.value(), status.getReasonPhrase(), e.getMessage(), e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onBadOption(IllegalArgumentException e) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorController.body(status.value(), status.getReasonPhrase(), e.getMessage(), e));
    }
}
