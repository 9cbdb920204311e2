package com.resumevault.controller;

import com.resumevault.ingestion.IngestionRequest;
import com.resumevault.ingestion.IngestionResult;
import com.resumevault.ingestion.ResumeIngestionService;
import com.resumevault.ingestion.UploadedFile;
import com.resumevault.model.ResumeFilters;
import com.resumevault.search.ResumeSearchService;
import com.resumevault.search.SearchCriteria;
import com.resumevault.security.ResumePrincipal;
import com.resumevault.service.FileDeliveryService;
import com.resumevault.service.ResumeFile;
import com.resumevault.service.ResumeResponseMapper;
import com.resumevault.service.ResumeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;

@Slf4j
@RestController
@RequestMapping("/resumes")
@RequiredArgsConstructor
public class ResumeController {

    private final ResumeIngestionService ingestionService;
    private final ResumeSearchService searchService;
    private final ResumeService resumeService;
    private final FileDeliveryService fileDeliveryService;
    private final ResumeResponseMapper mapper;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<UploadedResumeResponse>> upload(
        @RequestParam(value = "file", required = false) MultipartFile file,
        @RequestParam(required = false) String name,
        @RequestParam(required = false) String major,
        @RequestParam(required = false) String graduationYear,
        @RequestParam(required = false) String companies,
        @RequestParam(required = false) String keywords,
        @AuthenticationPrincipal ResumePrincipal principal
    ) throws IOException {

        UploadedFile upload = file == null ? null : new UploadedFile(file.getBytes(), file.getOriginalFilename());
        IngestionResult result = ingestionService.ingest(new IngestionRequest(
            upload, principal, name, major, graduationYear, companies, keywords));

        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(
            String.format("Resume \"%s\" uploaded successfully.", result.originalFilename()),
            mapper.toUploaded(result.resume(), result.parsingWarning())
        ));
    }

    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(
        @RequestParam(required = false) String query,
        @RequestParam(required = false) String name,
        @RequestParam(required = false) String major,
        @RequestParam(required = false) String company,
        @RequestParam(required = false) String graduationYear,
        @RequestParam(required = false) String keyword
    ) {
        return ResponseEntity.ok(searchService.search(
            new SearchCriteria(query, name, major, graduationYear, company, keyword)));
    }

    @GetMapping("/filters")
    public ResponseEntity<ApiResponse<ResumeFilters>> filters() {
        return ResponseEntity.ok(ApiResponse.ok(resumeService.filters()));
    }

    /**
     * Bytes are copied straight from the blob store to the response. A failure after the first
     * bytes were flushed aborts the connection.
     */
    @GetMapping("/{id}/file")
    public ResponseEntity<StreamingResponseBody> file(@PathVariable String id) {
        ResumeFile file = fileDeliveryService.open(id);

        StreamingResponseBody body = out -> {
            try (file) {
                file.content().transferTo(out);
            }
        };

        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_PDF)
            .contentLength(file.length())
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.inline().filename(file.inlineFilename()).build().toString())
            .body(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ResumeDetail>> getResume(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(resumeService.getById(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ResumeSummary>> updateResume(
        @PathVariable String id,
        @Valid @RequestBody ResumeUpdateRequest request,
        @AuthenticationPrincipal ResumePrincipal principal
    ) {
        return ResponseEntity.ok(ApiResponse.ok("Resume updated successfully.",
            resumeService.update(id, request, principal)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteResume(
        @PathVariable String id,
        @AuthenticationPrincipal ResumePrincipal principal
    ) {
        resumeService.delete(id, principal);
        return ResponseEntity.ok(ApiResponse.ok("Resume deleted successfully.", null));
    }

    @DeleteMapping("/all/delete")
    public ResponseEntity<ApiResponse<DeleteAllResult>> deleteAll(@AuthenticationPrincipal ResumePrincipal principal) {
        int deleted = resumeService.deleteAll(principal);
        return ResponseEntity.ok(ApiResponse.ok(
            String.format("Successfully deleted %d resumes.", deleted),
            new DeleteAllResult(deleted)
        ));
    }
}
