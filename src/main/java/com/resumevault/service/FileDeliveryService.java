package com.resumevault.service;

import com.resumevault.exception.ResumeNotFoundException;
import com.resumevault.model.Resume;
import com.resumevault.repository.ResumeRepository;
import com.resumevault.storage.BlobContent;
import com.resumevault.storage.BlobStore;
import com.resumevault.storage.FilenameSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
public class FileDeliveryService {

    private final ResumeRepository resumeRepository;
    private final BlobStore blobStore;
    private final String baseUrl;

    public FileDeliveryService(
        ResumeRepository resumeRepository,
        BlobStore blobStore,
        @Value("${app.delivery.base-url:}") String baseUrl
    ) {
        this.resumeRepository = resumeRepository;
        this.blobStore = blobStore;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
    }

    /**
     * Stable download reference for a resume. Built from the resume id, never the blob id.
     */
    public String fileUrlFor(UUID resumeId) {
        return baseUrl + "/resumes/" + resumeId + "/file";
    }

    /**
     * Opens the binary of an active resume. A resume whose blob is gone raises
     * {@link com.resumevault.exception.BlobNotFoundException}, distinct from the resume itself
     * being missing.
     */
    public ResumeFile open(String rawId) {
        UUID id = ResumeIds.parse(rawId);
        Resume resume = resumeRepository.findActiveById(id)
            .filter(r -> r.blobId() != null)
            .orElseThrow(() -> new ResumeNotFoundException(id));

        BlobContent content = blobStore.open(resume.blobId());
        log.debug("Streaming blob {} for resume {} ({} bytes)", resume.blobId(), id, content.descriptor().length());
        return new ResumeFile(id, inlineFilename(resume.name()), content);
    }

    static String inlineFilename(String name) {
        String base = name == null || name.isBlank() ? "resume" : name;
        return FilenameSanitizer.sanitize(base) + ".pdf";
    }
}
