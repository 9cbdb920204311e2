package com.resumevault.ingestion;

import com.resumevault.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

@Slf4j
@Component
@RequiredArgsConstructor
public class UploadValidator {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final UploadProperties properties;

    public void validate(UploadedFile file) {
        String filename = file == null ? "Unnamed file" : file.displayName();

        if (file == null || file.content() == null) {
            log.error("[{}] Validation failed: No PDF file uploaded.", filename);
            throw new ValidationException("No PDF file uploaded.");
        }
        if (file.content().length == 0) {
            log.error("[{}] Validation failed: Empty file content.", filename);
            throw new ValidationException("Empty file content.");
        }
        if (file.content().length > properties.maxBytes()) {
            log.error("[{}] Validation failed: File too large ({} bytes).", filename, file.content().length);
            throw new ValidationException(properties.tooLargeMessage());
        }
        if (!hasPdfSignature(file.content())) {
            log.error("[{}] Validation failed: Invalid PDF header.", filename);
            throw new ValidationException("Invalid PDF file format.");
        }
        log.info("[{}] Validation successful.", filename);
    }

    static boolean hasPdfSignature(byte[] content) {
        return content.length >= PDF_SIGNATURE.length
            && Arrays.equals(content, 0, PDF_SIGNATURE.length, PDF_SIGNATURE, 0, PDF_SIGNATURE.length);
    }
}
