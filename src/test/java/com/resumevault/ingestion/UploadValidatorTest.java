package com.resumevault.ingestion;

import com.resumevault.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadValidatorTest {

    private final UploadValidator validator = new UploadValidator(new UploadProperties(10L * 1024 * 1024, 100, 255));

    @Test
    @DisplayName("Accepts content starting with the PDF signature")
    void acceptsPdf() {
        assertThatCode(() -> validator.validate(file("%PDF-1.7\n...")))
            .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rejects a missing file part")
    void rejectsMissingFile() {
        assertThatThrownBy(() -> validator.validate(null))
            .isInstanceOf(ValidationException.class)
            .hasMessage("No PDF file uploaded.");
        assertThatThrownBy(() -> validator.validate(new UploadedFile(null, "a.pdf")))
            .hasMessage("No PDF file uploaded.");
    }

    @Test
    @DisplayName("Rejects empty content")
    void rejectsEmpty() {
        assertThatThrownBy(() -> validator.validate(new UploadedFile(new byte[0], "a.pdf")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Empty file content.");
    }

    @Test
    @DisplayName("Rejects content over the size ceiling")
    void rejectsOversized() {
        byte[] content = new byte[10 * 1024 * 1024 + 1];
        System.arraycopy("%PDF".getBytes(StandardCharsets.US_ASCII), 0, content, 0, 4);

        assertThatThrownBy(() -> validator.validate(new UploadedFile(content, "big.pdf")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("File too large. Maximum file size is 10MB.");
    }

    @Test
    @DisplayName("Rejects content without the PDF signature")
    void rejectsWrongSignature() {
        assertThatThrownBy(() -> validator.validate(file("GIF89a")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid PDF file format.");
        assertThatThrownBy(() -> validator.validate(file("%PD")))
            .hasMessage("Invalid PDF file format.");
    }

    private static UploadedFile file(String content) {
        return new UploadedFile(content.getBytes(StandardCharsets.US_ASCII), "resume.pdf");
    }
}
