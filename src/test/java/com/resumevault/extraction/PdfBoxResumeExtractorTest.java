package com.resumevault.extraction;

import com.resumevault.TestPdfs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxResumeExtractorTest {

    private final PdfBoxResumeExtractor extractor =
        new PdfBoxResumeExtractor(new ExtractorProperties(List.of("Java", "Python", "Go", "Kubernetes")));

    @Test
    @DisplayName("Reads name, major, graduation year, companies and keywords from the text layer")
    void extractsFields() throws Exception {
        byte[] pdf = pdf(
            "Jane Doe",
            "B.S. in Computer Science",
            "Class of 2024",
            "Software Engineer Intern, Acme Corp",
            "Research Assistant at Initech LLC",
            "Skills: Java, python, Kubernetes"
        );

        ExtractedResume extracted = extractor.extract(pdf, "jane_cv");

        assertThat(extracted.name()).isEqualTo("Jane Doe");
        assertThat(extracted.major()).isEqualTo("Computer Science");
        assertThat(extracted.graduationYear()).isEqualTo("2024");
        assertThat(extracted.companies()).containsExactly("Acme Corp", "Initech LLC");
        assertThat(extracted.keywords()).containsExactly("Java", "Python", "Kubernetes");
    }

    @Test
    @DisplayName("Falls back to the file stem when no name line is found and leaves unknown fields null")
    void fallsBackToFileStem() throws Exception {
        byte[] pdf = pdf("Curriculum vitae 2021-2023, all rights reserved.");

        ExtractedResume extracted = extractor.extract(pdf, "resume_final");

        assertThat(extracted.name()).isEqualTo("resume_final");
        assertThat(extracted.major()).isNull();
        assertThat(extracted.graduationYear()).isNull();
        assertThat(extracted.companies()).isEmpty();
    }

    @Test
    @DisplayName("Short vocabulary entries only match as whole, case-sensitive words")
    void shortKeywordsAreStrict() throws Exception {
        byte[] pdf = pdf("Jane Doe", "Worked at Google on services written in Go.", "Let's go build things.");

        ExtractedResume extracted = extractor.extract(pdf, "cv");

        assertThat(extracted.keywords()).containsExactly("Go");
    }

    @Test
    @DisplayName("A PDF without a text layer is an extraction failure")
    void blankPdf() throws Exception {
        byte[] pdf = pdf();

        assertThatThrownBy(() -> extractor.extract(pdf, "scan"))
            .isInstanceOf(ContentExtractionException.class)
            .hasMessage("PDF has no extractable text");
    }

    @Test
    @DisplayName("Bytes that are not a PDF are an extraction failure")
    void notAPdf() {
        byte[] garbage = "%PDF-1.4 truncated".getBytes();

        assertThatThrownBy(() -> extractor.extract(garbage, "broken"))
            .isInstanceOf(ContentExtractionException.class);
    }

    private static byte[] pdf(String... lines) throws IOException {
        return TestPdfs.withLines(lines);
    }
}
