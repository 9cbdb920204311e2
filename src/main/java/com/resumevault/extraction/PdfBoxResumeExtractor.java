package com.resumevault.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented heuristics over the text layer of a PDF. Scanned resumes without a text layer
 * are reported as extraction failures.
 */
@Slf4j
@Component
public class PdfBoxResumeExtractor implements ResumeContentExtractor {

    private static final int NAME_SEARCH_LINES = 5;
    private static final int MAX_NAME_LENGTH = 60;

    private static final Pattern NAME_LINE =
        Pattern.compile("^\\p{L}[\\p{L}'.-]*(?:\\s+\\p{L}[\\p{L}'.-]*){1,3}$");

    private static final Pattern GRADUATION_YEAR = Pattern.compile(
        "(?i)(?:class of|graduat(?:ed|ion|ing)|expected|anticipated)[^\\n\\d]{0,40}((?:19|20)\\d{2})");

    private static final Pattern MAJOR = Pattern.compile(
        "(?i)(?:major(?:ing)?\\s*(?:in|:)\\s*"
            + "|(?:b\\.?\\s?s\\.?|b\\.?\\s?a\\.?|m\\.?\\s?s\\.?|bachelor(?:'s)?(?: of \\w+)?|master(?:'s)?(?: of \\w+)?)"
            + "\\s+(?:degree\\s+)?in\\s+)"
            + "([A-Za-z&][A-Za-z &]{1,80})");

    private static final Pattern COMPANY = Pattern.compile(
        "\\b((?:[A-Z][\\w&'-]*\\s+){1,4}"
            + "(?:Inc|LLC|LLP|Corp|Corporation|Ltd|Company|Technologies|Labs|Group|Systems)\\.?)(?=\\W|$)");

    private final List<KeywordMatcher> keywordMatchers;

    public PdfBoxResumeExtractor(ExtractorProperties properties) {
        this.keywordMatchers = properties.keywords().stream()
            .filter(k -> k != null && !k.isBlank())
            .map(KeywordMatcher::of)
            .toList();
    }

    @Override
    public ExtractedResume extract(byte[] content, String fallbackName) throws ContentExtractionException {
        String text = readText(content);
        if (text.isBlank()) {
            throw new ContentExtractionException("PDF has no extractable text");
        }

        List<String> lines = text.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .toList();

        ExtractedResume extracted = new ExtractedResume(
            findName(lines).orElse(fallbackName),
            findFirstGroup(MAJOR, text),
            findFirstGroup(GRADUATION_YEAR, text),
            findCompanies(lines),
            findKeywords(text)
        );
        log.debug("Extracted name='{}', major='{}', graduationYear='{}', {} companies, {} keywords",
            extracted.name(), extracted.major(), extracted.graduationYear(),
            extracted.companies().size(), extracted.keywords().size());
        return extracted;
    }

    private String readText(byte[] content) throws ContentExtractionException {
        try (PDDocument document = Loader.loadPDF(content)) {
            return new PDFTextStripper().getText(document);
        } catch (InvalidPasswordException e) {
            throw new ContentExtractionException("PDF is password-protected", e);
        } catch (IOException e) {
            throw new ContentExtractionException("Unable to read PDF: " + e.getMessage(), e);
        }
    }

    private Optional<String> findName(List<String> lines) {
        return lines.stream()
            .limit(NAME_SEARCH_LINES)
            .filter(line -> line.length() <= MAX_NAME_LENGTH)
            .filter(line -> NAME_LINE.matcher(line).matches())
            .findFirst();
    }

    private static String findFirstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).strip();
        return value.isEmpty() ? null : value;
    }

    private List<String> findCompanies(List<String> lines) {
        Set<String> companies = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher matcher = COMPANY.matcher(line);
            while (matcher.find()) {
                companies.add(matcher.group(1).strip());
            }
        }
        return new ArrayList<>(companies);
    }

    private List<String> findKeywords(String text) {
        return keywordMatchers.stream()
            .filter(matcher -> matcher.matches(text))
            .map(KeywordMatcher::keyword)
            .toList();
    }

    /**
     * Short vocabulary entries such as "Go" or "SQL" match case-sensitively to keep prose out.
     */
    private record KeywordMatcher(String keyword, Pattern pattern) {

        static KeywordMatcher of(String keyword) {
            String boundary = "(?<![\\w+#])" + Pattern.quote(keyword) + "(?![\\w+#])";
            int flags = keyword.length() < 4 ? 0 : Pattern.CASE_INSENSITIVE;
            return new KeywordMatcher(keyword, Pattern.compile(boundary, flags));
        }

        boolean matches(String text) {
            return pattern.matcher(text).find();
        }
    }
}
