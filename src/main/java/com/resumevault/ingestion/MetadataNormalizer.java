package com.resumevault.ingestion;

import com.resumevault.extraction.ExtractedResume;
import com.resumevault.model.ResumeDraft;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Resolves final field values with precedence caller value, then extracted value, then fallback,
 * and clamps them to what the metadata store accepts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetadataNormalizer {

    private static final String ELLIPSIS = "...";

    private final UploadProperties properties;

    public ResumeDraft normalize(IngestionRequest request, ExtractedResume extracted, String fallbackName) {
        String filename = request.file() == null ? "Unnamed file" : request.file().displayName();

        String name = firstNonBlank(request.name(), extracted.name(), fallbackName);
        if (name == null) {
            name = "Unknown_Resume_" + System.currentTimeMillis();
            log.warn("[{}] Name was empty, defaulted to: {}", filename, name);
        }
        if (name.length() > properties.maxFieldLength()) {
            log.warn("[{}] Name too long ({} chars), truncating.", filename, name.length());
            name = truncate(name);
        }

        String major = firstNonBlank(request.major(), extracted.major());
        if (major == null) {
            log.warn("[{}] Major was empty, defaulting to '{}'. Parsed value was: \"{}\"",
                filename, ExtractedResume.UNSPECIFIED, extracted.major());
            major = ExtractedResume.UNSPECIFIED;
        }
        if (major.length() > properties.maxFieldLength()) {
            log.warn("[{}] Major too long ({} chars), truncating.", filename, major.length());
            major = truncate(major);
        }

        String graduationYear = firstNonBlank(request.graduationYear(), extracted.graduationYear());
        if (graduationYear == null) {
            log.warn("[{}] Graduation year was empty, defaulting to '{}'. Parsed value was: \"{}\"",
                filename, ExtractedResume.UNSPECIFIED, extracted.graduationYear());
            graduationYear = ExtractedResume.UNSPECIFIED;
        }
        if (graduationYear.length() > properties.maxFieldLength()) {
            log.warn("[{}] Graduation year too long ({} chars), defaulting to '{}'.",
                filename, graduationYear.length(), ExtractedResume.UNSPECIFIED);
            graduationYear = ExtractedResume.UNSPECIFIED;
        }

        List<String> companies = tagList(request.companies(), extracted.companies(), "company", filename);
        List<String> keywords = tagList(request.keywords(), extracted.keywords(), "keyword", filename);

        log.info("[{}] Data processed. Name: \"{}\", Major: \"{}\", GradYear: \"{}\", "
                + "Unique Companies: {}, Unique Keywords: {}",
            filename, name, major, graduationYear, companies.size(), keywords.size());

        return new ResumeDraft(name, major, graduationYear, companies, keywords);
    }

    /**
     * A supplied CSV replaces the extracted list entirely. The list is capped first, then deduplicated
     * by exact match keeping first occurrences.
     */
    private List<String> tagList(String csv, List<String> extracted, String kind, String filename) {
        List<String> names = csv != null && !csv.isBlank() ? splitCsv(csv) : clean(extracted);

        if (names.size() > properties.maxTags()) {
            log.warn("[{}] Truncating {} list from {} to {} items", filename, kind, names.size(), properties.maxTags());
            names = names.subList(0, properties.maxTags());
        }
        return new ArrayList<>(new LinkedHashSet<>(names));
    }

    public static List<String> splitCsv(String csv) {
        if (csv == null) {
            return List.of();
        }
        return clean(Arrays.asList(csv.split(",")));
    }

    private static List<String> clean(List<String> names) {
        if (names == null) {
            return List.of();
        }
        return names.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private String truncate(String value) {
        return value.substring(0, properties.maxFieldLength() - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }
}
