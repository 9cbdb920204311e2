package com.resumevault.search;

import com.resumevault.model.TagKind;
import com.resumevault.repository.LikePatterns;
import com.resumevault.repository.ResumeQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns search parameters into one parameterized SQL statement over active resumes.
 * <p>
 * Present filters are AND'ed. Substring matches use escaped {@code ILIKE} patterns, so user input
 * is always matched literally. Company and keyword filters must already be resolved to tag ids.
 */
@Component
@RequiredArgsConstructor
public class ResumeSearchCompiler {

    private static final String BASE_SQL = "SELECT r.* FROM resumes r WHERE r.is_active = TRUE";
    private static final String ORDER_BY = " ORDER BY r.created_at DESC, r.id";

    private final SearchProperties properties;

    public ResumeQuery compile(SearchCriteria criteria, TagMatches tags) {
        StringBuilder sql = new StringBuilder(BASE_SQL);
        Map<String, Object> params = new HashMap<>();

        if (hasText(criteria.query())) {
            List<String> alternatives = new ArrayList<>(List.of(
                "r.name ILIKE :query",
                "r.major ILIKE :query",
                "r.graduation_year ILIKE :query"
            ));
            params.put("query", LikePatterns.containing(criteria.query().trim()));

            if (!tags.queryCompanies().isEmpty()) {
                alternatives.add(linkedTo(TagKind.COMPANY, "queryCompanyIds"));
                params.put("queryCompanyIds", tags.queryCompanies());
            }
            if (!tags.queryKeywords().isEmpty()) {
                alternatives.add(linkedTo(TagKind.KEYWORD, "queryKeywordIds"));
                params.put("queryKeywordIds", tags.queryKeywords());
            }
            sql.append(" AND (").append(String.join(" OR ", alternatives)).append(')');
        }

        if (hasText(criteria.name())) {
            sql.append(" AND r.name ILIKE :name");
            params.put("name", LikePatterns.containing(criteria.name().trim()));
        }

        List<String> majors = splitValues(criteria.major());
        if (majors.size() == 1) {
            sql.append(" AND r.major ILIKE :major");
            params.put("major", LikePatterns.containing(majors.get(0)));
        } else if (majors.size() > 1) {
            sql.append(" AND r.major ILIKE ANY(:majors)");
            params.put("majors", majors.stream().map(LikePatterns::containing).toArray(String[]::new));
        }

        List<String> years = splitValues(criteria.graduationYear());
        if (years.size() == 1) {
            sql.append(" AND r.graduation_year = :graduationYear");
            params.put("graduationYear", years.get(0));
        } else if (years.size() > 1) {
            sql.append(" AND r.graduation_year IN (:graduationYears)");
            params.put("graduationYears", years);
        }

        if (tags.companyFilter() != null) {
            sql.append(" AND ").append(linkedTo(TagKind.COMPANY, "companyIds"));
            params.put("companyIds", tags.companyFilter());
        }
        if (tags.keywordFilter() != null) {
            sql.append(" AND ").append(linkedTo(TagKind.KEYWORD, "keywordIds"));
            params.put("keywordIds", tags.keywordFilter());
        }

        sql.append(ORDER_BY);
        return new ResumeQuery(sql.toString(), params);
    }

    /**
     * Whether the free-text query should also be matched against company and keyword names.
     */
    public boolean widensQueryToTags(String query) {
        if (!hasText(query)) {
            return false;
        }
        if (properties.legacyTagWidening()) {
            return query.contains("company") || query.contains("keyword");
        }
        return true;
    }

    public static List<String> splitValues(String csv) {
        if (csv == null) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String linkedTo(TagKind kind, String param) {
        return "EXISTS (SELECT 1 FROM %s l WHERE l.resume_id = r.id AND l.%s IN (:%s))"
            .formatted(kind.linkTable(), kind.linkColumn(), param);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
