package com.resumevault.search;

import com.resumevault.controller.ResumeSummary;
import com.resumevault.controller.SearchResponse;
import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.repository.ResumeQuery;
import com.resumevault.repository.ResumeRepository;
import com.resumevault.service.ResumeResponseMapper;
import com.resumevault.service.TagResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeSearchServiceImpl implements ResumeSearchService {

    private final ResumeSearchCompiler compiler;
    private final TagResolver tagResolver;
    private final ResumeRepository resumeRepository;
    private final ResumeResponseMapper mapper;

    @Override
    public SearchResponse search(SearchCriteria criteria) {
        List<UUID> companyFilter = null;
        List<String> companyNames = ResumeSearchCompiler.splitValues(criteria.company());
        if (!companyNames.isEmpty()) {
            companyFilter = ids(tagResolver.findMatching(TagKind.COMPANY, companyNames));
            if (companyFilter.isEmpty()) {
                log.debug("No companies match {}, skipping resume lookup", companyNames);
                return SearchResponse.of(List.of());
            }
        }

        List<UUID> keywordFilter = null;
        List<String> keywordNames = ResumeSearchCompiler.splitValues(criteria.keyword());
        if (!keywordNames.isEmpty()) {
            keywordFilter = ids(tagResolver.findMatching(TagKind.KEYWORD, keywordNames));
            if (keywordFilter.isEmpty()) {
                log.debug("No keywords match {}, skipping resume lookup", keywordNames);
                return SearchResponse.of(List.of());
            }
        }

        List<UUID> queryCompanies = List.of();
        List<UUID> queryKeywords = List.of();
        if (compiler.widensQueryToTags(criteria.query())) {
            List<String> fragment = List.of(criteria.query().trim());
            queryCompanies = ids(tagResolver.findMatching(TagKind.COMPANY, fragment));
            queryKeywords = ids(tagResolver.findMatching(TagKind.KEYWORD, fragment));
        }

        ResumeQuery query = compiler.compile(criteria,
            new TagMatches(companyFilter, keywordFilter, queryCompanies, queryKeywords));
        log.debug("Compiled resume search: {} with {}", query.sql(), query.params().keySet());

        List<ResumeSummary> results = resumeRepository.search(query).stream()
            .map(mapper::toSummary)
            .toList();
        return SearchResponse.of(results);
    }

    private static List<UUID> ids(List<Tag> tags) {
        return tags.stream().map(Tag::id).distinct().toList();
    }
}
