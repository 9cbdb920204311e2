package com.resumevault.search;

import java.util.List;
import java.util.UUID;

/**
 * Tag ids already resolved for one search. Filter lists that are {@code null} mean "no filter";
 * the query lists widen the free-text predicate and may be empty.
 */
public record TagMatches(
    List<UUID> companyFilter,
    List<UUID> keywordFilter,
    List<UUID> queryCompanies,
    List<UUID> queryKeywords
) {

    public static TagMatches none() {
        return new TagMatches(null, null, List.of(), List.of());
    }
}
