package com.resumevault.search;

/**
 * Raw search parameters as received. {@code major}, {@code graduationYear}, {@code company} and
 * {@code keyword} may be comma-separated lists.
 */
public record SearchCriteria(
    String query,
    String name,
    String major,
    String graduationYear,
    String company,
    String keyword
) {

    public static SearchCriteria empty() {
        return new SearchCriteria(null, null, null, null, null, null);
    }
}
