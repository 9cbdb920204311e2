package com.resumevault.controller;

import java.util.List;

public record SearchResponse(
    boolean error,
    int count,
    List<ResumeSummary> data
) {

    public static SearchResponse of(List<ResumeSummary> results) {
        return new SearchResponse(false, results.size(), results);
    }
}
