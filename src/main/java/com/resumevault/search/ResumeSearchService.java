package com.resumevault.search;

import com.resumevault.controller.SearchResponse;

public interface ResumeSearchService {
    SearchResponse search(SearchCriteria criteria);
}
