package com.resumevault.repository;

import java.util.Map;

/**
 * A compiled, parameterized resume lookup. {@code sql} selects whole {@code resumes} rows aliased {@code r}.
 */
public record ResumeQuery(String sql, Map<String, Object> params) {

    public ResumeQuery {
        params = Map.copyOf(params);
    }
}
