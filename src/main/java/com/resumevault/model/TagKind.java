package com.resumevault.model;

public enum TagKind {
    COMPANY("companies", "resume_companies", "company_id"),
    KEYWORD("keywords", "resume_keywords", "keyword_id");

    private final String table;
    private final String linkTable;
    private final String linkColumn;

    TagKind(String table, String linkTable, String linkColumn) {
        this.table = table;
        this.linkTable = linkTable;
        this.linkColumn = linkColumn;
    }

    public String table() {
        return table;
    }

    public String linkTable() {
        return linkTable;
    }

    public String linkColumn() {
        return linkColumn;
    }
}
