package com.resumevault.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    boolean error,
    String message,
    String errorCode,
    String details,
    int status,
    long timestamp
) {}
