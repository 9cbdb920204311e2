package com.resumevault.controller;

public record DeleteAllResult(int deletedCount) {}
