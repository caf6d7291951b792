package com.nevis.corpus.controller;

public record ErrorResponse(
    String message,
    String errorCode,
    int status,
    long timestamp
) {}
