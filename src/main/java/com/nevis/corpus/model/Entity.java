package com.nevis.corpus.model;

public record Entity(String key) {}
