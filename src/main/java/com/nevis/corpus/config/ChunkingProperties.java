package com.nevis.corpus.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
	@NotNull @Min(1) Integer sentencesPerChunk
) {}
