package com.resumevault.storage;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.blob")
public record BlobStoreProperties(
    @NotNull String store,
    @NotNull @Min(1024) @Max(16 * 1024 * 1024) Integer chunkSize,
    Filesystem filesystem
) {

    public record Filesystem(String directory) {}
}
