package com.resumevault.ingestion;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.upload")
public record UploadProperties(
    @NotNull @Min(1) Long maxBytes,
    @NotNull @Min(0) Integer maxTags,
    @NotNull @Min(4) Integer maxFieldLength
) {

    public String tooLargeMessage() {
        return String.format("File too large. Maximum file size is %dMB.", maxBytes / (1024 * 1024));
    }
}
