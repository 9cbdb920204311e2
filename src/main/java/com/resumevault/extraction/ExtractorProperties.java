package com.resumevault.extraction;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * @param keywords skill vocabulary matched against resume text, reported in the casing given here
 */
@ConfigurationProperties(prefix = "app.extractor")
public record ExtractorProperties(List<String> keywords) {

    public ExtractorProperties {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
