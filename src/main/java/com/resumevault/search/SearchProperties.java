package com.resumevault.search;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param legacyTagWidening when set, free-text queries only look at company and keyword names if
 *                          the query literally contains "company" or "keyword"
 */
@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
	@NotNull Boolean legacyTagWidening
) {}
