package com.scholary.bulkupload.validation;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for file validation.
 *
 * <p>These map to the "upload.validation.*" keys in application.yml. Allowed types are either exact
 * MIME types ({@code image/png}) or wildcard prefixes ({@code image/*}).
 */
@ConfigurationProperties(prefix = "upload.validation")
@Validated
public record ValidationProperties(
    @Positive long maxFileSize, @Positive int maxFiles, @NotEmpty List<String> allowedTypes) {}
