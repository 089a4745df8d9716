package com.scholary.bulkupload.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Request to validate or upload files readable by the server. */
public record BatchUploadRequest(
    @Schema(description = "Server-local paths of the files", example = "[\"/data/photo.jpg\"]")
        @NotEmpty
        List<@NotBlank String> filePaths) {}
