package com.scholary.bulkupload.api;

import java.time.Instant;
import java.util.List;

/** Error body returned by every endpoint. */
public record ErrorResponse(
    int status, String error, String message, List<String> details, Instant timestamp) {}
