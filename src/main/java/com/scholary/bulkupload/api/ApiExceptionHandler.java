package com.scholary.bulkupload.api;

import com.scholary.bulkupload.queue.UploadQueueException;
import com.scholary.bulkupload.service.BatchNotFoundException;
import com.scholary.bulkupload.service.InvalidBatchException;
import com.scholary.bulkupload.service.ValidatedBatch;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions raised by the upload API to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final Clock clock;

  public ApiExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
    List<String> details =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
    return respond(HttpStatus.BAD_REQUEST, "Invalid request", details);
  }

  @ExceptionHandler(InvalidBatchException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBatch(InvalidBatchException e) {
    ValidatedBatch validation = e.getValidation();
    List<String> details = new ArrayList<>(validation.batchErrors());
    validation
        .rejections()
        .forEach(rejection -> details.add(rejection.filename() + ": " + rejection.error()));
    LOGGER.info("Batch rejected: {}", details);
    return respond(HttpStatus.BAD_REQUEST, e.getMessage(), details);
  }

  @ExceptionHandler({BatchNotFoundException.class, NoSuchElementException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
    return respond(HttpStatus.NOT_FOUND, e.getMessage(), List.of());
  }

  @ExceptionHandler({UploadQueueException.class, IllegalStateException.class})
  public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
    LOGGER.warn("Request conflicts with batch state: {}", e.getMessage());
    return respond(HttpStatus.CONFLICT, e.getMessage(), List.of());
  }

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String message, List<String> details) {
    return ResponseEntity.status(status)
        .body(
            new ErrorResponse(
                status.value(), status.getReasonPhrase(), message, details, clock.instant()));
  }
}
