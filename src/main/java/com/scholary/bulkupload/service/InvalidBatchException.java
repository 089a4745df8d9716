package com.scholary.bulkupload.service;

/** Thrown when a batch cannot be created because no file passed validation. */
public class InvalidBatchException extends RuntimeException {

  private final transient ValidatedBatch validation;

  public InvalidBatchException(String message, ValidatedBatch validation) {
    super(message);
    this.validation = validation;
  }

  public ValidatedBatch getValidation() {
    return validation;
  }
}
