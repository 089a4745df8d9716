package com.scholary.bulkupload.service;

/** Thrown when a batch id is unknown, or its batch has expired. */
public class BatchNotFoundException extends RuntimeException {

  public BatchNotFoundException(String batchId) {
    super("Batch not found: " + batchId);
  }
}
