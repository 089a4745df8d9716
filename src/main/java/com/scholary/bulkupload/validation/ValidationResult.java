package com.scholary.bulkupload.validation;

/** Outcome of validating a single file. {@code error} is null when the file is valid. */
public record ValidationResult(boolean valid, String error) {

  private static final ValidationResult VALID = new ValidationResult(true, null);

  public static ValidationResult ok() {
    return VALID;
  }

  public static ValidationResult invalid(String error) {
    return new ValidationResult(false, error);
  }
}
