package com.scholary.bulkupload.validation;

/** A file that failed validation, with the reason. */
public record FileRejection(String filename, String error) {}
