package com.scholary.bulkupload.validation;

import com.scholary.bulkupload.file.UploadFile;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stateless checks on individual files and on whole batches.
 *
 * <p>Per-file checks are short-circuited in a fixed order: size, type, empty name, name length,
 * name characters. The first failing check produces the reported reason.
 *
 * <p>Batch checks add three rules on top:
 *
 * <ul>
 *   <li>file count quota, which rejects the whole batch up front
 *   <li>duplicate names, reported but not discarded
 *   <li>an aggregate size ceiling, which empties the valid set
 * </ul>
 */
@Component
public class FileValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileValidator.class);

  /** Aggregate size ceiling for a single batch, independent of per-file limits. */
  public static final long MAX_TOTAL_SIZE = 5L * 1024 * 1024 * 1024;

  public static final int MAX_FILENAME_LENGTH = 255;

  private static final String ILLEGAL_FILENAME_CHARS = "<>:\"/\\|?*";

  private static final int HEADER_LENGTH = 12;

  private static final byte[] JPEG_SIGNATURE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] PNG_SIGNATURE = {
    (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
  };
  private static final byte[] GIF_SIGNATURE = {0x47, 0x49, 0x46, 0x38};
  private static final byte[] RIFF_SIGNATURE = {0x52, 0x49, 0x46, 0x46};
  private static final byte[] WEBP_SIGNATURE = {0x57, 0x45, 0x42, 0x50};

  private final ValidationProperties properties;

  public FileValidator(ValidationProperties properties) {
    this.properties = properties;
  }

  /**
   * Validate a single file against size, type and name rules.
   *
   * @param file the file to check
   * @return the first failing check, or a valid result
   */
  public ValidationResult validateFile(UploadFile file) {
    if (file.size() > properties.maxFileSize()) {
      return ValidationResult.invalid(
          String.format(
              "File too large: %s (max: %s)",
              formatSize(file.size()), formatSize(properties.maxFileSize())));
    }

    if (!isAllowedType(file.contentType())) {
      return ValidationResult.invalid(
          String.format("Unsupported file type: %s", file.contentType()));
    }

    String name = file.name();
    if (name == null || name.isBlank()) {
      return ValidationResult.invalid("File name must not be empty");
    }

    if (name.length() > MAX_FILENAME_LENGTH) {
      return ValidationResult.invalid(
          String.format("File name too long: %d characters (max: %d)", name.length(), MAX_FILENAME_LENGTH));
    }

    for (char c : name.toCharArray()) {
      if (ILLEGAL_FILENAME_CHARS.indexOf(c) >= 0) {
        return ValidationResult.invalid(
            String.format("File name contains illegal character '%c'", c));
      }
    }

    return ValidationResult.ok();
  }

  /**
   * Validate a batch of files that is about to join {@code existingCount} already queued files.
   *
   * @param files the candidate files
   * @param existingCount number of files already accepted elsewhere
   * @return the partitioned result
   */
  public BatchValidationResult validateFiles(List<? extends UploadFile> files, int existingCount) {
    int remaining = Math.max(0, properties.maxFiles() - existingCount);
    if (existingCount + files.size() > properties.maxFiles()) {
      LOGGER.info(
          "Rejecting batch of {} files: {} already present, limit {}",
          files.size(),
          existingCount,
          properties.maxFiles());
      return new BatchValidationResult(
          List.of(),
          List.of(),
          List.of(
              String.format(
                  "Too many files: %d selected, at most %d more can be added",
                  files.size(), remaining)),
          0);
    }

    List<String> batchErrors = new ArrayList<>();
    List<String> duplicates = findDuplicateNames(files);
    if (!duplicates.isEmpty()) {
      batchErrors.add("Duplicate file names: " + String.join(", ", duplicates));
    }

    List<UploadFile> validFiles = new ArrayList<>();
    List<FileRejection> rejections = new ArrayList<>();
    long totalSize = 0;

    for (UploadFile file : files) {
      ValidationResult result = validateFile(file);
      if (result.valid()) {
        validFiles.add(file);
        totalSize += file.size();
      } else {
        LOGGER.debug("File rejected: name={}, reason={}", file.name(), result.error());
        rejections.add(new FileRejection(file.name(), result.error()));
      }
    }

    if (totalSize > MAX_TOTAL_SIZE) {
      batchErrors.add(
          String.format(
              "Total size %s exceeds the batch limit of %s",
              formatSize(totalSize), formatSize(MAX_TOTAL_SIZE)));
      return new BatchValidationResult(List.of(), rejections, batchErrors, totalSize);
    }

    LOGGER.debug(
        "Validated batch: {} valid, {} rejected, totalSize={} bytes",
        validFiles.size(),
        rejections.size(),
        totalSize);

    return new BatchValidationResult(validFiles, rejections, batchErrors, totalSize);
  }

  /**
   * Inspect the file's leading bytes to detect empty or corrupted content.
   *
   * <p>Only JPEG, PNG, GIF and WebP have known signatures; other types pass once they are
   * non-empty.
   *
   * @param file the file to inspect
   * @param executor executor that performs the blocking read
   * @return a future completing with the content verdict
   */
  public CompletableFuture<ValidationResult> validateFileContent(
      UploadFile file, Executor executor) {
    return CompletableFuture.supplyAsync(() -> checkContent(file), executor);
  }

  private ValidationResult checkContent(UploadFile file) {
    if (file.size() == 0) {
      return ValidationResult.invalid("File is empty: " + file.name());
    }

    String contentType = normalize(file.contentType());
    if (!contentType.startsWith("image/")) {
      return ValidationResult.ok();
    }

    byte[] header;
    try (InputStream in = file.openStream()) {
      header = in.readNBytes(HEADER_LENGTH);
    } catch (IOException e) {
      LOGGER.warn("Could not read header of {}: {}", file.name(), e.getMessage());
      return ValidationResult.invalid(
          String.format("File could not be read: %s (%s)", file.name(), e.getMessage()));
    }

    boolean matches =
        switch (contentType) {
          case "image/jpeg", "image/jpg" -> startsWith(header, 0, JPEG_SIGNATURE);
          case "image/png" -> startsWith(header, 0, PNG_SIGNATURE);
          case "image/gif" -> startsWith(header, 0, GIF_SIGNATURE);
          case "image/webp" ->
              startsWith(header, 0, RIFF_SIGNATURE) && startsWith(header, 8, WEBP_SIGNATURE);
          default -> true;
        };

    if (!matches) {
      return ValidationResult.invalid(
          String.format(
              "File appears to be corrupted: %s does not look like %s",
              file.name(), contentType));
    }
    return ValidationResult.ok();
  }

  private boolean isAllowedType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return false;
    }
    String normalized = normalize(contentType);
    for (String allowed : properties.allowedTypes()) {
      String pattern = normalize(allowed);
      if (pattern.endsWith("/*")) {
        if (normalized.startsWith(pattern.substring(0, pattern.length() - 1))) {
          return true;
        }
      } else if (pattern.equals(normalized)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> findDuplicateNames(List<? extends UploadFile> files) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (UploadFile file : files) {
      counts.merge(String.valueOf(file.name()), 1, Integer::sum);
    }
    List<String> duplicates = new ArrayList<>();
    counts.forEach(
        (name, count) -> {
          if (count > 1) {
            duplicates.add(name);
          }
        });
    return duplicates;
  }

  private static boolean startsWith(byte[] data, int offset, byte[] signature) {
    if (data.length < offset + signature.length) {
      return false;
    }
    return Arrays.equals(
        data, offset, offset + signature.length, signature, 0, signature.length);
  }

  private static String normalize(String contentType) {
    return contentType == null ? "" : contentType.trim().toLowerCase(Locale.ROOT);
  }

  static String formatSize(long bytes) {
    if (bytes >= 1024L * 1024 * 1024) {
      return String.format(Locale.ROOT, "%.1f GB", bytes / 1024.0 / 1024 / 1024);
    }
    if (bytes >= 1024L * 1024) {
      return String.format(Locale.ROOT, "%.1f MB", bytes / 1024.0 / 1024);
    }
    return bytes + " bytes";
  }
}
