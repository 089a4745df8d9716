package com.scholary.bulkupload.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.bulkupload.file.InMemoryUploadFile;
import com.scholary.bulkupload.file.SizedUploadFile;
import com.scholary.bulkupload.file.UploadFile;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FileValidatorTest {

  private static final long MIB = 1024 * 1024;

  private FileValidator validator;

  @BeforeEach
  void setUp() {
    validator =
        new FileValidator(
            new ValidationProperties(100 * MIB, 50, List.of("image/*", "video/mp4")));
  }

  @Test
  void validateFile_shouldAcceptFileWithinLimits() {
    ValidationResult result =
        validator.validateFile(new SizedUploadFile("photo.jpg", MIB, "image/jpeg"));

    assertThat(result.valid()).isTrue();
    assertThat(result.error()).isNull();
  }

  @Test
  void validateFile_shouldRejectOversizedFile() {
    ValidationResult result =
        validator.validateFile(new SizedUploadFile("huge.jpg", 101 * MIB, "image/jpeg"));

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("File too large: 101.0 MB (max: 100.0 MB)");
  }

  @Test
  void validateFile_shouldMatchExactAndWildcardTypes() {
    assertThat(validator.validateFile(new SizedUploadFile("a.webp", 1, "image/webp")).valid())
        .isTrue();
    assertThat(validator.validateFile(new SizedUploadFile("a.mp4", 1, "video/mp4")).valid())
        .isTrue();

    ValidationResult rejected =
        validator.validateFile(new SizedUploadFile("a.mov", 1, "video/quicktime"));
    assertThat(rejected.valid()).isFalse();
    assertThat(rejected.error()).isEqualTo("Unsupported file type: video/quicktime");
  }

  @Test
  void validateFile_shouldReportSizeBeforeType() {
    ValidationResult result =
        validator.validateFile(new SizedUploadFile("a.exe", 200 * MIB, "application/x-msdownload"));

    assertThat(result.error()).startsWith("File too large");
  }

  @Test
  void validateFile_shouldRejectBadNames() {
    assertThat(validator.validateFile(new SizedUploadFile(" ", 1, "image/png")).error())
        .isEqualTo("File name must not be empty");
    assertThat(
            validator
                .validateFile(new SizedUploadFile("x".repeat(256) + ".png", 1, "image/png"))
                .error())
        .startsWith("File name too long");
    assertThat(validator.validateFile(new SizedUploadFile("a?b.png", 1, "image/png")).error())
        .isEqualTo("File name contains illegal character '?'");
  }

  @Test
  void validateFile_shouldAcceptNameOfExactlyMaxLength() {
    String name = "x".repeat(FileValidator.MAX_FILENAME_LENGTH - 4) + ".png";

    assertThat(validator.validateFile(new SizedUploadFile(name, 1, "image/png")).valid()).isTrue();
  }

  @Test
  void validateFiles_shouldRejectWholeBatchOverFileQuota() {
    List<UploadFile> files = new ArrayList<>();
    for (int i = 0; i < 51; i++) {
      files.add(new SizedUploadFile("photo-" + i + ".png", MIB, "image/png"));
    }

    BatchValidationResult result = validator.validateFiles(files, 0);

    assertThat(result.validFiles()).isEmpty();
    assertThat(result.rejections()).isEmpty();
    assertThat(result.totalSize()).isZero();
    assertThat(result.batchErrors()).singleElement().asString().contains("50");
    assertThat(result.isValid()).isFalse();
  }

  @Test
  void validateFiles_shouldCountAlreadyQueuedFilesAgainstQuota() {
    List<UploadFile> files =
        List.of(
            new SizedUploadFile("a.png", 1, "image/png"),
            new SizedUploadFile("b.png", 1, "image/png"));

    BatchValidationResult result = validator.validateFiles(files, 49);

    assertThat(result.validFiles()).isEmpty();
    assertThat(result.batchErrors())
        .containsExactly("Too many files: 2 selected, at most 1 more can be added");
  }

  @Test
  void validateFiles_shouldReportDuplicatesButKeepValidatingEachFile() {
    List<UploadFile> files =
        List.of(
            new SizedUploadFile("same.png", MIB, "image/png"),
            new SizedUploadFile("same.png", 2 * MIB, "image/png"),
            new SizedUploadFile("doc.txt", MIB, "text/plain"));

    BatchValidationResult result = validator.validateFiles(files, 0);

    assertThat(result.batchErrors()).containsExactly("Duplicate file names: same.png");
    assertThat(result.validFiles()).hasSize(2);
    assertThat(result.rejections())
        .containsExactly(new FileRejection("doc.txt", "Unsupported file type: text/plain"));
    assertThat(result.totalSize()).isEqualTo(3 * MIB);
  }

  @Test
  void validateFiles_shouldEmptyValidSetWhenTotalSizeExceedsCeiling() {
    FileValidator generous =
        new FileValidator(
            new ValidationProperties(4L * 1024 * MIB, 50, List.of("video/*")));
    List<UploadFile> files =
        List.of(
            new SizedUploadFile("one.mp4", 3L * 1024 * MIB, "video/mp4"),
            new SizedUploadFile("two.mp4", 3L * 1024 * MIB, "video/mp4"));

    BatchValidationResult result = generous.validateFiles(files, 0);

    assertThat(result.validFiles()).isEmpty();
    assertThat(result.batchErrors()).singleElement().asString().contains("exceeds the batch limit");
    assertThat(result.totalSize()).isEqualTo(6L * 1024 * MIB);
  }

  @Test
  void validateFileContent_shouldAcceptMatchingSignatures() {
    byte[] png = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0};
    byte[] webp = {0x52, 0x49, 0x46, 0x46, 1, 2, 3, 4, 0x57, 0x45, 0x42, 0x50};
    byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0};

    assertThat(check(new InMemoryUploadFile("a.png", "image/png", png)).valid()).isTrue();
    assertThat(check(new InMemoryUploadFile("a.webp", "image/webp", webp)).valid()).isTrue();
    assertThat(
            check(new InMemoryUploadFile("a.jpg", "image/jpeg", jpeg)).valid())
        .isTrue();
  }

  @Test
  void validateFileContent_shouldFlagMismatchedSignature() {
    ValidationResult result =
        check(new InMemoryUploadFile("fake.png", "image/png", "not an image".getBytes()));

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).startsWith("File appears to be corrupted");
  }

  @Test
  void validateFileContent_shouldFlagEmptyFiles() {
    ValidationResult result = check(new InMemoryUploadFile("empty.mp4", "video/mp4", new byte[0]));

    assertThat(result.error()).isEqualTo("File is empty: empty.mp4");
  }

  @Test
  void validateFileContent_shouldPassUnknownImageTypesAndNonImages() {
    assertThat(check(new InMemoryUploadFile("a.bmp", "image/bmp", new byte[] {1, 2})).valid())
        .isTrue();
    assertThat(check(new InMemoryUploadFile("a.mp4", "video/mp4", new byte[] {1, 2})).valid())
        .isTrue();
  }

  @Test
  void validateFileContent_shouldReportUnreadableFiles() {
    UploadFile unreadable =
        new UploadFile() {
          @Override
          public String name() {
            return "broken.png";
          }

          @Override
          public long size() {
            return 10;
          }

          @Override
          public String contentType() {
            return "image/png";
          }

          @Override
          public InputStream openStream() throws IOException {
            throw new IOException("disk gone");
          }
        };

    ValidationResult result = check(unreadable);

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).contains("could not be read").contains("disk gone");
  }

  private ValidationResult check(UploadFile file) {
    return validator.validateFileContent(file, Runnable::run).join();
  }
}
