package com.scholary.bulkupload.objectstore;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressInputStreamTest {

  @Test
  void read_shouldReportEachWholePercentOnce() throws IOException {
    List<Integer> reported = new ArrayList<>();
    try (ProgressInputStream in =
        new ProgressInputStream(new ByteArrayInputStream(new byte[200]), 200, reported::add)) {
      byte[] buffer = new byte[50];
      while (in.read(buffer) > 0) {
        in.read();
      }
      assertThat(in.bytesRead()).isEqualTo(200);
    }

    assertThat(reported).doesNotHaveDuplicates().isSorted().endsWith(100);
  }

  @Test
  void read_shouldNotReportForUnknownLength() throws IOException {
    List<Integer> reported = new ArrayList<>();
    try (ProgressInputStream in =
        new ProgressInputStream(new ByteArrayInputStream(new byte[10]), 0, reported::add)) {
      in.readAllBytes();
    }

    assertThat(reported).isEmpty();
  }

  @Test
  void markSupported_shouldBeFalse() {
    ProgressInputStream in =
        new ProgressInputStream(new ByteArrayInputStream(new byte[1]), 1, percent -> {});

    assertThat(in.markSupported()).isFalse();
  }
}
