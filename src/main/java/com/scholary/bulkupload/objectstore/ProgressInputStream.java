package com.scholary.bulkupload.objectstore;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.function.IntConsumer;

/** Reports how much of a stream of known length has been read, in whole percent. */
class ProgressInputStream extends FilterInputStream {

  private final long length;
  private final IntConsumer progressSink;
  private long bytesRead;
  private int lastReported = -1;

  ProgressInputStream(InputStream in, long length, IntConsumer progressSink) {
    super(in);
    this.length = length;
    this.progressSink = progressSink;
  }

  @Override
  public int read() throws IOException {
    int b = super.read();
    if (b >= 0) {
      advance(1);
    }
    return b;
  }

  @Override
  public int read(byte[] buffer, int offset, int len) throws IOException {
    int n = super.read(buffer, offset, len);
    if (n > 0) {
      advance(n);
    }
    return n;
  }

  @Override
  public long skip(long n) throws IOException {
    long skipped = super.skip(n);
    if (skipped > 0) {
      advance(skipped);
    }
    return skipped;
  }

  // mark/reset would make the count lie
  @Override
  public boolean markSupported() {
    return false;
  }

  long bytesRead() {
    return bytesRead;
  }

  private void advance(long n) {
    bytesRead += n;
    if (length <= 0) {
      return;
    }
    int percent = (int) Math.min(100, bytesRead * 100 / length);
    if (percent != lastReported) {
      lastReported = percent;
      progressSink.accept(percent);
    }
  }
}
