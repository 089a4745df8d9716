package com.scholary.bulkupload.strategy;

import com.scholary.bulkupload.file.UploadFile;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Picks an upload strategy from a file's size and type.
 *
 * <p>The order of the checks matters: a large video is classified as streaming before the generic
 * chunked threshold is considered.
 */
@Component
public class StrategySelector {

  private final StrategyProperties properties;

  public StrategySelector(StrategyProperties properties) {
    this.properties = properties;
  }

  public UploadStrategy selectStrategy(UploadFile file) {
    if (!properties.autoSelect()) {
      return UploadStrategy.DIRECT;
    }

    long size = file.size();
    if (size < properties.directThreshold()) {
      return UploadStrategy.DIRECT;
    }
    if (isVideo(file.contentType()) && size > properties.streamingThreshold()) {
      return UploadStrategy.STREAMING;
    }
    if (size > properties.chunkedThreshold()) {
      return UploadStrategy.CHUNKED;
    }
    return UploadStrategy.HYBRID;
  }

  private static boolean isVideo(String contentType) {
    return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("video/");
  }
}
