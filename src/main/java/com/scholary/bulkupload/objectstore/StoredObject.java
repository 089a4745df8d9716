package com.scholary.bulkupload.objectstore;

import com.scholary.bulkupload.strategy.UploadStrategy;

/** Result of a completed upload: where the file landed and how it was sent. */
public record StoredObject(
    String bucket, String key, long size, UploadStrategy strategy, String eTag) {}
