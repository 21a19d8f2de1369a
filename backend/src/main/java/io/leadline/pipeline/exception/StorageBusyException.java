package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;

/** The prospect row could not be locked within the configured timeout. Safe to retry. */
public class StorageBusyException extends PipelineException {

  public StorageBusyException(String resourceType, Object id, Throwable cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        ErrorKind.STORAGE_BUSY,
        "Storage busy",
        resourceType + " " + id + " is locked by another writer; retry with backoff",
        cause);
  }
}
