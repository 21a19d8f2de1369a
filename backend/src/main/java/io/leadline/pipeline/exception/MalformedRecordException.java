package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;

public class MalformedRecordException extends PipelineException {

  public MalformedRecordException(String detail) {
    super(HttpStatus.BAD_REQUEST, ErrorKind.MALFORMED_RECORD, "Malformed import record", detail);
  }
}
