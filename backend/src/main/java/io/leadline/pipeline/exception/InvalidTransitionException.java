package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends PipelineException {

  public InvalidTransitionException(String title, String detail) {
    super(HttpStatus.CONFLICT, ErrorKind.INVALID_TRANSITION, title, detail);
  }
}
