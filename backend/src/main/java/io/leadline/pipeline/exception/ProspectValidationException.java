package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;

/** A candidate prospect state breaks a structural invariant; nothing was written. */
public class ProspectValidationException extends PipelineException {

  public ProspectValidationException(String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.VALIDATION_ERROR, title, detail);
  }
}
