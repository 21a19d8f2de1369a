package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for every documented pipeline failure. Carries an {@link ErrorKind} so batch callers
 * can classify failures without inspecting messages, and an RFC 7807 problem body for HTTP callers.
 */
public abstract class PipelineException extends ErrorResponseException {

  private final ErrorKind kind;

  protected PipelineException(HttpStatus status, ErrorKind kind, String title, String detail) {
    this(status, kind, title, detail, null);
  }

  protected PipelineException(
      HttpStatus status, ErrorKind kind, String title, String detail, Throwable cause) {
    super(status, createProblem(status, kind, title, detail), cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** The specific, human-readable reason for the failure. */
  public String getDetail() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(
      HttpStatus status, ErrorKind kind, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("errorKind", kind.name());
    return problem;
  }
}
