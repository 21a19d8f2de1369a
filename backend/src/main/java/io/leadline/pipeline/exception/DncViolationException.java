package io.leadline.pipeline.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

/**
 * Raised for any attempted transition, merge, follow-up or contact reactivation on a Do-Not-Contact
 * prospect. Never retried and never swallowed.
 */
public class DncViolationException extends PipelineException {

  private final UUID prospectId;

  public DncViolationException(UUID prospectId, String attemptedAction) {
    super(
        HttpStatus.CONFLICT,
        ErrorKind.DNC_VIOLATION,
        "Do-Not-Contact violation",
        "Prospect "
            + prospectId
            + " is Do-Not-Contact; "
            + attemptedAction
            + " is permanently forbidden");
    this.prospectId = prospectId;
  }

  public UUID getProspectId() {
    return prospectId;
  }
}
