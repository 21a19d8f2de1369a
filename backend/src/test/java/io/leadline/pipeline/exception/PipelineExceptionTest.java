package io.leadline.pipeline.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;

class PipelineExceptionTest {

  @Test
  void problemBodyCarriesErrorKind() {
    var prospectId = UUID.randomUUID();

    var ex = new DncViolationException(prospectId, "transition to UNENGAGED");

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(ex.getKind()).isEqualTo(ErrorKind.DNC_VIOLATION);
    assertThat(ex.getBody().getProperties()).containsEntry("errorKind", "DNC_VIOLATION");
    assertThat(ex.getDetail())
        .contains(prospectId.toString())
        .contains("transition to UNENGAGED");
    assertThat(ex.getProspectId()).isEqualTo(prospectId);
  }

  @Test
  void notFoundNamesResourceAndId() {
    var id = UUID.randomUUID();

    var ex = new ResourceNotFoundException("Prospect", id);

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(ex.getBody().getTitle()).isEqualTo("Prospect not found");
    assertThat(ex.getDetail()).isEqualTo("No prospect found with id " + id);
  }

  @Test
  void storageBusyKeepsCause() {
    var cause = new PessimisticLockingFailureException("lock timeout");

    var ex = new StorageBusyException("Prospect", "42", cause);

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(ex.getKind()).isEqualTo(ErrorKind.STORAGE_BUSY);
    assertThat(ex.getCause()).isSameAs(cause);
  }

  @Test
  void handlerRendersProblemDetailWithStatus() {
    var handler = new GlobalExceptionHandler();
    var request = new MockHttpServletRequest("POST", "/api/prospects/1/transition");

    var response =
        handler.handlePipelineException(
            new ProspectValidationException("Follow-up date required", "Missing follow-up"),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getDetail()).isEqualTo("Missing follow-up");
    assertThat(response.getBody().getProperties())
        .containsEntry("errorKind", ErrorKind.VALIDATION_ERROR.name());
  }

  @Test
  void lockTimeoutMapsToStorageBusy() {
    var response =
        new GlobalExceptionHandler()
            .handleLockTimeout(new PessimisticLockingFailureException("timeout"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getProperties())
        .containsEntry("errorKind", ErrorKind.STORAGE_BUSY.name());
  }
}
