package io.leadline.pipeline.cadence;

import io.leadline.pipeline.activity.ActivityOutcome;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.prospect.ProspectController.ProspectResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CadenceController {

  private final CadenceEngine cadenceEngine;
  private final Clock clock;

  public CadenceController(CadenceEngine cadenceEngine, Clock clock) {
    this.cadenceEngine = cadenceEngine;
    this.clock = clock;
  }

  @PutMapping("/api/prospects/{id}/follow-up")
  public ResponseEntity<ProspectResponse> setFollowUp(
      @PathVariable UUID id, @Valid @RequestBody FollowUpRequest request) {
    var prospect =
        cadenceEngine.setFollowUp(id, request.followUpDate(), request.reason(), request.actor());
    return ResponseEntity.ok(ProspectResponse.from(prospect));
  }

  @PostMapping("/api/prospects/{id}/attempts")
  public ResponseEntity<ProspectResponse> recordAttempt(
      @PathVariable UUID id, @Valid @RequestBody AttemptRequest request) {
    var prospect =
        cadenceEngine.recordAttempt(
            id, request.activityType(), request.outcome(), request.notes(), request.actor());
    return ResponseEntity.ok(ProspectResponse.from(prospect));
  }

  @GetMapping("/api/cadence/overdue")
  public ResponseEntity<List<ProspectResponse>> getOverdue(
      @RequestParam(required = false) Instant asOf) {
    var overdue = asOf != null ? cadenceEngine.getOverdue(asOf) : cadenceEngine.getOverdue();
    return ResponseEntity.ok(overdue.stream().map(ProspectResponse::from).toList());
  }

  @GetMapping("/api/cadence/today")
  public ResponseEntity<List<ProspectResponse>> getTodaysFollowUps(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date) {
    var day = date != null ? date : LocalDate.now(clock);
    return ResponseEntity.ok(
        cadenceEngine.getTodaysFollowUps(day).stream().map(ProspectResponse::from).toList());
  }

  @GetMapping("/api/cadence/orphaned-engaged")
  public ResponseEntity<List<ProspectResponse>> getOrphanedEngaged() {
    return ResponseEntity.ok(
        cadenceEngine.getOrphanedEngaged().stream().map(ProspectResponse::from).toList());
  }

  @GetMapping("/api/cadence/next-contact")
  public ResponseEntity<NextContactResponse> getNextContact(
      @RequestParam @Min(0) int attemptCount,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate lastAttemptDate) {
    var next = cadenceEngine.calculateNextContact(attemptCount, lastAttemptDate);
    return ResponseEntity.ok(
        new NextContactResponse(
            attemptCount, lastAttemptDate, next, cadenceEngine.channelFor(attemptCount + 1)));
  }

  // --- DTOs ---

  public record FollowUpRequest(
      @NotNull(message = "followUpDate is required") Instant followUpDate,
      @Size(max = 2000, message = "reason must be at most 2000 characters") String reason,
      @Size(max = 50, message = "actor must be at most 50 characters") String actor) {}

  public record AttemptRequest(
      @NotNull(message = "activityType is required") ActivityType activityType,
      ActivityOutcome outcome,
      @Size(max = 2000, message = "notes must be at most 2000 characters") String notes,
      @Size(max = 50, message = "actor must be at most 50 characters") String actor) {}

  public record NextContactResponse(
      int attemptCount,
      LocalDate lastAttemptDate,
      LocalDate nextContactDate,
      ContactChannel nextChannel) {}
}
