package io.leadline.pipeline.population;

import io.leadline.pipeline.batch.BatchFailure;
import io.leadline.pipeline.batch.BatchResult;
import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.LostReason;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectController.ProspectResponse;
import io.leadline.pipeline.prospect.ProspectService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/prospects")
public class PopulationController {

  private final PopulationStateMachine stateMachine;
  private final EngagementStageMachine stageMachine;
  private final BulkTransitionService bulkTransitionService;
  private final ProspectService prospectService;
  private final Clock clock;

  public PopulationController(
      PopulationStateMachine stateMachine,
      EngagementStageMachine stageMachine,
      BulkTransitionService bulkTransitionService,
      ProspectService prospectService,
      Clock clock) {
    this.stateMachine = stateMachine;
    this.stageMachine = stageMachine;
    this.bulkTransitionService = bulkTransitionService;
    this.prospectService = prospectService;
    this.clock = clock;
  }

  @PostMapping("/{id}/transition")
  public ResponseEntity<ProspectResponse> transition(
      @PathVariable UUID id, @Valid @RequestBody TransitionRequest request) {
    var prospect = stateMachine.transition(id, request.toCommand());
    return ResponseEntity.ok(ProspectResponse.from(prospect));
  }

  @GetMapping("/{id}/transitions")
  public ResponseEntity<AvailableTransitionsResponse> getAvailableTransitions(
      @PathVariable UUID id) {
    var prospect = prospectService.getProspect(id);
    return ResponseEntity.ok(
        new AvailableTransitionsResponse(
            id,
            prospect.getPopulation(),
            stateMachine.availableTransitions(prospect.getPopulation())));
  }

  @PostMapping("/{id}/stage")
  public ResponseEntity<ProspectResponse> transitionStage(
      @PathVariable UUID id, @Valid @RequestBody StageRequest request) {
    var prospect =
        stageMachine.transitionStage(id, request.target(), request.reason(), request.actor());
    return ResponseEntity.ok(ProspectResponse.from(prospect));
  }

  @PostMapping("/bulk-transition")
  public ResponseEntity<BulkTransitionResponse> bulkTransition(
      @Valid @RequestBody BulkTransitionRequest request) {
    var result =
        bulkTransitionService.transitionAll(
            request.prospectIds(), request.transition().toCommand());
    return ResponseEntity.ok(BulkTransitionResponse.from(result));
  }

  @PostMapping("/parked/reactivate")
  public ResponseEntity<BulkTransitionResponse> reactivateParked(
      @RequestParam(required = false) YearMonth month) {
    var asOf = month != null ? month : YearMonth.now(clock);
    return ResponseEntity.ok(
        BulkTransitionResponse.from(bulkTransitionService.reactivateDueParked(asOf)));
  }

  // --- DTOs ---

  public record TransitionRequest(
      @NotNull(message = "target is required") Population target,
      @Size(max = 2000, message = "reason must be at most 2000 characters") String reason,
      Instant followUpDate,
      YearMonth parkedMonth,
      EngagementStage stage,
      LostReason lostReason,
      @Size(max = 50, message = "actor must be at most 50 characters") String actor) {

    public TransitionCommand toCommand() {
      return new TransitionCommand(
          target, reason, followUpDate, parkedMonth, stage, lostReason, actor);
    }
  }

  public record StageRequest(
      @NotNull(message = "target is required") EngagementStage target,
      @Size(max = 2000, message = "reason must be at most 2000 characters") String reason,
      @Size(max = 50, message = "actor must be at most 50 characters") String actor) {}

  public record BulkTransitionRequest(
      @NotEmpty(message = "prospectIds must not be empty")
          @Size(max = 1000, message = "at most 1000 prospects per request")
          List<UUID> prospectIds,
      @NotNull(message = "transition is required") @Valid TransitionRequest transition) {}

  public record AvailableTransitionsResponse(
      UUID prospectId, Population current, List<Population> available) {}

  public record BulkTransitionResponse(
      List<ProspectResponse> succeeded, List<BatchFailure<UUID>> failed) {

    public static BulkTransitionResponse from(BatchResult<Prospect, UUID> result) {
      return new BulkTransitionResponse(
          result.succeeded().stream().map(ProspectResponse::from).toList(), result.failed());
    }
  }
}
