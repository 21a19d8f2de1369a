package io.leadline.pipeline.activity;

import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/prospects")
public class ActivityController {

  private final ActivityService activityService;

  public ActivityController(ActivityService activityService) {
    this.activityService = activityService;
  }

  @GetMapping("/{id}/activities")
  public ResponseEntity<List<ActivityResponse>> getActivities(
      @PathVariable UUID id,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var activities =
        activityService.getHistory(id, PageRequest.of(page, Math.min(size, 200))).getContent();
    return ResponseEntity.ok(activities.stream().map(ActivityResponse::from).toList());
  }

  public record ActivityResponse(
      UUID id,
      UUID prospectId,
      ActivityType activityType,
      ActivityOutcome outcome,
      Population populationBefore,
      Population populationAfter,
      EngagementStage stageBefore,
      EngagementStage stageAfter,
      Instant followUpSet,
      String notes,
      String createdBy,
      Instant createdAt) {

    public static ActivityResponse from(Activity activity) {
      return new ActivityResponse(
          activity.getId(),
          activity.getProspectId(),
          activity.getActivityType(),
          activity.getOutcome(),
          activity.getPopulationBefore(),
          activity.getPopulationAfter(),
          activity.getStageBefore(),
          activity.getStageAfter(),
          activity.getFollowUpSet(),
          activity.getNotes(),
          activity.getCreatedBy(),
          activity.getCreatedAt());
    }
  }
}
