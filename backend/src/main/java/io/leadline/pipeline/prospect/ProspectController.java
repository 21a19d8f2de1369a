package io.leadline.pipeline.prospect;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/prospects")
public class ProspectController {

  private final ProspectService prospectService;

  public ProspectController(ProspectService prospectService) {
    this.prospectService = prospectService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProspectResponse> getProspect(@PathVariable UUID id) {
    return ResponseEntity.ok(ProspectResponse.from(prospectService.getProspect(id)));
  }

  public record ProspectResponse(
      UUID id,
      UUID companyId,
      String firstName,
      String lastName,
      String title,
      Population population,
      EngagementStage engagementStage,
      Instant followUpDate,
      LocalDate lastContactDate,
      YearMonth parkedMonth,
      int attemptCount,
      String source,
      String deadReason,
      LocalDate deadDate,
      LostReason lostReason,
      LocalDate lostDate,
      Instant createdAt,
      Instant updatedAt) {

    public static ProspectResponse from(Prospect prospect) {
      return new ProspectResponse(
          prospect.getId(),
          prospect.getCompanyId(),
          prospect.getFirstName(),
          prospect.getLastName(),
          prospect.getTitle(),
          prospect.getPopulation(),
          prospect.getEngagementStage(),
          prospect.getFollowUpDate(),
          prospect.getLastContactDate(),
          prospect.getParkedMonth(),
          prospect.getAttemptCount(),
          prospect.getSource(),
          prospect.getDeadReason(),
          prospect.getDeadDate(),
          prospect.getLostReason(),
          prospect.getLostDate(),
          prospect.getCreatedAt(),
          prospect.getUpdatedAt());
    }
  }
}
