package io.leadline.pipeline.intake;

import io.leadline.pipeline.activity.ActivityBuilder;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.company.CompanyService;
import io.leadline.pipeline.contact.ContactMethodService;
import io.leadline.pipeline.contact.ContactMethodType;
import io.leadline.pipeline.exception.DncViolationException;
import io.leadline.pipeline.exception.MalformedRecordException;
import io.leadline.pipeline.population.PopulationStateMachine;
import io.leadline.pipeline.population.TransitionCommand;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one accepted import row. Runs inside the per-row transaction opened by {@link
 * IntakeFunnel#commit}, so the live DNC check and the writes it guards are atomic.
 */
@Component
public class IntakeRecordCommitter {

  private static final Logger log = LoggerFactory.getLogger(IntakeRecordCommitter.class);

  public enum Outcome {
    IMPORTED,
    IMPORTED_BROKEN,
    MERGED
  }

  private final CompanyService companyService;
  private final ProspectService prospectService;
  private final ContactMethodService contactMethodService;
  private final PopulationStateMachine stateMachine;
  private final ProspectInvariantValidator invariantValidator;
  private final ActivityService activityService;
  private final NameMatcher nameMatcher;

  public IntakeRecordCommitter(
      CompanyService companyService,
      ProspectService prospectService,
      ContactMethodService contactMethodService,
      PopulationStateMachine stateMachine,
      ProspectInvariantValidator invariantValidator,
      ActivityService activityService,
      NameMatcher nameMatcher) {
    this.companyService = companyService;
    this.prospectService = prospectService;
    this.contactMethodService = contactMethodService;
    this.stateMachine = stateMachine;
    this.invariantValidator = invariantValidator;
    this.activityService = activityService;
    this.nameMatcher = nameMatcher;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Outcome commit(AnalysisResult analysis, ImportPreview preview) {
    var record = analysis.record();
    requireWellFormed(analysis);
    requireNoDncContact(record);
    return switch (analysis.status()) {
      case NEW, INCOMPLETE -> create(record, preview);
      case MERGE -> merge(analysis, preview);
      case NEEDS_REVIEW, BLOCKED_DNC -> throw new IllegalArgumentException(
          "Row " + analysis.rowNumber() + " with status " + analysis.status()
              + " is not committed");
    };
  }

  private Outcome create(ImportRecord record, ImportPreview preview) {
    if (!record.hasName()) {
      throw new MalformedRecordException("A new prospect requires a first or last name");
    }
    requireNoDncNameMatch(record);
    var company = companyService.findOrCreate(record.companyName(), record.state());
    var prospect =
        new Prospect(
            company.getId(),
            strip(record.firstName()),
            strip(record.lastName()),
            strip(record.title()),
            record.source() != null && !record.source().isBlank()
                ? record.source()
                : preview.sourceName(),
            record.notes());
    var population =
        record.hasEmail() || record.hasPhone() ? Population.UNENGAGED : Population.BROKEN;
    prospect =
        stateMachine.admit(
            prospect, population, "Imported from " + preview.label(), ActivityBuilder.SYSTEM);

    if (record.hasEmail()) {
      contactMethodService.addIfAbsent(
          prospect.getId(), ContactMethodType.EMAIL, record.email(), true, preview.label());
    }
    if (record.hasPhone()) {
      contactMethodService.addIfAbsent(
          prospect.getId(),
          ContactMethodType.PHONE,
          record.phone(),
          !record.hasEmail(),
          preview.label());
    }
    return population == Population.BROKEN ? Outcome.IMPORTED_BROKEN : Outcome.IMPORTED;
  }

  private Outcome merge(AnalysisResult analysis, ImportPreview preview) {
    UUID prospectId = analysis.matchedProspectId();
    if (prospectId == null) {
      throw new MalformedRecordException("A merge requires a matched prospect");
    }
    var record = analysis.record();
    var prospect = prospectService.lockProspect(prospectId);
    invariantValidator.requireNotDnc(prospect, "import merge");

    prospect.fillBlankProfileFields(strip(record.title()), record.notes(), record.source());
    prospect = prospectService.save(prospect);
    if (record.hasEmail()) {
      contactMethodService.addIfAbsent(
          prospectId, ContactMethodType.EMAIL, record.email(), false, preview.label());
    }
    if (record.hasPhone()) {
      contactMethodService.addIfAbsent(
          prospectId, ContactMethodType.PHONE, record.phone(), false, preview.label());
    }

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(ActivityType.IMPORT)
            .notes(
                "Merged from import: "
                    + preview.label()
                    + " (match: "
                    + analysis.matchReason()
                    + ")")
            .createdBy(ActivityBuilder.SYSTEM)
            .build());

    if (prospect.getPopulation() == Population.BROKEN && hasEmailOrPhone(prospectId)) {
      stateMachine.transition(
          prospectId,
          TransitionCommand.to(Population.UNENGAGED, "Contact data completed by import merge")
              .byActor(ActivityBuilder.SYSTEM));
    }
    return Outcome.MERGED;
  }

  private void requireWellFormed(AnalysisResult analysis) {
    var record = analysis.record();
    if (record == null) {
      throw new MalformedRecordException("Row " + analysis.rowNumber() + " has no data");
    }
    if (analysis.status() == null) {
      throw new MalformedRecordException("Row " + analysis.rowNumber() + " has no match status");
    }
    if (record.hasEmail() && !record.email().contains("@")) {
      throw new MalformedRecordException(
          "Row " + analysis.rowNumber() + " has an invalid email '" + record.email() + "'");
    }
  }

  /** Live check inside the row transaction: DNC status may have changed since analysis. */
  private void requireNoDncContact(ImportRecord record) {
    contactMethodService
        .findDncProspectId(record.email(), record.phone())
        .ifPresent(
            dncProspectId -> {
              log.error(
                  "DNC violation: import row matches contact data of Do-Not-Contact prospect {}",
                  dncProspectId);
              throw new DncViolationException(dncProspectId, "import of a matching record");
            });
  }

  /** A new row may not duplicate a Do-Not-Contact prospect by name at the same company. */
  private void requireNoDncNameMatch(ImportRecord record) {
    nameMatcher
        .bestMatch(record)
        .filter(NameMatcher.NameMatch::isDoNotContact)
        .ifPresent(
            match -> {
              log.error(
                  "DNC violation: import row '{}' matches Do-Not-Contact prospect {} by name",
                  record.fullName(),
                  match.prospect().getId());
              throw new DncViolationException(
                  match.prospect().getId(), "import of a record matching by name");
            });
  }

  /** Same rule as a fresh import: any email or phone makes a prospect reachable. */
  private boolean hasEmailOrPhone(UUID prospectId) {
    return contactMethodService.getContactMethods(prospectId).stream()
        .anyMatch(
            m -> m.getType() == ContactMethodType.EMAIL || m.getType() == ContactMethodType.PHONE);
  }

  private static String strip(String value) {
    return value != null ? value.strip() : null;
  }
}
