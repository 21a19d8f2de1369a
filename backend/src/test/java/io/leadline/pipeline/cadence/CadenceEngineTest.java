package io.leadline.pipeline.cadence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.leadline.pipeline.activity.Activity;
import io.leadline.pipeline.activity.ActivityOutcome;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.exception.DncViolationException;
import io.leadline.pipeline.exception.ProspectValidationException;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectRepository;
import io.leadline.pipeline.prospect.ProspectService;
import io.leadline.pipeline.testutil.TestProspectFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CadenceEngineTest {

  // Thursday
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-02-05T10:00:00Z"), ZoneOffset.UTC);
  private static final LocalDate TODAY = LocalDate.of(2026, 2, 5);
  private static final LocalDate MONDAY = LocalDate.of(2026, 2, 9);

  @Mock private ProspectRepository prospectRepository;
  @Mock private ProspectService prospectService;
  @Mock private ActivityService activityService;

  private CadenceEngine cadenceEngine;

  @BeforeEach
  void setUp() {
    cadenceEngine =
        new CadenceEngine(
            CadenceProperties.defaults(),
            prospectRepository,
            prospectService,
            new ProspectInvariantValidator(),
            activityService,
            CLOCK);
  }

  @Test
  void firstContactIsTodayPlusFirstInterval() {
    assertThat(cadenceEngine.calculateNextContact(0, null)).isEqualTo(LocalDate.of(2026, 2, 10));
    assertThat(cadenceEngine.calculateNextContact(3, null)).isEqualTo(LocalDate.of(2026, 2, 10));
  }

  @Test
  void laterAttemptsUseTheirIntervalFromLastAttempt() {
    assertThat(cadenceEngine.calculateNextContact(1, LocalDate.of(2026, 2, 6)))
        .isEqualTo(LocalDate.of(2026, 2, 11));
    assertThat(cadenceEngine.calculateNextContact(2, MONDAY)).isEqualTo(LocalDate.of(2026, 2, 16));
    assertThat(cadenceEngine.calculateNextContact(4, MONDAY)).isEqualTo(LocalDate.of(2026, 2, 23));
  }

  @Test
  void attemptsPastTheTableUseOverflowInterval() {
    assertThat(cadenceEngine.calculateNextContact(7, MONDAY)).isEqualTo(LocalDate.of(2026, 2, 27));
  }

  @Test
  void scheduleNeverShrinksAsAttemptsGrow() {
    for (int attempt = 1; attempt < 10; attempt++) {
      assertThat(cadenceEngine.calculateNextContact(attempt, MONDAY))
          .isBeforeOrEqualTo(cadenceEngine.calculateNextContact(attempt + 1, MONDAY));
    }
  }

  @Test
  void negativeAttemptCountIsRejected() {
    assertThatThrownBy(() -> cadenceEngine.calculateNextContact(-1, MONDAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void setFollowUpRequiresDate() {
    assertThatThrownBy(() -> cadenceEngine.setFollowUp(UUID.randomUUID(), null, null, null))
        .isInstanceOf(ProspectValidationException.class);
    verifyNoInteractions(prospectService, activityService);
  }

  @Test
  void setFollowUpOnDncProspectIsRejected() {
    var prospect = lockable(Population.DEAD_DNC);

    assertThatThrownBy(
            () ->
                cadenceEngine.setFollowUp(
                    prospect.getId(), Instant.parse("2026-03-01T15:00:00Z"), null, null))
        .isInstanceOf(DncViolationException.class);
    verify(activityService, never()).append(any());
  }

  @Test
  void setFollowUpStoresExplicitDateAndWritesReminder() {
    var prospect = lockable(Population.ENGAGED);
    stubSave();
    var when = Instant.parse("2026-03-03T16:30:00Z");

    var result =
        cadenceEngine.setFollowUp(prospect.getId(), when, "Call after board meeting", null);

    assertThat(result.getFollowUpDate()).isEqualTo(when);
    var activity = capturedActivity();
    assertThat(activity.getActivityType()).isEqualTo(ActivityType.REMINDER);
    assertThat(activity.getFollowUpSet()).isEqualTo(when);
    assertThat(activity.getNotes()).isEqualTo("Call after board meeting");
  }

  @Test
  void attemptOnSystemPacedProspectSchedulesNextContact() {
    var prospect = lockable(Population.UNENGAGED);
    stubSave();

    var result =
        cadenceEngine.recordAttempt(
            prospect.getId(), ActivityType.CALL, ActivityOutcome.NO_ANSWER, null, null);

    assertThat(result.getAttemptCount()).isEqualTo(1);
    assertThat(result.getLastContactDate()).isEqualTo(TODAY);
    assertThat(result.getFollowUpDate()).isEqualTo(Instant.parse("2026-02-10T00:00:00Z"));
    var activity = capturedActivity();
    assertThat(activity.getActivityType()).isEqualTo(ActivityType.CALL);
    assertThat(activity.getOutcome()).isEqualTo(ActivityOutcome.NO_ANSWER);
    assertThat(activity.getFollowUpSet()).isEqualTo(Instant.parse("2026-02-10T00:00:00Z"));
  }

  @Test
  void attemptOnEngagedProspectKeepsAgreedFollowUp() {
    var prospect = lockable(Population.ENGAGED);
    stubSave();

    var result =
        cadenceEngine.recordAttempt(
            prospect.getId(), ActivityType.EMAIL_SENT, null, "Sent recap", null);

    assertThat(result.getFollowUpDate()).isEqualTo(TestProspectFactory.FOLLOW_UP);
    assertThat(result.getAttemptCount()).isEqualTo(1);
    assertThat(capturedActivity().getFollowUpSet()).isNull();
  }

  @Test
  void nonAttemptActivityTypeIsRejected() {
    assertThatThrownBy(
            () ->
                cadenceEngine.recordAttempt(
                    UUID.randomUUID(), ActivityType.NOTE, null, null, null))
        .isInstanceOf(ProspectValidationException.class);
  }

  @Test
  void attemptOnDncProspectIsRejected() {
    var prospect = lockable(Population.DEAD_DNC);

    assertThatThrownBy(
            () ->
                cadenceEngine.recordAttempt(
                    prospect.getId(), ActivityType.CALL, null, null, null))
        .isInstanceOf(DncViolationException.class);
    assertThat(prospect.getAttemptCount()).isZero();
  }

  @Test
  void overdueExcludesTerminalPopulationsOnly() {
    var asOf = Instant.parse("2026-02-05T00:00:00Z");
    when(prospectRepository.findOverdue(eq(asOf), any())).thenReturn(List.of());

    cadenceEngine.getOverdue(asOf);

    verify(prospectRepository)
        .findOverdue(
            eq(asOf),
            argThat(
                excluded ->
                    excluded.contains(Population.DEAD_DNC)
                        && excluded.contains(Population.CLOSED_WON)
                        && excluded.contains(Population.PARTNERSHIP)
                        && !excluded.contains(Population.LOST)
                        && !excluded.contains(Population.ENGAGED)));
  }

  @Test
  void followUpListsExcludeExactlyTheTerminalPopulations() {
    for (Population population : Population.values()) {
      assertThat(CadenceEngine.NO_FOLLOW_UP.contains(population))
          .as(population.name())
          .isEqualTo(population.isTerminal());
    }
  }

  @Test
  void winBackFollowUpOnLostProspectIsStored() {
    var prospect = lockable(Population.LOST);
    stubSave();
    var when = Instant.parse("2026-06-01T15:00:00Z");

    var result = cadenceEngine.setFollowUp(prospect.getId(), when, "Try again next quarter", null);

    assertThat(result.getFollowUpDate()).isEqualTo(when);
    assertThat(capturedActivity().getActivityType()).isEqualTo(ActivityType.REMINDER);
  }

  @Test
  void todaysFollowUpsCoverTheWholeDay() {
    when(prospectRepository.findFollowUpsBetween(any(), any(), any())).thenReturn(List.of());

    cadenceEngine.getTodaysFollowUps(TODAY);

    verify(prospectRepository)
        .findFollowUpsBetween(
            eq(Instant.parse("2026-02-05T00:00:00Z")),
            eq(Instant.parse("2026-02-06T00:00:00Z")),
            any());
  }

  @Test
  void orphanedEngagedAreReported() {
    var orphan =
        TestProspectFactory.prospectIn(Population.ENGAGED);
    when(prospectRepository.findByPopulationWithoutFollowUp(Population.ENGAGED))
        .thenReturn(List.of(orphan));

    assertThat(cadenceEngine.getOrphanedEngaged()).containsExactly(orphan);
  }

  private Prospect lockable(Population population) {
    var prospect = TestProspectFactory.prospectIn(population);
    when(prospectService.lockProspect(prospect.getId())).thenReturn(prospect);
    return prospect;
  }

  private void stubSave() {
    when(prospectService.save(any(Prospect.class))).thenAnswer(inv -> inv.getArgument(0));
  }

  private Activity capturedActivity() {
    var captor = ArgumentCaptor.forClass(Activity.class);
    verify(activityService).append(captor.capture());
    return captor.getValue();
  }
}
