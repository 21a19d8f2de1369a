package io.leadline.pipeline.population;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.leadline.pipeline.activity.Activity;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.exception.DncViolationException;
import io.leadline.pipeline.exception.InvalidTransitionException;
import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectService;
import io.leadline.pipeline.prospect.ProspectState;
import io.leadline.pipeline.testutil.TestProspectFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EngagementStageMachineTest {

  @Mock private ProspectService prospectService;
  @Mock private ActivityService activityService;

  private EngagementStageMachine stageMachine;

  @BeforeEach
  void setUp() {
    stageMachine =
        new EngagementStageMachine(
            prospectService, new ProspectInvariantValidator(), activityService);
  }

  @Test
  void advancesOneStepAndRecordsStageChange() {
    var prospect = engagedAt(EngagementStage.PRE_DEMO);
    when(prospectService.save(any(Prospect.class))).thenAnswer(inv -> inv.getArgument(0));

    var result =
        stageMachine.transitionStage(
            prospect.getId(), EngagementStage.DEMO_SCHEDULED, "Demo booked", null);

    assertThat(result.getEngagementStage()).isEqualTo(EngagementStage.DEMO_SCHEDULED);
    var captor = ArgumentCaptor.forClass(Activity.class);
    verify(activityService).append(captor.capture());
    assertThat(captor.getValue().getStageBefore()).isEqualTo(EngagementStage.PRE_DEMO);
    assertThat(captor.getValue().getStageAfter()).isEqualTo(EngagementStage.DEMO_SCHEDULED);
    assertThat(captor.getValue().getPopulationBefore()).isEqualTo(Population.ENGAGED);
    assertThat(captor.getValue().getPopulationAfter()).isEqualTo(Population.ENGAGED);
  }

  @Test
  void skippingAheadIsRejected() {
    var prospect = engagedAt(EngagementStage.PRE_DEMO);

    assertThatThrownBy(
            () ->
                stageMachine.transitionStage(
                    prospect.getId(), EngagementStage.CLOSING, null, null))
        .isInstanceOfSatisfying(
            InvalidTransitionException.class,
            e -> assertThat(e.getDetail()).contains("from stage PRE_DEMO to CLOSING"));
    assertThat(prospect.getEngagementStage()).isEqualTo(EngagementStage.PRE_DEMO);
    verify(activityService, never()).append(any());
  }

  @Test
  void regressingIsRejected() {
    var prospect = engagedAt(EngagementStage.POST_DEMO);

    assertThatThrownBy(
            () ->
                stageMachine.transitionStage(
                    prospect.getId(), EngagementStage.PRE_DEMO, null, null))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void stageChangeOutsideEngagedIsRejected() {
    var prospect = TestProspectFactory.prospectIn(Population.UNENGAGED);
    when(prospectService.lockProspect(prospect.getId())).thenReturn(prospect);

    assertThatThrownBy(
            () ->
                stageMachine.transitionStage(
                    prospect.getId(), EngagementStage.DEMO_SCHEDULED, null, null))
        .isInstanceOfSatisfying(
            InvalidTransitionException.class,
            e -> assertThat(e.getDetail()).contains("only while ENGAGED"));
  }

  @Test
  void dncProspectIsRejectedBeforeAnyStageCheck() {
    var prospect = TestProspectFactory.prospectIn(Population.DEAD_DNC);
    when(prospectService.lockProspect(prospect.getId())).thenReturn(prospect);

    assertThatThrownBy(
            () ->
                stageMachine.transitionStage(
                    prospect.getId(), EngagementStage.DEMO_SCHEDULED, null, null))
        .isInstanceOf(DncViolationException.class);
  }

  @Test
  void canTransitionStageMirrorsOrdering() {
    assertThat(
            stageMachine.canTransitionStage(
                EngagementStage.POST_DEMO, EngagementStage.CLOSING))
        .isTrue();
    assertThat(stageMachine.canTransitionStage(null, EngagementStage.PRE_DEMO)).isFalse();
  }

  private Prospect engagedAt(EngagementStage stage) {
    var prospect =
        TestProspectFactory.prospectWithState(
            new ProspectState(
                Population.ENGAGED, stage, TestProspectFactory.FOLLOW_UP, null));
    when(prospectService.lockProspect(prospect.getId())).thenReturn(prospect);
    return prospect;
  }
}
