package io.leadline.pipeline.activity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ActivityBuilderTest {

  @Test
  void buildsStatusChangeActivity() {
    var prospectId = UUID.randomUUID();

    var activity =
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(ActivityType.STATUS_CHANGE)
            .population(Population.ENGAGED, Population.ENGAGED)
            .stage(EngagementStage.PRE_DEMO, EngagementStage.DEMO_SCHEDULED)
            .notes("Demo booked")
            .createdBy(ActivityBuilder.SYSTEM)
            .build();

    assertThat(activity.getProspectId()).isEqualTo(prospectId);
    assertThat(activity.getPopulationBefore()).isEqualTo(Population.ENGAGED);
    assertThat(activity.getStageAfter()).isEqualTo(EngagementStage.DEMO_SCHEDULED);
    assertThat(activity.getCreatedBy()).isEqualTo("system");
    assertThat(activity.getCreatedAt()).isNotNull();
  }

  @Test
  void actorDefaultsToUser() {
    var activity =
        ActivityBuilder.builder()
            .prospectId(UUID.randomUUID())
            .activityType(ActivityType.NOTE)
            .createdBy(null)
            .build();

    assertThat(activity.getCreatedBy()).isEqualTo(ActivityBuilder.USER);
  }

  @Test
  void prospectAndTypeAreRequired() {
    assertThatThrownBy(() -> ActivityBuilder.builder().activityType(ActivityType.NOTE).build())
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("prospectId");
    assertThatThrownBy(() -> ActivityBuilder.builder().prospectId(UUID.randomUUID()).build())
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("activityType");
  }

  @Test
  void onlyOutreachTypesCountAsAttempts() {
    assertThat(ActivityType.CALL.isAttempt()).isTrue();
    assertThat(ActivityType.VOICEMAIL.isAttempt()).isTrue();
    assertThat(ActivityType.EMAIL_SENT.isAttempt()).isTrue();
    assertThat(ActivityType.EMAIL_RECEIVED.isAttempt()).isFalse();
    assertThat(ActivityType.DEMO.isAttempt()).isFalse();
  }
}
