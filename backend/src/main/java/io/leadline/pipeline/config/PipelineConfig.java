package io.leadline.pipeline.config;

import io.leadline.pipeline.cadence.CadenceProperties;
import io.leadline.pipeline.intake.IntakeProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({CadenceProperties.class, IntakeProperties.class})
public class PipelineConfig {

  /** Source of "now" and "today" for scheduling; replaced by a fixed clock in tests. */
  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }
}
