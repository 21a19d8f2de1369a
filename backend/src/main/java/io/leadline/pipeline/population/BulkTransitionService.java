package io.leadline.pipeline.population;

import io.leadline.pipeline.activity.ActivityBuilder;
import io.leadline.pipeline.batch.BatchFailure;
import io.leadline.pipeline.batch.BatchResult;
import io.leadline.pipeline.exception.PipelineException;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectRepository;
import java.time.YearMonth;
import java.util.Collection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies one transition to many prospects. Each prospect is its own transaction, so a DNC,
 * invalid or missing prospect is reported without affecting the rest.
 */
@Service
public class BulkTransitionService {

  private static final Logger log = LoggerFactory.getLogger(BulkTransitionService.class);

  private final PopulationStateMachine stateMachine;
  private final ProspectRepository prospectRepository;

  public BulkTransitionService(
      PopulationStateMachine stateMachine, ProspectRepository prospectRepository) {
    this.stateMachine = stateMachine;
    this.prospectRepository = prospectRepository;
  }

  public BatchResult<Prospect, UUID> transitionAll(
      Collection<UUID> prospectIds, TransitionCommand command) {
    var collector = new BatchResult.Collector<Prospect, UUID>();
    for (UUID prospectId : prospectIds) {
      try {
        collector.succeeded(stateMachine.transition(prospectId, command));
      } catch (PipelineException e) {
        log.warn(
            "Bulk transition of prospect {} to {} failed: {}",
            prospectId,
            command.target(),
            e.getDetail());
        collector.failed(BatchFailure.of(prospectId, e));
      }
    }
    var result = collector.build();
    log.info(
        "Bulk transition to {}: {} succeeded, {} failed",
        command.target(),
        result.succeeded().size(),
        result.failed().size());
    return result;
  }

  /** Returns every PARKED prospect whose month has arrived to UNENGAGED. */
  public BatchResult<Prospect, UUID> reactivateDueParked(YearMonth month) {
    var due = prospectRepository.findIdsByPopulationAndParkedMonthUpTo(Population.PARKED, month);
    return transitionAll(
        due,
        TransitionCommand.to(Population.UNENGAGED, "Parked month " + month + " arrived")
            .byActor(ActivityBuilder.SYSTEM));
  }
}
