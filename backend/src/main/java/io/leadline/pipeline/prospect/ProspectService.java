package io.leadline.pipeline.prospect;

import io.leadline.pipeline.exception.ResourceNotFoundException;
import io.leadline.pipeline.exception.StorageBusyException;
import java.util.UUID;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Point lookups of prospects, including the locked read every mutation starts with. */
@Service
public class ProspectService {

  private final ProspectRepository prospectRepository;

  public ProspectService(ProspectRepository prospectRepository) {
    this.prospectRepository = prospectRepository;
  }

  @Transactional(readOnly = true)
  public Prospect getProspect(UUID prospectId) {
    return prospectRepository
        .findById(prospectId)
        .orElseThrow(() -> new ResourceNotFoundException("Prospect", prospectId));
  }

  /**
   * Reads a prospect under a row lock. Must run inside the caller's transaction so that the check
   * and the subsequent write see the same row.
   *
   * @throws StorageBusyException if the lock is not granted within the timeout
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Prospect lockProspect(UUID prospectId) {
    try {
      return prospectRepository
          .findByIdForUpdate(prospectId)
          .orElseThrow(() -> new ResourceNotFoundException("Prospect", prospectId));
    } catch (PessimisticLockingFailureException e) {
      throw new StorageBusyException("Prospect", prospectId, e);
    }
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Prospect save(Prospect prospect) {
    return prospectRepository.save(prospect);
  }
}
