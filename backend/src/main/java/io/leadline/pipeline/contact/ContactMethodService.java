package io.leadline.pipeline.contact;

import io.leadline.pipeline.exception.ResourceNotFoundException;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Contact method lookups used for dedup and DNC blocking, plus the suspect/reactivate lifecycle of
 * a single contact value. All matching is done on normalized values.
 */
@Service
public class ContactMethodService {

  private static final Logger log = LoggerFactory.getLogger(ContactMethodService.class);

  private final ContactMethodRepository contactMethodRepository;
  private final ProspectService prospectService;
  private final ProspectInvariantValidator invariantValidator;
  private final Clock clock;

  public ContactMethodService(
      ContactMethodRepository contactMethodRepository,
      ProspectService prospectService,
      ProspectInvariantValidator invariantValidator,
      Clock clock) {
    this.contactMethodRepository = contactMethodRepository;
    this.prospectService = prospectService;
    this.invariantValidator = invariantValidator;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Optional<UUID> findProspectIdByEmail(String email) {
    return findProspectId(ContactMethodType.EMAIL, email);
  }

  @Transactional(readOnly = true)
  public Optional<UUID> findProspectIdByPhone(String phone) {
    return findProspectId(ContactMethodType.PHONE, phone);
  }

  /**
   * Returns the id of a Do-Not-Contact prospect owning the given email or phone. Status is read
   * live on every call; nothing is cached.
   */
  @Transactional(readOnly = true)
  public Optional<UUID> findDncProspectId(String email, String phone) {
    var byEmail = findProspectIdInPopulation(ContactMethodType.EMAIL, email, Population.DEAD_DNC);
    if (byEmail.isPresent()) {
      return byEmail;
    }
    return findProspectIdInPopulation(ContactMethodType.PHONE, phone, Population.DEAD_DNC);
  }

  @Transactional(readOnly = true)
  public List<ContactMethod> getContactMethods(UUID prospectId) {
    return contactMethodRepository.findByProspectIdOrderByPrimaryDescCreatedAtAsc(prospectId);
  }

  /**
   * Adds a contact value to a prospect unless the prospect already holds the same normalized value.
   *
   * @return true if a new contact method was created
   */
  @Transactional
  public boolean addIfAbsent(
      UUID prospectId, ContactMethodType type, String value, boolean primary, String source) {
    String normalized = ContactValues.normalize(type, value);
    if (normalized.isEmpty()) {
      return false;
    }
    boolean exists =
        getContactMethods(prospectId).stream()
            .anyMatch(m -> m.getType() == type && m.getNormalizedValue().equals(normalized));
    if (exists) {
      return false;
    }
    contactMethodRepository.save(new ContactMethod(prospectId, type, value, primary, source));
    return true;
  }

  @Transactional
  public ContactMethod flagSuspect(UUID contactMethodId) {
    var method = getContactMethod(contactMethodId);
    method.flagSuspect();
    log.info(
        "Contact method {} of prospect {} flagged suspect",
        contactMethodId,
        method.getProspectId());
    return contactMethodRepository.save(method);
  }

  /**
   * Clears the suspect flag of a contact value. Refused for Do-Not-Contact prospects, whose contact
   * data may never be made usable again.
   */
  @Transactional
  public ContactMethod reactivate(UUID contactMethodId) {
    var method = getContactMethod(contactMethodId);
    var prospect = prospectService.lockProspect(method.getProspectId());
    invariantValidator.requireNotDnc(prospect, "contact method reactivation");
    method.reactivate(LocalDate.now(clock));
    log.info("Contact method {} of prospect {} reactivated", contactMethodId, prospect.getId());
    return contactMethodRepository.save(method);
  }

  private ContactMethod getContactMethod(UUID contactMethodId) {
    return contactMethodRepository
        .findById(contactMethodId)
        .orElseThrow(() -> new ResourceNotFoundException("ContactMethod", contactMethodId));
  }

  private Optional<UUID> findProspectId(ContactMethodType type, String value) {
    String normalized = ContactValues.normalize(type, value);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    return contactMethodRepository
        .findByTypeAndNormalizedValueOrderByCreatedAtAsc(type, normalized)
        .stream()
        .map(ContactMethod::getProspectId)
        .findFirst();
  }

  private Optional<UUID> findProspectIdInPopulation(
      ContactMethodType type, String value, Population population) {
    String normalized = ContactValues.normalize(type, value);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    return contactMethodRepository
        .findProspectIdsByContactInPopulation(type, normalized, population)
        .stream()
        .findFirst();
  }
}
