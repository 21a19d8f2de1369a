package io.leadline.pipeline.contact;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ContactMethodController {

  private final ContactMethodService contactMethodService;

  public ContactMethodController(ContactMethodService contactMethodService) {
    this.contactMethodService = contactMethodService;
  }

  @GetMapping("/api/prospects/{prospectId}/contact-methods")
  public ResponseEntity<List<ContactMethodResponse>> getContactMethods(
      @PathVariable UUID prospectId) {
    return ResponseEntity.ok(
        contactMethodService.getContactMethods(prospectId).stream()
            .map(ContactMethodResponse::from)
            .toList());
  }

  @PostMapping("/api/contact-methods/{id}/suspect")
  public ResponseEntity<ContactMethodResponse> flagSuspect(@PathVariable UUID id) {
    return ResponseEntity.ok(ContactMethodResponse.from(contactMethodService.flagSuspect(id)));
  }

  @PostMapping("/api/contact-methods/{id}/reactivate")
  public ResponseEntity<ContactMethodResponse> reactivate(@PathVariable UUID id) {
    return ResponseEntity.ok(ContactMethodResponse.from(contactMethodService.reactivate(id)));
  }

  public record ContactMethodResponse(
      UUID id,
      UUID prospectId,
      ContactMethodType type,
      String value,
      String label,
      boolean primary,
      boolean verified,
      LocalDate verifiedDate,
      int confidenceScore,
      boolean suspect,
      String source,
      Instant createdAt) {

    public static ContactMethodResponse from(ContactMethod method) {
      return new ContactMethodResponse(
          method.getId(),
          method.getProspectId(),
          method.getType(),
          method.getValue(),
          method.getLabel(),
          method.isPrimary(),
          method.isVerified(),
          method.getVerifiedDate(),
          method.getConfidenceScore(),
          method.isSuspect(),
          method.getSource(),
          method.getCreatedAt());
    }
  }
}
