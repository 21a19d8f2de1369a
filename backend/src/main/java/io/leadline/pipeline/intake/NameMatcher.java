package io.leadline.pipeline.intake;

import io.leadline.pipeline.company.CompanyService;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectRepository;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/** Fuzzy name lookup among the prospects of a record's normalized company. */
@Component
public class NameMatcher {

  private final CompanyService companyService;
  private final ProspectRepository prospectRepository;
  private final NameSimilarity nameSimilarity;
  private final IntakeProperties intakeProperties;

  public NameMatcher(
      CompanyService companyService,
      ProspectRepository prospectRepository,
      NameSimilarity nameSimilarity,
      IntakeProperties intakeProperties) {
    this.companyService = companyService;
    this.prospectRepository = prospectRepository;
    this.nameSimilarity = nameSimilarity;
    this.intakeProperties = intakeProperties;
  }

  /**
   * The most similar prospect at the same normalized company, if its similarity reaches the
   * threshold. Equal scores go to the oldest prospect.
   */
  public Optional<NameMatch> bestMatch(ImportRecord record) {
    if (record == null || !record.hasName() || !record.hasCompany()) {
      return Optional.empty();
    }
    var company = companyService.findByName(record.companyName());
    if (company.isEmpty()) {
      return Optional.empty();
    }
    var candidates =
        prospectRepository.findByCompanyIdOrderByCreatedAtAsc(
            company.get().getId(), PageRequest.of(0, intakeProperties.fuzzyCandidateLimit()));
    String fullName = record.fullName();
    NameMatch best = null;
    for (Prospect candidate : candidates) {
      double similarity = nameSimilarity.similarity(fullName, candidate.getFullName());
      if (similarity >= intakeProperties.nameSimilarityThreshold()
          && (best == null || similarity > best.similarity())) {
        best = new NameMatch(candidate, similarity);
      }
    }
    return Optional.ofNullable(best);
  }

  public record NameMatch(Prospect prospect, double similarity) {

    public boolean isDoNotContact() {
      return prospect.getPopulation() == Population.DEAD_DNC;
    }
  }
}
