package io.leadline.pipeline.company;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CompanyService {

  private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

  private final CompanyRepository companyRepository;

  public CompanyService(CompanyRepository companyRepository) {
    this.companyRepository = companyRepository;
  }

  @Transactional(readOnly = true)
  public Optional<Company> findByName(String name) {
    String normalized = CompanyNames.normalize(name);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    return companyRepository.findFirstByNameNormalizedOrderByCreatedAtAsc(normalized);
  }

  /** Returns the company with the same normalized name, creating it when none exists. */
  @Transactional
  public Company findOrCreate(String name, String state) {
    String displayName =
        name == null || name.isBlank() ? CompanyNames.UNKNOWN_COMPANY : name.strip();
    return findByName(displayName)
        .orElseGet(
            () -> {
              var company = companyRepository.save(new Company(displayName, null, state));
              log.info("Created company {} ({})", company.getId(), company.getNameNormalized());
              return company;
            });
  }
}
