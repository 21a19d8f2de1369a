package io.leadline.pipeline.intake;

import io.leadline.pipeline.batch.BatchFailure;
import io.leadline.pipeline.contact.ContactMethodService;
import io.leadline.pipeline.exception.DncViolationException;
import io.leadline.pipeline.exception.ErrorKind;
import io.leadline.pipeline.exception.PipelineException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Two-phase admission of external records.
 *
 * <p>{@link #analyze} classifies every row against the current store without writing anything. The
 * passes run in a fixed order and the first hit wins:
 *
 * <ol>
 *   <li>DNC: any email or phone owned by a DEAD_DNC prospect blocks the row
 *   <li>exact email: merge
 *   <li>fuzzy name at the same normalized company: merge (or block, if the match is DNC)
 *   <li>phone: needs review, since phones are often shared lines
 *   <li>no name, or neither email nor phone: incomplete
 * </ol>
 *
 * <p>{@link #commit} writes each accepted row in its own transaction; a failing row is reported and
 * the rest of the batch continues.
 */
@Service
public class IntakeFunnel {

  private static final Logger log = LoggerFactory.getLogger(IntakeFunnel.class);

  private final ContactMethodService contactMethodService;
  private final NameMatcher nameMatcher;
  private final IntakeRecordCommitter recordCommitter;
  private final ImportSourceRepository importSourceRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public IntakeFunnel(
      ContactMethodService contactMethodService,
      NameMatcher nameMatcher,
      IntakeRecordCommitter recordCommitter,
      ImportSourceRepository importSourceRepository,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.contactMethodService = contactMethodService;
    this.nameMatcher = nameMatcher;
    this.recordCommitter = recordCommitter;
    this.importSourceRepository = importSourceRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /** Classifies every record. Read-only; calling it twice on an unchanged store is idempotent. */
  @Transactional(readOnly = true)
  public ImportPreview analyze(List<ImportRecord> records, String sourceName, String filename) {
    var results = new ArrayList<AnalysisResult>(records.size());
    for (int i = 0; i < records.size(); i++) {
      results.add(classify(i + 1, records.get(i)));
    }
    var preview = new ImportPreview(sourceName, filename, results);
    log.info(
        "Import analysis of '{}' complete: total={}, new={}, merge={}, review={}, dncBlocked={},"
            + " incomplete={}",
        preview.label(),
        preview.totalRecords(),
        preview.newRecords().size(),
        preview.mergeRecords().size(),
        preview.needsReview().size(),
        preview.blockedDnc().size(),
        preview.incomplete().size());
    return preview;
  }

  AnalysisResult classify(int rowNumber, ImportRecord record) {
    if (record == null) {
      return AnalysisResult.of(rowNumber, null, MatchStatus.INCOMPLETE);
    }

    var dncByEmail = contactMethodService.findDncProspectId(record.email(), null);
    if (dncByEmail.isPresent()) {
      return AnalysisResult.matched(
          rowNumber,
          record,
          MatchStatus.BLOCKED_DNC,
          dncByEmail.get(),
          MatchReason.DNC_EMAIL,
          1.0);
    }
    var dncByPhone = contactMethodService.findDncProspectId(null, record.phone());
    if (dncByPhone.isPresent()) {
      return AnalysisResult.matched(
          rowNumber,
          record,
          MatchStatus.BLOCKED_DNC,
          dncByPhone.get(),
          MatchReason.DNC_PHONE,
          1.0);
    }

    if (record.hasEmail()) {
      var byEmail = contactMethodService.findProspectIdByEmail(record.email());
      if (byEmail.isPresent()) {
        return AnalysisResult.matched(
            rowNumber, record, MatchStatus.MERGE, byEmail.get(), MatchReason.EMAIL, 1.0);
      }
    }

    var fuzzy = nameMatcher.bestMatch(record);
    if (fuzzy.isPresent()) {
      var match = fuzzy.get();
      var status = match.isDoNotContact() ? MatchStatus.BLOCKED_DNC : MatchStatus.MERGE;
      var reason =
          status == MatchStatus.BLOCKED_DNC ? MatchReason.DNC_NAME : MatchReason.FUZZY_NAME;
      return AnalysisResult.matched(
          rowNumber, record, status, match.prospect().getId(), reason, match.similarity());
    }

    if (record.hasPhone()) {
      var byPhone = contactMethodService.findProspectIdByPhone(record.phone());
      if (byPhone.isPresent()) {
        return AnalysisResult.matched(
            rowNumber, record, MatchStatus.NEEDS_REVIEW, byPhone.get(), MatchReason.PHONE, null);
      }
    }

    if (!record.hasName() || (!record.hasEmail() && !record.hasPhone())) {
      return AnalysisResult.of(rowNumber, record, MatchStatus.INCOMPLETE);
    }
    return AnalysisResult.of(rowNumber, record, MatchStatus.NEW);
  }

  /**
   * Writes the accepted rows of a (possibly reviewer-edited) preview. BLOCKED_DNC rows are never
   * written and NEEDS_REVIEW rows are skipped. Every written row repeats the DNC check inside its
   * own transaction.
   */
  public ImportResult commit(ImportPreview preview) {
    int imported = 0;
    int merged = 0;
    int broken = 0;
    int skipped = 0;
    int dncBlocked = 0;
    var failures = new ArrayList<BatchFailure<AnalysisResult>>();

    for (AnalysisResult analysis : preview.results()) {
      if (analysis.status() == MatchStatus.BLOCKED_DNC) {
        dncBlocked++;
        continue;
      }
      if (analysis.status() == MatchStatus.NEEDS_REVIEW) {
        skipped++;
        continue;
      }
      try {
        var outcome = transactionTemplate.execute(tx -> recordCommitter.commit(analysis, preview));
        switch (outcome) {
          case IMPORTED -> imported++;
          case IMPORTED_BROKEN -> {
            imported++;
            broken++;
          }
          case MERGED -> merged++;
        }
      } catch (DncViolationException e) {
        dncBlocked++;
        failures.add(BatchFailure.of(analysis, e));
      } catch (PipelineException e) {
        log.warn("Import row {} rejected: {}", analysis.rowNumber(), e.getDetail());
        failures.add(BatchFailure.of(analysis, e));
      } catch (PessimisticLockingFailureException e) {
        log.warn("Import row {} hit a locked prospect: {}", analysis.rowNumber(), e.getMessage());
        failures.add(
            new BatchFailure<>(
                analysis,
                ErrorKind.STORAGE_BUSY,
                "Row " + analysis.rowNumber() + " could not lock its prospect; retry the row"));
      } catch (DataIntegrityViolationException e) {
        log.warn("Import row {} could not be stored: {}", analysis.rowNumber(), e.getMessage());
        failures.add(
            new BatchFailure<>(
                analysis,
                ErrorKind.MALFORMED_RECORD,
                "Row "
                    + analysis.rowNumber()
                    + " could not be stored: "
                    + e.getMostSpecificCause().getMessage()));
      } catch (RuntimeException e) {
        log.warn("Import row {} failed: {}", analysis.rowNumber(), e.toString());
        failures.add(
            new BatchFailure<>(
                analysis,
                ErrorKind.MALFORMED_RECORD,
                "Row " + analysis.rowNumber() + " could not be imported: " + e.getMessage()));
      }
    }

    int importedCount = imported;
    int mergedCount = merged;
    int brokenCount = broken;
    int skippedCount = skipped;
    int dncBlockedCount = dncBlocked;
    var source =
        transactionTemplate.execute(
            tx ->
                importSourceRepository.save(
                    new ImportSource(
                        preview.label(),
                        preview.filename(),
                        preview.totalRecords(),
                        importedCount,
                        mergedCount,
                        brokenCount,
                        dncBlockedCount,
                        skippedCount,
                        failures.size(),
                        clock.instant())));

    log.info(
        "Import '{}' committed: imported={}, merged={}, broken={}, skipped={}, dncBlocked={},"
            + " failed={}, sourceId={}",
        preview.label(),
        imported,
        merged,
        broken,
        skipped,
        dncBlocked,
        failures.size(),
        source.getId());

    return new ImportResult(
        preview.totalRecords(),
        imported,
        merged,
        broken,
        skipped,
        dncBlocked,
        source.getId(),
        failures);
  }

  @Transactional(readOnly = true)
  public List<ImportSource> listImports() {
    return importSourceRepository.findAllByOrderByImportDateDesc();
  }
}
