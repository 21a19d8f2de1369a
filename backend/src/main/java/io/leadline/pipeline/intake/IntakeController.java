package io.leadline.pipeline.intake;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/imports")
public class IntakeController {

  private final IntakeFunnel intakeFunnel;

  public IntakeController(IntakeFunnel intakeFunnel) {
    this.intakeFunnel = intakeFunnel;
  }

  @PostMapping("/analyze")
  public ResponseEntity<ImportPreview> analyze(@Valid @RequestBody AnalyzeRequest request) {
    return ResponseEntity.ok(
        intakeFunnel.analyze(request.records(), request.sourceName(), request.filename()));
  }

  /** Commits a preview returned by {@code /analyze}, optionally with edited classifications. */
  @PostMapping("/commit")
  public ResponseEntity<ImportResult> commit(@Valid @RequestBody CommitRequest request) {
    return ResponseEntity.ok(
        intakeFunnel.commit(
            new ImportPreview(request.sourceName(), request.filename(), request.results())));
  }

  @GetMapping
  public ResponseEntity<List<ImportSourceResponse>> listImports() {
    return ResponseEntity.ok(
        intakeFunnel.listImports().stream().map(ImportSourceResponse::from).toList());
  }

  // --- DTOs ---

  public record AnalyzeRequest(
      @Size(max = 200, message = "sourceName must be at most 200 characters") String sourceName,
      @Size(max = 500, message = "filename must be at most 500 characters") String filename,
      @NotNull(message = "records are required")
          @Size(max = 10000, message = "at most 10000 records per batch")
          List<ImportRecord> records) {}

  public record CommitRequest(
      @Size(max = 200, message = "sourceName must be at most 200 characters") String sourceName,
      @Size(max = 500, message = "filename must be at most 500 characters") String filename,
      @NotNull(message = "results are required")
          @Size(max = 10000, message = "at most 10000 records per batch")
          List<AnalysisResult> results) {}

  public record ImportSourceResponse(
      UUID id,
      String sourceName,
      String filename,
      int totalRecords,
      int importedRecords,
      int duplicateRecords,
      int brokenRecords,
      int dncBlockedRecords,
      int skippedRecords,
      int failedRecords,
      Instant importDate) {

    public static ImportSourceResponse from(ImportSource source) {
      return new ImportSourceResponse(
          source.getId(),
          source.getSourceName(),
          source.getFilename(),
          source.getTotalRecords(),
          source.getImportedRecords(),
          source.getDuplicateRecords(),
          source.getBrokenRecords(),
          source.getDncBlockedRecords(),
          source.getSkippedRecords(),
          source.getFailedRecords(),
          source.getImportDate());
    }
  }
}
