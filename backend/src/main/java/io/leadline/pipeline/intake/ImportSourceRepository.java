package io.leadline.pipeline.intake;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ImportSourceRepository extends JpaRepository<ImportSource, UUID> {

  List<ImportSource> findAllByOrderByImportDateDesc();
}
