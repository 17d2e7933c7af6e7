package com.flamingo.ai.knowledgedesk.domain.repository;

import com.flamingo.ai.knowledgedesk.domain.entity.IngestionRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the ingestion ledger. */
@Repository
public interface IngestionRecordRepository extends JpaRepository<IngestionRecord, UUID> {

  Optional<IngestionRecord> findByCollectionAndPath(String collection, String path);

  List<IngestionRecord> findByCollection(String collection);

  long countByCollection(String collection);
}
