package com.flamingo.ai.knowledgedesk.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Ledger entry for one source document of a collection. */
@Entity
@Table(
    name = "ingestion_records",
    uniqueConstraints = @UniqueConstraint(columnNames = {"collection", "path"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String collection;

  @Column(nullable = false, length = 1024)
  private String path;

  /** SHA-256 of the fetched content, hex encoded. */
  @Column(nullable = false, length = 64)
  private String contentHash;

  @Column(nullable = false)
  private long version;

  private Instant sourceModifiedAt;

  private Instant lastSuccessAt;

  private Instant lastAttemptAt;

  /** Error of the most recent failed attempt; cleared on success. */
  @Column(columnDefinition = "TEXT")
  private String lastError;

  /** Records a successful replace of the document's chunks. */
  public void markIngested(String contentHash, long version, Instant modifiedAt, Instant now) {
    this.contentHash = contentHash;
    this.version = version;
    this.sourceModifiedAt = modifiedAt;
    this.lastSuccessAt = now;
    this.lastAttemptAt = now;
    this.lastError = null;
  }

  /** Records a failed attempt without touching the ingested version. */
  public void markFailed(String error, Instant now) {
    this.lastError = error;
    this.lastAttemptAt = now;
  }
}
