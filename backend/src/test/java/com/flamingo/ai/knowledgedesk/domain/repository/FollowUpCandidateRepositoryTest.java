package com.flamingo.ai.knowledgedesk.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgedesk.domain.entity.FollowUpCandidate;
import com.flamingo.ai.knowledgedesk.domain.entity.IngestionRecord;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("Ledger and follow-up repository Tests")
class FollowUpCandidateRepositoryTest {

  private static final Instant ASKED_AT = Instant.parse("2026-03-02T09:00:00.123Z");

  @Autowired private TestEntityManager entityManager;
  @Autowired private FollowUpCandidateRepository candidateRepository;
  @Autowired private IngestionRecordRepository recordRepository;

  @Test
  @DisplayName("should find candidates by ticket and keep instants exact")
  void shouldRoundTripCandidate() {
    FollowUpCandidate saved =
        candidateRepository.save(
            FollowUpCandidate.builder()
                .ticketKey("PAY-42")
                .commentId("100")
                .mentionedUser("alice")
                .askedBy("bob")
                .askedAt(ASKED_AT)
                .firstSeenAt(ASKED_AT.plusSeconds(3600))
                .build());
    entityManager.flush();
    entityManager.clear();

    assertThat(candidateRepository.findByTicketKey("PAY-42"))
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.getId()).isEqualTo(saved.getId());
              assertThat(c.getAskedAt()).isEqualTo(ASKED_AT);
              assertThat(c.isNotified()).isFalse();
              assertThat(c.getNotifiedAt()).isNull();
            });
    assertThat(
            candidateRepository.findByTicketKeyAndCommentIdAndMentionedUser(
                "PAY-42", "100", "alice"))
        .isPresent();
    assertThat(candidateRepository.findByTicketKey("PAY-7")).isEmpty();
  }

  @Test
  @DisplayName("should look up ledger entries by collection and path")
  void shouldFindIngestionRecords() {
    recordRepository.save(record("tech-docs", "guide/install.md"));
    recordRepository.save(record("tech-docs", "guide/upgrade.md"));
    recordRepository.save(record("functional-docs", "guide/install.md"));
    entityManager.flush();
    entityManager.clear();

    assertThat(recordRepository.findByCollectionAndPath("tech-docs", "guide/install.md"))
        .hasValueSatisfying(
            r -> {
              assertThat(r.getVersion()).isEqualTo(3);
              assertThat(r.getLastSuccessAt()).isEqualTo(ASKED_AT);
            });
    assertThat(recordRepository.findByCollection("tech-docs")).hasSize(2);
    assertThat(recordRepository.countByCollection("functional-docs")).isEqualTo(1);
  }

  private static IngestionRecord record(String collection, String path) {
    return IngestionRecord.builder()
        .collection(collection)
        .path(path)
        .contentHash("ab".repeat(32))
        .version(3)
        .lastSuccessAt(ASKED_AT)
        .lastAttemptAt(ASKED_AT)
        .build();
  }
}
