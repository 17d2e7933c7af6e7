package com.flamingo.ai.knowledgedesk.domain.repository;

import com.flamingo.ai.knowledgedesk.domain.entity.FollowUpCandidate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for pending and notified follow-up candidates. */
@Repository
public interface FollowUpCandidateRepository extends JpaRepository<FollowUpCandidate, UUID> {

  List<FollowUpCandidate> findByTicketKey(String ticketKey);

  Optional<FollowUpCandidate> findByTicketKeyAndCommentIdAndMentionedUser(
      String ticketKey, String commentId, String mentionedUser);
}
