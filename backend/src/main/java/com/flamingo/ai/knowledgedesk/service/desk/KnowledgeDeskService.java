package com.flamingo.ai.knowledgedesk.service.desk;

import com.flamingo.ai.knowledgedesk.service.ingestion.IngestionReport;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalQuery;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import com.flamingo.ai.knowledgedesk.service.supervisor.RouteRequest;
import com.flamingo.ai.knowledgedesk.service.supervisor.RoutedAnswer;
import com.flamingo.ai.knowledgedesk.service.supervisor.RoutedStreamingAnswer;
import com.flamingo.ai.knowledgedesk.service.tracker.followup.FollowUpScan;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.GroupProgressReport;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.ProgressReport;
import java.time.Instant;
import java.util.List;

/** Operations offered to an HTTP, chat or CLI front end. */
public interface KnowledgeDeskService {

  /**
   * Syncs a configured collection with its source.
   *
   * @throws com.flamingo.ai.knowledgedesk.exception.UnknownCollectionException if not configured
   * @throws com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException if a sync of
   *     the collection is in progress
   */
  IngestionReport triggerIngest(String collection);

  Answer ask(RetrievalQuery query);

  StreamingAnswer askStreaming(RetrievalQuery query);

  RoutedAnswer routeQuery(RouteRequest request);

  RoutedStreamingAnswer routeQueryStreaming(RouteRequest request);

  ProgressReport getProgressReport(String ticketKey);

  GroupProgressReport getGroupProgressReport(List<String> ticketKeys, Instant from, Instant to);

  /** Updates the follow-up candidates of a ticket and returns reminder drafts for stale ones. */
  FollowUpScan scanFollowUps(String ticketKey);

  /**
   * Posts reminders for the ticket's stale questions.
   *
   * @return number of reminders posted
   */
  int sendFollowUpReminders(String ticketKey);
}
