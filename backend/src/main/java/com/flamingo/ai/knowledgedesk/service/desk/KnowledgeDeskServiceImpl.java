package com.flamingo.ai.knowledgedesk.service.desk;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.service.ingestion.IngestionPipeline;
import com.flamingo.ai.knowledgedesk.service.ingestion.IngestionReport;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalQuery;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalService;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import com.flamingo.ai.knowledgedesk.service.supervisor.RouteRequest;
import com.flamingo.ai.knowledgedesk.service.supervisor.RoutedAnswer;
import com.flamingo.ai.knowledgedesk.service.supervisor.RoutedStreamingAnswer;
import com.flamingo.ai.knowledgedesk.service.supervisor.SupervisorRouter;
import com.flamingo.ai.knowledgedesk.service.tracker.TicketTracker;
import com.flamingo.ai.knowledgedesk.service.tracker.followup.FollowUpNotifier;
import com.flamingo.ai.knowledgedesk.service.tracker.followup.FollowUpScan;
import com.flamingo.ai.knowledgedesk.service.tracker.followup.FollowUpService;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.ChangelogAnalyzer;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.GroupProgressReport;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.ProgressReport;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeDeskServiceImpl implements KnowledgeDeskService {

  private final IngestionPipeline ingestionPipeline;
  private final RetrievalService retrievalService;
  private final SupervisorRouter supervisorRouter;
  private final TicketTracker ticketTracker;
  private final ChangelogAnalyzer changelogAnalyzer;
  private final FollowUpService followUpService;
  private final FollowUpNotifier followUpNotifier;
  private final TrackerConfig trackerConfig;

  @Override
  public IngestionReport triggerIngest(String collection) {
    log.info("Ingestion of {} requested", collection);
    return ingestionPipeline.sync(collection);
  }

  @Override
  public Answer ask(RetrievalQuery query) {
    return retrievalService.answer(query);
  }

  @Override
  public StreamingAnswer askStreaming(RetrievalQuery query) {
    return retrievalService.streamAnswer(query);
  }

  @Override
  public RoutedAnswer routeQuery(RouteRequest request) {
    return supervisorRouter.route(request);
  }

  @Override
  public RoutedStreamingAnswer routeQueryStreaming(RouteRequest request) {
    return supervisorRouter.routeStreaming(request);
  }

  @Override
  public ProgressReport getProgressReport(String ticketKey) {
    return changelogAnalyzer.analyze(ticketTracker.fetchTicket(ticketKey));
  }

  @Override
  public GroupProgressReport getGroupProgressReport(
      List<String> ticketKeys, Instant from, Instant to) {
    List<Ticket> tickets = ticketKeys.stream().map(ticketTracker::fetchTicket).toList();
    return changelogAnalyzer.analyzeGroup(tickets, from, to);
  }

  @Override
  public FollowUpScan scanFollowUps(String ticketKey) {
    Ticket ticket = ticketTracker.fetchTicket(ticketKey);
    return followUpService.scan(ticket, trackerConfig.getFollowUp().getStalenessWindow());
  }

  @Override
  public int sendFollowUpReminders(String ticketKey) {
    return followUpNotifier.sendReminders(ticketKey);
  }
}
