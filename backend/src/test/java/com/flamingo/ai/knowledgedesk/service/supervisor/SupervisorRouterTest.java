package com.flamingo.ai.knowledgedesk.service.supervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.domain.enums.RouteState;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.exception.CompletionServiceException;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Citation;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@DisplayName("SupervisorRouter Tests")
class SupervisorRouterTest {

  private static final String QUERY = "How do I deploy the payment service?";

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private List<TagScore> scores;
  private StubSpecialist confluence;
  private StubSpecialist sharepoint;
  private StubSpecialist general;
  private SupervisorRouter router;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    confluence = new StubSpecialist(SpecialistTag.CONFLUENCE);
    sharepoint = new StubSpecialist(SpecialistTag.SHAREPOINT);
    general = new StubSpecialist(SpecialistTag.GENERAL);
    scores = List.of();
    QueryClassifier classifier = query -> new Classification(scores, "test");
    router =
        new SupervisorRouter(
            classifier,
            List.of(confluence, sharepoint, general),
            new AnswerMerger(),
            ragConfig,
            meterRegistry);
  }

  private static Answer grounded(String text, Citation... citations) {
    return new Answer(text, List.of(citations), true);
  }

  private static CompletionServiceException unavailable(int status) {
    return new CompletionServiceException("Chat completion returned HTTP " + status, null);
  }

  private static Citation citation(String collection, String path) {
    return new Citation(collection, path, path, null, 0.9);
  }

  @Nested
  @DisplayName("Dispatch")
  class Dispatch {

    @Test
    @DisplayName("should answer with the single confident specialist")
    void shouldDispatchToTopSpecialist_whenConfidentAndClear() {
      scores =
          List.of(
              new TagScore(SpecialistTag.CONFLUENCE, 0.8),
              new TagScore(SpecialistTag.SHAREPOINT, 0.6),
              new TagScore(SpecialistTag.GENERAL, 0.3));
      confluence.answers(grounded("Use the deploy pipeline.", citation("tech", "deploy.md")));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(routed.finalState()).isEqualTo(RouteState.RESPONDED);
      assertThat(routed.trace())
          .containsExactly(
              RouteState.RECEIVED,
              RouteState.CLASSIFIED,
              RouteState.DISPATCHED,
              RouteState.SPECIALIST_SUCCEEDED,
              RouteState.SYNTHESIZED,
              RouteState.RESPONDED);
      assertThat(routed.answer().text()).isEqualTo("Use the deploy pipeline.");
      assertThat(routed.answeredBy()).containsExactly(SpecialistTag.CONFLUENCE);
      assertThat(routed.failed()).isFalse();
      assertThat(routed.clarification()).isNull();
      assertThat(sharepoint.calls).isZero();
    }

    @Test
    @DisplayName("should skip classification when the user picked a specialist")
    void shouldUseChosenSpecialist_whenRequestIsClarified() {
      sharepoint.answers(grounded("Approval needs two signatures."));

      RoutedAnswer routed =
          router.route(
              RouteRequest.of("Who approves refunds?").clarified(SpecialistTag.SHAREPOINT));

      assertThat(routed.classification().classifier()).isEqualTo("user");
      assertThat(routed.answeredBy()).containsExactly(SpecialistTag.SHAREPOINT);
      assertThat(routed.answer().text()).isEqualTo("Approval needs two signatures.");
    }

    @Test
    @DisplayName("should retry a failing specialist once")
    void shouldRetryOnce_whenSpecialistFails() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence
          .fails(unavailable(503))
          .answers(grounded("Second time lucky."));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(confluence.calls).isEqualTo(2);
      assertThat(routed.trace())
          .containsExactly(
              RouteState.RECEIVED,
              RouteState.CLASSIFIED,
              RouteState.DISPATCHED,
              RouteState.SPECIALIST_FAILED,
              RouteState.DISPATCHED,
              RouteState.SPECIALIST_SUCCEEDED,
              RouteState.SYNTHESIZED,
              RouteState.RESPONDED);
      assertThat(routed.answeredBy()).containsExactly(SpecialistTag.CONFLUENCE);
      assertThat(general.calls).isZero();
    }

    @Test
    @DisplayName("should fall back to the general specialist after the retry fails")
    void shouldFallBackToGeneral_whenRetryFails() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.fails(unavailable(503));
      general.answers(grounded("Found it in the general docs."));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(confluence.calls).isEqualTo(2);
      assertThat(general.calls).isEqualTo(1);
      assertThat(routed.answeredBy()).containsExactly(SpecialistTag.GENERAL);
      assertThat(routed.answer().text()).isEqualTo("Found it in the general docs.");
      assertThat(routed.failed()).isFalse();
      assertThat(meterRegistry.counter("router.fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should respond with an explicit failure when nothing succeeds")
    void shouldRespondWithFailure_whenFallbackAlsoFails() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.fails(unavailable(503));
      general.fails(new IllegalStateException("index unavailable"));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(routed.finalState()).isEqualTo(RouteState.RESPONDED);
      assertThat(routed.failed()).isTrue();
      assertThat(routed.answer().grounded()).isFalse();
      assertThat(routed.answer().text())
          .startsWith("Sorry, I could not get an answer from the Confluence assistant");
      assertThat(routed.answeredBy()).isEmpty();
      assertThat(meterRegistry.counter("router.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should call once and fail when retry and fallback are disabled")
    void shouldFailImmediately_whenRetryAndFallbackDisabled() {
      ragConfig.getRouting().setRetryOnFailure(false);
      ragConfig.getRouting().setFallbackToGeneral(false);
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.fails(unavailable(503));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(confluence.calls).isEqualTo(1);
      assertThat(general.calls).isZero();
      assertThat(routed.failed()).isTrue();
    }
  }

  @Nested
  @DisplayName("Clarification")
  class ClarificationRequests {

    @Test
    @DisplayName("should ask the user when the top confidence is below the threshold")
    void shouldAskUser_whenConfidenceLow() {
      scores =
          List.of(
              new TagScore(SpecialistTag.SHAREPOINT, 0.4),
              new TagScore(SpecialistTag.GENERAL, 0.3),
              new TagScore(SpecialistTag.CONFLUENCE, 0.0));

      RoutedAnswer routed = router.route(RouteRequest.of("What about it?"));

      assertThat(routed.awaitingUser()).isTrue();
      assertThat(routed.trace())
          .containsExactly(
              RouteState.RECEIVED,
              RouteState.CLASSIFIED,
              RouteState.CLARIFICATION_REQUESTED,
              RouteState.AWAITING_USER);
      assertThat(routed.answer()).isNull();
      assertThat(routed.clarification().options())
          .containsExactly(
              SpecialistTag.SHAREPOINT, SpecialistTag.GENERAL, SpecialistTag.CONFLUENCE);
      assertThat(routed.clarification().question())
          .isEqualTo(
              "I am not sure where to look for this. Should I search Sharepoint, General,"
                  + " Confluence?");
      assertThat(confluence.calls + sharepoint.calls + general.calls).isZero();
      assertThat(meterRegistry.counter("router.clarification").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should ask the user when the two best candidates are tied")
    void shouldAskUser_whenTopTwoWithinTieMargin() {
      scores =
          List.of(
              new TagScore(SpecialistTag.CONFLUENCE, 0.7),
              new TagScore(SpecialistTag.SHAREPOINT, 0.65));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(routed.awaitingUser()).isTrue();
      assertThat(routed.clarification().options())
          .startsWith(SpecialistTag.CONFLUENCE, SpecialistTag.SHAREPOINT);
    }

    @Test
    @DisplayName("should not treat a clear lead as a tie")
    void shouldSelectTop_whenLeadExceedsTieMargin() {
      Classification classification =
          new Classification(
              List.of(
                  new TagScore(SpecialistTag.CONFLUENCE, 0.8),
                  new TagScore(SpecialistTag.SHAREPOINT, 0.6)),
              "test");

      assertThat(router.selectTargets(classification))
          .extracting(TagScore::tag)
          .containsExactly(SpecialistTag.CONFLUENCE);
    }
  }

  @Nested
  @DisplayName("Multi-agent")
  class MultiAgent {

    @BeforeEach
    void enableMultiAgent() {
      ragConfig.getRouting().setMultiAgent(true);
    }

    @Test
    @DisplayName("should merge answers of every confident specialist")
    void shouldMergeAnswers_whenSeveralSpecialistsConfident() {
      scores =
          List.of(
              new TagScore(SpecialistTag.SHAREPOINT, 0.6),
              new TagScore(SpecialistTag.CONFLUENCE, 0.8),
              new TagScore(SpecialistTag.GENERAL, 0.3));
      confluence.answers(
          grounded("Deploy with Helm.", citation("tech", "deploy.md"), citation("all", "faq.md")));
      sharepoint.answers(
          grounded("Deployments need a change ticket.", citation("all", "faq.md")));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(routed.answeredBy())
          .containsExactly(SpecialistTag.CONFLUENCE, SpecialistTag.SHAREPOINT);
      assertThat(routed.answer().text())
          .isEqualTo(
              "**Confluence**\nDeploy with Helm.\n\n**Sharepoint**\nDeployments need a change"
                  + " ticket.");
      assertThat(routed.answer().citations())
          .extracting(Citation::documentKey)
          .containsExactly("tech:deploy.md", "all:faq.md");
      assertThat(general.calls).isZero();
    }

    @Test
    @DisplayName("should keep the surviving answer when one specialist fails")
    void shouldUseRemainingAnswer_whenOneSpecialistFails() {
      ragConfig.getRouting().setFallbackToGeneral(false);
      scores =
          List.of(
              new TagScore(SpecialistTag.CONFLUENCE, 0.8),
              new TagScore(SpecialistTag.SHAREPOINT, 0.6));
      confluence.fails(unavailable(500));
      sharepoint.answers(grounded("Ask the finance team."));

      RoutedAnswer routed = router.route(RouteRequest.of(QUERY));

      assertThat(routed.failed()).isFalse();
      assertThat(routed.answeredBy()).containsExactly(SpecialistTag.SHAREPOINT);
      assertThat(routed.answer().text()).isEqualTo("Ask the finance team.");
    }
  }

  @Nested
  @DisplayName("Streaming")
  class Streaming {

    @Test
    @DisplayName("should stream the single specialist's fragments")
    void shouldStreamFragments_whenSingleSpecialist() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.answers(grounded("Use the pipeline.", citation("tech", "deploy.md")));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      assertThat(routed.finalState()).isEqualTo(RouteState.RESPONDED);
      assertThat(routed.answer().citations()).hasSize(1);
      StepVerifier.create(routed.answer().fragments())
          .expectNext("Use ", "the ", "pipeline.")
          .verifyComplete();
    }

    @Test
    @DisplayName("should stream a failure message when every attempt fails")
    void shouldStreamFailure_whenEverythingFails() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.fails(unavailable(503));
      general.fails(unavailable(503));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      assertThat(routed.failed()).isTrue();
      StepVerifier.create(routed.answer().fragments())
          .assertNext(text -> assertThat(text).startsWith("Sorry"))
          .verifyComplete();
    }

    @Test
    @DisplayName("should fall back to the general stream when the completion stream fails")
    void shouldFallBackToGeneralStream_whenStreamFailsBeforeFirstFragment() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.streamFails(unavailable(503));
      general.answers(grounded("Found it in the general docs."));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      StepVerifier.create(routed.answer().fragments())
          .expectNext("Found ", "it ", "in ", "the ", "general ", "docs.")
          .verifyComplete();
      assertThat(confluence.calls).isEqualTo(2);
      assertThat(general.calls).isEqualTo(1);
      assertThat(meterRegistry.counter("router.fallback").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("router.failed").count()).isZero();
    }

    @Test
    @DisplayName("should retry a failed completion stream before falling back")
    void shouldRetryStream_whenFirstStreamFails() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.streamFails(unavailable(503)).answers(grounded("Second time lucky."));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      StepVerifier.create(routed.answer().fragments())
          .expectNext("Second ", "time ", "lucky.")
          .verifyComplete();
      assertThat(confluence.calls).isEqualTo(2);
      assertThat(general.calls).isZero();
    }

    @Test
    @DisplayName("should end with the failure message when every stream fails")
    void shouldStreamFailureMessage_whenRecoveryStreamsFail() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.9));
      confluence.streamFails(unavailable(503));
      general.streamFails(unavailable(502));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      StepVerifier.create(routed.answer().fragments())
          .assertNext(
              text ->
                  assertThat(text)
                      .startsWith("Sorry, I could not get an answer from the Confluence assistant"))
          .verifyComplete();
      assertThat(meterRegistry.counter("router.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return a clarification without a stream")
    void shouldRequestClarification_whenStreamingAndConfidenceLow() {
      scores = List.of(new TagScore(SpecialistTag.CONFLUENCE, 0.2));

      RoutedStreamingAnswer routed = router.routeStreaming(RouteRequest.of(QUERY));

      assertThat(routed.awaitingUser()).isTrue();
      assertThat(routed.answer()).isNull();
    }
  }

  @Test
  @DisplayName("should reject a blank query")
  void shouldRejectBlankQuery() {
    assertThatThrownBy(() -> RouteRequest.of(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  /** A failure raised by the fragment stream rather than by the call that creates it. */
  private record StreamFailure(RuntimeException error) {}

  /** Replays scripted answers and failures; the last step repeats. */
  private static final class StubSpecialist implements Specialist {

    private final SpecialistTag tag;
    private final Deque<Object> script = new ArrayDeque<>();
    private int calls;

    StubSpecialist(SpecialistTag tag) {
      this.tag = tag;
    }

    StubSpecialist answers(Answer answer) {
      script.add(answer);
      return this;
    }

    StubSpecialist fails(RuntimeException error) {
      script.add(error);
      return this;
    }

    StubSpecialist streamFails(RuntimeException error) {
      script.add(new StreamFailure(error));
      return this;
    }

    private Object next() {
      calls++;
      Object next = script.size() > 1 ? script.poll() : script.peek();
      if (next instanceof RuntimeException) {
        throw (RuntimeException) next;
      }
      if (next == null) {
        throw new IllegalStateException("No scripted answer for " + tag);
      }
      return next;
    }

    @Override
    public SpecialistTag tag() {
      return tag;
    }

    @Override
    public double classifyRelevance(String query) {
      return 0.0;
    }

    @Override
    public Answer answer(String query) {
      Object next = next();
      if (next instanceof StreamFailure) {
        throw ((StreamFailure) next).error();
      }
      return (Answer) next;
    }

    @Override
    public StreamingAnswer streamAnswer(String query) {
      Object next = next();
      if (next instanceof StreamFailure) {
        return new StreamingAnswer(List.of(), false, Flux.error(((StreamFailure) next).error()));
      }
      Answer answer = (Answer) next;
      return new StreamingAnswer(
          answer.citations(),
          answer.grounded(),
          Flux.fromArray(answer.text().split("(?<= )")));
    }
  }
}
