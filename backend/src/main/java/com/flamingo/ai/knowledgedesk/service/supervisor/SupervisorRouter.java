package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.domain.enums.RouteState;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Decides which specialist answers a query and turns its result into one response.
 *
 * <p>Every query walks the {@link RouteState} machine. A confident, unambiguous classification is
 * dispatched; a low or tied one asks the user to choose. A failing specialist is retried once and
 * then replaced by the general specialist, as configured. If nothing succeeds the response says
 * so explicitly. In multi-agent mode every specialist above the confidence threshold is asked and
 * the answers are merged.
 */
@Service
@Slf4j
public class SupervisorRouter {

  private final QueryClassifier classifier;
  private final Map<SpecialistTag, Specialist> specialists = new EnumMap<>(SpecialistTag.class);
  private final AnswerMerger merger;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public SupervisorRouter(
      QueryClassifier classifier,
      List<Specialist> specialists,
      AnswerMerger merger,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.classifier = classifier;
    specialists.forEach(s -> this.specialists.put(s.tag(), s));
    this.merger = merger;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /** Routes a query and returns the synthesized answer or a clarification request. */
  @Timed(value = "router.route", description = "Time to route and answer a query")
  public RoutedAnswer route(RouteRequest request) {
    RouteTrace trace = new RouteTrace();
    Classification classification = classify(request);
    trace.moveTo(RouteState.CLASSIFIED);

    List<TagScore> targets = selectTargets(classification);
    if (targets.isEmpty()) {
      Clarification clarification = requestClarification(trace, classification);
      return new RoutedAnswer(
          trace.current(), trace.states(), classification, null, List.of(), clarification, false);
    }

    List<SpecialistOutcome> outcomes = new ArrayList<>();
    for (TagScore target : targets) {
      outcomes.add(dispatch(trace, target, targets, request.query(), Specialist::answer));
    }

    trace.moveTo(RouteState.SYNTHESIZED);
    boolean failed = outcomes.stream().noneMatch(SpecialistOutcome::succeeded);
    Answer answer = failed ? failureAnswer(targets.get(0).tag()) : merger.merge(outcomes);
    trace.moveTo(RouteState.RESPONDED);
    if (failed) {
      meterRegistry.counter("router.failed").increment();
    }
    return new RoutedAnswer(
        trace.current(),
        trace.states(),
        classification,
        answer,
        answeredBy(outcomes),
        null,
        failed);
  }

  /**
   * Streaming variant of {@link #route}. A single specialist streams its answer; merged multi-agent
   * answers are computed first and delivered as one fragment.
   *
   * <p>A single-specialist stream that fails before its first fragment is retried and then handed
   * to the general specialist under the same rules as {@link #route}; when those fail too the
   * stream ends with the failure message. Citations stay those of the first attempt. A failure
   * after fragments were delivered is passed on to the subscriber.
   */
  public RoutedStreamingAnswer routeStreaming(RouteRequest request) {
    RouteTrace trace = new RouteTrace();
    Classification classification = classify(request);
    trace.moveTo(RouteState.CLASSIFIED);

    List<TagScore> targets = selectTargets(classification);
    if (targets.isEmpty()) {
      Clarification clarification = requestClarification(trace, classification);
      return new RoutedStreamingAnswer(
          trace.current(), trace.states(), classification, null, List.of(), clarification, false);
    }

    StreamingAnswer answer;
    List<SpecialistOutcome> outcomes = new ArrayList<>();
    if (targets.size() == 1) {
      Dispatched<StreamingAnswer> streamed =
          attempt(trace, targets.get(0), targets, request.query(), Specialist::streamAnswer);
      outcomes.add(streamed.outcome(null));
      trace.moveTo(RouteState.SYNTHESIZED);
      answer =
          streamed.result() != null
              ? recoverable(streamed, targets, request.query())
              : StreamingAnswer.of(failureAnswer(targets.get(0).tag()));
    } else {
      for (TagScore target : targets) {
        outcomes.add(dispatch(trace, target, targets, request.query(), Specialist::answer));
      }
      trace.moveTo(RouteState.SYNTHESIZED);
      answer =
          outcomes.stream().anyMatch(SpecialistOutcome::succeeded)
              ? StreamingAnswer.of(merger.merge(outcomes))
              : StreamingAnswer.of(failureAnswer(targets.get(0).tag()));
    }
    trace.moveTo(RouteState.RESPONDED);
    boolean failed = outcomes.stream().noneMatch(SpecialistOutcome::succeeded);
    if (failed) {
      meterRegistry.counter("router.failed").increment();
    }
    return new RoutedStreamingAnswer(
        trace.current(),
        trace.states(),
        classification,
        answer,
        answeredBy(outcomes),
        null,
        failed);
  }

  private Classification classify(RouteRequest request) {
    if (request.chosenSpecialist() != null) {
      log.info("Routing to user-chosen specialist {}", request.chosenSpecialist());
      return Classification.chosenByUser(request.chosenSpecialist());
    }
    Classification classification = classifier.classify(request.query());
    log.info(
        "Classified query by {}: {}",
        classification.classifier(),
        classification.scores().stream()
            .map(s -> s.tag() + "=" + String.format("%.2f", s.confidence()))
            .collect(Collectors.joining(", ")));
    return classification;
  }

  /**
   * Specialists to dispatch to, best first. Empty when the classification is too weak or too
   * close to call.
   */
  List<TagScore> selectTargets(Classification classification) {
    RagConfig.Routing routing = ragConfig.getRouting();
    TagScore top = classification.top();
    if (top.confidence() < routing.getConfidenceThreshold()) {
      log.info("Top confidence {} below threshold, asking the user", top.confidence());
      return List.of();
    }
    List<TagScore> confident =
        classification.scores().stream()
            .filter(s -> s.confidence() >= routing.getConfidenceThreshold())
            .toList();
    if (routing.isMultiAgent()) {
      return confident;
    }
    TagScore runnerUp = classification.runnerUp();
    if (runnerUp != null && top.confidence() - runnerUp.confidence() < routing.getTieMargin()) {
      log.info("{} and {} are tied, asking the user", top.tag(), runnerUp.tag());
      return List.of();
    }
    return List.of(top);
  }

  private Clarification requestClarification(RouteTrace trace, Classification classification) {
    trace.moveTo(RouteState.CLARIFICATION_REQUESTED);
    meterRegistry.counter("router.clarification").increment();
    List<SpecialistTag> options = new ArrayList<>();
    classification.scores().stream()
        .filter(s -> s.confidence() > 0 && specialists.containsKey(s.tag()))
        .forEach(s -> options.add(s.tag()));
    specialists.keySet().stream().filter(tag -> !options.contains(tag)).forEach(options::add);
    String question =
        "I am not sure where to look for this. Should I search "
            + options.stream().map(SpecialistTag::displayName).collect(Collectors.joining(", "))
            + "?";
    trace.moveTo(RouteState.AWAITING_USER);
    return new Clarification(question, List.copyOf(options));
  }

  private SpecialistOutcome dispatch(
      RouteTrace trace,
      TagScore target,
      List<TagScore> allTargets,
      String query,
      BiFunction<Specialist, String, Answer> call) {
    Dispatched<Answer> dispatched = attempt(trace, target, allTargets, query, call);
    return dispatched.outcome(dispatched.result());
  }

  /**
   * Calls the target specialist, retrying once and then falling back to the general specialist
   * when configured. The general fallback is skipped if the general specialist is already one of
   * the targets.
   */
  private <T> Dispatched<T> attempt(
      RouteTrace trace,
      TagScore target,
      List<TagScore> allTargets,
      String query,
      BiFunction<Specialist, String, T> call) {
    RagConfig.Routing routing = ragConfig.getRouting();
    int attempts = routing.isRetryOnFailure() ? 2 : 1;
    RuntimeException lastError = null;
    for (int i = 1; i <= attempts; i++) {
      try {
        T result = invoke(trace, target.tag(), query, call);
        return new Dispatched<>(target, target.tag(), result, null);
      } catch (RuntimeException e) {
        lastError = e;
        log.warn(
            "{} specialist failed (attempt {}/{}): {}", target.tag(), i, attempts, e.getMessage());
      }
    }

    if (canFallBackToGeneral(target.tag(), allTargets)) {
      meterRegistry.counter("router.fallback").increment();
      log.info("Falling back from {} to the general specialist", target.tag());
      try {
        return new Dispatched<>(
            target, SpecialistTag.GENERAL, invoke(trace, SpecialistTag.GENERAL, query, call), null);
      } catch (RuntimeException e) {
        lastError = e;
        log.warn("General specialist failed as fallback: {}", e.getMessage());
      }
    }
    return new Dispatched<>(target, null, null, lastError);
  }

  private boolean canFallBackToGeneral(SpecialistTag failed, List<TagScore> allTargets) {
    boolean generalAlreadyAsked =
        allTargets.stream().anyMatch(t -> t.tag() == SpecialistTag.GENERAL);
    return ragConfig.getRouting().isFallbackToGeneral()
        && failed != SpecialistTag.GENERAL
        && !generalAlreadyAsked
        && specialists.containsKey(SpecialistTag.GENERAL);
  }

  private StreamingAnswer recoverable(
      Dispatched<StreamingAnswer> streamed, List<TagScore> allTargets, String query) {
    List<SpecialistTag> recovery = new ArrayList<>();
    if (ragConfig.getRouting().isRetryOnFailure()) {
      recovery.add(streamed.answeredBy());
    }
    if (canFallBackToGeneral(streamed.answeredBy(), allTargets)) {
      recovery.add(SpecialistTag.GENERAL);
    }
    StreamingAnswer first = streamed.result();
    return new StreamingAnswer(
        first.citations(),
        first.grounded(),
        withRecovery(first.fragments(), streamed.target().tag(), recovery, query));
  }

  /** Resumes a stream that failed before emitting anything with the next specialist in line. */
  private Flux<String> withRecovery(
      Flux<String> fragments, SpecialistTag requested, List<SpecialistTag> next, String query) {
    AtomicBoolean started = new AtomicBoolean();
    return fragments
        .doOnNext(fragment -> started.set(true))
        .onErrorResume(
            e -> !started.get(),
            e -> {
              log.warn("{} stream failed before its first fragment: {}", requested, e.getMessage());
              if (next.isEmpty()) {
                meterRegistry.counter("router.failed").increment();
                return Flux.just(failureAnswer(requested).text());
              }
              SpecialistTag tag = next.get(0);
              if (tag == SpecialistTag.GENERAL && requested != SpecialistTag.GENERAL) {
                meterRegistry.counter("router.fallback").increment();
                log.info("Falling back from {} to the general specialist", requested);
              }
              Flux<String> retried =
                  Flux.defer(() -> specialists.get(tag).streamAnswer(query).fragments());
              return withRecovery(retried, requested, next.subList(1, next.size()), query);
            });
  }

  private <T> T invoke(
      RouteTrace trace, SpecialistTag tag, String query, BiFunction<Specialist, String, T> call) {
    trace.moveTo(RouteState.DISPATCHED);
    try {
      Specialist specialist = specialists.get(tag);
      if (specialist == null) {
        throw new IllegalStateException("No specialist registered for " + tag);
      }
      T result = call.apply(specialist, query);
      trace.moveTo(RouteState.SPECIALIST_SUCCEEDED);
      return result;
    } catch (RuntimeException e) {
      trace.moveTo(RouteState.SPECIALIST_FAILED);
      throw e;
    }
  }

  private static Answer failureAnswer(SpecialistTag tag) {
    return new Answer(
        "Sorry, I could not get an answer from the "
            + tag.displayName()
            + " assistant right now. Please try again later.",
        List.of(),
        false);
  }

  private static List<SpecialistTag> answeredBy(List<SpecialistOutcome> outcomes) {
    return outcomes.stream()
        .filter(SpecialistOutcome::succeeded)
        .sorted(AnswerMerger.BY_CONFIDENCE)
        .map(SpecialistOutcome::answeredBy)
        .distinct()
        .toList();
  }

  private record Dispatched<T>(
      TagScore target, SpecialistTag answeredBy, T result, RuntimeException error) {

    SpecialistOutcome outcome(Answer answer) {
      return new SpecialistOutcome(target.tag(), answeredBy, target.confidence(), answer, error);
    }
  }
}
