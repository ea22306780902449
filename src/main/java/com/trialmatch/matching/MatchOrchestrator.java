package com.trialmatch.matching;

import com.trialmatch.error.ParseFailureException;
import com.trialmatch.error.ProviderUnavailableException;
import com.trialmatch.error.RegistryUnavailableException;
import com.trialmatch.error.ValidationFailureException;
import com.trialmatch.model.MatchReport;
import com.trialmatch.model.MatchResult;
import com.trialmatch.model.PatientRecord;
import com.trialmatch.model.Trial;
import com.trialmatch.model.TrialFailure;
import com.trialmatch.registry.TrialRegistryClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives registry search, prompt formatting, reasoning and parsing for a patient.
 *
 * <p>Per-trial reasoning runs on a fixed worker pool shared by every request, so the pool size
 * is the global cap on concurrent provider calls. A trial whose call fails or whose reply cannot
 * be parsed is reported as a {@link TrialFailure} and left out of the ranking; the rest of the
 * batch is unaffected. Results are ordered by score, never by completion order.
 */
public final class MatchOrchestrator implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(MatchOrchestrator.class);
    public static final int MAX_TRIALS_LIMIT = 50;

    private static final Comparator<MatchResult> RANKING = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparing(MatchResult::trialId);

    private final TrialRegistryClient registry;
    private final CriteriaFormatter formatter;
    private final ReasoningProvider provider;
    private final MatchResponseParser parser;
    private final Duration defaultDeadline;
    private final ExecutorService pool;
    private final ExecutorService searchPool;

    public MatchOrchestrator(
            TrialRegistryClient registry,
            CriteriaFormatter formatter,
            ReasoningProvider provider,
            MatchResponseParser parser,
            int concurrency,
            Duration defaultDeadline
    ) {
        this.registry = registry;
        this.formatter = formatter;
        this.provider = provider;
        this.parser = parser;
        this.defaultDeadline = defaultDeadline;
        this.pool = Executors.newFixedThreadPool(Math.max(1, concurrency), workerFactory("match-worker-"));
        this.searchPool = Executors.newCachedThreadPool(workerFactory("match-search-"));
    }

    /**
     * Same as {@link #match(PatientRecord, String, int, double, Duration)} with the configured deadline.
     */
    public MatchReport match(PatientRecord patient, String condition, int maxTrials, double minScore) {
        return match(patient, condition, maxTrials, minScore, defaultDeadline);
    }

    /**
     * Ranks candidate trials for {@code condition} by match score, keeping those at or above {@code minScore}.
     * When {@code deadline} passes, unfinished trials are abandoned and reported as
     * {@link TrialFailure.Kind#DEADLINE_EXCEEDED}; completed results are still returned.
     *
     * @throws ValidationFailureException for malformed input, before any network call
     * @throws RegistryUnavailableException when the candidate search fails or outlives the deadline
     * @throws ProviderUnavailableException when candidates exist but none could be scored
     */
    public MatchReport match(PatientRecord patient, String condition, int maxTrials, double minScore, Duration deadline) {
        if (patient == null) {
            throw new ValidationFailureException("patient", "is required");
        }
        if (condition == null || condition.isBlank()) {
            throw new ValidationFailureException("condition", "is required");
        }
        if (maxTrials < 1 || maxTrials > MAX_TRIALS_LIMIT) {
            throw new ValidationFailureException("max_trials", "must be between 1 and " + MAX_TRIALS_LIMIT + ", got " + maxTrials);
        }
        if (!(minScore >= 0.0 && minScore <= 1.0)) {
            throw new ValidationFailureException("min_score", "must be within [0, 1], got " + minScore);
        }

        long deadlineNanos = System.nanoTime() + (deadline == null ? defaultDeadline : deadline).toNanos();
        List<Trial> candidates = searchWithin(condition, maxTrials, deadlineNanos);
        if (candidates.size() > maxTrials) {
            candidates = candidates.subList(0, maxTrials);
        }
        if (candidates.isEmpty()) {
            LOG.info("no candidate trials for condition='{}'", condition.trim());
            return new MatchReport(condition.trim(), 0, List.of(), List.of(), 0);
        }

        CompletionService<MatchResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<MatchResult>, Trial> pending = new IdentityHashMap<>();
        for (Trial trial : candidates) {
            pending.put(completion.submit(() -> evaluate(patient, trial)), trial);
        }

        List<MatchResult> scored = new ArrayList<>(candidates.size());
        List<TrialFailure> failures = new ArrayList<>();
        boolean deadlineHit = false;
        try {
            while (!pending.isEmpty()) {
                long remaining = deadlineNanos - System.nanoTime();
                Future<MatchResult> done = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (done == null) {
                    deadlineHit = true;
                    break;
                }
                Trial trial = pending.remove(done);
                collect(done, trial, scored, failures);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadlineHit = true;
        }
        if (deadlineHit) {
            for (Map.Entry<Future<MatchResult>, Trial> left : pending.entrySet()) {
                left.getKey().cancel(true);
                failures.add(new TrialFailure(left.getValue().id, TrialFailure.Kind.DEADLINE_EXCEEDED, "abandoned at request deadline"));
            }
            LOG.warn("match deadline reached condition='{}' abandoned={}", condition.trim(), pending.size());
        }

        if (scored.isEmpty() && !deadlineHit) {
            throw new ProviderUnavailableException(provider.name(),
                    "0 of " + candidates.size() + " trials could be evaluated; first failure: " + failures.get(0).message());
        }

        scored.sort(RANKING);
        List<MatchResult> ranked = new ArrayList<>(scored.size());
        for (MatchResult result : scored) {
            if (result.score() >= minScore) {
                ranked.add(result);
            }
        }
        MatchReport report = new MatchReport(condition.trim(), candidates.size(), ranked, failures, scored.size() - ranked.size());
        LOG.info("match complete {}", report.summary());
        return report;
    }

    /**
     * Matches one trial by identifier through the same pipeline, on the caller's thread.
     * Provider and parse failures propagate to the caller.
     */
    public MatchResult matchOne(PatientRecord patient, String trialId) {
        if (patient == null) {
            throw new ValidationFailureException("patient", "is required");
        }
        if (trialId == null || trialId.isBlank()) {
            throw new ValidationFailureException("trial_id", "is required");
        }
        Trial trial = registry.getById(trialId.trim());
        return evaluate(patient, trial);
    }

    private List<Trial> searchWithin(String condition, int maxTrials, long deadlineNanos) {
        Future<List<Trial>> search = searchPool.submit(() -> registry.search(condition, maxTrials));
        try {
            return search.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            search.cancel(true);
            LOG.warn("registry search outlived match deadline condition='{}'", condition.trim());
            throw new RegistryUnavailableException("registry search did not finish before the match deadline", e);
        } catch (InterruptedException e) {
            search.cancel(true);
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("interrupted while searching the registry", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RegistryUnavailableException("registry search failed: " + cause.getMessage(), cause);
        }
    }

    private MatchResult evaluate(PatientRecord patient, Trial trial) {
        String prompt = formatter.format(patient, trial);
        String raw = provider.execute(prompt);
        MatchResult result;
        try {
            result = parser.parse(trial, raw, provider.name());
        } catch (ParseFailureException e) {
            LOG.warn("unparseable reply trial={} provider={} reply='{}'", trial.id, provider.name(), e.rawExcerpt());
            throw e;
        }
        LOG.info("trial={} score={} eligible={} provider={}",
                trial.id, String.format(Locale.ROOT, "%.2f", result.score()), result.eligible(), provider.name());
        return result;
    }

    private void collect(Future<MatchResult> done, Trial trial, List<MatchResult> scored, List<TrialFailure> failures)
            throws InterruptedException {
        try {
            scored.add(done.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            TrialFailure.Kind kind = cause instanceof ParseFailureException
                    ? TrialFailure.Kind.PARSE_FAILURE
                    : TrialFailure.Kind.PROVIDER_UNAVAILABLE;
            if (!(cause instanceof ParseFailureException) && !(cause instanceof ProviderUnavailableException)) {
                LOG.error("unexpected failure evaluating trial={}", trial.id, cause);
            } else {
                LOG.warn("trial={} not evaluated kind={} err={}", trial.id, kind, cause.getMessage());
            }
            failures.add(new TrialFailure(trial.id, kind, cause.getMessage()));
        }
    }

    private static ThreadFactory workerFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        pool.shutdownNow();
        searchPool.shutdownNow();
    }
}
