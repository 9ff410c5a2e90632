package omni.sync.app.service.job;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.common.RetryPolicy;
import omni.sync.app.config.JobProperties;
import omni.sync.app.entity.Job;
import omni.sync.app.exception.AuthException;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.exception.MalformedPayloadException;
import omni.sync.app.exception.ProviderException;
import omni.sync.app.repository.JobRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the queue and executes jobs. A poll cycle claims at most {@code batchSize} jobs and
 * stops starting new ones once the cycle budget is spent. Jobs run sequentially unless
 * {@code concurrency > 1}; in both cases the atomic claim is the only coordination, so any
 * number of runners may poll the same table.
 * <p>
 * Failure handling:
 * <ul>
 *   <li>auth, payload and argument errors are terminal;</li>
 *   <li>provider errors follow their retryable flag;</li>
 *   <li>timeouts stay processing until the stale sweep re-queues them;</li>
 *   <li>anything else is retried with backoff until max attempts.</li>
 * </ul>
 */
@Slf4j
@Service
public class JobRunner {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobRepository jobRepository;
    private final JobDispatcher dispatcher;
    private final JobProperties properties;
    private final AsyncTaskExecutor handlerExecutor;
    private final AsyncTaskExecutor laneExecutor;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    public JobRunner(JobRepository jobRepository,
                     JobDispatcher dispatcher,
                     JobProperties properties,
                     @Qualifier("jobHandlerExecutor") AsyncTaskExecutor handlerExecutor,
                     @Qualifier("jobLaneExecutor") AsyncTaskExecutor laneExecutor,
                     Clock clock) {
        this.jobRepository = jobRepository;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.handlerExecutor = handlerExecutor;
        this.laneExecutor = laneExecutor;
        this.clock = clock;
        this.retryPolicy = properties.retryPolicy();
    }

    /**
     * Runs one poll cycle. Safe to call concurrently from several triggers.
     */
    public JobRunSummary runOnce() {
        Instant started = clock.instant();
        Instant deadline = started.plus(properties.getCycleBudget());
        List<Job> candidates = jobRepository.findRunnable(started, PageRequest.of(0, properties.getBatchSize()));
        if (candidates.isEmpty()) {
            log.debug("No runnable jobs");
            return JobRunSummary.empty();
        }
        log.info("Job runner cycle started with {} candidate jobs", candidates.size());

        Tally tally = new Tally();
        int lanes = Math.min(Math.max(1, properties.getConcurrency()), candidates.size());
        if (lanes == 1) {
            drain(new ConcurrentLinkedQueue<>(candidates), deadline, tally);
        } else {
            runInLanes(candidates, lanes, deadline, tally);
        }

        JobRunSummary summary = tally.toSummary();
        log.info("Job runner cycle finished: processed={} done={} error={} retried={} skipped={}",
                summary.processed(), summary.done(), summary.error(), summary.retried(), summary.skipped());
        return summary;
    }

    private void runInLanes(List<Job> candidates, int lanes, Instant deadline, Tally tally) {
        ConcurrentLinkedQueue<Job> queue = new ConcurrentLinkedQueue<>(candidates);
        List<Future<?>> futures = new ArrayList<>(lanes);
        for (int i = 0; i < lanes; i++) {
            futures.add(laneExecutor.submit(() -> drain(queue, deadline, tally)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for job lanes");
                return;
            } catch (ExecutionException e) {
                log.error("Job lane failed: {}", e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private void drain(ConcurrentLinkedQueue<Job> queue, Instant deadline, Tally tally) {
        boolean first = true;
        Job job;
        while ((job = queue.poll()) != null) {
            if (!clock.instant().isBefore(deadline)) {
                log.info("Cycle budget spent, leaving job {} and the rest for the next cycle", job.getId());
                return;
            }
            if (!first && !pause(properties.getInterJobDelay().toMillis())) {
                return;
            }
            first = false;
            process(job, tally);
        }
    }

    void process(Job job, Tally tally) {
        if (jobRepository.claim(job.getId(), job.getUserId(), clock.instant()) == 0) {
            log.debug("Job {} already claimed by another runner", job.getId());
            tally.skipped.incrementAndGet();
            return;
        }
        tally.processed.incrementAndGet();
        int attempts = jobRepository.findAttemptsById(job.getId()).orElse(job.getAttempts() + 1);
        log.info("Running {} job {} for user {} (attempt {}/{})",
                job.getKind().getWireName(), job.getId(), job.getUserId(), attempts, retryPolicy.getMaxAttempts());

        Future<JobResult> future = handlerExecutor.submit(() -> dispatcher.dispatch(job));
        try {
            JobResult result = future.get(properties.getJobTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (jobRepository.markDone(job.getId(), clock.instant()) == 0) {
                log.warn("Job {} finished but was no longer processing", job.getId());
            }
            tally.done.incrementAndGet();
            log.info("Job {} done: {}", job.getId(), result != null ? result.summary() : "");
        } catch (TimeoutException e) {
            future.cancel(true);
            timedOut(job, attempts, tally);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(job, attempts, describe(cause), isRetryable(cause), cause, tally);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            fail(job, attempts, "Runner interrupted", true, null, tally);
        }
    }

    /**
     * Cancelling does not stop a handler that ignores interrupts, so a timed out job is not
     * re-queued here. It stays processing and the stale sweep re-queues it once
     * {@code staleAfter} has passed, or it fails now when no attempt is left.
     */
    private void timedOut(Job job, int attempts, Tally tally) {
        String error = "Timed out after " + properties.getJobTimeout().toMillis() + " ms";
        if (!retryPolicy.canRetry(attempts)) {
            fail(job, attempts, error, false, null, tally);
            return;
        }
        jobRepository.markTimedOut(job.getId(), error, clock.instant());
        tally.retried.incrementAndGet();
        log.warn("Job {} timed out on attempt {}, left in processing for the stale sweep ({} minutes)",
                job.getId(), attempts, properties.getStaleAfter().toMinutes());
    }

    private void fail(Job job, int attempts, String error, boolean retryable, Throwable cause, Tally tally) {
        Instant now = clock.instant();
        String lastError = truncate(error);
        if (retryable && retryPolicy.canRetry(attempts)) {
            Instant runAfter = now.plusMillis(retryPolicy.delayMs(attempts - 1));
            jobRepository.markRetry(job.getId(), runAfter, lastError, now);
            tally.retried.incrementAndGet();
            log.warn("Job {} attempt {} failed, retrying after {}: {}", job.getId(), attempts, runAfter, error);
        } else {
            jobRepository.markError(job.getId(), lastError, now);
            tally.error.incrementAndGet();
            if (cause != null) {
                log.error("Job {} ({}) failed permanently after {} attempts: {}",
                        job.getId(), job.getKind().getWireName(), attempts, error, cause);
            } else {
                log.error("Job {} ({}) failed permanently after {} attempts: {}",
                        job.getId(), job.getKind().getWireName(), attempts, error);
            }
        }
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof AuthException
                || error instanceof JobPayloadException
                || error instanceof MalformedPayloadException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException) {
            return false;
        }
        if (error instanceof ProviderException) {
            return ((ProviderException) error).isRetryable();
        }
        return true;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String truncate(String value) {
        return value == null || value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static final class Tally {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger done = new AtomicInteger();
        final AtomicInteger error = new AtomicInteger();
        final AtomicInteger retried = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();

        JobRunSummary toSummary() {
            return new JobRunSummary(processed.get(), done.get(), error.get(), retried.get(), skipped.get());
        }
    }
}
