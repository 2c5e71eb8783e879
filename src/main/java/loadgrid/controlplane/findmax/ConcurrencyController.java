package loadgrid.controlplane.findmax;

import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Step search for the highest concurrency a worker can hold.
 * <p>
 * Starts at {@code startConcurrency} and adds {@code concurrencyIncrement}
 * after every stable step, never going past {@code maxConcurrency}. The
 * first step sets the latency baseline. The search ends at the first
 * unstable step, at a stable step at the maximum, or when a stop is
 * requested. With {@code maxBackoffAttempts > 0} an instability first
 * triggers a backoff: the last stable level is re-run as a confirmation
 * ({@code is_backoff}) and the midpoint towards the failing level is probed.
 * <p>
 * One instance runs one search; it is not thread-safe.
 */
public class ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);

    private final FindMaxSettings settings;
    private final StabilityEvaluator evaluator;
    private final StepExecutor executor;
    private final Consumer<StepRecord> stepListener;
    private final BooleanSupplier stopRequested;

    private final List<StepRecord> steps = new ArrayList<>();
    private Double baselineP95;
    private Double baselineP99;

    public ConcurrencyController(FindMaxSettings settings, StabilityEvaluator evaluator, StepExecutor executor,
            Consumer<StepRecord> stepListener, BooleanSupplier stopRequested) {
        this.settings = settings;
        this.evaluator = evaluator;
        this.executor = executor;
        this.stepListener = stepListener;
        this.stopRequested = stopRequested;
    }

    public FindMaxResult run() throws InterruptedException {
        int current = settings.startConcurrency();
        int backoffAttempts = 0;
        StepRecord lastStable = null;
        String termination;

        while (true) {
            if (stopRequested.getAsBoolean()) {
                termination = FindMaxResult.STOPPED;
                break;
            }

            StepMeasurement m = executor.runStep(current, settings.stepDurationSeconds());
            if (stopRequested.getAsBoolean()) {
                // partial window, not a measurement of this level
                termination = FindMaxResult.STOPPED;
                break;
            }

            if (steps.isEmpty()) {
                baselineP95 = m.hasLatency() ? m.p95LatencyMs() : 0.0;
                baselineP99 = m.hasLatency() ? m.p99LatencyMs() : 0.0;
                log.info("Baseline at concurrency {}: p95={}ms p99={}ms", current, baselineP95, baselineP99);
            }

            StabilityVerdict verdict = evaluator.evaluate(m, baselineP95, baselineP99);

            if (verdict.stable()) {
                if (current >= settings.maxConcurrency()) {
                    lastStable = record(m.toStep(steps.size(), true, FindMaxResult.REACHED_MAX, false));
                    termination = FindMaxResult.REACHED_MAX;
                    break;
                }
                lastStable = record(m.toStep(steps.size(), true, null, false));
                current = Math.min(current + settings.concurrencyIncrement(), settings.maxConcurrency());
                continue;
            }

            record(m.toStep(steps.size(), false, verdict.reason(), false));
            termination = verdict.reason();

            if (lastStable == null || backoffAttempts >= settings.maxBackoffAttempts()) {
                break;
            }
            backoffAttempts++;
            int failedLevel = current;

            StepMeasurement confirm = executor.runStep(lastStable.concurrency(), settings.stepDurationSeconds());
            if (stopRequested.getAsBoolean()) {
                termination = FindMaxResult.STOPPED;
                break;
            }
            StabilityVerdict confirmVerdict = evaluator.evaluate(confirm, baselineP95, baselineP99);
            record(confirm.toStep(steps.size(), confirmVerdict.stable(), confirmVerdict.reason(), true));
            if (!confirmVerdict.stable()) {
                log.info("Backoff at {} did not hold, stopping", lastStable.concurrency());
                break;
            }

            int midpoint = (lastStable.concurrency() + failedLevel) / 2;
            if (midpoint <= lastStable.concurrency()) {
                break;
            }
            log.info("Backoff {}/{}: probing midpoint {} between {} and {}", backoffAttempts,
                    settings.maxBackoffAttempts(), midpoint, lastStable.concurrency(), failedLevel);
            current = midpoint;
        }

        int best = lastStable != null ? lastStable.concurrency() : 0;
        double bestQps = lastStable != null ? lastStable.qps() : 0.0;
        log.info("Find-max finished: best concurrency {} ({} qps), {} steps, reason: {}",
                best, String.format("%.1f", bestQps), steps.size(), termination);
        return new FindMaxResult(best, bestQps, baselineP95, baselineP99, termination, steps);
    }

    /** Steps recorded so far. */
    public List<StepRecord> steps() {
        return List.copyOf(steps);
    }

    private StepRecord record(StepRecord step) {
        steps.add(step);
        if (step.stable()) {
            log.info("Step {} at concurrency {}: stable (qps={}, p95={}ms)", step.stepIndex(), step.concurrency(),
                    String.format("%.1f", step.qps()), String.format("%.2f", step.p95LatencyMs()));
        } else {
            log.info("Step {} at concurrency {}: unstable{} - {}", step.stepIndex(), step.concurrency(),
                    step.backoff() ? " (backoff)" : "", step.stopReason());
        }
        stepListener.accept(step);
        return step;
    }
}
