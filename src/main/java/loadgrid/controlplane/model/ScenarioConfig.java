package loadgrid.controlplane.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Plan of a single run. Written to {@code run_status.scenario_config} at run creation
 * so every worker loads the same settings from the store.
 */
public record ScenarioConfig(
        int workerCount,
        int minWorkers,
        DeadWorkerPolicy deadWorkerPolicy,
        LoadMode loadMode,
        int concurrency,
        Integer perWorkerCap,
        double warmupSeconds,
        double durationSeconds,
        long thinkTimeMs,
        long operationsPerTask,
        int connectionPoolSize,
        Map<OperationKind, Double> operationMix,
        FindMaxSettings findMax,
        QpsSettings qps,
        Map<OperationKind, KindSlo> slos) {

    public ScenarioConfig {
        operationMix = operationMix == null || operationMix.isEmpty()
                ? Map.of(OperationKind.POINT_LOOKUP, 100.0)
                : Collections.unmodifiableMap(new EnumMap<>(operationMix));
        slos = slos == null || slos.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(slos));
        findMax = findMax == null ? FindMaxSettings.defaults() : findMax;
        qps = qps == null ? QpsSettings.defaults() : qps;
        deadWorkerPolicy = deadWorkerPolicy == null ? DeadWorkerPolicy.FAIL_RUN : deadWorkerPolicy;
        loadMode = loadMode == null ? LoadMode.FIND_MAX : loadMode;
    }

    /** Phase the orchestrator sets when the run starts. */
    public RunPhase initialPhase() {
        return warmupSeconds > 0 ? RunPhase.WARMUP : RunPhase.RUNNING;
    }

    /** Highest concurrency a single worker will ever ask for. */
    public int peakWorkerConcurrency() {
        if (loadMode == LoadMode.FIND_MAX) {
            return findMax.maxConcurrency();
        }
        if (loadMode == LoadMode.QPS) {
            return qps.maxConcurrency();
        }
        int share = (int) Math.ceil(concurrency / (double) workerCount);
        return perWorkerCap != null && perWorkerCap > 0 ? Math.min(share, perWorkerCap) : share;
    }

    /** One worker's share of the run's target QPS. */
    public double workerTargetQps() {
        return qps.targetQps() / workerCount;
    }

    /** Connection ceiling per worker: the configured size, or the peak concurrency if unset. */
    public int effectiveConnectionPoolSize() {
        return connectionPoolSize > 0 ? connectionPoolSize : Math.max(1, peakWorkerConcurrency());
    }

    public void validate() {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        if (minWorkers <= 0 || minWorkers > workerCount) {
            throw new IllegalArgumentException("minWorkers must be between 1 and workerCount");
        }
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must be non-negative");
        }
        if (warmupSeconds < 0 || durationSeconds < 0) {
            throw new IllegalArgumentException("warmupSeconds and durationSeconds must be non-negative");
        }
        if (thinkTimeMs < 0 || operationsPerTask < 0 || connectionPoolSize < 0) {
            throw new IllegalArgumentException("thinkTimeMs, operationsPerTask and connectionPoolSize must be non-negative");
        }
        double totalWeight = 0;
        for (Map.Entry<OperationKind, Double> e : operationMix.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("operation weight for " + e.getKey() + " must be non-negative");
            }
            totalWeight += e.getValue();
        }
        if (totalWeight <= 0) {
            throw new IllegalArgumentException("operation mix must have a positive total weight");
        }
        if (loadMode == LoadMode.FIND_MAX) {
            findMax.validate();
            return;
        }
        if (loadMode == LoadMode.QPS) {
            qps.validate();
        }
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException(loadMode + " runs need a positive durationSeconds");
        }
    }

    public Builder toBuilder() {
        return new Builder()
                .workerCount(workerCount)
                .minWorkers(minWorkers)
                .deadWorkerPolicy(deadWorkerPolicy)
                .loadMode(loadMode)
                .concurrency(concurrency)
                .perWorkerCap(perWorkerCap)
                .warmupSeconds(warmupSeconds)
                .durationSeconds(durationSeconds)
                .thinkTimeMs(thinkTimeMs)
                .operationsPerTask(operationsPerTask)
                .connectionPoolSize(connectionPoolSize)
                .operationMix(operationMix)
                .findMax(findMax)
                .qps(qps)
                .slos(slos);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int workerCount = 1;
        private int minWorkers = 1;
        private DeadWorkerPolicy deadWorkerPolicy = DeadWorkerPolicy.FAIL_RUN;
        private LoadMode loadMode = LoadMode.FIND_MAX;
        private int concurrency = 1;
        private Integer perWorkerCap;
        private double warmupSeconds;
        private double durationSeconds;
        private long thinkTimeMs;
        private long operationsPerTask;
        private int connectionPoolSize;
        private Map<OperationKind, Double> operationMix = new EnumMap<>(OperationKind.class);
        private FindMaxSettings findMax = FindMaxSettings.defaults();
        private QpsSettings qps = QpsSettings.defaults();
        private Map<OperationKind, KindSlo> slos = new EnumMap<>(OperationKind.class);

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder minWorkers(int minWorkers) {
            this.minWorkers = minWorkers;
            return this;
        }

        public Builder deadWorkerPolicy(DeadWorkerPolicy deadWorkerPolicy) {
            this.deadWorkerPolicy = deadWorkerPolicy;
            return this;
        }

        public Builder loadMode(LoadMode loadMode) {
            this.loadMode = loadMode;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder perWorkerCap(Integer perWorkerCap) {
            this.perWorkerCap = perWorkerCap;
            return this;
        }

        public Builder warmupSeconds(double warmupSeconds) {
            this.warmupSeconds = warmupSeconds;
            return this;
        }

        public Builder durationSeconds(double durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder thinkTimeMs(long thinkTimeMs) {
            this.thinkTimeMs = thinkTimeMs;
            return this;
        }

        public Builder operationsPerTask(long operationsPerTask) {
            this.operationsPerTask = operationsPerTask;
            return this;
        }

        public Builder connectionPoolSize(int connectionPoolSize) {
            this.connectionPoolSize = connectionPoolSize;
            return this;
        }

        public Builder operationMix(Map<OperationKind, Double> operationMix) {
            this.operationMix = new EnumMap<>(OperationKind.class);
            this.operationMix.putAll(operationMix);
            return this;
        }

        public Builder weight(OperationKind kind, double weight) {
            this.operationMix.put(kind, weight);
            return this;
        }

        public Builder findMax(FindMaxSettings findMax) {
            this.findMax = findMax;
            return this;
        }

        public Builder qps(QpsSettings qps) {
            this.qps = qps;
            return this;
        }

        public Builder slos(Map<OperationKind, KindSlo> slos) {
            this.slos = new EnumMap<>(OperationKind.class);
            this.slos.putAll(slos);
            return this;
        }

        public Builder slo(OperationKind kind, KindSlo slo) {
            this.slos.put(kind, slo);
            return this;
        }

        public ScenarioConfig build() {
            return new ScenarioConfig(workerCount, minWorkers, deadWorkerPolicy, loadMode, concurrency,
                    perWorkerCap, warmupSeconds, durationSeconds, thinkTimeMs, operationsPerTask,
                    connectionPoolSize, operationMix, findMax, qps, slos);
        }
    }
}
