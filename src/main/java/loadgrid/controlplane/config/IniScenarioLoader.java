package loadgrid.controlplane.config;

import loadgrid.controlplane.model.DeadWorkerPolicy;
import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.KindSlo;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.model.QpsSettings;
import loadgrid.controlplane.model.ScenarioConfig;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Locale;

/**
 * Loads a run plan from an INI file.
 * Sections: [RUN] (required), [FIND_MAX], [QPS], [MIX], [SLO.&lt;KIND&gt;] (all optional).
 */
public final class IniScenarioLoader {

    private static final String SLO_PREFIX = "SLO.";

    private IniScenarioLoader() {
    }

    public static ScenarioConfig load(File file) throws IOException {
        return parse(new Ini(file));
    }

    public static ScenarioConfig load(Reader reader) throws IOException {
        return parse(new Ini(reader));
    }

    private static ScenarioConfig parse(Ini ini) {
        Profile.Section run = ini.get("RUN");
        if (run == null) {
            throw new IllegalArgumentException("INI file has no [RUN] section");
        }

        int workerCount = intOpt(run, "worker_count", 1);
        ScenarioConfig.Builder builder = ScenarioConfig.builder()
                .workerCount(workerCount)
                .minWorkers(intOpt(run, "min_workers", workerCount))
                .deadWorkerPolicy(DeadWorkerPolicy.valueOf(opt(run, "dead_worker_policy", "FAIL_RUN").toUpperCase(Locale.ROOT)))
                .loadMode(LoadMode.valueOf(opt(run, "load_mode", "FIND_MAX").toUpperCase(Locale.ROOT)))
                .concurrency(intOpt(run, "concurrency", 1))
                .warmupSeconds(doubleOpt(run, "warmup_seconds", 0))
                .durationSeconds(doubleOpt(run, "duration_seconds", 0))
                .thinkTimeMs(longOpt(run, "think_time_ms", 0))
                .operationsPerTask(longOpt(run, "operations_per_task", 0))
                .connectionPoolSize(intOpt(run, "connection_pool_size", 0));

        String cap = opt(run, "per_worker_cap");
        if (cap != null && !cap.isBlank()) {
            builder.perWorkerCap(Integer.parseInt(cap.trim()));
        }

        Profile.Section findMax = ini.get("FIND_MAX");
        if (findMax != null) {
            FindMaxSettings d = FindMaxSettings.defaults();
            builder.findMax(new FindMaxSettings(
                    intOpt(findMax, "start_concurrency", d.startConcurrency()),
                    intOpt(findMax, "concurrency_increment", d.concurrencyIncrement()),
                    doubleOpt(findMax, "step_duration_seconds", d.stepDurationSeconds()),
                    intOpt(findMax, "max_concurrency", d.maxConcurrency()),
                    doubleOpt(findMax, "latency_stability_pct", d.latencyStabilityPct()),
                    doubleOpt(findMax, "max_error_rate_pct", d.maxErrorRatePct()),
                    intOpt(findMax, "max_backoff_attempts", d.maxBackoffAttempts()),
                    longOpt(findMax, "settle_ms", d.settleMillis())));
        }

        Profile.Section qps = ini.get("QPS");
        if (qps != null) {
            QpsSettings d = QpsSettings.defaults();
            builder.qps(new QpsSettings(
                    doubleOpt(qps, "target_qps", d.targetQps()),
                    intOpt(qps, "min_concurrency", d.minConcurrency()),
                    intOpt(qps, "max_concurrency", d.maxConcurrency()),
                    longOpt(qps, "control_interval_ms", d.controlIntervalMillis())));
        }

        Profile.Section mix = ini.get("MIX");
        if (mix != null) {
            for (String key : mix.keySet()) {
                builder.weight(kind(key), Double.parseDouble(mix.get(key).trim()));
            }
        }

        for (String name : ini.keySet()) {
            if (!name.toUpperCase(Locale.ROOT).startsWith(SLO_PREFIX)) {
                continue;
            }
            Profile.Section slo = ini.get(name);
            builder.slo(kind(name.substring(SLO_PREFIX.length())), new KindSlo(
                    doubleOrNull(slo, "target_p95_ms"),
                    doubleOrNull(slo, "target_p99_ms"),
                    doubleOrNull(slo, "target_error_rate_pct")));
        }

        ScenarioConfig config = builder.build();
        config.validate();
        return config;
    }

    // ===== helpers =====
    private static OperationKind kind(String raw) {
        return OperationKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    private static String opt(Profile.Section s, String key) {
        return s == null ? null : s.get(key);
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int intOpt(Profile.Section s, String key, int def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
    }

    private static long longOpt(Profile.Section s, String key, long def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : Long.parseLong(v.trim());
    }

    private static double doubleOpt(Profile.Section s, String key, double def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : Double.parseDouble(v.trim());
    }

    private static Double doubleOrNull(Profile.Section s, String key) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? null : Double.valueOf(v.trim());
    }
}
