package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.config.properties.PreflightProperties;
import com.phillippitts.mockinterview.domain.Capability;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the environment capability probes before an interview may start.
 *
 * <p><b>Parallel Execution:</b> every probe runs on the worker executor at the same time; no probe
 * waits for another. The call blocks until all finish or the check timeout elapses. A probe that
 * overruns or throws is reported as {@link CheckStatus#FAILED}.
 *
 * <p><b>Policy:</b> the capabilities listed in {@code interview.preflight.mandatory-checks} gate the
 * interview. The others (microphone by default) only flag the session as degraded.
 *
 * <p><b>Retry:</b> {@link #runOne(UUID, Capability)} re-probes a single capability; callers merge the
 * result with {@link PreflightReport#with(CheckResult)} so other checks keep their status.
 */
@Service
public class PreflightChecker {

    private static final Logger LOG = LogManager.getLogger(PreflightChecker.class);

    private final Map<Capability, CapabilityProbe> probes = new EnumMap<>(Capability.class);
    private final PreflightProperties props;
    private final Executor executor;

    public PreflightChecker(List<CapabilityProbe> probes,
                            PreflightProperties props,
                            @Qualifier("workerExecutor") Executor executor) {
        this.props = Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
        for (CapabilityProbe p : probes) {
            this.probes.put(p.capability(), p);
        }
        LOG.info("Preflight probes registered for {} (mandatory={})", this.probes.keySet(), props.getMandatoryChecks());
    }

    public Set<Capability> mandatory() {
        return props.mandatorySet();
    }

    /**
     * Runs all probes concurrently.
     *
     * @param handle engine session handle
     * @return report with a terminal status for every capability
     */
    public PreflightReport runAll(UUID handle) {
        Objects.requireNonNull(handle, "handle");
        List<Capability> order = new ArrayList<>(List.of(Capability.values()));
        List<CompletableFuture<CheckResult>> futures = new ArrayList<>(order.size());
        for (Capability c : order) {
            futures.add(CompletableFuture.supplyAsync(() -> runProbe(c, handle), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(props.getCheckTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Preflight timed out after {} ms for session handle {}", props.getCheckTimeoutMs(), handle);
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            LOG.debug("Preflight probe completed exceptionally: {}", ee.toString());
        }

        PreflightReport report = PreflightReport.pending(mandatory());
        for (int i = 0; i < order.size(); i++) {
            report = report.with(resultOrTimeout(order.get(i), futures.get(i)));
        }
        logReport(handle, report);
        return report;
    }

    /**
     * Re-runs a single probe, bounded by the check timeout.
     */
    public CheckResult runOne(UUID handle, Capability capability) {
        Objects.requireNonNull(capability, "capability");
        CompletableFuture<CheckResult> future = CompletableFuture.supplyAsync(() -> runProbe(capability, handle), executor);
        try {
            future.get(props.getCheckTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            LOG.debug("Probe {} completed exceptionally: {}", capability, ee.toString());
        }
        CheckResult result = resultOrTimeout(capability, future);
        LOG.info("Preflight retry {} -> {}{}", capability, result.status(),
                result.detail() == null ? "" : " (" + result.detail() + ")");
        return result;
    }

    private CheckResult runProbe(Capability capability, UUID handle) {
        CapabilityProbe probe = probes.get(capability);
        if (probe == null) {
            return CheckResult.failed(capability, "no probe registered");
        }
        try {
            CheckResult r = probe.probe(handle);
            return r != null ? r : CheckResult.failed(capability, "probe returned no result");
        } catch (RuntimeException e) {
            LOG.warn("Probe {} threw: {}", capability, e.toString());
            return CheckResult.failed(capability, "probe error");
        }
    }

    private CheckResult resultOrTimeout(Capability capability, CompletableFuture<CheckResult> f) {
        try {
            if (f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled()) {
                return f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOG.debug("Probe {} completed exceptionally: {}", capability, e.toString());
        }
        return CheckResult.failed(capability, "timed out");
    }

    private void logReport(UUID handle, PreflightReport report) {
        StringBuilder sb = new StringBuilder("Preflight for ").append(handle).append(": ");
        report.results().forEach((c, r) -> sb.append(c).append('=').append(r.status()).append(' '));
        LOG.info(sb.toString().trim());
        if (!report.degraded().isEmpty()) {
            LOG.warn("Session handle {} will run in degraded mode, optional checks failed: {}", handle, report.degraded());
        }
    }
}
