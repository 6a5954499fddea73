package me.golemcore.testinsight.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ConnectionTestResult;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.ProbeResult;
import me.golemcore.testinsight.domain.model.ServiceName;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.AiProbePort;
import me.golemcore.testinsight.port.outbound.GitHubProbePort;
import me.golemcore.testinsight.port.outbound.JenkinsProbePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs live probes against external services with a bounded timeout.
 *
 * <p>
 * Every outcome, including missing credentials, timeouts and unexpected
 * probe exceptions, is returned as a value. Nothing here throws.
 */
@Service
@Slf4j
public class ConnectionTestService {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final JenkinsProbePort jenkinsProbe;
    private final GitHubProbePort gitHubProbe;
    private final AiProbePort aiProbe;
    private final long timeoutMillis;
    private final ExecutorService probeExecutor;

    public ConnectionTestService(JenkinsProbePort jenkinsProbe, GitHubProbePort gitHubProbe, AiProbePort aiProbe,
            TestInsightProperties properties) {
        this.jenkinsProbe = jenkinsProbe;
        this.gitHubProbe = gitHubProbe;
        this.aiProbe = aiProbe;
        TestInsightProperties.ConnectionTestProperties config = properties.getConnectionTest();
        this.timeoutMillis = config.getTimeoutMillis();
        AtomicInteger threadCounter = new AtomicInteger();
        this.probeExecutor = Executors.newFixedThreadPool(Math.max(1, config.getMaxConcurrentProbes()), r -> {
            Thread t = new Thread(r, "connection-test-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void destroy() {
        probeExecutor.shutdownNow();
        try {
            probeExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public ConnectionTestResult testJenkins(String url, String username, String apiToken, boolean verifySsl) {
        if (isBlank(url)) {
            return misconfigured(ServiceName.JENKINS, "Jenkins URL is not configured");
        }
        if (isBlank(username)) {
            return misconfigured(ServiceName.JENKINS, "Jenkins username is not configured");
        }
        if (isBlank(apiToken)) {
            return misconfigured(ServiceName.JENKINS, "Jenkins API token is not configured");
        }
        ProbeResult result = runProbe(ServiceName.JENKINS,
                () -> jenkinsProbe.probe(url.trim(), username.trim(), apiToken, verifySsl));
        return ConnectionTestResult.from(ServiceName.JENKINS, result);
    }

    public ConnectionTestResult testGitHub(String token) {
        if (isBlank(token)) {
            return misconfigured(ServiceName.GITHUB, "GitHub token is not configured");
        }
        ProbeResult result = runProbe(ServiceName.GITHUB, () -> gitHubProbe.probe(token));
        return ConnectionTestResult.from(ServiceName.GITHUB, result);
    }

    public ConnectionTestResult testAi(String apiKey, String model) {
        if (isBlank(apiKey)) {
            return misconfigured(ServiceName.AI, "AI API key is not configured");
        }
        ProbeResult result = runProbe(ServiceName.AI, () -> aiProbe.probe(apiKey, model));
        return ConnectionTestResult.from(ServiceName.AI, result);
    }

    public AiModelsResult listAiModels(String apiKey) {
        if (isBlank(apiKey)) {
            return AiModelsResult.failure(ProbeFailureKind.MISCONFIGURATION, "AI API key is not configured", "");
        }
        Outcome<AiModelsResult> outcome = runBounded(() -> aiProbe.listModels(apiKey));
        if (outcome.value() != null) {
            return outcome.value();
        }
        return AiModelsResult.failure(outcome.failure().failureKind(), "Failed to fetch AI models",
                outcome.failure().details());
    }

    private ProbeResult runProbe(ServiceName service, Callable<ProbeResult> probe) {
        Outcome<ProbeResult> outcome = runBounded(probe);
        if (outcome.value() != null) {
            log.info("[Probe] {} connection test {}", service.getId(), outcome.value().ok() ? "succeeded" : "failed");
            return outcome.value();
        }
        log.info("[Probe] {} connection test failed: {}", service.getId(), outcome.failure().failureKind());
        return outcome.failure();
    }

    private <T> Outcome<T> runBounded(Callable<T> task) {
        Future<T> future;
        try {
            future = probeExecutor.submit(task);
        } catch (RuntimeException e) {
            log.warn("[Probe] Failed to schedule probe: {}", e.getMessage());
            return Outcome.failed(ProbeResult.failure(ProbeFailureKind.UNEXPECTED,
                    "Connection test could not be started", e.getMessage()));
        }

        try {
            T value = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (value == null) {
                return Outcome.failed(ProbeResult.failure(ProbeFailureKind.UNEXPECTED,
                        "Connection test returned no result", ""));
            }
            return Outcome.of(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Outcome.failed(ProbeResult.failure(ProbeFailureKind.TIMEOUT,
                    "Connection test timed out", "No response within " + timeoutMillis + " ms"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failed(ProbeResult.failure(ProbeFailureKind.UNEXPECTED,
                    "Connection test was interrupted", ""));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Probe] Probe threw {}", cause.getClass().getSimpleName(), cause);
            return Outcome.failed(ProbeResult.failure(ProbeFailureKind.UNEXPECTED,
                    "Connection test failed unexpectedly", cause.getClass().getSimpleName() + ": "
                            + cause.getMessage()));
        }
    }

    private static ConnectionTestResult misconfigured(ServiceName service, String message) {
        return ConnectionTestResult.failure(service, ProbeFailureKind.MISCONFIGURATION, message,
                "Required configuration is missing");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Outcome<T>(T value, ProbeResult failure) {

        static <T> Outcome<T> of(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failed(ProbeResult failure) {
            return new Outcome<>(null, failure);
        }
    }
}
