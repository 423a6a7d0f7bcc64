package fun.ai.devhub.health;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.mapper.ServiceHealthCheckMapper;
import fun.ai.devhub.process.CommandResult;
import fun.ai.devhub.process.CommandRunner;
import fun.ai.devhub.service.ServiceConfigService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 定时健康检查：每个 check 一个周期任务（立即执行一次，之后每 intervalSeconds 执行），
 * 结果回写到 services.health_status / last_health_check / health_check_failures
 */
@Component
public class ScheduledHealthCheckCoordinator implements HealthCheckCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ScheduledHealthCheckCoordinator.class);

    private static final int DEFAULT_INTERVAL_SECONDS = 30;
    private static final int DEFAULT_TIMEOUT_MS = 5000;
    private static final int DEFAULT_EXPECTED_STATUS = 200;

    private final ServiceHealthCheckMapper healthCheckMapper;
    private final ServiceConfigService configService;
    private final CommandRunner commandRunner;
    private final DevHubProperties props;

    private final Map<String, ScheduledFuture<?>> running = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final HttpClient httpClient;

    public ScheduledHealthCheckCoordinator(ServiceHealthCheckMapper healthCheckMapper,
                                           ServiceConfigService configService,
                                           CommandRunner commandRunner,
                                           DevHubProperties props) {
        this.healthCheckMapper = healthCheckMapper;
        this.configService = configService;
        this.commandRunner = commandRunner;
        this.props = props;
        AtomicInteger seq = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, props.getHealth().getPoolSize()), r -> {
            Thread t = new Thread(r, "health-check-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(DEFAULT_TIMEOUT_MS))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<ServiceHealthCheck> getHealthChecks(String serviceId) {
        return healthCheckMapper.selectList(new LambdaQueryWrapper<ServiceHealthCheck>()
                .eq(ServiceHealthCheck::getServiceId, serviceId)
                .orderByAsc(ServiceHealthCheck::getCreatedAt));
    }

    @Override
    public void startHealthCheck(ServiceHealthCheck check) {
        if (check == null || !StringUtils.hasText(check.getId())) {
            throw new IllegalArgumentException("health check id 不能为空");
        }
        if (!props.getHealth().isEnabled()) {
            log.debug("health check disabled by config, skip: checkId={}", check.getId());
            return;
        }
        long interval = check.getIntervalSeconds() == null || check.getIntervalSeconds() <= 0
                ? DEFAULT_INTERVAL_SECONDS : check.getIntervalSeconds();
        running.computeIfAbsent(check.getId(), id -> {
            log.info("health check started: checkId={}, serviceId={}, type={}, intervalSeconds={}",
                    id, check.getServiceId(), check.getType(), interval);
            return scheduler.scheduleWithFixedDelay(() -> runCheck(check), 0, interval, TimeUnit.SECONDS);
        });
    }

    @Override
    public void stopHealthCheck(String checkId) {
        if (checkId == null) return;
        ScheduledFuture<?> f = running.remove(checkId);
        if (f != null) {
            f.cancel(false);
            log.info("health check stopped: checkId={}", checkId);
        }
    }

    public boolean isRunning(String checkId) {
        return checkId != null && running.containsKey(checkId);
    }

    private void runCheck(ServiceHealthCheck check) {
        try {
            HealthProbeResult result = probe(check);
            if (!result.isHealthy()) {
                log.debug("health check failed: checkId={}, serviceId={}, error={}",
                        check.getId(), check.getServiceId(), result.getError());
            }
            configService.updateHealthStatus(check.getServiceId(), result.isHealthy());
        } catch (Exception e) {
            // 异常不能抛出，否则周期任务会被取消
            log.warn("health check run failed: checkId={}, serviceId={}, error={}",
                    check.getId(), check.getServiceId(), e.getMessage());
        }
    }

    public HealthProbeResult probe(ServiceHealthCheck check) {
        String type = check.getType() == null ? "" : check.getType();
        switch (type) {
            case "http":
                return probeHttp(check);
            case "tcp":
                return probeTcp(check);
            case "command":
                return probeCommand(check);
            default:
                return HealthProbeResult.unhealthy("unknown health check type: " + type);
        }
    }

    private HealthProbeResult probeHttp(ServiceHealthCheck check) {
        String url = StringUtils.hasText(check.getEndpoint()) ? check.getEndpoint() : "http://localhost";
        int expected = check.getExpectedStatus() == null ? DEFAULT_EXPECTED_STATUS : check.getExpectedStatus();
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(Duration.ofMillis(timeoutMs(check)))
                    .GET()
                    .build();
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != expected) {
                return HealthProbeResult.unhealthy("expected status " + expected + ", got " + resp.statusCode());
            }
            if (StringUtils.hasText(check.getExpectedBody())
                    && (resp.body() == null || !resp.body().contains(check.getExpectedBody()))) {
                return HealthProbeResult.unhealthy("expected body to contain \"" + check.getExpectedBody() + "\"");
            }
            return HealthProbeResult.healthy();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthProbeResult.unhealthy("interrupted");
        } catch (IOException | IllegalArgumentException e) {
            return HealthProbeResult.unhealthy(e.getMessage());
        }
    }

    private HealthProbeResult probeTcp(ServiceHealthCheck check) {
        if (check.getPort() == null) {
            return HealthProbeResult.unhealthy("port not specified");
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("localhost", check.getPort()), timeoutMs(check));
            return HealthProbeResult.healthy();
        } catch (IOException e) {
            return HealthProbeResult.unhealthy(e.getMessage());
        }
    }

    private HealthProbeResult probeCommand(ServiceHealthCheck check) {
        if (!StringUtils.hasText(check.getCommand())) {
            return HealthProbeResult.unhealthy("command not specified");
        }
        CommandResult r = commandRunner.runShell(Duration.ofMillis(timeoutMs(check)), check.getCommand(), null);
        if (r.isSuccess()) {
            return HealthProbeResult.healthy();
        }
        return HealthProbeResult.unhealthy(r.isTimeout() ? "command timeout" : "exit code " + r.getExitCode());
    }

    private static int timeoutMs(ServiceHealthCheck check) {
        return check.getTimeoutMs() == null || check.getTimeoutMs() <= 0 ? DEFAULT_TIMEOUT_MS : check.getTimeoutMs();
    }

    @PreDestroy
    public void stopAll() {
        for (String id : running.keySet()) {
            stopHealthCheck(id);
        }
        scheduler.shutdownNow();
    }
}
