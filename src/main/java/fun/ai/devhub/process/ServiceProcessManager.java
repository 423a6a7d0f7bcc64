package fun.ai.devhub.process;

import fun.ai.devhub.common.ServiceAlreadyRunningException;
import fun.ai.devhub.common.ServiceNotFoundException;
import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.response.RunningService;
import fun.ai.devhub.health.HealthCheckCoordinator;
import fun.ai.devhub.log.ExitReason;
import fun.ai.devhub.log.LogEntryInput;
import fun.ai.devhub.log.LogLevel;
import fun.ai.devhub.process.event.ServiceErrorEvent;
import fun.ai.devhub.process.event.ServiceEvent;
import fun.ai.devhub.process.event.ServiceEventBus;
import fun.ai.devhub.process.event.ServiceEventSubscription;
import fun.ai.devhub.process.event.ServiceExitEvent;
import fun.ai.devhub.process.event.ServiceLogEvent;
import fun.ai.devhub.service.ServiceConfigService;
import fun.ai.devhub.service.ServiceLogService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 服务进程生命周期管理：
 * - 每个 serviceId 最多一个存活进程（start 的检查与写入在该服务的锁内完成）
 * - stdout/stderr 去 ANSI 后写入内存环形缓冲（最近 500 行）并按块批量落库
 * - stop：立即停健康检查，TERM 整棵进程树，超时未退出再 KILL；退出码/退出原因只由退出处理写入
 * - 生命周期事件（log/exit/error）通过 subscribe 订阅
 */
@Component
public class ServiceProcessManager {
    private static final Logger log = LoggerFactory.getLogger(ServiceProcessManager.class);

    private static final int SIGKILL_EXIT = 128 + 9;
    private static final int SIGTERM_EXIT = 128 + 15;

    private final ServiceConfigService configService;
    private final ServiceLogService logService;
    private final HealthCheckCoordinator healthCheckCoordinator;
    private final ProcessTreeKiller treeKiller;
    private final ShellCommandBuilder shellCommandBuilder;
    private final DevHubProperties props;

    private final ServiceEventBus eventBus = new ServiceEventBus();
    private final Map<String, ServiceRuntime> runtimes = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    // 输出读取 + 退出等待，每个进程占 3 个线程
    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "svc-io");
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService killScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "svc-kill");
        t.setDaemon(true);
        return t;
    });

    public ServiceProcessManager(ServiceConfigService configService,
                                 ServiceLogService logService,
                                 HealthCheckCoordinator healthCheckCoordinator,
                                 ProcessTreeKiller treeKiller,
                                 ShellCommandBuilder shellCommandBuilder,
                                 DevHubProperties props) {
        this.configService = configService;
        this.logService = logService;
        this.healthCheckCoordinator = healthCheckCoordinator;
        this.treeKiller = treeKiller;
        this.shellCommandBuilder = shellCommandBuilder;
        this.props = props;
    }

    // ---------------- 服务定义 ----------------

    public List<ServiceConfig> getAllServices(String workspaceId) {
        return configService.getAllServices(workspaceId);
    }

    public ServiceConfig getService(String serviceId) {
        return configService.getService(serviceId);
    }

    public ServiceConfig createService(String workspaceId, ServiceConfig config) {
        return configService.createService(workspaceId, config);
    }

    public boolean updateService(String serviceId, ServiceConfig partial) {
        return configService.updateService(serviceId, partial);
    }

    /**
     * 运行中先停（失败只记日志），再移除内存记录与服务定义
     */
    public boolean deleteService(String serviceId) {
        boolean tracked = runtimes.containsKey(serviceId);
        if (tracked) {
            try {
                stopService(serviceId);
            } catch (Exception e) {
                log.warn("stop before delete failed: serviceId={}, error={}", serviceId, e.getMessage());
            }
        }
        ReentrantLock lock = lockFor(serviceId);
        lock.lock();
        try {
            runtimes.remove(serviceId);
        } finally {
            lock.unlock();
        }
        boolean deleted = configService.deleteService(serviceId);
        return deleted || tracked;
    }

    // ---------------- 生命周期 ----------------

    public RunningService startService(String serviceId) {
        ReentrantLock lock = lockFor(serviceId);
        lock.lock();
        try {
            ServiceRuntime existing = runtimes.get(serviceId);
            if (existing != null) {
                if (existing.status == ServiceStatus.RUNNING && existing.isAlive()) {
                    throw new ServiceAlreadyRunningException(serviceId);
                }
                if (existing.isAlive()) {
                    // stop 已发出但进程还没退出：等旧进程树真正结束，避免同一服务两个进程并存
                    awaitPreviousExit(existing);
                }
                runtimes.remove(serviceId);
            }

            ServiceConfig config = configService.getService(serviceId);
            if (config == null) {
                throw new ServiceNotFoundException(serviceId);
            }

            ServiceRuntime rt = new ServiceRuntime(config, props.getServices().getMaxLogLines());
            runtimes.put(serviceId, rt);

            Process process;
            try {
                process = spawn(config);
            } catch (IOException | RuntimeException e) {
                rt.markSpawnFailed(System.currentTimeMillis());
                log.warn("spawn service failed: serviceId={}, command={}, cwd={}, error={}",
                        serviceId, config.getCommand(), config.getRepoPath(), e.getMessage());
                eventBus.publish(new ServiceErrorEvent(serviceId, e.getMessage()));
                return rt.snapshot();
            }

            ServiceLogSession session;
            try {
                session = logService.createSession(serviceId);
            } catch (RuntimeException e) {
                // 没有 session 就无法落日志：不保留这个进程
                treeKiller.terminateProcessTree(process.pid(), KillSignal.KILL);
                rt.markSpawnFailed(System.currentTimeMillis());
                log.error("create log session failed, process killed: serviceId={}, pid={}, error={}",
                        serviceId, process.pid(), e.getMessage(), e);
                eventBus.publish(new ServiceErrorEvent(serviceId, "create log session failed: " + e.getMessage()));
                throw e;
            }

            rt.markRunning(process, session.getId(), System.currentTimeMillis());
            attachIo(rt, process);
            log.info("service started: serviceId={}, pid={}, sessionId={}, command={}",
                    serviceId, rt.pid, rt.logSessionId, config.getCommand());

            startHealthChecks(serviceId);
            return rt.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 不等待退出：TERM 后挂一个可取消的强杀任务，状态先乐观置为 stopped
     */
    public void stopService(String serviceId) {
        ReentrantLock lock = lockFor(serviceId);
        lock.lock();
        try {
            ServiceRuntime rt = runtimes.get(serviceId);
            if (rt == null || !rt.isAlive()) {
                log.debug("stop skipped, no live process: serviceId={}", serviceId);
                return;
            }
            stopHealthChecks(serviceId);
            if (rt.stopRequested) {
                return;
            }
            rt.stopRequested = true;
            long pid = rt.process.pid();
            rt.stopTree = rt.process.descendants().collect(Collectors.toList());
            treeKiller.terminateProcessTree(pid, KillSignal.TERM);
            long killTimeoutMs = props.getServices().getKillTimeoutMs();
            rt.forceKill = killScheduler.schedule(() -> forceKill(rt), killTimeoutMs, TimeUnit.MILLISECONDS);
            rt.status = ServiceStatus.STOPPED;
            log.info("service stopping: serviceId={}, pid={}, killTimeoutMs={}", serviceId, pid, killTimeoutMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 只负责把停止信号发给所有服务，不等待退出
     */
    public void stopAll() {
        for (String serviceId : new ArrayList<>(runtimes.keySet())) {
            try {
                stopService(serviceId);
            } catch (Exception e) {
                log.warn("stop service failed: serviceId={}, error={}", serviceId, e.getMessage());
            }
        }
    }

    // ---------------- 查询 ----------------

    public RunningService getServiceStatus(String serviceId) {
        ServiceRuntime rt = serviceId == null ? null : runtimes.get(serviceId);
        return rt == null ? null : rt.snapshot();
    }

    public List<RunningService> getRunningServices() {
        List<RunningService> out = new ArrayList<>();
        for (ServiceRuntime rt : runtimes.values()) {
            if (rt.status == ServiceStatus.RUNNING) {
                out.add(rt.snapshot());
            }
        }
        return out;
    }

    public List<RunningService> getRunningServicesForWorkspace(String workspaceId) {
        List<RunningService> out = new ArrayList<>();
        for (ServiceRuntime rt : runtimes.values()) {
            if (rt.status == ServiceStatus.RUNNING && workspaceId != null && workspaceId.equals(rt.workspaceId)) {
                out.add(rt.snapshot());
            }
        }
        return out;
    }

    /**
     * 内存环形缓冲中的最近 maxLines 行（到达顺序）；未知服务返回空列表
     */
    public List<String> getServiceLogs(String serviceId, int maxLines) {
        ServiceRuntime rt = serviceId == null ? null : runtimes.get(serviceId);
        if (rt == null) {
            return new ArrayList<>();
        }
        return rt.tail(maxLines);
    }

    public List<String> getServiceLogs(String serviceId) {
        return getServiceLogs(serviceId, 100);
    }

    public ServiceEventSubscription subscribe(Consumer<ServiceEvent> listener) {
        return eventBus.subscribe(listener);
    }

    // ---------------- 进程 ----------------

    private Process spawn(ServiceConfig config) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(shellCommandBuilder.build(config.getCommand()));
        pb.directory(new File(config.getRepoPath()));
        Map<String, String> envVars = config.getEnvVars();
        if (envVars != null) {
            Map<String, String> env = pb.environment();
            for (Map.Entry<String, String> e : envVars.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    env.put(e.getKey(), e.getValue());
                }
            }
        }
        return pb.start();
    }

    private void attachIo(ServiceRuntime rt, Process process) {
        // stdin 不使用，直接关掉，避免子进程等待输入
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("close stdin failed: serviceId={}, error={}", rt.serviceId, e.getMessage());
        }
        CompletableFuture<Void> out = CompletableFuture.runAsync(
                () -> pump(rt, process.getInputStream(), ServiceLogEvent.STDOUT), ioPool);
        CompletableFuture<Void> err = CompletableFuture.runAsync(
                () -> pump(rt, process.getErrorStream(), ServiceLogEvent.STDERR), ioPool);
        ioPool.execute(() -> watchExit(rt, process, CompletableFuture.allOf(out, err)));
    }

    private void pump(ServiceRuntime rt, InputStream in, String stream) {
        LogLineBuffer buffer = new LogLineBuffer();
        char[] buf = new char[8192];
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = r.read(buf)) != -1) {
                List<String> lines = buffer.append(new String(buf, 0, n));
                if (!lines.isEmpty()) {
                    onOutput(rt, stream, lines);
                }
            }
        } catch (IOException e) {
            log.debug("read {} closed: serviceId={}, error={}", stream, rt.serviceId, e.getMessage());
        }
        List<String> rest = buffer.flush();
        if (!rest.isEmpty()) {
            onOutput(rt, stream, rest);
        }
    }

    private void onOutput(ServiceRuntime rt, String stream, List<String> lines) {
        boolean stderr = ServiceLogEvent.STDERR.equals(stream);
        List<LogEntryInput> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            entries.add(new LogEntryInput(line, stderr ? LogLevel.ERROR : logService.parseLogLevel(line)));
        }
        synchronized (rt.outputMonitor) {
            rt.appendLines(lines);
            try {
                logService.writeLogs(rt.logSessionId, rt.serviceId, entries);
            } catch (Exception e) {
                log.warn("persist service logs failed: serviceId={}, sessionId={}, lines={}, error={}",
                        rt.serviceId, rt.logSessionId, lines.size(), e.getMessage());
            }
        }
        eventBus.publish(new ServiceLogEvent(rt.serviceId, stream, lines));
    }

    private void watchExit(ServiceRuntime rt, Process process, CompletableFuture<Void> readers) {
        int raw;
        try {
            raw = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("exit watcher interrupted: serviceId={}, pid={}", rt.serviceId, process.pid());
            return;
        }
        try {
            readers.get(props.getServices().getOutputDrainTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 后台子进程可能继承了输出管道，不能无限等
            log.debug("output not drained in time: serviceId={}, pid={}", rt.serviceId, process.pid());
        } catch (ExecutionException e) {
            log.warn("output reader failed: serviceId={}, error={}", rt.serviceId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        handleExit(rt, raw);
    }

    private void handleExit(ServiceRuntime rt, int rawExitCode) {
        Integer code = mapExitCode(rawExitCode, rt.stopRequested);
        ExitReason reason = ExitReason.of(code);

        ReentrantLock lock = lockFor(rt.serviceId);
        lock.lock();
        try {
            // 根进程退了但子孙还活着：保留强杀任务
            if (rt.forceKill != null && rt.aliveStopTree().isEmpty()) {
                rt.forceKill.cancel(false);
                rt.forceKill = null;
            }
            rt.markExited(code, System.currentTimeMillis());
            // 已被新一次 start 替换：只收尾自己的记录，不动 map 与健康检查
            if (runtimes.get(rt.serviceId) == rt) {
                stopHealthChecks(rt.serviceId);
            }
        } finally {
            lock.unlock();
        }

        try {
            logService.endSession(rt.logSessionId, code, reason);
        } catch (Exception e) {
            log.warn("close log session failed: serviceId={}, sessionId={}, error={}",
                    rt.serviceId, rt.logSessionId, e.getMessage());
        }
        log.info("service exited: serviceId={}, rawExitCode={}, exitCode={}, reason={}",
                rt.serviceId, rawExitCode, code, reason.getCode());
        eventBus.publish(new ServiceExitEvent(rt.serviceId, code));
    }

    /**
     * JVM 对被信号结束的进程返回 128+signal；这类情况按“无退出码”处理
     */
    static Integer mapExitCode(int raw, boolean stopRequested) {
        if (raw == SIGKILL_EXIT || raw == SIGTERM_EXIT) {
            return null;
        }
        if (stopRequested && raw > 128) {
            return null;
        }
        return raw;
    }

    private void forceKill(ServiceRuntime rt) {
        Process p = rt.process;
        boolean rootAlive = p != null && p.isAlive();
        List<ProcessHandle> leftovers = rt.aliveStopTree();
        if (!rootAlive && leftovers.isEmpty()) {
            return;
        }
        log.warn("service did not exit in time, killing process tree: serviceId={}, pid={}, rootAlive={}, leftovers={}",
                rt.serviceId, p == null ? null : p.pid(), rootAlive, leftovers.size());
        if (rootAlive) {
            treeKiller.terminateProcessTree(p.pid(), KillSignal.KILL);
        }
        killLeftovers(leftovers);
    }

    /**
     * 根进程退出后被过继的子孙：连同它们后来派生的进程一起 KILL
     */
    private static void killLeftovers(List<ProcessHandle> leftovers) {
        for (ProcessHandle h : leftovers) {
            h.descendants().forEach(ProcessHandle::destroyForcibly);
            h.destroyForcibly();
        }
    }

    /**
     * 调用方持有该服务的锁
     */
    private void awaitPreviousExit(ServiceRuntime previous) {
        Process p = previous.process;
        if (previous.forceKill != null) {
            previous.forceKill.cancel(false);
            previous.forceKill = null;
        }
        previous.stopRequested = true;
        treeKiller.terminateProcessTree(p.pid(), KillSignal.KILL);
        killLeftovers(previous.aliveStopTree());
        try {
            if (!p.waitFor(props.getServices().getKillTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("previous process still alive after kill: serviceId={}, pid={}", previous.serviceId, p.pid());
                throw new ServiceAlreadyRunningException(previous.serviceId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceAlreadyRunningException(previous.serviceId);
        }
        // 旧的退出处理还在等锁：先把旧 session 关掉，新 session 打开前同一服务只有一个未关闭的 session
        Integer code = mapExitCode(p.exitValue(), true);
        try {
            logService.endSession(previous.logSessionId, code, ExitReason.of(code));
        } catch (Exception e) {
            log.warn("close previous log session failed: serviceId={}, sessionId={}, error={}",
                    previous.serviceId, previous.logSessionId, e.getMessage());
        }
    }

    private void startHealthChecks(String serviceId) {
        try {
            for (ServiceHealthCheck check : healthCheckCoordinator.getHealthChecks(serviceId)) {
                if (!Boolean.FALSE.equals(check.getEnabled())) {
                    healthCheckCoordinator.startHealthCheck(check);
                }
            }
        } catch (Exception e) {
            log.warn("start health checks failed: serviceId={}, error={}", serviceId, e.getMessage());
        }
    }

    private void stopHealthChecks(String serviceId) {
        try {
            for (ServiceHealthCheck check : healthCheckCoordinator.getHealthChecks(serviceId)) {
                healthCheckCoordinator.stopHealthCheck(check.getId());
            }
        } catch (Exception e) {
            log.warn("stop health checks failed: serviceId={}, error={}", serviceId, e.getMessage());
        }
    }

    private ReentrantLock lockFor(String serviceId) {
        if (serviceId == null) {
            throw new IllegalArgumentException("serviceId 不能为空");
        }
        return locks.computeIfAbsent(serviceId, k -> new ReentrantLock());
    }

    @PreDestroy
    public void shutdown() {
        stopAll();
        long deadline = System.currentTimeMillis() + props.getServices().getKillTimeoutMs();
        for (ServiceRuntime rt : new ArrayList<>(runtimes.values())) {
            Process p = rt.process;
            if (p == null) continue;
            long remaining = deadline - System.currentTimeMillis();
            try {
                if (remaining > 0) {
                    p.waitFor(remaining, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        for (ServiceRuntime rt : runtimes.values()) {
            Process p = rt.process;
            if (p != null && p.isAlive()) {
                treeKiller.terminateProcessTree(p.pid(), KillSignal.KILL);
            }
            killLeftovers(rt.aliveStopTree());
        }
        killScheduler.shutdownNow();
        ioPool.shutdown();
        try {
            // 让退出处理把 session 收尾
            if (!ioPool.awaitTermination(props.getServices().getOutputDrainTimeoutMs() + 1000L, TimeUnit.MILLISECONDS)) {
                ioPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioPool.shutdownNow();
        }
        log.info("service process manager stopped: tracked={}", runtimes.size());
    }
}
