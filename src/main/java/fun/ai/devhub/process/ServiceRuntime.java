package fun.ai.devhub.process;

import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.entity.response.RunningService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 一次运行的内存记录。状态字段只在该服务的锁内修改；
 * 日志环形缓冲由 outputMonitor 保护（与落库同一临界区，保证两边顺序一致）。
 */
final class ServiceRuntime {

    final String serviceId;
    final String workspaceId;
    final String name;
    final String command;
    final Integer port;

    final Object outputMonitor = new Object();
    private final Deque<String> ring = new ArrayDeque<>();
    private final int maxLogLines;

    volatile Process process;
    volatile Long pid;
    volatile ServiceStatus status;
    volatile Long startedAt;
    volatile Long stoppedAt;
    volatile Integer exitCode;
    volatile String logSessionId;
    volatile boolean stopRequested;
    // 发 TERM 时的子孙进程快照：根进程先退出后，被过继的子进程仍要按超时强杀
    volatile List<ProcessHandle> stopTree = List.of();
    ScheduledFuture<?> forceKill;

    ServiceRuntime(ServiceConfig config, int maxLogLines) {
        this.serviceId = config.getId();
        this.workspaceId = config.getWorkspaceId();
        this.name = config.getName();
        this.command = config.getCommand();
        this.port = config.getPort();
        this.maxLogLines = Math.max(1, maxLogLines);
    }

    boolean isAlive() {
        Process p = process;
        return p != null && p.isAlive();
    }

    List<ProcessHandle> aliveStopTree() {
        List<ProcessHandle> alive = new ArrayList<>();
        for (ProcessHandle h : stopTree) {
            if (h.isAlive()) {
                alive.add(h);
            }
        }
        return alive;
    }

    void markRunning(Process p, String sessionId, long now) {
        this.process = p;
        this.pid = p.pid();
        this.logSessionId = sessionId;
        this.startedAt = now;
        this.stoppedAt = null;
        this.exitCode = null;
        this.status = ServiceStatus.RUNNING;
    }

    void markSpawnFailed(long now) {
        this.process = null;
        this.pid = null;
        this.startedAt = now;
        this.stoppedAt = now;
        this.status = ServiceStatus.ERROR;
    }

    void markExited(Integer code, long now) {
        this.exitCode = code;
        this.pid = null;
        this.stoppedAt = now;
        this.status = code != null && code == 0 ? ServiceStatus.STOPPED : ServiceStatus.ERROR;
    }

    /**
     * 调用方持有 outputMonitor
     */
    void appendLines(List<String> lines) {
        for (String line : lines) {
            ring.addLast(line);
        }
        while (ring.size() > maxLogLines) {
            ring.removeFirst();
        }
    }

    List<String> tail(int maxLines) {
        synchronized (outputMonitor) {
            int n = Math.min(Math.max(maxLines, 0), ring.size());
            List<String> out = new ArrayList<>(n);
            int skip = ring.size() - n;
            for (String line : ring) {
                if (skip-- > 0) continue;
                out.add(line);
            }
            return out;
        }
    }

    RunningService snapshot() {
        RunningService s = new RunningService();
        s.setServiceId(serviceId);
        s.setWorkspaceId(workspaceId);
        s.setName(name);
        s.setCommand(command);
        s.setPort(port);
        s.setPid(pid);
        s.setStatus(status);
        s.setStartedAt(startedAt);
        s.setStoppedAt(stoppedAt);
        s.setExitCode(exitCode);
        s.setLogSessionId(logSessionId);
        return s;
    }
}
