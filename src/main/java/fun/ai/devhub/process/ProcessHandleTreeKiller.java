package fun.ai.devhub.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基于 ProcessHandle 的进程树结束：先子孙（叶子优先），再根进程
 */
@Component
public class ProcessHandleTreeKiller implements ProcessTreeKiller {
    private static final Logger log = LoggerFactory.getLogger(ProcessHandleTreeKiller.class);

    @Override
    public boolean terminateProcessTree(long pid, KillSignal signal) {
        Optional<ProcessHandle> root = ProcessHandle.of(pid);
        if (root.isEmpty() || !root.get().isAlive()) {
            return false;
        }
        // descendants() 先序遍历（父在子前），倒序即叶子优先
        List<ProcessHandle> descendants = root.get().descendants().collect(Collectors.toList());
        for (int i = descendants.size() - 1; i >= 0; i--) {
            signal(descendants.get(i), signal);
        }
        signal(root.get(), signal);
        log.debug("process tree signaled: pid={}, signal={}, descendants={}", pid, signal, descendants.size());
        return true;
    }

    private void signal(ProcessHandle h, KillSignal signal) {
        try {
            boolean requested = signal == KillSignal.KILL ? h.destroyForcibly() : h.destroy();
            if (!requested && h.isAlive()) {
                log.debug("signal not delivered: pid={}, signal={}", h.pid(), signal);
            }
        } catch (Exception e) {
            // 进程已退出或无权限
            log.debug("signal process failed: pid={}, signal={}, error={}", h.pid(), signal, e.getMessage());
        }
    }
}
