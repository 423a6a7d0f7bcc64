package fun.ai.devhub.process;

import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.service.ServiceLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时清理过期日志：删除 started_at 早于 retentionDays 的 session 及其日志
 */
@Component
public class LogRetentionReaper {
    private static final Logger log = LoggerFactory.getLogger(LogRetentionReaper.class);

    private final ServiceLogService logService;
    private final DevHubProperties props;

    public LogRetentionReaper(ServiceLogService logService, DevHubProperties props) {
        this.logService = logService;
        this.props = props;
    }

    @Scheduled(initialDelay = 60_000L, fixedDelay = 3_600_000L)
    public void sweep() {
        DevHubProperties.LogProperties logs = props.getLogs();
        if (!logs.isRetentionSweepEnabled()) return;
        // 约定：<=0 表示禁用（避免误配 0 把所有历史日志清空）
        int days = logs.getRetentionDays();
        if (days <= 0) return;

        try {
            int removed = logService.deleteOldLogs(days);
            if (removed > 0) {
                log.info("log retention sweep: retentionDays={}, rowsRemoved={}", days, removed);
            }
        } catch (Exception ex) {
            log.warn("log retention sweep failed: retentionDays={}, error={}", days, ex.getMessage());
        }
    }
}
