package fun.ai.devhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * DevHub（本地开发面板）服务进程管理配置
 */
@Component
@ConfigurationProperties(prefix = "devhub")
public class DevHubProperties {

    private ServiceProperties services = new ServiceProperties();

    private LogProperties logs = new LogProperties();

    private HealthProperties health = new HealthProperties();

    public ServiceProperties getServices() {
        return services;
    }

    public void setServices(ServiceProperties services) {
        this.services = services;
    }

    public LogProperties getLogs() {
        return logs;
    }

    public void setLogs(LogProperties logs) {
        this.logs = logs;
    }

    public HealthProperties getHealth() {
        return health;
    }

    public void setHealth(HealthProperties health) {
        this.health = health;
    }

    /**
     * 进程生命周期相关
     */
    public static class ServiceProperties {

        /**
         * 每个服务内存中保留的最近日志行数（实时 tail 用，历史日志走数据库）
         */
        private int maxLogLines = 500;

        /**
         * stop 发出 TERM 后，多久仍未退出则对整棵进程树 KILL（毫秒）
         */
        private long killTimeoutMs = 5000L;

        /**
         * 进程退出后，等待 stdout/stderr 读线程把剩余输出读完的窗口（毫秒）
         */
        private long outputDrainTimeoutMs = 2000L;

        /**
         * 可选：执行 command 使用的 shell（例如 /bin/bash）。
         * 不配置时：Windows 用 cmd.exe，其它系统用 /bin/sh。
         */
        private String shell;

        public int getMaxLogLines() {
            return maxLogLines;
        }

        public void setMaxLogLines(int maxLogLines) {
            this.maxLogLines = maxLogLines;
        }

        public long getKillTimeoutMs() {
            return killTimeoutMs;
        }

        public void setKillTimeoutMs(long killTimeoutMs) {
            this.killTimeoutMs = killTimeoutMs;
        }

        public long getOutputDrainTimeoutMs() {
            return outputDrainTimeoutMs;
        }

        public void setOutputDrainTimeoutMs(long outputDrainTimeoutMs) {
            this.outputDrainTimeoutMs = outputDrainTimeoutMs;
        }

        public String getShell() {
            return shell;
        }

        public void setShell(String shell) {
            this.shell = shell;
        }
    }

    /**
     * 日志持久化相关
     */
    public static class LogProperties {

        /**
         * 单条日志最大字符数，超出部分截断并追加 ...[truncated]
         */
        private int maxMessageLength = 10000;

        /**
         * 日志保留天数：定时清理 started_at 早于该天数的 session 及其日志
         */
        private int retentionDays = 30;

        /**
         * 是否启用定时清理（<=0 的 retentionDays 也视为禁用）
         */
        private boolean retentionSweepEnabled = true;

        public int getMaxMessageLength() {
            return maxMessageLength;
        }

        public void setMaxMessageLength(int maxMessageLength) {
            this.maxMessageLength = maxMessageLength;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public boolean isRetentionSweepEnabled() {
            return retentionSweepEnabled;
        }

        public void setRetentionSweepEnabled(boolean retentionSweepEnabled) {
            this.retentionSweepEnabled = retentionSweepEnabled;
        }
    }

    /**
     * 健康检查相关
     */
    public static class HealthProperties {

        /**
         * 是否执行健康检查探测（关闭后 start/stop 仍可调用，但不会真正探测）
         */
        private boolean enabled = true;

        /**
         * 探测线程数
         */
        private int poolSize = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
