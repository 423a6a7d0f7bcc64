package fun.ai.devhub.service;

import fun.ai.devhub.entity.ServiceLogEntry;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.response.LogStatsResponse;
import fun.ai.devhub.log.ExitReason;
import fun.ai.devhub.log.LogEntryInput;
import fun.ai.devhub.log.LogLevel;
import fun.ai.devhub.log.LogQuery;

import java.util.List;

/**
 * 服务日志持久化：session（一次进程运行）+ 日志行
 */
public interface ServiceLogService {

    /**
     * 进程 spawn 成功后创建 session
     */
    ServiceLogSession createSession(String serviceId);

    /**
     * 进程退出时关闭 session。未知或已关闭的 session 返回 false（不抛异常）。
     */
    boolean endSession(String sessionId, Integer exitCode, ExitReason exitReason);

    ServiceLogSession getSession(String sessionId);

    /**
     * 最近的 session 在前
     */
    List<ServiceLogSession> getSessions(String serviceId, int limit);

    ServiceLogSession getActiveSession(String serviceId);

    void writeLog(String sessionId, String serviceId, String message, LogLevel level);

    /**
     * 批量写入：所有行与 logs_count 的累加在同一事务内提交。
     * session 不存在时整批忽略。
     */
    void writeLogs(String sessionId, String serviceId, List<LogEntryInput> entries);

    /**
     * 单个 session 的日志，按到达顺序升序
     */
    List<ServiceLogEntry> getLogs(String sessionId, LogQuery query);

    /**
     * 跨 session 的服务日志，最新的在前
     */
    List<ServiceLogEntry> getServiceLogs(String serviceId, LogQuery query);

    long getLogCount(String sessionId);

    LogStatsResponse getLogStats(String serviceId);

    boolean deleteSession(String sessionId);

    /**
     * @return 删除的行数（日志 + session）
     */
    int deleteServiceLogs(String serviceId);

    /**
     * 删除 started_at 早于 daysOld 天的 session 及其日志
     *
     * @return 删除的行数（日志 + session）
     */
    int deleteOldLogs(int daysOld);

    LogLevel parseLogLevel(String message);
}
