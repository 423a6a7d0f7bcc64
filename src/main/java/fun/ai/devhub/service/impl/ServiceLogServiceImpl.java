package fun.ai.devhub.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.entity.ServiceLogEntry;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.response.LogStatsResponse;
import fun.ai.devhub.log.ExitReason;
import fun.ai.devhub.log.LogEntryInput;
import fun.ai.devhub.log.LogLevel;
import fun.ai.devhub.log.LogQuery;
import fun.ai.devhub.mapper.ServiceLogEntryMapper;
import fun.ai.devhub.mapper.ServiceLogSessionMapper;
import fun.ai.devhub.service.ServiceLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class ServiceLogServiceImpl implements ServiceLogService {
    private static final Logger log = LoggerFactory.getLogger(ServiceLogServiceImpl.class);

    static final String TRUNCATED_SUFFIX = "...[truncated]";

    // 5 个参数/行，200 行一条 INSERT，远低于 sqlite 的变量上限
    private static final int INSERT_CHUNK = 200;
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final ServiceLogSessionMapper sessionMapper;
    private final ServiceLogEntryMapper entryMapper;
    private final DevHubProperties props;

    public ServiceLogServiceImpl(ServiceLogSessionMapper sessionMapper,
                                 ServiceLogEntryMapper entryMapper,
                                 DevHubProperties props) {
        this.sessionMapper = sessionMapper;
        this.entryMapper = entryMapper;
        this.props = props;
    }

    @Override
    public ServiceLogSession createSession(String serviceId) {
        if (!StringUtils.hasText(serviceId)) {
            throw new IllegalArgumentException("serviceId 不能为空");
        }
        long now = System.currentTimeMillis();
        ServiceLogSession session = new ServiceLogSession();
        session.setId("session_" + now + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9));
        session.setServiceId(serviceId);
        session.setStartedAt(now);
        session.setLogsCount(0);
        session.setCreatedAt(now);
        sessionMapper.insert(session);
        return session;
    }

    @Override
    public boolean endSession(String sessionId, Integer exitCode, ExitReason exitReason) {
        if (!StringUtils.hasText(sessionId)) return false;
        int n = sessionMapper.closeSession(sessionId, System.currentTimeMillis(), exitCode,
                exitReason == null ? null : exitReason.getCode());
        if (n == 0) {
            log.debug("end session skipped (unknown or already closed): sessionId={}", sessionId);
        }
        return n > 0;
    }

    @Override
    public ServiceLogSession getSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) return null;
        return sessionMapper.selectById(sessionId);
    }

    @Override
    public List<ServiceLogSession> getSessions(String serviceId, int limit) {
        int l = limit <= 0 ? 50 : limit;
        return sessionMapper.selectList(new LambdaQueryWrapper<ServiceLogSession>()
                .eq(ServiceLogSession::getServiceId, serviceId)
                .orderByDesc(ServiceLogSession::getStartedAt)
                .last("LIMIT " + l));
    }

    @Override
    public ServiceLogSession getActiveSession(String serviceId) {
        List<ServiceLogSession> list = sessionMapper.selectList(new LambdaQueryWrapper<ServiceLogSession>()
                .eq(ServiceLogSession::getServiceId, serviceId)
                .isNull(ServiceLogSession::getStoppedAt)
                .orderByDesc(ServiceLogSession::getStartedAt)
                .last("LIMIT 1"));
        return list.isEmpty() ? null : list.get(0);
    }

    @Override
    @Transactional
    public void writeLog(String sessionId, String serviceId, String message, LogLevel level) {
        List<LogEntryInput> one = new ArrayList<>(1);
        one.add(new LogEntryInput(message, level));
        writeLogs(sessionId, serviceId, one);
    }

    @Override
    @Transactional
    public void writeLogs(String sessionId, String serviceId, List<LogEntryInput> entries) {
        if (entries == null || entries.isEmpty()) return;
        // 先累加计数：0 行受影响说明 session 不存在，整批忽略
        int updated = sessionMapper.incrementLogsCount(sessionId, entries.size());
        if (updated == 0) {
            log.debug("write logs skipped, session not found: sessionId={}, serviceId={}, lines={}",
                    sessionId, serviceId, entries.size());
            return;
        }

        long now = System.currentTimeMillis();
        List<ServiceLogEntry> rows = new ArrayList<>(Math.min(entries.size(), INSERT_CHUNK));
        for (LogEntryInput in : entries) {
            ServiceLogEntry row = new ServiceLogEntry();
            row.setSessionId(sessionId);
            row.setServiceId(serviceId);
            row.setTimestamp(now);
            row.setLevel((in.getLevel() == null ? LogLevel.INFO : in.getLevel()).getCode());
            row.setMessage(truncate(in.getMessage()));
            rows.add(row);
            if (rows.size() >= INSERT_CHUNK) {
                entryMapper.insertBatch(rows);
                rows = new ArrayList<>(INSERT_CHUNK);
            }
        }
        if (!rows.isEmpty()) {
            entryMapper.insertBatch(rows);
        }
    }

    @Override
    public List<ServiceLogEntry> getLogs(String sessionId, LogQuery query) {
        LogQuery q = query == null ? LogQuery.defaults() : query;
        LambdaQueryWrapper<ServiceLogEntry> w = new LambdaQueryWrapper<ServiceLogEntry>()
                .eq(ServiceLogEntry::getSessionId, sessionId)
                .eq(q.getLevel() != null, ServiceLogEntry::getLevel, q.getLevel() == null ? null : q.getLevel().getCode())
                .like(StringUtils.hasText(q.getSearch()), ServiceLogEntry::getMessage, q.getSearch())
                .orderByAsc(ServiceLogEntry::getId)
                .last("LIMIT " + q.limitOrDefault() + " OFFSET " + q.offsetOrDefault());
        return entryMapper.selectList(w);
    }

    @Override
    public List<ServiceLogEntry> getServiceLogs(String serviceId, LogQuery query) {
        LogQuery q = query == null ? LogQuery.defaults() : query;
        LambdaQueryWrapper<ServiceLogEntry> w = new LambdaQueryWrapper<ServiceLogEntry>()
                .eq(ServiceLogEntry::getServiceId, serviceId)
                .eq(StringUtils.hasText(q.getSessionId()), ServiceLogEntry::getSessionId, q.getSessionId())
                .eq(q.getLevel() != null, ServiceLogEntry::getLevel, q.getLevel() == null ? null : q.getLevel().getCode())
                .like(StringUtils.hasText(q.getSearch()), ServiceLogEntry::getMessage, q.getSearch())
                .orderByDesc(ServiceLogEntry::getId)
                .last("LIMIT " + q.limitOrDefault() + " OFFSET " + q.offsetOrDefault());
        return entryMapper.selectList(w);
    }

    @Override
    public long getLogCount(String sessionId) {
        Long n = entryMapper.selectCount(new LambdaQueryWrapper<ServiceLogEntry>()
                .eq(ServiceLogEntry::getSessionId, sessionId));
        return n == null ? 0L : n;
    }

    @Override
    public LogStatsResponse getLogStats(String serviceId) {
        LogStatsResponse stats = new LogStatsResponse();
        stats.setTotalSessions(nullToZero(sessionMapper.selectCount(new LambdaQueryWrapper<ServiceLogSession>()
                .eq(ServiceLogSession::getServiceId, serviceId))));
        stats.setActiveSessions(nullToZero(sessionMapper.selectCount(new LambdaQueryWrapper<ServiceLogSession>()
                .eq(ServiceLogSession::getServiceId, serviceId)
                .isNull(ServiceLogSession::getStoppedAt))));
        stats.setTotalLogs(nullToZero(entryMapper.selectCount(new LambdaQueryWrapper<ServiceLogEntry>()
                .eq(ServiceLogEntry::getServiceId, serviceId))));

        List<Map<String, Object>> rows = entryMapper.selectMaps(new QueryWrapper<ServiceLogEntry>()
                .select("level", "COUNT(*) AS cnt")
                .eq("service_id", serviceId)
                .groupBy("level"));
        for (Map<String, Object> row : rows) {
            Object level = row.get("level");
            Object cnt = row.get("cnt");
            long c = cnt instanceof Number ? ((Number) cnt).longValue() : 0L;
            stats.getLogsByLevel().add(new LogStatsResponse.LevelCount(level == null ? null : level.toString(), c));
        }
        return stats;
    }

    @Override
    @Transactional
    public boolean deleteSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) return false;
        entryMapper.delete(new LambdaQueryWrapper<ServiceLogEntry>().eq(ServiceLogEntry::getSessionId, sessionId));
        return sessionMapper.deleteById(sessionId) > 0;
    }

    @Override
    @Transactional
    public int deleteServiceLogs(String serviceId) {
        if (!StringUtils.hasText(serviceId)) return 0;
        int logs = entryMapper.delete(new LambdaQueryWrapper<ServiceLogEntry>()
                .eq(ServiceLogEntry::getServiceId, serviceId));
        int sessions = sessionMapper.delete(new LambdaQueryWrapper<ServiceLogSession>()
                .eq(ServiceLogSession::getServiceId, serviceId));
        return logs + sessions;
    }

    @Override
    @Transactional
    public int deleteOldLogs(int daysOld) {
        long cutoff = System.currentTimeMillis() - daysOld * DAY_MS;
        int logs = entryMapper.delete(new LambdaQueryWrapper<ServiceLogEntry>()
                .inSql(ServiceLogEntry::getSessionId,
                        "SELECT id FROM service_log_sessions WHERE started_at < " + cutoff));
        int sessions = sessionMapper.delete(new LambdaQueryWrapper<ServiceLogSession>()
                .lt(ServiceLogSession::getStartedAt, cutoff));
        if (logs + sessions > 0) {
            log.info("deleted old logs: daysOld={}, logs={}, sessions={}", daysOld, logs, sessions);
        }
        return logs + sessions;
    }

    @Override
    public LogLevel parseLogLevel(String message) {
        return LogLevel.parse(message);
    }

    String truncate(String message) {
        if (message == null) return "";
        int max = props.getLogs().getMaxMessageLength();
        if (max <= 0 || message.length() <= max) {
            return message;
        }
        return message.substring(0, max) + TRUNCATED_SUFFIX;
    }

    private static long nullToZero(Long n) {
        return n == null ? 0L : n;
    }
}
