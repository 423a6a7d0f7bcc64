package fun.ai.devhub.service.impl;

import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.entity.ServiceLogEntry;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.response.LogStatsResponse;
import fun.ai.devhub.log.ExitReason;
import fun.ai.devhub.log.LogEntryInput;
import fun.ai.devhub.log.LogLevel;
import fun.ai.devhub.log.LogQuery;
import fun.ai.devhub.mapper.ServiceLogSessionMapper;
import fun.ai.devhub.service.ServiceLogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ServiceLogServiceImplTest {

    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    @Autowired
    private ServiceLogService logService;

    @Autowired
    private ServiceLogSessionMapper sessionMapper;

    @Autowired
    private DevHubProperties props;

    private static String newServiceId() {
        return "service_test_" + UUID.randomUUID();
    }

    @Test
    void testWriteLogsIncrementsCountInArrivalOrder() {
        String serviceId = newServiceId();
        ServiceLogSession session = logService.createSession(serviceId);
        long before = logService.getLogCount(session.getId());

        logService.writeLogs(session.getId(), serviceId, List.of(
                LogEntryInput.of("m1"),
                new LogEntryInput("m2", LogLevel.WARN),
                new LogEntryInput("m3", LogLevel.ERROR)));

        assertEquals(before + 3, logService.getLogCount(session.getId()));
        assertEquals(3, logService.getSession(session.getId()).getLogsCount());

        List<ServiceLogEntry> logs = logService.getLogs(session.getId(), LogQuery.defaults());
        assertEquals(List.of("m1", "m2", "m3"), logs.stream().map(ServiceLogEntry::getMessage).toList());
        assertTrue(logs.get(0).getId() < logs.get(1).getId());
        assertTrue(logs.get(1).getId() < logs.get(2).getId());
        // level 为空按 info 存
        assertEquals("info", logs.get(0).getLevel());
        assertEquals("warn", logs.get(1).getLevel());
    }

    @Test
    void testLongMessageTruncated() {
        String serviceId = newServiceId();
        ServiceLogSession session = logService.createSession(serviceId);
        String longMessage = "x".repeat(10_001);

        logService.writeLog(session.getId(), serviceId, longMessage, LogLevel.INFO);

        String stored = logService.getLogs(session.getId(), LogQuery.defaults()).get(0).getMessage();
        assertEquals(10_000 + ServiceLogServiceImpl.TRUNCATED_SUFFIX.length(), stored.length());
        assertTrue(stored.endsWith("...[truncated]"));
        assertTrue(stored.startsWith("xxxx"));
    }

    @Test
    void testConfiguredMaxLengthAboveDefaultIsStored() {
        int original = props.getLogs().getMaxMessageLength();
        props.getLogs().setMaxMessageLength(20_000);
        try {
            String serviceId = newServiceId();
            ServiceLogSession session = logService.createSession(serviceId);

            logService.writeLog(session.getId(), serviceId, "y".repeat(15_000), LogLevel.INFO);
            logService.writeLog(session.getId(), serviceId, "z".repeat(20_001), LogLevel.INFO);

            List<ServiceLogEntry> logs = logService.getLogs(session.getId(), LogQuery.defaults());
            assertEquals(2, logs.size());
            assertEquals(15_000, logs.get(0).getMessage().length());
            assertEquals(20_000 + ServiceLogServiceImpl.TRUNCATED_SUFFIX.length(), logs.get(1).getMessage().length());
        } finally {
            props.getLogs().setMaxMessageLength(original);
        }
    }

    @Test
    void testWriteToUnknownSessionIsNoop() {
        String serviceId = newServiceId();
        assertDoesNotThrow(() -> logService.writeLogs("session_missing", serviceId, List.of(LogEntryInput.of("lost"))));
        assertEquals(0, logService.getLogCount("session_missing"));
        assertTrue(logService.getServiceLogs(serviceId, LogQuery.defaults()).isEmpty());
    }

    @Test
    void testEndSessionOnlyOnce() {
        ServiceLogSession session = logService.createSession(newServiceId());
        assertNotNull(logService.getActiveSession(session.getServiceId()));

        assertTrue(logService.endSession(session.getId(), 0, ExitReason.STOPPED));
        assertFalse(logService.endSession(session.getId(), 1, ExitReason.CRASHED));
        assertFalse(logService.endSession("session_missing", 0, ExitReason.STOPPED));

        ServiceLogSession closed = logService.getSession(session.getId());
        assertNotNull(closed.getStoppedAt());
        assertEquals(0, closed.getExitCode());
        assertEquals("stopped", closed.getExitReason());
        assertNull(logService.getActiveSession(session.getServiceId()));
    }

    @Test
    void testServiceLogsDescendingWithFilters() {
        String serviceId = newServiceId();
        ServiceLogSession s1 = logService.createSession(serviceId);
        logService.writeLogs(s1.getId(), serviceId, List.of(
                new LogEntryInput("server starting", LogLevel.INFO),
                new LogEntryInput("port in use", LogLevel.ERROR)));
        logService.endSession(s1.getId(), 1, ExitReason.CRASHED);
        ServiceLogSession s2 = logService.createSession(serviceId);
        logService.writeLogs(s2.getId(), serviceId, List.of(
                new LogEntryInput("server starting", LogLevel.INFO),
                new LogEntryInput("server ready", LogLevel.INFO)));

        List<ServiceLogEntry> all = logService.getServiceLogs(serviceId, LogQuery.defaults());
        assertEquals(List.of("server ready", "server starting", "port in use", "server starting"),
                all.stream().map(ServiceLogEntry::getMessage).toList());

        LogQuery errors = new LogQuery();
        errors.setLevel(LogLevel.ERROR);
        assertEquals(1, logService.getServiceLogs(serviceId, errors).size());

        LogQuery onlyS2 = new LogQuery();
        onlyS2.setSessionId(s2.getId());
        onlyS2.setSearch("ready");
        List<ServiceLogEntry> ready = logService.getServiceLogs(serviceId, onlyS2);
        assertEquals(1, ready.size());
        assertEquals(s2.getId(), ready.get(0).getSessionId());

        LogQuery page = new LogQuery();
        page.setLimit(1);
        page.setOffset(1);
        List<ServiceLogEntry> second = logService.getLogs(s1.getId(), page);
        assertEquals(1, second.size());
        assertEquals("port in use", second.get(0).getMessage());

        LogStatsResponse stats = logService.getLogStats(serviceId);
        assertEquals(2, stats.getTotalSessions());
        assertEquals(1, stats.getActiveSessions());
        assertEquals(4, stats.getTotalLogs());
        long infoCount = stats.getLogsByLevel().stream()
                .filter(c -> "info".equals(c.getLevel()))
                .mapToLong(LogStatsResponse.LevelCount::getCount)
                .sum();
        assertEquals(3, infoCount);
    }

    @Test
    void testWriteLogsLargerThanOneInsertChunk() {
        String serviceId = newServiceId();
        ServiceLogSession session = logService.createSession(serviceId);
        List<LogEntryInput> entries = new ArrayList<>();
        for (int i = 0; i < 450; i++) {
            entries.add(LogEntryInput.of("line " + i));
        }

        logService.writeLogs(session.getId(), serviceId, entries);

        assertEquals(450, logService.getLogCount(session.getId()));
        LogQuery q = new LogQuery();
        q.setLimit(1000);
        List<ServiceLogEntry> logs = logService.getLogs(session.getId(), q);
        assertEquals("line 0", logs.get(0).getMessage());
        assertEquals("line 449", logs.get(449).getMessage());
    }

    @Test
    void testDeleteSessionAndServiceLogs() {
        String serviceId = newServiceId();
        ServiceLogSession s1 = logService.createSession(serviceId);
        logService.writeLogs(s1.getId(), serviceId, List.of(LogEntryInput.of("a"), LogEntryInput.of("b")));
        ServiceLogSession s2 = logService.createSession(serviceId);
        logService.writeLogs(s2.getId(), serviceId, List.of(LogEntryInput.of("c")));

        assertTrue(logService.deleteSession(s1.getId()));
        assertFalse(logService.deleteSession(s1.getId()));
        assertEquals(0, logService.getLogCount(s1.getId()));

        // 1 行日志 + 1 个 session
        assertEquals(2, logService.deleteServiceLogs(serviceId));
        assertTrue(logService.getSessions(serviceId, 50).isEmpty());
    }

    @Test
    void testDeleteOldLogs() {
        String serviceId = newServiceId();
        ServiceLogSession old = logService.createSession(serviceId);
        logService.writeLogs(old.getId(), serviceId, List.of(LogEntryInput.of("old 1"), LogEntryInput.of("old 2")));
        ServiceLogSession aged = new ServiceLogSession();
        aged.setId(old.getId());
        aged.setStartedAt(System.currentTimeMillis() - 31 * DAY_MS);
        sessionMapper.updateById(aged);

        ServiceLogSession recent = logService.createSession(serviceId);
        logService.writeLogs(recent.getId(), serviceId, List.of(LogEntryInput.of("new")));

        // 2 行日志 + 1 个 session
        assertEquals(3, logService.deleteOldLogs(30));
        assertNull(logService.getSession(old.getId()));
        assertNotNull(logService.getSession(recent.getId()));
        assertEquals(1, logService.getLogCount(recent.getId()));
    }

    @Test
    void testSessionsNewestFirst() {
        String serviceId = newServiceId();
        ServiceLogSession first = logService.createSession(serviceId);
        ServiceLogSession older = new ServiceLogSession();
        older.setId(first.getId());
        older.setStartedAt(first.getStartedAt() - 1000);
        sessionMapper.updateById(older);
        ServiceLogSession second = logService.createSession(serviceId);

        List<ServiceLogSession> sessions = logService.getSessions(serviceId, 10);
        assertEquals(2, sessions.size());
        assertEquals(second.getId(), sessions.get(0).getId());
        assertEquals(1, logService.getSessions(serviceId, 1).size());
    }
}
