package fun.ai.devhub.service.impl;

import fun.ai.devhub.common.WorkspaceNotFoundException;
import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.Workspace;
import fun.ai.devhub.log.LogEntryInput;
import fun.ai.devhub.mapper.ServiceHealthCheckMapper;
import fun.ai.devhub.mapper.WorkspaceMapper;
import fun.ai.devhub.service.ServiceConfigService;
import fun.ai.devhub.service.ServiceLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ServiceConfigServiceImplTest {

    @Autowired
    private ServiceConfigService configService;

    @Autowired
    private ServiceLogService logService;

    @Autowired
    private WorkspaceMapper workspaceMapper;

    @Autowired
    private ServiceHealthCheckMapper healthCheckMapper;

    private String workspaceId;

    @BeforeEach
    void setUp() {
        Workspace ws = new Workspace();
        ws.setId("ws_" + UUID.randomUUID());
        ws.setName("test workspace");
        ws.setActive(true);
        ws.setCreatedAt(System.currentTimeMillis());
        workspaceMapper.insert(ws);
        workspaceId = ws.getId();
    }

    private ServiceConfig newConfig(String name) {
        ServiceConfig cfg = new ServiceConfig();
        cfg.setName(name);
        cfg.setRepoPath("/tmp/" + name);
        cfg.setCommand("npm run dev");
        cfg.setPort(3000);
        cfg.setEnvVars(Map.of("NODE_ENV", "development"));
        return cfg;
    }

    @Test
    void testCreateRequiresExistingWorkspace() {
        assertThrows(WorkspaceNotFoundException.class, () -> configService.createService("ws_missing", newConfig("api")));
    }

    @Test
    void testCreateAndGet() {
        ServiceConfig created = configService.createService(workspaceId, newConfig("api"));

        assertTrue(created.getId().startsWith("service_"));
        ServiceConfig loaded = configService.getService(created.getId());
        assertEquals("api", loaded.getName());
        assertEquals(workspaceId, loaded.getWorkspaceId());
        assertEquals("development", loaded.getEnvVars().get("NODE_ENV"));
        assertEquals("unknown", loaded.getHealthStatus());

        List<ServiceConfig> inWorkspace = configService.getAllServices(workspaceId);
        assertEquals(1, inWorkspace.size());
    }

    @Test
    void testPartialUpdate() {
        ServiceConfig created = configService.createService(workspaceId, newConfig("web"));

        ServiceConfig patch = new ServiceConfig();
        patch.setCommand("npm start");
        assertTrue(configService.updateService(created.getId(), patch));

        ServiceConfig loaded = configService.getService(created.getId());
        assertEquals("npm start", loaded.getCommand());
        assertEquals("web", loaded.getName());
        assertEquals(3000, loaded.getPort());

        // 没有字段 / id 不存在
        assertFalse(configService.updateService(created.getId(), new ServiceConfig()));
        assertFalse(configService.updateService("service_missing", patch));
    }

    @Test
    void testDeleteRemovesHealthChecksAndLogs() {
        ServiceConfig created = configService.createService(workspaceId, newConfig("worker"));
        String id = created.getId();
        ServiceHealthCheck hc = new ServiceHealthCheck();
        hc.setId("hc_" + UUID.randomUUID());
        hc.setServiceId(id);
        hc.setType("tcp");
        hc.setPort(3000);
        hc.setEnabled(false);
        healthCheckMapper.insert(hc);
        ServiceLogSession session = logService.createSession(id);
        logService.writeLogs(session.getId(), id, List.of(LogEntryInput.of("hello")));

        assertTrue(configService.deleteService(id));

        assertNull(configService.getService(id));
        assertNull(healthCheckMapper.selectById(hc.getId()));
        assertNull(logService.getSession(session.getId()));
        assertEquals(0, logService.getLogCount(session.getId()));
        assertFalse(configService.deleteService(id));
    }

    @Test
    void testHealthStatusWriteBack() {
        ServiceConfig created = configService.createService(workspaceId, newConfig("db"));

        configService.updateHealthStatus(created.getId(), false);
        configService.updateHealthStatus(created.getId(), false);
        ServiceConfig unhealthy = configService.getService(created.getId());
        assertEquals("unhealthy", unhealthy.getHealthStatus());
        assertEquals(2, unhealthy.getHealthCheckFailures());
        assertNotNull(unhealthy.getLastHealthCheck());

        configService.updateHealthStatus(created.getId(), true);
        ServiceConfig healthy = configService.getService(created.getId());
        assertEquals("healthy", healthy.getHealthStatus());
        assertEquals(0, healthy.getHealthCheckFailures());
    }

    @Test
    void testResolveWorkspaceId() {
        assertEquals("ws_given", configService.resolveWorkspaceId("ws_given"));

        String resolved = configService.resolveWorkspaceId(null);
        Workspace active = workspaceMapper.selectById(resolved);
        assertNotNull(active);
        assertTrue(active.getActive());
    }
}
