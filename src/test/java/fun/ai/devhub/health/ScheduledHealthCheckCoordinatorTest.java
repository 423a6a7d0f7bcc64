package fun.ai.devhub.health;

import com.sun.net.httpserver.HttpServer;
import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.mapper.ServiceHealthCheckMapper;
import fun.ai.devhub.process.CommandRunner;
import fun.ai.devhub.process.ProcessHandleTreeKiller;
import fun.ai.devhub.process.ShellCommandBuilder;
import fun.ai.devhub.service.ServiceConfigService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class ScheduledHealthCheckCoordinatorTest {

    private ServiceConfigService configService;
    private ScheduledHealthCheckCoordinator coordinator;

    @BeforeEach
    void setUp() {
        DevHubProperties props = new DevHubProperties();
        configService = mock(ServiceConfigService.class);
        CommandRunner commandRunner = new CommandRunner(new ShellCommandBuilder(props), new ProcessHandleTreeKiller());
        coordinator = new ScheduledHealthCheckCoordinator(mock(ServiceHealthCheckMapper.class), configService, commandRunner, props);
    }

    @AfterEach
    void tearDown() {
        coordinator.stopAll();
    }

    private static ServiceHealthCheck check(String type) {
        ServiceHealthCheck hc = new ServiceHealthCheck();
        hc.setId("hc_" + type);
        hc.setServiceId("service_hc");
        hc.setType(type);
        hc.setTimeoutMs(1000);
        hc.setIntervalSeconds(60);
        hc.setEnabled(true);
        return hc;
    }

    @Test
    void testTcpProbe() throws Exception {
        ServiceHealthCheck hc = check("tcp");
        try (ServerSocket server = new ServerSocket(0)) {
            hc.setPort(server.getLocalPort());
            assertTrue(coordinator.probe(hc).isHealthy());
        }
        // 端口已关闭
        assertFalse(coordinator.probe(hc).isHealthy());

        hc.setPort(null);
        assertEquals("port not specified", coordinator.probe(hc).getError());
    }

    @Test
    void testHttpProbe() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/health", exchange -> {
            byte[] body = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            ServiceHealthCheck hc = check("http");
            hc.setEndpoint("http://localhost:" + server.getAddress().getPort() + "/health");
            hc.setExpectedStatus(200);
            assertTrue(coordinator.probe(hc).isHealthy());

            hc.setExpectedBody("\"ok\"");
            assertTrue(coordinator.probe(hc).isHealthy());

            hc.setExpectedBody("ready");
            assertFalse(coordinator.probe(hc).isHealthy());

            hc.setExpectedBody(null);
            hc.setExpectedStatus(204);
            assertEquals("expected status 204, got 200", coordinator.probe(hc).getError());
        } finally {
            server.stop(0);
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testCommandProbe() {
        ServiceHealthCheck hc = check("command");
        hc.setCommand("test 1 -eq 1");
        assertTrue(coordinator.probe(hc).isHealthy());

        hc.setCommand("exit 2");
        assertEquals("exit code 2", coordinator.probe(hc).getError());

        hc.setCommand("sleep 5");
        hc.setTimeoutMs(300);
        assertEquals("command timeout", coordinator.probe(hc).getError());
    }

    @Test
    void testUnknownType() {
        assertFalse(coordinator.probe(check("grpc")).isHealthy());
    }

    @Test
    void testStartRunsImmediatelyAndStopCancels() throws Exception {
        ServiceHealthCheck hc = check("tcp");
        try (ServerSocket server = new ServerSocket(0)) {
            hc.setPort(server.getLocalPort());

            coordinator.startHealthCheck(hc);
            coordinator.startHealthCheck(hc);
            assertTrue(coordinator.isRunning(hc.getId()));
            verify(configService, timeout(3000)).updateHealthStatus("service_hc", true);
        }

        coordinator.stopHealthCheck(hc.getId());
        assertFalse(coordinator.isRunning(hc.getId()));
        assertDoesNotThrow(() -> coordinator.stopHealthCheck("hc_missing"));
    }
}
