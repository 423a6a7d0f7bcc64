package fun.ai.devhub.controller.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.devhub.process.ServiceProcessManager;
import fun.ai.devhub.process.event.ServiceEvent;
import fun.ai.devhub.process.event.ServiceEventSubscription;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@RestController
@RequestMapping("/api/realtime")
@Tag(name = "DevHub 实时通道", description = "SSE：推送服务生命周期事件（log/exit/error）")
public class ServiceRealtimeController {
    private static final Logger log = LoggerFactory.getLogger(ServiceRealtimeController.class);

    private static final long KEEP_ALIVE_MS = 25_000L;

    private final ServiceProcessManager processManager;
    private final ObjectMapper objectMapper;

    // 所有连接共用：只发 keep-alive 注释
    private final ScheduledExecutorService keepAliveScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    public ServiceRealtimeController(ServiceProcessManager processManager, ObjectMapper objectMapper) {
        this.processManager = processManager;
        this.objectMapper = objectMapper;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "SSE：服务生命周期事件",
            description = "事件名即事件类型：log（一个输出块的若干行）/exit（退出码，被信号结束时为 null）/error（spawn 失败等）。"
                    + "连接建立时先推送一次 snapshot（当前运行中的服务）。"
    )
    public ResponseEntity<SseEmitter> events(
            @Parameter(description = "可选：只推送该服务的事件") @RequestParam(required = false) String serviceId
    ) {
        // 不设置超时（由前端主动断开/重连）
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean closed = new AtomicBoolean(false);
        AtomicReference<ServiceEventSubscription> subscription = new AtomicReference<>();
        AtomicReference<ScheduledFuture<?>> keepAlive = new AtomicReference<>();
        Runnable close = () -> safeClose(emitter, subscription.get(), keepAlive.get(), closed);

        try {
            String json = objectMapper.writeValueAsString(processManager.getRunningServices());
            emitter.send(SseEmitter.event().name("snapshot").data(json, MediaType.APPLICATION_JSON));
        } catch (Exception e) {
            log.debug("send sse snapshot failed: error={}", e.getMessage());
            close.run();
            return ResponseEntity.ok().body(emitter);
        }

        subscription.set(processManager.subscribe(event -> {
            if (closed.get()) return;
            if (StringUtils.hasText(serviceId) && !serviceId.equals(event.getServiceId())) return;
            send(emitter, event, close);
        }));

        keepAlive.set(keepAliveScheduler.scheduleWithFixedDelay(() -> {
            if (closed.get()) return;
            try {
                // 注释行格式：": xxx\n\n"（EventSource 不会触发 message 事件）
                emitter.send(":" + System.currentTimeMillis() + "\n\n");
            } catch (Exception e) {
                close.run();
            }
        }, KEEP_ALIVE_MS, KEEP_ALIVE_MS, TimeUnit.MILLISECONDS));
        if (closed.get()) {
            keepAlive.get().cancel(false);
        }

        emitter.onCompletion(close);
        emitter.onTimeout(close);
        emitter.onError(ex -> close.run());

        // nginx 反代 SSE 时容易被缓冲：通过 header 明确禁用缓冲/缓存
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CACHE_CONTROL, "no-cache");
        headers.add("X-Accel-Buffering", "no");
        return ResponseEntity.ok().headers(headers).body(emitter);
    }

    private void send(SseEmitter emitter, ServiceEvent event, Runnable close) {
        try {
            String json = objectMapper.writeValueAsString(event);
            emitter.send(SseEmitter.event().name(event.getType()).data(json, MediaType.APPLICATION_JSON));
        } catch (Exception e) {
            // 客户端已断开
            log.debug("send sse event failed: serviceId={}, type={}, error={}",
                    event.getServiceId(), event.getType(), e.getMessage());
            close.run();
        }
    }

    private void safeClose(SseEmitter emitter, ServiceEventSubscription subscription,
                           ScheduledFuture<?> keepAlive, AtomicBoolean closed) {
        if (!closed.compareAndSet(false, true)) return;
        if (subscription != null) {
            subscription.close();
        }
        if (keepAlive != null) {
            keepAlive.cancel(false);
        }
        try {
            emitter.complete();
        } catch (Exception e) {
            log.debug("complete sse emitter failed: error={}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        keepAliveScheduler.shutdownNow();
    }
}
