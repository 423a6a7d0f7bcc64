package fun.ai.devhub.controller.log;

import fun.ai.devhub.common.Result;
import fun.ai.devhub.entity.ServiceLogEntry;
import fun.ai.devhub.entity.ServiceLogSession;
import fun.ai.devhub.entity.response.LogStatsResponse;
import fun.ai.devhub.log.LogLevel;
import fun.ai.devhub.log.LogQuery;
import fun.ai.devhub.service.ServiceLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 持久化日志查询与清理（每次进程运行一个 session）
 */
@RestController
@RequestMapping("/api/logs")
@Tag(name = "DevHub 服务日志", description = "历史日志：session 列表、按 session/服务查询、统计与清理")
public class ServiceLogController {
    private static final Logger log = LoggerFactory.getLogger(ServiceLogController.class);

    private final ServiceLogService logService;

    public ServiceLogController(ServiceLogService logService) {
        this.logService = logService;
    }

    @GetMapping("/sessions/{serviceId}")
    @Operation(summary = "服务的 session 列表（新的在前）")
    public Result<List<ServiceLogSession>> sessions(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId,
            @Parameter(description = "条数，默认 50") @RequestParam(defaultValue = "50") int limit
    ) {
        return Result.success(logService.getSessions(serviceId, limit));
    }

    @GetMapping("/sessions/{serviceId}/active")
    @Operation(summary = "当前打开的 session", description = "进程未运行时 data 为 null")
    public Result<ServiceLogSession> activeSession(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId
    ) {
        return Result.success(logService.getActiveSession(serviceId));
    }

    @GetMapping("/session/{sessionId}")
    @Operation(summary = "按 session 查询日志（按到达顺序升序）")
    public Result<List<ServiceLogEntry>> sessionLogs(
            @Parameter(description = "session ID", required = true) @PathVariable String sessionId,
            @Parameter(description = "info/warn/error/debug") @RequestParam(required = false) String level,
            @Parameter(description = "message 子串") @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        try {
            return Result.success(logService.getLogs(sessionId, buildQuery(null, level, search, limit, offset)));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        }
    }

    @GetMapping("/service/{serviceId}")
    @Operation(summary = "按服务查询日志（跨 session，最新在前）")
    public Result<List<ServiceLogEntry>> serviceLogs(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId,
            @Parameter(description = "只看某个 session") @RequestParam(required = false) String sessionId,
            @Parameter(description = "info/warn/error/debug") @RequestParam(required = false) String level,
            @Parameter(description = "message 子串") @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        try {
            return Result.success(logService.getServiceLogs(serviceId, buildQuery(sessionId, level, search, limit, offset)));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        }
    }

    @GetMapping("/stats/{serviceId}")
    @Operation(summary = "日志统计", description = "session 数、日志行数、打开中的 session 数、按级别计数")
    public Result<LogStatsResponse> stats(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId
    ) {
        return Result.success(logService.getLogStats(serviceId));
    }

    @DeleteMapping("/session/{sessionId}")
    @Operation(summary = "删除一个 session 及其日志")
    public Result<Boolean> deleteSession(
            @Parameter(description = "session ID", required = true) @PathVariable String sessionId
    ) {
        try {
            return Result.success(logService.deleteSession(sessionId));
        } catch (Exception e) {
            log.error("delete log session failed: sessionId={}, error={}", sessionId, e.getMessage(), e);
            return Result.error("delete log session failed: " + e.getMessage());
        }
    }

    @DeleteMapping("/service/{serviceId}")
    @Operation(summary = "删除服务的全部历史日志", description = "返回删除的行数（日志 + session）")
    public Result<Integer> deleteServiceLogs(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId
    ) {
        try {
            return Result.success(logService.deleteServiceLogs(serviceId));
        } catch (Exception e) {
            log.error("delete service logs failed: serviceId={}, error={}", serviceId, e.getMessage(), e);
            return Result.error("delete service logs failed: " + e.getMessage());
        }
    }

    @PostMapping("/cleanup")
    @Operation(summary = "清理过期日志", description = "删除 startedAt 早于 daysOld 天的 session 及其日志，返回删除的行数")
    public Result<Integer> cleanup(
            @Parameter(description = "天数，默认 30") @RequestParam(defaultValue = "30") int daysOld
    ) {
        if (daysOld < 0) {
            return Result.error(400, "daysOld 不能为负数");
        }
        try {
            return Result.success(logService.deleteOldLogs(daysOld));
        } catch (Exception e) {
            log.error("cleanup logs failed: daysOld={}, error={}", daysOld, e.getMessage(), e);
            return Result.error("cleanup logs failed: " + e.getMessage());
        }
    }

    private static LogQuery buildQuery(String sessionId, String level, String search, Integer limit, Integer offset) {
        LogQuery q = new LogQuery();
        q.setSessionId(sessionId);
        q.setLevel(LogLevel.fromCode(level));
        q.setSearch(search);
        q.setLimit(limit);
        q.setOffset(offset);
        return q;
    }
}
