package fun.ai.devhub.controller.service;

import fun.ai.devhub.common.DevHubException;
import fun.ai.devhub.common.Result;
import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.entity.request.ServiceBatchCreateRequest;
import fun.ai.devhub.entity.request.ServiceCreateRequest;
import fun.ai.devhub.entity.request.ServiceUpdateRequest;
import fun.ai.devhub.entity.response.BatchCreateResult;
import fun.ai.devhub.entity.response.RunningService;
import fun.ai.devhub.entity.response.ServiceWithStatusResponse;
import fun.ai.devhub.process.ServiceProcessManager;
import fun.ai.devhub.service.ServiceConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 服务定义 CRUD + 进程生命周期（start/stop/status/tail）
 */
@RestController
@RequestMapping("/api/services")
@Tag(name = "DevHub 服务", description = "服务定义与进程运行态：同一服务同一时间仅允许一个存活进程")
public class ServiceController {
    private static final Logger log = LoggerFactory.getLogger(ServiceController.class);

    private final ServiceProcessManager processManager;
    private final ServiceConfigService configService;

    public ServiceController(ServiceProcessManager processManager, ServiceConfigService configService) {
        this.processManager = processManager;
        this.configService = configService;
    }

    @GetMapping
    @Operation(summary = "服务列表（含运行态）", description = "不传 workspaceId 时使用当前 active workspace")
    public Result<List<ServiceWithStatusResponse>> list(
            @Parameter(description = "workspace ID") @RequestParam(required = false) String workspaceId
    ) {
        try {
            String wsId = configService.resolveWorkspaceId(workspaceId);
            List<ServiceWithStatusResponse> out = new ArrayList<>();
            for (ServiceConfig cfg : processManager.getAllServices(wsId)) {
                out.add(ServiceWithStatusResponse.of(cfg, processManager.getServiceStatus(cfg.getId())));
            }
            return Result.success(out);
        } catch (DevHubException e) {
            return Result.error(e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("list services failed: workspaceId={}, error={}", workspaceId, e.getMessage(), e);
            return Result.error("list services failed: " + e.getMessage());
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "服务详情（含运行态）")
    public Result<ServiceWithStatusResponse> get(
            @Parameter(description = "服务ID", required = true) @PathVariable String id
    ) {
        ServiceConfig cfg = processManager.getService(id);
        if (cfg == null) {
            return Result.error(404, "服务不存在: " + id);
        }
        return Result.success(ServiceWithStatusResponse.of(cfg, processManager.getServiceStatus(id)));
    }

    @PostMapping
    @Operation(summary = "创建服务", description = "name/repoPath/command 必填；workspace 不存在返回 404")
    public Result<ServiceConfig> create(@Valid @RequestBody ServiceCreateRequest req) {
        try {
            String wsId = configService.resolveWorkspaceId(req.getWorkspaceId());
            return Result.success(processManager.createService(wsId, toConfig(req)));
        } catch (DevHubException e) {
            return Result.error(e.getCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("create service failed: name={}, error={}", req.getName(), e.getMessage(), e);
            return Result.error("create service failed: " + e.getMessage());
        }
    }

    @PostMapping("/batch")
    @Operation(summary = "批量创建服务", description = "同一 workspace 下 repoPath 已存在的跳过；单个失败不影响其它")
    public Result<BatchCreateResult> batchCreate(@Valid @RequestBody ServiceBatchCreateRequest req) {
        try {
            String wsId = configService.resolveWorkspaceId(req.getWorkspaceId());
            Set<String> existingPaths = new HashSet<>();
            for (ServiceConfig cfg : processManager.getAllServices(wsId)) {
                existingPaths.add(cfg.getRepoPath());
            }
            BatchCreateResult result = new BatchCreateResult();
            for (ServiceCreateRequest item : req.getServices()) {
                if (existingPaths.contains(item.getRepoPath())) {
                    result.getSkipped().add(item.getRepoPath());
                    continue;
                }
                try {
                    ServiceConfig created = processManager.createService(wsId, toConfig(item));
                    existingPaths.add(created.getRepoPath());
                    result.getCreated().add(created);
                } catch (Exception e) {
                    log.warn("batch create item failed: name={}, error={}", item.getName(), e.getMessage());
                    result.getFailed().add(new BatchCreateResult.Failure(item.getName(), e.getMessage()));
                }
            }
            return Result.success(result);
        } catch (DevHubException e) {
            return Result.error(e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("batch create services failed: error={}", e.getMessage(), e);
            return Result.error("batch create services failed: " + e.getMessage());
        }
    }

    @PutMapping("/{id}")
    @Operation(summary = "更新服务（部分字段）", description = "仅更新非空字段；已运行的进程不受影响，下次 start 生效")
    public Result<ServiceConfig> update(
            @Parameter(description = "服务ID", required = true) @PathVariable String id,
            @RequestBody ServiceUpdateRequest req
    ) {
        ServiceConfig partial = new ServiceConfig();
        partial.setName(req.getName());
        partial.setRepoPath(req.getRepoPath());
        partial.setCommand(req.getCommand());
        partial.setPort(req.getPort());
        partial.setEnvVars(req.getEnvVars());
        if (!processManager.updateService(id, partial)) {
            return Result.error(404, "服务不存在或没有需要更新的字段: " + id);
        }
        return Result.success(processManager.getService(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除服务", description = "运行中会先 stop；同时删除健康检查与历史日志")
    public Result<Void> delete(
            @Parameter(description = "服务ID", required = true) @PathVariable String id
    ) {
        try {
            if (!processManager.deleteService(id)) {
                return Result.error(404, "服务不存在: " + id);
            }
            return Result.success();
        } catch (Exception e) {
            log.error("delete service failed: serviceId={}, error={}", id, e.getMessage(), e);
            return Result.error("delete service failed: " + e.getMessage());
        }
    }

    @PostMapping("/{id}/start")
    @Operation(summary = "启动服务", description = "已在运行返回 409；spawn 失败时返回 status=error（原因见 error 事件）")
    public Result<RunningService> start(
            @Parameter(description = "服务ID", required = true) @PathVariable String id
    ) {
        try {
            return Result.success(processManager.startService(id));
        } catch (DevHubException e) {
            return Result.error(e.getCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("start service failed: serviceId={}, error={}", id, e.getMessage(), e);
            return Result.error("start service failed: " + e.getMessage());
        }
    }

    @PostMapping("/{id}/stop")
    @Operation(summary = "停止服务", description = "TERM 整棵进程树，超时未退出再 KILL；不等待退出，未运行时为 no-op")
    public Result<RunningService> stop(
            @Parameter(description = "服务ID", required = true) @PathVariable String id
    ) {
        try {
            processManager.stopService(id);
            return Result.success(processManager.getServiceStatus(id));
        } catch (Exception e) {
            log.error("stop service failed: serviceId={}, error={}", id, e.getMessage(), e);
            return Result.error("stop service failed: " + e.getMessage());
        }
    }

    @GetMapping("/{id}/status")
    @Operation(summary = "查询运行态", description = "本次启动以来从未运行过时 data 为 null")
    public Result<RunningService> status(
            @Parameter(description = "服务ID", required = true) @PathVariable String id
    ) {
        return Result.success(processManager.getServiceStatus(id));
    }

    @GetMapping("/running")
    @Operation(summary = "运行中的服务", description = "不传 workspaceId 时返回全部")
    public Result<List<RunningService>> running(
            @Parameter(description = "workspace ID") @RequestParam(required = false) String workspaceId
    ) {
        if (workspaceId == null || workspaceId.isBlank()) {
            return Result.success(processManager.getRunningServices());
        }
        return Result.success(processManager.getRunningServicesForWorkspace(workspaceId));
    }

    @GetMapping("/{id}/logs")
    @Operation(summary = "最近输出（内存）", description = "当前/最近一次运行的最近 N 行；历史日志请用 /api/logs")
    public Result<List<String>> logs(
            @Parameter(description = "服务ID", required = true) @PathVariable String id,
            @Parameter(description = "行数，默认 100") @RequestParam(defaultValue = "100") int lines
    ) {
        return Result.success(processManager.getServiceLogs(id, lines));
    }

    private static ServiceConfig toConfig(ServiceCreateRequest req) {
        ServiceConfig cfg = new ServiceConfig();
        cfg.setName(req.getName());
        cfg.setRepoPath(req.getRepoPath());
        cfg.setCommand(req.getCommand());
        cfg.setPort(req.getPort());
        cfg.setEnvVars(req.getEnvVars());
        return cfg;
    }
}
