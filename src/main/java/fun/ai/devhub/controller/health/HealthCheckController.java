package fun.ai.devhub.controller.health;

import fun.ai.devhub.common.DevHubException;
import fun.ai.devhub.common.Result;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.request.HealthCheckCreateRequest;
import fun.ai.devhub.service.ServiceHealthCheckService;
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

import java.util.List;

@RestController
@RequestMapping("/api/health-checks")
@Tag(name = "DevHub 健康检查", description = "http/tcp/command 周期探测，结果写回服务的 healthStatus")
public class HealthCheckController {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckController.class);

    private final ServiceHealthCheckService healthCheckService;

    public HealthCheckController(ServiceHealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @GetMapping("/service/{serviceId}")
    @Operation(summary = "服务的健康检查列表")
    public Result<List<ServiceHealthCheck>> list(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId
    ) {
        return Result.success(healthCheckService.listByService(serviceId));
    }

    @PostMapping("/service/{serviceId}")
    @Operation(summary = "创建健康检查", description = "enabled（默认 true）时立即开始探测")
    public Result<ServiceHealthCheck> create(
            @Parameter(description = "服务ID", required = true) @PathVariable String serviceId,
            @Valid @RequestBody HealthCheckCreateRequest req
    ) {
        try {
            return Result.success(healthCheckService.createHealthCheck(serviceId, req));
        } catch (DevHubException e) {
            return Result.error(e.getCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        } catch (Exception e) {
            log.error("create health check failed: serviceId={}, error={}", serviceId, e.getMessage(), e);
            return Result.error("create health check failed: " + e.getMessage());
        }
    }

    @PutMapping("/{id}/enabled")
    @Operation(summary = "启用/停用健康检查")
    public Result<Void> setEnabled(
            @Parameter(description = "健康检查ID", required = true) @PathVariable String id,
            @Parameter(description = "true 启用 / false 停用", required = true) @RequestParam boolean enabled
    ) {
        if (!healthCheckService.setEnabled(id, enabled)) {
            return Result.error(404, "健康检查不存在: " + id);
        }
        return Result.success();
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除健康检查", description = "先停止探测再删除")
    public Result<Void> delete(
            @Parameter(description = "健康检查ID", required = true) @PathVariable String id
    ) {
        if (!healthCheckService.deleteHealthCheck(id)) {
            return Result.error(404, "健康检查不存在: " + id);
        }
        return Result.success();
    }
}
