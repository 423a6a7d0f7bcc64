package fun.ai.devhub.health;

import fun.ai.devhub.entity.ServiceHealthCheck;

import java.util.List;

/**
 * 健康检查调度：由进程生命周期驱动（spawn 成功后启动，停止/退出时停止），反向不调用
 */
public interface HealthCheckCoordinator {

    List<ServiceHealthCheck> getHealthChecks(String serviceId);

    /**
     * 已在运行的同一 check 再次启动为 no-op
     */
    void startHealthCheck(ServiceHealthCheck check);

    /**
     * 未运行的 check 为 no-op
     */
    void stopHealthCheck(String checkId);
}
