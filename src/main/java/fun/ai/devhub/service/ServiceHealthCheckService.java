package fun.ai.devhub.service;

import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.request.HealthCheckCreateRequest;

import java.util.List;

/**
 * 健康检查配置 CRUD；启用/停用会同步启动/停止探测
 */
public interface ServiceHealthCheckService {

    List<ServiceHealthCheck> listByService(String serviceId);

    ServiceHealthCheck getHealthCheck(String id);

    /**
     * 服务不存在抛 ServiceNotFoundException；enabled 时立即开始探测
     */
    ServiceHealthCheck createHealthCheck(String serviceId, HealthCheckCreateRequest req);

    boolean setEnabled(String id, boolean enabled);

    /**
     * 先停探测再删除
     */
    boolean deleteHealthCheck(String id);
}
