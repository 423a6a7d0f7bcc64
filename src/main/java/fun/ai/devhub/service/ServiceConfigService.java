package fun.ai.devhub.service;

import fun.ai.devhub.entity.ServiceConfig;

import java.util.List;

/**
 * 服务定义存储（services 表）
 */
public interface ServiceConfigService {

    /**
     * workspaceId 为空时返回全部
     */
    List<ServiceConfig> getAllServices(String workspaceId);

    ServiceConfig getService(String serviceId);

    /**
     * 校验 workspace 存在，生成 id（service_{epochMs}_{random}）后写入
     */
    ServiceConfig createService(String workspaceId, ServiceConfig config);

    /**
     * 部分更新：只写入非空字段；无字段或 id 不存在返回 false
     */
    boolean updateService(String serviceId, ServiceConfig partial);

    /**
     * 删除服务定义，同一事务内一并删除其健康检查与日志（session + 行）
     */
    boolean deleteService(String serviceId);

    /**
     * workspaceId 为空时回落到当前 active workspace；都没有则抛 WorkspaceNotFoundException
     */
    String resolveWorkspaceId(String workspaceId);

    /**
     * 健康检查结果回写
     */
    void updateHealthStatus(String serviceId, boolean healthy);
}
