package fun.ai.devhub.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import fun.ai.devhub.common.WorkspaceNotFoundException;
import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.Workspace;
import fun.ai.devhub.mapper.ServiceConfigMapper;
import fun.ai.devhub.mapper.ServiceHealthCheckMapper;
import fun.ai.devhub.mapper.WorkspaceMapper;
import fun.ai.devhub.service.ServiceConfigService;
import fun.ai.devhub.service.ServiceLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.UUID;

@Service
public class ServiceConfigServiceImpl implements ServiceConfigService {
    private static final Logger log = LoggerFactory.getLogger(ServiceConfigServiceImpl.class);

    private final ServiceConfigMapper serviceConfigMapper;
    private final WorkspaceMapper workspaceMapper;
    private final ServiceHealthCheckMapper healthCheckMapper;
    private final ServiceLogService logService;

    public ServiceConfigServiceImpl(ServiceConfigMapper serviceConfigMapper,
                                    WorkspaceMapper workspaceMapper,
                                    ServiceHealthCheckMapper healthCheckMapper,
                                    ServiceLogService logService) {
        this.serviceConfigMapper = serviceConfigMapper;
        this.workspaceMapper = workspaceMapper;
        this.healthCheckMapper = healthCheckMapper;
        this.logService = logService;
    }

    @Override
    public List<ServiceConfig> getAllServices(String workspaceId) {
        return serviceConfigMapper.selectList(new LambdaQueryWrapper<ServiceConfig>()
                .eq(StringUtils.hasText(workspaceId), ServiceConfig::getWorkspaceId, workspaceId)
                .orderByAsc(ServiceConfig::getName));
    }

    @Override
    public ServiceConfig getService(String serviceId) {
        if (!StringUtils.hasText(serviceId)) return null;
        return serviceConfigMapper.selectById(serviceId);
    }

    @Override
    public ServiceConfig createService(String workspaceId, ServiceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config 不能为空");
        }
        if (!StringUtils.hasText(workspaceId) || workspaceMapper.selectById(workspaceId) == null) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        long now = System.currentTimeMillis();
        ServiceConfig row = new ServiceConfig();
        row.setId("service_" + now + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9));
        row.setWorkspaceId(workspaceId);
        row.setName(config.getName());
        row.setRepoPath(config.getRepoPath());
        row.setCommand(config.getCommand());
        row.setPort(config.getPort());
        row.setEnvVars(config.getEnvVars() == null ? new HashMap<>() : new HashMap<>(config.getEnvVars()));
        row.setHealthStatus("unknown");
        row.setHealthCheckFailures(0);
        row.setCreatedAt(now);
        row.setUpdatedAt(now);
        serviceConfigMapper.insert(row);
        log.info("service created: serviceId={}, workspaceId={}, name={}", row.getId(), workspaceId, row.getName());
        return row;
    }

    @Override
    public boolean updateService(String serviceId, ServiceConfig partial) {
        if (!StringUtils.hasText(serviceId) || partial == null) return false;

        ServiceConfig patch = new ServiceConfig();
        boolean any = false;
        if (partial.getName() != null) {
            patch.setName(partial.getName());
            any = true;
        }
        if (partial.getRepoPath() != null) {
            patch.setRepoPath(partial.getRepoPath());
            any = true;
        }
        if (partial.getCommand() != null) {
            patch.setCommand(partial.getCommand());
            any = true;
        }
        if (partial.getPort() != null) {
            patch.setPort(partial.getPort());
            any = true;
        }
        if (partial.getEnvVars() != null) {
            patch.setEnvVars(new HashMap<>(partial.getEnvVars()));
            any = true;
        }
        if (!any) return false;

        patch.setId(serviceId);
        patch.setUpdatedAt(System.currentTimeMillis());
        // updateById 默认忽略 null 字段，天然就是部分更新
        return serviceConfigMapper.updateById(patch) > 0;
    }

    @Override
    @Transactional
    public boolean deleteService(String serviceId) {
        if (!StringUtils.hasText(serviceId)) return false;
        healthCheckMapper.delete(new LambdaQueryWrapper<ServiceHealthCheck>()
                .eq(ServiceHealthCheck::getServiceId, serviceId));
        logService.deleteServiceLogs(serviceId);
        boolean deleted = serviceConfigMapper.deleteById(serviceId) > 0;
        if (deleted) {
            log.info("service deleted: serviceId={}", serviceId);
        }
        return deleted;
    }

    @Override
    public String resolveWorkspaceId(String workspaceId) {
        if (StringUtils.hasText(workspaceId)) {
            return workspaceId;
        }
        List<Workspace> active = workspaceMapper.selectList(new LambdaQueryWrapper<Workspace>()
                .eq(Workspace::getActive, true)
                .last("LIMIT 1"));
        if (active.isEmpty()) {
            throw new WorkspaceNotFoundException(null);
        }
        return active.get(0).getId();
    }

    @Override
    public void updateHealthStatus(String serviceId, boolean healthy) {
        int n = serviceConfigMapper.updateHealth(serviceId, healthy ? "healthy" : "unhealthy", healthy,
                System.currentTimeMillis());
        if (n == 0) {
            log.debug("health status skipped, service not found: serviceId={}", serviceId);
        }
    }
}
