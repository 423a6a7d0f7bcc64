package fun.ai.devhub.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import fun.ai.devhub.common.ServiceNotFoundException;
import fun.ai.devhub.entity.ServiceHealthCheck;
import fun.ai.devhub.entity.request.HealthCheckCreateRequest;
import fun.ai.devhub.health.HealthCheckCoordinator;
import fun.ai.devhub.mapper.ServiceHealthCheckMapper;
import fun.ai.devhub.service.ServiceConfigService;
import fun.ai.devhub.service.ServiceHealthCheckService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.UUID;

@Service
public class ServiceHealthCheckServiceImpl implements ServiceHealthCheckService {

    private final ServiceHealthCheckMapper healthCheckMapper;
    private final ServiceConfigService configService;
    private final HealthCheckCoordinator coordinator;

    public ServiceHealthCheckServiceImpl(ServiceHealthCheckMapper healthCheckMapper,
                                         ServiceConfigService configService,
                                         HealthCheckCoordinator coordinator) {
        this.healthCheckMapper = healthCheckMapper;
        this.configService = configService;
        this.coordinator = coordinator;
    }

    @Override
    public List<ServiceHealthCheck> listByService(String serviceId) {
        return healthCheckMapper.selectList(new LambdaQueryWrapper<ServiceHealthCheck>()
                .eq(ServiceHealthCheck::getServiceId, serviceId)
                .orderByAsc(ServiceHealthCheck::getCreatedAt));
    }

    @Override
    public ServiceHealthCheck getHealthCheck(String id) {
        if (!StringUtils.hasText(id)) return null;
        return healthCheckMapper.selectById(id);
    }

    @Override
    public ServiceHealthCheck createHealthCheck(String serviceId, HealthCheckCreateRequest req) {
        if (configService.getService(serviceId) == null) {
            throw new ServiceNotFoundException(serviceId);
        }
        if (req == null || !StringUtils.hasText(req.getType())) {
            throw new IllegalArgumentException("type 不能为空");
        }
        switch (req.getType()) {
            case "http":
                if (!StringUtils.hasText(req.getEndpoint())) throw new IllegalArgumentException("http 检查需要 endpoint");
                break;
            case "tcp":
                if (req.getPort() == null) throw new IllegalArgumentException("tcp 检查需要 port");
                break;
            case "command":
                if (!StringUtils.hasText(req.getCommand())) throw new IllegalArgumentException("command 检查需要 command");
                break;
            default:
                throw new IllegalArgumentException("type 只能是 http/tcp/command");
        }

        long now = System.currentTimeMillis();
        ServiceHealthCheck hc = new ServiceHealthCheck();
        hc.setId("hc_" + now + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9));
        hc.setServiceId(serviceId);
        hc.setType(req.getType());
        hc.setEndpoint(req.getEndpoint());
        hc.setExpectedStatus(req.getExpectedStatus() == null ? 200 : req.getExpectedStatus());
        hc.setExpectedBody(req.getExpectedBody());
        hc.setPort(req.getPort());
        hc.setCommand(req.getCommand());
        hc.setIntervalSeconds(req.getIntervalSeconds() == null ? 30 : req.getIntervalSeconds());
        hc.setTimeoutMs(req.getTimeoutMs() == null ? 5000 : req.getTimeoutMs());
        hc.setRetries(req.getRetries() == null ? 3 : req.getRetries());
        hc.setEnabled(req.getEnabled() == null || req.getEnabled());
        hc.setCreatedAt(now);
        hc.setUpdatedAt(now);
        healthCheckMapper.insert(hc);

        if (Boolean.TRUE.equals(hc.getEnabled())) {
            coordinator.startHealthCheck(hc);
        }
        return hc;
    }

    @Override
    public boolean setEnabled(String id, boolean enabled) {
        ServiceHealthCheck hc = getHealthCheck(id);
        if (hc == null) return false;

        ServiceHealthCheck patch = new ServiceHealthCheck();
        patch.setId(id);
        patch.setEnabled(enabled);
        patch.setUpdatedAt(System.currentTimeMillis());
        boolean updated = healthCheckMapper.updateById(patch) > 0;

        if (enabled) {
            hc.setEnabled(true);
            coordinator.startHealthCheck(hc);
        } else {
            coordinator.stopHealthCheck(id);
        }
        return updated;
    }

    @Override
    public boolean deleteHealthCheck(String id) {
        if (!StringUtils.hasText(id)) return false;
        coordinator.stopHealthCheck(id);
        return healthCheckMapper.deleteById(id) > 0;
    }
}
