package fun.ai.devhub.entity.response;

import fun.ai.devhub.entity.ServiceConfig;
import fun.ai.devhub.process.ServiceStatus;
import lombok.Data;

/**
 * 服务定义 + 当前运行态（列表页用）
 */
@Data
public class ServiceWithStatusResponse {
    private ServiceConfig config;
    /**
     * 从未启动过时为 stopped
     */
    private ServiceStatus status;
    private Long pid;
    private Integer exitCode;
    private String logSessionId;

    public static ServiceWithStatusResponse of(ServiceConfig config, RunningService running) {
        ServiceWithStatusResponse resp = new ServiceWithStatusResponse();
        resp.setConfig(config);
        if (running == null) {
            resp.setStatus(ServiceStatus.STOPPED);
            return resp;
        }
        resp.setStatus(running.getStatus());
        resp.setPid(running.getPid());
        resp.setExitCode(running.getExitCode());
        resp.setLogSessionId(running.getLogSessionId());
        return resp;
    }
}
