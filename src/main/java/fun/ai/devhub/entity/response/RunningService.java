package fun.ai.devhub.entity.response;

import fun.ai.devhub.process.ServiceStatus;
import lombok.Data;

/**
 * 服务运行态快照（只读副本；内存中的运行记录不会直接暴露给调用方）
 */
@Data
public class RunningService {
    private String serviceId;
    private String workspaceId;
    private String name;
    private String command;
    private Integer port;
    /**
     * 进程退出后为 null
     */
    private Long pid;
    private ServiceStatus status;
    private Long startedAt;
    private Long stoppedAt;
    /**
     * 被信号结束（killed）时为 null
     */
    private Integer exitCode;
    private String logSessionId;
}
