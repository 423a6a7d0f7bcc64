package fun.ai.devhub.common;

/**
 * 同一 serviceId 同一时间只允许一个存活进程
 */
public class ServiceAlreadyRunningException extends DevHubException {
    private final String serviceId;

    public ServiceAlreadyRunningException(String serviceId) {
        super(409, "服务已在运行: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
