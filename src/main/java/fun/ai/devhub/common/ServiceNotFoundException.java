package fun.ai.devhub.common;

public class ServiceNotFoundException extends DevHubException {
    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        super(404, "服务不存在: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
