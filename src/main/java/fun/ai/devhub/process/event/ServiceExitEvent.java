package fun.ai.devhub.process.event;

public final class ServiceExitEvent implements ServiceEvent {
    private final String serviceId;
    private final Integer code;

    public ServiceExitEvent(String serviceId, Integer code) {
        this.serviceId = serviceId;
        this.code = code;
    }

    @Override
    public String getServiceId() {
        return serviceId;
    }

    @Override
    public String getType() {
        return "exit";
    }

    /**
     * 被信号结束时为 null
     */
    public Integer getCode() {
        return code;
    }
}
