package fun.ai.devhub.process.event;

public final class ServiceErrorEvent implements ServiceEvent {
    private final String serviceId;
    private final String error;

    public ServiceErrorEvent(String serviceId, String error) {
        this.serviceId = serviceId;
        this.error = error;
    }

    @Override
    public String getServiceId() {
        return serviceId;
    }

    @Override
    public String getType() {
        return "error";
    }

    public String getError() {
        return error;
    }
}
