package fun.ai.devhub.health;

public class HealthProbeResult {
    private final boolean healthy;
    private final String error;

    private HealthProbeResult(boolean healthy, String error) {
        this.healthy = healthy;
        this.error = error;
    }

    public static HealthProbeResult healthy() {
        return new HealthProbeResult(true, null);
    }

    public static HealthProbeResult unhealthy(String error) {
        return new HealthProbeResult(false, error);
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String getError() {
        return error;
    }
}
