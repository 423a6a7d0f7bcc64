package fun.ai.devhub.process.event;

import java.util.List;

/**
 * 一次输出块（已去 ANSI、已按行拆分）
 */
public final class ServiceLogEvent implements ServiceEvent {
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    private final String serviceId;
    private final String stream;
    private final List<String> lines;

    public ServiceLogEvent(String serviceId, String stream, List<String> lines) {
        this.serviceId = serviceId;
        this.stream = stream;
        this.lines = List.copyOf(lines);
    }

    @Override
    public String getServiceId() {
        return serviceId;
    }

    @Override
    public String getType() {
        return "log";
    }

    /**
     * stdout / stderr
     */
    public String getStream() {
        return stream;
    }

    public List<String> getLines() {
        return lines;
    }
}
