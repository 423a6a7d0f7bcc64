package fun.ai.devhub.process.event;

/**
 * 服务生命周期事件（log / exit / error）
 */
public interface ServiceEvent {

    String getServiceId();

    /**
     * log / exit / error，同时用作 SSE 的 event name
     */
    String getType();
}
