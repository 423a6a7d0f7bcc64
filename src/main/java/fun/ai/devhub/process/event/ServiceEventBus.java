package fun.ai.devhub.process.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 进程内发布/订阅：在发布线程上同步回调。
 * 订阅者异常只记日志，不会影响输出读取线程或其它订阅者。
 */
public class ServiceEventBus {
    private static final Logger log = LoggerFactory.getLogger(ServiceEventBus.class);

    private final List<Consumer<ServiceEvent>> listeners = new CopyOnWriteArrayList<>();

    public ServiceEventSubscription subscribe(Consumer<ServiceEvent> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener 不能为空");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(ServiceEvent event) {
        if (event == null) return;
        for (Consumer<ServiceEvent> l : listeners) {
            try {
                l.accept(event);
            } catch (Exception e) {
                log.warn("service event listener failed: serviceId={}, type={}, error={}",
                        event.getServiceId(), event.getType(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
