package fun.ai.devhub.process.event;

/**
 * 取消订阅；重复 close 无副作用
 */
public interface ServiceEventSubscription extends AutoCloseable {

    @Override
    void close();
}
