package com.projectgroup5.pongarena.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 进程内事件总线 - 组件之间的解耦
 * 同步分发：publish() 返回时所有订阅者都已处理完毕
 */
@Component
public class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<?>, List<Consumer<Object>>> subscribers = new ConcurrentHashMap<>();

    public <T> void subscribe(Class<T> type, Consumer<? super T> handler) {
        subscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void publish(Object event) {
        List<Consumer<Object>> handlers = subscribers.get(event.getClass());
        if (handlers == null) {
            return;
        }
        for (Consumer<Object> handler : handlers) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                // 单个订阅者异常不影响其他订阅者
                logger.error("Subscriber failed while handling {}", event, e);
            }
        }
    }
}
