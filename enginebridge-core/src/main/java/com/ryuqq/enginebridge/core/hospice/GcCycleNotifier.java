package com.ryuqq.enginebridge.core.hospice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.ListenerNotFoundException;
import javax.management.Notification;
import javax.management.NotificationEmitter;
import javax.management.NotificationListener;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * JVM GC 완료 통지를 {@link Hospice#collectorCycleCompleted()}로 전달.
 *
 * <p>GC MXBean이 {@link NotificationEmitter}를 지원하지 않는 JVM에서는 아무것도 등록하지 않습니다.
 * 이 경우 quiescence 통지는 호출자가 직접 보내야 합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class GcCycleNotifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GcCycleNotifier.class);

    static final String GC_NOTIFICATION = "com.sun.management.gc.notification";

    private final List<NotificationEmitter> emitters = new ArrayList<>();
    private final NotificationListener listener;

    private GcCycleNotifier(Hospice hospice) {
        this.listener = (Notification notification, Object handback) -> {
            if (GC_NOTIFICATION.equals(notification.getType())) {
                hospice.collectorCycleCompleted();
            }
        };
    }

    /**
     * 모든 GC MXBean에 listener 등록.
     *
     * @param hospice 통지를 받을 hospice
     * @return 닫으면 listener를 해제하는 notifier
     */
    public static GcCycleNotifier install(Hospice hospice) {
        if (hospice == null) {
            throw new IllegalArgumentException("hospice cannot be null");
        }
        GcCycleNotifier notifier = new GcCycleNotifier(hospice);
        for (GarbageCollectorMXBean bean : ManagementFactory.getGarbageCollectorMXBeans()) {
            if (bean instanceof NotificationEmitter) {
                NotificationEmitter emitter = (NotificationEmitter) bean;
                emitter.addNotificationListener(notifier.listener, null, null);
                notifier.emitters.add(emitter);
            }
        }
        if (notifier.emitters.isEmpty()) {
            log.warn("No GC notification source available; hospice cycles must be signalled manually");
        } else {
            log.debug("Listening to {} garbage collectors", notifier.emitters.size());
        }
        return notifier;
    }

    /**
     * @return listener가 등록된 GC 수
     */
    public int sourceCount() {
        return emitters.size();
    }

    @Override
    public void close() {
        for (NotificationEmitter emitter : emitters) {
            try {
                emitter.removeNotificationListener(listener);
            } catch (ListenerNotFoundException e) {
                log.debug("GC listener already removed from {}", emitter, e);
            }
        }
        emitters.clear();
    }
}
