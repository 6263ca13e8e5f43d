package com.ryuqq.enginebridge.core.loop;

import com.ryuqq.enginebridge.core.context.ContextPropagator;
import com.ryuqq.enginebridge.core.context.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 프로세스 전역 EventLoop holder.
 *
 * <p>설치된 loop가 없으면 {@link #NO_LOOP}가 사용됩니다. holder가 loop 없는 상태로
 * 남는 경우는 없습니다.</p>
 *
 * <p><strong>loop 교체 규칙:</strong></p>
 * <ol>
 *   <li>기존 loop의 {@link EventLoop#detach()} 호출</li>
 *   <li>새 loop 설치 후 {@link EventLoop#attach()} 호출</li>
 *   <li>attach가 실패하면 {@link #NO_LOOP}로 되돌리고 예외 전파</li>
 * </ol>
 *
 * <p><strong>context 보존:</strong> {@link #fromThread(Callable)}, {@link #toThread(Callable)}는
 * 호출 시점의 {@link TaskContext}와 설치된 {@link ContextPropagator}(예: 현재 environment)를
 * 캡처하여, 나중에 다른 스레드에서 실행되더라도 같은 context에서 작업을 실행합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class EventLoops {

    private static final Logger log = LoggerFactory.getLogger(EventLoops.class);

    /**
     * 스케줄러가 없을 때의 기본 loop.
     */
    public static final EventLoop NO_LOOP = new NoEventLoop();

    private static final Object LOCK = new Object();

    private static volatile EventLoop current = NO_LOOP;
    private static volatile ContextPropagator propagator = ContextPropagator.NONE;

    private EventLoops() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return 현재 설치된 loop
     */
    public static EventLoop get() {
        return current;
    }

    /**
     * Loop 교체.
     *
     * @param loop 새 loop
     * @throws IllegalArgumentException loop가 null인 경우
     * @throws RuntimeException 새 loop의 attach()가 실패한 경우 (NO_LOOP로 복귀한 뒤 전파)
     */
    public static void set(EventLoop loop) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        synchronized (LOCK) {
            current.detach();
            try {
                current = loop;
                loop.attach();
            } catch (RuntimeException | Error e) {
                current = NO_LOOP;
                log.warn("Failed to attach {}; reverted to {}", loop, NO_LOOP, e);
                throw e;
            }
            log.debug("Event loop switched to {}", loop);
        }
    }

    /**
     * 실행 경계를 넘어 전달할 상태의 propagator 설치.
     *
     * @param contextPropagator 새 propagator (null이면 {@link ContextPropagator#NONE})
     */
    public static void installPropagator(ContextPropagator contextPropagator) {
        synchronized (LOCK) {
            propagator = contextPropagator == null ? ContextPropagator.NONE : contextPropagator;
        }
    }

    /**
     * 주어진 propagator가 설치되어 있을 때만 제거.
     *
     * @param contextPropagator 제거할 propagator
     */
    public static void uninstallPropagator(ContextPropagator contextPropagator) {
        synchronized (LOCK) {
            if (propagator == contextPropagator) {
                propagator = ContextPropagator.NONE;
            }
        }
    }

    /**
     * 호출 스레드의 context 캡처.
     *
     * @return 다른 스레드에서 재설치할 수 있는 context
     */
    public static CapturedContext captureContext() {
        return new CapturedContext(TaskContext.capture(), propagator.capture());
    }

    /**
     * 호출 시점의 context를 보존하는 Callable로 감쌈.
     *
     * @param task 원본 작업
     * @return 실행 시 캡처된 context와 environment를 설치하는 작업
     */
    public static <T> Callable<T> preserveContext(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return captureContext().wrap(task);
    }

    /**
     * 호출 시점의 context를 보존하는 Runnable로 감쌈.
     */
    public static Runnable preserveContext(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return captureContext().wrap(task);
    }

    /**
     * 현재 loop에서 작업 실행 (context 보존).
     *
     * <p>NO_LOOP에서는 호출 스레드에서 즉시 실행됩니다.</p>
     */
    public static <T> CompletableFuture<T> fromThread(Callable<T> task) {
        return current.fromThread(preserveContext(task));
    }

    /**
     * 전용 worker에서 작업 실행 (context 보존).
     */
    public static <T> CompletableFuture<T> toThread(Callable<T> task) {
        return current.toThread(preserveContext(task));
    }

    /**
     * 현재 loop로 future 대기 연결.
     */
    public static <T> CompletableFuture<T> awaitFuture(CompletableFuture<T> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        return current.awaitFuture(future);
    }
}
