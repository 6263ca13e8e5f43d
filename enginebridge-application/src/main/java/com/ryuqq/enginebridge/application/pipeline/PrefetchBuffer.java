package com.ryuqq.enginebridge.application.pipeline;

import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 순서를 보존하는 prefetch 버퍼.
 *
 * <p>원본 iterator의 {@code next()}가 요청을 발행한다고 가정합니다. 버퍼는 요청을 미리 발행하되
 * 다음 두 상한을 지킵니다:</p>
 * <ul>
 *   <li>진행 중인 요청 수 ≤ {@link PrefetchConfig#prefetch()}</li>
 *   <li>발행했지만 소비되지 않은 요청 수 ≤ {@link PrefetchConfig#backlog()}</li>
 * </ul>
 *
 * <p><strong>순서:</strong> {@link #next()}는 완료 순서와 상관없이 발행 순서대로 future를 반환합니다.</p>
 *
 * <p><strong>중단:</strong> 요청 하나가 실패하거나 {@link #close()}가 호출되면 더 이상 요청을 발행하지 않습니다.
 * 이미 발행된 요청은 취소하지 않고 끝까지 진행되며, 실패 전에 발행된 항목은 계속 소비할 수 있습니다.
 * 원본 iterator 자체가 던진 예외는 그 위치의 실패한 future로 전달됩니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Iterator&lt;CompletableFuture&lt;Frame&gt;&gt; requests = ...; // next()마다 core.request(...)
 * try (PrefetchBuffer&lt;Frame&gt; frames = PrefetchBuffer.buffer(requests, PrefetchConfig.of(4))) {
 *     for (Frame frame : new UnifiedIterator&lt;&gt;(frames)) {
 *         write(frame);
 *     }
 * }
 * </pre>
 *
 * @param <T> 결과 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class PrefetchBuffer<T> implements Iterator<CompletableFuture<T>>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PrefetchBuffer.class);

    private final Iterator<? extends CompletionStage<T>> source;
    private final PrefetchConfig config;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<Long, CompletableFuture<T>> reorder = new HashMap<>();

    private long requested;
    private long yielded;
    private int running;
    private boolean finished;
    private boolean closed;

    private int peakRunning;
    private int peakBuffered;

    private PrefetchBuffer(Iterator<? extends CompletionStage<T>> source, PrefetchConfig config) {
        this.source = source;
        this.config = config;
    }

    /**
     * 버퍼 생성 후 즉시 첫 요청들을 발행.
     *
     * @param requests next()마다 요청을 발행하는 iterator
     * @param config 상한 설정
     * @return 발행 순서대로 future를 반환하는 iterator
     */
    public static <T> PrefetchBuffer<T> buffer(Iterator<? extends CompletionStage<T>> requests, PrefetchConfig config) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        PrefetchBuffer<T> buffer = new PrefetchBuffer<>(requests, config);
        buffer.refill();
        return buffer;
    }

    /**
     * core의 worker 수를 prefetch로 사용하는 버퍼 생성.
     */
    public static <T> PrefetchBuffer<T> buffer(Iterator<? extends CompletionStage<T>> requests, NativeCore core) {
        return buffer(requests, PrefetchConfig.forCore(core));
    }

    /**
     * {@inheritDoc}
     *
     * <p>다음 순번의 요청이 발행될 때까지 대기합니다.</p>
     */
    @Override
    public boolean hasNext() {
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    return false;
                }
                if (reorder.containsKey(yielded)) {
                    return true;
                }
                if (finished && reorder.isEmpty() && running == 0) {
                    return false;
                }
                changed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for the next request", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletableFuture<T> next() {
        lock.lock();
        try {
            if (!hasNext()) {
                throw new NoSuchElementException("No more requests");
            }
            CompletableFuture<T> future = reorder.remove(yielded);
            yielded++;
            refill();
            return future;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 새 요청 발행 중단. 이미 발행된 요청은 계속 진행됩니다.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            finished = true;
            changed.signalAll();
            log.debug("Prefetch buffer closed after {} of {} requests ({} still running)", yielded, requested, running);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 진행 중인 요청 수
     */
    public int running() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 관측된 최대 동시 요청 수
     */
    public int peakRunning() {
        lock.lock();
        try {
            return peakRunning;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 관측된 최대 미소비 요청 수
     */
    public int peakBuffered() {
        lock.lock();
        try {
            return peakBuffered;
        } finally {
            lock.unlock();
        }
    }

    public PrefetchConfig config() {
        return config;
    }

    private void refill() {
        lock.lock();
        try {
            while (!finished && running < config.prefetch() && reorder.size() < config.backlog()) {
                requestNext();
            }
        } finally {
            lock.unlock();
        }
    }

    private void requestNext() {
        CompletionStage<T> stage;
        try {
            if (!source.hasNext()) {
                finished = true;
                changed.signalAll();
                return;
            }
            stage = source.next();
        } catch (RuntimeException e) {
            log.warn("Request source failed at index {}", requested, e);
            finished = true;
            reorder.put(requested++, CompletableFuture.failedFuture(e));
            changed.signalAll();
            return;
        }

        CompletableFuture<T> future = new CompletableFuture<>();
        reorder.put(requested++, future);
        running++;
        peakRunning = Math.max(peakRunning, running);
        peakBuffered = Math.max(peakBuffered, reorder.size());
        changed.signalAll();

        // the slot is released before consumers see the result
        stage.whenComplete((value, error) -> {
            onFinished(error);
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(value);
            }
        });
    }

    private void onFinished(Throwable error) {
        lock.lock();
        try {
            running--;
            changed.signalAll();
            if (finished) {
                return;
            }
            if (error != null) {
                log.debug("Request failed; no further requests will be issued", error);
                finished = true;
                return;
            }
            refill();
        } finally {
            lock.unlock();
        }
    }
}
