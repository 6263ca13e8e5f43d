package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 작업 큐를 하나의 스레드에서 순서대로 실행하는 loop.
 *
 * <p><strong>수명:</strong></p>
 * <pre>
 * start() → post()* → stop()
 * </pre>
 *
 * <p>stop() 이전에 post된 작업은 모두 실행되고, 이후의 post()는 false를 반환합니다.
 * loop 스레드가 인터럽트로 끝나면 남은 작업은 {@link LoopTask#abandon()}으로 정리됩니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class RunLoop {

    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    private static final LoopTask STOP = new LoopTask(() -> { }, new CancellationToken());

    private final String name;
    private final BlockingQueue<LoopTask> queue = new LinkedBlockingQueue<>();
    private final ThreadLocal<LoopTask> current = new ThreadLocal<>();
    private final Object lock = new Object();

    private boolean running;
    private boolean started;
    private Thread thread;

    public RunLoop(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    /**
     * loop 스레드 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start() {
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Run loop already started: " + name);
            }
            started = true;
            running = true;
            thread = new Thread(this::drain, name);
            thread.setDaemon(true);
            thread.start();
        }
        log.debug("Run loop {} started", name);
    }

    /**
     * 작업 등록.
     *
     * @param task 실행할 작업
     * @return loop가 작업을 받았으면 true, 이미 멈췄으면 false
     */
    public boolean post(LoopTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        synchronized (lock) {
            if (!running) {
                return false;
            }
            queue.add(task);
            return true;
        }
    }

    /**
     * 새 작업 수신을 멈추고, 이미 받은 작업이 끝날 때까지 최대 timeoutMs 대기.
     *
     * <p>loop 스레드에서 호출하면 기다리지 않습니다.</p>
     */
    public void stop(long timeoutMs) {
        Thread loopThread;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            queue.add(STOP);
            loopThread = thread;
        }

        if (Thread.currentThread() == loopThread) {
            return;
        }
        try {
            loopThread.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while stopping run loop " + name, e);
        }
        if (loopThread.isAlive()) {
            log.warn("Run loop {} did not stop within {}ms", name, timeoutMs);
        } else {
            log.debug("Run loop {} stopped", name);
        }
    }

    /**
     * @return 호출 스레드가 이 loop의 스레드이면 true
     */
    public boolean isLoopThread() {
        synchronized (lock) {
            return thread != null && Thread.currentThread() == thread;
        }
    }

    /**
     * @return loop 스레드에서 실행 중인 작업 (loop 밖에서는 null)
     */
    public LoopTask currentTask() {
        return current.get();
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private void drain() {
        while (true) {
            LoopTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run loop {} interrupted", name);
                abandonRemaining();
                return;
            }
            if (task == STOP) {
                return;
            }

            current.set(task);
            try {
                task.run();
            } catch (RuntimeException | Error e) {
                log.error("Loop task failed on {}", name, e);
            } finally {
                current.remove();
            }
        }
    }

    private void abandonRemaining() {
        synchronized (lock) {
            running = false;
        }
        LoopTask task;
        while ((task = queue.poll()) != null) {
            if (task != STOP) {
                task.abandon();
            }
        }
    }

    @Override
    public String toString() {
        return "RunLoop{" + name + "}";
    }
}
