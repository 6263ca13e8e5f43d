package com.ryuqq.enginebridge.core.store;

import com.ryuqq.enginebridge.core.context.TaskContext;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EnvironmentStore 전략별 테스트.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@DisplayName("EnvironmentStore 전략 테스트")
class StoreStrategyTest {

    private final EnvironmentData first = EnvironmentData.allocate();
    private final EnvironmentData second = EnvironmentData.allocate();

    @AfterEach
    void tearDown() {
        TaskContext.restore(TaskContext.empty());
    }

    @Test
    @DisplayName("newStore()는 전략별 구현을 생성한다")
    void 전략별_구현_생성() {
        assertThat(StoreStrategy.GLOBAL.newStore()).isInstanceOf(GlobalStore.class);
        assertThat(StoreStrategy.THREAD_LOCAL.newStore()).isInstanceOf(ThreadLocalStore.class);
        assertThat(StoreStrategy.TASK_LOCAL.newStore()).isInstanceOf(TaskLocalStore.class);
    }

    // ============================================================
    // GLOBAL
    // ============================================================

    @Test
    @DisplayName("GlobalStore는 모든 스레드가 같은 값을 본다")
    void global_스레드간_공유() throws Exception {
        // given
        EnvironmentStore store = StoreStrategy.GLOBAL.newStore();
        store.setCurrentEnvironment(new WeakReference<>(first));

        // when
        EnvironmentData seen = CompletableFuture
            .supplyAsync(() -> store.getCurrentEnvironment().get())
            .get(1, TimeUnit.SECONDS);

        // then
        assertThat(seen).isSameAs(first);
    }

    // ============================================================
    // THREAD_LOCAL
    // ============================================================

    @Test
    @DisplayName("ThreadLocalStore는 다른 스레드의 값을 보지 않는다")
    void threadLocal_스레드간_격리() throws Exception {
        // given
        EnvironmentStore store = StoreStrategy.THREAD_LOCAL.newStore();
        store.setCurrentEnvironment(new WeakReference<>(first));

        // when
        WeakReference<EnvironmentData> seen = CompletableFuture
            .supplyAsync(store::getCurrentEnvironment)
            .get(1, TimeUnit.SECONDS);

        // then
        assertThat(seen).isNull();
        assertThat(store.getCurrentEnvironment().get()).isSameAs(first);

        store.setCurrentEnvironment(null);
        assertThat(store.getCurrentEnvironment()).isNull();
    }

    // ============================================================
    // TASK_LOCAL
    // ============================================================

    @Test
    @DisplayName("TaskLocalStore는 spawn 시점의 값을 상속하고 이후 변경은 형제간에 공유되지 않는다")
    void taskLocal_상속과_격리() throws Exception {
        // given
        EnvironmentStore store = StoreStrategy.TASK_LOCAL.newStore();
        store.setCurrentEnvironment(new WeakReference<>(first));
        TaskContext spawned = TaskContext.capture();

        // when
        EnvironmentData inherited = CompletableFuture
            .supplyAsync(() -> {
                try {
                    return spawned.call(() -> store.getCurrentEnvironment().get());
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            })
            .get(1, TimeUnit.SECONDS);
        spawned.call(() -> {
            store.setCurrentEnvironment(new WeakReference<>(second));
            return null;
        });

        // then
        assertThat(inherited).isSameAs(first);
        assertThat(spawned.call(() -> store.getCurrentEnvironment().get())).isSameAs(first);
        assertThat(store.getCurrentEnvironment().get()).isSameAs(first);
    }

    @Test
    @DisplayName("서로 다른 TaskLocalStore는 값을 공유하지 않는다")
    void taskLocal_store간_격리() {
        // given
        EnvironmentStore a = new TaskLocalStore();
        EnvironmentStore b = new TaskLocalStore();

        // when
        a.setCurrentEnvironment(new WeakReference<>(first));

        // then
        assertThat(b.getCurrentEnvironment()).isNull();
    }
}
