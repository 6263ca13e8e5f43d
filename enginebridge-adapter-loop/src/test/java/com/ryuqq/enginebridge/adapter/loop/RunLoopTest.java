package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunLoop 테스트.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@DisplayName("RunLoop 테스트")
class RunLoopTest {

    @Test
    @DisplayName("stop() 이전에 post된 작업은 순서대로 모두 실행된다")
    void 순서_실행() {
        // given
        RunLoop loop = new RunLoop("run-loop-test");
        List<Integer> executed = new CopyOnWriteArrayList<>();
        loop.start();

        // when
        for (int i = 0; i < 5; i++) {
            int value = i;
            loop.post(new LoopTask(() -> executed.add(value), new CancellationToken()));
        }
        loop.stop(5000);

        // then
        assertThat(executed).containsExactly(0, 1, 2, 3, 4);
        assertThat(loop.isRunning()).isFalse();
        assertThat(loop.post(new LoopTask(() -> executed.add(99), new CancellationToken()))).isFalse();
    }

    @Test
    @DisplayName("실행 중인 작업은 currentTask()로 조회되고 실패해도 loop는 계속된다")
    void 현재작업_예외격리() {
        // given
        RunLoop loop = new RunLoop("run-loop-current");
        CancellationToken token = new CancellationToken();
        List<Object> seen = new CopyOnWriteArrayList<>();
        loop.start();

        // when
        loop.post(new LoopTask(() -> {
            throw new IllegalStateException("boom");
        }, new CancellationToken()));
        loop.post(new LoopTask(() -> seen.add(loop.currentTask().token()), token));
        loop.post(new LoopTask(() -> seen.add(loop.isLoopThread()), new CancellationToken()));
        loop.stop(5000);

        // then
        assertThat(seen).containsExactly(token, true);
        assertThat(loop.currentTask()).isNull();
    }

    @Test
    @DisplayName("두 번 시작할 수 없다")
    void 중복_시작() {
        RunLoop loop = new RunLoop("run-loop-twice");
        loop.start();
        try {
            assertThatThrownBy(loop::start).isInstanceOf(IllegalStateException.class);
        } finally {
            loop.stop(5000);
        }
    }
}
