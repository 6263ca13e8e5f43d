/**
 * Host scheduler adapters.
 *
 * <p>두 가지 {@link com.ryuqq.enginebridge.core.loop.EventLoop} 구현을 제공합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.adapter.loop.CallbackEventLoop}: 단일 스레드 callback loop.
 *       blocking 작업은 고정 크기 worker pool에서 실행</li>
 *   <li>{@link com.ryuqq.enginebridge.adapter.loop.ScopedEventLoop}: {@link com.ryuqq.enginebridge.adapter.loop.TaskScope}에
 *       묶인 loop. detach 시 scope 전체 취소, blocking 작업 동시 실행 수 제한</li>
 * </ul>
 *
 * <p>두 구현 모두 {@link com.ryuqq.enginebridge.adapter.loop.RunLoop} 하나의 스레드에서
 * loop 작업을 순서대로 실행합니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventLoops.set(new CallbackEventLoop());
 * try {
 *     UnifiedFuture.fromFuture(core.request(work))
 *         .addLoopCallback(f -&gt; render(f.result()));
 * } finally {
 *     EventLoops.set(EventLoops.NO_LOOP);
 * }
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.enginebridge.adapter.loop;
