/**
 * EventLoop 추상화.
 *
 * <p>호스트 스케줄러(스레드만 사용, 단일 스레드 콜백 루프, structured scope)를
 * submit / suspend / cancel primitive 뒤로 정규화합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.loop.EventLoop} - 어댑터가 구현하는 인터페이스</li>
 *   <li>{@link com.ryuqq.enginebridge.core.loop.NoEventLoop} - 스케줄러가 없을 때의 기본값 (inline 실행)</li>
 *   <li>{@link com.ryuqq.enginebridge.core.loop.EventLoops} - 프로세스 전역 loop holder</li>
 *   <li>{@link com.ryuqq.enginebridge.core.loop.CancellationToken} - 협력적 취소 플래그</li>
 * </ul>
 *
 * <p><strong>취소 규칙:</strong> 취소는 협력적입니다. 이미 native thread에서 실행 중인 작업은
 * 중단되지 않으며, 다음 suspension point({@code awaitFuture}, {@code nextCycle})에서
 * {@link com.ryuqq.enginebridge.core.loop.LoopCancelledException}이 발생합니다.</p>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.loop;
