/**
 * Loop에 독립적인 결과 타입.
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.future.UnifiedFuture} - 단일 값</li>
 *   <li>{@link com.ryuqq.enginebridge.core.future.UnifiedIterator} - future의 순서 있는 시퀀스</li>
 * </ul>
 *
 * <p>두 타입 모두 blocking 대기와 현재 {@link com.ryuqq.enginebridge.core.loop.EventLoop}를 통한
 * 비동기 대기를 함께 제공합니다. 콜백 예외는 파생 future의 실패로 전달되며
 * 동기적으로 던져지지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.future;
