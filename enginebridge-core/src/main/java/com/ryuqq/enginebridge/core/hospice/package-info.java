/**
 * Native core의 단계적 지연 회수.
 *
 * <p>native runtime은 environment가 논리적으로 끝난 뒤에도 worker thread에서 core로
 * 콜백할 수 있습니다. 따라서 core는 즉시 해제하지 않고, environment가 도달 불가능해진 뒤
 * 외부 quiescence 통지를 여러 번 거쳐 hold가 없음이 확인될 때만 해제합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.hospice.Hospice} - 등록부와 단계 승격</li>
 *   <li>{@link com.ryuqq.enginebridge.core.hospice.ReachabilityObserver} - environment 도달 불가 감지</li>
 *   <li>{@link com.ryuqq.enginebridge.core.hospice.GcCycleNotifier} - JVM GC 완료를 quiescence 통지로 연결</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.hospice;
