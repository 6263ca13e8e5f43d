/**
 * EnvironmentStore 전략.
 *
 * <p>Store는 "실행 컨텍스트 → 현재 environment(weak reference)" 매핑만 담당하는
 * 순수 상태 보관소입니다. 생존 여부 확인과 상호 배제는 policy의 책임입니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.store.GlobalStore} - 프로세스 전역 슬롯 하나</li>
 *   <li>{@link com.ryuqq.enginebridge.core.store.ThreadLocalStore} - 스레드별 슬롯</li>
 *   <li>{@link com.ryuqq.enginebridge.core.store.TaskLocalStore} - 논리적 task별 슬롯 (spawn 시점 상속)</li>
 * </ul>
 *
 * <p>전략 선택은 생성 시점에 {@link com.ryuqq.enginebridge.core.store.StoreStrategy}로 합니다.</p>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.store;
