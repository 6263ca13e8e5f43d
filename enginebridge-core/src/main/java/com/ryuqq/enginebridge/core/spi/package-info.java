/**
 * Native runtime SPI.
 *
 * <p>Engine Bridge는 native runtime을 직접 구현하지 않습니다. 이 패키지의 인터페이스는
 * runtime이 제공해야 하는 기능 표면(capability surface)을 정의합니다:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.spi.NativeRuntime} - 단일 policy 등록 슬롯, 현재 environment 조회</li>
 *   <li>{@link com.ryuqq.enginebridge.core.spi.EnvironmentPolicy} - runtime이 "현재 environment"를 물어보는 중재자</li>
 *   <li>{@link com.ryuqq.enginebridge.core.spi.EnvironmentPolicyApi} - 등록된 policy에게만 주어지는 특권 API</li>
 *   <li>{@link com.ryuqq.enginebridge.core.spi.Environment} - environment 래퍼, scoped 활성화</li>
 *   <li>{@link com.ryuqq.enginebridge.core.spi.NativeCore} - environment와 1:1인 native core, 비동기 요청 primitive</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: native worker thread에서 동시에 호출될 수 있음</li>
 *   <li>Non-blocking: 요청 primitive는 즉시 future를 반환해야 함</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.spi;
