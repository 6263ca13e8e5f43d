/**
 * Engine Bridge 예외 계층.
 *
 * <ul>
 *   <li>{@link com.ryuqq.enginebridge.core.exception.ConfigurationException} - policy/environment 미등록 (재시도 불가)</li>
 *   <li>{@link com.ryuqq.enginebridge.core.exception.DeadEnvironmentException} - 파괴된 environment 사용</li>
 *   <li>{@link com.ryuqq.enginebridge.core.exception.ResourceLeakWarning} - dispose 없이 회수된 자원 (로그 전용)</li>
 * </ul>
 *
 * <p>취소 신호는 {@link com.ryuqq.enginebridge.core.loop.LoopCancelledException}을 참고하세요.</p>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.exception;
