/**
 * Task-scoped context propagation.
 *
 * <p>{@link com.ryuqq.enginebridge.core.context.TaskContext}는 논리적 task 단위의 불변 값 묶음입니다.
 * 새 task를 시작할 때 호출자의 context를 캡처하고, task 쪽 스레드에서 설치합니다.
 * 설치 이후의 변경은 copy-on-write로 해당 task에만 보입니다.</p>
 *
 * @since 1.0.0
 * @author Engine Bridge Team
 */
package com.ryuqq.enginebridge.core.context;
