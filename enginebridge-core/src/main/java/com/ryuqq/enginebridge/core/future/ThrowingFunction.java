package com.ryuqq.enginebridge.core.future;

/**
 * 검사 예외를 던질 수 있는 함수.
 *
 * @param <T> 입력 타입
 * @param <R> 결과 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThrowingFunction<T, R> {

    R apply(T value) throws Exception;
}
