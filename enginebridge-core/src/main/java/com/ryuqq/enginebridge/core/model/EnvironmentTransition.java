package com.ryuqq.enginebridge.core.model;

/**
 * EnvironmentState 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → IN_USE</li>
 *   <li>CREATED → DISPOSED</li>
 *   <li>IN_USE → IN_USE (재활성화)</li>
 *   <li>IN_USE → DISPOSED</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class EnvironmentTransition {

    private EnvironmentTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(EnvironmentState from, EnvironmentState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED, IN_USE -> to == EnvironmentState.IN_USE || to == EnvironmentState.DISPOSED;
            case DISPOSED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static EnvironmentState transition(EnvironmentState current, EnvironmentState next) {
        validate(current, next);
        return next;
    }
}
