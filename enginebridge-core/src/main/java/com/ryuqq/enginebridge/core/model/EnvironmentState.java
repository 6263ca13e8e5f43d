package com.ryuqq.enginebridge.core.model;

/**
 * ManagedEnvironment의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ├─► IN_USE (use / switchTo)
 *    │      │
 *    │      └─► DISPOSED
 *    │
 *    └─► DISPOSED
 *
 * 금지된 전이:
 * - DISPOSED → * ❌
 * - IN_USE → CREATED ❌
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public enum EnvironmentState {

    /**
     * 생성됨 (아직 활성화된 적 없음).
     */
    CREATED,

    /**
     * 한 번 이상 활성화됨.
     */
    IN_USE,

    /**
     * 폐기됨 (core는 hospice로 이관).
     */
    DISPOSED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DISPOSED인 경우 true
     */
    public boolean isTerminal() {
        return this == DISPOSED;
    }
}
