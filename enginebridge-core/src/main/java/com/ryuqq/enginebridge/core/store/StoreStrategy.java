package com.ryuqq.enginebridge.core.store;

/**
 * Store 전략 선택.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public enum StoreStrategy {

    /**
     * 프로세스 전역 슬롯.
     */
    GLOBAL,

    /**
     * 스레드별 슬롯.
     */
    THREAD_LOCAL,

    /**
     * 논리적 task별 슬롯.
     */
    TASK_LOCAL;

    /**
     * 전략에 해당하는 새 store 생성.
     *
     * @return 새 store 인스턴스
     */
    public EnvironmentStore newStore() {
        return switch (this) {
            case GLOBAL -> new GlobalStore();
            case THREAD_LOCAL -> new ThreadLocalStore();
            case TASK_LOCAL -> new TaskLocalStore();
        };
    }
}
