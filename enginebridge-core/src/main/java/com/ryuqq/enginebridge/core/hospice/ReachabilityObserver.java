package com.ryuqq.enginebridge.core.hospice;

/**
 * 객체가 도달 불가능해지는 시점을 감지하는 관찰자.
 *
 * <p>구현은 referent를 강하게 참조해서는 안 되며, 콜백은 최대 한 번 실행되어야 합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface ReachabilityObserver {

    /**
     * 단발성 관찰 등록.
     *
     * @param referent 관찰 대상
     * @param onUnreachable 대상이 도달 불가능해진 뒤 실행할 작업 (referent를 캡처하면 안 됨)
     */
    void watch(Object referent, Runnable onUnreachable);
}
