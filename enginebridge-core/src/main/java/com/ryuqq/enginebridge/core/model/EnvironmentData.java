package com.ryuqq.enginebridge.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Native runtime이 발급하는 Environment 식별 핸들.
 *
 * <p>내용을 알 수 없는 불투명(opaque) 핸들입니다. 동등성은 오직 identity로만 판단하며,
 * 살아있는지 여부는 핸들 자체가 아닌 runtime에 질의해야 합니다
 * (native 측에서 언제든 무효화될 수 있음).</p>
 *
 * <p>store와 policy는 이 핸들을 weak reference로만 보관합니다. 핸들의 강한 참조를
 * 소유하는 쪽은 runtime의 Environment 래퍼뿐입니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class EnvironmentData {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;

    private EnvironmentData(long id) {
        this.id = id;
    }

    /**
     * 새 핸들 발급.
     *
     * @return 고유한 EnvironmentData
     */
    public static EnvironmentData allocate() {
        return new EnvironmentData(SEQUENCE.incrementAndGet());
    }

    /**
     * 진단용 일련번호.
     *
     * @return 핸들 번호
     */
    public long id() {
        return id;
    }

    @Override
    public String toString() {
        return "EnvironmentData{" + id + '}';
    }
}
