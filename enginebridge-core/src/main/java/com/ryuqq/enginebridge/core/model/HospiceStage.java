package com.ryuqq.enginebridge.core.model;

/**
 * Hospice 등록 항목의 회수 단계.
 *
 * <pre>
 * ACTIVE ──(environment 도달 불가)──► STAGE1
 * STAGE1 ──(quiescence 통지, hold 없음)──► STAGED
 * STAGED ──(다음 통지)──► STAGE2
 * STAGE2 ──(다음 통지, hold 없음)──► RELEASED
 * </pre>
 *
 * <p>STAGE1, STAGE2에서 hold가 남아 있으면 경고 로그와 함께 해당 단계에 머뭅니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public enum HospiceStage {

    ACTIVE,

    STAGE1,

    STAGED,

    STAGE2,

    RELEASED;

    /**
     * @return RELEASED인 경우 true
     */
    public boolean isTerminal() {
        return this == RELEASED;
    }
}
