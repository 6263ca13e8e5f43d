package com.ryuqq.enginebridge.core.spi;

/**
 * Core에 대한 외부 hold.
 *
 * <p>hold가 하나라도 열려 있으면 hospice는 core를 해제하지 않습니다.
 * close는 멱등적이어야 합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface CoreHold extends AutoCloseable {

    @Override
    void close();
}
