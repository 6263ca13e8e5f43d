package com.ryuqq.enginebridge.core.exception;

/**
 * Policy 또는 environment가 등록되지 않은 상태에서 native API에 접근할 때 발생.
 *
 * <p>즉시 발생하며 재시도해도 해결되지 않습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }
}
