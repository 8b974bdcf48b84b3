package com.ryuqq.wick.core.error;

/**
 * SpaceRegistry 오용.
 *
 * <p>중복 label, 빈 index stem, freeze 이후 공간 추가, 등록되지 않은 공간 조회,
 * reset 이전 epoch의 Index 사용 등에서 발생합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public class ConfigurationException extends WickException {

    public static final String ERROR_CODE = "WICK-CONFIG";

    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
}
