package com.ryuqq.wick.core.space;

import com.ryuqq.wick.core.error.ConfigurationException;

import java.util.Locale;

/**
 * 기준 상태(reference) 대비 공간의 점유 분류.
 *
 * <p>Wick 축약 값은 점유 분류에 의해 결정됩니다:</p>
 * <ul>
 *   <li>OCCUPIED: 생성-소멸 순서의 축약만 δ (hole)</li>
 *   <li>UNOCCUPIED: 소멸-생성 순서의 축약만 δ (particle)</li>
 *   <li>GENERAL: 두 축약 모두 기호(밀도 행렬)로 남음</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public enum OccupationClass {

    OCCUPIED,

    UNOCCUPIED,

    GENERAL;

    /**
     * "occupied" / "unoccupied" / "general" 문자열 변환.
     *
     * @param text 대소문자 무시
     * @return OccupationClass
     * @throws ConfigurationException 알 수 없는 값인 경우
     */
    public static OccupationClass fromLabel(String text) {
        if (text == null) {
            throw new ConfigurationException("occupation class cannot be null");
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "occupied" -> OCCUPIED;
            case "unoccupied" -> UNOCCUPIED;
            case "general" -> GENERAL;
            default -> throw new ConfigurationException(
                "Unknown occupation class: " + text + " (expected one of [occupied, unoccupied, general])");
        };
    }
}
