package com.ryuqq.wick.core.space;

import com.ryuqq.wick.core.error.ConfigurationException;

import java.util.Locale;

/**
 * 입자 통계.
 *
 * <p>페르미온 연산자의 전치(transposition)는 부호 -1을 곱하고,
 * 보손 연산자의 전치는 부호를 바꾸지 않습니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public enum Statistics {

    FERMION,

    BOSON;

    /**
     * 전치 1회당 부호.
     *
     * @return FERMION이면 -1, BOSON이면 1
     */
    public int transpositionSign() {
        return this == FERMION ? -1 : 1;
    }

    /**
     * "fermion" / "boson" 문자열 변환.
     *
     * @param text 대소문자 무시
     * @return Statistics
     * @throws ConfigurationException 알 수 없는 값인 경우
     */
    public static Statistics fromLabel(String text) {
        if (text == null) {
            throw new ConfigurationException("statistics cannot be null");
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "fermion" -> FERMION;
            case "boson" -> BOSON;
            default -> throw new ConfigurationException(
                "Unknown statistics: " + text + " (expected one of [fermion, boson])");
        };
    }
}
