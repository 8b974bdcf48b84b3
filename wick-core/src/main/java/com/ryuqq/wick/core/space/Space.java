package com.ryuqq.wick.core.space;

import com.ryuqq.wick.core.error.ConfigurationException;

import java.util.List;

/**
 * 이름이 붙은 단일 입자 상태 공간.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>label: 영문자만 허용 (텍스트 문법에서 "o0", "o_0"으로 참조)</li>
 *   <li>stems: 비어 있을 수 없음, 각 stem은 blank 불가</li>
 *   <li>elementarySpaces: 합성 공간을 이루는 기본 공간 label (없으면 빈 목록)</li>
 * </ul>
 *
 * <p>합성 공간(예: 일반 공간 g = o ⊕ v)은 구성 기본 공간을 메타데이터로만 기록합니다.
 * 축약은 여전히 같은 label의 index 사이에서만 일어납니다.</p>
 *
 * @param label 공간 label (예: "o", "v")
 * @param statistics 입자 통계
 * @param occupation 점유 분류
 * @param stems index 표기용 stem (예: i, j, k)
 * @param elementarySpaces 구성 기본 공간 label 목록
 *
 * @author Wick Team
 * @since 1.0.0
 */
public record Space(
    String label,
    Statistics statistics,
    OccupationClass occupation,
    List<String> stems,
    List<String> elementarySpaces
) {

    public Space(String label, Statistics statistics, OccupationClass occupation, List<String> stems) {
        this(label, statistics, occupation, stems, List.of());
    }

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 필드가 유효하지 않은 경우
     */
    public Space {
        if (label == null || label.isBlank()) {
            throw new ConfigurationException("Space label cannot be null or blank");
        }
        if (!label.matches("^[A-Za-z]+$")) {
            throw new ConfigurationException("Space label must be alphabetic (current: " + label + ")");
        }
        if (statistics == null) {
            throw new ConfigurationException("statistics cannot be null for space " + label);
        }
        if (occupation == null) {
            throw new ConfigurationException("occupation cannot be null for space " + label);
        }
        if (stems == null || stems.isEmpty()) {
            throw new ConfigurationException("Index stems cannot be empty for space " + label);
        }
        for (String stem : stems) {
            if (stem == null || stem.isBlank()) {
                throw new ConfigurationException("Index stems cannot contain blank values for space " + label);
            }
        }
        stems = List.copyOf(stems);
        if (elementarySpaces == null) {
            elementarySpaces = List.of();
        }
        for (String elementary : elementarySpaces) {
            if (elementary == null || elementary.equals(label)) {
                throw new ConfigurationException(
                    "Elementary spaces of " + label + " must be other registered labels (current: " + elementarySpaces + ")");
            }
        }
        elementarySpaces = List.copyOf(elementarySpaces);
    }

    public boolean isComposite() {
        return !elementarySpaces.isEmpty();
    }

    public boolean isFermionic() {
        return statistics == Statistics.FERMION;
    }

    /**
     * ordinal에 해당하는 stem 이름 (LaTeX 출력용).
     *
     * <p>stem 개수를 넘는 ordinal은 prime(')을 붙여 순환합니다 (i, j, i', j', ...).</p>
     *
     * @param ordinal 0 이상
     * @return stem 이름
     */
    public String stemName(int ordinal) {
        String stem = stems.get(ordinal % stems.size());
        return stem + "'".repeat(ordinal / stems.size());
    }
}
