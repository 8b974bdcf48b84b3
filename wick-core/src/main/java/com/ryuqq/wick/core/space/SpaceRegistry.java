package com.ryuqq.wick.core.space;

import com.ryuqq.wick.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 이름이 붙은 index 공간의 설정 테이블.
 *
 * <p>전역 싱글턴 대신 명시적 컨텍스트로 모든 소비자에게 참조로 전달됩니다.
 * 발급된 {@link Index}는 registry의 epoch를 지니므로, {@link #reset()} 이후
 * 이전 세대의 index를 사용하면 조용히 잘못된 결과를 내는 대신
 * {@link ConfigurationException}이 발생합니다.</p>
 *
 * <p><strong>Configure-then-freeze:</strong></p>
 * <pre>
 * registry.addSpace("o", FERMION, OCCUPIED, List.of("i", "j"));   // 설정 단계
 * registry.addSpace("v", FERMION, UNOCCUPIED, List.of("a", "b"));
 * Index i = registry.freshIndex("o");                             // 첫 발급 시 자동 freeze
 * registry.addSpace("a", ...);                                    // ConfigurationException
 * registry.reset();                                               // 새 epoch, freeze 해제
 * </pre>
 *
 * <p><strong>Draft-then-reserve:</strong> 파서와 빌더는 {@link #draftIndex(String, int)}로
 * 부수 효과 없이 Index를 만들고, 입력 전체가 성공한 뒤에만 {@link #reserve(Collection)}로
 * freeze와 ordinal 예약을 한꺼번에 반영합니다. 실패한 입력은 registry를 바꾸지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 공개 메서드는 동기화되어 있습니다. 병렬 전개 단계에서는
 * registry가 freeze 상태(읽기 전용)여야 합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class SpaceRegistry {

    private static final AtomicLong EPOCHS = new AtomicLong();

    private final Map<String, Space> spaces = new LinkedHashMap<>();
    private final Map<String, Integer> nextOrdinals = new HashMap<>();
    private long epoch;
    private boolean frozen;

    public SpaceRegistry() {
        this.epoch = EPOCHS.incrementAndGet();
    }

    /**
     * 모든 공간과 ordinal 카운터를 원자적으로 제거하고 새 epoch를 시작합니다.
     *
     * <p>이전 epoch에서 발급된 Index, 그리고 이를 참조하는 Term/Expression은 무효가 됩니다.</p>
     */
    public synchronized void reset() {
        spaces.clear();
        nextOrdinals.clear();
        epoch = EPOCHS.incrementAndGet();
        frozen = false;
    }

    /**
     * 공간 추가.
     *
     * @param label 공간 label (영문자)
     * @param statistics 입자 통계
     * @param occupation 점유 분류
     * @param stems index stem 목록 (비어 있을 수 없음)
     * @return 등록된 Space
     * @throws ConfigurationException label 중복, stem 비어 있음, freeze 상태인 경우
     */
    public synchronized Space addSpace(String label, Statistics statistics, OccupationClass occupation,
                                       List<String> stems) {
        return addSpace(label, statistics, occupation, stems, List.of());
    }

    /**
     * 합성 공간 추가.
     *
     * <p>구성 기본 공간은 이미 등록되어 있어야 하며, 합성 공간 자신이 아니어야 하고,
     * 같은 입자 통계를 가져야 합니다.</p>
     *
     * @param label 공간 label
     * @param statistics 입자 통계
     * @param occupation 점유 분류
     * @param stems index stem 목록
     * @param elementarySpaces 구성 기본 공간 label 목록 (비어 있으면 기본 공간)
     * @return 등록된 Space
     * @throws ConfigurationException 설정이 잘못되었거나 freeze 상태인 경우
     */
    public synchronized Space addSpace(String label, Statistics statistics, OccupationClass occupation,
                                       List<String> stems, List<String> elementarySpaces) {
        if (frozen) {
            throw new ConfigurationException(
                "Registry is frozen; add spaces before building indices (space: " + label + ")");
        }
        Space space = new Space(label, statistics, occupation, stems, elementarySpaces);
        if (spaces.containsKey(space.label())) {
            throw new ConfigurationException("Duplicate space label: " + label);
        }
        for (String elementary : space.elementarySpaces()) {
            Space component = spaces.get(elementary);
            if (component == null) {
                throw new ConfigurationException(
                    "Elementary space " + elementary + " of " + label + " is not registered");
            }
            if (component.isComposite()) {
                throw new ConfigurationException(
                    "Elementary space " + elementary + " of " + label + " is itself composite");
            }
            if (component.statistics() != space.statistics()) {
                throw new ConfigurationException(
                    "Elementary space " + elementary + " of " + label + " has different statistics");
            }
        }
        spaces.put(space.label(), space);
        nextOrdinals.put(space.label(), 0);
        return space;
    }

    /**
     * label로 공간 조회.
     *
     * @param label 공간 label
     * @return Space
     * @throws ConfigurationException 등록되지 않은 label인 경우
     */
    public synchronized Space space(String label) {
        Space space = spaces.get(label);
        if (space == null) {
            throw new ConfigurationException("Unknown space label: " + label + " (registered: " + spaces.keySet() + ")");
        }
        return space;
    }

    public synchronized boolean hasSpace(String label) {
        return spaces.containsKey(label);
    }

    /**
     * Index가 속한 공간 조회 (epoch 검증 포함).
     *
     * @param index 조회할 Index
     * @return Space
     * @throws ConfigurationException 다른 epoch의 Index이거나 공간이 없는 경우
     */
    public synchronized Space spaceOf(Index index) {
        requireCurrent(index);
        return space(index.getLabel());
    }

    /**
     * 다음 미사용 ordinal로 새 Index 발급.
     *
     * <p>ordinal은 epoch 내에서 label별로 단조 증가합니다. 첫 발급 시 registry가 freeze됩니다.</p>
     *
     * @param label 공간 label
     * @return 새 Index
     * @throws ConfigurationException 등록되지 않은 label인 경우
     */
    public synchronized Index freshIndex(String label) {
        space(label);
        frozen = true;
        int ordinal = nextOrdinals.get(label);
        nextOrdinals.put(label, ordinal + 1);
        return new Index(label, ordinal, epoch);
    }

    /**
     * 지정 ordinal의 Index 생성 (이후 freshIndex가 이 ordinal을 건너뛰도록 표시).
     *
     * @param label 공간 label
     * @param ordinal 0 이상
     * @return Index
     * @throws ConfigurationException 등록되지 않은 label인 경우
     * @throws IllegalArgumentException ordinal이 음수인 경우
     */
    public synchronized Index index(String label, int ordinal) {
        Index index = draftIndex(label, ordinal);
        reserve(List.of(index));
        return index;
    }

    /**
     * 지정 ordinal의 Index를 registry 상태 변경 없이 생성.
     *
     * <p>freeze하지 않고 ordinal도 예약하지 않습니다. 사용이 확정되면 {@link #reserve(Collection)}를 호출합니다.</p>
     *
     * @param label 공간 label
     * @param ordinal 0 이상
     * @return 현재 epoch의 Index
     * @throws ConfigurationException 등록되지 않은 label인 경우
     * @throws IllegalArgumentException ordinal이 음수인 경우
     */
    public synchronized Index draftIndex(String label, int ordinal) {
        space(label);
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative (current: " + ordinal + ")");
        }
        return new Index(label, ordinal, epoch);
    }

    /**
     * index 사용 확정: registry를 freeze하고 이후 freshIndex가 해당 ordinal을 건너뛰도록 표시.
     *
     * <p>모든 index를 먼저 검증한 뒤 반영하므로, 예외가 발생하면 registry는 바뀌지 않습니다.
     * 빈 목록이면 아무 일도 하지 않습니다.</p>
     *
     * @param indices 확정할 index
     * @throws ConfigurationException 이전 epoch의 Index이거나 공간이 없는 경우
     */
    public synchronized void reserve(Collection<Index> indices) {
        if (indices == null) {
            throw new IllegalArgumentException("indices cannot be null");
        }
        for (Index index : indices) {
            spaceOf(index);
        }
        if (indices.isEmpty()) {
            return;
        }
        frozen = true;
        for (Index index : indices) {
            if (nextOrdinals.get(index.getLabel()) <= index.getOrdinal()) {
                nextOrdinals.put(index.getLabel(), index.getOrdinal() + 1);
            }
        }
    }

    /**
     * Index가 현재 epoch에서 발급되었는지 검증.
     *
     * @param index 검증할 Index
     * @throws ConfigurationException 이전 epoch 또는 다른 registry의 Index인 경우
     */
    public synchronized void requireCurrent(Index index) {
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
        if (index.getEpoch() != epoch) {
            throw new ConfigurationException(
                "Index " + index + " belongs to a stale registry epoch (index epoch: "
                    + index.getEpoch() + ", current: " + epoch + ")");
        }
    }

    /**
     * 명시적 freeze. 이미 freeze 상태면 아무 일도 하지 않습니다.
     */
    public synchronized void freeze() {
        frozen = true;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    public synchronized long epoch() {
        return epoch;
    }

    public synchronized int numSpaces() {
        return spaces.size();
    }

    public synchronized List<Space> spaces() {
        return List.copyOf(new ArrayList<>(spaces.values()));
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s %-10s %-12s %-16s %s%n", "label", "statistics", "occupation", "stems", "elementary"));
        for (Space space : spaces.values()) {
            sb.append(String.format("%-8s %-10s %-12s %-16s %s%n",
                space.label(),
                space.statistics().name().toLowerCase(),
                space.occupation().name().toLowerCase(),
                String.join(",", space.stems()),
                String.join(",", space.elementarySpaces())).stripTrailing()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
