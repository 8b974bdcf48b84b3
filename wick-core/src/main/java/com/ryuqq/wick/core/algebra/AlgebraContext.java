package com.ryuqq.wick.core.algebra;

import com.ryuqq.wick.core.canonical.Canonicalizer;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.spi.ExpansionRuntime;
import com.ryuqq.wick.core.spi.SequentialExpansionRuntime;
import com.ryuqq.wick.core.wick.ContractionRule;
import com.ryuqq.wick.core.wick.ExpansionLimits;
import com.ryuqq.wick.core.wick.FermiVacuumContractionRule;
import com.ryuqq.wick.core.wick.WickEngine;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expression 연산이 공유하는 설정 컨텍스트.
 *
 * <p>SpaceRegistry, 전개 상한, 축약 규칙, 전개 runtime, 파싱 시 기본 텐서 대칭성을 묶습니다.
 * 같은 컨텍스트(같은 registry)를 공유하는 Expression끼리만 결합할 수 있습니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>limits: {@link ExpansionLimits#ExpansionLimits()}</li>
 *   <li>rule: {@link FermiVacuumContractionRule}</li>
 *   <li>runtime: {@link SequentialExpansionRuntime}</li>
 *   <li>defaultSymmetry: {@link Symmetry#ANTISYMMETRIC}</li>
 * </ul>
 *
 * <p><strong>대칭성 선언:</strong> Expression에 병합된 텐서의 대칭성은 시그니처(이름 + 슬롯 개수)별로
 * 컨텍스트에 기록되며, 처음 기록된 선언이 유지됩니다. 텍스트에는 대칭성이 없으므로 파서는
 * 기록된 선언 → 예약 이름({@code delta}, {@code gamma1}, {@code eta1}: 대칭성 없음) → 기본 대칭성
 * 순서로 대칭성을 정합니다. 기록은 registry epoch별로 분리되고, {@code withX}로 만든 컨텍스트와 공유됩니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class AlgebraContext {

    private static final Set<String> RESERVED_NONE_SYMMETRIC = Set.of(
        WickEngine.KRONECKER_DELTA,
        FermiVacuumContractionRule.ONE_BODY_DENSITY,
        FermiVacuumContractionRule.ONE_HOLE_DENSITY);

    private final SpaceRegistry registry;
    private final ExpansionLimits limits;
    private final ContractionRule rule;
    private final ExpansionRuntime runtime;
    private final Symmetry defaultSymmetry;
    private final WickEngine engine;
    private final Canonicalizer canonicalizer;
    private final Map<String, Symmetry> declaredSymmetries;

    public AlgebraContext(SpaceRegistry registry) {
        this(registry, new ExpansionLimits(), new FermiVacuumContractionRule(),
            new SequentialExpansionRuntime(), Symmetry.ANTISYMMETRIC);
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AlgebraContext(SpaceRegistry registry, ExpansionLimits limits, ContractionRule rule,
                          ExpansionRuntime runtime, Symmetry defaultSymmetry) {
        this(registry, limits, rule, runtime, defaultSymmetry, new ConcurrentHashMap<>());
    }

    private AlgebraContext(SpaceRegistry registry, ExpansionLimits limits, ContractionRule rule,
                           ExpansionRuntime runtime, Symmetry defaultSymmetry,
                           Map<String, Symmetry> declaredSymmetries) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (defaultSymmetry == null) {
            throw new IllegalArgumentException("defaultSymmetry cannot be null");
        }
        this.registry = registry;
        this.limits = limits;
        this.rule = rule;
        this.runtime = runtime;
        this.defaultSymmetry = defaultSymmetry;
        this.engine = new WickEngine(registry, rule, limits);
        this.canonicalizer = new Canonicalizer(registry, limits);
        this.declaredSymmetries = declaredSymmetries;
    }

    public AlgebraContext withLimits(ExpansionLimits newLimits) {
        return new AlgebraContext(registry, newLimits, rule, runtime, defaultSymmetry, declaredSymmetries);
    }

    public AlgebraContext withRule(ContractionRule newRule) {
        return new AlgebraContext(registry, limits, newRule, runtime, defaultSymmetry, declaredSymmetries);
    }

    public AlgebraContext withRuntime(ExpansionRuntime newRuntime) {
        return new AlgebraContext(registry, limits, rule, newRuntime, defaultSymmetry, declaredSymmetries);
    }

    public AlgebraContext withDefaultSymmetry(Symmetry newDefaultSymmetry) {
        return new AlgebraContext(registry, limits, rule, runtime, newDefaultSymmetry, declaredSymmetries);
    }

    public SpaceRegistry getRegistry() {
        return registry;
    }

    public ExpansionLimits getLimits() {
        return limits;
    }

    public ContractionRule getRule() {
        return rule;
    }

    public ExpansionRuntime getRuntime() {
        return runtime;
    }

    public Symmetry getDefaultSymmetry() {
        return defaultSymmetry;
    }

    public WickEngine getEngine() {
        return engine;
    }

    public Canonicalizer getCanonicalizer() {
        return canonicalizer;
    }

    /**
     * 텐서 대칭성 선언 기록. 같은 시그니처가 이미 기록되어 있으면 무시합니다.
     *
     * @param declarations 시그니처 → 대칭성
     */
    public void recordSymmetries(Map<String, Symmetry> declarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("declarations cannot be null");
        }
        long epoch = registry.epoch();
        for (Map.Entry<String, Symmetry> declaration : declarations.entrySet()) {
            declaredSymmetries.putIfAbsent(epoch + ":" + declaration.getKey(), declaration.getValue());
        }
    }

    /**
     * 텍스트 입력 텐서의 대칭성 결정 (기록된 선언 우선).
     *
     * @param name 텐서 이름
     * @param upperCount 위 첨자 개수
     * @param lowerCount 아래 첨자 개수
     * @return 기록된 선언, 예약 이름이면 NONE, 그 외에는 기본 대칭성
     */
    public Symmetry resolveSymmetry(String name, int upperCount, int lowerCount) {
        Symmetry declared = declaredSymmetries.get(
            registry.epoch() + ":" + name + "(" + upperCount + "," + lowerCount + ")");
        if (declared != null) {
            return declared;
        }
        return isReservedName(name) ? Symmetry.NONE : defaultSymmetry;
    }

    /**
     * 엔진이 생성하는 텐서 이름(δ, 1체 밀도, 1정공 밀도) 여부.
     *
     * @param name 텐서 이름
     * @return 예약 이름이면 true
     */
    public static boolean isReservedName(String name) {
        return RESERVED_NONE_SYMMETRIC.contains(name);
    }
}
