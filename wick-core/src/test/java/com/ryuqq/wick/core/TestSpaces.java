package com.ryuqq.wick.core;

import com.ryuqq.wick.core.space.OccupationClass;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.space.Statistics;

import java.util.List;

/**
 * 테스트 공용 공간 설정: o (occupied), a (general), v (unoccupied), b (boson, general).
 */
public final class TestSpaces {

    private TestSpaces() {
    }

    public static SpaceRegistry standard() {
        SpaceRegistry registry = new SpaceRegistry();
        registry.addSpace("o", Statistics.FERMION, OccupationClass.OCCUPIED, List.of("i", "j", "k", "l"));
        registry.addSpace("a", Statistics.FERMION, OccupationClass.GENERAL, List.of("u", "v", "w", "x"));
        registry.addSpace("v", Statistics.FERMION, OccupationClass.UNOCCUPIED, List.of("a", "b", "c", "d"));
        registry.addSpace("b", Statistics.BOSON, OccupationClass.GENERAL, List.of("p", "q"));
        return registry;
    }
}
