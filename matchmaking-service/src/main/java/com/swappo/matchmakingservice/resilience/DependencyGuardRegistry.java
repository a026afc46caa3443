package com.swappo.matchmakingservice.resilience;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Holds exactly one {@link GuardedDependency} per {@link DependencyName}.
 * Built once at startup; lookups never create breakers on the fly.
 */
public class DependencyGuardRegistry {

    private final Map<DependencyName, GuardedDependency> guards;

    public DependencyGuardRegistry(Function<DependencyName, GuardedDependency> factory) {
        Map<DependencyName, GuardedDependency> built = new EnumMap<>(DependencyName.class);
        for (DependencyName dependency : DependencyName.values()) {
            built.put(dependency, factory.apply(dependency));
        }
        this.guards = Collections.unmodifiableMap(built);
    }

    public GuardedDependency guard(DependencyName dependency) {
        return guards.get(dependency);
    }

    public DependencyHealth health(DependencyName dependency) {
        return guards.get(dependency).health();
    }

    public Collection<GuardedDependency> all() {
        return guards.values();
    }
}
