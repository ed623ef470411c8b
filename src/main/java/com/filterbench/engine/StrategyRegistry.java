package com.filterbench.engine;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the strategy bean for a {@link StrategyType}.
 */
@Component
public class StrategyRegistry {

    private final Map<StrategyType, ExecutionStrategy> strategies = new EnumMap<>(StrategyType.class);

    public StrategyRegistry(List<ExecutionStrategy> strategies) {
        for (ExecutionStrategy strategy : strategies) {
            ExecutionStrategy previous = this.strategies.put(strategy.getType(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Two strategies registered for " + strategy.getType() + ": "
                        + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
            }
        }
    }

    /**
     * @throws IllegalArgumentException if no strategy of that type is registered
     */
    public ExecutionStrategy get(StrategyType type) {
        ExecutionStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for " + type);
        }
        return strategy;
    }
}
