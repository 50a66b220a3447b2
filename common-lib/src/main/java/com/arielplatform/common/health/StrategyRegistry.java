package com.arielplatform.common.health;

import com.arielplatform.common.exception.InvalidArgumentException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of recovery strategies. Registration order is selection order.
 */
public class StrategyRegistry {

    private final Map<String, RecoveryStrategy> strategies = new LinkedHashMap<>();

    public void register(RecoveryStrategy strategy) {
        if (strategies.containsKey(strategy.key())) {
            throw new InvalidArgumentException("recovery", "Strategy already registered: " + strategy.key());
        }
        strategies.put(strategy.key(), strategy);
    }

    public void registerAll(RecoveryStrategy... toRegister) {
        for (RecoveryStrategy strategy : toRegister) {
            register(strategy);
        }
    }

    /**
     * First registered strategy whose key occurs in {@code subject}.
     */
    public Optional<RecoveryStrategy> select(String subject) {
        for (RecoveryStrategy s : strategies.values()) {
            if (subject.contains(s.key())) return Optional.of(s);
        }
        return Optional.empty();
    }

    public Collection<RecoveryStrategy> getAll() {
        return Collections.unmodifiableCollection(strategies.values());
    }

    public int size() {
        return strategies.size();
    }
}
