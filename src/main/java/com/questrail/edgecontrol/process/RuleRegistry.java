package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.rule.LogicRule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Authored logic rules by id.
 */
public final class RuleRegistry {

    private final ConcurrentMap<String, LogicRule> rules = new ConcurrentHashMap<>();

    public void put(LogicRule rule) {
        Objects.requireNonNull(rule, "rule");
        rules.put(rule.id(), rule);
    }

    public Optional<LogicRule> get(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Optional<LogicRule> remove(String ruleId) {
        return Optional.ofNullable(rules.remove(ruleId));
    }

    public List<LogicRule> all() {
        return List.copyOf(rules.values());
    }
}
