package com.buildsentinel.core.engine;

import com.buildsentinel.core.error.NotFoundException;
import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.AnomalyEvent;
import com.buildsentinel.core.model.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered routing table. The first rule whose job pattern matches wins; if none
 * does, the synthetic default rule applies.
 *
 * <p>
 * Rules keep their insertion order. Removing a rule does not reorder the
 * remaining ones and re-adding a rule appends it at the end.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; callers hold the engine lock.
 * </p>
 *
 * @since 1.0.0
 */
public class Router {

    private static final Logger LOG = LoggerFactory.getLogger(Router.class);

    private final Map<String, RoutingRule> rules = new LinkedHashMap<>();
    private final RoutingRule defaultRule;

    /**
     * @param defaultRule rule applied when nothing registered matches
     */
    public Router(RoutingRule defaultRule) {
        this.defaultRule = Objects.requireNonNull(defaultRule, "Default rule must not be null");
    }

    /**
     * @param jobName job to route
     * @return first matching registered rule, otherwise the default rule
     */
    public RoutingRule match(String jobName) {
        for (RoutingRule rule : rules.values()) {
            if (rule.matchesJob(jobName)) {
                return rule;
            }
        }
        return defaultRule;
    }

    /**
     * @return {@code true} unless the event's severity is strictly below the
     *         rule's floor
     */
    public boolean passesSeverity(AnomalyEvent event, RoutingRule rule) {
        return rule.passesSeverity(event.getEffectiveSeverity());
    }

    /**
     * Append a rule to the end of the table.
     *
     * @throws ValidationException if a rule with the same name exists or the
     *                             name is reserved
     */
    public void add(RoutingRule rule) {
        Objects.requireNonNull(rule, "Routing rule must not be null");
        if (rule.isDefaultRule()) {
            throw new ValidationException(
                    "Rule name '" + RoutingRule.DEFAULT_RULE_NAME + "' is reserved");
        }
        if (rules.containsKey(rule.getName())) {
            throw new ValidationException("Routing rule '" + rule.getName() + "' is already registered");
        }
        rules.put(rule.getName(), rule);
        LOG.info("Added routing rule: {}", rule);
    }

    /**
     * @return the removed rule
     * @throws NotFoundException if no rule has that name
     */
    public RoutingRule remove(String name) {
        RoutingRule removed = rules.remove(name);
        if (removed == null) {
            throw new NotFoundException("Routing rule '" + name + "' is not registered");
        }
        LOG.info("Removed routing rule '{}'", name);
        return removed;
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * @return registered rules in evaluation order
     */
    public List<RoutingRule> list() {
        return List.copyOf(rules.values());
    }

    /**
     * Replace the table with restored rules, preserving their order.
     */
    public void restore(Collection<RoutingRule> restored) {
        rules.clear();
        if (restored != null) {
            for (RoutingRule rule : restored) {
                if (rule != null && !rule.isDefaultRule()) {
                    rules.putIfAbsent(rule.getName(), rule);
                }
            }
        }
    }

    public int size() {
        return rules.size();
    }
}
