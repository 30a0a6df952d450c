package io.mcgateway.core.route;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable per-server forwarding rules. Replaced wholesale on reload.
 */
public final class ForwardingTable {
    public static final Set<ForwardEvent> DEFAULT_EVENTS = Set.copyOf(EnumSet.of(ForwardEvent.CHAT, ForwardEvent.PLAYER_EVENT));

    private static final ForwardingTable EMPTY = new ForwardingTable(Map.of());

    private final Map<String, Rule> rules;

    private ForwardingTable(Map<String, Rule> rules) {
        this.rules = Map.copyOf(rules);
    }

    public static ForwardingTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<ForwardTarget> targetsFor(String serverId, ForwardEvent event) {
        Rule rule = rules.get(serverId);
        if (rule == null || !rule.events().contains(event)) {
            return Set.of();
        }
        return rule.targets();
    }

    public int targetCount(String serverId) {
        Rule rule = rules.get(serverId);
        return rule == null ? 0 : rule.targets().size();
    }

    public Set<String> serverIds() {
        return rules.keySet();
    }

    /**
     * Servers that forward any event to {@code target}, sorted by id.
     */
    public Set<String> serversForwardingTo(ForwardTarget target) {
        Objects.requireNonNull(target, "target");
        Set<String> servers = new TreeSet<>();
        for (Map.Entry<String, Rule> entry : rules.entrySet()) {
            if (entry.getValue().targets().contains(target)) {
                servers.add(entry.getKey());
            }
        }
        return servers;
    }

    public record Rule(Set<ForwardTarget> targets, Set<ForwardEvent> events) {
        public Rule {
            targets = Set.copyOf(Objects.requireNonNull(targets, "targets"));
            events = Set.copyOf(Objects.requireNonNull(events, "events"));
        }
    }

    public static final class Builder {
        private final Map<String, Rule> rules = new LinkedHashMap<>();

        public Builder forward(String serverId, Set<ForwardTarget> targets, Set<ForwardEvent> events) {
            Objects.requireNonNull(serverId, "serverId");
            if (targets.isEmpty()) {
                rules.remove(serverId);
                return this;
            }
            rules.put(serverId, new Rule(targets, events.isEmpty() ? DEFAULT_EVENTS : events));
            return this;
        }

        public Builder forward(String serverId, Set<ForwardTarget> targets) {
            return forward(serverId, targets, DEFAULT_EVENTS);
        }

        public ForwardingTable build() {
            return new ForwardingTable(rules);
        }
    }
}
