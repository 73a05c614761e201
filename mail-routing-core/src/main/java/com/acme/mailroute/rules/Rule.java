package com.acme.mailroute.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * A prioritized condition/action rule. All conditions must hold (AND). Higher priority is
 * evaluated first; a match with {@code stopProcessing} ends evaluation.
 */
public record Rule(
    String id,
    String name,
    String description,
    boolean enabled,
    int priority,
    List<Condition> conditions,
    ActionSource actions,
    boolean stopProcessing) {

  public Rule {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Rule id is required");
    }
    if (actions == null) {
      throw new IllegalArgumentException("Rule " + id + " has no action source");
    }
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    name = name == null ? id : name;
  }

  public Rule withEnabled(boolean flag) {
    return new Rule(id, name, description, flag, priority, conditions, actions, stopProcessing);
  }

  public Rule withConditions(List<Condition> replaced) {
    return new Rule(id, name, description, enabled, priority, replaced, actions, stopProcessing);
  }

  public boolean usesLists() {
    return conditions.stream().anyMatch(c -> c.listRef() != null);
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public static final class Builder {
    private final String id;
    private String name;
    private String description;
    private boolean enabled = true;
    private int priority;
    private final List<Condition> conditions = new ArrayList<>();
    private ActionSource actions;
    private boolean stopProcessing;

    private Builder(String id) {
      this.id = id;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder when(ConditionType type, Operator operator, Object value) {
      conditions.add(Condition.of(type, operator, value));
      return this;
    }

    public Builder when(Condition condition) {
      conditions.add(condition);
      return this;
    }

    public Builder then(Action... list) {
      this.actions = ActionSource.of(list);
      return this;
    }

    public Builder then(ActionSource source) {
      this.actions = source;
      return this;
    }

    public Builder stopProcessing() {
      this.stopProcessing = true;
      return this;
    }

    public Rule build() {
      return new Rule(
          id, name, description, enabled, priority, conditions, actions, stopProcessing);
    }
  }
}
