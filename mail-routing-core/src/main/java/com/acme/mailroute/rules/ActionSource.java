package com.acme.mailroute.rules;

import com.acme.mailroute.domain.ClassificationResult;
import java.util.List;
import java.util.function.Function;

/** Where a rule's actions come from: a fixed list, or a function of the classification. */
public sealed interface ActionSource {

  List<Action> resolve(ClassificationResult classification);

  static ActionSource of(Action... actions) {
    return new Static(List.of(actions));
  }

  static ActionSource computed(Function<ClassificationResult, List<Action>> fn) {
    return new Computed(fn);
  }

  record Static(List<Action> actions) implements ActionSource {
    public Static {
      actions = List.copyOf(actions);
    }

    @Override
    public List<Action> resolve(ClassificationResult classification) {
      return actions;
    }
  }

  record Computed(Function<ClassificationResult, List<Action>> fn) implements ActionSource {
    @Override
    public List<Action> resolve(ClassificationResult classification) {
      List<Action> actions = fn.apply(classification);
      return actions == null ? List.of() : List.copyOf(actions);
    }
  }
}
