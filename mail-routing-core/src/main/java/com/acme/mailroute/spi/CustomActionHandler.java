package com.acme.mailroute.spi;

import com.acme.mailroute.dispatch.DispatchContext;
import com.acme.mailroute.rules.Action;

/** Handler for {@code CUSTOM} actions, selected by the action value. */
public interface CustomActionHandler {
  String name();

  void handle(DispatchContext ctx, Action action);
}
