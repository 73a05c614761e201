package com.acme.mailroute.spi;

import com.acme.mailroute.dispatch.DispatchContext;
import java.util.Map;

public interface TaskTracker {
  /** Returns the tracker's id for the new task. */
  String createTask(DispatchContext ctx, String title, Map<String, String> params);
}
