package com.acme.mailroute.spi;

import com.acme.mailroute.dispatch.DispatchContext;
import java.util.Map;

public interface Notifier {
  void notify(DispatchContext ctx, String channel, Map<String, String> params);
}
