package com.acme.mailroute.spi;

import com.acme.mailroute.dispatch.DispatchContext;

public interface MessageForwarder {
  void forward(DispatchContext ctx, String address);
}
