package com.acme.mailroute.dispatch;

import com.acme.mailroute.spi.CustomActionHandler;
import com.acme.mailroute.spi.MailboxOperations;
import com.acme.mailroute.spi.MessageForwarder;
import com.acme.mailroute.spi.Notifier;
import com.acme.mailroute.spi.SenderListManager;
import com.acme.mailroute.spi.TaskTracker;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Collaborators the dispatcher may call. Any of them may be null; their actions are skipped. */
public record Capabilities(
    MailboxOperations mailbox,
    MessageForwarder forwarder,
    Notifier notifier,
    TaskTracker tasks,
    SenderListManager senderLists,
    Map<String, CustomActionHandler> customHandlers) {

  public Capabilities {
    customHandlers = customHandlers == null ? Map.of() : Map.copyOf(customHandlers);
  }

  public static Capabilities none() {
    return new Capabilities(null, null, null, null, null, Map.of());
  }

  public static Map<String, CustomActionHandler> byName(List<CustomActionHandler> handlers) {
    return handlers.stream()
        .collect(Collectors.toMap(CustomActionHandler::name, Function.identity()));
  }
}
