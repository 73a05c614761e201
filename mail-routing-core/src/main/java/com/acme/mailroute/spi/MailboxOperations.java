package com.acme.mailroute.spi;

import com.acme.mailroute.dispatch.DispatchContext;

/** Folder and flag operations on the user's mailbox. */
public interface MailboxOperations {
  void route(DispatchContext ctx, String folder);

  void tag(DispatchContext ctx, String tag);

  void setPriority(DispatchContext ctx, String level);

  void archive(DispatchContext ctx);

  void delete(DispatchContext ctx);

  void star(DispatchContext ctx);

  void snooze(DispatchContext ctx, String until);

  void markAsSpam(DispatchContext ctx);
}
