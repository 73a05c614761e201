package com.acme.mailroute.processor.sink;

import com.acme.mailroute.dispatch.DispatchContext;
import com.acme.mailroute.spi.MailboxOperations;
import com.acme.mailroute.spi.MessageForwarder;
import com.acme.mailroute.spi.Notifier;
import com.acme.mailroute.spi.TaskTracker;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Default capability sink used when no mailbox integration is deployed. Every action is logged
 * and reported as done; a real integration bean replaces it.
 */
@Slf4j
@Singleton
@Secondary
public class LoggingActionSink
    implements MailboxOperations, MessageForwarder, Notifier, TaskTracker {

  @Override
  public void route(DispatchContext ctx, String folder) {
    log.info("[{}] route to folder {}", ctx.recordId(), folder);
  }

  @Override
  public void tag(DispatchContext ctx, String tag) {
    log.info("[{}] tag {}", ctx.recordId(), tag);
  }

  @Override
  public void setPriority(DispatchContext ctx, String level) {
    log.info("[{}] priority {}", ctx.recordId(), level);
  }

  @Override
  public void archive(DispatchContext ctx) {
    log.info("[{}] archive", ctx.recordId());
  }

  @Override
  public void delete(DispatchContext ctx) {
    log.info("[{}] delete", ctx.recordId());
  }

  @Override
  public void star(DispatchContext ctx) {
    log.info("[{}] star", ctx.recordId());
  }

  @Override
  public void snooze(DispatchContext ctx, String until) {
    log.info("[{}] snooze until {}", ctx.recordId(), until);
  }

  @Override
  public void markAsSpam(DispatchContext ctx) {
    log.info("[{}] mark as spam", ctx.recordId());
  }

  @Override
  public void forward(DispatchContext ctx, String address) {
    log.info("[{}] forward to {}", ctx.recordId(), address);
  }

  @Override
  public void notify(DispatchContext ctx, String channel, Map<String, String> params) {
    log.info("[{}] notify {} {}", ctx.recordId(), channel, params);
  }

  @Override
  public String createTask(DispatchContext ctx, String title, Map<String, String> params) {
    String taskId = "task-" + UUID.randomUUID();
    log.info("[{}] task {} '{}' {}", ctx.recordId(), taskId, title, params);
    return taskId;
  }
}
