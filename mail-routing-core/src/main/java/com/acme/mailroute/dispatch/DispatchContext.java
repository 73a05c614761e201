package com.acme.mailroute.dispatch;

import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import java.util.UUID;

/** The message an action applies to. */
public record DispatchContext(
    UUID recordId, Message message, ClassificationResult classification) {}
