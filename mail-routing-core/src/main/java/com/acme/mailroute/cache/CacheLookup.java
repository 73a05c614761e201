package com.acme.mailroute.cache;

import com.acme.mailroute.domain.ClassificationResult;
import java.time.Instant;

/** Result of a cache read-through. */
public record CacheLookup(ClassificationResult result, boolean fromCache, Instant accessedAt) {}
