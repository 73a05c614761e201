package com.acme.mailroute.repository;

import com.acme.mailroute.domain.FilterConfiguration;
import com.acme.mailroute.domain.FilterKind;

/** Persisted ignore-lists for the poll loop. */
public interface FilterRepository {

  FilterConfiguration load();

  /**
   * @return false if the pattern was already present
   */
  boolean add(FilterKind kind, String pattern);

  /**
   * @return false if the pattern was not present
   */
  boolean remove(FilterKind kind, String pattern);
}
