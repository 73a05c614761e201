package com.acme.mailroute;

import io.micronaut.runtime.Micronaut;

/**
 * Mail routing worker. Hosts the ingestion coordinator and routing pipeline, and the poll loop
 * when a mail source integration is deployed.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}
