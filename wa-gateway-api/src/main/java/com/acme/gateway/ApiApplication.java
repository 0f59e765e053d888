package com.acme.gateway;

import io.micronaut.runtime.Micronaut;

/**
 * Gateway application: REST API and agent tool-call endpoint in front of the messaging
 * sessions, with the outgoing and webhook queues running in-process.
 */
public class ApiApplication {
  public static void main(String[] args) {
    Micronaut.run(ApiApplication.class, args);
  }
}
