package com.ospicorp.anomalyapi.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Scope a JWT must carry to reach the {@code /admin} routes when auth is enabled. */
@Component("adminAuthorization")
public class AdminAuthorization {
  private final String scope;

  public AdminAuthorization(@Value("${security.admin.scope:anomaly:admin}") String scope) {
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }

  public String authority() {
    return "SCOPE_" + scope;
  }
}
