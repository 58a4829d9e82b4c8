package com.monthledger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Credentials handed over by the external auth subsystem. The remote client reads the token from
 * here; an unauthorized answer moves the session to {@link Status#EXPIRED}.
 */
@Component
public class ClientSession {
  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

  public enum Status {
    SIGNED_OUT,
    ACTIVE,
    EXPIRED
  }

  private String userId;
  private String accessToken;
  private Status status = Status.SIGNED_OUT;

  public synchronized void start(String userId, String accessToken) {
    this.userId = userId;
    this.accessToken = accessToken;
    this.status = Status.ACTIVE;
  }

  public synchronized void end() {
    this.userId = null;
    this.accessToken = null;
    this.status = Status.SIGNED_OUT;
  }

  public synchronized void expire() {
    if (status == Status.ACTIVE) {
      log.warn("Remote store ended the session for user {}", userId);
    }
    this.accessToken = null;
    this.status = Status.EXPIRED;
  }

  public synchronized boolean isActive() {
    return status == Status.ACTIVE;
  }

  public synchronized String getUserId() {
    return userId;
  }

  public synchronized String getAccessToken() {
    return accessToken;
  }

  public synchronized Status getStatus() {
    return status;
  }
}
