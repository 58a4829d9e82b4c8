package com.monthledger.remote;

public class UnauthorizedException extends RemoteStoreException {
  public UnauthorizedException(String message, Throwable cause) {
    super(message, 401, cause);
  }
}
