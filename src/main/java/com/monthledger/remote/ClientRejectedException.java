package com.monthledger.remote;

public class ClientRejectedException extends RemoteStoreException {
  public ClientRejectedException(String message, int status, Throwable cause) {
    super(message, status, cause);
  }
}
