package com.monthledger.remote;

public class TransientRemoteException extends RemoteStoreException {
  private final boolean connectivityLoss;

  public TransientRemoteException(String message, int status, boolean connectivityLoss, Throwable cause) {
    super(message, status, cause);
    this.connectivityLoss = connectivityLoss;
  }

  public boolean isConnectivityLoss() {
    return connectivityLoss;
  }
}
