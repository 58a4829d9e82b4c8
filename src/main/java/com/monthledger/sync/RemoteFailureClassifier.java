package com.monthledger.sync;

import com.monthledger.remote.ClientRejectedException;
import com.monthledger.remote.RemoteStoreException;
import com.monthledger.remote.TransientRemoteException;
import com.monthledger.remote.UnauthorizedException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class RemoteFailureClassifier {

  public FailureKind classify(Throwable failure) {
    if (failure instanceof UnauthorizedException) {
      return FailureKind.UNAUTHORIZED;
    }
    if (failure instanceof ClientRejectedException) {
      return FailureKind.CLIENT_REJECTED;
    }
    if (failure instanceof TransientRemoteException) {
      return FailureKind.TRANSIENT;
    }
    if (failure instanceof RemoteStoreException remote) {
      return byStatus(remote.getStatus());
    }
    if (failure instanceof RestClientResponseException response) {
      return byStatus(response.getStatusCode().value());
    }
    return FailureKind.TRANSIENT;
  }

  public boolean isConnectivityLoss(Throwable failure) {
    if (failure instanceof TransientRemoteException transientFailure) {
      return transientFailure.isConnectivityLoss();
    }
    return failure instanceof ResourceAccessException;
  }

  private static FailureKind byStatus(int status) {
    if (status == 401) {
      return FailureKind.UNAUTHORIZED;
    }
    if (RemoteStoreException.isRetryableClientStatus(status)) {
      return FailureKind.TRANSIENT;
    }
    if (status >= 400 && status < 500) {
      return FailureKind.CLIENT_REJECTED;
    }
    return FailureKind.TRANSIENT;
  }
}
