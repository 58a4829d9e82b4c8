package com.monthledger.remote;

/**
 * Failure reported by the remote budget store, already sorted into the sync layer's taxonomy by
 * its concrete subtype.
 */
public abstract class RemoteStoreException extends RuntimeException {
  private final int status;

  protected RemoteStoreException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /**
   * HTTP status of the failed call, or {@code 0} when no response was received.
   */
  public int getStatus() {
    return status;
  }

  /**
   * Client-error statuses that mean "try again later" rather than "this request is wrong":
   * 408 Request Timeout and 429 Too Many Requests.
   */
  public static boolean isRetryableClientStatus(int status) {
    return status == 408 || status == 429;
  }
}
