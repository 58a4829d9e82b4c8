package com.monthledger.sync;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last known reachability of the remote store.
 */
@Component
public class ConnectivityMonitor {
  private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

  private final AtomicBoolean online = new AtomicBoolean(true);

  public boolean isOnline() {
    return online.get();
  }

  /**
   * @return {@code true} if this call brought the client back online
   */
  public boolean markOnline() {
    boolean changed = online.compareAndSet(false, true);
    if (changed) {
      log.info("Remote store reachable again");
    }
    return changed;
  }

  public boolean markOffline() {
    boolean changed = online.compareAndSet(true, false);
    if (changed) {
      log.warn("Remote store unreachable, queueing edits locally");
    }
    return changed;
  }
}
