package ca.gc.cra.relay.application.bus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live subscriber connections keyed by connection id.
 *
 * <p>The lock covers map bookkeeping only; callers perform socket I/O on the links after releasing it.</p>
 */
final class ConnectionRegistry {
  enum Admission { ADMITTED, FULL, CLOSED }

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, SubscriberLink> links = new LinkedHashMap<>();
  private boolean closed;

  Admission tryRegister(SubscriberLink link, int maxConnections) {
    lock.lock();
    try {
      if (closed) {
        return Admission.CLOSED;
      }
      if (links.size() >= maxConnections) {
        return Admission.FULL;
      }
      links.put(link.id(), link);
      return Admission.ADMITTED;
    } finally {
      lock.unlock();
    }
  }

  /** Returns {@code true} if this call removed the link, so exactly one caller reports its loss. */
  boolean remove(SubscriberLink link) {
    lock.lock();
    try {
      return links.remove(link.id(), link);
    } finally {
      lock.unlock();
    }
  }

  List<SubscriberLink> snapshot() {
    lock.lock();
    try {
      return links.isEmpty() ? List.of() : new ArrayList<>(links.values());
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return links.size();
    } finally {
      lock.unlock();
    }
  }

  /** Refuses further registrations and hands back every live link for the caller to close. */
  List<SubscriberLink> closeAll() {
    lock.lock();
    try {
      closed = true;
      List<SubscriberLink> drained = new ArrayList<>(links.values());
      links.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }
}
