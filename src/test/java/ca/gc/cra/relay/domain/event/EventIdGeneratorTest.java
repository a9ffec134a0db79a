package ca.gc.cra.relay.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventIdGeneratorTest {

  @Test
  void idsCarryTimestampAndSequence() {
    EventIdGenerator ids = new EventIdGenerator();
    long first = ids.nextId(1_000L);
    long second = ids.nextId(1_000L);

    assertEquals(1_000L, EventIdGenerator.timestampOf(first));
    assertEquals(0L, EventIdGenerator.sequenceOf(first));
    assertEquals(1L, EventIdGenerator.sequenceOf(second));
    assertTrue(second > first);
  }

  @Test
  void idsAreUniqueAcrossThreadsWithinOneMillisecond() throws InterruptedException {
    EventIdGenerator ids = new EventIdGenerator();
    Set<Long> seen = ConcurrentHashMap.newKeySet();
    int threads = 8;
    int perThread = 5_000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch done = new CountDownLatch(threads);
    for (int t = 0; t < threads; t++) {
      pool.execute(() -> {
        for (int i = 0; i < perThread; i++) {
          seen.add(ids.nextId(42L));
        }
        done.countDown();
      });
    }
    assertTrue(done.await(10, TimeUnit.SECONDS));
    pool.shutdownNow();

    assertEquals(threads * perThread, seen.size());
  }
}
