package io.dsh.shell.cli.completion.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompletionCacheTest {

  private static final long MS = 1_000_000L;

  private AtomicLong now;
  private AtomicInteger loads;
  private CompletionCache<String, String> cache;

  @BeforeEach
  void setUp() {
    now = new AtomicLong();
    loads = new AtomicInteger();
    cache = new CompletionCache<>(Duration.ofMillis(100), now::get);
  }

  private String load() {
    return "value-" + loads.incrementAndGet();
  }

  @Test
  void secondLookupWithinTtlDoesNotReload() {
    assertEquals("value-1", cache.getOrLoad("k", this::load));
    now.addAndGet(50 * MS);
    assertEquals("value-1", cache.getOrLoad("k", this::load));

    assertEquals(1, loads.get());
  }

  @Test
  void expiredEntryIsReloaded() {
    cache.getOrLoad("k", this::load);
    now.addAndGet(100 * MS);

    assertEquals("value-2", cache.getOrLoad("k", this::load));
    assertEquals(2, loads.get());
  }

  @Test
  void hitsExtendTheEntryLifetime() {
    cache.getOrLoad("k", this::load);
    now.addAndGet(80 * MS);
    cache.getOrLoad("k", this::load);
    now.addAndGet(80 * MS);

    assertEquals("value-1", cache.getOrLoad("k", this::load));
    assertEquals(1, loads.get());
  }

  @Test
  void plainGetDoesNotExtendLifetime() {
    cache.set("k", "v");
    now.addAndGet(80 * MS);
    assertTrue(cache.get("k").isPresent());
    now.addAndGet(20 * MS);

    assertTrue(cache.get("k").isEmpty());
    assertEquals(0, cache.size());
  }

  @Test
  void extendTtlOnMissingOrExpiredKeyFails() {
    assertFalse(cache.extendTtl("missing"));
    cache.set("k", "v");
    now.addAndGet(200 * MS);

    assertFalse(cache.extendTtl("k"));
  }

  @Test
  void failedLoadIsNotCached() {
    assertThrows(
        IOException.class,
        () ->
            cache.getOrLoad(
                "k",
                () -> {
                  throw new IOException("boom");
                }));

    assertTrue(cache.get("k").isEmpty());
    assertEquals("value-1", cache.getOrLoad("k", this::load));
  }

  @Test
  void invalidateAllDropsEverything() {
    cache.set("a", "1");
    cache.set("b", "2");

    cache.invalidateAll();

    assertEquals(0, cache.size());
  }

  @Test
  void rejectsNonPositiveTtl() {
    assertThrows(IllegalArgumentException.class, () -> new CompletionCache<>(Duration.ZERO));
  }
}
