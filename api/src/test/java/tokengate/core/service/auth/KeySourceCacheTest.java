package tokengate.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokengate.core.model.auth.KeyLookupResult;
import tokengate.core.port.out.KeySetFetcher.KeySetFetchException;
import tokengate.core.port.out.ValidationMetrics;
import tokengate.support.FakeKeySetFetcher;
import tokengate.support.MutableClock;
import tokengate.support.TokenFactory;

@DisplayName("KeySourceCache")
class KeySourceCacheTest {

    private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration TTL = Duration.ofHours(1);
    private static final Duration AWAIT = Duration.ofSeconds(5);

    private static RsaJsonWebKey key1;
    private static RsaJsonWebKey key2;

    private MutableClock clock;
    private FakeKeySetFetcher fetcher;
    private KeySourceCache cache;
    private ExecutorService executor;

    @BeforeAll
    static void setUpKeys() {
        key1 = TokenFactory.rsaKey("key-1");
        key2 = TokenFactory.rsaKey("key-2");
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        fetcher = new FakeKeySetFetcher(TokenFactory.keySet(key1));
        cache = newCache(new KeySourceCache.Settings(Duration.ofSeconds(2), TTL, Duration.ZERO, false));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private KeySourceCache newCache(KeySourceCache.Settings settings) {
        return new KeySourceCache(fetcher, settings, clock, ValidationMetrics.noop());
    }

    private KeyLookupResult lookup(String keyId) {
        return cache.getKey(keyId).await().atMost(AWAIT);
    }

    @Nested
    @DisplayName("getKey() with a fresh key set")
    class FreshKeySetTests {

        @Test
        @DisplayName("should fetch on first lookup and serve later lookups from memory")
        void shouldFetchOnceAndServeFromMemory() {
            final var first = lookup("key-1");
            final var second = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Found.class, first);
            assertInstanceOf(KeyLookupResult.Found.class, second);
            assertEquals("key-1", ((KeyLookupResult.Found) second).key().keyId());
            assertEquals(1, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should report NotFound for unknown kid without fetching again")
        void shouldReportNotFoundWithoutRefetch() {
            lookup("key-1");

            for (int i = 0; i < 20; i++) {
                final var result = lookup("unknown-" + i);
                assertInstanceOf(KeyLookupResult.NotFound.class, result);
            }

            assertEquals(1, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should expose the held snapshot")
        void shouldExposeCurrentSnapshot() {
            assertTrue(cache.currentSnapshot().isEmpty());

            lookup("key-1");

            final var snapshot = cache.currentSnapshot().orElseThrow();
            assertEquals(START, snapshot.fetchedAt());
            assertEquals(START.plus(TTL), snapshot.expiresAt());
            assertEquals(1, snapshot.size());
        }
    }

    @Nested
    @DisplayName("getKey() with an expired key set")
    class ExpiredKeySetTests {

        @Test
        @DisplayName("should refresh and find a rotated key")
        void shouldRefreshAndFindRotatedKey() {
            lookup("key-1");
            fetcher.respondWith(TokenFactory.keySet(key2));
            clock.advance(TTL.plusSeconds(1));

            final var result = lookup("key-2");

            assertInstanceOf(KeyLookupResult.Found.class, result);
            assertEquals(2, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should drop keys no longer published upstream")
        void shouldDropKeysRemovedUpstream() {
            lookup("key-1");
            fetcher.respondWith(TokenFactory.keySet(key2));
            clock.advance(TTL.plusSeconds(1));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.NotFound.class, result);
            assertTrue(cache.currentSnapshot().orElseThrow().find("key-1").isEmpty());
        }

        @Test
        @DisplayName("should treat the exact expiry instant as still fresh")
        void shouldTreatExpiryInstantAsFresh() {
            lookup("key-1");
            clock.set(START.plus(TTL));

            lookup("key-1");

            assertEquals(1, fetcher.fetchCount());
        }
    }

    @Nested
    @DisplayName("getKey() when the provider fails")
    class FetchFailureTests {

        @Test
        @DisplayName("should report Unavailable when nothing was ever fetched")
        void shouldReportUnavailableWithoutSnapshot() {
            fetcher.failWith(new IllegalStateException("connection refused"));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Unavailable.class, result);
            assertTrue(((KeyLookupResult.Unavailable) result).reason().contains("connection refused"));
        }

        @Test
        @DisplayName("should not serve an expired key set by default")
        void shouldNotServeStaleByDefault() {
            lookup("key-1");
            fetcher.failWith(new KeySetFetchException("JWKS endpoint returned status 503"));
            clock.advance(TTL.plusSeconds(1));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Unavailable.class, result);
        }

        @Test
        @DisplayName("should serve an expired key set when allowed")
        void shouldServeStaleWhenAllowed() {
            cache = newCache(new KeySourceCache.Settings(Duration.ofSeconds(2), TTL, Duration.ZERO, true));
            lookup("key-1");
            fetcher.failWith(new KeySetFetchException("JWKS endpoint returned status 503"));
            clock.advance(TTL.plusSeconds(1));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Found.class, result);
        }

        @Test
        @DisplayName("should give up after the fetch timeout")
        void shouldTimeOut() {
            cache = newCache(new KeySourceCache.Settings(Duration.ofMillis(100), TTL, Duration.ZERO, false));
            fetcher.hang();

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Unavailable.class, result);
            assertTrue(((KeyLookupResult.Unavailable) result).reason().contains("Timeout"));
        }

        @Test
        @DisplayName("should retry on the next lookup after a failed fetch")
        void shouldRetryAfterFailure() {
            fetcher.failWith(new IllegalStateException("connection refused"));
            lookup("key-1");
            fetcher.respondWith(TokenFactory.keySet(key1));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Found.class, result);
            assertEquals(2, fetcher.fetchCount());
        }
    }

    @Nested
    @DisplayName("refresh()")
    class RefreshTests {

        @Test
        @DisplayName("should replace the snapshot")
        void shouldReplaceSnapshot() {
            lookup("key-1");
            fetcher.respondWith(TokenFactory.keySet(key1, key2));
            clock.advance(Duration.ofMinutes(10));

            final var snapshot = cache.refresh().await().atMost(AWAIT);

            assertEquals(2, snapshot.size());
            assertSame(snapshot, cache.currentSnapshot().orElseThrow());
            assertEquals(START.plus(Duration.ofMinutes(10)).plus(TTL), snapshot.expiresAt());
        }

        @Test
        @DisplayName("should fail with KeySetFetchException")
        void shouldFailWithFetchException() {
            fetcher.failWith(new IllegalStateException("boom"));

            assertThrows(KeySetFetchException.class, () -> cache.refresh().await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should skip keys without kid, encryption keys and duplicates")
        void shouldSkipUnusableKeys() {
            final var noKid = TokenFactory.rsaKey(null);
            final var encryption = TokenFactory.rsaKey("enc-key");
            encryption.setUse("enc");
            final var duplicate = TokenFactory.rsaKey("key-1");
            fetcher.respondWith(TokenFactory.keySet(key1, noKid, encryption, duplicate));

            final var snapshot = cache.refresh().await().atMost(AWAIT);

            assertEquals(1, snapshot.size());
            assertEquals(
                    key1.getPublicKey(), snapshot.find("key-1").orElseThrow().publicKey());
        }

        @Test
        @DisplayName("should record fetch outcomes")
        void shouldRecordFetchOutcomes() {
            final var metrics = mock(ValidationMetrics.class);
            cache = new KeySourceCache(fetcher, KeySourceCache.Settings.defaults(), clock, metrics);

            cache.refresh().await().atMost(AWAIT);
            fetcher.failWith(new IllegalStateException("boom"));
            cache.refresh().onFailure().recoverWithNull().await().atMost(AWAIT);

            verify(metrics).recordKeySetFetch(true);
            verify(metrics).recordKeySetFetch(false);
        }
    }

    @Nested
    @DisplayName("single-flight refresh")
    class SingleFlightTests {

        @Test
        @DisplayName("should collapse concurrent misses on a stale cache into one fetch")
        void shouldCollapseConcurrentMisses() throws Exception {
            lookup("key-1");
            clock.advance(TTL.plusSeconds(1));
            final CompletableFuture<JsonWebKeySet> gate = fetcher.holdResponses();

            final int callers = 32;
            executor = Executors.newFixedThreadPool(8);
            final var ready = new CountDownLatch(callers);
            final List<CompletableFuture<KeyLookupResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                final var result = new CompletableFuture<KeyLookupResult>();
                results.add(result);
                executor.submit(() -> {
                    cache.getKey("key-2").subscribe().with(result::complete, result::completeExceptionally);
                    ready.countDown();
                });
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));

            gate.complete(TokenFactory.keySet(key1, key2));

            for (var result : results) {
                assertInstanceOf(KeyLookupResult.Found.class, result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(2, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should share a failed fetch with every waiter")
        void shouldShareFailure() throws Exception {
            final CompletableFuture<JsonWebKeySet> gate = fetcher.holdResponses();

            final var first = cache.getKey("key-1").subscribeAsCompletionStage();
            final var second = cache.getKey("key-1").subscribeAsCompletionStage();
            gate.completeExceptionally(new IllegalStateException("provider down"));

            assertInstanceOf(KeyLookupResult.Unavailable.class, first.get(5, TimeUnit.SECONDS));
            assertInstanceOf(KeyLookupResult.Unavailable.class, second.get(5, TimeUnit.SECONDS));
            assertEquals(1, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should start a new fetch once the previous one completed")
        void shouldStartNewFetchAfterCompletion() {
            cache.refresh().await().atMost(AWAIT);
            cache.refresh().await().atMost(AWAIT);

            assertEquals(2, fetcher.fetchCount());
        }

        @Test
        @DisplayName("should not fetch before anyone subscribes")
        void shouldBeLazy() {
            final Uni<?> pending = cache.refresh();

            assertEquals(0, fetcher.fetchCount());
            pending.await().atMost(AWAIT);
            assertEquals(1, fetcher.fetchCount());
        }
    }

    @Nested
    @DisplayName("refresh-ahead")
    class RefreshAheadTests {

        @BeforeEach
        void enableRefreshAhead() {
            cache = newCache(new KeySourceCache.Settings(Duration.ofSeconds(2), TTL, Duration.ofMinutes(5), false));
            lookup("key-1");
        }

        @Test
        @DisplayName("should answer from the current key set and refresh in the background")
        void shouldRefreshInBackground() {
            fetcher.respondWith(TokenFactory.keySet(key1, key2));
            clock.advance(TTL.minusMinutes(2));

            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Found.class, result);
            assertEquals(2, fetcher.fetchCount());
            assertEquals(2, cache.currentSnapshot().orElseThrow().size());
        }

        @Test
        @DisplayName("should try the background refresh once per key set")
        void shouldTryOncePerKeySet() {
            fetcher.failWith(new IllegalStateException("provider down"));
            clock.advance(TTL.minusMinutes(2));

            lookup("key-1");
            lookup("key-1");
            final var result = lookup("key-1");

            assertInstanceOf(KeyLookupResult.Found.class, result);
            assertEquals(2, fetcher.fetchCount());
            assertEquals(START, cache.currentSnapshot().orElseThrow().fetchedAt());
        }

        @Test
        @DisplayName("should not refresh outside the window")
        void shouldNotRefreshOutsideWindow() {
            clock.advance(TTL.minusMinutes(10));

            lookup("key-1");

            assertEquals(1, fetcher.fetchCount());
        }
    }
}
