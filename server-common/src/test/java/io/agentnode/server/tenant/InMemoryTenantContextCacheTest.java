package io.agentnode.server.tenant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.agentnode.server.config.Settings;
import io.agentnode.server.tenant.TestTenantStores.CountingTenantStoreProvider;
import io.agentnode.server.tenant.TestTenantStores.TestTenantStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryTenantContextCacheTest {

    private static final TenantId ALICE = TenantId.of("alice");
    private static final TenantId BOB = TenantId.of("bob");
    private static final Settings BASE = Settings.of(Map.of("agentnode.tenant.label", "default",
            "agentnode.inbound.response-timeout-ms", "1000"));

    private CountingTenantStoreProvider provider;
    private InMemoryTenantContextCache cache;
    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        provider = new CountingTenantStoreProvider(ALICE, BOB);
        cache = new InMemoryTenantContextCache(provider);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testOpensOnFirstUseAndReusesAfterwards() {
        TenantContext first = cache.getOrOpen(ALICE, BASE);
        TenantContext second = cache.getOrOpen(ALICE, BASE);

        assertSame(first, second);
        assertEquals(1, provider.openCount(ALICE));
        assertEquals(ALICE, first.tenantId());
        assertEquals("label-alice", first.settings().getString("agentnode.tenant.label"));
        assertEquals("1000", first.settings().getString("agentnode.inbound.response-timeout-ms"));
        assertEquals("default", BASE.getString("agentnode.tenant.label"));
    }

    @Test
    public void testConcurrentFirstOpensOpenOnce() throws Exception {
        int exchanges = 16;
        CountDownLatch gate = new CountDownLatch(1);
        provider.holdOpens(gate);
        CountDownLatch ready = new CountDownLatch(exchanges);

        List<Future<TenantContext>> results = new ArrayList<>();
        for (int i = 0; i < exchanges; i++) {
            results.add(executor.submit(() -> {
                ready.countDown();
                return cache.getOrOpen(ALICE, BASE);
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        // Give every task the chance to reach the cache before the first open completes
        Thread.sleep(100);
        gate.countDown();

        TenantContext expected = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<TenantContext> result : results) {
            assertSame(expected, result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, provider.openCount(ALICE));
        assertEquals(1, cache.size());
    }

    @Test
    public void testUnknownTenantIsNotCached() {
        TenantId unknown = TenantId.of("mallory");

        TenantStoreException e = assertThrows(TenantStoreException.class, () -> cache.getOrOpen(unknown, BASE));

        assertTrue(e.isUnknownTenant());
        assertEquals(0, cache.size());
        assertTrue(cache.get(unknown).isEmpty());
    }

    @Test
    public void testFailedOpenIsRetriedLater() {
        provider.lock(BOB);
        assertThrows(TenantStoreException.class, () -> cache.getOrOpen(BOB, BASE));
        assertEquals(0, cache.size());

        provider.unlock(BOB);
        TenantContext context = cache.getOrOpen(BOB, BASE);

        assertEquals(BOB, context.tenantId());
        assertEquals(2, provider.openCount(BOB));
    }

    @Test
    public void testFailureOfOneTenantDoesNotAffectAnother() {
        TenantContext alice = cache.getOrOpen(ALICE, BASE);
        provider.lock(BOB);

        assertThrows(TenantStoreException.class, () -> cache.getOrOpen(BOB, BASE));

        assertSame(alice, cache.getOrOpen(ALICE, BASE));
        assertSame(alice, cache.get(ALICE).orElseThrow());
    }

    @Test
    public void testEvictClosesStore() {
        TenantContext alice = cache.getOrOpen(ALICE, BASE);

        assertTrue(cache.evict(ALICE));
        assertFalse(cache.evict(ALICE));

        assertTrue(((TestTenantStore) alice.store()).closed);
        assertTrue(cache.get(ALICE).isEmpty());
    }

    @Test
    public void testEvictDuringOpenReopensTenant() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        provider.holdOpens(gate);
        Future<TenantContext> opening = executor.submit(() -> cache.getOrOpen(ALICE, BASE));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (provider.openCount(ALICE) == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, provider.openCount(ALICE));

        assertTrue(cache.evict(ALICE));
        gate.countDown();
        TenantContext context = opening.get(5, TimeUnit.SECONDS);

        assertFalse(((TestTenantStore) context.store()).closed);
        assertEquals(2, provider.openCount(ALICE));
        assertSame(context, cache.get(ALICE).orElseThrow());
    }
}
