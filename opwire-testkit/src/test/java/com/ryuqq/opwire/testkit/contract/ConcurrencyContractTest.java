package com.ryuqq.opwire.testkit.contract;

import com.ryuqq.opwire.adapter.inmemory.store.InMemoryTransaction;
import com.ryuqq.opwire.adapter.runner.WorkerPoolConfig;
import com.ryuqq.opwire.adapter.runner.WorkerPoolInvoker;
import com.ryuqq.opwire.application.binding.FaultSignal;
import com.ryuqq.opwire.application.binding.Reply;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.transaction.Transactions;
import com.ryuqq.opwire.middleware.TransactionMiddleware;
import com.ryuqq.opwire.testkit.recording.RecordingTransaction;
import com.ryuqq.opwire.testkit.sample.CreateEntityRequest;
import com.ryuqq.opwire.testkit.sample.Entity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: concurrent invocations.
 *
 * <p>Concurrent invocations of one wrapped operation each get their own unit of work;
 * uncommitted writes are invisible to the store and to other units of work.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractContractTest {

    private static final int REQUESTS = 50;

    @Test
    void testConcurrentCreates_DistinctNames_AllCommitted() throws Exception {
        // Given
        Operation<CreateEntityRequest, Entity> operation = transactional(createEntity());
        WorkerPoolConfig config = new WorkerPoolConfig().withConcurrency(8);

        // When
        List<Reply<Entity>> replies = new ArrayList<>();
        try (WorkerPoolInvoker<CreateEntityRequest, Entity> invoker =
                 new WorkerPoolInvoker<>(operation, idGenerator, timeSource, config)) {
            List<CompletableFuture<Reply<Entity>>> futures = new ArrayList<>();
            for (int i = 0; i < REQUESTS; i++) {
                futures.add(invoker.submit(CreateEntityRequest.named("name-" + i)));
            }
            for (CompletableFuture<Reply<Entity>> future : futures) {
                replies.add(future.get(10, TimeUnit.SECONDS));
            }
        }

        // Then
        Set<String> ids = new HashSet<>();
        for (Reply<Entity> reply : replies) {
            assertEquals(FaultSignal.OK, reply.getSignal(), "Unexpected reply: " + reply);
            ids.add(reply.getResponseOrNull().id());
        }
        assertEquals(REQUESTS, ids.size(), "Every invocation must get its own id");
        assertEntityCount(REQUESTS);
        assertEquals(REQUESTS, store.getCommitCount());
    }

    @Test
    void testConcurrentInvocations_EachGetsExclusiveHandle() throws Exception {
        // Given
        Set<RecordingTransaction> seen = Collections.synchronizedSet(new HashSet<>());
        Operation<String, String> operation = TransactionMiddleware.<String, String, RecordingTransaction>create(recordingProvider)
            .wrap((ctx, request) -> {
                seen.add(Transactions.require(ctx, recordingProvider));
                return Outcome.ok(request);
            });

        // When
        try (WorkerPoolInvoker<String, String> invoker = new WorkerPoolInvoker<>(
                operation, idGenerator, timeSource, new WorkerPoolConfig().withConcurrency(4))) {
            List<CompletableFuture<Reply<String>>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(invoker.submit("req-" + i));
            }
            for (CompletableFuture<Reply<String>> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        }

        // Then
        assertEquals(20, seen.size());
        assertEquals(20, recordingProvider.getBeginCount());
        assertEquals(20, recordingProvider.getCommitCount());
    }

    @Test
    void testUncommittedWrites_InvisibleOutsideTransaction() throws Exception {
        // Given
        CountDownLatch written = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Operation<String, String> operation = TransactionMiddleware.<String, String, InMemoryTransaction<Entity>>create(store)
            .wrap((ctx, request) -> {
                InMemoryTransaction<Entity> tx = Transactions.require(ctx, store);
                tx.put("entity:pending", new Entity("pending", request, timeSource.now()));
                written.countDown();
                try {
                    if (!release.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("release timed out");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return Outcome.ok(request);
            });

        // When
        try (WorkerPoolInvoker<String, String> invoker = new WorkerPoolInvoker<>(
                operation, idGenerator, timeSource, new WorkerPoolConfig().withConcurrency(2))) {
            CompletableFuture<Reply<String>> pending = invoker.submit("pending");
            assertTrue(written.await(10, TimeUnit.SECONDS));

            // Then: neither the store nor another unit of work sees the write
            assertFalse(store.containsKey("entity:pending"));
            InMemoryTransaction<Entity> other = store.begin();
            assertTrue(other.get("entity:pending").isEmpty());
            other.rollback();

            release.countDown();
            assertEquals(FaultSignal.OK, pending.get(10, TimeUnit.SECONDS).getSignal());
        }
        assertTrue(store.containsKey("entity:pending"));
    }
}
