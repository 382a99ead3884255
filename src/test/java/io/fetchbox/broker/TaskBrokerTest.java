package io.fetchbox.broker;

import io.fetchbox.config.FetchBoxConfig;
import io.fetchbox.config.FetchBoxSettings;
import io.fetchbox.model.QueueStatus;
import io.fetchbox.model.Task;
import io.fetchbox.proxy.ProxyResolver;
import io.fetchbox.retry.BackoffEngine;
import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.TaskFailure;
import io.fetchbox.storage.Database;
import io.fetchbox.storage.DeadLetterStore;
import io.fetchbox.storage.DurableQueue;
import io.fetchbox.worker.DownloadResponse;
import io.fetchbox.worker.Downloader;
import io.fetchbox.worker.Ledger;
import io.fetchbox.worker.ObjectStorage;
import io.fetchbox.worker.PipelineOutcome;
import io.fetchbox.worker.TaskPipeline;
import io.fetchbox.worker.TokenBucketRateLimiter;
import io.fetchbox.worker.UploadedRef;
import io.fetchbox.worker.Worker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

final class TaskBrokerTest {

    @Test
    void stopsLeasingWhenEveryInboxIsFull() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-backpressure-");
        try {
            DurableQueue queue = queue(root);
            TaskPipeline pipeline = pipeline(queue, new ConcurrentHashMap<>());
            TaskBroker broker = new TaskBroker(queue, workers(2, 1, pipeline, null), () -> 1_000L, 10L, 1_000L);
            List<Long> sequences = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                sequences.add(broker.enqueue(Task.of("r" + i, "job", "http://example.test/" + i)));
            }

            TaskBroker.DispatchOutcome first = broker.dispatchOnce(1_000L);
            Assertions.assertEquals(2, first.dispatched());
            Assertions.assertTrue(first.backpressured());
            Assertions.assertEquals(2, queue.stats().byStatus().get(QueueStatus.LEASED.name()));
            Assertions.assertEquals(3, queue.stats().byStatus().get(QueueStatus.PENDING.name()));
            Assertions.assertEquals("worker-0", queue.get(sequences.get(0)).orElseThrow().leaseOwner());
            Assertions.assertEquals("worker-1", queue.get(sequences.get(1)).orElseThrow().leaseOwner());

            TaskBroker.DispatchOutcome second = broker.dispatchOnce(1_000L);
            Assertions.assertEquals(0, second.dispatched());
            Assertions.assertTrue(second.backpressured());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shutdownReleasesEntriesThatNeverStarted() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-shutdown-");
        try {
            DurableQueue queue = queue(root);
            TaskPipeline pipeline = pipeline(queue, new ConcurrentHashMap<>());
            TaskBroker broker = new TaskBroker(queue, workers(2, 2, pipeline, null), () -> 1_000L, 10L, 1_000L);
            long firstSequence = broker.enqueue(Task.of("r0", "job", "http://example.test/0"));
            broker.enqueue(Task.of("r1", "job", "http://example.test/1"));
            broker.enqueue(Task.of("r2", "job", "http://example.test/2"));
            Assertions.assertEquals(3, broker.dispatchOnce(1_000L).dispatched());

            TaskBroker.ShutdownOutcome out = broker.shutdown(100L);

            Assertions.assertEquals(3, out.released());
            Assertions.assertTrue(out.abandonedWorkers().isEmpty());
            Assertions.assertEquals(3, queue.stats().byStatus().get(QueueStatus.PENDING.name()));
            Assertions.assertEquals(0, queue.get(firstSequence).orElseThrow().attemptCount());
            Assertions.assertFalse(broker.leasing());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void startedBrokerProcessesEnqueuedTasks() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-run-");
        try {
            DurableQueue queue = queue(root);
            Map<String, byte[]> stored = new ConcurrentHashMap<>();
            CountDownLatch done = new CountDownLatch(6);
            List<PipelineOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
            Consumer<PipelineOutcome> listener = outcome -> {
                outcomes.add(outcome);
                done.countDown();
            };
            TaskBroker broker = new TaskBroker(queue, workers(3, 2, pipeline(queue, stored), listener),
                    System::currentTimeMillis, 10L, 1_000L);
            broker.start();
            try {
                for (int i = 0; i < 6; i++) {
                    broker.enqueue(Task.of("r" + i, "job", "http://example.test/" + i));
                }
                Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                broker.shutdown(2_000L);
            }

            Assertions.assertEquals(6, stored.size());
            Assertions.assertEquals(6, queue.stats().byStatus().get(QueueStatus.COMPLETED.name()));
            Assertions.assertTrue(outcomes.stream().allMatch(o -> o.disposition() == PipelineOutcome.Disposition.COMPLETED));
            Assertions.assertEquals(6L, broker.workers().stream().mapToLong(Worker::processed).sum());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void drainVisibleRunsOnCallingThread() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-drain-");
        try {
            DurableQueue queue = queue(root);
            Map<String, byte[]> stored = new ConcurrentHashMap<>();
            TaskBroker broker = new TaskBroker(queue, workers(2, 1, pipeline(queue, stored), null), () -> 1_000L, 10L, 1_000L);
            for (int i = 0; i < 4; i++) {
                broker.enqueue(Task.of("r" + i, "job", "http://example.test/" + i));
            }

            List<PipelineOutcome> first = broker.drainVisible(3);
            Assertions.assertEquals(3, first.size());
            List<PipelineOutcome> rest = broker.drainVisible(10);
            Assertions.assertEquals(1, rest.size());
            Assertions.assertEquals(4, stored.size());
            Assertions.assertTrue(broker.drainVisible(10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void slowTaskKeepsItsLeaseWhileRunning() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-renew-");
        try {
            DurableQueue queue = queue(root, 300L);
            Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
            Map<String, AtomicInteger> running = new ConcurrentHashMap<>();
            AtomicInteger maxConcurrent = new AtomicInteger();
            Downloader slow = (url, headers, endpoint) -> {
                fetches.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
                int now = running.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
                maxConcurrent.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(1_500L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION, "interrupted");
                } finally {
                    running.get(url).decrementAndGet();
                }
                byte[] body = url.getBytes(StandardCharsets.UTF_8);
                return new DownloadResponse(200, new ByteArrayInputStream(body), body.length, "text/plain");
            };
            Map<String, byte[]> stored = new ConcurrentHashMap<>();
            CountDownLatch done = new CountDownLatch(2);
            List<PipelineOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
            Consumer<PipelineOutcome> listener = outcome -> {
                outcomes.add(outcome);
                done.countDown();
            };
            TaskBroker broker = new TaskBroker(queue, workers(2, 1, pipeline(queue, stored, slow), listener),
                    System::currentTimeMillis, 10L, 50L);
            broker.start();
            try {
                broker.enqueue(Task.of("r0", "job", "http://example.test/0"));
                broker.enqueue(Task.of("r1", "job", "http://example.test/1"));
                Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                broker.shutdown(3_000L);
            }

            Assertions.assertEquals(1, fetches.get("http://example.test/0").get());
            Assertions.assertEquals(1, fetches.get("http://example.test/1").get());
            Assertions.assertEquals(1, maxConcurrent.get());
            Assertions.assertEquals(2, outcomes.size());
            Assertions.assertTrue(outcomes.stream().allMatch(o -> o.disposition() == PipelineOutcome.Disposition.COMPLETED));
            Assertions.assertEquals(2, queue.stats().byStatus().get(QueueStatus.COMPLETED.name()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void renewHeldLeasesExtendsInboxEntries() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-renew-inbox-");
        try {
            DurableQueue queue = queue(root, 1_000L);
            TaskPipeline pipeline = pipeline(queue, new ConcurrentHashMap<>());
            TaskBroker broker = new TaskBroker(queue, workers(2, 1, pipeline, null), () -> 0L, 10L, 1_000L);
            long first = broker.enqueue(Task.of("r0", "job", "http://example.test/0"));
            broker.enqueue(Task.of("r1", "job", "http://example.test/1"));
            Assertions.assertEquals(2, broker.dispatchOnce(0L).dispatched());

            Assertions.assertEquals(2, broker.renewHeldLeases(800L));
            Assertions.assertEquals(1_800L, queue.get(first).orElseThrow().leaseExpiresAtMs());
            Assertions.assertEquals(0, queue.recoverExpiredLeases(1_500L));

            Assertions.assertEquals(2, queue.recoverExpiredLeases(2_000L));
            Assertions.assertEquals(0, broker.renewHeldLeases(2_001L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void requiresAtLeastOneWorker() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-broker-empty-");
        try {
            DurableQueue queue = queue(root);
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> new TaskBroker(queue, List.of(), () -> 0L, 10L, 1_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    private static DurableQueue queue(Path root) {
        return queue(root, 60_000L);
    }

    private static DurableQueue queue(Path root, long leaseTtlMs) {
        Database db = new Database(FetchBoxConfig.fromRoot(root.toString()));
        db.init();
        return new DurableQueue(db, new DeadLetterStore(db), 100, leaseTtlMs);
    }

    private static TaskPipeline pipeline(DurableQueue queue, Map<String, byte[]> stored) {
        Downloader downloader = (url, headers, endpoint) -> {
            byte[] body = url.getBytes(StandardCharsets.UTF_8);
            return new DownloadResponse(200, new ByteArrayInputStream(body), body.length, "text/plain");
        };
        return pipeline(queue, stored, downloader);
    }

    private static TaskPipeline pipeline(DurableQueue queue, Map<String, byte[]> stored, Downloader downloader) {
        ObjectStorage storage = (body, destination, metadata) -> {
            byte[] bytes;
            try {
                bytes = body.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            stored.put(destination.key(), bytes);
            return new UploadedRef(destination.bucket(), destination.key(), bytes.length, "mem://" + destination.key());
        };
        Ledger ledger = new Ledger() {
            @Override
            public void onTaskCompleted(String jobId, String resourceId) {
            }

            @Override
            public void onTaskFailed(String jobId, String resourceId, String failureCode, String failureMessage) {
            }
        };
        FetchBoxSettings settings = FetchBoxSettings.defaults();
        return new TaskPipeline(queue, new ProxyResolver(Map.of()), downloader, storage, ledger,
                new BackoffEngine(), () -> settings, System::currentTimeMillis);
    }

    private static List<Worker> workers(int count, int inboxCapacity, TaskPipeline pipeline, Consumer<PipelineOutcome> listener) {
        List<Worker> workers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            workers.add(new Worker("worker-" + i, inboxCapacity, new TokenBucketRateLimiter(0.0d), pipeline, 10L, listener));
        }
        return workers;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
