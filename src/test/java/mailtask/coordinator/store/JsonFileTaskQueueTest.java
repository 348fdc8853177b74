package mailtask.coordinator.store;

import com.fasterxml.jackson.databind.JsonNode;
import mailtask.coordinator.TestSupport;
import mailtask.coordinator.model.LogLevel;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskLog;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.store.lock.LockFileMutex;
import mailtask.coordinator.util.Jsons;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static mailtask.coordinator.TestSupport.mail;
import static org.junit.jupiter.api.Assertions.*;

class JsonFileTaskQueueTest {

    @TempDir
    Path dir;

    private JsonFileTaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = TestSupport.newQueue(dir, 3);
    }

    @Test
    @DisplayName("add, pick, complete")
    void happyPath() {
        Task added = queue.addTask(mail("A"), "r@x.com");
        assertEquals(TaskStatus.PENDING, added.status());
        assertEquals(0, added.retries());
        assertEquals(3, added.maxRetries());
        assertEquals("r@x.com", added.reporterEmail());
        assertEquals("Task created", added.logs().get(0).message());

        Task picked = queue.pickTask().orElseThrow();
        assertEquals(added.id(), picked.id());
        assertEquals(TaskStatus.PROCESSING, picked.status());
        assertNotNull(picked.startedAt());

        assertTrue(queue.completeTask(picked.id(), TaskResult.summary("ok")));

        Task done = queue.getTask(added.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals("ok", done.result().summary());
        assertNotNull(done.completedAt());
        assertNull(done.error());
        assertEquals(List.of("Task created", "Task processing started", "Task processing completed"),
                done.logs().stream().map(TaskLog::message).toList());
    }

    @Test
    void claimTaskTakesOnlyTheNamedPendingTask() {
        Task first = queue.addTask(mail("first"), "r@x.com");
        Task second = queue.addTask(mail("second"), "r@x.com");

        Task claimed = queue.claimTask(second.id()).orElseThrow();
        assertEquals(TaskStatus.PROCESSING, claimed.status());
        assertEquals(TaskStatus.PENDING, queue.getTask(first.id()).orElseThrow().status());

        // Already processing, unknown
        assertTrue(queue.claimTask(second.id()).isEmpty());
        assertTrue(queue.claimTask("nope").isEmpty());
    }

    @Test
    void failWithoutRetriesLeftIsTerminal() {
        JsonFileTaskQueue single = TestSupport.newQueue(dir.resolve("single"), 1);
        Task task = single.addTask(mail("A"), "r@x.com");
        single.pickTask();

        Task failed = single.failTask(task.id(), "boom").orElseThrow();

        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.retries());
        assertEquals("boom", failed.error());
        assertNotNull(failed.completedAt());
    }

    @Test
    void failWithRetriesLeftReturnsToPending() {
        Task task = queue.addTask(mail("A"), "r@x.com");
        queue.pickTask();

        Task retried = queue.failTask(task.id(), "flaky").orElseThrow();

        assertEquals(TaskStatus.PENDING, retried.status());
        assertEquals(1, retried.retries());
        assertNull(retried.startedAt());
        assertNull(retried.error());
        List<String> messages = retried.logs().stream().map(TaskLog::message).toList();
        assertTrue(messages.contains("Task processing failed: flaky"));
        assertTrue(messages.contains("Task will retry (1/3)"));

        // Picked again on the next poll
        assertEquals(task.id(), queue.pickTask().orElseThrow().id());
    }

    @Test
    void exhaustingRetriesFailsWithLastError() {
        Task task = queue.addTask(mail("A"), "r@x.com");
        for (int i = 1; i <= 3; i++) {
            assertEquals(task.id(), queue.pickTask().orElseThrow().id());
            queue.failTask(task.id(), "error " + i);
        }

        Task failed = queue.getTask(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(3, failed.retries());
        assertEquals("error 3", failed.error());
        assertTrue(queue.pickTask().isEmpty());
    }

    @Test
    void pickIsFifoAndNeverReturnsProcessingTask() {
        Task first = queue.addTask(mail("first"), "r@x.com");
        Task second = queue.addTask(mail("second"), "r@x.com");

        assertEquals(first.id(), queue.pickTask().orElseThrow().id());
        assertEquals(second.id(), queue.pickTask().orElseThrow().id());
        assertTrue(queue.pickTask().isEmpty());
    }

    @Test
    void pickOnEmptyQueueReturnsEmpty() {
        assertEquals(Optional.empty(), queue.pickTask());
    }

    @Test
    @DisplayName("unknown ids are no-ops that leave the file untouched")
    void unknownIdIsNoOp() throws Exception {
        queue.addTask(mail("A"), "r@x.com");
        byte[] before = Files.readAllBytes(queue.filePath());

        assertFalse(queue.completeTask("missing", TaskResult.summary("x")));
        assertTrue(queue.failTask("missing", "x").isEmpty());
        assertFalse(queue.addTaskLog("missing", LogLevel.INFO, "x"));
        assertTrue(queue.getTask("missing").isEmpty());
        queue.getAllTasks();
        queue.getStats();

        assertArrayEquals(before, Files.readAllBytes(queue.filePath()));
    }

    @Test
    void idsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(queue.addTask(mail("T" + i), "r@x.com").id());
        }
        assertEquals(50, ids.size());
    }

    @Test
    void addTaskLogAppendsEntryWithData() {
        Task task = queue.addTask(mail("A"), "r@x.com");
        JsonNode data = Jsons.mapper().createObjectNode().put("step", "analyze");

        assertTrue(queue.addTaskLog(task.id(), LogLevel.DEBUG, "Progress", data));

        Task updated = queue.getTask(task.id()).orElseThrow();
        TaskLog last = updated.logs().get(updated.logs().size() - 1);
        assertEquals(LogLevel.DEBUG, last.level());
        assertEquals("Progress", last.message());
        assertEquals("analyze", last.data().get("step").asText());
        assertFalse(updated.updatedAt().isBefore(task.updatedAt()));
    }

    @Test
    void stateSurvivesReload() {
        Task a = queue.addTask(mail("A"), "r@x.com");
        queue.addTask(mail("B"), "r@x.com");
        queue.pickTask();
        queue.completeTask(a.id(), TaskResult.summary("done"));

        JsonFileTaskQueue reopened = TestSupport.newQueue(dir, 3);

        assertEquals(2, reopened.getAllTasks().size());
        Task reloaded = reopened.getTask(a.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, reloaded.status());
        assertEquals("done", reloaded.result().summary());
        assertEquals("A", reloaded.subject());
        assertEquals(a.createdAt(), reloaded.createdAt());
    }

    @Test
    void storeFileFormat() throws Exception {
        Task task = queue.addTask(mail("A"), "r@x.com");

        JsonNode root = Jsons.mapper().readTree(queue.filePath().toFile());

        assertTrue(root.has("lastUpdated"));
        assertEquals(1, root.get("tasks").size());
        JsonNode stored = root.get("tasks").get(0);
        assertEquals(task.id(), stored.get("id").asText());
        assertEquals("pending", stored.get("status").asText());
        assertEquals("A", stored.get("prompt").get("subject").asText());
        assertEquals("info", stored.get("logs").get(0).get("level").asText());
        assertTrue(stored.has("startedAt"));
        assertTrue(stored.get("startedAt").isNull());
    }

    @Test
    void stats() {
        Task a = queue.addTask(mail("A"), "r@x.com");
        queue.addTask(mail("B"), "r@x.com");
        queue.addTask(mail("C"), "r@x.com");
        queue.pickTask();
        queue.completeTask(a.id(), TaskResult.summary("ok"));
        queue.pickTask();

        assertEquals(new TaskStats(3, 1, 1, 1, 0), queue.getStats());
        assertEquals(1, queue.getTasksByStatus(TaskStatus.PENDING).size());
    }

    @Test
    @DisplayName("cleanup(0) removes exactly the terminal tasks")
    void cleanupZeroRemovesTerminalTasksOnly() {
        Task done = queue.addTask(mail("done"), "r@x.com");
        Task waiting = queue.addTask(mail("waiting"), "r@x.com");
        queue.pickTask();
        queue.completeTask(done.id(), TaskResult.summary("ok"));

        assertEquals(1, queue.cleanup(Duration.ZERO));

        List<Task> remaining = queue.getAllTasks();
        assertEquals(1, remaining.size());
        assertEquals(waiting.id(), remaining.get(0).id());
    }

    @Test
    void cleanupKeepsRecentlyFinishedTasks() {
        Instant t0 = Instant.parse("2024-03-01T10:00:00Z");
        Path file = dir.resolve("aged.json");
        JsonFileTaskQueue early = new JsonFileTaskQueue(file, 3, new LockFileMutex(TestSupport.fastLock()),
                Clock.fixed(t0, ZoneOffset.UTC));
        Task task = early.addTask(mail("old"), "r@x.com");
        early.pickTask();
        early.completeTask(task.id(), TaskResult.summary("ok"));

        JsonFileTaskQueue halfHourLater = new JsonFileTaskQueue(file, 3, new LockFileMutex(TestSupport.fastLock()),
                Clock.fixed(t0.plus(Duration.ofMinutes(30)), ZoneOffset.UTC));
        assertEquals(0, halfHourLater.cleanup(Duration.ofHours(1)));

        JsonFileTaskQueue twoHoursLater = new JsonFileTaskQueue(file, 3, new LockFileMutex(TestSupport.fastLock()),
                Clock.fixed(t0.plus(Duration.ofHours(2)), ZoneOffset.UTC));
        assertEquals(1, twoHoursLater.cleanup(Duration.ofHours(1)));
        assertTrue(twoHoursLater.getAllTasks().isEmpty());
    }

    @Test
    void cleanupRejectsNegativeAge() {
        assertThrows(IllegalArgumentException.class, () -> queue.cleanup(Duration.ofDays(-1)));
    }

    @Test
    void initializeCreatesParentDirectories() {
        Path nested = dir.resolve("a").resolve("b").resolve("tasks.json");
        JsonFileTaskQueue q = new JsonFileTaskQueue(nested, 3, new LockFileMutex(TestSupport.fastLock()));

        q.initialize();
        q.initialize();

        assertTrue(Files.exists(nested));
        assertTrue(q.getAllTasks().isEmpty());
    }

    @Test
    void unusableLocationFailsWithStorageException() throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        JsonFileTaskQueue q = new JsonFileTaskQueue(blocker.resolve("tasks.json"), 3,
                new LockFileMutex(TestSupport.fastLock()));

        assertThrows(StorageException.class, q::initialize);
    }

    @Test
    @DisplayName("concurrent producers on two queue instances lose no task")
    void concurrentAddsFromTwoInstances() throws Exception {
        JsonFileTaskQueue other = TestSupport.newQueue(dir, 3);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<Task>> futures = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            JsonFileTaskQueue target = i % 2 == 0 ? queue : other;
            int n = i;
            futures.add(pool.submit(() -> target.addTask(mail("T" + n), "r@x.com")));
        }
        for (Future<Task> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(30, queue.getAllTasks().size());
        assertEquals(30, queue.getAllTasks().stream().map(Task::id).distinct().count());
    }

    @Test
    @DisplayName("concurrent pickers never pick the same task twice")
    void concurrentPicksAreExclusive() throws Exception {
        for (int i = 0; i < 20; i++) {
            queue.addTask(mail("T" + i), "r@x.com");
        }
        JsonFileTaskQueue other = TestSupport.newQueue(dir, 3);
        ConcurrentLinkedQueue<String> picked = new ConcurrentLinkedQueue<>();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            JsonFileTaskQueue target = w % 2 == 0 ? queue : other;
            futures.add(pool.submit(() -> {
                Optional<Task> next;
                while ((next = target.pickTask()).isPresent()) {
                    picked.add(next.get().id());
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(20, picked.size());
        assertEquals(20, new HashSet<>(picked).size());
        assertEquals(20, queue.getStats().processing());
    }
}
