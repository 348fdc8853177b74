package mailtask.coordinator.agent;

import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MockAgentTest {

    private static Task task(String subject) {
        Instant now = Instant.now();
        return Task.builder()
                .id("task-1")
                .status(TaskStatus.PROCESSING)
                .prompt(EmailContent.of(subject, "r@x.com", "hello"))
                .maxRetries(3)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void returnsCannedResult() throws Exception {
        MockAgent agent = new MockAgent(Duration.ZERO);
        List<AgentProgress> progress = new ArrayList<>();

        TaskResult result = agent.processTask(task("Report"),
                new ProcessOptions(CancellationToken.none(), null, progress::add));

        assertEquals("MockAgent", agent.name());
        assertTrue(agent.isReady());
        assertEquals("Processed email: Report", result.summary());
        assertEquals(1, result.todos().size());
        assertEquals("Process: Report", result.todos().get(0).title());
        assertEquals("Mock Agent processed task task-1", result.response());
        assertEquals(4, result.agentLogs().size());
        assertEquals(2, progress.size());
        assertEquals(100, progress.get(1).percentage().intValue());
    }

    @Test
    void forcedFailureThrows() {
        MockAgent agent = new MockAgent(Duration.ZERO, true, 0.0);

        Exception e = assertThrows(IllegalStateException.class,
                () -> agent.processTask(task("x"), ProcessOptions.unbounded()));
        assertEquals("Simulated processing failure", e.getMessage());
    }

    @Test
    void cancelledTokenStopsTheWait() {
        MockAgent agent = new MockAgent(Duration.ofMinutes(5));
        CancellationToken token = CancellationToken.none();
        token.cancel("shutdown");

        long start = System.nanoTime();
        assertThrows(TaskCancelledException.class,
                () -> agent.processTask(task("x"), ProcessOptions.of(token, Duration.ofMinutes(5))));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new MockAgent(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> new MockAgent(Duration.ZERO, false, 1.5));
    }

    @Test
    void progressDescription() {
        assertEquals("Progress 50% [analyze]: reading", AgentProgress.of(50, "analyze", "reading").describe());
        assertEquals("Progress", new AgentProgress(null, null, null).describe());
    }
}
