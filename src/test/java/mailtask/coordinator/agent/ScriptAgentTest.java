package mailtask.coordinator.agent;

import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ScriptAgentTest {

    private static Task task() {
        Instant now = Instant.now();
        return Task.builder()
                .id("abc-123")
                .status(TaskStatus.PROCESSING)
                .prompt(EmailContent.of("Quarterly report", "boss@x.com", "numbers please"))
                .maxRetries(3)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static ScriptAgent sh(String script) {
        return new ScriptAgent("test-script", List.of("sh", "-c", script));
    }

    @Test
    void parsesJsonResult() {
        TaskResult result = ScriptAgent.parseResult(
                "{\"summary\":\"done\",\"todos\":[{\"id\":\"1\",\"title\":\"Reply\",\"status\":\"pending\"}]}");

        assertEquals("done", result.summary());
        assertEquals("Reply", result.todos().get(0).title());
    }

    @Test
    void plainTextBecomesResponse() {
        TaskResult result = ScriptAgent.parseResult("First line\nsecond line\n");

        assertEquals("First line", result.summary());
        assertEquals("First line\nsecond line", result.response());
    }

    @Test
    void emptyOutputStillCompletes() {
        assertEquals("Script finished without output", ScriptAgent.parseResult("  ").summary());
    }

    @Test
    void invalidJsonFallsBackToText() {
        TaskResult result = ScriptAgent.parseResult("{not json");
        assertEquals("{not json", result.response());
    }

    @Test
    void commandLineIsSplitOnWhitespace() {
        ScriptAgent agent = ScriptAgent.fromCommandLine("  python3   agent.py --fast ");

        assertEquals(List.of("python3", "agent.py", "--fast"), agent.command());
        assertEquals("ScriptAgent(python3)", agent.name());
        assertThrows(IllegalArgumentException.class, () -> ScriptAgent.fromCommandLine(" "));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void scriptReceivesTaskOnStdin() throws Exception {
        // Echo the subject found in the JSON document back as the summary
        ScriptAgent agent = sh("input=$(cat); case \"$input\" in *'Quarterly report'*) "
                + "echo '{\"summary\":\"saw subject\"}';; *) echo 'missing';; esac");

        TaskResult result = agent.processTask(task(), ProcessOptions.of(CancellationToken.none(), Duration.ofSeconds(30)));

        assertEquals("saw subject", result.summary());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFails() {
        ScriptAgent agent = sh("cat > /dev/null; echo 'boom' >&2; exit 3");

        Exception e = assertThrows(IllegalStateException.class,
                () -> agent.processTask(task(), ProcessOptions.of(CancellationToken.none(), Duration.ofSeconds(30))));
        assertTrue(e.getMessage().contains("exit=3"), e.getMessage());
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void slowScriptTimesOut() {
        ScriptAgent agent = sh("sleep 30");

        assertThrows(TimeoutException.class,
                () -> agent.processTask(task(), ProcessOptions.of(CancellationToken.none(), Duration.ofMillis(200))));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancellationKillsScript() throws Exception {
        ScriptAgent agent = sh("sleep 30");
        CancellationToken token = CancellationToken.none();

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            token.cancel("shutdown");
        });
        canceller.start();

        long start = System.nanoTime();
        assertThrows(TaskCancelledException.class,
                () -> agent.processTask(task(), ProcessOptions.of(token, Duration.ofSeconds(20))));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        canceller.join();
    }
}
