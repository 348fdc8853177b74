package mailtask.coordinator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.store.model.TaskDocument;
import mailtask.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Agent backed by an external command.
 *
 * <p>The task is written to the process's stdin as JSON. Stdout is read as a
 * {@link TaskResult} JSON object; any other output becomes the result's response text.
 * A non-zero exit fails the attempt. Cancelling the token kills the process.
 */
public final class ScriptAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(ScriptAgent.class);

    private static final int MAX_ERROR_CHARS = 512;
    private static final int MAX_SUMMARY_CHARS = 200;

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "mailtask-script-io");
        t.setDaemon(true);
        return t;
    });

    private final String name;
    private final List<String> command;

    public ScriptAgent(String name, List<String> command) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script agent name cannot be empty");
        }
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
    }

    /**
     * Build from a whitespace separated command line such as {@code python3 agent.py}.
     */
    public static ScriptAgent fromCommandLine(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("script agent command cannot be empty");
        }
        List<String> parts = Arrays.asList(commandLine.trim().split("\\s+"));
        return new ScriptAgent("ScriptAgent(" + parts.get(0) + ")", parts);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public TaskResult processTask(Task task, ProcessOptions options) throws Exception {
        CancellationToken token = options.token();
        token.throwIfCancelled();

        Process process;
        try {
            process = new ProcessBuilder(new ArrayList<>(command)).start();
        } catch (IOException e) {
            throw new IllegalStateException("Script spawn failed: " + e.getMessage(), e);
        }
        token.onCancel(process::destroyForcibly);
        log.debug("Started {} for task {} (pid {})", command, task.id(), process.pid());

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());

        try {
            writeInput(process, Jsons.toJson(TaskDocument.from(task)));

            Duration timeout = options.timeout();
            boolean finished;
            if (timeout == null) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new TimeoutException("Script timeout after " + timeout);
            }
            token.throwIfCancelled();

            String out = join(stdout);
            if (process.exitValue() != 0) {
                String err = join(stderr);
                throw new IllegalStateException("Script exit=" + process.exitValue()
                        + " output=" + truncate(err.isBlank() ? out : err, MAX_ERROR_CHARS));
            }
            return parseResult(out);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    /**
     * Interpret script output: a JSON object is a TaskResult, anything else is plain text.
     */
    static TaskResult parseResult(String output) {
        String trimmed = output == null ? "" : output.strip();
        if (trimmed.isEmpty()) {
            return TaskResult.summary("Script finished without output");
        }
        if (trimmed.startsWith("{")) {
            try {
                return Jsons.mapper().readValue(trimmed, TaskResult.class);
            } catch (JsonProcessingException e) {
                log.debug("Script output is not a TaskResult, using it as text: {}", e.getOriginalMessage());
            }
        }
        String firstLine = trimmed.lines().findFirst().orElse(trimmed);
        return new TaskResult(null, null, truncate(firstLine, MAX_SUMMARY_CHARS), null, trimmed, null);
    }

    private static void writeInput(Process process, String input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            // The script may exit without reading its input
            log.debug("Could not write task to script stdin: {}", e.getMessage());
        }
    }

    private static CompletableFuture<String> readAsync(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }

    private static String join(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Failed to read script output: {}", e.getMessage());
            return "";
        }
    }

    private static String truncate(String raw, int max) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= max) {
            return normalized;
        }
        return normalized.substring(0, max) + "...";
    }
}
