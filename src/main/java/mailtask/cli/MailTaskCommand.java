package mailtask.cli;

import mailtask.coordinator.agent.Agent;
import mailtask.coordinator.agent.MockAgent;
import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.config.Dependencies;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.model.TodoItem;
import mailtask.coordinator.service.TaskService;
import mailtask.coordinator.store.JsonFileTaskQueue;
import mailtask.coordinator.store.StorageException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "mailtask",
        mixinStandardHelpOptions = true,
        version = "mailtask 2.0.0",
        description = "Persistent mail task queue and scheduler",
        subcommands = {
                MailTaskCommand.StartCommand.class,
                MailTaskCommand.StatusCommand.class,
                MailTaskCommand.ListCommand.class,
                MailTaskCommand.EnqueueCommand.class,
                MailTaskCommand.ProcessCommand.class,
                MailTaskCommand.CleanupCommand.class,
                MailTaskCommand.TestAgentCommand.class
        }
)
public final class MailTaskCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"--queue"}, description = "Task queue file (overrides TASK_QUEUE_PATH)")
    Path queuePath;

    private final Map<String, String> env;

    public MailTaskCommand() {
        this(System.getenv());
    }

    MailTaskCommand(Map<String, String> env) {
        this.env = env;
    }

    @Override
    public void run() {
        out().println("Use subcommands: start | status | list | enqueue | process | cleanup | test-agent");
    }

    CoordinatorConfig config() {
        CoordinatorConfig config = CoordinatorConfig.fromEnv(env);
        if (queuePath != null) {
            config.withQueuePath(queuePath);
        }
        return config;
    }

    TaskService taskService(CoordinatorConfig config) {
        JsonFileTaskQueue queue = new JsonFileTaskQueue(config);
        queue.initialize();
        return new TaskService(queue, config);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /** Report an expected failure and return the exit code for it. */
    int fail(String what, Exception e) {
        err().println(what + ": " + e.getMessage());
        err().flush();
        return 1;
    }

    static String shortId(Task task) {
        return task.id().length() > 8 ? task.id().substring(0, 8) : task.id();
    }

    static void printResult(PrintWriter out, TaskResult result) {
        if (result == null) {
            return;
        }
        if (result.summary() != null) {
            out.println("Summary: " + result.summary());
        }
        List<TodoItem> todos = result.todos();
        if (todos != null && !todos.isEmpty()) {
            out.println("Todos:");
            for (TodoItem todo : todos) {
                out.println("  - " + todo.title() + " (" + (todo.priority() == null ? "medium" : todo.priority()) + ")");
            }
        }
        List<String> agentLogs = result.agentLogs();
        if (agentLogs != null && !agentLogs.isEmpty()) {
            out.println("Agent logs:");
            for (String line : agentLogs) {
                out.println("  " + line);
            }
        }
    }

    @Command(name = "start", description = "Run the scheduler and the status server until interrupted")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Option(names = {"--mock"}, description = "Use MockAgent")
        boolean mock;

        @Option(names = {"--no-scheduler"}, description = "Do not process tasks")
        boolean noScheduler;

        @Option(names = {"--no-server"}, description = "Do not start the HTTP status server")
        boolean noServer;

        @Override
        public Integer call() throws Exception {
            CoordinatorConfig config;
            Dependencies deps;
            try {
                config = parent.config();
                deps = Dependencies.create(config, Dependencies.createAgent(config, mock));
            } catch (IllegalArgumentException | StorageException e) {
                return parent.fail("Failed to start", e);
            }

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                deps.close();
                stopped.countDown();
            }, "mailtask-shutdown-hook"));

            try {
                if (!noScheduler) {
                    deps.startScheduler();
                }
                if (!noServer) {
                    deps.startServer();
                }
            } catch (IllegalStateException e) {
                deps.close();
                return parent.fail("Failed to start", e);
            }

            PrintWriter out = parent.out();
            out.println("mailtask running (agent: " + deps.agent().name()
                    + ", scheduler: " + (noScheduler ? "off" : "on")
                    + ", server: " + (noServer ? "off" : config.serverHost() + ":" + deps.server().boundPort()) + ")");
            out.println("Press Ctrl+C to stop");
            out.flush();

            stopped.await();
            return 0;
        }
    }

    @Command(name = "status", description = "Show task queue status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Override
        public Integer call() {
            TaskStats stats;
            try {
                stats = parent.taskService(parent.config()).stats();
            } catch (IllegalArgumentException | StorageException e) {
                return parent.fail("Failed to get status", e);
            }
            PrintWriter out = parent.out();
            out.println("Task Queue Status");
            out.println("  Total:      " + stats.total());
            out.println("  Pending:    " + stats.pending());
            out.println("  Processing: " + stats.processing());
            out.println("  Completed:  " + stats.completed());
            out.println("  Failed:     " + stats.failed());
            out.flush();
            return 0;
        }
    }

    @Command(name = "list", description = "List tasks")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Option(names = {"-s", "--status"}, description = "Filter by status (pending, processing, completed, failed)")
        String status;

        @Option(names = {"-l", "--limit"}, defaultValue = "10", description = "Limit results")
        int limit;

        @Override
        public Integer call() {
            List<Task> tasks;
            try {
                TaskStatus filter = status == null ? null : TaskStatus.fromString(status);
                tasks = parent.taskService(parent.config()).listTasks(filter, limit);
            } catch (IllegalArgumentException | StorageException e) {
                return parent.fail("Failed to list tasks", e);
            }

            PrintWriter out = parent.out();
            if (tasks.isEmpty()) {
                out.println("No tasks found");
                out.flush();
                return 0;
            }
            out.println("Task List (showing " + tasks.size() + " most recent)");
            for (Task task : tasks) {
                out.println(String.format("  %-12s %s %s", task.status().wireName(), shortId(task), task.subject()));
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Add a task manually")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Option(names = {"--subject"}, required = true, description = "Task subject")
        String subject;

        @Option(names = {"--from"}, required = true, description = "Sender address; receives the report")
        String from;

        @Option(names = {"--text"}, description = "Task body")
        String text;

        @Override
        public Integer call() {
            Task task;
            try {
                task = parent.taskService(parent.config()).enqueue(subject, from, text, null);
            } catch (IllegalArgumentException | StorageException e) {
                return parent.fail("Failed to enqueue task", e);
            }
            parent.out().println("Task created: " + task.id());
            parent.out().flush();
            return 0;
        }
    }

    @Command(name = "process", description = "Process one task now, outside the scheduler")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Parameters(index = "0", description = "Task id or unique id prefix")
        String taskId;

        @Option(names = {"--mock"}, description = "Use MockAgent")
        boolean mock;

        @Override
        public Integer call() {
            Task task;
            try {
                CoordinatorConfig config = parent.config();
                Agent agent = Dependencies.createAgent(config, mock);
                task = parent.taskService(config).processNow(taskId, agent);
            } catch (IllegalArgumentException | IllegalStateException | StorageException e) {
                return parent.fail("Task processing failed", e);
            }

            PrintWriter out = parent.out();
            out.println("Task " + shortId(task) + " is " + task.status().wireName());
            if (task.status() == TaskStatus.COMPLETED) {
                printResult(out, task.result());
                out.flush();
                return 0;
            }
            String lastError = task.error();
            if (lastError == null && !task.logs().isEmpty()) {
                lastError = task.logs().get(task.logs().size() - 1).message();
            }
            out.println("Error: " + lastError);
            out.flush();
            return 1;
        }
    }

    @Command(name = "cleanup", description = "Remove old completed and failed tasks")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Option(names = {"-d", "--days"}, defaultValue = "7", description = "Keep tasks from the last N days")
        int days;

        @Override
        public Integer call() {
            int removed;
            try {
                removed = parent.taskService(parent.config()).cleanup(days);
            } catch (IllegalArgumentException | StorageException e) {
                return parent.fail("Cleanup failed", e);
            }
            parent.out().println("Cleanup complete, removed " + removed + " old tasks");
            parent.out().flush();
            return 0;
        }
    }

    @Command(name = "test-agent", description = "Run a sample task through the agent")
    static final class TestAgentCommand implements Callable<Integer> {
        @ParentCommand
        MailTaskCommand parent;

        @Option(names = {"-m", "--message"}, defaultValue = "Please create a todo for completing project docs",
                description = "Test message")
        String message;

        @Option(names = {"--mock"}, description = "Use MockAgent")
        boolean mock;

        @Override
        public Integer call() {
            TaskResult result;
            Agent agent;
            try {
                CoordinatorConfig config = parent.config();
                agent = mock ? new MockAgent(Duration.ofMillis(500)) : Dependencies.createAgent(config, false);
                result = TaskService.testAgent(agent, message, config.taskTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return parent.fail("Agent test interrupted", e);
            } catch (Exception e) {
                return parent.fail("Agent test failed", e);
            }

            PrintWriter out = parent.out();
            out.println("Agent test completed (" + agent.name() + ")");
            printResult(out, result);
            out.flush();
            return 0;
        }
    }
}
