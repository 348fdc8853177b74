package mailtask.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import mailtask.coordinator.api.Controller;
import mailtask.coordinator.api.v1.dto.CreateTaskRequest;
import mailtask.coordinator.api.v1.dto.TaskResponse;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.service.TaskService;
import mailtask.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the task queue (public API).
 *
 * GET /api/v1/tasks?status=&limit= - Recent tasks
 * GET /api/v1/tasks/{taskId} - One task with its logs
 * POST /api/v1/tasks - Enqueue a task manually
 * POST /api/v1/tasks/cleanup?days= - Remove old finished tasks
 * GET /api/v1/stats - Queue counts
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CLEANUP_PATTERN = Pattern.compile("^/api/v1/tasks/cleanup$");
    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/stats$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || CLEANUP_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || TASK_BY_ID_PATTERN.matcher(path).matches()
                    || STATS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            QueryStringDecoder query = new QueryStringDecoder(req.uri());

            if (req.method().equals(HttpMethod.POST)) {
                if (CLEANUP_PATTERN.matcher(path).matches()) {
                    return handleCleanup(query);
                }
                return handleCreate(req);
            }

            if (STATS_PATTERN.matcher(path).matches()) {
                return ControllerResponse.json(HttpResponseStatus.OK, taskService.stats());
            }
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(query);
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error: " + e.getMessage());
        }
    }

    /**
     * POST /api/v1/tasks - Enqueue a task
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CreateTaskRequest request;
        try {
            request = Jsons.mapper().readValue(body, CreateTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        request.validate();

        Task task = taskService.enqueue(request.subject(), request.from(), request.text(), request.html());
        return ControllerResponse.json(HttpResponseStatus.CREATED, TaskResponse.from(task));
    }

    /**
     * GET /api/v1/tasks - Recent tasks
     */
    private ControllerResponse handleList(QueryStringDecoder query) {
        String statusParam = param(query, "status");
        TaskStatus status = statusParam == null ? null : TaskStatus.fromString(statusParam);
        int limit = intParam(query, "limit", TaskService.DEFAULT_LIST_LIMIT);

        List<TaskResponse> tasks = taskService.listTasks(status, limit).stream()
                .map(TaskResponse::from)
                .toList();

        return ControllerResponse.json(HttpResponseStatus.OK, Map.of(
                "count", tasks.size(),
                "tasks", tasks));
    }

    /**
     * GET /api/v1/tasks/{taskId} - One task
     */
    private ControllerResponse handleGetTask(String taskId) {
        Optional<Task> task = taskService.findTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(HttpResponseStatus.OK, TaskResponse.from(task.get(), true));
    }

    /**
     * POST /api/v1/tasks/cleanup - Remove old finished tasks
     */
    private ControllerResponse handleCleanup(QueryStringDecoder query) {
        int days = intParam(query, "days", TaskService.DEFAULT_CLEANUP_DAYS);
        int removed = taskService.cleanup(days);
        return ControllerResponse.json(HttpResponseStatus.OK, Map.of(
                "removed", removed,
                "days", days));
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    private static int intParam(QueryStringDecoder query, String name, int fallback) {
        String value = param(query, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }
}
