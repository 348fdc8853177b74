package mailtask.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mailtask.coordinator.api.Controller;
import mailtask.coordinator.api.v1.dto.HealthResponse;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.scheduler.Scheduler;
import mailtask.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    public static final String VERSION = "2.0.0";

    private final TaskService taskService;
    private final Scheduler scheduler;

    /**
     * @param scheduler may be null when the process runs without a scheduler
     */
    public HealthController(TaskService taskService, Scheduler scheduler) {
        this.taskService = taskService;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        TaskStats stats;
        try {
            stats = taskService.stats();
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }

        HealthResponse response = HealthResponse.healthy(
                formatUptime(), VERSION, stats, scheduler == null ? null : scheduler.getStatus());
        return ControllerResponse.json(HttpResponseStatus.OK, response);
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
