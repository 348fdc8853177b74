package mailtask.coordinator.report;

import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a one-line report per finished task to the log.
 */
public class LoggingTaskReporter implements TaskReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskReporter.class);

    @Override
    public void sendTaskReport(Task task) {
        String to = task.reporterEmail() == null ? "-" : task.reporterEmail();
        if (task.status() == TaskStatus.COMPLETED) {
            String summary = task.result() == null || task.result().summary() == null
                    ? ""
                    : task.result().summary();
            log.info("Report for {} to {}: completed \"{}\" {}", task.id(), to, task.subject(), summary);
        } else {
            log.warn("Report for {} to {}: {} \"{}\" after {} attempt(s): {}",
                    task.id(), to, task.status().wireName(), task.subject(), task.retries(), task.error());
        }
    }
}
