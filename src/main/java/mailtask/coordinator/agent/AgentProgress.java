package mailtask.coordinator.agent;

/**
 * Progress report from a running agent. Every field is optional.
 */
public record AgentProgress(Integer percentage, String step, String message) {

    public static AgentProgress of(int percentage, String step, String message) {
        return new AgentProgress(percentage, step, message);
    }

    /** One-line form used in task logs. */
    public String describe() {
        StringBuilder sb = new StringBuilder("Progress");
        if (percentage != null) {
            sb.append(' ').append(percentage).append('%');
        }
        if (step != null && !step.isBlank()) {
            sb.append(" [").append(step).append(']');
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
