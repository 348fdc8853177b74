package mailtask.coordinator.agent;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {
    };

    void onProgress(AgentProgress progress);
}
