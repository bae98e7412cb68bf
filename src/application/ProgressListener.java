package application;

/**
 * Receives textual progress notifications from a running search.
 *
 * <p>The orchestrator calls {@link #onProgress(String)} synchronously before
 * each integer count is searched ("Searching 3 numbers..."). Notifications are
 * fire-and-forget: nothing a listener does changes the course of the search.
 *
 * <p>A configuration without a listener uses {@link #NONE}, so the orchestrator
 * never has to check for {@code null}.
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every notification. */
    ProgressListener NONE = message -> { };

    /**
     * Called with a human-readable description of the step about to run.
     *
     * @param message progress text
     */
    void onProgress(String message);
}
