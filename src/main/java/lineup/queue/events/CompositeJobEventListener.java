package lineup.queue.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans notifications out to any number of listeners. A listener that throws
 * is logged and skipped; the others still receive the event.
 */
public final class CompositeJobEventListener implements JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeJobEventListener.class);

    private final CopyOnWriteArrayList<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    public CompositeJobEventListener() {
    }

    public CompositeJobEventListener(List<? extends JobEventListener> initial) {
        initial.forEach(this::add);
    }

    public CompositeJobEventListener add(JobEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onJobStarted(String jobId) {
        fire("job-started", jobId, l -> l.onJobStarted(jobId));
    }

    @Override
    public void onJobProgress(String jobId, int current, int total) {
        fire("job-progress", jobId, l -> l.onJobProgress(jobId, current, total));
    }

    @Override
    public void onJobCompleted(String jobId, String output) {
        fire("job-completed", jobId, l -> l.onJobCompleted(jobId, output));
    }

    @Override
    public void onJobFailed(String jobId, String error) {
        fire("job-failed", jobId, l -> l.onJobFailed(jobId, error));
    }

    @Override
    public void onJobCancelled(String jobId) {
        fire("job-cancelled", jobId, l -> l.onJobCancelled(jobId));
    }

    private void fire(String event, String jobId, Consumer<JobEventListener> call) {
        for (JobEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for job {}", listener.getClass().getSimpleName(), event, jobId, e);
            }
        }
    }
}
