package lineup.queue.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every lifecycle notification to the log.
 */
public class LoggingJobEventListener implements JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobEventListener.class);

    @Override
    public void onJobStarted(String jobId) {
        log.info("Job {} started", jobId);
    }

    @Override
    public void onJobProgress(String jobId, int current, int total) {
        log.debug("Job {} progress {}/{}", jobId, current, total);
    }

    @Override
    public void onJobCompleted(String jobId, String output) {
        log.info("Job {} completed{}", jobId, output != null ? " with output (" + output.length() + " chars)" : "");
    }

    @Override
    public void onJobFailed(String jobId, String error) {
        log.warn("Job {} failed: {}", jobId, error);
    }

    @Override
    public void onJobCancelled(String jobId) {
        log.info("Job {} cancelled", jobId);
    }
}
