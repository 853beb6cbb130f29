package io.github.byzatic.cronengine.schedulers;

/**
 * Receives due jobs. Called on the scheduler's execution queue, never on the timer thread.
 */
@FunctionalInterface
public interface JobTickHandler {
    void onTick(CronJob job);
}
