package quest.gekko.insight.service.sync;

/** Called synchronously at every stage boundary. */
@FunctionalInterface
public interface SyncProgressListener {

    void onProgress(SyncProgress progress);
}
