package au.djac.midiset;
import au.djac.midiset.archive.Archive;

/**
 * Observes the progress of an extraction run. All methods have empty defaults.
 *
 * <p>{@code archiveStarted} may be called concurrently from several worker threads. The other
 * methods are called only from the thread that called {@link MidiSet#extract}.
 */
public interface ProgressListener
{
    /**
     * @param totalArchives   Every archive found, including those already skipped.
     * @param alreadyFinished Archives found but skipped as unreadable before extraction began.
     */
    default void runStarted(int totalArchives, int alreadyFinished) {}
    default void archiveStarted(Archive archive) {}
    default void archiveFinished(ArchiveResult result, RunStats stats) {}
    default void runFinished(RunStats stats) {}
}
