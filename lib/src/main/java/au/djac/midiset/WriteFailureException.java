package au.djac.midiset;

/**
 * An I/O error occurred while writing or committing the output dataset. Whatever was written is
 * discarded.
 */
public class WriteFailureException extends MidiSetException
{
    public WriteFailureException(String msg, Throwable cause) { super(msg, cause); }
}
