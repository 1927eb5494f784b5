package au.djac.midiset;

/**
 * The output path cannot be created, or already exists and may not (or cannot) be replaced.
 */
public class OutputConflictException extends MidiSetException
{
    public OutputConflictException(String msg)                  { super(msg); }
    public OutputConflictException(String msg, Throwable cause) { super(msg, cause); }
}
