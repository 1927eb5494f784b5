package au.djac.midiset;

/**
 * The input directory contains no .tar.gz, .tgz or .zip files. This is treated as a usage error,
 * rather than producing an empty dataset.
 */
public class NoArchivesFoundException extends MidiSetException
{
    public NoArchivesFoundException(String msg) { super(msg); }
}
