package au.djac.midiset.clitools;
import au.djac.midiset.*;

import picocli.CommandLine;

import java.io.*;
import java.util.concurrent.Callable;


@CommandLine.Command(name = "midiset-extract",
                     mixinStandardHelpOptions = true,
                     version = "0.1",
                     description = "Extracts the MIDI files (.mid/.midi) from a directory of .tar.gz, .tgz and .zip "
                                 + "archives into a Parquet dataset, partitioned by archive name.",
                     footer = {
                         "",
                         "Exit codes:",
                         "  0  Output written (individual archives may have failed; see the summary).",
                         "  2  Invalid command-line usage.",
                         "  3  Input directory missing or unreadable.",
                         "  4  Output already exists (use -f), or cannot be written.",
                         "  5  No .tar.gz, .tgz or .zip files in the input directory.",
                         "  6  No MIDI files in any archive.",
                         "  7  Failed while writing the output.",
                         "  8  Cancelled."
                     })

public class ExtractMidi implements Callable<Integer>
{
    public static final int EXIT_INPUT_NOT_FOUND = 3;
    public static final int EXIT_OUTPUT_CONFLICT = 4;
    public static final int EXIT_NO_ARCHIVES     = 5;
    public static final int EXIT_NO_MIDI_FILES   = 6;
    public static final int EXIT_WRITE_FAILURE   = 7;
    public static final int EXIT_CANCELLED       = 8;

    public static void main(String[] args)
    {
        System.exit(newCommandLine(new ExtractMidi()).execute(args));
    }

    /**
     * Sets up a CommandLine that reports library exceptions as a one-line message on stderr, and
     * returns the matching exit code (rather than picocli's default stack trace and exit code 1).
     */
    public static CommandLine newCommandLine(ExtractMidi command)
    {
        var cmd = new CommandLine(command);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) ->
        {
            commandLine.getErr().println(commandLine.getColorScheme().errorText(ex.getMessage()));
            commandLine.getErr().flush();
            return exitCodeFor(ex);
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) throws Exception
    {
        if(ex instanceof InputNotFoundException)     { return EXIT_INPUT_NOT_FOUND; }
        if(ex instanceof OutputConflictException)    { return EXIT_OUTPUT_CONFLICT; }
        if(ex instanceof NoArchivesFoundException)   { return EXIT_NO_ARCHIVES; }
        if(ex instanceof NoMidiFilesFoundException)  { return EXIT_NO_MIDI_FILES; }
        if(ex instanceof WriteFailureException)      { return EXIT_WRITE_FAILURE; }
        if(ex instanceof RunCancelledException)      { return EXIT_CANCELLED; }
        throw ex;
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Directory containing the archives.")
    private File inputDir;

    @CommandLine.Option(names = {"-o", "--output"}, required = true,
                        description = "Path of the Parquet dataset (a directory) to create.")
    private File output;

    @CommandLine.Option(names = {"-j", "--jobs"},
                        description = "Number of archives to read in parallel (default: number of CPUs).")
    private Integer jobs;

    @CommandLine.Option(names = {"-r", "--recursive"},
                        description = "Also look for archives in sub-directories of the input directory.")
    private boolean recursive;

    @CommandLine.Option(names = {"-f", "--overwrite"},
                        description = "Replace the output if it already exists.")
    private boolean overwrite;

    @CommandLine.Option(names = "--compression-level", defaultValue = "22",
                        description = "ZSTD compression level, 1-22 (default: ${DEFAULT-VALUE}).")
    private int compressionLevel;

    @CommandLine.Option(names = "--queue-capacity",
                        description = "Number of read archives that may wait to be written (default: twice the number of jobs).")
    private Integer queueCapacity;

    @CommandLine.Option(names = "--no-histogram",
                        description = "Leave the file size distribution out of the summary.")
    private boolean noHistogram;

    @Override
    public Integer call()
    {
        var midiSet = new MidiSet()
            .recursive(recursive)
            .overwrite(overwrite);

        try
        {
            midiSet.compressionLevel(compressionLevel);
            if(jobs != null)
            {
                midiSet.jobs(jobs);
            }
            if(queueCapacity != null)
            {
                midiSet.queueCapacity(queueCapacity);
            }
        }
        catch(IllegalArgumentException e)
        {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        var stats = midiSet.extract(inputDir.toPath(), output.toPath());

        PrintWriter out = spec.commandLine().getOut();
        stats.summary(!noHistogram).forEach(out::println);
        out.flush();
        return 0;
    }
}
