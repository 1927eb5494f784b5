package au.djac.midiset.clitools;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

class ExtractMidiTest
{
    @TempDir
    Path tempDir;

    private Path input;
    private Path output;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException
    {
        input = Files.createDirectories(tempDir.resolve("in"));
        output = tempDir.resolve("midi.parquet");
    }

    private int run(String... args)
    {
        CommandLine cmd = ExtractMidi.newCommandLine(new ExtractMidi());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private void zip(String name, String... memberNames) throws IOException
    {
        try(var zos = new ZipArchiveOutputStream(input.resolve(name).toFile()))
        {
            for(var member : memberNames)
            {
                zos.putArchiveEntry(new ZipArchiveEntry(member));
                zos.write(("content of " + member).getBytes(StandardCharsets.UTF_8));
                zos.closeArchiveEntry();
            }
        }
    }

    @Test
    void extract_succeedsAndPrintsSummary() throws IOException
    {
        zip("jazz_collection.zip", "a.mid", "b.MIDI", "c.txt");

        int exitCode = run(input.toString(), "-o", output.toString(), "-j", "2", "--compression-level", "5");

        assertThat(exitCode).isZero();
        assertThat(output.resolve("group=jazz_collection")).isDirectory();
        assertThat(out.toString())
            .contains("MIDI files extracted  : 2")
            .contains("jazz_collection: 2 files")
            .contains("MIDI file size distribution:");
    }

    @Test
    void extract_canLeaveOutHistogram() throws IOException
    {
        zip("jazz_collection.zip", "a.mid");

        assertThat(run(input.toString(), "--output", output.toString(), "--no-histogram")).isZero();
        assertThat(out.toString()).doesNotContain("MIDI file size distribution:");
    }

    @Test
    void extract_returnsDistinctExitCodesForFatalErrors() throws IOException
    {
        assertThat(run(tempDir.resolve("missing").toString(), "-o", output.toString()))
            .isEqualTo(ExtractMidi.EXIT_INPUT_NOT_FOUND);

        assertThat(run(input.toString(), "-o", output.toString()))
            .isEqualTo(ExtractMidi.EXIT_NO_ARCHIVES);

        zip("docs.zip", "readme.txt");
        assertThat(run(input.toString(), "-o", output.toString()))
            .isEqualTo(ExtractMidi.EXIT_NO_MIDI_FILES);
        assertThat(output).doesNotExist();

        zip("songs.zip", "a.mid");
        assertThat(run(input.toString(), "-o", output.toString())).isZero();
        assertThat(run(input.toString(), "-o", output.toString()))
            .isEqualTo(ExtractMidi.EXIT_OUTPUT_CONFLICT);
        assertThat(err.toString()).contains("already exists");

        assertThat(run(input.toString(), "-o", output.toString(), "-f")).isZero();
    }

    @Test
    void extract_treatsBadArgumentsAsUsageErrors()
    {
        assertThat(run(input.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run(input.toString(), "-o", output.toString(), "--compression-level", "30"))
            .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run(input.toString(), "-o", output.toString(), "-j", "0"))
            .isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void listing_showsGroupsAndFiles() throws IOException
    {
        zip("jazz_collection.zip", "a.mid", "b.mid");
        zip("classical_music.zip", "c.mid");
        assertThat(run(input.toString(), "-o", output.toString())).isZero();

        var lsOut = new StringWriter();
        var ls = new CommandLine(new ListMidiSet());
        ls.setOut(new PrintWriter(lsOut));
        assertThat(ls.execute(output.toString())).isZero();
        assertThat(lsOut.toString()).contains("classical_music\t1").contains("jazz_collection\t2");

        var groupOut = new StringWriter();
        ls = new CommandLine(new ListMidiSet());
        ls.setOut(new PrintWriter(groupOut));
        assertThat(ls.execute(output.toString(), "-g", "jazz_collection")).isZero();
        assertThat(groupOut.toString()).contains("a.mid").contains("b.mid").doesNotContain("c.mid");
    }
}
