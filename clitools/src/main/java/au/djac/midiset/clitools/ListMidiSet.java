package au.djac.midiset.clitools;
import au.djac.midiset.parquet.PartitionedDatasetReader;

import org.apache.commons.io.FileUtils;
import picocli.CommandLine;

import java.io.*;
import java.nio.file.Files;
import java.util.concurrent.Callable;


@CommandLine.Command(name = "midiset-ls",
                     mixinStandardHelpOptions = true,
                     version = "0.1",
                     description = "Lists the groups in a MIDI dataset written by midiset-extract, or the files in one group.")

public class ListMidiSet implements Callable<Integer>
{
    public static void main(String[] args)
    {
        System.exit(new CommandLine(new ListMidiSet()).execute(args));
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Dataset directory.")
    private File dataset;

    @CommandLine.Option(names = {"-g", "--group"},
                        description = "List the files in this group (reads only its partition).")
    private String group;

    @Override
    public Integer call() throws IOException
    {
        if(!Files.isDirectory(dataset.toPath()))
        {
            throw new CommandLine.ParameterException(
                spec.commandLine(), "Dataset '" + dataset + "' is not a directory");
        }

        var reader = new PartitionedDatasetReader(dataset.toPath());
        PrintWriter out = spec.commandLine().getOut();
        if(group == null)
        {
            for(var g : reader.groups())
            {
                out.printf("%s\t%,d%n", g, reader.recordCount(g));
            }
        }
        else
        {
            if(reader.partFiles(group).isEmpty())
            {
                spec.commandLine().getErr().println("No such group: " + group);
                return 1;
            }
            reader.read(group, record ->
                out.printf("%s\t%s%n",
                           record.getFileName(),
                           FileUtils.byteCountToDisplaySize(record.getSize())));
        }
        out.flush();
        return 0;
    }
}
