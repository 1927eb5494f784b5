package au.djac.midiset.parquet;
import au.djac.midiset.OutputRecord;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.HadoopReadOptions;
import org.apache.parquet.ParquetReadOptions;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.RecordReader;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.function.Consumer;

/**
 * Reads a dataset written by {@link PartitionedParquetWriter}. Group-specific queries open only
 * the files inside that group's partition directory.
 */
public class PartitionedDatasetReader
{
    private final Path root;
    private final ParquetReadOptions options;

    public PartitionedDatasetReader(Path root)
    {
        this.root = root;
        this.options = HadoopReadOptions.builder(new Configuration(false)).build();
    }

    public Path getRoot() { return root; }

    /**
     * Lists the groups present, from the partition directory names alone.
     *
     * @return The group values, sorted.
     */
    public List<String> groups() throws IOException
    {
        var groups = new ArrayList<String>();
        try(var stream = Files.newDirectoryStream(root, Files::isDirectory))
        {
            for(var dir : stream)
            {
                var group = PartitionPaths.groupOf(dir.getFileName().toString());
                if(group != null)
                {
                    groups.add(group);
                }
            }
        }
        Collections.sort(groups);
        return groups;
    }

    /**
     * Lists the Parquet files making up one group's partition, or an empty list if the group
     * does not exist.
     */
    public List<Path> partFiles(String group) throws IOException
    {
        var dir = root.resolve(PartitionPaths.directoryName(group));
        var files = new ArrayList<Path>();
        if(!Files.isDirectory(dir))
        {
            return files;
        }
        try(var stream = Files.newDirectoryStream(dir, "*.parquet"))
        {
            stream.forEach(files::add);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Counts a group's records from the Parquet footers, without reading any data pages.
     */
    public long recordCount(String group) throws IOException
    {
        long count = 0;
        for(var file : partFiles(group))
        {
            try(var reader = ParquetFileReader.open(new LocalInputFile(file), options))
            {
                count += reader.getRecordCount();
            }
        }
        return count;
    }

    public void read(String group, Consumer<OutputRecord> consumer) throws IOException
    {
        for(var file : partFiles(group))
        {
            readFile(file, consumer);
        }
    }

    public List<OutputRecord> read(String group) throws IOException
    {
        var records = new ArrayList<OutputRecord>();
        read(group, records::add);
        return records;
    }

    public void readAll(Consumer<OutputRecord> consumer) throws IOException
    {
        for(var group : groups())
        {
            read(group, consumer);
        }
    }

    public List<OutputRecord> readAll() throws IOException
    {
        var records = new ArrayList<OutputRecord>();
        readAll(records::add);
        return records;
    }

    private void readFile(Path file, Consumer<OutputRecord> consumer) throws IOException
    {
        try(var reader = ParquetFileReader.open(new LocalInputFile(file), options))
        {
            var schema = reader.getFooter().getFileMetaData().getSchema();
            var columnIO = new ColumnIOFactory().getColumnIO(schema);
            var pages = reader.readNextRowGroup();
            while(pages != null)
            {
                RecordReader<Group> recordReader =
                    columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
                for(long i = 0; i < pages.getRowCount(); i++)
                {
                    consumer.accept(MidiFileSchema.fromGroup(recordReader.read()));
                }
                pages = reader.readNextRowGroup();
            }
        }
    }
}
