package au.djac.midiset.parquet;
import au.djac.midiset.OutputRecord;

import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.*;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * The Parquet schema of the output dataset, and conversion between {@link OutputRecord}s and
 * Parquet's example {@link Group} object model.
 *
 * <pre>
 * message midi_file {
 *   required binary group (STRING);
 *   required binary file_name (STRING);
 *   required binary content;
 * }
 * </pre>
 */
public final class MidiFileSchema
{
    public static final String GROUP     = "group";
    public static final String FILE_NAME = "file_name";
    public static final String CONTENT   = "content";

    public static final MessageType SCHEMA = Types.buildMessage()
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named(GROUP)
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named(FILE_NAME)
        .required(PrimitiveTypeName.BINARY).named(CONTENT)
        .named("midi_file");

    private MidiFileSchema() {}

    static Group toGroup(SimpleGroupFactory factory, OutputRecord record)
    {
        return factory.newGroup()
            .append(GROUP, record.getGroup())
            .append(FILE_NAME, record.getFileName())
            .append(CONTENT, Binary.fromConstantByteArray(record.getContent()));
    }

    static OutputRecord fromGroup(Group group)
    {
        return new OutputRecord(
            group.getString(GROUP, 0),
            group.getString(FILE_NAME, 0),
            group.getBinary(CONTENT, 0).getBytes());
    }
}
