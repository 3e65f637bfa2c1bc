package io.callscan.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.callscan.ScanResult;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One CSV row per function. List cells are joined with "; " and read "None" when empty.
 */
public class CsvExporter implements Exporter {

    static final List<String> COLUMNS =
        List.of("File", "Function", "Line", "Parameters", "Returns", "Externals", "FunctionCalls");
    static final String NONE = "None";
    static final String SEPARATOR = "; ";

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema;

    public CsvExporter() {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : COLUMNS) {
            builder.addColumn(column);
        }
        this.schema = builder.build().withHeader();
    }

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public void write(ScanResult result, Writer writer) throws IOException {
        write(FunctionRecord.all(result), writer);
    }

    public void write(List<FunctionRecord> records, Writer writer) throws IOException {
        ObjectWriter csv = mapper.writerFor(Map.class)
            .with(schema)
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        try (SequenceWriter rows = csv.writeValues(writer)) {
            for (FunctionRecord record : records) {
                rows.write(toRow(record));
            }
        }
        writer.flush();
    }

    private static Map<String, String> toRow(FunctionRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("File", record.file());
        row.put("Function", record.function());
        row.put("Line", Integer.toString(record.line()));
        row.put("Parameters", join(record.parameters()));
        row.put("Returns", join(record.returns()));
        row.put("Externals", join(record.externals()));
        row.put("FunctionCalls", join(record.calls()));
        return row;
    }

    static String join(List<String> values) {
        return values.isEmpty() ? NONE : String.join(SEPARATOR, values);
    }
}
