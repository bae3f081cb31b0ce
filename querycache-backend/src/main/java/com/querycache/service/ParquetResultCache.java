package com.querycache.service;

import com.querycache.model.ColumnType;
import com.querycache.model.TabularColumn;
import com.querycache.model.TabularResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stores query results as one Parquet file per cache key.
 *
 * Files are written with parquet-avro. Every Avro field carries the original column name and
 * {@link ColumnType} as field properties, so names Avro cannot represent (and types Avro would widen)
 * come back exactly as they were written.
 */
@Slf4j
public class ParquetResultCache {

    static final String AVRO_SCHEMA_KEY = "parquet.avro.schema";
    static final String COLUMN_PROP = "querycache.column";
    static final String TYPE_PROP = "querycache.type";

    private static final String RECORD_NAME = "CachedResult";
    private static final Pattern AVRO_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final LocalDateTime EPOCH = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final Path cacheDir;
    private final Configuration conf;

    /**
     * Create a cache rooted at {@code cacheDir}.
     *
     * @param cacheDir directory holding the cache files; created on first write
     */
    public ParquetResultCache(Path cacheDir) {
        this.cacheDir = cacheDir;
        this.conf = new Configuration();
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    /**
     * Path of the cache file for a key.
     *
     * @param cacheKey cache key (file name)
     * @return cache file path
     */
    public Path pathFor(String cacheKey) {
        return cacheDir.resolve(cacheKey);
    }

    public boolean contains(String cacheKey) {
        return Files.isRegularFile(pathFor(cacheKey));
    }

    /**
     * Create the cache directory if it does not exist yet.
     *
     * @throws IOException when the directory cannot be created
     */
    public void ensureDirectory() throws IOException {
        Files.createDirectories(cacheDir);
    }

    /**
     * Write a result, replacing any existing entry for the key.
     *
     * A result without columns cannot be represented in Parquet; it is not cached.
     *
     * @param cacheKey cache key
     * @param result result to store
     * @throws IOException on write errors
     */
    public void write(String cacheKey, TabularResult result) throws IOException {
        ensureDirectory();
        Path file = pathFor(cacheKey);
        if (result.getColumns().isEmpty()) {
            log.warn("Result for {} has no columns; not caching it", cacheKey);
            return;
        }

        Schema schema = buildSchema(result.getColumns());
        List<Schema.Field> fields = schema.getFields();
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(toHadoopPath(file))
                .withSchema(schema)
                .withConf(conf)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (List<Object> row : result.getRows()) {
                GenericRecord record = new GenericData.Record(schema);
                for (int i = 0; i < fields.size(); i++) {
                    record.put(i, toAvro(result.getColumns().get(i).getType(), row.get(i)));
                }
                writer.write(record);
            }
        }
        log.info("Cached {} rows to {}", result.getRowCount(), file);
    }

    /**
     * Read a cached result.
     *
     * @param cacheKey cache key
     * @return stored result
     * @throws IOException when the entry is missing or unreadable
     */
    public TabularResult read(String cacheKey) throws IOException {
        Path file = pathFor(cacheKey);
        InputFile inputFile = HadoopInputFile.fromPath(toHadoopPath(file), conf);

        Schema schema;
        try (ParquetFileReader footerReader = ParquetFileReader.open(inputFile)) {
            String avroSchema = footerReader.getFooter().getFileMetaData().getKeyValueMetaData().get(AVRO_SCHEMA_KEY);
            if (avroSchema == null) {
                throw new IOException("Cache file " + file + " carries no Avro schema");
            }
            schema = new Schema.Parser().parse(avroSchema);
        }

        List<TabularColumn> columns = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            columns.add(columnOf(field));
        }

        List<List<Object>> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(inputFile).build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    row.add(fromAvro(columns.get(i).getType(), record.get(i)));
                }
                rows.add(row);
            }
        }
        log.debug("Read {} cached rows from {}", rows.size(), file);
        return TabularResult.of(columns, rows);
    }

    /**
     * Delete the entry for a key, together with Hadoop's checksum side file.
     *
     * @param cacheKey cache key
     * @return true when an entry existed
     * @throws IOException on delete errors
     */
    public boolean evict(String cacheKey) throws IOException {
        Path file = pathFor(cacheKey);
        Files.deleteIfExists(cacheDir.resolve("." + cacheKey + ".crc"));
        boolean deleted = Files.deleteIfExists(file);
        if (deleted) {
            log.info("Evicted cache entry {}", file);
        }
        return deleted;
    }

    static Schema buildSchema(List<TabularColumn> columns) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME).fields();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < columns.size(); i++) {
            TabularColumn column = columns.get(i);
            String fieldName = column.getName();
            if (!AVRO_NAME.matcher(fieldName).matches() || !used.add(fieldName)) {
                fieldName = "col_" + i;
                used.add(fieldName);
            }
            fields = fields.name(fieldName)
                    .prop(COLUMN_PROP, column.getName())
                    .prop(TYPE_PROP, column.getType().name())
                    .type(Schema.createUnion(Schema.create(Schema.Type.NULL), avroType(column.getType())))
                    .withDefault(null);
        }
        return fields.endRecord();
    }

    private static Schema avroType(ColumnType type) {
        switch (type) {
            case INTEGER:
                return Schema.create(Schema.Type.LONG);
            case FLOAT:
                return Schema.create(Schema.Type.DOUBLE);
            case BOOLEAN:
                return Schema.create(Schema.Type.BOOLEAN);
            case TIMESTAMP:
                return LogicalTypes.localTimestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
            case DATE:
                return LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
            case BINARY:
                return Schema.create(Schema.Type.BYTES);
            default:
                return Schema.create(Schema.Type.STRING);
        }
    }

    private static TabularColumn columnOf(Schema.Field field) {
        String name = field.getProp(COLUMN_PROP);
        String type = field.getProp(TYPE_PROP);
        return TabularColumn.of(
                name != null ? name : field.name(),
                type != null ? ColumnType.valueOf(type) : ColumnType.STRING);
    }

    private static Object toAvro(ColumnType type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case TIMESTAMP:
                return ChronoUnit.MICROS.between(EPOCH, (LocalDateTime) value);
            case DATE:
                return (int) ((LocalDate) value).toEpochDay();
            case BINARY:
                return ByteBuffer.wrap((byte[]) value);
            case STRING:
                return value.toString();
            default:
                return value;
        }
    }

    private static Object fromAvro(ColumnType type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case TIMESTAMP:
                if (value instanceof Long micros) {
                    return LocalDateTime.ofEpochSecond(
                            Math.floorDiv(micros, 1_000_000L),
                            (int) Math.floorMod(micros, 1_000_000L) * 1_000,
                            ZoneOffset.UTC);
                }
                return value;
            case DATE:
                if (value instanceof Integer days) {
                    return LocalDate.ofEpochDay(days);
                }
                return value;
            case BINARY:
                if (value instanceof ByteBuffer buffer) {
                    ByteBuffer copy = buffer.duplicate();
                    byte[] bytes = new byte[copy.remaining()];
                    copy.get(bytes);
                    return bytes;
                }
                return value;
            case STRING:
                return value.toString();
            default:
                return value;
        }
    }

    private static org.apache.hadoop.fs.Path toHadoopPath(Path file) {
        return new org.apache.hadoop.fs.Path(file.toAbsolutePath().toUri());
    }
}
