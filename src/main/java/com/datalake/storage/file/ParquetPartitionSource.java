package com.datalake.storage.file;

import com.datalake.domain.RecordBatch;
import com.datalake.domain.Schema;
import com.datalake.domain.Values;
import org.apache.avro.LogicalType;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads Parquet batch files from the data lake.
 *
 * Layout: {@code <root>/<COLLECTION>/<COLLECTION>_batch_<n>_<yyyyMMdd_HHmmss>.parquet}.
 * Every sub-directory of the root holding at least one {@code .parquet} file is a
 * collection. Files are read with {@link AvroParquetReader}; Avro timestamp logical
 * types are turned into naive UTC wall-clock values and everything else is coerced
 * through {@link Values#coerce(Object)}.
 */
@Component
public class ParquetPartitionSource implements PartitionSource {

    private static final Logger logger = LoggerFactory.getLogger(ParquetPartitionSource.class);

    static final String PARQUET_SUFFIX = ".parquet";

    private final Path root;
    private final Configuration hadoopConf;

    public ParquetPartitionSource(@Value("${datalake.storage.data-lake-root:data_lake}") String root) {
        this.root = Paths.get(root).toAbsolutePath().normalize();
        this.hadoopConf = new Configuration();
        logger.info("ParquetPartitionSource initialized with data lake root {}", this.root);
    }

    @Override
    public List<String> listCollections() throws IOException {
        List<String> collections = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            logger.warn("Data lake root {} does not exist, no file collections available", root);
            return collections;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                if (containsPartitions(dir)) {
                    collections.add(dir.getFileName().toString());
                }
            }
        }
        collections.sort(String::compareTo);
        return collections;
    }

    @Override
    public List<PartitionHandle> listPartitions(String collection) throws IOException {
        List<PartitionHandle> partitions = new ArrayList<>();
        Path dir = root.resolve(collection).normalize();
        if (!dir.startsWith(root) || !Files.isDirectory(dir)) {
            return partitions;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, ParquetPartitionSource::isPartitionFile)) {
            for (Path file : files) {
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                partitions.add(new PartitionHandle(collection, file.toString(),
                    attributes.size(), attributes.lastModifiedTime().toMillis()));
            }
        }
        partitions.sort((a, b) -> a.getLocation().compareTo(b.getLocation()));
        return partitions;
    }

    @Override
    public RecordBatch readPartition(PartitionHandle handle) throws IOException {
        long startTime = System.currentTimeMillis();
        org.apache.hadoop.fs.Path path = new org.apache.hadoop.fs.Path(Paths.get(handle.getLocation()).toUri());
        InputFile inputFile = HadoopInputFile.fromPath(path, hadoopConf);

        List<Map<String, Object>> rows = new ArrayList<>();
        Schema schema = Schema.empty();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(inputFile)
                .withConf(hadoopConf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                if (schema.isEmpty()) {
                    schema = schemaOf(record.getSchema());
                }
                rows.add(toRow(record));
            }
        } catch (RuntimeException e) {
            // Corrupt footers and schema conversion problems surface as unchecked exceptions
            throw new IOException("Failed to read partition " + handle + ": " + e.getMessage(), e);
        }

        logger.debug("Read {} records from partition {} in {}ms",
            rows.size(), handle, System.currentTimeMillis() - startTime);
        return RecordBatch.of(schema, rows);
    }

    private static Schema schemaOf(org.apache.avro.Schema avroSchema) {
        List<String> fields = new ArrayList<>();
        for (org.apache.avro.Schema.Field field : avroSchema.getFields()) {
            fields.add(field.name());
        }
        return Schema.of(fields);
    }

    private static Map<String, Object> toRow(GenericRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (org.apache.avro.Schema.Field field : record.getSchema().getFields()) {
            Object value = record.get(field.pos());
            row.put(field.name(), convert(value, field.schema()));
        }
        return row;
    }

    /**
     * Map an Avro value to the record value domain, honoring timestamp logical types
     */
    static Object convert(Object value, org.apache.avro.Schema fieldSchema) {
        if (value == null) {
            return null;
        }
        LogicalType logicalType = valueSchema(fieldSchema).getLogicalType();
        if (logicalType != null && value instanceof Number) {
            long raw = ((Number) value).longValue();
            switch (logicalType.getName()) {
                case "timestamp-millis":
                case "local-timestamp-millis":
                    return LocalDateTime.ofInstant(Instant.ofEpochMilli(raw), ZoneOffset.UTC);
                case "timestamp-micros":
                case "local-timestamp-micros":
                    return LocalDateTime.ofInstant(
                        Instant.ofEpochSecond(Math.floorDiv(raw, 1_000_000L), Math.floorMod(raw, 1_000_000L) * 1_000L),
                        ZoneOffset.UTC);
                case "date":
                    return LocalDate.ofEpochDay(raw).atStartOfDay();
                default:
                    break;
            }
        }
        if (value instanceof Instant) {
            // Data models with logical type conversions hand back instants
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof GenericRecord || value instanceof java.util.Collection || value instanceof Map) {
            return value.toString();
        }
        if (value instanceof org.apache.avro.generic.GenericEnumSymbol) {
            return value.toString();
        }
        return Values.coerce(value);
    }

    /**
     * Non-null branch of an optional union, or the schema itself
     */
    private static org.apache.avro.Schema valueSchema(org.apache.avro.Schema schema) {
        if (schema.getType() == org.apache.avro.Schema.Type.UNION) {
            for (org.apache.avro.Schema branch : schema.getTypes()) {
                if (branch.getType() != org.apache.avro.Schema.Type.NULL) {
                    return branch;
                }
            }
        }
        return schema;
    }

    private static boolean containsPartitions(Path dir) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, ParquetPartitionSource::isPartitionFile)) {
            return files.iterator().hasNext();
        }
    }

    private static boolean isPartitionFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(PARQUET_SUFFIX) && !name.startsWith(".") && Files.isRegularFile(file);
    }
}
