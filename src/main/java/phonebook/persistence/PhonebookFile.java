package phonebook.persistence;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactField;
import phonebook.domain.ContactRecord;
import phonebook.domain.Result;
import phonebook.domain.error.DirectoryError;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.MappingIterator;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvSchema;

/**
 * Reads and writes the directory's CSV file.
 *
 * <h2>Format</h2>
 * <ul>
 *   <li>UTF-8, comma separated, double-quote quoting for embedded commas, quotes and newlines</li>
 *   <li>First row: the seven {@link ContactField} labels in column order</li>
 *   <li>Then one row per record; the ID column holds the record's one-based position</li>
 * </ul>
 *
 * <p>Writes replace the whole file. The new content is written to a sibling {@code .tmp} file,
 * forced to disk and moved over the target, so a crash mid-write leaves either the old or the
 * new file but never a truncated one.
 */
@Component
public class PhonebookFile {

    private static final Logger LOG = LoggerFactory.getLogger(PhonebookFile.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String TEMP_SUFFIX = ".tmp";

    private final CsvMapper csvMapper;
    private final CsvSchema writeSchema;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "CsvMapper is an immutable, shared Spring bean")
    public PhonebookFile(final CsvMapper csvMapper) {
        this.csvMapper = Objects.requireNonNull(csvMapper, "csvMapper must not be null");
        final CsvSchema.Builder schema = CsvSchema.builder();
        for (final String label : ContactField.headerLabels()) {
            schema.addColumn(label);
        }
        this.writeSchema = schema.build().withHeader();
    }

    /**
     * Loads every record from {@code path}.
     *
     * <p>A missing file is an empty directory, not an error. The ID column is checked to be a
     * positive integer and then dropped: ids are reassigned from positions on the next write.
     *
     * @param path backing file
     * @return records in file order
     * @throws PhonebookParseException       if the content is not a valid directory file
     * @throws PhonebookPersistenceException if the file exists but cannot be read
     */
    public List<ContactRecord> read(final Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.exists(path)) {
            LOG.info("Phonebook file {} does not exist yet, starting empty", path);
            return new ArrayList<>();
        }

        final List<String[]> rows = parseRows(path, readContent(path));
        if (rows.isEmpty()) {
            throw new PhonebookParseException("Missing header row in " + path, path);
        }
        checkHeader(path, rows.get(0));

        final List<ContactRecord> records = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            records.add(toRecord(path, i, rows.get(i)));
        }
        return records;
    }

    /**
     * Replaces the content of {@code path} with the header and one row per record.
     *
     * @param path    backing file; its parent directory is created when missing
     * @param records records in directory order
     * @throws PhonebookPersistenceException if the file cannot be written
     */
    public void write(final Path path, final List<ContactRecord> records) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(records, "records must not be null");

        final String content;
        try {
            content = csvMapper.writer(writeSchema).writeValueAsString(toRows(records));
        } catch (JacksonException e) {
            throw new PhonebookPersistenceException("Could not encode phonebook rows", path, e);
        }

        final Path target = path.toAbsolutePath();
        final Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(tmp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            discardTemp(tmp, e);
            throw new PhonebookPersistenceException("Could not write phonebook file " + path, path, e);
        }
        LOG.debug("Wrote {} records to {}", records.size(), path);
    }

    private static void moveIntoPlace(final Path tmp, final Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTemp(final Path tmp, final IOException failure) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private static String readContent(final Path path) {
        final String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new PhonebookParseException("Phonebook file " + path + " is not valid UTF-8", path, e);
        } catch (IOException e) {
            throw new PhonebookPersistenceException("Could not read phonebook file " + path, path, e);
        }
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            return content.substring(1);
        }
        return content;
    }

    private List<String[]> parseRows(final Path path, final String content) {
        try {
            final MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(content);
            return rows.readAll();
        } catch (JacksonException e) {
            throw new PhonebookParseException("Malformed CSV in " + path + ": " + e.getMessage(), path, e);
        }
    }

    private static void checkHeader(final Path path, final String[] header) {
        final List<String> expected = ContactField.headerLabels();
        if (!expected.equals(Arrays.asList(header))) {
            throw new PhonebookParseException(
                    "Unexpected header in " + path + ": expected " + expected + " but was " + Arrays.toString(header),
                    path);
        }
    }

    private static ContactRecord toRecord(final Path path, final int rowNumber, final String[] row) {
        final int columns = ContactField.values().length;
        if (row.length != columns) {
            throw new PhonebookParseException(
                    "Row " + rowNumber + " of " + path + " has " + row.length + " columns, expected " + columns,
                    path);
        }
        checkId(path, rowNumber, row[ContactField.ID.ordinal()]);

        final ContactDraft draft = new ContactDraft(
                row[ContactField.LAST_NAME.ordinal()],
                row[ContactField.FIRST_NAME.ordinal()],
                row[ContactField.PATRONYMIC.ordinal()],
                row[ContactField.ORGANIZATION.ordinal()],
                row[ContactField.WORK_PHONE.ordinal()],
                row[ContactField.PERSONAL_PHONE.ordinal()]);
        final Result<ContactRecord, DirectoryError> record = ContactRecord.create(draft);
        if (!record.isOk()) {
            throw new PhonebookParseException(
                    "Row " + rowNumber + " of " + path + " is invalid: " + record.error().message(), path);
        }
        return record.value();
    }

    private static void checkId(final Path path, final int rowNumber, final String id) {
        final int parsed;
        try {
            parsed = Integer.parseInt(id.trim());
        } catch (NumberFormatException e) {
            throw new PhonebookParseException(
                    "Row " + rowNumber + " of " + path + " has a non-numeric ID '" + id + "'", path, e);
        }
        if (parsed < 1) {
            throw new PhonebookParseException(
                    "Row " + rowNumber + " of " + path + " has a non-positive ID " + parsed, path);
        }
    }

    private static List<Map<String, String>> toRows(final List<ContactRecord> records) {
        final List<Map<String, String>> rows = new ArrayList<>(records.size());
        int position = 1;
        for (final ContactRecord record : records) {
            final Map<String, String> row = new LinkedHashMap<>();
            row.put(ContactField.ID.label(), Integer.toString(position++));
            for (final ContactField field : ContactField.textFields()) {
                row.put(field.label(), record.get(field));
            }
            rows.add(row);
        }
        return rows;
    }
}
