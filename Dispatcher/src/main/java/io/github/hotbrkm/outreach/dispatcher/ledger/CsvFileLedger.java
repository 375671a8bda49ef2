package io.github.hotbrkm.outreach.dispatcher.ledger;

import io.github.hotbrkm.outreach.dispatcher.config.CampaignLockException;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link Ledger} stored as an append-only CSV file, one record per line.
 * <p>
 * The column layout is compatible with the legacy {@code sent_log.csv}:
 * {@code timestamp,email,subject,status,type,first_name,last_name,organization,template_used,followup_sequence}.
 * Legacy rows with naive timestamps are read in the configured zone and legacy type labels
 * ({@code cold}, {@code followup}, {@code warmup}) are accepted.
 * <p>
 * Every append is forced to disk before returning. A torn trailing record left by a crash is skipped when
 * scanning and cut off by the next append. A malformed record anywhere else fails the scan.
 */
@Slf4j
public class CsvFileLedger implements Ledger {

    static final List<String> HEADER = List.of(
            "timestamp", "email", "subject", "status", "type",
            "first_name", "last_name", "organization", "template_used", "followup_sequence");

    private static final List<String> REQUIRED_COLUMNS = List.of("timestamp", "email", "status", "type");
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    @Getter
    private final Path path;
    private final Path lockPath;
    private final ZoneId zone;

    private OffsetDateTime lastTimestamp;
    private boolean lastTimestampLoaded;

    public CsvFileLedger(Path path, ZoneId zone) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.lockPath = path.resolveSibling(path.getFileName() + ".lock");
    }

    @Override
    public synchronized void append(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        LedgerEntry stored = clampTimestamp(entry);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                if (channel.size() > 0) {
                    repairTornTail(channel);
                }
                StringBuilder out = new StringBuilder();
                if (channel.size() == 0) {
                    printRecord(out, HEADER);
                }
                printRecord(out, toColumns(stored));
                channel.position(channel.size());
                ByteBuffer buffer = ByteBuffer.wrap(out.toString().getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new LedgerIOException("Failed to append to ledger " + path + ": " + e.getMessage(), e);
        }
        lastTimestamp = stored.timestamp();
        log.debug("Ledger append. recipient={}, status={}, category={}, sequence={}",
                stored.recipientKey(), stored.status(), stored.category(), stored.sequence());
    }

    @Override
    public Stream<LedgerEntry> scan() {
        if (!Files.exists(path)) {
            return Stream.empty();
        }
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerIOException("Failed to open ledger " + path + ": " + e.getMessage(), e);
        }
        try {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                reader.close();
                return Stream.empty();
            }
            Map<String, Integer> columns = headerColumns(headerLine);
            EntryIterator iterator = new EntryIterator(reader, columns, !endsWithLineTerminator());
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                    .onClose(iterator::close);
        } catch (IOException | RuntimeException e) {
            closeQuietly(reader, e);
            if (e instanceof LedgerIOException ledgerIOException) {
                throw ledgerIOException;
            }
            throw new LedgerIOException("Failed to read ledger header " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public LedgerLock lock() {
        FileChannel channel;
        try {
            Path parent = lockPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new CampaignLockException("Cannot open ledger lock file " + lockPath + ": " + e.getMessage(), e);
        }
        FileLock fileLock;
        try {
            fileLock = channel.tryLock();
        } catch (IOException | OverlappingFileLockException e) {
            closeQuietly(channel, e);
            throw new CampaignLockException("Ledger " + path + " is locked by another dispatcher", e);
        }
        if (fileLock == null) {
            closeQuietly(channel, null);
            throw new CampaignLockException("Ledger " + path + " is locked by another dispatcher");
        }
        log.info("Ledger lock acquired. lockFile={}", lockPath);
        return () -> {
            try {
                fileLock.release();
                channel.close();
                log.info("Ledger lock released. lockFile={}", lockPath);
            } catch (IOException e) {
                throw new LedgerIOException("Failed to release ledger lock " + lockPath, e);
            }
        };
    }

    private LedgerEntry clampTimestamp(LedgerEntry entry) {
        if (!lastTimestampLoaded) {
            try (Stream<LedgerEntry> entries = scan()) {
                lastTimestamp = entries.map(LedgerEntry::timestamp)
                        .reduce((a, b) -> b.isAfter(a) ? b : a)
                        .orElse(null);
            }
            lastTimestampLoaded = true;
        }
        if (lastTimestamp != null && entry.timestamp().isBefore(lastTimestamp)) {
            log.warn("Clock moved backwards, clamping ledger timestamp. given={}, last={}", entry.timestamp(), lastTimestamp);
            return entry.toBuilder().timestamp(lastTimestamp).build();
        }
        return entry;
    }

    private boolean endsWithLineTerminator() throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return endsWithLineTerminator(channel);
        }
    }

    private static boolean endsWithLineTerminator(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return true;
        }
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    /**
     * Cuts off a trailing fragment without a line terminator unless it is a complete record.
     */
    private void repairTornTail(FileChannel channel) throws IOException {
        if (endsWithLineTerminator(channel)) {
            return;
        }
        long size = channel.size();
        long lineStart = size - 1;
        ByteBuffer single = ByteBuffer.allocate(1);
        while (lineStart > 0) {
            single.clear();
            channel.read(single, lineStart - 1);
            if (single.get(0) == '\n') {
                break;
            }
            lineStart--;
        }
        ByteBuffer fragment = ByteBuffer.allocate((int) (size - lineStart));
        channel.read(fragment, lineStart);
        String line = new String(fragment.array(), StandardCharsets.UTF_8);
        if (lineStart > 0 && isCompleteRecord(line)) {
            channel.write(ByteBuffer.wrap(new byte[]{'\n'}), size);
            return;
        }
        log.warn("Discarding torn trailing ledger record. path={}, fragment={}", path, line);
        channel.truncate(lineStart);
    }

    private boolean isCompleteRecord(String line) {
        try {
            parseLine(line, headerColumns(readHeaderLine()));
            return true;
        } catch (RuntimeException | IOException e) {
            return false;
        }
    }

    private String readHeaderLine() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            return header == null ? "" : header;
        }
    }

    private static Map<String, Integer> headerColumns(String headerLine) throws IOException {
        List<CSVRecord> records;
        try (CSVParser parser = CSVParser.parse(headerLine, FORMAT)) {
            records = parser.getRecords();
        }
        Map<String, Integer> columns = new HashMap<>();
        if (!records.isEmpty()) {
            CSVRecord header = records.get(0);
            for (int i = 0; i < header.size(); i++) {
                columns.put(header.get(i).trim().toLowerCase(Locale.ROOT), i);
            }
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new LedgerIOException("Ledger header is missing column '" + required + "': " + headerLine);
            }
        }
        return columns;
    }

    private LedgerEntry parseLine(String line, Map<String, Integer> columns) {
        List<CSVRecord> records;
        try (CSVParser parser = CSVParser.parse(line, FORMAT)) {
            records = parser.getRecords();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (records.size() != 1 || records.get(0).size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " columns");
        }
        CSVRecord record = records.get(0);
        TrafficCategory category = TrafficCategory.fromCode(column(record, columns, "type"));
        return LedgerEntry.builder()
                .timestamp(parseTimestamp(column(record, columns, "timestamp")))
                .recipientKey(column(record, columns, "email").trim().toLowerCase(Locale.ROOT))
                .status(SendStatus.fromCode(column(record, columns, "status")))
                .category(category)
                .sequence(category == TrafficCategory.FOLLOW_UP ? parseSequence(column(record, columns, "followup_sequence")) : null)
                .subject(column(record, columns, "subject"))
                .firstName(column(record, columns, "first_name"))
                .lastName(column(record, columns, "last_name"))
                .organization(column(record, columns, "organization"))
                .templateUsed(column(record, columns, "template_used"))
                .build();
    }

    private static String column(CSVRecord record, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        return index == null ? "" : record.get(index);
    }

    private OffsetDateTime parseTimestamp(String value) {
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(zone).toOffsetDateTime();
        }
    }

    // Legacy follow-up rows may carry an empty sequence.
    private static Integer parseSequence(String value) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        return Integer.parseInt(value.trim());
    }

    private static List<String> toColumns(LedgerEntry entry) {
        return List.of(
                entry.timestamp().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                sanitize(entry.recipientKey()),
                sanitize(entry.subject()),
                entry.status().code(),
                entry.category().code(),
                sanitize(entry.firstName()),
                sanitize(entry.lastName()),
                sanitize(entry.organization()),
                sanitize(entry.templateUsed()),
                entry.sequence() == null ? "" : Integer.toString(entry.sequence()));
    }

    // One record per line.
    private static String sanitize(String value) {
        return value == null ? "" : value.replace('\r', ' ').replace('\n', ' ');
    }

    private static void printRecord(StringBuilder out, List<String> values) throws IOException {
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            printer.printRecord(values);
        }
    }

    private static void closeQuietly(AutoCloseable closeable, Exception primary) {
        try {
            closeable.close();
        } catch (Exception e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                log.warn("Failed to close ledger resource", e);
            }
        }
    }

    private final class EntryIterator implements Iterator<LedgerEntry> {

        private final BufferedReader reader;
        private final Map<String, Integer> columns;
        private final boolean tornTail;
        private String pendingLine;
        private long lineNumber = 1;
        private LedgerEntry next;
        private boolean finished;

        /**
         * @param tornTail whether the file ends without a line terminator; only then may the last record be skipped
         */
        private EntryIterator(BufferedReader reader, Map<String, Integer> columns, boolean tornTail) throws IOException {
            this.reader = reader;
            this.columns = columns;
            this.tornTail = tornTail;
            this.pendingLine = reader.readLine();
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                while (pendingLine != null) {
                    String line = pendingLine;
                    pendingLine = reader.readLine();
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        next = parseLine(line, columns);
                        return true;
                    } catch (RuntimeException e) {
                        if (pendingLine == null && tornTail) {
                            log.warn("Skipping torn trailing ledger record. path={}, line={}, reason={}",
                                    path, lineNumber, e.getMessage());
                            break;
                        }
                        throw new LedgerIOException("Malformed ledger record at " + path + ":" + lineNumber
                                + " (" + e.getMessage() + ")", e);
                    }
                }
            } catch (IOException e) {
                throw new LedgerIOException("Failed to read ledger " + path + ": " + e.getMessage(), e);
            }
            finished = true;
            return false;
        }

        @Override
        public LedgerEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LedgerEntry current = next;
            next = null;
            return current;
        }

        void close() {
            try {
                reader.close();
            } catch (IOException e) {
                throw new LedgerIOException("Failed to close ledger " + path, e);
            }
        }
    }
}
