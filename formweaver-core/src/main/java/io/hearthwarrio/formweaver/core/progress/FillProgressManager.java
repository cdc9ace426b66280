package io.hearthwarrio.formweaver.core.progress;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hearthwarrio.formweaver.core.FillLogSink;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Persists fill progress as JSON so an interrupted session can be resumed or audited.
 * <p>
 * Writes:
 * <ul>
 *   <li>row records are appended in memory and written by a single background writer, in order, without
 *       blocking the fill loop; a crash loses at most the write in flight</li>
 *   <li>status transitions (start, page turn, pause, resume, completion, abort) are written synchronously</li>
 * </ul>
 * Every write goes to a temporary file that is then moved over the target, so a file on disk is always complete.
 * Write failures are logged and do not interrupt the session.
 */
public final class FillProgressManager implements AutoCloseable {

    public static final Path DEFAULT_DIRECTORY = Paths.get(System.getProperty("user.home"), ".formweaver", "progress");

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String PREFIX = "progress_";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final FillLogSink log;
    private final ExecutorService writer;
    private final Object lock = new Object();
    private final Object fileLock = new Object();

    private FillProgress progress;
    private Path file;

    public FillProgressManager(Path directory, FillLogSink log) {
        this(directory, Clock.systemDefaultZone(), log);
    }

    public FillProgressManager(Path directory, Clock clock, FillLogSink log) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
        this.mapper = createMapper();
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "formweaver-progress-writer");
            t.setDaemon(true);
            return t;
        });
    }

    static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Starts a new progress file.
     *
     * @return path of the file that will hold this session
     */
    public Path startSession(String sourceId, int totalRows, String anchorField) {
        synchronized (lock) {
            Instant now = clock.instant();
            FillProgress p = new FillProgress();
            p.setSourceId(sourceId);
            p.setTotalRows(totalRows);
            p.setAnchorField(anchorField);
            p.setStatus(ProgressStatus.RUNNING);
            p.setStartedAt(now);
            p.setUpdatedAt(now);
            this.progress = p;
            this.file = newFile(now);
        }
        writeSnapshot();
        return file;
    }

    /**
     * Continues an existing progress file, typically one returned by {@link #load(Path)}.
     */
    public void resumeSession(FillProgress restored, Path restoredFile) {
        synchronized (lock) {
            this.progress = Objects.requireNonNull(restored, "restored must not be null");
            this.file = Objects.requireNonNull(restoredFile, "restoredFile must not be null");
            progress.setStatus(ProgressStatus.RUNNING);
            progress.setUpdatedAt(clock.instant());
        }
        writeSnapshot();
    }

    /**
     * Appends a row record and schedules a background write.
     *
     * @param cursor number of source rows handled so far
     */
    public Future<?> recordRow(FillRecord record, int cursor) {
        Objects.requireNonNull(record, "record must not be null");
        synchronized (lock) {
            requireSession();
            progress.getRecords().add(record);
            switch (record.getStatus()) {
                case SUCCESS:
                    progress.setFilledCount(progress.getFilledCount() + 1);
                    break;
                case FAILED:
                    progress.setFailedCount(progress.getFailedCount() + 1);
                    break;
                default:
                    progress.setSkippedCount(progress.getSkippedCount() + 1);
                    break;
            }
            progress.setCurrentRow(Math.max(progress.getCurrentRow(), cursor));
            progress.setUpdatedAt(clock.instant());
        }
        return writer.submit(this::writeSnapshot);
    }

    public void onPageTurn(int page) {
        synchronized (lock) {
            requireSession();
            progress.setCurrentPage(page);
            progress.setUpdatedAt(clock.instant());
        }
        writeSnapshot();
    }

    public void pause(int cursor) {
        transition(ProgressStatus.PAUSED, cursor);
    }

    public void resume() {
        transition(ProgressStatus.RUNNING, -1);
    }

    public void complete(int cursor) {
        transition(ProgressStatus.COMPLETED, cursor);
    }

    public void abort(int cursor) {
        transition(ProgressStatus.ABORTED, cursor);
    }

    private void transition(ProgressStatus status, int cursor) {
        synchronized (lock) {
            requireSession();
            progress.setStatus(status);
            if (cursor >= 0) {
                progress.setCurrentRow(cursor);
            }
            progress.setUpdatedAt(clock.instant());
        }
        writeSnapshot();
    }

    /**
     * Blocks until all queued writes are done.
     */
    public void flush() {
        try {
            writer.submit(() -> {
            }).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Interrupted while flushing progress");
        } catch (Exception e) {
            log.error("Progress flush failed: " + e.getMessage());
        }
    }

    public FillProgress load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        return mapper.readValue(path.toFile(), FillProgress.class);
    }

    /**
     * Progress files in the directory, newest first.
     */
    public List<Path> listSaved() throws IOException {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, PREFIX + "*" + SUFFIX)) {
            for (Path p : stream) {
                out.add(p);
            }
        }
        out.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return out;
    }

    /**
     * Latest progress file whose session can still be resumed.
     */
    public Optional<Path> findResumable() throws IOException {
        for (Path p : listSaved()) {
            try {
                if (load(p).isResumable()) {
                    return Optional.of(p);
                }
            } catch (IOException e) {
                log.warning("Unreadable progress file " + p.getFileName() + ": " + e.getMessage());
            }
        }
        return Optional.empty();
    }

    public FillProgress snapshot() {
        synchronized (lock) {
            requireSession();
            return progress.copy();
        }
    }

    public Path currentFile() {
        synchronized (lock) {
            return file;
        }
    }

    /**
     * One-line summary, e.g. {@code orders.xlsx: 12/40 rows, 11 filled, 1 failed, 0 skipped, page 2, RUNNING}.
     */
    public String summary() {
        FillProgress p = snapshot();
        return p.getSourceId() + ": " + p.getCurrentRow() + "/" + p.getTotalRows() + " rows, "
                + p.getFilledCount() + " filled, " + p.getFailedCount() + " failed, "
                + p.getSkippedCount() + " skipped, page " + p.getCurrentPage() + ", " + p.getStatus();
    }

    /**
     * @return the last {@code n} records, oldest first
     */
    public List<FillRecord> recentRecords(int n) {
        synchronized (lock) {
            requireSession();
            List<FillRecord> all = progress.getRecords();
            return List.copyOf(all.subList(Math.max(0, all.size() - Math.max(0, n)), all.size()));
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warning("Progress writer did not finish in time");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    private void writeSnapshot() {
        synchronized (fileLock) {
            FillProgress copy;
            Path target;
            synchronized (lock) {
                if (progress == null) {
                    return;
                }
                copy = progress.copy();
                target = file;
            }
            try {
                Files.createDirectories(directory);
                Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
                mapper.writeValue(tmp.toFile(), copy);
                try {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                log.error("Saving progress to " + target + " failed: " + e.getMessage());
            }
        }
    }

    private Path newFile(Instant now) {
        String stamp = FILE_STAMP.format(now.atZone(clock.getZone()));
        Path candidate = directory.resolve(PREFIX + stamp + SUFFIX);
        int n = 1;
        while (Files.exists(candidate)) {
            candidate = directory.resolve(PREFIX + stamp + "_" + n++ + SUFFIX);
        }
        return candidate;
    }

    private void requireSession() {
        if (progress == null) {
            throw new IllegalStateException("No progress session started");
        }
    }
}
