package paylink.dal.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.JsonSupport;
import paylink.domain.transaction.TransactionRecord;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Append-only JSON-lines log of record versions.
 * The last version of an id wins when the log is replayed. Every append is forced to disk
 * before the call returns (unless fsync is disabled), {@link #compact()} rewrites the log
 * with one line per record.
 */
public class FileTransactionStore extends AbstractTransactionStore {
    private static final Logger logger = LoggerFactory.getLogger(FileTransactionStore.class);

    private final Gson gson = JsonSupport.compact();
    private final Path file;
    private final boolean fsync;
    private FileChannel channel;

    public FileTransactionStore(Path file, boolean fsync) {
        this.file = file;
        this.fsync = fsync;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            load();
            this.channel = openForAppend();
        } catch (IOException e) {
            throw new TransactionStoreException("Cannot open transaction log " + file, e);
        }
        logger.info("Transaction log {} opened, {} records ({} unresolved)",
                file.toAbsolutePath(), records.size(), findUnresolved().size());
    }

    private FileChannel openForAppend() throws IOException {
        return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void load() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        byte[] content = Files.readAllBytes(file);
        int start = 0;
        int lineNumber = 0;
        while (start < content.length) {
            int end = start;
            while (end < content.length && content[end] != '\n') {
                end++;
            }
            lineNumber++;
            String line = new String(content, start, end - start, StandardCharsets.UTF_8).trim();
            if (!line.isEmpty()) {
                try {
                    TransactionRecord record = parse(line);
                    records.put(record.id(), record);
                    if (end == content.length) {
                        // complete record whose newline never made it to disk
                        repairTail(content.length, true);
                    }
                } catch (JsonParseException e) {
                    if (!isBlankFrom(content, end)) {
                        throw new TransactionStoreException("Corrupt transaction log " + file + " at line " + lineNumber, e);
                    }
                    // torn write from a crash in the middle of an append
                    logger.warn("Truncating incomplete last line {} of {}: {}", lineNumber, file, e.getMessage());
                    repairTail(start, false);
                    return;
                }
            }
            start = end + 1;
        }
    }

    private TransactionRecord parse(String line) {
        TransactionRecord record = gson.fromJson(line, TransactionRecord.class);
        if (record == null || record.id() == null || record.state() == null) {
            throw new JsonParseException("record without id or state");
        }
        return record;
    }

    private static boolean isBlankFrom(byte[] content, int from) {
        for (int i = from; i < content.length; i++) {
            if (!Character.isWhitespace(content[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cut the log back to {@code length} bytes, or terminate its last line when {@code terminate} is set,
     * so the next append starts on a line of its own
     */
    private void repairTail(long length, boolean terminate) throws IOException {
        try (FileChannel out = FileChannel.open(file, StandardOpenOption.WRITE)) {
            if (terminate) {
                out.position(length);
                ByteBuffer newline = ByteBuffer.wrap(new byte[]{'\n'});
                while (newline.hasRemaining()) {
                    out.write(newline);
                }
            } else {
                out.truncate(length);
            }
            out.force(true);
        }
    }

    @Override
    protected void persist(TransactionRecord record) {
        if (channel == null) {
            throw new TransactionStoreException("Transaction log " + file + " is closed");
        }
        byte[] line = (gson.toJson(record) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsync) {
                channel.force(true);
            }
        } catch (IOException e) {
            throw new TransactionStoreException("Failed to append transaction " + record.id() + " to " + file, e);
        }
    }

    /**
     * Rewrite the log with only the latest version of every record
     */
    @Override
    public void compact() {
        lock.writeLock().lock();
        try {
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (FileChannel out = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                for (TransactionRecord record : records.values()) {
                    ByteBuffer buffer = ByteBuffer.wrap((gson.toJson(record) + "\n").getBytes(StandardCharsets.UTF_8));
                    while (buffer.hasRemaining()) {
                        out.write(buffer);
                    }
                }
                out.force(true);
            }
            if (channel != null) {
                channel.close();
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            channel = openForAppend();
            logger.info("Compacted transaction log {} to {} records", file, records.size());
        } catch (IOException e) {
            reopenAfterFailedCompaction();
            throw new TransactionStoreException("Failed to compact transaction log " + file, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void reopenAfterFailedCompaction() {
        if (channel != null && channel.isOpen()) {
            return;
        }
        try {
            channel = openForAppend();
        } catch (IOException e) {
            channel = null;
            logger.error("Transaction log {} could not be reopened, further writes will fail", file, e);
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (channel != null) {
                channel.close();
                channel = null;
                logger.info("Transaction log {} closed", file);
            }
        } catch (IOException e) {
            logger.warn("Error closing transaction log {}: {}", file, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
