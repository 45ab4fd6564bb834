package com.tokenexchange.rollup.journal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only journal of batch payloads in a memory-mapped file.
 *
 * Record format: [1-byte marker][4-byte length (big-endian)][payload bytes].
 * The first slot without a marker ends the journal, so reopening an existing file
 * continues after the last record. flush() calls MappedByteBuffer.force() and is
 * deferred to endOfBatch events from the Disruptor.
 *
 * No rotation or compaction: once full, appends are dropped with a warning.
 */
public class InputJournal {

    private static final Logger logger = LoggerFactory.getLogger(InputJournal.class);

    static final String FILE_NAME = "journal.dat";
    private static final byte RECORD_MARKER = 0x4A;
    private static final int HEADER_SIZE = 1 + Integer.BYTES;

    private final MappedByteBuffer buffer;
    private final RandomAccessFile raf;
    private final int capacity;
    private int position;
    private int records;
    private boolean full;

    public InputJournal(String path, int sizeMb) throws IOException {
        this.capacity = sizeMb * 1024 * 1024;

        Path dirPath = Path.of(path);
        Files.createDirectories(dirPath);

        Path filePath = dirPath.resolve(FILE_NAME);
        logger.info("Opening input journal at {} with size {} MB", filePath, sizeMb);

        this.raf = new RandomAccessFile(filePath.toFile(), "rw");
        if (raf.length() < capacity) {
            this.raf.setLength(capacity);
        }
        FileChannel channel = this.raf.getChannel();
        this.buffer = channel.map(FileChannel.MapMode.READ_WRITE, 0, capacity);

        this.position = 0;
        this.records = 0;
        scanToEnd();
        if (records > 0) {
            logger.info("Input journal resumed after {} records ({} bytes)", records, position);
        }
    }

    /**
     * Append a payload. Does NOT call force(), that is deferred to flush().
     *
     * @return false when the journal is full
     */
    public boolean append(byte[] payload) {
        if (full) {
            return false;
        }

        int recordSize = HEADER_SIZE + payload.length;
        if (position + recordSize > capacity) {
            logger.warn("Input journal is full. Position: {}, capacity: {}, record size: {}. "
                    + "Stopping journal appends.", position, capacity, recordSize);
            full = true;
            return false;
        }

        // payload and length first, the marker commits the record
        buffer.putInt(position + 1, payload.length);
        buffer.put(position + HEADER_SIZE, payload, 0, payload.length);
        buffer.put(position, RECORD_MARKER);
        position += recordSize;
        records++;
        return true;
    }

    /**
     * All journaled payloads in append order.
     */
    public List<byte[]> replay() {
        List<byte[]> payloads = new ArrayList<>(records);
        int offset = 0;
        while (offset < position) {
            int length = buffer.getInt(offset + 1);
            byte[] payload = new byte[length];
            buffer.get(offset + HEADER_SIZE, payload, 0, length);
            payloads.add(payload);
            offset += HEADER_SIZE + length;
        }
        return payloads;
    }

    public void flush() {
        buffer.force();
    }

    public void close() {
        flush();
        try {
            raf.close();
        } catch (IOException e) {
            logger.warn("Failed to close journal file: {}", e.getMessage());
        }
        logger.info("Input journal closed. {} records, {} bytes written", records, position);
    }

    private void scanToEnd() {
        while (position + HEADER_SIZE <= capacity && buffer.get(position) == RECORD_MARKER) {
            int length = buffer.getInt(position + 1);
            if (length < 0 || position + HEADER_SIZE + length > capacity) {
                logger.warn("Corrupt journal record at byte {}, ignoring the rest", position);
                break;
            }
            position += HEADER_SIZE + length;
            records++;
        }
    }

    public int getPosition() {
        return position;
    }

    public int getRecordCount() {
        return records;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isFull() {
        return full;
    }
}
