package com.example.sandstormtracker.tail;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.zip.CRC32;

/**
 * File identity tokens and position checksums.
 */
public final class FileIdentities {

    /**
     * Number of bytes before a cursor position covered by its checksum.
     */
    static final int CHECKSUM_WINDOW = 64;

    private FileIdentities() {
    }

    /**
     * The OS file key (device and inode on Unix) or, where the file system has none,
     * the creation time.
     */
    public static String of(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        Object key = attributes.fileKey();
        if (key != null) {
            return key.toString();
        }
        return "ctime:" + attributes.creationTime().toMillis();
    }

    /**
     * CRC32 of up to {@link #CHECKSUM_WINDOW} bytes ending at {@code offset}.
     * Returns 0 for offset 0.
     */
    public static long checksumBefore(Path path, long offset) throws IOException {
        if (offset <= 0) {
            return 0L;
        }
        long from = Math.max(0, offset - CHECKSUM_WINDOW);
        ByteBuffer buffer = ByteBuffer.allocate((int) (offset - from));
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long position = from;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
        }
        CRC32 crc = new CRC32();
        crc.update(buffer.array(), 0, buffer.position());
        return crc.getValue();
    }
}
