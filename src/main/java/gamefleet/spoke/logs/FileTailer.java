package gamefleet.spoke.logs;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental reader of a growing text file. A file that shrinks is treated as
 * rotated or truncated and read again from the start. Not thread-safe.
 */
final class FileTailer {

    private static final int BACKLOG_BYTES = 256 * 1024;
    private static final int READ_CHUNK = 64 * 1024;

    private final Path file;
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
    private long position;

    FileTailer(Path file) {
        this.file = file;
    }

    /**
     * The last {@code count} complete lines. Following {@link #poll()} calls
     * return only what is written afterwards.
     */
    List<String> lastLines(int count) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - BACKLOG_BYTES);
            List<String> lines = new ArrayList<>();
            position = start;
            partial.reset();
            readFrom(channel, size, lines);
            if (start > 0 && !lines.isEmpty()) {
                // first line is cut
                lines.remove(0);
            }
            return count <= 0 ? List.of() : lines.subList(Math.max(0, lines.size() - count), lines.size());
        }
    }

    /**
     * Lines completed since the last call.
     */
    List<String> poll() throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            List<String> lines = new ArrayList<>();
            if (size < position) {
                position = 0;
                partial.reset();
            }
            if (size > position) {
                readFrom(channel, size, lines);
            }
            return lines;
        }
    }

    private void readFrom(FileChannel channel, long size, List<String> out) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
        while (position < size) {
            buffer.clear();
            int limit = (int) Math.min(READ_CHUNK, size - position);
            buffer.limit(limit);
            int read = channel.read(buffer, position);
            if (read <= 0) {
                break;
            }
            position += read;
            byte[] bytes = buffer.array();
            for (int i = 0; i < read; i++) {
                byte b = bytes[i];
                if (b == '\n') {
                    out.add(takeLine());
                } else {
                    partial.write(b);
                }
            }
        }
    }

    private String takeLine() {
        String line = partial.toString(StandardCharsets.UTF_8);
        partial.reset();
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
