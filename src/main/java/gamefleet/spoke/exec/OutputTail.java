package gamefleet.spoke.exec;

/**
 * Keeps the last {@code capacity} characters of process output.
 */
final class OutputTail {

    private final int capacity;
    private final StringBuilder buffer = new StringBuilder();
    private boolean truncated;

    OutputTail(int capacity) {
        this.capacity = capacity;
    }

    synchronized void appendLine(String line) {
        buffer.append(line).append('\n');
        int overflow = buffer.length() - capacity;
        if (overflow > 0) {
            buffer.delete(0, overflow);
            truncated = true;
        }
    }

    synchronized boolean truncated() {
        return truncated;
    }

    @Override
    public synchronized String toString() {
        return buffer.toString();
    }
}
