package gamefleet.hub.logs;

/**
 * One console line, or a marker for lines dropped because a subscriber fell behind.
 *
 * @param text    line content, null for a gap marker
 * @param dropped number of lines lost before this point, 0 for a normal line
 */
public record LogLine(String text, long dropped) {

    public static LogLine of(String text) {
        return new LogLine(text, 0);
    }

    public static LogLine gap(long dropped) {
        return new LogLine(null, dropped);
    }

    public boolean isGap() {
        return dropped > 0;
    }
}
