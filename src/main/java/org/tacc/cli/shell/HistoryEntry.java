package org.tacc.cli.shell;

/**
 * One compilation attempt in a shell session.
 *
 * @param status           Outcome of the attempt.
 * @param source           The compiled program text.
 * @param instructionCount Number of generated instructions; 0 for failures.
 * @param error            The error message; {@code null} for successes.
 */
public record HistoryEntry(Status status, String source, int instructionCount, String error) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    static HistoryEntry success(String source, int instructionCount) {
        return new HistoryEntry(Status.SUCCESS, source, instructionCount, null);
    }

    static HistoryEntry failure(String source, String error) {
        return new HistoryEntry(Status.FAILED, source, 0, error);
    }

    /**
     * @param maxLength Maximum number of source characters to show.
     * @return The source on one line, truncated with {@code ...} if longer than {@code maxLength}.
     */
    public String preview(int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        String flat = source.replaceAll("\\s+", " ").trim();
        return flat.length() <= maxLength ? flat : flat.substring(0, maxLength) + "...";
    }
}
