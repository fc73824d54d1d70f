package com.taskpilot.core.model;

/**
 * A task descriptor read from the TODO source.
 *
 * @param text    task text, unique within the source
 * @param done    whether the source already marks it done
 * @param skipped whether the source marks it skipped
 * @param comment optional trailing comment, may be null
 */
public record TodoItem(
    String text,
    boolean done,
    boolean skipped,
    String comment
) {

    public static TodoItem pending(String text) {
        return new TodoItem(text, false, false, null);
    }

    public boolean isPending() {
        return !done && !skipped;
    }
}
