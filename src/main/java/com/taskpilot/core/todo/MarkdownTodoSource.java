package com.taskpilot.core.todo;

import com.taskpilot.core.lifecycle.OwnWriteTracker;
import com.taskpilot.core.model.TodoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link TodoSource} over a Markdown checklist.
 *
 * <pre>
 * - [ ] pending task
 * - [x] done task
 * - [~] skipped task &lt;!-- reason --&gt;
 * </pre>
 *
 * Lines that are not checklist items are kept verbatim when the file is rewritten.
 * Every mutation re-reads the file first, so edits made since the last read survive.
 */
public class MarkdownTodoSource implements TodoSource, OwnWriteTracker {

    private static final Logger log = LoggerFactory.getLogger(MarkdownTodoSource.class);

    private static final Pattern ITEM = Pattern.compile(
            "^(\\s*)[-*] \\[([ xX~])\\]\\s*(.+?)\\s*(?:<!--\\s*(.*?)\\s*-->)?\\s*$");

    private final Path file;
    private final List<Line> lines = new ArrayList<>();
    private volatile String lastWritten;

    public MarkdownTodoSource(Path file) {
        this.file = file;
        reload();
    }

    public Path file() {
        return file;
    }

    @Override
    public boolean isOwnWrite(Path changed) {
        String written = lastWritten;
        if (written == null || !changed.toAbsolutePath().normalize().equals(file.toAbsolutePath().normalize())) {
            return false;
        }
        try {
            return Files.exists(changed) && Files.readString(changed, StandardCharsets.UTF_8).equals(written);
        } catch (IOException e) {
            log.debug("Cannot read {} to compare with last write: {}", changed, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized List<TodoItem> items() {
        return lines.stream().filter(l -> l.item != null).map(l -> l.item).toList();
    }

    @Override
    public synchronized void markDone(String text) {
        reload();
        replace(text, new TodoItem(text, true, false, null));
    }

    @Override
    public synchronized void markSkipped(String text, String reason) {
        reload();
        replace(text, new TodoItem(text, false, true, reason));
    }

    @Override
    public synchronized void insertAtHead(String text) {
        reload();
        int firstItem = 0;
        while (firstItem < lines.size() && lines.get(firstItem).item == null) {
            firstItem++;
        }
        if (firstItem == lines.size()) {
            appendItem(text);
            return;
        }
        lines.add(firstItem, Line.of(TodoItem.pending(text), lines.get(firstItem).indent));
        save();
    }

    @Override
    public synchronized void insertAtTail(String text) {
        reload();
        appendItem(text);
    }

    private void appendItem(String text) {
        int lastItem = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).item != null) {
                lastItem = i;
            }
        }
        int at = lastItem < 0 ? lines.size() : lastItem + 1;
        lines.add(at, Line.of(TodoItem.pending(text), ""));
        save();
    }

    @Override
    public synchronized int clearPending() {
        reload();
        int before = lines.size();
        lines.removeIf(l -> l.item != null && l.item.isPending());
        int removed = before - lines.size();
        if (removed > 0) {
            save();
        }
        return removed;
    }

    @Override
    public synchronized void reload() {
        lines.clear();
        if (!Files.exists(file)) {
            log.info("TODO file {} does not exist yet", file);
            return;
        }
        try {
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lines.add(parse(raw));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read TODO file " + file, e);
        }
        log.debug("Loaded {} TODO items from {}", items().size(), file);
    }

    private void replace(String text, TodoItem updated) {
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.item != null && line.item.text().equals(text)) {
                lines.set(i, Line.of(updated, line.indent));
                save();
                return;
            }
        }
        log.warn("TODO item not found, cannot update: {}", text);
    }

    static Line parse(String raw) {
        Matcher m = ITEM.matcher(raw);
        if (!m.matches()) {
            return new Line(raw, "", null);
        }
        String mark = m.group(2);
        boolean done = mark.equalsIgnoreCase("x");
        boolean skipped = mark.equals("~");
        return new Line(raw, m.group(1), new TodoItem(m.group(3), done, skipped, m.group(4)));
    }

    static String render(TodoItem item, String indent) {
        String mark = item.done() ? "x" : item.skipped() ? "~" : " ";
        String comment = item.comment() == null || item.comment().isBlank()
                ? ""
                : " <!-- " + item.comment().replace("-->", "") + " -->";
        return indent + "- [" + mark + "] " + item.text() + comment;
    }

    private void save() {
        String content = lines.stream().map(l -> l.raw + System.lineSeparator()).reduce("", String::concat);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            lastWritten = content;
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write TODO file " + file, e);
        }
    }

    record Line(String raw, String indent, TodoItem item) {
        static Line of(TodoItem item, String indent) {
            return new Line(render(item, indent), indent, item);
        }
    }
}
