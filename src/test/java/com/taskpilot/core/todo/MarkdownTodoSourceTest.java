package com.taskpilot.core.todo;

import com.taskpilot.core.model.TodoItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownTodoSourceTest {

    @TempDir
    Path tempDir;

    private Path todo(String content) throws IOException {
        Path file = tempDir.resolve("TODO.md");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("parses pending, done and skipped items and keeps other lines")
    void parsesChecklist() throws IOException {
        var source = new MarkdownTodoSource(todo("""
                # Backlog

                - [ ] add feature A
                - [x] set up CI
                - [~] migrate DB <!-- blocked on access -->
                * [ ] write docs
                """));

        List<TodoItem> items = source.items();
        assertEquals(4, items.size());
        assertEquals(List.of("add feature A", "write docs"),
                source.pendingItems().stream().map(TodoItem::text).toList());
        assertTrue(items.get(1).done());
        assertTrue(items.get(2).skipped());
        assertEquals("blocked on access", items.get(2).comment());
    }

    @Test
    @DisplayName("marking done rewrites only that line")
    void markDone() throws IOException {
        Path file = todo("""
                # Backlog
                - [ ] add feature A
                - [ ] add feature B
                """);
        var source = new MarkdownTodoSource(file);

        source.markDone("add feature A");

        String content = Files.readString(file);
        assertTrue(content.startsWith("# Backlog"));
        assertTrue(content.contains("- [x] add feature A"));
        assertTrue(content.contains("- [ ] add feature B"));
    }

    @Test
    @DisplayName("skipped items carry the reason as a comment")
    void markSkipped() throws IOException {
        Path file = todo("- [ ] flaky task\n");
        var source = new MarkdownTodoSource(file);

        source.markSkipped("flaky task", "failed after 3 attempts");

        assertTrue(Files.readString(file).contains("- [~] flaky task <!-- failed after 3 attempts -->"));
        assertTrue(new MarkdownTodoSource(file).pendingItems().isEmpty());
    }

    @Test
    @DisplayName("insert at head goes before the first item, at tail after the last")
    void inserts() throws IOException {
        var source = new MarkdownTodoSource(todo("""
                # Backlog
                - [ ] middle
                
                Notes at the end.
                """));

        source.insertAtHead("first");
        source.insertAtTail("last");

        assertEquals(List.of("first", "middle", "last"), source.items().stream().map(TodoItem::text).toList());
        source.reload();
        assertEquals(List.of("first", "middle", "last"), source.items().stream().map(TodoItem::text).toList());
    }

    @Test
    @DisplayName("clear removes pending items only")
    void clearPending() throws IOException {
        var source = new MarkdownTodoSource(todo("""
                - [ ] a
                - [x] b
                - [ ] c
                """));

        assertEquals(2, source.clearPending());
        assertEquals(List.of("b"), source.items().stream().map(TodoItem::text).toList());
    }

    @Test
    @DisplayName("missing file reads as empty and is created on first insert")
    void missingFile() {
        Path file = tempDir.resolve("nested/TODO.md");
        var source = new MarkdownTodoSource(file);
        assertTrue(source.items().isEmpty());

        source.insertAtTail("bootstrap");

        assertTrue(Files.exists(file));
        assertEquals(1, source.pendingItems().size());
    }

    @Test
    @DisplayName("own writes are recognised until someone else edits the file")
    void ownWriteTracking() throws IOException {
        Path file = todo("- [ ] a\n");
        var source = new MarkdownTodoSource(file);
        assertFalse(source.isOwnWrite(file));

        source.markDone("a");
        assertTrue(source.isOwnWrite(file));

        Files.writeString(file, "- [x] a\n- [ ] b\n");
        assertFalse(source.isOwnWrite(file));
        assertFalse(source.isOwnWrite(tempDir.resolve("other.md")));
    }

    @Test
    @DisplayName("external edits made after the last read survive every mutation")
    void externalEditsSurviveMutations() throws IOException {
        Path file = todo("- [ ] a\n- [ ] b\n");
        var source = new MarkdownTodoSource(file);

        Files.writeString(file, "- [ ] a\n- [ ] b\n- [ ] c added by hand\n");
        source.markDone("a");
        Files.writeString(file, Files.readString(file) + "- [ ] d added by hand\n");
        source.markSkipped("b", "not needed");
        Files.writeString(file, Files.readString(file) + "- [ ] e added by hand\n");
        source.insertAtHead("urgent");

        String content = Files.readString(file);
        assertTrue(content.contains("- [x] a"));
        assertTrue(content.contains("- [~] b <!-- not needed -->"));
        assertEquals(List.of("urgent", "c added by hand", "d added by hand", "e added by hand"),
                source.pendingItems().stream().map(TodoItem::text).toList());
    }
}
