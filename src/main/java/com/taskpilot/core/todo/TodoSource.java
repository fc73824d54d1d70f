package com.taskpilot.core.todo;

import com.taskpilot.core.model.TodoItem;

import java.util.List;

/**
 * Ordered source of task descriptors. Only the orchestration loop thread calls it.
 */
public interface TodoSource {

    /** All items in source order, including done and skipped ones. */
    List<TodoItem> items();

    default List<TodoItem> pendingItems() {
        return items().stream().filter(TodoItem::isPending).toList();
    }

    void markDone(String text);

    void markSkipped(String text, String reason);

    void insertAtHead(String text);

    void insertAtTail(String text);

    /** Removes every pending item; done and skipped items stay for history. */
    int clearPending();

    /** Re-reads the backing store, discarding anything cached. */
    void reload();
}
