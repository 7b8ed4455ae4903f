package com.fotofun.history;

import com.fotofun.eventmodel.Event;

import java.util.List;

/**
 * Read-only view of the undo/redo position.
 *
 * @param canUndo        whether {@link HistoryStore#undo()} would change anything
 * @param canRedo        whether {@link HistoryStore#redo()} would change anything
 * @param undoStack      undoable events, oldest first
 * @param redoStack      undone events, the next one to redo last
 * @param currentEventId id of the newest undoable event, or {@code null}
 * @param totalEvents    user actions recorded since the last clear
 */
public record HistoryState(
        boolean canUndo,
        boolean canRedo,
        List<Event> undoStack,
        List<Event> redoStack,
        String currentEventId,
        int totalEvents) {

    public HistoryState {
        undoStack = List.copyOf(undoStack);
        redoStack = List.copyOf(redoStack);
    }

    static HistoryState empty() {
        return new HistoryState(false, false, List.of(), List.of(), null, 0);
    }
}
