package com.williamcallahan.scormingest.domain.todo;

import java.util.Objects;

/**
 * A single todo entry.
 *
 * @param id store-assigned identifier
 * @param title todo text
 * @param completed whether the todo is done
 */
public record Todo(long id, String title, boolean completed) {

    public Todo {
        Objects.requireNonNull(title, "title");
    }

    public Todo withTitle(String newTitle) {
        return new Todo(id, newTitle, completed);
    }

    public Todo withCompleted(boolean newCompleted) {
        return new Todo(id, title, newCompleted);
    }
}
