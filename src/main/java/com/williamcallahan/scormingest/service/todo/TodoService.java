package com.williamcallahan.scormingest.service.todo;

import com.williamcallahan.scormingest.domain.todo.Todo;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory todo store. Contents are lost on restart.
 */
@Service
public class TodoService {
    private static final Logger log = LoggerFactory.getLogger(TodoService.class);

    private final List<Todo> todos = new ArrayList<>();

    public TodoService() {
        todos.add(new Todo(1, "Learn Flask", false));
        todos.add(new Todo(2, "Learn React", false));
        todos.add(new Todo(3, "Build Full-Stack App", false));
    }

    public synchronized List<Todo> findAll() {
        return List.copyOf(todos);
    }

    public synchronized Optional<Todo> findById(long id) {
        return todos.stream().filter(todo -> todo.id() == id).findFirst();
    }

    /**
     * Adds a todo with the next free id (highest existing id plus one).
     */
    public synchronized Todo create(String title, boolean completed) {
        Objects.requireNonNull(title, "title");
        long nextId = todos.stream().mapToLong(Todo::id).max().orElse(0L) + 1;
        Todo created = new Todo(nextId, title, completed);
        todos.add(created);
        log.debug("Created todo {}", nextId);
        return created;
    }

    /**
     * Applies the non-null fields to an existing todo.
     *
     * @throws TodoNotFoundException when no todo has the id
     */
    public synchronized Todo update(long id, String title, Boolean completed) {
        int index = indexOf(id);
        Todo updated = todos.get(index);
        if (title != null) {
            updated = updated.withTitle(title);
        }
        if (completed != null) {
            updated = updated.withCompleted(completed);
        }
        todos.set(index, updated);
        return updated;
    }

    /**
     * @throws TodoNotFoundException when no todo has the id
     */
    public synchronized void delete(long id) {
        todos.remove(indexOf(id));
        log.debug("Deleted todo {}", id);
    }

    private int indexOf(long id) {
        for (int index = 0; index < todos.size(); index++) {
            if (todos.get(index).id() == id) {
                return index;
            }
        }
        throw new TodoNotFoundException(id);
    }
}
