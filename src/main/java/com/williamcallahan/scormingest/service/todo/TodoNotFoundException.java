package com.williamcallahan.scormingest.service.todo;

/**
 * Thrown when a todo id does not exist in the store.
 */
public class TodoNotFoundException extends RuntimeException {

    public TodoNotFoundException(long id) {
        super("Todo not found: " + id);
    }
}
