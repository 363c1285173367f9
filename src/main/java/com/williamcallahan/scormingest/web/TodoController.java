package com.williamcallahan.scormingest.web;

import com.williamcallahan.scormingest.domain.todo.Todo;
import com.williamcallahan.scormingest.service.todo.TodoNotFoundException;
import com.williamcallahan.scormingest.service.todo.TodoService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/todos")
public class TodoController {

    private final TodoService todoService;
    private final ExceptionResponseBuilder exceptionBuilder;

    public TodoController(TodoService todoService, ExceptionResponseBuilder exceptionBuilder) {
        this.todoService = todoService;
        this.exceptionBuilder = exceptionBuilder;
    }

    @GetMapping
    public List<Todo> list() {
        return todoService.findAll();
    }

    @GetMapping("/{id}")
    public Todo get(@PathVariable("id") long id) {
        return todoService.findById(id).orElseThrow(() -> new TodoNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<Todo> create(@Valid @RequestBody TodoCreateRequest request) {
        boolean completed = Boolean.TRUE.equals(request.completed());
        return ResponseEntity.status(HttpStatus.CREATED).body(todoService.create(request.title(), completed));
    }

    /**
     * Updates the supplied fields. An unknown id is reported before a missing body.
     */
    @PutMapping("/{id}")
    public ResponseEntity<?> update(
            @PathVariable("id") long id, @Valid @RequestBody(required = false) TodoUpdateRequest request) {
        if (todoService.findById(id).isEmpty()) {
            throw new TodoNotFoundException(id);
        }
        if (request == null) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "No data provided");
        }
        return ResponseEntity.ok(todoService.update(id, request.title(), request.completed()));
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable("id") long id) {
        todoService.delete(id);
        return Map.of("result", true);
    }
}
