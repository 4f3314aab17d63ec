package com.timeBank.controller;

import com.timeBank.dto.TaskCreateDTO;
import com.timeBank.dto.TaskResponseDTO;
import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.dto.ValidationResponseDTO;
import com.timeBank.model.Task;
import com.timeBank.model.User;
import com.timeBank.model.ValidationResult;
import com.timeBank.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
@Validated
public class TaskController {

    private final TaskService taskService;

    @PostMapping
    public ResponseEntity<TaskResponseDTO> createTask(
            @AuthenticationPrincipal User currentUser,
            @Valid @RequestBody TaskCreateDTO body) {
        Task task = taskService.createTask(body, currentUser);
        return ResponseEntity.ok(TaskResponseDTO.fromModel(task));
    }

    /** Public, no token needed */
    @GetMapping
    public ResponseEntity<List<TaskResponseDTO>> getTasks(
            @RequestParam(required = false) String location,
            @RequestParam(name = "task_type", required = false) String taskType,
            @RequestParam(defaultValue = "open") String status) {
        return ResponseEntity.ok(toDtos(taskService.listTasks(location, taskType, status)));
    }

    @GetMapping("/my")
    public ResponseEntity<List<TaskResponseDTO>> getMyTasks(@AuthenticationPrincipal User currentUser) {
        return ResponseEntity.ok(toDtos(taskService.listMyTasks(currentUser)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskResponseDTO> getTaskById(@PathVariable String id) {
        return ResponseEntity.ok(TaskResponseDTO.fromModel(taskService.getTask(id)));
    }

    @PostMapping("/{id}/assign")
    public ResponseEntity<TaskResponseDTO> assignTask(
            @AuthenticationPrincipal User currentUser,
            @PathVariable String id) {
        return ResponseEntity.ok(TaskResponseDTO.fromModel(taskService.assignTask(id, currentUser)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TaskResponseDTO> updateTask(
            @AuthenticationPrincipal User currentUser,
            @PathVariable String id,
            @RequestBody TaskUpdateDTO body) {
        return ResponseEntity.ok(TaskResponseDTO.fromModel(taskService.updateTask(id, body, currentUser)));
    }

    @PostMapping("/{id}/validate")
    public ResponseEntity<ValidationResponseDTO> validateTask(
            @AuthenticationPrincipal User currentUser,
            @PathVariable String id) {
        ValidationResult result = taskService.validateTask(id, currentUser);
        return ResponseEntity.ok(new ValidationResponseDTO(result));
    }

    private static List<TaskResponseDTO> toDtos(List<Task> tasks) {
        return tasks.stream()
                .map(TaskResponseDTO::fromModel)
                .collect(Collectors.toList());
    }
}
