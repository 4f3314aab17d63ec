package com.timeBank.controller;

import com.timeBank.config.SecurityConfig;
import com.timeBank.dto.TaskCreateDTO;
import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.exception.ErrorCode;
import com.timeBank.exception.ForbiddenException;
import com.timeBank.exception.ResourceNotFoundException;
import com.timeBank.exception.ServiceException;
import com.timeBank.exception.TaskRuleException;
import com.timeBank.exception.UnauthenticatedException;
import com.timeBank.model.Task;
import com.timeBank.model.User;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import com.timeBank.security.IdentityResolver;
import com.timeBank.service.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@Import(SecurityConfig.class)
class TaskControllerTest {

    private static final String ALICE_TOKEN = "Bearer token-alice";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaskService taskService;

    @MockBean
    private IdentityResolver identityResolver;

    private final User alice = User.builder().id("alice").email("alice@example.com").timeCredits(60).build();

    private Task sampleTask() {
        return Task.builder()
                .id("t1")
                .title("Carry groceries")
                .description("Third floor, no lift")
                .duration(20)
                .creditsOffered(10)
                .taskType(TaskType.OFFER)
                .skillsRequired(List.of("lifting", "stairs"))
                .location("Elm Park")
                .createdBy("alice")
                .status(TaskStatus.OPEN)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @BeforeEach
    void authenticateAlice() {
        when(identityResolver.resolve("token-alice")).thenReturn(alice);
    }

    @Test
    void shouldRejectTaskCreationWithoutToken() throws Exception {
        mockMvc.perform(post("/api/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"));

        verifyNoInteractions(taskService);
    }

    @Test
    void shouldRejectInvalidToken() throws Exception {
        when(identityResolver.resolve("forged")).thenThrow(new UnauthenticatedException("Could not validate credentials"));

        mockMvc.perform(get("/api/tasks/my").header("Authorization", "Bearer forged"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"))
            .andExpect(jsonPath("$.message").value("Could not validate credentials"));
    }

    @Test
    void shouldListOpenTasksWithoutToken() throws Exception {
        when(taskService.listTasks(null, null, "open")).thenReturn(List.of(sampleTask()));

        mockMvc.perform(get("/api/tasks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("t1"))
            .andExpect(jsonPath("$[0].credits_offered").value(10))
            .andExpect(jsonPath("$[0].task_type").value("offer"))
            .andExpect(jsonPath("$[0].status").value("open"))
            .andExpect(jsonPath("$[0].skills_required[1]").value("stairs"))
            .andExpect(jsonPath("$[0].created_by").value("alice"))
            .andExpect(jsonPath("$[0].created_at").value("2024-05-01T10:00:00Z"));
    }

    @Test
    void shouldIgnoreCredentialsOnPublicListing() throws Exception {
        when(taskService.listTasks("park", "request", "open")).thenReturn(List.of());

        mockMvc.perform(get("/api/tasks")
                .param("location", "park")
                .param("task_type", "request")
                .header("Authorization", "Bearer garbage"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());

        verify(identityResolver, never()).resolve("garbage");
    }

    @Test
    void shouldReturnEmptyListForStatusNoTaskCanHave() throws Exception {
        when(taskService.listTasks(null, null, "cancelled")).thenReturn(List.of());

        mockMvc.perform(get("/api/tasks").param("status", "cancelled"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void shouldCreateTaskForCaller() throws Exception {
        when(taskService.createTask(any(TaskCreateDTO.class), eq(alice))).thenReturn(sampleTask());

        mockMvc.perform(post("/api/tasks")
                .header("Authorization", ALICE_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"title": "Carry groceries", "description": "Third floor, no lift",
                         "duration": 20, "credits_offered": 10, "task_type": "offer",
                         "skills_required": ["lifting", "stairs"], "location": "Elm Park"}
                        """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("t1"))
            .andExpect(jsonPath("$.assigned_to").doesNotExist());

        ArgumentCaptor<TaskCreateDTO> body = ArgumentCaptor.forClass(TaskCreateDTO.class);
        verify(taskService).createTask(body.capture(), eq(alice));
        assertEquals(10, body.getValue().getCreditsOffered());
        assertEquals(TaskType.OFFER, body.getValue().getTaskType());
        assertEquals(List.of("lifting", "stairs"), body.getValue().getSkillsRequired());
    }

    @Test
    void shouldReportLifecycleViolationAsBadRequest() throws Exception {
        when(taskService.createTask(any(TaskCreateDTO.class), eq(alice)))
                .thenThrow(new TaskRuleException(ErrorCode.INVALID_DURATION, "Duration must be between 15-60 minutes"));

        mockMvc.perform(post("/api/tasks")
                .header("Authorization", ALICE_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"title": "Quick chat", "description": "", "duration": 5,
                         "credits_offered": 1, "task_type": "offer", "location": "Online"}
                        """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.error").value("INVALID_DURATION"))
            .andExpect(jsonPath("$.message").value("Duration must be between 15-60 minutes"));
    }

    @Test
    void shouldRejectCreationWithMissingFields() throws Exception {
        mockMvc.perform(post("/api/tasks")
                .header("Authorization", ALICE_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"duration\": 30}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(taskService);
    }

    @Test
    void shouldReportUnavailableTaskOnAssign() throws Exception {
        when(taskService.assignTask("t1", alice))
                .thenThrow(new TaskRuleException(ErrorCode.NOT_AVAILABLE, "Task is not available"));

        mockMvc.perform(post("/api/tasks/t1/assign").header("Authorization", ALICE_TOKEN))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("NOT_AVAILABLE"));
    }

    @Test
    void shouldForbidUpdateByOutsider() throws Exception {
        when(taskService.updateTask(eq("t1"), any(TaskUpdateDTO.class), eq(alice)))
                .thenThrow(new ForbiddenException("Not authorized to update this task"));

        mockMvc.perform(put("/api/tasks/t1")
                .header("Authorization", ALICE_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"after_photo\": \"after.jpg\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void shouldPassPartialUpdateThrough() throws Exception {
        Task updated = sampleTask();
        updated.setBeforePhoto("before.jpg");
        when(taskService.updateTask(eq("t1"), any(TaskUpdateDTO.class), eq(alice))).thenReturn(updated);

        mockMvc.perform(put("/api/tasks/t1")
                .header("Authorization", ALICE_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"before_photo\": \"before.jpg\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.before_photo").value("before.jpg"));

        ArgumentCaptor<TaskUpdateDTO> body = ArgumentCaptor.forClass(TaskUpdateDTO.class);
        verify(taskService).updateTask(eq("t1"), body.capture(), eq(alice));
        assertEquals("before.jpg", body.getValue().getBeforePhoto());
        assertNull(body.getValue().getAfterPhoto());
        assertNull(body.getValue().getStatus());
    }

    @Test
    void shouldReturnValidationOutcome() throws Exception {
        when(taskService.validateTask("t1", alice))
                .thenReturn(new ValidationResult(true, 95, "Task appears complete (mock response)."));

        mockMvc.perform(post("/api/tasks/t1/validate").header("Authorization", ALICE_TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.validation_result.valid").value(true))
            .andExpect(jsonPath("$.validation_result.confidence").value(95))
            .andExpect(jsonPath("$.validation_result.reason").value("Task appears complete (mock response)."));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        when(taskService.getTask("nope")).thenThrow(new ResourceNotFoundException("Task", "nope"));

        mockMvc.perform(get("/api/tasks/nope").header("Authorization", ALICE_TOKEN))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void shouldListCallersTasks() throws Exception {
        when(taskService.listMyTasks(alice)).thenReturn(List.of(sampleTask()));

        mockMvc.perform(get("/api/tasks/my").header("Authorization", ALICE_TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("t1"));
    }

    @Test
    void shouldForwardUpstreamFailureMessage() throws Exception {
        when(taskService.listMyTasks(alice))
                .thenThrow(new ServiceException("Cannot get tasks of user", new RuntimeException("UNAVAILABLE")));

        mockMvc.perform(get("/api/tasks/my").header("Authorization", ALICE_TOKEN))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("UPSTREAM_FAILURE"))
            .andExpect(jsonPath("$.message").value("Cannot get tasks of user: UNAVAILABLE"));
    }
}
