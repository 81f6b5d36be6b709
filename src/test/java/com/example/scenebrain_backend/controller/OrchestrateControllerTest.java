package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.OperationClass;
import com.example.scenebrain_backend.orchestrator.OrchestrationResult;
import com.example.scenebrain_backend.orchestrator.OrchestrationService;
import com.example.scenebrain_backend.orchestrator.ProgressEventType;
import com.example.scenebrain_backend.orchestrator.ProgressStream;
import com.example.scenebrain_backend.orchestrator.ProgressStreamRegistry;
import com.example.scenebrain_backend.orchestrator.RunStatus;
import com.example.scenebrain_backend.sync.ScenePayload;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = OrchestrateController.class)
@AutoConfigureMockMvc(addFilters = false)
class OrchestrateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestrationService orchestrationService;

    @MockitoBean
    private ProgressStreamRegistry streams;

    @Test
    void orchestrateReturnsResultWithScenes() throws Exception {
        UUID projectId = UUID.randomUUID();
        UUID sceneId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        VersionedArtifact artifact = new VersionedArtifact(sceneId,
                ScenePayload.create(projectId, "Intro", "<Intro/>", 90, null), 3L);
        when(orchestrationService.orchestrate(any(OrchestrationRequest.class))).thenReturn(new OrchestrationResult(runId,
                RunStatus.SUCCEEDED, OperationClass.TRIVIAL, List.of("edit"), List.of(artifact), "colour change",
                null, null, null, false));

        mockMvc.perform(post("/v1/projects/" + projectId + "/orchestrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"u1","prompt":"change the text color to blue","targetEntityId":"%s",
                                 "history":[{"role":"USER","content":"hi"}]}
                                """.formatted(sceneId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.operationClass").value("TRIVIAL"))
                .andExpect(jsonPath("$.tools[0]").value("edit"))
                .andExpect(jsonPath("$.scenes[0].entityId").value(sceneId.toString()))
                .andExpect(jsonPath("$.scenes[0].versionToken").value(3));

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(orchestrationService).orchestrate(captor.capture());
        assertThat(captor.getValue().projectId()).isEqualTo(projectId);
        assertThat(captor.getValue().targetEntityId()).isEqualTo(sceneId);
        assertThat(captor.getValue().priorUserTurns()).isEqualTo(1);
    }

    @Test
    void blankPromptIsRejected() throws Exception {
        mockMvc.perform(post("/v1/projects/" + UUID.randomUUID() + "/orchestrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(orchestrationService);
    }

    @Test
    void startReturnsRunLinks() throws Exception {
        UUID runId = UUID.randomUUID();
        when(orchestrationService.start(any(OrchestrationRequest.class))).thenReturn(runId);

        mockMvc.perform(post("/v1/projects/" + UUID.randomUUID() + "/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"create an intro\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value(runId.toString()))
                .andExpect(jsonPath("$.poll").value("/v1/runs/" + runId));
    }

    @Test
    void pollReturnsEventsAfterSequence() throws Exception {
        UUID runId = UUID.randomUUID();
        ProgressStream stream = new ProgressStream(runId, Clock.systemUTC(), null, 16);
        stream.emit(ProgressEventType.STARTED, "Run started");
        stream.emit(ProgressEventType.CONTEXT_READY, "Context ready");
        stream.emit(ProgressEventType.DONE, "Done");
        when(streams.find(runId)).thenReturn(Optional.of(stream));

        mockMvc.perform(get("/v1/runs/" + runId).param("after", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finished").value(true))
                .andExpect(jsonPath("$.events.length()").value(2))
                .andExpect(jsonPath("$.events[1].type").value("DONE"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(streams.find(runId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/runs/" + runId))
                .andExpect(status().isNotFound());
    }
}
