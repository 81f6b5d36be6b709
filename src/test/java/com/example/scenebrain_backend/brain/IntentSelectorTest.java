package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ContextTier;
import com.example.scenebrain_backend.context.EntitySummary;
import com.example.scenebrain_backend.context.PatternSummary;
import com.example.scenebrain_backend.llm.InvocationException;
import com.example.scenebrain_backend.llm.LlmMessage;
import com.example.scenebrain_backend.llm.ModelTier;
import com.example.scenebrain_backend.llm.SchemaRegistry;
import com.example.scenebrain_backend.llm.StructuredOutputService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentSelectorTest {

    @Mock
    private StructuredOutputService structuredOutput;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID projectId = UUID.randomUUID();
    private IntentSelector selector;

    @BeforeEach
    void setUp() {
        selector = new IntentSelector(structuredOutput, new ReferenceResolver(), new ComplexityHeuristics(),
                new CapabilityHeuristics(), objectMapper);
    }

    private void modelAnswers(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        when(structuredOutput.call(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), anyList())).thenReturn(node);
    }

    private static ContextBundle bundle(EntitySummary... scenes) {
        return new ContextBundle(ContextTier.STANDARD, null, List.of(scenes), Map.of(), List.of(), List.of(),
                PatternSummary.EMPTY, false);
    }

    private static EntitySummary scene(int number, String name) {
        return new EntitySummary(UUID.randomUUID(), number, name, 150, null, 1L, number);
    }

    @Test
    void colorChangeOnOnlySceneIsSurgicalEdit() throws Exception {
        EntitySummary only = scene(1, "Intro");
        modelAnswers("{\"steps\":[{\"action\":\"edit\",\"complexity\":\"surgical\"}],\"reasoning\":\"precise colour change\"}");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId, "change the text color to blue"), bundle(only));

        assertThat(plan.isMultiStep()).isFalse();
        assertThat(plan.first()).isInstanceOfSatisfying(ToolSelection.Edit.class, edit -> {
            assertThat(edit.targetEntityId()).isEqualTo(only.entityId());
            assertThat(edit.complexity()).isEqualTo(EditComplexity.SURGICAL);
            assertThat(edit.instruction()).isEqualTo("change the text color to blue");
        });
        assertThat(plan.reasoning()).isEqualTo("precise colour change");
    }

    @Test
    void redesignOfSelectedSceneIsStructuralEdit() throws Exception {
        EntitySummary first = scene(1, "Intro");
        EntitySummary second = scene(2, "Pricing");
        modelAnswers("{\"steps\":[{\"action\":\"edit\",\"complexity\":\"structural\"}]}");
        OrchestrationRequest request = OrchestrationRequest.of(projectId, "completely redesign this with a modern layout")
                .withTarget(second.entityId());

        ToolPlan plan = selector.select(request, bundle(first, second));

        assertThat(plan.first()).isEqualTo(new ToolSelection.Edit(second.entityId(), EditComplexity.STRUCTURAL,
                "completely redesign this with a modern layout", null));
        assertThat(plan.complexity()).contains(EditComplexity.STRUCTURAL);
    }

    @Test
    void missingComplexityFallsBackToKeywords() {
        IntentClassification.Step step = new IntentClassification.Step("edit", null, null, null, null, null, null, null, null);

        assertThat(selector.decideComplexity(step, "completely redesign this with a modern layout"))
                .isEqualTo(EditComplexity.STRUCTURAL);
        assertThat(selector.decideComplexity(step, "change the text color to blue")).isEqualTo(EditComplexity.SURGICAL);
        assertThat(selector.decideComplexity(step, "hmm")).isEqualTo(EditComplexity.CREATIVE);
    }

    @Test
    void modelComplexityWinsOverKeywords() {
        IntentClassification.Step step = new IntentClassification.Step("edit", null, null, "creative", null, null, null, null, null);

        assertThat(selector.decideComplexity(step, "change the text color to blue")).isEqualTo(EditComplexity.CREATIVE);
    }

    @Test
    void outOfRangeOrdinalAsksInsteadOfGuessing() throws Exception {
        EntitySummary first = scene(1, "Intro");
        EntitySummary second = scene(2, "Outro");
        modelAnswers("{\"steps\":[{\"action\":\"edit\",\"targetEntityId\":\"" + second.entityId() + "\",\"complexity\":\"creative\"}]}");

        assertThatThrownBy(() -> selector.select(OrchestrationRequest.of(projectId, "edit the third one"), bundle(first, second)))
                .isInstanceOfSatisfying(AmbiguousIntentException.class,
                        e -> assertThat(e.getQuestion()).contains("only 2 scenes"));
    }

    @Test
    void ordinalPicksSceneByIntroductionOrder() throws Exception {
        EntitySummary first = scene(1, "Intro");
        EntitySummary second = scene(2, "Features");
        EntitySummary third = scene(3, "Outro");
        modelAnswers("{\"steps\":[{\"action\":\"delete\",\"targetEntityId\":\"" + first.entityId() + "\"}]}");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId, "delete scene 2"), bundle(first, second, third));

        assertThat(plan.first()).isEqualTo(new ToolSelection.Delete(second.entityId()));
    }

    @Test
    void deleteWithoutReferenceAmongSeveralScenesIsAmbiguous() throws Exception {
        modelAnswers("{\"steps\":[{\"action\":\"delete\"}]}");

        assertThatThrownBy(() -> selector.select(OrchestrationRequest.of(projectId, "delete it"),
                bundle(scene(1, "A"), scene(2, "B"))))
                .isInstanceOf(AmbiguousIntentException.class);
    }

    @Test
    void compoundRequestBecomesOrderedPlan() throws Exception {
        EntitySummary first = scene(1, "Intro");
        EntitySummary second = scene(2, "Outro");
        modelAnswers("""
                {"steps":[
                  {"action":"change_duration","reference":"scene 1","durationSeconds":4},
                  {"action":"change_attribute","reference":"the last scene","attribute":"name","value":"Goodbye"}
                ]}""");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId,
                "make scene 1 last 4 seconds and rename the last scene to Goodbye"), bundle(first, second));

        assertThat(plan.steps()).containsExactly(
                new ToolSelection.ChangeDuration(first.entityId(), 4.0),
                new ToolSelection.ChangeAttribute(second.entityId(), "name", "Goodbye"));
    }

    @Test
    void durationIsReadFromInstructionWhenModelOmitsIt() throws Exception {
        EntitySummary only = scene(1, "Intro");
        modelAnswers("{\"steps\":[{\"action\":\"change_duration\"}]}");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId, "make it 6 seconds long"), bundle(only));

        assertThat(plan.first()).isEqualTo(new ToolSelection.ChangeDuration(only.entityId(), 6.0));
    }

    @Test
    void attributeStepWithoutValueBecomesSurgicalEdit() throws Exception {
        EntitySummary only = scene(1, "Intro");
        modelAnswers("{\"steps\":[{\"action\":\"change_attribute\",\"attribute\":\"title\"}]}");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId, "fix the title"), bundle(only));

        assertThat(plan.first()).isInstanceOfSatisfying(ToolSelection.Edit.class,
                edit -> assertThat(edit.complexity()).isEqualTo(EditComplexity.SURGICAL));
    }

    @Test
    void createUsesAttachedImage() throws Exception {
        modelAnswers("{\"steps\":[{\"action\":\"create\"}]}");
        OrchestrationRequest request = new OrchestrationRequest(projectId, "u1", "make a scene from this screenshot",
                null, List.of(), List.of(new ImageRef("img-1", "https://cdn.example.com/1.png")), null);

        ToolPlan plan = selector.select(request, bundle());

        assertThat(plan.first()).isEqualTo(new ToolSelection.Create("make a scene from this screenshot", "img-1"));
    }

    @Test
    void clarificationQuestionIsRaised() throws Exception {
        modelAnswers("{\"steps\":[],\"clarificationQuestion\":\"Which scene should change?\"}");

        assertThatThrownBy(() -> selector.select(OrchestrationRequest.of(projectId, "change it"), bundle()))
                .isInstanceOfSatisfying(AmbiguousIntentException.class,
                        e -> assertThat(e.getQuestion()).isEqualTo("Which scene should change?"));
    }

    @Test
    void emptyPlanIsNoCapabilityMatch() throws Exception {
        modelAnswers("{\"steps\":[]}");

        assertThatThrownBy(() -> selector.select(OrchestrationRequest.of(projectId, "sing a song"), bundle()))
                .isInstanceOf(NoCapabilityMatchException.class);
    }

    @Test
    void failedClassificationIsNoCapabilityMatch() {
        when(structuredOutput.call(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), anyList()))
                .thenThrow(new InvocationException("Model output does not match schema"));

        assertThatThrownBy(() -> selector.select(OrchestrationRequest.of(projectId, "edit it"), bundle()))
                .isInstanceOf(NoCapabilityMatchException.class)
                .hasCauseInstanceOf(InvocationException.class);
    }

    @Test
    void longPlansAreTruncated() throws Exception {
        StringBuilder steps = new StringBuilder();
        for (int i = 0; i < 7; i++) {
            steps.append(i == 0 ? "" : ",").append("{\"action\":\"create\",\"instruction\":\"scene ").append(i).append("\"}");
        }
        modelAnswers("{\"steps\":[" + steps + "]}");

        ToolPlan plan = selector.select(OrchestrationRequest.of(projectId, "make seven scenes"), bundle());

        assertThat(plan.steps()).hasSize(ToolPlan.MAX_STEPS);
    }

    @Test
    void promptListsScenesWithDisplayNumbers() throws Exception {
        EntitySummary first = scene(1, "Intro");
        modelAnswers("{\"steps\":[{\"action\":\"edit\"}]}");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LlmMessage>> captor = ArgumentCaptor.forClass(List.class);

        selector.select(OrchestrationRequest.of(projectId, "make it more playful"), bundle(first));

        verify(structuredOutput).call(eq(ModelTier.FAST), eq(SchemaRegistry.INTENT_CLASSIFICATION), captor.capture());
        List<LlmMessage> sent = new ArrayList<>(captor.getValue());
        assertThat(sent).hasSize(3);
        assertThat(sent.get(1).content()).contains("Scene 1: \"Intro\" id=" + first.entityId());
        assertThat(sent.get(2).content()).isEqualTo("make it more playful");
    }
}
