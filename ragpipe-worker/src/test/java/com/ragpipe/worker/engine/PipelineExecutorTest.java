package com.ragpipe.worker.engine;

import com.ragpipe.activity.ChunkDocumentsActivity;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ExecutionKind;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineOrigin;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.transform.TransformRegistry;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineExecutorTest {

    private static final String EMBED = "perform_embedding_and_indexing_activity";
    private static final String SEARCH = "search_documents_activity";

    /** Records every invocation; answers from a per-activity function. */
    private static final class RecordingInvoker implements ActivityInvoker {
        final List<String> calls = new ArrayList<>();
        final List<List<Object>> args = new ArrayList<>();
        final Map<String, Function<List<Object>, Object>> answers = new LinkedHashMap<>();

        RecordingInvoker answer(String activity, Function<List<Object>, Object> f) {
            answers.put(activity, f);
            return this;
        }

        @Override
        public Object invoke(ActivityDescriptor descriptor, List<Object> a) {
            calls.add(descriptor.getName());
            args.add(a);
            Function<List<Object>, Object> f = answers.get(descriptor.getName());
            if (f == null) throw new AssertionError("unexpected activity " + descriptor.getName());
            return f.apply(a);
        }
    }

    private static PipelineDefinition pipeline(String name, PipelineStep... steps) {
        return new PipelineDefinition(name, null, null, List.of(steps), PipelineOrigin.DECLARED);
    }

    private static PipelineExecutor executor(ServiceConfig config, String defaultCollection, ActivityInvoker invoker) {
        return new PipelineExecutor(new ServiceConfigPlanResolver(() -> config, defaultCollection),
                TransformRegistry.defaultRegistry(), invoker);
    }

    private static ServiceConfig documentProcessingConfig() {
        return ServiceConfig.builder("test")
                .activity(ActivityDescriptor.local(ChunkDocumentsActivity.NAME, null, null))
                .activity(ActivityDescriptor.remote(EMBED, "embedding_service", "embedding-task-queue", null, null))
                .pipeline(pipeline("document_processing",
                        new PipelineStep(ChunkDocumentsActivity.NAME, "documents", ExecutionKind.LOCAL, null),
                        new PipelineStep(EMBED, "chunked_docs_with_collection", ExecutionKind.REMOTE, "embedding_service")))
                .build();
    }

    @Test
    void documentProcessing_chunksThenEmbedsIntoRequestedCollection() {
        ChunkDocumentsActivity chunker = new ChunkDocumentsActivity();
        RecordingInvoker invoker = new RecordingInvoker()
                .answer(ChunkDocumentsActivity.NAME, a -> {
                    try {
                        return chunker.invoke(a);
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                })
                .answer(EMBED, a -> Map.of("status", "success", "indexed_count", ((List<?>) a.get(0)).size()));
        Map<String, Object> input = Map.of(
                "documents", List.of(Map.of("id", "doc1", "text", "Paragraph one.\n\nParagraph two.")),
                "collection", "test");

        PipelineResult result = executor(documentProcessingConfig(), "document_chunks", invoker)
                .execute("document_processing", input, "wf-1");

        assertEquals(PipelineStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(ChunkDocumentsActivity.NAME, EMBED), invoker.calls);
        List<?> chunks = (List<?>) invoker.args.get(1).get(0);
        assertEquals(2, chunks.size());
        assertEquals("test", invoker.args.get(1).get(1));
        assertEquals(Map.of("status", "success", "indexed_count", 2), result.getFinalResult());
        assertEquals(2, result.getStepsCompleted());
        assertEquals("wf-1", result.getWorkflowId());
        assertEquals("list(2 items)", result.getStepTrace().get(0).getResultSummary());
        assertEquals("map(2 keys, status=success)", result.getStepTrace().get(1).getResultSummary());
    }

    @Test
    void documentRetrieval_bareStringQueryUsesDefaultCollection() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.remote(SEARCH, "retrieval_service", "retrieval-task-queue", null, null))
                .pipeline(pipeline("document_retrieval", PipelineStep.of(SEARCH, "query_with_collection")))
                .build();
        RecordingInvoker invoker = new RecordingInvoker()
                .answer(SEARCH, a -> Map.of("status", "success", "retrieved_documents", List.of()));

        PipelineResult result = executor(config, "docs", invoker).execute("document_retrieval", "machine learning", "wf-2");

        assertTrue(result.isCompleted());
        assertEquals(List.of(List.of("machine learning", "docs", 10)), invoker.args);
    }

    @Test
    void stepsRunStrictlyInOrderEachSeeingThePreviousOutput() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.local("a", null, null))
                .activity(ActivityDescriptor.local("b", null, null))
                .activity(ActivityDescriptor.local("c", null, null))
                .pipeline(pipeline("abc", PipelineStep.of("a", "passthrough"), PipelineStep.of("b", "passthrough"),
                        PipelineStep.of("c", "passthrough")))
                .build();
        RecordingInvoker invoker = new RecordingInvoker()
                .answer("a", a -> {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "A(" + a.get(0) + ")";
                })
                .answer("b", a -> "B(" + a.get(0) + ")")
                .answer("c", a -> "C(" + a.get(0) + ")");

        PipelineResult result = executor(config, "docs", invoker).execute("abc", "x", "wf-3");

        assertEquals(List.of("a", "b", "c"), invoker.calls);
        assertEquals("C(B(A(x)))", result.getFinalResult());
        assertEquals(List.of(0, 1, 2), result.getStepTrace().stream().map(StepTraceEntry::getStepIndex)
                .collect(Collectors.toList()));
    }

    @RepeatedTest(8)
    void stepsStayOrderedUnderVaryingStepLatency(RepetitionInfo repetition) {
        Random random = new Random(31L * repetition.getCurrentRepetition());
        int stepCount = 5;
        int instantStep = random.nextInt(stepCount);
        ServiceConfig.Builder builder = ServiceConfig.builder("test");
        PipelineStep[] steps = new PipelineStep[stepCount];
        RecordingInvoker invoker = new RecordingInvoker();
        List<String> expectedCalls = new ArrayList<>();
        for (int i = 0; i < stepCount; i++) {
            String name = "step_" + i;
            long latencyMillis = i == instantStep ? 0 : random.nextInt(25);
            builder.activity(ActivityDescriptor.local(name, null, null));
            steps[i] = PipelineStep.of(name, "passthrough");
            expectedCalls.add(name);
            invoker.answer(name, a -> {
                try {
                    Thread.sleep(latencyMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return name + "(" + a.get(0) + ")";
            });
        }
        ServiceConfig config = builder.pipeline(pipeline("chain", steps)).build();

        PipelineResult result = executor(config, "docs", invoker).execute("chain", "seed", "wf-order");

        assertEquals(expectedCalls, invoker.calls);
        Object previous = "seed";
        for (int i = 0; i < stepCount; i++) {
            assertEquals(previous, invoker.args.get(i).get(0), "input of step " + i);
            previous = "step_" + i + "(" + previous + ")";
        }
        assertEquals(previous, result.getFinalResult());
        assertEquals(stepCount, result.getStepsCompleted());
    }

    @Test
    void unknownPipeline_failsBeforeAnyInvocation() {
        RecordingInvoker invoker = new RecordingInvoker();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> executor(documentProcessingConfig(), "docs", invoker).execute("nope", "x", "wf-4"));

        assertEquals(ConfigurationException.Kind.PIPELINE_NOT_FOUND, e.getKind());
        assertTrue(invoker.calls.isEmpty());
    }

    @Test
    void missingActivityDescriptor_failsBeforeAnyInvocationAndNamesTheActivity() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.local(ChunkDocumentsActivity.NAME, null, null))
                .pipeline(pipeline("document_processing",
                        PipelineStep.of(ChunkDocumentsActivity.NAME, "documents"),
                        PipelineStep.of(EMBED, "chunked_docs_with_collection")))
                .build();
        RecordingInvoker invoker = new RecordingInvoker();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> executor(config, "docs", invoker).execute("document_processing", Map.of(), "wf-5"));

        assertEquals(ConfigurationException.Kind.ACTIVITY_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains(EMBED));
        assertTrue(invoker.calls.isEmpty());
    }

    @Test
    void activityFailure_returnsFailedResultWithCompletedStepsOnly() {
        RecordingInvoker invoker = new RecordingInvoker()
                .answer(ChunkDocumentsActivity.NAME, a -> List.of(Map.of("id", "c1", "text", "t")))
                .answer(EMBED, a -> {
                    throw new ActivityInvocationException(EMBED, "Activity timed out: TIMEOUT_TYPE_START_TO_CLOSE", null);
                });

        PipelineResult result = executor(documentProcessingConfig(), "docs", invoker)
                .execute("document_processing", Map.of("documents", List.of()), "wf-6");

        assertEquals(PipelineStatus.FAILED, result.getStatus());
        assertNull(result.getFinalResult());
        PipelineFailure failure = result.getFailure();
        assertEquals(ErrorKind.ACTIVITY_EXECUTION_ERROR, failure.getErrorKind());
        assertEquals(1, failure.getFailedAtStep());
        assertEquals(EMBED, failure.getActivityName());
        assertEquals(1, failure.getStepTrace().size());
        assertEquals(ChunkDocumentsActivity.NAME, failure.getStepTrace().get(0).getActivityName());
        assertEquals(StepStatus.FAILED, failure.getFailedStep().getStatus());
        assertEquals(1, result.getStepsCompleted());
    }

    @Test
    void transformFailure_isReportedAsTransformErrorWithoutInvokingTheStep() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.remote(SEARCH, "retrieval_service", "retrieval-task-queue", null, null))
                .pipeline(pipeline("document_retrieval", PipelineStep.of(SEARCH, "query_with_collection")))
                .build();
        RecordingInvoker invoker = new RecordingInvoker();

        PipelineResult result = executor(config, "docs", invoker)
                .execute("document_retrieval", Map.of("query", "q", "top_k", "many"), "wf-7");

        assertEquals(PipelineStatus.FAILED, result.getStatus());
        assertEquals(ErrorKind.TRANSFORM_ERROR, result.getFailure().getErrorKind());
        assertEquals(0, result.getFailure().getFailedAtStep());
        assertTrue(result.getStepTrace().isEmpty());
        assertTrue(invoker.calls.isEmpty());
    }

    @Test
    void emptyPipeline_isAConfigurationError() {
        ServiceConfig config = ServiceConfig.builder("test").pipeline(pipeline("empty")).build();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> executor(config, "docs", new RecordingInvoker()).execute("empty", null, "wf-8"));

        assertEquals(ConfigurationException.Kind.INVALID_STEP, e.getKind());
    }

    @Test
    void transformInput_unknownNameFallsBackToPassthrough() {
        PipelineExecutor executor = executor(documentProcessingConfig(), "docs", new RecordingInvoker());

        assertEquals(List.of("x"), executor.transformInput("no_such_transform", "x", Map.of(), "x", "docs"));
    }
}
