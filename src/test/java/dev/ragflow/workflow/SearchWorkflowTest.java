package dev.ragflow.workflow;

import dev.ragflow.backend.CapabilityException;
import dev.ragflow.backend.ChatMessage;
import dev.ragflow.backend.Generator;
import dev.ragflow.backend.Retriever;
import dev.ragflow.model.ConfidenceScore;
import dev.ragflow.model.Document;
import dev.ragflow.model.ExitStatus;
import dev.ragflow.model.Guardrails;
import dev.ragflow.model.NodeId;
import dev.ragflow.model.QuestionRewrite;
import dev.ragflow.model.RelevanceGrade;
import dev.ragflow.model.WorkflowResult;
import dev.ragflow.model.WorkflowSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchWorkflowTest {

    private static final WorkflowSettings DEFAULTS = WorkflowSettings.defaults();

    private static ConfidenceScore score(double confidence) {
        return new ConfidenceScore(confidence, List.of("missing " + confidence), List.of("suggest " + confidence));
    }

    @Test
    void confidentAnswerFromLocalDocuments() {
        var retriever = new StubRetriever(Document.of("S3 stores objects in buckets.", "s3.md"));
        var searcher = new StubWebSearcher("unused");
        var generator = new StubGenerator()
            .replies(RelevanceGrade.of(true), score(0.95))
            .answers("In buckets, thanks for asking!");

        WorkflowResult result = RagWorkflow.search(retriever, generator, searcher, DEFAULTS)
            .execute("Where does S3 store objects?");

        assertThat(result.workflow()).isEqualTo("search-rag");
        assertThat(result.path()).containsExactly(
            NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS, NodeId.GENERATE, NodeId.CHECK_CONFIDENCE);
        assertThat(result.answer()).isEqualTo("In buckets, thanks for asking!");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.exitStatus()).isEqualTo(ExitStatus.COMPLETED);
        assertThat(result.exitReason()).isEqualTo("confident-answer");
        assertThat(searcher.queries()).isEmpty();
    }

    @Test
    void irrelevantDocumentsFallBackToWebSearch() {
        var retriever = new StubRetriever(Document.of("Unrelated text.", "misc.md"));
        var searcher = new StubWebSearcher("SES supports inbound email.", "Use receipt rules.");
        var generator = new StubGenerator().replies(RelevanceGrade.of(false), score(0.92));

        WorkflowResult result = RagWorkflow.search(retriever, generator, searcher, DEFAULTS)
            .execute("How does SES inbound work?");

        assertThat(result.path()).containsExactly(NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS,
            NodeId.WEB_SEARCH, NodeId.GENERATE, NodeId.CHECK_CONFIDENCE);
        assertThat(searcher.queries()).containsExactly("How does SES inbound work?");
        assertThat(result.documents()).singleElement().satisfies(doc -> {
            assertThat(doc.source()).isEqualTo(RagNodes.WEB_SEARCH_SOURCE);
            assertThat(doc.content()).isEqualTo("SES supports inbound email.\nUse receipt rules.");
        });
        assertThat(generator.calls(String.class).get(0).userMessage())
            .startsWith("Context:\nSES supports inbound email.\nUse receipt rules.");
    }

    @Test
    void emptyRetrievalGoesStraightToWebSearch() {
        var searcher = new StubWebSearcher("snippet");
        var generator = new StubGenerator().replies(score(0.99));

        WorkflowResult result = RagWorkflow.search(new StubRetriever(), generator, searcher, DEFAULTS)
            .execute("q");

        assertThat(generator.calls(RelevanceGrade.class)).isEmpty();
        assertThat(result.path()).contains(NodeId.WEB_SEARCH);
        assertThat(result.completed()).isTrue();
    }

    @Test
    void lowConfidenceRewritesAndSearchesAgain() {
        var retriever = new StubRetriever(Document.of("doc"));
        var searcher = new StubWebSearcher("web result");
        var generator = new StubGenerator()
            .replies(
                RelevanceGrade.of(true),
                score(0.5), score(0.95),
                new QuestionRewrite("What is the SES inbound pricing per 1000 emails?"))
            .answers("first answer", "second answer");

        WorkflowResult result = RagWorkflow.search(retriever, generator, searcher, DEFAULTS)
            .execute("SES pricing?");

        assertThat(result.path()).containsExactly(
            NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS, NodeId.GENERATE, NodeId.CHECK_CONFIDENCE,
            NodeId.QUERY_REWRITE, NodeId.WEB_SEARCH, NodeId.GENERATE, NodeId.CHECK_CONFIDENCE);
        assertThat(result.question()).isEqualTo("What is the SES inbound pricing per 1000 emails?");
        assertThat(searcher.queries()).containsExactly("What is the SES inbound pricing per 1000 emails?");
        assertThat(result.answer()).isEqualTo("second answer");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.exitReason()).isEqualTo("confident-answer");
    }

    @Test
    void rewritePromptUsesLastAssessment() {
        var generator = new StubGenerator().replies(
            RelevanceGrade.of(true),
            new ConfidenceScore(0.3, List.of("pricing tiers"), List.of("add the pricing page")),
            score(0.99),
            new QuestionRewrite("SES pricing tiers"));

        RagWorkflow.search(new StubRetriever(Document.of("doc")), generator, new StubWebSearcher("w"), DEFAULTS)
            .execute("SES cost");

        assertThat(generator.calls(QuestionRewrite.class)).singleElement().satisfies(call ->
            assertThat(call.userMessage())
                .contains("Here is the initial question:\n\nSES cost")
                .contains("Suggestions:\nadd the pricing page")
                .contains("Missing information:\npricing tiers")
                .endsWith("Formulate an improved question."));
    }

    @Test
    void thresholdIsExclusive() {
        var generator = new StubGenerator().replies(
            RelevanceGrade.of(true), score(0.9), score(0.91), new QuestionRewrite("better"));

        WorkflowResult result = RagWorkflow.search(
                new StubRetriever(Document.of("doc")), generator, new StubWebSearcher("w"), DEFAULTS)
            .execute("q");

        assertThat(generator.calls(ConfidenceScore.class)).hasSize(2);
        assertThat(result.confidence()).isEqualTo(0.91);
        assertThat(result.completed()).isTrue();
    }

    @Test
    void neverConfidentStopsAtLoopLimit() {
        var searcher = new StubWebSearcher("w");
        var generator = new StubGenerator().replies(
            RelevanceGrade.of(true),
            score(0.2),
            new QuestionRewrite("rewrite 1"), new QuestionRewrite("rewrite 2"), new QuestionRewrite("rewrite 3"));

        WorkflowResult result = RagWorkflow.search(new StubRetriever(Document.of("doc")), generator, searcher, DEFAULTS)
            .execute("q");

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.LOOP_LIMIT);
        assertThat(result.exitReason()).contains("max-node-visits-exceeded for 'query_rewrite'");
        assertThat(generator.calls(QuestionRewrite.class)).hasSize(3);
        assertThat(generator.calls(ConfidenceScore.class)).hasSize(4);
        assertThat(searcher.queries()).containsExactly("rewrite 1", "rewrite 2", "rewrite 3");
        assertThat(result.question()).isEqualTo("rewrite 3");
        assertThat(result.answer()).isEqualTo("answer 4");
        assertThat(result.confidence()).isEqualTo(0.2);
        assertThat(result.path()).last().isEqualTo(NodeId.CHECK_CONFIDENCE);
    }

    @Test
    void totalStepGuardrailAlsoBoundsTheLoop() {
        var settings = DEFAULTS.withGuardrails(new Guardrails(10, 6));
        var generator = new StubGenerator().replies(RelevanceGrade.of(true), score(0.1), new QuestionRewrite("again"));

        WorkflowResult result = RagWorkflow.search(
                new StubRetriever(Document.of("doc")), generator, new StubWebSearcher("w"), settings)
            .execute("q");

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.LOOP_LIMIT);
        assertThat(result.exitReason()).isEqualTo("max-total-steps-exceeded (6)");
        assertThat(result.stepCount()).isEqualTo(6);
    }

    @Test
    void repeatedRunsAreIdentical() {
        WorkflowResult first = runScriptedLoop();
        WorkflowResult second = runScriptedLoop();

        assertThat(second).isEqualTo(first);
    }

    private static WorkflowResult runScriptedLoop() {
        var generator = new StubGenerator().replies(
            RelevanceGrade.of(false), score(0.4), score(0.97), new QuestionRewrite("refined"));
        return RagWorkflow.search(new StubRetriever(Document.of("doc")), generator,
                new StubWebSearcher("one", "two"), DEFAULTS)
            .execute("q");
    }

    /** Stateless, so safe to share between threads: every reply is derived from the prompt. */
    private static final class EchoGenerator implements Generator {
        @Override
        public String invoke(List<ChatMessage> messages) {
            String user = messages.get(messages.size() - 1).content();
            return "answer to " + user.substring(user.lastIndexOf("Question: ") + "Question: ".length());
        }

        @Override
        public <T> T invokeStructured(List<ChatMessage> messages, Class<T> schema) {
            if (schema == RelevanceGrade.class) {
                return schema.cast(RelevanceGrade.of(true));
            }
            if (schema == ConfidenceScore.class) {
                return schema.cast(score(0.95));
            }
            throw new IllegalStateException("unexpected schema " + schema.getSimpleName());
        }
    }

    @Test
    void concurrentRunsKeepTheirOwnState() throws Exception {
        Retriever retriever = (query, n, k) -> List.of(Document.of("notes on " + query));
        var workflow = RagWorkflow.search(retriever, new EchoGenerator(), query -> List.of(), DEFAULTS);
        List<String> questions = IntStream.range(0, 32).mapToObj(i -> "question " + i).toList();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<WorkflowResult>> futures;
        try {
            futures = pool.invokeAll(questions.stream()
                .map(q -> (Callable<WorkflowResult>) () -> workflow.execute(q))
                .toList());
        } finally {
            pool.shutdown();
        }

        for (int i = 0; i < questions.size(); i++) {
            WorkflowResult result = futures.get(i).get();
            String question = questions.get(i);
            assertThat(result.question()).isEqualTo(question);
            assertThat(result.answer()).isEqualTo("answer to " + question);
            assertThat(result.documents()).extracting(Document::content).containsExactly("notes on " + question);
            assertThat(result.path()).containsExactly(
                NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS, NodeId.GENERATE, NodeId.CHECK_CONFIDENCE);
            assertThat(result.stepCount()).isEqualTo(4);
        }
    }

    @Test
    void failedRunDoesNotAffectNextRun() {
        Retriever retriever = (query, n, k) -> {
            if (query.equals("break the index")) {
                throw new CapabilityException("retriever", "index offline");
            }
            return List.of(Document.of("notes on " + query));
        };
        var workflow = RagWorkflow.search(retriever, new EchoGenerator(), query -> List.of(), DEFAULTS);

        assertThatThrownBy(() -> workflow.execute("break the index"))
            .isInstanceOf(CapabilityException.class)
            .hasMessageContaining("index offline");

        WorkflowResult result = workflow.execute("What is S3?");

        assertThat(result.completed()).isTrue();
        assertThat(result.question()).isEqualTo("What is S3?");
        assertThat(result.answer()).isEqualTo("answer to What is S3?");
        assertThat(result.stepCount()).isEqualTo(4);
    }

    @Test
    void searchWorkflowRequiresWebSearcher() {
        assertThatThrownBy(() -> RagWorkflow.search(new StubRetriever(), new StubGenerator(), null, DEFAULTS))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requires a web searcher");
    }
}
