package dev.ragflow.workflow;

import dev.ragflow.backend.Generator;
import dev.ragflow.backend.Retriever;
import dev.ragflow.backend.WebSearcher;
import dev.ragflow.engine.Router;
import dev.ragflow.engine.WorkflowState;
import dev.ragflow.model.ConfidenceAssessment;
import dev.ragflow.model.ConfidenceScore;
import dev.ragflow.model.Document;
import dev.ragflow.model.EnrichmentSuggestion;
import dev.ragflow.model.QuestionRewrite;
import dev.ragflow.model.RelevanceGrade;
import dev.ragflow.model.RelevanceVerdict;
import dev.ragflow.model.StateUpdate;
import dev.ragflow.model.WorkflowSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Node handlers and routers shared by the workflow variants. Stateless apart from
 * the capability handles, which are only read.
 */
public final class RagNodes {

    private static final Logger log = LoggerFactory.getLogger(RagNodes.class);

    public static final String GENERATE = "generate";
    public static final String WEB_SEARCH = "web_search";
    public static final String SUGGEST_ENRICHMENT = "suggest_enrichment";
    public static final String COMPLETE = "complete";
    public static final String INCOMPLETE = "incomplete";

    public static final String WEB_SEARCH_SOURCE = "web_search";

    static final String NO_DOCUMENTS_ANSWER =
        "Sorry, no relevant document was found to answer the query. Check the answer details for suggestions.";

    private final Retriever retriever;
    private final Generator generator;
    private final WebSearcher webSearcher; // nullable, only the search workflow needs one
    private final WorkflowSettings settings;

    public RagNodes(Retriever retriever, Generator generator, WebSearcher webSearcher, WorkflowSettings settings) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.webSearcher = webSearcher;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public StateUpdate retrieve(WorkflowState state) {
        List<Document> documents = retriever.retrieve(state.question(), settings.nResults(), settings.rerankTopK());
        log.debug("Retrieved {} documents", documents.size());
        return StateUpdate.ofDocuments(documents);
    }

    /**
     * Grade the retrieved documents as a whole. An empty set is not relevant and
     * is never sent to the classifier.
     */
    public StateUpdate gradeDocuments(WorkflowState state) {
        if (state.documents().isEmpty()) {
            log.info("No documents retrieved, skipping relevance grading");
            return StateUpdate.ofRelevance(RelevanceVerdict.NOT_RELEVANT);
        }
        String context = PromptBuilder.buildContext(state.documents());
        RelevanceGrade grade = generator.invokeStructured(
            PromptBuilder.buildGradingPrompt(state.question(), context), RelevanceGrade.class);
        log.info("Relevance of {} documents: {}", state.documents().size(), grade.binaryScore());
        return StateUpdate.ofRelevance(grade.verdict());
    }

    public StateUpdate generate(WorkflowState state) {
        String context = PromptBuilder.buildContext(state.documents());
        String answer = generator.invoke(PromptBuilder.buildAnswerPrompt(state.question(), context));
        return StateUpdate.ofAnswer(answer);
    }

    /**
     * Replace the documents with one synthetic document holding every web snippet.
     */
    public StateUpdate webSearch(WorkflowState state) {
        if (webSearcher == null) {
            throw new IllegalStateException("Web search node used without a WebSearcher");
        }
        List<String> snippets = webSearcher.search(state.question());
        log.info("Web search returned {} results", snippets.size());
        Document webResults = Document.of(String.join("\n", snippets), WEB_SEARCH_SOURCE);
        return StateUpdate.ofDocuments(List.of(webResults));
    }

    public StateUpdate suggestEnrichment(WorkflowState state) {
        EnrichmentSuggestion suggestion = generator.invokeStructured(
            PromptBuilder.buildEnrichmentPrompt(state.question()), EnrichmentSuggestion.class);
        return StateUpdate.ofAnswer(NO_DOCUMENTS_ANSWER)
            .withAssessment(new ConfidenceAssessment(0.0, suggestion.missingInfo(), suggestion.suggestions()));
    }

    public StateUpdate checkConfidence(WorkflowState state) {
        String context = PromptBuilder.buildContext(state.documents());
        ConfidenceScore score = generator.invokeStructured(
            PromptBuilder.buildConfidencePrompt(state.question(), context, state.answer()), ConfidenceScore.class);
        log.info("Answer confidence: {}", score.confidence());
        return StateUpdate.ofAssessment(score.toAssessment());
    }

    /**
     * Ask for a better query; the result replaces the current question entirely.
     */
    public StateUpdate queryRewrite(WorkflowState state) {
        QuestionRewrite rewrite = generator.invokeStructured(
            PromptBuilder.buildRewritePrompt(state.question(), state.suggestions(), state.missingInfo()),
            QuestionRewrite.class);
        log.info("Rewrote query: {}", rewrite.query());
        return StateUpdate.ofQuestion(rewrite.query());
    }

    /**
     * Route relevant documents to generation and everything else to {@code fallbackLabel}.
     */
    public static Router decideToGenerate(String fallbackLabel) {
        return state -> state.relevance() == RelevanceVerdict.RELEVANT ? GENERATE : fallbackLabel;
    }

    /**
     * Complete when the confidence is strictly above {@code threshold}.
     */
    public static Router decideEnd(double threshold) {
        return state -> {
            Double confidence = state.confidence();
            return confidence != null && confidence > threshold ? COMPLETE : INCOMPLETE;
        };
    }
}
