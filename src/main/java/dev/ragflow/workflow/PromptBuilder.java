package dev.ragflow.workflow;

import dev.ragflow.backend.ChatMessage;
import dev.ragflow.model.Document;

import java.util.List;

/**
 * Builds the prompts sent to the generator by the workflow nodes.
 */
public final class PromptBuilder {

    static final String SIGN_OFF = "thanks for asking!";

    private static final String ANSWER_SYSTEM = """
        Use the following pieces of context to answer the question at the end.
        If you don't know the answer, just say that you don't know, don't try to make up an answer.
        Use three sentences maximum and keep the answer as concise as possible.
        Always say "%s" at the end of the answer.""".formatted(SIGN_OFF);

    private static final String GRADER_SYSTEM = """
        You are a grader assessing relevance of a retrieved document to a user question.
        If the document contains keyword(s) or semantic meaning related to the question, grade it as relevant.
        Give a binary score 'yes' or 'no' score to indicate whether the document is relevant to the question.""";

    private static final String EVALUATOR_SYSTEM = """
        You are an expert system for evaluating the accuracy and completeness of answers based on provided documents.
        Your objective:
        1. Assess whether the given Answer fully and correctly addresses the Question, using evidence from the Context.
        2. Determine if the answer is factually accurate and fully supported by the content of the provided context.
        3. Check for coverage: does the answer address all key aspects of the question that are present or inferable from the context?
        4. Identify any irrelevant, unsupported, or hallucinated claims.
        Confidence scoring:
        Output a confidence score between 0 and 1 indicating how certain you are that the answer is accurate and complete.
        1.0 = fully correct and complete, 0.0 = inaccurate or entirely unsupported.
        Missing or uncertain information:
        If the answer is incomplete, specify which facts, concepts, or perspectives are missing,
        and highlight ambiguities in the context that limit a complete answer.
        Enrichment suggestions:
        Recommend up to three additional sources, topics, or data types that would fill the gaps or improve retrieval.
        Keep suggestions specific and actionable ("Add documentation on AWS SES inbound email processing", not "find more info about AWS").""";

    private static final String ENRICHMENT_SYSTEM = """
        You are an expert at enriching a knowledge base. You provide suggestions and missing information for a given query.
        Missing or uncertain information:
        Specify which facts, concepts, or perspectives are missing, and highlight ambiguities that limit a complete answer.
        Enrichment suggestions:
        Recommend up to three additional sources, topics, or data types that would fill the gaps or improve retrieval.
        Keep suggestions specific and actionable ("Add documentation on AWS SES inbound email processing", not "find more info about AWS").""";

    private static final String REWRITER_SYSTEM = """
        You are a question re-writer that converts an input question to a better version that is optimized
        for search. Look at the input and try to reason about the underlying semantic intent / meaning.""";

    private PromptBuilder() {}

    /**
     * Join document contents into one context block, separated by blank lines.
     */
    public static String buildContext(List<Document> documents) {
        var sb = new StringBuilder();
        for (Document document : documents) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(document.content());
        }
        return sb.toString();
    }

    public static List<ChatMessage> buildAnswerPrompt(String question, String context) {
        return List.of(
            ChatMessage.system(ANSWER_SYSTEM),
            ChatMessage.user("Context:\n" + context + "\nQuestion: " + question));
    }

    public static List<ChatMessage> buildGradingPrompt(String question, String context) {
        return List.of(
            ChatMessage.system(GRADER_SYSTEM),
            ChatMessage.user("Document:\n" + context + "\n\nQuestion: " + question));
    }

    public static List<ChatMessage> buildConfidencePrompt(String question, String context, String answer) {
        return List.of(
            ChatMessage.system(EVALUATOR_SYSTEM),
            ChatMessage.user("Context: " + context + "\n\nQuestion: " + question + "\n\nAnswer: " + answer));
    }

    public static List<ChatMessage> buildEnrichmentPrompt(String question) {
        return List.of(
            ChatMessage.system(ENRICHMENT_SYSTEM),
            ChatMessage.user("Question: " + question));
    }

    public static List<ChatMessage> buildRewritePrompt(String question, List<String> suggestions,
                                                       List<String> missingInfo) {
        var sb = new StringBuilder();
        sb.append("Here is the initial question:\n\n").append(question).append("\n\n");
        sb.append("Suggestions:\n").append(String.join("\n", suggestions)).append("\n\n");
        sb.append("Missing information:\n").append(String.join("\n", missingInfo)).append("\n\n");
        sb.append("Formulate an improved question.");
        return List.of(
            ChatMessage.system(REWRITER_SYSTEM),
            ChatMessage.user(sb.toString()));
    }
}
