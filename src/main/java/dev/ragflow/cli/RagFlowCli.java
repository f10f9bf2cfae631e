package dev.ragflow.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.ragflow.backend.CapabilityException;
import dev.ragflow.backend.ChatMessage;
import dev.ragflow.backend.Generator;
import dev.ragflow.backend.LangChainGenerator;
import dev.ragflow.backend.LuceneRetriever;
import dev.ragflow.backend.Retriever;
import dev.ragflow.backend.TavilyWebSearcher;
import dev.ragflow.backend.WebSearcher;
import dev.ragflow.engine.SettingsLoader;
import dev.ragflow.engine.StructuredOutputException;
import dev.ragflow.engine.WorkflowListener;
import dev.ragflow.model.Guardrails;
import dev.ragflow.model.WorkflowResult;
import dev.ragflow.model.WorkflowSettings;
import dev.ragflow.workflow.RagWorkflow;
import dev.ragflow.workflow.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: answer one question with the selected workflow.
 */
@Command(
    name = "ragflow",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = RagFlowCli.EXIT_USAGE,
    exitCodeOnExecutionException = RagFlowCli.EXIT_FAILURE,
    description = "Answer a question from a local document corpus, with grading, web fallback and self-critique."
)
public class RagFlowCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RagFlowCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    @Parameters(arity = "0..*", description = "Question to answer")
    private List<String> question;

    @Option(names = "--workflow", defaultValue = "suggestion-rag",
        description = "Workflow: basic-rag, suggestion-rag, search-rag (default: ${DEFAULT-VALUE})")
    private String workflow;

    @Option(names = "--docs", description = "Directory of .txt/.md documents to index")
    private Path docs;

    @Option(names = "--config", description = "JSON settings file")
    private Path config;

    @Option(names = "--list", description = "List all available workflows")
    private boolean list;

    @Option(names = "--dry-run", description = "Print workflow graph without executing")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Log node execution and routing decisions")
    private boolean verbose;

    @Option(names = "--model", description = "Chat model name (default: " + LangChainGenerator.DEFAULT_MODEL + ")")
    private String model;

    @Option(names = "--base-url", description = "OpenAI-compatible endpoint base URL")
    private String baseUrl;

    @Option(names = "--n-results", description = "Override number of documents to retrieve")
    private Integer nResults;

    @Option(names = "--rerank-top-k", description = "Override rerank depth")
    private Integer rerankTopK;

    @Option(names = "--threshold", description = "Override confidence threshold of the search loop")
    private Double threshold;

    @Option(names = "--max-steps", description = "Override maxTotalSteps guardrail")
    private Integer maxSteps;

    @Option(names = "--max-visits", description = "Override maxNodeVisits guardrail")
    private Integer maxVisits;

    private final ProviderFactory providers;
    private final PrintStream out;
    private final PrintStream err;

    public RagFlowCli() {
        this(ProviderFactory.fromEnvironment(), System.out, System.err);
    }

    RagFlowCli(ProviderFactory providers, PrintStream out, PrintStream err) {
        this.providers = providers;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.ragflow")).setLevel(Level.DEBUG);
        }

        if (list) {
            out.println("Available workflows:");
            for (WorkflowType type : WorkflowType.values()) {
                out.printf("  %-16s %s%n", type.id(), type.description());
            }
            return EXIT_OK;
        }

        WorkflowType type;
        WorkflowSettings settings;
        try {
            type = WorkflowType.fromId(workflow);
            settings = resolveSettings();
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (dryRun) {
            RagWorkflow preview = RagWorkflow.create(type, (q, n, k) -> List.of(), UNAVAILABLE,
                q -> List.of(), settings, WorkflowListener.NONE);
            out.print(preview.graph().describe());
            out.printf("guardrails: maxNodeVisits=%d, maxTotalSteps=%d%n",
                settings.guardrails().maxNodeVisits(), settings.guardrails().maxTotalSteps());
            return EXIT_OK;
        }

        if (question == null || question.isEmpty()) {
            err.println("Error: question required. Use --list to see available workflows.");
            return EXIT_USAGE;
        }
        if (docs == null) {
            err.println("Error: --docs is required to answer a question.");
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(docs)) {
            err.println("Error: not a directory: " + docs);
            return EXIT_USAGE;
        }

        Retriever retriever;
        try {
            retriever = providers.retriever(docs);
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            RagWorkflow ragWorkflow;
            try {
                Generator generator = providers.generator(model, baseUrl);
                WebSearcher webSearcher = type.needsWebSearch() ? providers.webSearcher() : null;
                WorkflowListener listener = verbose ? new TraceListener(err) : WorkflowListener.NONE;
                ragWorkflow = RagWorkflow.create(type, retriever, generator, webSearcher, settings, listener);
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }

            WorkflowResult result = ragWorkflow.execute(String.join(" ", question));
            out.println(toJson(result));
            return EXIT_OK;
        } catch (CapabilityException | StructuredOutputException e) {
            err.println("Workflow failed: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            close(retriever);
        }
    }

    private static void close(Retriever retriever) {
        if (retriever instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close retriever", e);
            }
        }
    }

    private WorkflowSettings resolveSettings() throws IOException {
        WorkflowSettings base = config == null ? WorkflowSettings.defaults() : SettingsLoader.loadFromFile(config);
        Guardrails guardrails = new Guardrails(
            maxVisits != null ? maxVisits : base.guardrails().maxNodeVisits(),
            maxSteps != null ? maxSteps : base.guardrails().maxTotalSteps());
        return new WorkflowSettings(
            nResults != null ? nResults : base.nResults(),
            rerankTopK != null ? rerankTopK : base.rerankTopK(),
            threshold != null ? threshold : base.confidenceThreshold(),
            base.suggestionConfidenceCheck(),
            guardrails);
    }

    private static String toJson(WorkflowResult result) {
        try {
            return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result", e);
        }
    }

    private static final Generator UNAVAILABLE = new Generator() {
        @Override
        public String invoke(List<ChatMessage> messages) {
            throw new UnsupportedOperationException("dry run");
        }

        @Override
        public <T> T invokeStructured(List<ChatMessage> messages, Class<T> schema) {
            throw new UnsupportedOperationException("dry run");
        }
    };

    /**
     * Creates the capability providers for a run.
     */
    interface ProviderFactory {

        Retriever retriever(Path docs) throws IOException;

        Generator generator(String model, String baseUrl);

        WebSearcher webSearcher();

        static ProviderFactory fromEnvironment() {
            return new ProviderFactory() {
                @Override
                public Retriever retriever(Path docs) throws IOException {
                    return LuceneRetriever.fromDirectory(docs, null);
                }

                @Override
                public Generator generator(String model, String baseUrl) {
                    return LangChainGenerator.openAi(System.getenv("OPENAI_API_KEY"), baseUrl, model);
                }

                @Override
                public WebSearcher webSearcher() {
                    return new TavilyWebSearcher(System.getenv("TAVILY_API_KEY"));
                }
            };
        }
    }
}
