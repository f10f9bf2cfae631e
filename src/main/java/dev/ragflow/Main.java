package dev.ragflow;

import dev.ragflow.cli.RagFlowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new RagFlowCli()).execute(args);
        System.exit(exitCode);
    }
}
