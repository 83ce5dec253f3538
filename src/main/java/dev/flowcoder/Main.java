package dev.flowcoder;

import dev.flowcoder.cli.FlowCoderCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowCoderCli()).execute(args);
        System.exit(exitCode);
    }
}
