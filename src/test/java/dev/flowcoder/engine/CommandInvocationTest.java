package dev.flowcoder.engine;

import dev.flowcoder.model.ArgumentParseException;
import dev.flowcoder.model.Command;
import dev.flowcoder.model.CommandArgument;
import dev.flowcoder.model.CommandBlock;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandInvocationTest {

    private static Command lint() {
        Command command = new Command("lint");
        command.setArguments(List.of(
            CommandArgument.required("path", ""),
            CommandArgument.optional("level", "", "warn")));
        return command;
    }

    @Test
    void resolvesTargetIgnoringSlash() {
        Command lint = lint();
        CommandBlock block = new CommandBlock("Lint", "/lint", "");

        assertThat(CommandInvocation.resolveTarget(block, Map.of("lint", lint))).isSameAs(lint);
    }

    @Test
    void unknownTargetFails() {
        CommandBlock block = new CommandBlock("Lint", "lint", "");

        assertThatThrownBy(() -> CommandInvocation.resolveTarget(block, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Command not found: lint");
    }

    @Test
    void childBindingsComeFromFilledTemplate() {
        CommandBlock block = new CommandBlock("Lint", "lint", "{{dir}} $2");
        Map<String, Object> parent = Map.of("$1", "ignored", "$2", "error", "dir", "src/main", "extra", 1);

        Map<String, Object> child = CommandInvocation.childBindings(block, lint(), parent);

        assertThat(child).containsOnlyKeys("$1", "path", "$2", "level");
        assertThat(child).containsEntry("path", "src/main").containsEntry("level", "error");
    }

    @Test
    void inheritedVariablesAreOverriddenByArguments() {
        CommandBlock block = new CommandBlock("Lint", "lint", "src");
        block.setInheritVariables(true);
        Map<String, Object> parent = Map.of("$1", "top", "path", "old", "extra", 1);

        Map<String, Object> child = CommandInvocation.childBindings(block, lint(), parent);

        assertThat(child).containsEntry("path", "src")
            .containsEntry("$1", "src")
            .containsEntry("extra", 1)
            .containsEntry("level", "warn");
    }

    @Test
    void missingRequiredChildArgumentFails() {
        CommandBlock block = new CommandBlock("Lint", "lint", "");

        assertThatThrownBy(() -> CommandInvocation.childBindings(block, lint(), Map.of()))
            .isInstanceOf(ArgumentParseException.class)
            .hasMessage("Missing required argument: path (position 1)");
    }

    @Test
    void mergesNamedOutputsOnlyWhenRequested() {
        CommandBlock block = new CommandBlock("Lint", "lint", "");
        var parent = new LinkedHashMap<String, Object>(Map.of("$1", "mine", "count", 1));
        Map<String, Object> child = Map.of("$1", "theirs", "count", 5, "report", "ok");

        assertThat(CommandInvocation.mergeOutputs(block, parent, child)).isZero();
        assertThat(parent).containsEntry("count", 1);

        block.setMergeOutput(true);
        assertThat(CommandInvocation.mergeOutputs(block, parent, child)).isEqualTo(2);
        assertThat(parent).containsEntry("$1", "mine")
            .containsEntry("count", 5)
            .containsEntry("report", "ok");
    }
}
