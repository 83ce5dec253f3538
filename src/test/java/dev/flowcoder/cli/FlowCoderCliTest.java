package dev.flowcoder.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FlowCoderCliTest {

    private static final String REVIEW = """
        {
          "name": "review",
          "description": "Review a file",
          "arguments": [
            {"name": "file", "required": true},
            {"name": "mode", "required": false, "default": "strict"}
          ],
          "flowchart": {
            "blocks": {
              "start": {"id": "start", "type": "start", "position": {"x": 0, "y": 0}},
              "ask": {"id": "ask", "type": "prompt", "position": {"x": 0, "y": 100}, "prompt": "Review $1"},
              "end": {"id": "end", "type": "end", "position": {"x": 0, "y": 200}}
            },
            "connections": [
              {"source_block_id": "start", "target_block_id": "ask"},
              {"source_block_id": "ask", "target_block_id": "end"}
            ]
          }
        }
        """;

    private static final String BROKEN = """
        {
          "name": "broken",
          "flowchart": {
            "blocks": {
              "start": {"id": "start", "type": "start", "position": {"x": 0, "y": 0}},
              "ask": {"id": "ask", "type": "prompt", "position": {"x": 0, "y": 100}, "prompt": "Use $1 and $3"},
              "call": {"id": "call", "type": "command", "position": {"x": 0, "y": 200}, "command_name": "broken"}
            },
            "connections": [
              {"source_block_id": "start", "target_block_id": "ask"},
              {"source_block_id": "ask", "target_block_id": "call"}
            ]
          }
        }
        """;

    private static final String GAPPY = """
        {
          "name": "gappy",
          "flowchart": {
            "blocks": {
              "start": {"id": "start", "type": "start", "position": {"x": 0, "y": 0}},
              "set": {"id": "set", "type": "variable", "name": "Set", "position": {"x": 0, "y": 100},
                      "variable_name": "target", "variable_value": "$1/$3"},
              "check": {"id": "check", "type": "branch", "name": "Check", "position": {"x": 0, "y": 200},
                        "condition": "$2 == $4"},
              "end": {"id": "end", "type": "end", "position": {"x": 0, "y": 300}}
            },
            "connections": [
              {"source_block_id": "start", "target_block_id": "set"},
              {"source_block_id": "set", "target_block_id": "check"},
              {"source_block_id": "check", "target_block_id": "end", "is_true_path": true},
              {"source_block_id": "check", "target_block_id": "set", "is_true_path": false}
            ]
          }
        }
        """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dir.resolve("review.json"), REVIEW);
        Files.writeString(dir.resolve("broken.json"), BROKEN);
        Files.writeString(dir.resolve("gappy.json"), GAPPY);
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--commands-dir";
        full[1] = dir.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new FlowCoderCli()).execute(full);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void listsCommandSignatures() {
        assertThat(run("--list")).isZero();
        assertThat(stdout()).contains("/review <file> [mode]", "Review a file", "/broken");
    }

    @Test
    void validCommandPassesValidation() {
        assertThat(run("/review")).isZero();
        assertThat(stdout()).contains("Command /review: valid");
    }

    @Test
    void invalidCommandFailsWithFindings() {
        assertThat(run("broken", "--validate")).isEqualTo(1);
        assertThat(stdout()).contains(
            "Command /broken: INVALID",
            "Circular dependency detected: broken calls itself",
            "Argument reference skips $2 (found $1, $3)");
    }

    @Test
    void argumentGapsAreCheckedInEveryTemplate() {
        assertThat(run("gappy")).isZero();
        assertThat(stdout()).contains(
            "warning: [Set] Argument reference skips $2 (found $1, $3)",
            "warning: [Check] Argument reference skips $1, $3 (found $2, $4)");
    }

    @Test
    void unreadableCommandFileFailsCleanly() throws IOException {
        Files.writeString(dir.resolve("dated.json"), """
            {"name": "dated", "metadata": {"created": "yesterday", "modified": "today"}}
            """);

        assertThat(run("--list")).isEqualTo(1);
        assertThat(stderr()).contains("Error: Failed to load command from", "dated.json");
    }

    @Test
    void printsArgumentBindings() {
        assertThat(run("review", "--args", "utils.py")).isZero();
        assertThat(stdout()).contains("$1 = utils.py", "file = utils.py", "mode = strict");
    }

    @Test
    void reportsMissingRequiredArgument() {
        assertThat(run("review", "--args", "")).isEqualTo(1);
        assertThat(stderr()).contains("Missing required argument: file (position 1)");
    }

    @Test
    void unknownCommandFails() {
        assertThat(run("nope")).isEqualTo(1);
        assertThat(stderr()).contains("unknown command: nope");
    }

    @Test
    void missingDirectoryFails() {
        int code = new CommandLine(new FlowCoderCli())
            .execute("--commands-dir", dir.resolve("absent").toString(), "--list");

        assertThat(code).isEqualTo(1);
        assertThat(stderr()).contains("commands directory not found");
    }
}
