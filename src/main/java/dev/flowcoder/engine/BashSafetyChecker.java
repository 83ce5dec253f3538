package dev.flowcoder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags shell commands that match known destructive or risky patterns.
 * Matches prefixed {@code Dangerous:} make a command unsafe; {@code Warning:} matches are advisory.
 */
public final class BashSafetyChecker {

    private static final Logger log = LoggerFactory.getLogger(BashSafetyChecker.class);

    private record Rule(Pattern pattern, String message) {
        Rule(String regex, String message) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), message);
        }

        boolean dangerous() {
            return message.startsWith("Dangerous:");
        }
    }

    private static final List<Rule> RULES = List.of(
        new Rule("rm\\s+(-[rf]+\\s+)?/", "Dangerous: rm command with root path"),
        new Rule("rm\\s+-rf\\s+~", "Dangerous: rm -rf on home directory"),
        new Rule("dd\\s+if=", "Dangerous: dd command can overwrite disks"),
        new Rule(":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:", "Dangerous: Fork bomb detected"),
        new Rule("while\\s+true.*do.*done", "Warning: Infinite loop detected"),
        new Rule("curl.*\\|\\s*bash", "Dangerous: Piping curl to bash"),
        new Rule("wget.*\\|\\s*bash", "Dangerous: Piping wget to bash"),
        new Rule("curl.*\\|\\s*sh", "Dangerous: Piping curl to sh"),
        new Rule("wget.*\\|\\s*sh", "Dangerous: Piping wget to sh"),
        new Rule("mkfs", "Dangerous: Filesystem creation detected"),
        new Rule("fdisk", "Dangerous: Disk partitioning command"),
        new Rule("parted", "Dangerous: Disk partitioning command"),
        new Rule("sudo\\s+rm", "Warning: sudo rm detected"),
        new Rule("sudo\\s+dd", "Warning: sudo dd detected"),
        new Rule(">\\s*/dev/sd[a-z]", "Dangerous: Writing to block device")
    );

    private BashSafetyChecker() {}

    public static BashSafetyReport check(String command) {
        if (command == null || command.isBlank()) {
            return new BashSafetyReport(true, List.of());
        }
        String normalized = String.join(" ", command.trim().split("\\s+"));

        boolean safe = true;
        var warnings = new ArrayList<String>();
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(normalized).find()) {
                if (rule.dangerous()) {
                    safe = false;
                    log.warn("{} in command: {}", rule.message(), command);
                }
                warnings.add(rule.message());
            }
        }
        return new BashSafetyReport(safe, warnings);
    }
}
