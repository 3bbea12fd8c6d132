package dev.twig.cli;

import dev.twig.branch.IBranch;
import dev.twig.exception.CommitNotFoundException;
import dev.twig.exception.NotJoinableBranchesException;
import dev.twig.model.Commit;
import dev.twig.repo.IRepository;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Interprets a line-oriented command script against a repository. One command per line; blank lines and lines starting
 * with {@code #} are skipped. Arguments are separated by whitespace and double quotes group words.
 *
 * <pre>
 * create-branch &lt;new&gt; [&lt;base&gt; [&lt;commitIndex&gt;]]
 * remove-branch &lt;name&gt;
 * clone-branch &lt;name&gt; &lt;new&gt; [&lt;commitIndex&gt;]
 * commit &lt;branch&gt; &lt;name&gt; &lt;description&gt; [&lt;file&gt;...]
 * join &lt;source&gt; &lt;destination&gt;
 * undo [&lt;branch&gt;]
 * redo [&lt;branch&gt;]
 * show [&lt;branch&gt;]
 * </pre>
 *
 * A failing line is reported on the error stream and the script continues.
 */
public class ScriptRunner {
    private static final Logger logger = LogManager.getLogger(ScriptRunner.class);

    /** A script line that cannot be executed as written. */
    public static class CommandException extends Exception {
        public CommandException(String message) {
            super(message);
        }
    }

    private final IRepository repository;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(IRepository repository, PrintStream out, PrintStream err) {
        this.repository = repository;
        this.out = out;
        this.err = err;
    }

    /**
     * Runs every line of {@code script}.
     *
     * @return the number of lines that failed
     */
    public int run(BufferedReader script) throws IOException {
        int failures = 0;
        int lineNo = 0;
        String line;
        while ((line = script.readLine()) != null) {
            lineNo++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                execute(tokenize(trimmed));
            } catch (CommandException | NotJoinableBranchesException | CommitNotFoundException e) {
                failures++;
                err.printf("line %d: %s%n", lineNo, e.getMessage());
                logger.warn("Script line {} failed: {}", lineNo, e.getMessage());
            }
        }
        return failures;
    }

    /** Executes a single tokenized command. */
    public void execute(List<String> args) throws CommandException {
        if (args.isEmpty()) {
            throw new CommandException("empty command");
        }
        var command = args.get(0);
        var rest = args.subList(1, args.size());
        switch (command) {
            case "create-branch" -> {
                requireArgs(command, rest, 1, 3);
                var base = rest.size() > 1 ? rest.get(1) : null;
                var lastCommit = rest.size() > 2 ? commitAt(branch(rest.get(1)), rest.get(2)) : null;
                repository.createBranch(rest.get(0), base, lastCommit);
            }
            case "remove-branch" -> {
                requireArgs(command, rest, 1, 1);
                repository.removeBranch(rest.get(0));
            }
            case "clone-branch" -> {
                requireArgs(command, rest, 2, 3);
                var lastCommit = rest.size() > 2 ? commitAt(branch(rest.get(0)), rest.get(2)) : null;
                repository.cloneBranch(rest.get(0), rest.get(1), lastCommit);
            }
            case "commit" -> {
                requireArgs(command, rest, 3, Integer.MAX_VALUE);
                branch(rest.get(0)).addCommit(rest.get(1), rest.get(2), List.copyOf(rest.subList(3, rest.size())));
            }
            case "join" -> {
                requireArgs(command, rest, 2, 2);
                branch(rest.get(0)).join(branch(rest.get(1)));
            }
            case "undo" -> {
                requireArgs(command, rest, 0, 1);
                if (rest.isEmpty()) {
                    repository.undo();
                } else {
                    branch(rest.get(0)).undo();
                }
            }
            case "redo" -> {
                requireArgs(command, rest, 0, 1);
                if (rest.isEmpty()) {
                    repository.redo();
                } else {
                    branch(rest.get(0)).redo();
                }
            }
            case "show" -> {
                requireArgs(command, rest, 0, 1);
                out.print(rest.isEmpty() ? repository.toString() : branch(rest.get(0)).toString());
            }
            default -> throw new CommandException("unknown command: " + command);
        }
    }

    private IBranch branch(String name) throws CommandException {
        return repository.getBranch(name).orElseThrow(() -> new CommandException("no such branch: " + name));
    }

    private static Commit commitAt(IBranch branch, String index) throws CommandException {
        int idx;
        try {
            idx = Integer.parseInt(index);
        } catch (NumberFormatException e) {
            throw new CommandException("commit index is not a number: " + index);
        }
        var commits = branch.getCommitsList();
        if (idx < 0 || idx >= commits.size()) {
            throw new CommandException(
                    "commit index %d out of range for branch %s (%d commits)"
                            .formatted(idx, branch.getName(), commits.size()));
        }
        return commits.get(idx);
    }

    private static void requireArgs(String command, List<String> args, int min, int max) throws CommandException {
        if (args.size() < min || args.size() > max) {
            throw new CommandException("wrong number of arguments for " + command + ": " + args.size());
        }
    }

    /** Splits on whitespace; double quotes group words and are dropped. */
    static List<String> tokenize(String line) throws CommandException {
        var tokens = new ArrayList<String>();
        @Nullable StringBuilder current = null;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                if (current == null) {
                    current = new StringBuilder();
                }
            } else if (Character.isWhitespace(c) && !quoted) {
                if (current != null) {
                    tokens.add(current.toString());
                    current = null;
                }
            } else {
                if (current == null) {
                    current = new StringBuilder();
                }
                current.append(c);
            }
        }
        if (quoted) {
            throw new CommandException("unterminated quote");
        }
        if (current != null) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
