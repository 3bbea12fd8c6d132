package dev.twig.cli;

import static org.junit.jupiter.api.Assertions.*;

import dev.twig.branch.IBranch;
import dev.twig.model.Commit;
import dev.twig.repo.Repository;
import dev.twig.util.TwigSettings;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ScriptRunnerTest {

    private Repository repo;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ScriptRunner runner;

    @BeforeEach
    public void setUp() {
        repo = new Repository("scripted", TwigSettings.defaults(), Clock.systemUTC());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new ScriptRunner(
                repo,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String script) throws IOException {
        return runner.run(new BufferedReader(new StringReader(script)));
    }

    private List<String> commitNames(String branch) {
        return repo.getBranch(branch).orElseThrow().getCommitsList().stream()
                .map(Commit::name)
                .toList();
    }

    @Test
    public void testSampleScript() throws IOException {
        var in = Objects.requireNonNull(getClass().getResourceAsStream("/dev/twig/sample-script.twig"));
        int failures;
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            failures = runner.run(reader);
        }

        assertEquals(0, failures, err.toString(StandardCharsets.UTF_8));
        assertEquals(List.of("init", "docs", "parser"), commitNames("main"));
        assertEquals(List.of("init", "docs"), commitNames("release"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Branch: main\n"));
    }

    @Test
    public void testQuotedArgumentsAndFiles() throws IOException {
        run("""
            create-branch main
            commit main "first commit" "a longer description" a.py "dir with space/b.py"
            """);

        var commit = repo.getBranch("main").orElseThrow().getCommitsList().get(0);
        assertEquals("first commit", commit.name());
        assertEquals("a longer description", commit.description());
        assertEquals(List.of("a.py", "dir with space/b.py"), commit.files());
    }

    @Test
    public void testJoinConflictIsReportedAndScriptContinues() throws IOException {
        int failures = run("""
            create-branch main
            create-branch other
            commit main m1 "main change" x.py
            commit other o1 "other change" x.py
            join other main
            commit main m2 "after" y.py
            """);

        assertEquals(1, failures);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("line 5:"));
        assertEquals(List.of("m1", "m2"), commitNames("main"));
    }

    @Test
    public void testBranchAndRepositoryUndoRedo() throws IOException {
        int failures = run("""
            create-branch main
            commit main c1 one a.py
            commit main c2 two b.py
            undo main
            clone-branch main copy
            redo main
            undo
            """);

        assertEquals(0, failures);
        assertTrue(repo.getBranch("main").isEmpty(), "undoing a clone removes its source");
        assertEquals(List.of("c1"), commitNames("copy"));
    }

    @Test
    public void testCreateBranchAtCommitIndex() throws IOException {
        run("""
            create-branch main
            commit main c1 one a.py
            commit main c2 two b.py
            create-branch hotfix main 0
            """);

        assertEquals(List.of("c1"), commitNames("hotfix"));
    }

    @Test
    public void testUsageErrors() throws IOException {
        int failures = run("""
            frobnicate
            create-branch
            commit ghost c1 one a.py
            create-branch main
            clone-branch main copy 5
            clone-branch main copy x
            commit main "unterminated
            remove-branch main
            """);

        assertEquals(6, failures);
        var errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("unknown command: frobnicate"), errors);
        assertTrue(errors.contains("no such branch: ghost"), errors);
        assertTrue(errors.contains("out of range"), errors);
        assertTrue(errors.contains("unterminated quote"), errors);
        assertTrue(repo.getBranchList().isEmpty());
    }

    @Test
    public void testCommentsAndBlankLinesSkipped() throws IOException {
        int failures = run("""
            # a comment

               create-branch main
            """);

        assertEquals(0, failures);
        assertEquals(List.of("main"), repo.getBranchList().stream().map(IBranch::getName).toList());
    }

    @Test
    public void testTokenize() throws ScriptRunner.CommandException {
        assertEquals(List.of("commit", "main", "a b", ""), ScriptRunner.tokenize("commit  main \"a b\" \"\""));
        assertThrows(ScriptRunner.CommandException.class, () -> ScriptRunner.tokenize("commit \"open"));
    }
}
