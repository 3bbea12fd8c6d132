package dev.twig.cli;

import dev.twig.repo.Repository;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "twig-cli",
        mixinStandardHelpOptions = true,
        description = "Runs a branch/commit command script against an in-memory repository.")
public final class TwigCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TwigCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_SCRIPT_FAILURES = 2;

    @CommandLine.Option(names = "--repo", description = "Repository name.", defaultValue = "repo")
    private String repoName = "repo";

    @CommandLine.Option(names = "--script", description = "Command script to run. Reads stdin when omitted.")
    @Nullable
    private Path scriptPath;

    @CommandLine.Option(names = "--print", description = "Print the repository when the script finishes.")
    private boolean print = false;

    private final PrintStream out;
    private final PrintStream err;

    public TwigCli() {
        this(System.out, System.err);
    }

    TwigCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TwigCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var repository = new Repository(repoName);
        var runner = new ScriptRunner(repository, out, err);
        int failures;
        try (var reader = openScript()) {
            failures = runner.run(reader);
        } catch (IOException e) {
            logger.error("Failed to read script {}", scriptPath, e);
            err.println("Failed to read script: " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Script aborted", e);
            err.println("Script aborted: " + e);
            return EXIT_ERROR;
        }

        if (print) {
            out.print(repository);
        }
        if (failures > 0) {
            logger.info("Script finished with {} failed line(s)", failures);
            return EXIT_SCRIPT_FAILURES;
        }
        return EXIT_OK;
    }

    private BufferedReader openScript() throws IOException {
        if (scriptPath == null) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return Files.newBufferedReader(scriptPath, StandardCharsets.UTF_8);
    }
}
