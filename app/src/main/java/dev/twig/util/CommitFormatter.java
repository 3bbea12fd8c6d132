package dev.twig.util;

import dev.twig.model.Commit;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Human-readable rendering of commits and branch listings. */
public final class CommitFormatter {
    private static volatile @Nullable CommitFormatter defaultInstance;

    private final DateTimeFormatter timestampFormat;

    public CommitFormatter(TwigSettings settings) {
        this(settings, ZoneId.systemDefault());
    }

    public CommitFormatter(TwigSettings settings, ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern(settings.timestampPattern()).withZone(zone);
    }

    /** Formatter for the loaded {@link TwigSettings}. */
    public static CommitFormatter defaultFormatter() {
        var local = defaultInstance;
        if (local == null) {
            local = new CommitFormatter(TwigSettings.load());
            defaultInstance = local;
        }
        return local;
    }

    public String format(Commit commit) {
        return "Commit: %s, Description: %s, Created at: %s"
                .formatted(commit.name(), commit.description(), timestampFormat.format(commit.createdAt()));
    }

    /** Header line followed by one line per commit, oldest first. */
    public String formatBranch(String branchName, List<Commit> commits) {
        var sb = new StringBuilder("Branch: ").append(branchName).append('\n');
        for (var commit : commits) {
            sb.append(format(commit)).append('\n');
        }
        return sb.toString();
    }
}
