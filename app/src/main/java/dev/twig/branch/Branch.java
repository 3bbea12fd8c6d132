package dev.twig.branch;

import dev.twig.exception.CommitNotFoundException;
import dev.twig.exception.NotJoinableBranchesException;
import dev.twig.history.OperationHistory;
import dev.twig.model.Commit;
import dev.twig.util.CommitFormatter;
import dev.twig.util.TwigSettings;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory branch: an append-only list of commits plus an undo/redo log of {@link BranchOp}s.
 *
 * <p>Not thread-safe. A branch is owned by one repository and driven by a single writer.
 */
public class Branch implements IBranch {
    private static final Logger logger = LogManager.getLogger(Branch.class);

    private String name;
    private final List<Commit> commits = new ArrayList<>();
    private final OperationHistory<BranchOp> history;
    private final TwigSettings settings;
    private final Clock clock;

    public Branch(String name) {
        this(name, TwigSettings.load(), Clock.systemDefaultZone());
    }

    public Branch(String name, TwigSettings settings, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.settings = settings;
        this.clock = clock;
        this.history = new OperationHistory<>(settings.maxHistoryDepth());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public List<Commit> getCommitsList() {
        return Collections.unmodifiableList(commits);
    }

    @Override
    public void addCommit(String name, String description, List<String> files) {
        var commit = Commit.create(name, description, files, clock);
        commits.add(commit);
        history.record(new BranchOp.AddCommit(commit));
        logger.debug("Branch {}: added commit {} touching {}", this.name, name, commit.files());
    }

    @Override
    public Branch clone() {
        return clone(null);
    }

    @Override
    public Branch clone(@Nullable Commit lastCommit) {
        var cloned = new Branch(name, settings, clock);
        if (lastCommit == null) {
            cloned.commits.addAll(commits);
        } else {
            int idx = indexOf(lastCommit);
            if (idx < 0) {
                throw new CommitNotFoundException(name, lastCommit);
            }
            cloned.commits.addAll(commits.subList(0, idx + 1));
        }
        logger.debug("Branch {}: cloned {} of {} commits", name, cloned.commits.size(), commits.size());
        return cloned;
    }

    @Override
    public void join(IBranch destination) {
        var conflicts = conflictingFiles(destination);
        if (!conflicts.isEmpty()) {
            throw new NotJoinableBranchesException(name, destination.getName(), conflicts);
        }
        // snapshot first: destination may be this branch
        var toCopy = List.copyOf(commits);
        for (var commit : toCopy) {
            destination.addCommit(commit.name(), commit.description(), commit.files());
        }
        logger.debug("Branch {}: joined {} commits into {}", name, toCopy.size(), destination.getName());
    }

    /** Paths touched both by this branch and by {@code other}, sorted. */
    public List<String> conflictingFiles(IBranch other) {
        var ours = new HashSet<String>();
        for (var commit : commits) {
            ours.addAll(commit.files());
        }
        var shared = new TreeSet<String>();
        for (var commit : other.getCommitsList()) {
            for (var file : commit.files()) {
                if (ours.contains(file)) {
                    shared.add(file);
                }
            }
        }
        return List.copyOf(shared);
    }

    @Override
    public void undo() {
        var op = history.popUndo();
        if (op.isEmpty()) {
            logger.debug("Branch {}: nothing to undo", name);
            return;
        }
        if (op.get() instanceof BranchOp.AddCommit add) {
            removeExact(add.commit());
            history.pushRedo(add);
            logger.debug("Branch {}: undid commit {}", name, add.commit().name());
        }
    }

    @Override
    public void redo() {
        var op = history.popRedo();
        if (op.isEmpty()) {
            logger.debug("Branch {}: nothing to redo", name);
            return;
        }
        if (op.get() instanceof BranchOp.AddCommit add) {
            commits.add(add.commit());
            history.pushUndo(add);
            logger.debug("Branch {}: redid commit {}", name, add.commit().name());
        }
    }

    /** Recorded operations that {@link #undo()} would revert, oldest → newest. */
    public List<BranchOp> getUndoEntries() {
        return history.undoEntries();
    }

    /** Undone operations that {@link #redo()} would re-apply, oldest → newest. */
    public List<BranchOp> getRedoEntries() {
        return history.redoEntries();
    }

    OperationHistory<BranchOp> getHistory() {
        return history;
    }

    private int indexOf(Commit commit) {
        for (int i = 0; i < commits.size(); i++) {
            if (commits.get(i) == commit) {
                return i;
            }
        }
        return -1;
    }

    private void removeExact(Commit commit) {
        int idx = indexOf(commit);
        if (idx >= 0) {
            commits.remove(idx);
        }
    }

    @Override
    public String toString() {
        return new CommitFormatter(settings).formatBranch(name, commits);
    }
}
