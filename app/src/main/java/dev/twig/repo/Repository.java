package dev.twig.repo;

import dev.twig.branch.Branch;
import dev.twig.branch.IBranch;
import dev.twig.history.OperationHistory;
import dev.twig.model.Commit;
import dev.twig.util.TwigSettings;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory repository. Owns its branches exclusively, keyed by the name they had when inserted, and records branch
 * lifecycle events as {@link RepositoryOp}s.
 *
 * <p>Undo and redo only move the recorded entries and delete map keys; removed branches are not retained, so they
 * cannot be restored. Undoing a {@link RepositoryOp.CreateBranch} discards the entry without reverting it.
 *
 * <p>Not thread-safe. Callers serialize access to the repository and every branch in it.
 */
public class Repository implements IRepository {
    private static final Logger logger = LogManager.getLogger(Repository.class);

    private final String name;
    private final Map<String, IBranch> branches = new LinkedHashMap<>();
    private final OperationHistory<RepositoryOp> history;
    private final TwigSettings settings;
    private final Clock clock;

    public Repository(String name) {
        this(name, TwigSettings.load(), Clock.systemDefaultZone());
    }

    public Repository(String name, TwigSettings settings, Clock clock) {
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
    public List<IBranch> getBranchList() {
        return List.copyOf(branches.values());
    }

    @Override
    public Optional<IBranch> getBranch(String name) {
        return Optional.ofNullable(branches.get(name));
    }

    @Override
    public void createBranch(String newName, @Nullable String baseName, @Nullable Commit lastCommit) {
        IBranch created;
        // an empty base name means no base
        if (baseName != null && !baseName.isEmpty()) {
            var base = branches.get(baseName);
            if (base == null) {
                logger.debug("Repository {}: base branch {} not found, {} not created", name, baseName, newName);
                return;
            }
            created = base.clone(lastCommit);
            created.setName(newName);
        } else {
            created = new Branch(newName, settings, clock);
        }
        branches.put(newName, created);
        history.record(new RepositoryOp.CreateBranch(newName));
        logger.debug("Repository {}: created branch {}", name, newName);
    }

    @Override
    public void removeBranch(String name) {
        if (branches.remove(name) == null) {
            logger.debug("Repository {}: no branch {} to remove", this.name, name);
            return;
        }
        history.record(new RepositoryOp.RemoveBranch(name));
        logger.debug("Repository {}: removed branch {}", this.name, name);
    }

    @Override
    public void cloneBranch(String name, String newName, @Nullable Commit lastCommit) {
        var source = branches.get(name);
        if (source == null) {
            logger.debug("Repository {}: no branch {} to clone", this.name, name);
            return;
        }
        var cloned = source.clone(lastCommit);
        cloned.setName(newName);
        branches.put(newName, cloned);
        history.record(new RepositoryOp.CloneBranch(name, newName));
        logger.debug("Repository {}: cloned {} as {}", this.name, name, newName);
    }

    @Override
    public void addBranch(IBranch branch) {
        var branchName = branch.getName();
        branches.put(branchName, branch);
        history.record(new RepositoryOp.AddBranch(branchName, branch));
        logger.debug("Repository {}: added branch {}", name, branchName);
    }

    @Override
    public void undo() {
        var popped = history.popUndo();
        if (popped.isEmpty()) {
            logger.debug("Repository {}: nothing to undo", name);
            return;
        }
        var op = popped.get();
        if (op instanceof RepositoryOp.RemoveBranch remove) {
            branches.remove(remove.name());
            history.pushRedo(op);
        } else if (op instanceof RepositoryOp.CloneBranch clone) {
            // removes the source entry, not the clone
            branches.remove(clone.sourceName());
            history.pushRedo(op);
        } else if (op instanceof RepositoryOp.AddBranch add) {
            branches.remove(add.name());
            history.pushRedo(op);
        } else if (op instanceof RepositoryOp.CreateBranch create) {
            logger.warn(
                    "Repository {}: undo of branch creation {} is not supported, entry discarded",
                    name,
                    create.name());
            return;
        }
        logger.debug("Repository {}: undid {}", name, op);
    }

    @Override
    public void redo() {
        var popped = history.popRedo();
        if (popped.isEmpty()) {
            logger.debug("Repository {}: nothing to redo", name);
            return;
        }
        var op = popped.get();
        if (op instanceof RepositoryOp.RemoveBranch remove) {
            branches.remove(remove.name());
        } else if (op instanceof RepositoryOp.AddBranch add) {
            branches.put(add.name(), add.branch());
        }
        // CloneBranch has nothing to rebuild; CreateBranch never reaches the redo log
        history.pushUndo(op);
        logger.debug("Repository {}: redid {}", name, op);
    }

    /** Recorded operations that {@link #undo()} would revert, oldest → newest. */
    public List<RepositoryOp> getUndoEntries() {
        return history.undoEntries();
    }

    /** Undone operations that {@link #redo()} would re-apply, oldest → newest. */
    public List<RepositoryOp> getRedoEntries() {
        return history.redoEntries();
    }

    OperationHistory<RepositoryOp> getHistory() {
        return history;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("Repository: ").append(name).append('\n');
        for (var branch : branches.values()) {
            sb.append(branch);
        }
        return sb.toString();
    }
}
