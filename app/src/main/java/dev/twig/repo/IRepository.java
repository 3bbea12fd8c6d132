package dev.twig.repo;

import dev.twig.branch.IBranch;
import dev.twig.exception.CommitNotFoundException;
import dev.twig.model.Commit;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A named collection of branches with an undo/redo log of branch lifecycle events. Branch-internal history (commits
 * added to a branch) is not visible here; each branch keeps its own log.
 */
public interface IRepository {

    String getName();

    /** Snapshot of the branches; no ordering contract beyond the implementation's. */
    List<IBranch> getBranchList();

    Optional<IBranch> getBranch(String name);

    /** Creates an empty branch. */
    default void createBranch(String newName) {
        createBranch(newName, null, null);
    }

    default void createBranch(String newName, @Nullable String baseName) {
        createBranch(newName, baseName, null);
    }

    /**
     * Creates {@code newName} as an empty branch, or, when {@code baseName} is given, as a clone of that branch
     * truncated at {@code lastCommit}. A {@code null} or empty {@code baseName} means no base; an unknown one is a
     * silent no-op.
     *
     * @throws CommitNotFoundException if {@code lastCommit} is not in the base branch
     */
    void createBranch(String newName, @Nullable String baseName, @Nullable Commit lastCommit);

    /** Removes the branch; no-op when absent. */
    void removeBranch(String name);

    default void cloneBranch(String name, String newName) {
        cloneBranch(name, newName, null);
    }

    /**
     * Copies {@code name} to {@code newName}, truncated at {@code lastCommit} when given. No-op when {@code name} is
     * absent.
     *
     * @throws CommitNotFoundException if {@code lastCommit} is not in the source branch
     */
    void cloneBranch(String name, String newName, @Nullable Commit lastCommit);

    /** Inserts {@code branch} under its own name. */
    void addBranch(IBranch branch);

    void undo();

    void redo();
}
