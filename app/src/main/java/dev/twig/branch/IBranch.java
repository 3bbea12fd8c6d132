package dev.twig.branch;

import dev.twig.exception.CommitNotFoundException;
import dev.twig.exception.NotJoinableBranchesException;
import dev.twig.model.Commit;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A named, ordered commit history with its own undo/redo log. */
public interface IBranch {

    String getName();

    /**
     * Renames this branch. The owning repository does not re-key its map, so callers keep the two consistent.
     *
     * @param name the new name
     */
    void setName(String name);

    /** Commits oldest → newest. */
    List<Commit> getCommitsList();

    /** Appends a new commit and records it for undo. */
    void addCommit(String name, String description, List<String> files);

    /** Structural copy of the full history under the same name, with empty undo/redo logs. */
    IBranch clone();

    /**
     * Structural copy of the history up to and including {@code lastCommit}, or the full history when it is
     * {@code null}. The copy starts with empty undo/redo logs.
     *
     * @throws CommitNotFoundException if {@code lastCommit} is not in this branch
     */
    IBranch clone(@Nullable Commit lastCommit);

    /**
     * Re-creates every commit of this branch in {@code destination}, oldest first, provided no path is touched by
     * commits of both branches. This branch is left untouched.
     *
     * @throws NotJoinableBranchesException if the branches share a touched path; {@code destination} is unchanged
     */
    void join(IBranch destination);

    /** Reverts the most recent recorded operation; no-op when there is none. */
    void undo();

    /** Re-applies the most recently undone operation; no-op when there is none. */
    void redo();
}
