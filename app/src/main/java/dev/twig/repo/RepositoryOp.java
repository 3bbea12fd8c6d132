package dev.twig.repo;

import dev.twig.branch.IBranch;

/** Branch lifecycle operations recorded in a repository's history. */
public sealed interface RepositoryOp
        permits RepositoryOp.CreateBranch,
                RepositoryOp.RemoveBranch,
                RepositoryOp.CloneBranch,
                RepositoryOp.AddBranch {

    record CreateBranch(String name) implements RepositoryOp {}

    record RemoveBranch(String name) implements RepositoryOp {}

    record CloneBranch(String sourceName, String newName) implements RepositoryOp {}

    /** Carries the inserted branch so redo can put the same object back. */
    record AddBranch(String name, IBranch branch) implements RepositoryOp {}
}
