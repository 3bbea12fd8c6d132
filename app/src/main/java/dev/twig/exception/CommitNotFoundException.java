package dev.twig.exception;

import dev.twig.model.Commit;

/** Thrown when a clone is truncated at a commit that is not part of the source branch. */
public class CommitNotFoundException extends RuntimeException {
    private final String branchName;
    private final Commit commit;

    public CommitNotFoundException(String branchName, Commit commit) {
        super("Commit '%s' is not in branch '%s'".formatted(commit.name(), branchName));
        this.branchName = branchName;
        this.commit = commit;
    }

    public String getBranchName() {
        return branchName;
    }

    public Commit getCommit() {
        return commit;
    }
}
