package dev.twig.exception;

import java.util.List;

/** Thrown by {@code join} when both branches have commits touching the same path. Nothing is merged. */
public class NotJoinableBranchesException extends RuntimeException {
    private final String sourceBranch;
    private final String destinationBranch;
    private final List<String> conflictingFiles;

    public NotJoinableBranchesException(String sourceBranch, String destinationBranch, List<String> conflictingFiles) {
        super("Cannot join branch '%s' into '%s': both touch %s"
                .formatted(sourceBranch, destinationBranch, String.join(", ", conflictingFiles)));
        this.sourceBranch = sourceBranch;
        this.destinationBranch = destinationBranch;
        this.conflictingFiles = List.copyOf(conflictingFiles);
    }

    public String getSourceBranch() {
        return sourceBranch;
    }

    public String getDestinationBranch() {
        return destinationBranch;
    }

    /** Sorted paths touched by both branches. */
    public List<String> getConflictingFiles() {
        return conflictingFiles;
    }
}
