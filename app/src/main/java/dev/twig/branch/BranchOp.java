package dev.twig.branch;

import dev.twig.model.Commit;

/** Reversible operations recorded in a branch's history. */
public sealed interface BranchOp permits BranchOp.AddCommit {

    record AddCommit(Commit commit) implements BranchOp {}
}
