package com.backstop.core.transaction;

public record TransactionVerdict(
    CommitSafety safety,
    String reason
) {}
