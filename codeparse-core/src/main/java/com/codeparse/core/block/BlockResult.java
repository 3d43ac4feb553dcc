package com.codeparse.core.block;

import java.util.List;

import com.codeparse.core.diagnostic.ParseWarning;

/**
 * Outcome of a {@link BlockParser} scan.
 *
 * @param memberIndices indices of the tokens forming the block's content, in order, excluding the
 *                      opening delimiter and the closing delimiter or dedent
 * @param nextIndex index of the first token after the block
 * @param terminated false if input ended before the block was closed
 * @param diagnostics irregularities noticed while scanning (never fatal)
 */
public record BlockResult(
    List<Integer> memberIndices,
    int nextIndex,
    boolean terminated,
    List<ParseWarning> diagnostics
) {
    public BlockResult {
        memberIndices = memberIndices != null ? List.copyOf(memberIndices) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean isEmpty() {
        return memberIndices.isEmpty();
    }

    /**
     * Returns the first member index, or {@code nextIndex} for an empty block.
     */
    public int firstMember() {
        return memberIndices.isEmpty() ? nextIndex : memberIndices.get(0);
    }

    /**
     * Returns the index just past the last member, or {@code nextIndex} for an empty block.
     */
    public int memberEnd() {
        return memberIndices.isEmpty() ? nextIndex : memberIndices.get(memberIndices.size() - 1) + 1;
    }
}
