package com.dnobretech.teialigner.align;

/**
 * Aligner parameters.
 *
 * @param maxAlign   maximum number of items (both sides together) in one correspondence
 * @param topK       neighbours averaged for margin scoring
 * @param win        half-width of the search band around the diagonal
 * @param skip       score of leaving an item unmatched
 * @param margin     subtract the neighbourhood similarity from each score
 * @param lenPenalty damp scores of correspondences with very different text lengths
 */
public record AlignConfig(int maxAlign, int topK, int win, double skip, boolean margin, boolean lenPenalty) {

    public static AlignConfig defaults() {
        return new AlignConfig(5, 3, 5, -0.1, true, true);
    }

    public AlignConfig {
        if (maxAlign < 1 || maxAlign > 10) throw new IllegalArgumentException("max_align must be in 1..10");
        if (topK < 1 || topK > 10) throw new IllegalArgumentException("top_k must be in 1..10");
        if (win < 1 || win > 20) throw new IllegalArgumentException("win must be in 1..20");
        if (skip < -1.0 || skip > 0.0) throw new IllegalArgumentException("skip must be in -1.0..0.0");
    }
}
