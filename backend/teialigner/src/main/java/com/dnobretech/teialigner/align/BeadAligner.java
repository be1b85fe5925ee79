package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.exception.AlignmentException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Monotonic alignment by dynamic programming over "beads": a bead takes a source items and
 * b target items, with a + b <= max_align, or leaves one item unmatched at the skip score.
 * The search stays inside a band of half-width {@code win} (plus the diagonal's slope)
 * around the diagonal.
 * Subclasses only decide how a bead is scored.
 */
@Slf4j
public abstract class BeadAligner implements Aligner {

    private static final double NONE = Double.NEGATIVE_INFINITY;

    protected interface BeadScorer {
        // contribution of bead src[i, i+a) x tgt[j, j+b) to the path score
        double score(int i, int a, int j, int b);

        // similarity reported on the resulting correspondence, 0..1
        double similarity(int i, int a, int j, int b);
    }

    protected abstract BeadScorer scorer(List<String> src, List<String> tgt, AlignConfig config);

    @Override
    public List<Correspondence> align(List<String> src, List<String> tgt, AlignConfig config) {
        final int n = src.size(), m = tgt.size();
        if (n == 0 || m == 0) return unmatched(n, m);

        BeadScorer scorer = scorer(src, tgt, config);
        int[][] beads = beadTypes(config.maxAlign());
        int w = bandWidth(n, m, config);

        double[][] best = new double[n + 1][m + 1];
        int[][] back = new int[n + 1][m + 1];
        for (double[] row : best) Arrays.fill(row, NONE);
        best[0][0] = 0.0;

        for (int i = 0; i <= n; i++) {
            for (int j = 0; j <= m; j++) {
                if (best[i][j] == NONE || !inBand(i, j, n, m, w)) continue;
                for (int k = 0; k < beads.length; k++) {
                    int a = beads[k][0], b = beads[k][1];
                    int ni = i + a, nj = j + b;
                    if (ni > n || nj > m || !inBand(ni, nj, n, m, w)) continue;
                    double s = (a == 0 || b == 0) ? config.skip() : scorer.score(i, a, j, b);
                    double cand = best[i][j] + s;
                    if (cand > best[ni][nj]) {
                        best[ni][nj] = cand;
                        back[ni][nj] = k;
                    }
                }
            }
        }

        if (best[n][m] == NONE) {
            throw new AlignmentException("No alignment path for " + n + "x" + m + " items");
        }

        List<Correspondence> out = new ArrayList<>();
        int i = n, j = m;
        while (i > 0 || j > 0) {
            int[] bead = beads[back[i][j]];
            int a = bead[0], b = bead[1];
            i -= a;
            j -= b;
            double sim = (a == 0 || b == 0) ? 0.0 : scorer.similarity(i, a, j, b);
            out.add(Correspondence.of(range(i, a), range(j, b), sim));
        }
        Collections.reverse(out);

        log.debug("{}: {}x{} -> {} correspondences (score={})",
                getClass().getSimpleName(), n, m, out.size(), best[n][m]);
        return out;
    }

    // (1,0) and (0,1) first, then every (a,b) with a,b >= 1 and a + b <= max_align
    static int[][] beadTypes(int maxAlign) {
        int limit = Math.max(2, maxAlign);
        List<int[]> types = new ArrayList<>();
        types.add(new int[]{1, 0});
        types.add(new int[]{0, 1});
        for (int a = 1; a < limit; a++) {
            for (int b = 1; a + b <= limit; b++) {
                types.add(new int[]{a, b});
            }
        }
        return types.toArray(new int[0][]);
    }

    // the band must also cover the steps a steep diagonal takes within one row or column
    static int bandWidth(int n, int m, AlignConfig config) {
        int slope = (int) Math.ceil((double) Math.max(n, m) / Math.min(n, m));
        return Math.max(1, config.win()) + slope;
    }

    private static boolean inBand(int i, int j, int n, int m, int w) {
        double center = (double) i * m / n;
        return Math.abs(j - center) <= w;
    }

    private static List<Correspondence> unmatched(int n, int m) {
        List<Correspondence> out = new ArrayList<>(n + m);
        for (int i = 0; i < n; i++) out.add(Correspondence.of(List.of(i), List.of(), 0.0));
        for (int j = 0; j < m; j++) out.add(Correspondence.of(List.of(), List.of(j), 0.0));
        return out;
    }

    private static List<Integer> range(int from, int len) {
        return IntStream.range(from, from + len).boxed().toList();
    }
}
