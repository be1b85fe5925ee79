package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.client.EmbeddingModel;
import com.dnobretech.teialigner.exception.AlignmentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bead aligner scored by cosine similarity of sentence embeddings. Every run of up to
 * max_align - 1 consecutive items is embedded once (joined with a space), so a bead's
 * score is the similarity of its two joined runs.
 */
@Slf4j
@Component("embeddingAligner")
@RequiredArgsConstructor
public class EmbeddingAligner extends BeadAligner {

    private final EmbeddingModel model;

    @Override
    protected BeadScorer scorer(List<String> src, List<String> tgt, AlignConfig config) {
        int maxRun = Math.max(1, config.maxAlign() - 1);
        double[][][] srcVec = embedRuns(src, maxRun);
        double[][][] tgtVec = embedRuns(tgt, maxRun);

        double[] srcMargin = new double[src.size()];
        double[] tgtMargin = new double[tgt.size()];
        if (config.margin()) {
            neighbourMeans(srcVec, tgtVec, config.topK(), srcMargin, tgtMargin);
        }

        int[] srcPrefix = prefixLengths(src);
        int[] tgtPrefix = prefixLengths(tgt);

        return new BeadScorer() {
            @Override
            public double score(int i, int a, int j, int b) {
                double s = similarity(i, a, j, b);
                if (config.margin()) {
                    s -= (mean(srcMargin, i, a) + mean(tgtMargin, j, b)) / 2.0;
                }
                return s;
            }

            @Override
            public double similarity(int i, int a, int j, int b) {
                double s = cosine(srcVec[i][a - 1], tgtVec[j][b - 1]);
                if (config.lenPenalty()) {
                    s *= lengthFactor(srcPrefix[i + a] - srcPrefix[i], tgtPrefix[j + b] - tgtPrefix[j]);
                }
                return Math.max(0.0, Math.min(1.0, s));
            }
        };
    }

    // vectors[i][len - 1] = embedding of items[i, i + len); null past the end
    private double[][][] embedRuns(List<String> items, int maxRun) {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            StringBuilder sb = new StringBuilder();
            for (int len = 1; len <= maxRun && i + len <= items.size(); len++) {
                if (len > 1) sb.append(' ');
                sb.append(items.get(i + len - 1));
                texts.add(sb.toString());
            }
        }

        List<double[]> vectors = model.embed(texts);
        if (vectors.size() != texts.size()) {
            throw new AlignmentException("Embedding model returned " + vectors.size() + " vectors for "
                    + texts.size() + " texts");
        }

        double[][][] out = new double[items.size()][maxRun][];
        int k = 0;
        for (int i = 0; i < items.size(); i++) {
            for (int len = 1; len <= maxRun && i + len <= items.size(); len++) {
                out[i][len - 1] = vectors.get(k++);
            }
        }
        log.debug("EmbeddingAligner: embedded {} runs for {} items", texts.size(), items.size());
        return out;
    }

    // mean of the top-k single-item similarities of each item against the other side
    private static void neighbourMeans(double[][][] srcVec, double[][][] tgtVec, int k,
                                       double[] srcOut, double[] tgtOut) {
        int n = srcVec.length, m = tgtVec.length;
        double[][] srcTop = new double[n][];
        double[][] tgtTop = new double[m][];
        for (int i = 0; i < n; i++) srcTop[i] = emptyTop(Math.min(k, m));
        for (int j = 0; j < m; j++) tgtTop[j] = emptyTop(Math.min(k, n));

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                double s = cosine(srcVec[i][0], tgtVec[j][0]);
                offer(srcTop[i], s);
                offer(tgtTop[j], s);
            }
        }
        for (int i = 0; i < n; i++) srcOut[i] = Arrays.stream(srcTop[i]).average().orElse(0.0);
        for (int j = 0; j < m; j++) tgtOut[j] = Arrays.stream(tgtTop[j]).average().orElse(0.0);
    }

    private static double[] emptyTop(int k) {
        double[] top = new double[Math.max(1, k)];
        Arrays.fill(top, Double.NEGATIVE_INFINITY);
        return top;
    }

    // keeps top sorted descending
    private static void offer(double[] top, double s) {
        int last = top.length - 1;
        if (s <= top[last]) return;
        int p = last;
        while (p > 0 && top[p - 1] < s) {
            top[p] = top[p - 1];
            p--;
        }
        top[p] = s;
    }

    private static double mean(double[] values, int from, int len) {
        double sum = 0;
        for (int k = from; k < from + len; k++) sum += values[k];
        return sum / len;
    }

    static double lengthFactor(int l1, int l2) {
        int max = Math.max(l1, l2);
        if (max == 0) return 1.0;
        return 0.8 + 0.2 * Math.min(l1, l2) / max;
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int k = 0; k < a.length && k < b.length; k++) {
            dot += a[k] * b[k];
            na += a[k] * a[k];
            nb += b[k] * b[k];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / Math.sqrt(na * nb);
    }

    private static int[] prefixLengths(List<String> items) {
        int[] prefix = new int[items.size() + 1];
        for (int k = 0; k < items.size(); k++) prefix[k + 1] = prefix[k] + items.get(k).length();
        return prefix;
    }
}
