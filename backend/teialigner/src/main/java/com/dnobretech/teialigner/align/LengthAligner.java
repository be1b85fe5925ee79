package com.dnobretech.teialigner.align;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bead aligner scored with the Gale-Church length model: translated runs have
 * character lengths in a roughly constant ratio. Needs no model.
 */
@Component("lengthAligner")
public class LengthAligner extends BeadAligner {

    // variance of the length ratio per character
    private static final double S2 = 6.8;

    private static final double P_11 = 0.89;
    private static final double P_12 = 0.089;
    private static final double P_22 = 0.011;
    private static final double P_OTHER = 0.005;

    @Override
    protected BeadScorer scorer(List<String> src, List<String> tgt, AlignConfig config) {
        int[] srcPrefix = prefixLengths(src);
        int[] tgtPrefix = prefixLengths(tgt);
        int srcTotal = srcPrefix[src.size()];
        int tgtTotal = tgtPrefix[tgt.size()];
        double ratio = srcTotal == 0 || tgtTotal == 0 ? 1.0 : (double) tgtTotal / srcTotal;

        return new BeadScorer() {
            @Override
            public double score(int i, int a, int j, int b) {
                return similarity(i, a, j, b);
            }

            @Override
            public double similarity(int i, int a, int j, int b) {
                int l1 = srcPrefix[i + a] - srcPrefix[i];
                int l2 = tgtPrefix[j + b] - tgtPrefix[j];
                return prior(a, b) / P_11 * matchProbability(l1, l2, ratio);
            }
        };
    }

    static double matchProbability(int l1, int l2, double ratio) {
        double mean = Math.max(1.0, (l1 + l2 / ratio) / 2.0);
        double delta = (l2 - l1 * ratio) / Math.sqrt(mean * S2);
        return 2.0 * (1.0 - normalCdf(Math.abs(delta)));
    }

    static double prior(int a, int b) {
        if (a == 1 && b == 1) return P_11;
        if ((a == 1 && b == 2) || (a == 2 && b == 1)) return P_12;
        if (a == 2 && b == 2) return P_22;
        return P_OTHER;
    }

    // Abramowitz-Stegun 7.1.26
    static double normalCdf(double x) {
        double z = Math.abs(x) / Math.sqrt(2.0);
        double t = 1.0 / (1.0 + 0.3275911 * z);
        double erf = 1.0 - (((((1.061405429 * t - 1.453152027) * t) + 1.421413741) * t - 0.284496736) * t
                + 0.254829592) * t * Math.exp(-z * z);
        return x >= 0 ? 0.5 * (1.0 + erf) : 0.5 * (1.0 - erf);
    }

    private static int[] prefixLengths(List<String> items) {
        int[] prefix = new int[items.size() + 1];
        for (int k = 0; k < items.size(); k++) {
            prefix[k + 1] = prefix[k] + items.get(k).length();
        }
        return prefix;
    }
}
