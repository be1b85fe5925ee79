package com.dnobretech.teialigner.align;

import com.dnobretech.teialigner.client.EmbeddingModel;
import com.dnobretech.teialigner.exception.AlignmentException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EmbeddingAlignerTest {

    // bag-of-concepts vectors: translations share a concept dimension
    private static final Map<String, Integer> CONCEPTS = Map.of(
            "cat", 0, "gatto", 0,
            "dog", 1, "cane", 1,
            "house", 2, "casa", 2);

    static class ConceptModel implements EmbeddingModel {
        final List<String> seen = new ArrayList<>();

        @Override
        public List<double[]> embed(List<String> texts) {
            seen.addAll(texts);
            List<double[]> out = new ArrayList<>();
            for (String t : texts) {
                double[] v = new double[CONCEPTS.size()];
                for (String w : t.toLowerCase().split("\\W+")) {
                    Integer d = CONCEPTS.get(w);
                    if (d != null) v[d] += 1.0;
                }
                out.add(v);
            }
            return out;
        }

        @Override
        public boolean isLoaded() {
            return true;
        }
    }

    private static final AlignConfig PLAIN = new AlignConfig(2, 3, 5, -0.1, false, false);

    @Test
    void alignsTranslationsOneToOne() {
        EmbeddingAligner aligner = new EmbeddingAligner(new ConceptModel());

        List<Correspondence> out = aligner.align(
                List.of("The cat.", "The dog.", "The house."),
                List.of("Il gatto.", "Il cane.", "La casa."),
                PLAIN);

        assertThat(out).hasSize(3);
        assertThat(out).extracting(Correspondence::sourceIndices)
                .containsExactly(List.of(0), List.of(1), List.of(2));
        assertThat(out).allSatisfy(c -> assertThat(c.score()).isCloseTo(1.0, within(1e-9)));
    }

    @Test
    void crossedOrderLeavesOneSidedItems() {
        EmbeddingAligner aligner = new EmbeddingAligner(new ConceptModel());

        List<Correspondence> out = aligner.align(
                List.of("The cat.", "The dog."),
                List.of("Il cane.", "Il gatto."),
                PLAIN);

        assertThat(out).filteredOn(c -> !c.isOneSided())
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.score()).isCloseTo(1.0, within(1e-9));
                    assertThat(c.sourceIndices()).hasSize(1);
                    assertThat(c.targetIndices()).hasSize(1);
                });
        assertThat(out).filteredOn(Correspondence::isOneSided).hasSize(2);
    }

    @Test
    void joinsRunsForManyToOneBeads() {
        ConceptModel model = new ConceptModel();
        EmbeddingAligner aligner = new EmbeddingAligner(model);

        List<Correspondence> out = aligner.align(
                List.of("The cat", "and the dog."),
                List.of("Il gatto e il cane."),
                new AlignConfig(3, 3, 5, -0.1, false, false));

        assertThat(out).singleElement().satisfies(c -> {
            assertThat(c.sourceIndices()).containsExactly(0, 1);
            assertThat(c.targetIndices()).containsExactly(0);
        });
        assertThat(model.seen).contains("The cat and the dog.");
    }

    @Test
    void lengthPenaltyDampsUnevenPairs() {
        assertThat(EmbeddingAligner.lengthFactor(10, 10)).isEqualTo(1.0);
        assertThat(EmbeddingAligner.lengthFactor(10, 40)).isCloseTo(0.85, within(1e-9));
        assertThat(EmbeddingAligner.cosine(new double[]{1, 0}, new double[]{0, 0})).isZero();
    }

    @Test
    void marginScoringStillFindsTheDiagonal() {
        EmbeddingAligner aligner = new EmbeddingAligner(new ConceptModel());

        List<Correspondence> out = aligner.align(
                List.of("The cat.", "The dog.", "The house."),
                List.of("Il gatto.", "Il cane.", "La casa."),
                AlignConfig.defaults());

        assertThat(out).extracting(Correspondence::targetIndices)
                .containsExactly(List.of(0), List.of(1), List.of(2));
    }

    @Test
    void wrongVectorCountIsAnAlignmentError() {
        EmbeddingModel broken = new EmbeddingModel() {
            @Override
            public List<double[]> embed(List<String> texts) {
                return List.of();
            }

            @Override
            public boolean isLoaded() {
                return false;
            }
        };

        assertThatThrownBy(() -> new EmbeddingAligner(broken).align(List.of("a"), List.of("b"), PLAIN))
                .isInstanceOf(AlignmentException.class);
    }
}
