package com.dnobretech.teialigner.client;

import java.util.List;

/**
 * Shared, read-only handle to the sentence embedding model. One instance serves all
 * requests; implementations must allow concurrent {@link #embed} calls.
 */
public interface EmbeddingModel {

    // one unit-normalized vector per text, in input order
    List<double[]> embed(List<String> texts);

    boolean isLoaded();
}
