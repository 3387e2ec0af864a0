package com.geoinsight.backend.provider;

/**
 * Image embedding model.
 */
public interface EmbeddingModel {

    /**
     * Embedding of an encoded image. The vector length is {@link #dimension()}.
     */
    double[] embed(byte[] image);

    int dimension();
}
