package org.learningjava.carbonengine.application.port;

import java.util.List;

public interface EmbeddingPort {
    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);

    /** Model id, recorded next to persisted calculations. */
    String model();
}
