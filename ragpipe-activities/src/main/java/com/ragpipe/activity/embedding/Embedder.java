package com.ragpipe.activity.embedding;

import java.util.List;

/** Text embedding model. Returns one vector per input text, in input order. */
public interface Embedder {

    List<float[]> embed(List<String> texts) throws Exception;

    String modelName();
}
