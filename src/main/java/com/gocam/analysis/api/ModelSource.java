package com.gocam.analysis.api;

import com.gocam.analysis.core.model.GoCamModel;

/**
 * A named source of one parsed model, backed by an external parser.
 */
public interface ModelSource {

    /**
     * Name used in failure reports, typically the file path.
     */
    String name();

    /**
     * Parses the source. Any runtime exception thrown here, including one raised
     * while assembling the model, fails only this source within a batch.
     *
     * @throws ModelParseException         if the content is malformed
     * @throws java.io.UncheckedIOException if the source cannot be read
     */
    GoCamModel load();

    /**
     * Wraps an already parsed model.
     */
    static ModelSource of(GoCamModel model) {
        return new ModelSource() {
            @Override
            public String name() {
                return model.getId();
            }

            @Override
            public GoCamModel load() {
                return model;
            }
        };
    }
}
