package org.metalad.conduct;

import java.io.IOException;
import java.util.Iterator;

/**
 * Source of the items of a pipeline run
 */
public interface Provider {

        String getName();

        /**
         * Start a new enumeration. Items are produced lazily; the iterator may throw unchecked
         * exceptions, which end the run as FAILED.
         *
         * @return Finite iterator of items
         * @throws IOException When the enumeration cannot start
         */
        Iterator<PipelineData> provide() throws IOException;
}
