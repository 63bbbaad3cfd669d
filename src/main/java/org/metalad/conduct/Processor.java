package org.metalad.conduct;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;

import org.metalad.exceptions.ConfigurationException;

/**
 * One stage of the processor chain. Every exception thrown by process() becomes an `error`
 * outcome of the item.
 */
public interface Processor {

        String getName();

        /**
         * @return False if the processor must not be invoked by two workers at the same time
         */
        default boolean isConcurrent() {
            return true;
        }

        void process(PipelineData data) throws IOException, ConfigurationException,
            NoSuchAlgorithmException, InterruptedException;
}
