package io.keepsake.core.job;

import java.io.IOException;

/**
 * The work a job performs once the worker picks it up.
 */
public interface JobTask {

    RunOutcome execute() throws IOException;
}
