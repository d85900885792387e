package org.janelia.blur.client;

import org.janelia.blur.transport.TransportException;
import org.janelia.blur.util.PhaseTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Wraps a run with consistent log statements and exits the JVM with the run's status.
     */
    public void run() {
        System.exit(runAndGetExitStatus());
    }

    /**
     * @return 0 if the client completed,
     *         the transport status code if the client failed because of a {@link TransportException},
     *         or 1 for any other failure.
     */
    public int runAndGetExitStatus() {

        LOG.info("run: entry");

        final PhaseTimer timer = new PhaseTimer();

        int exitStatus;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", timer);
            exitStatus = 0;
        } catch (final TransportException e) {
            LOG.error("run: caught transport exception", e);
            LOG.info("run: exit, processing failed after {}", timer);
            exitStatus = e.getStatusCode();
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", timer);
            exitStatus = 1;
        }

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
