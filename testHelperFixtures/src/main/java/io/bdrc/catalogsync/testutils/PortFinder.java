package io.bdrc.catalogsync.testutils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;

import lombok.extern.slf4j.Slf4j;

/**
 * Finds free local ports for servers started inside tests.
 */
@Slf4j
public class PortFinder {
    private static final int MAX_PORT_TRIES = 100;

    private PortFinder() {}

    public static class ExceededMaxPortAssignmentAttemptException extends Exception {
        public ExceededMaxPortAssignmentAttemptException(Throwable cause) {
            super(cause);
        }
    }

    @FunctionalInterface
    public interface PortBinder {
        void bind(int port) throws Exception;
    }

    /**
     * Keeps offering fresh ports to the binder until one binds without throwing.
     */
    public static int retryWithNewPortUntilNoThrow(PortBinder binder) throws ExceededMaxPortAssignmentAttemptException {
        int numTries = 0;
        while (true) {
            int port = findOpenPort();
            try {
                binder.bind(port);
                return port;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExceededMaxPortAssignmentAttemptException(e);
            } catch (Exception e) {
                if (++numTries >= MAX_PORT_TRIES) {
                    log.atError().setCause(e).setMessage("Exceeded max tries {}, giving up")
                        .addArgument(MAX_PORT_TRIES).log();
                    throw new ExceededMaxPortAssignmentAttemptException(e);
                }
                log.atWarn().setCause(e).setMessage("Port {} could not be bound, trying another").addArgument(port).log();
            }
        }
    }

    public static int findOpenPort() {
        try (var serverSocket = new ServerSocket(0)) {
            return serverSocket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to find an open port", e);
        }
    }
}
