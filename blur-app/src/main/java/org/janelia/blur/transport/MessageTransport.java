package org.janelia.blur.transport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Point-to-point messaging between a fixed set of ranks ({@code 0} to {@code size - 1}).
 *
 * Messages between the same source and destination on the same {@link MessageTag}
 * are delivered in the order they were sent.  No ordering exists across tags or across sources.
 */
public interface MessageTransport {

    /**
     * @return number of ranks.
     */
    int getSize();

    /**
     * Sends a message, blocking until the transport has accepted it.
     * The payload is copied, later changes to the array are not seen by the receiver.
     *
     * @throws TransportException
     *   if either rank is invalid or the transport has been aborted.
     */
    void send(final int source,
              final int destination,
              final MessageTag tag,
              final byte[] payload)
            throws TransportException;

    /**
     * Receives the next message from source on the specified channel, blocking until it arrives.
     *
     * @throws TransportException
     *   if either rank is invalid or the transport has been aborted.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting.
     */
    byte[] receive(final int destination,
                   final int source,
                   final MessageTag tag)
            throws TransportException, InterruptedException;

    /**
     * Posts a receive for the next message from source on the specified channel without waiting.
     * The returned future fails with a {@link TransportException} if the transport is aborted
     * before a message arrives.
     *
     * @throws TransportException
     *   if either rank is invalid or the transport has been aborted.
     */
    CompletableFuture<byte[]> receiveAsync(final int destination,
                                           final int source,
                                           final MessageTag tag)
            throws TransportException;

    /**
     * Fails all pending and future operations.  Only the first cause is kept.
     */
    void abort(final Throwable cause);

    /**
     * Waits for a posted receive, unwrapping any transport failure.
     */
    static byte[] waitFor(final CompletableFuture<byte[]> pendingReceive)
            throws TransportException, InterruptedException {
        try {
            return pendingReceive.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof TransportException) {
                throw (TransportException) cause;
            }
            throw new TransportException(TransportException.ERR_ABORTED, "receive failed", cause);
        }
    }

}
