package org.janelia.blur.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageTransport} for ranks that are threads within the same JVM.
 *
 * Each (source, destination, tag) combination has its own unbounded FIFO channel,
 * so sends never block.  Payloads are copied on send so ranks never share pixel buffers.
 */
public class InProcessTransport
        implements MessageTransport {

    private final int size;
    private final Map<ChannelKey, Channel> channels;
    private volatile TransportException abortException;

    /**
     * @param  size  number of ranks (coordinator included).
     */
    public InProcessTransport(final int size) {
        if (size < 1) {
            throw new IllegalArgumentException("transport needs at least one rank");
        }
        this.size = size;
        this.channels = new ConcurrentHashMap<>();
        this.abortException = null;
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public void send(final int source,
                     final int destination,
                     final MessageTag tag,
                     final byte[] payload)
            throws TransportException {
        getChannel(source, destination, tag).deliver(payload.clone());
    }

    @Override
    public byte[] receive(final int destination,
                          final int source,
                          final MessageTag tag)
            throws TransportException, InterruptedException {
        return MessageTransport.waitFor(receiveAsync(destination, source, tag));
    }

    @Override
    public CompletableFuture<byte[]> receiveAsync(final int destination,
                                                  final int source,
                                                  final MessageTag tag)
            throws TransportException {
        return getChannel(source, destination, tag).postReceive();
    }

    @Override
    public void abort(final Throwable cause) {

        synchronized (this) {
            if (abortException != null) {
                return;
            }
            abortException = new TransportException(TransportException.ERR_ABORTED, "transport aborted", cause);
        }

        LOG.warn("abort: failing all pending receives", cause);

        for (final Channel channel : channels.values()) {
            channel.failPendingReceives();
        }
    }

    public boolean isAborted() {
        return abortException != null;
    }

    private Channel getChannel(final int source,
                               final int destination,
                               final MessageTag tag)
            throws TransportException {
        checkRank("source", source);
        checkRank("destination", destination);
        if (abortException != null) {
            throw abortException;
        }
        return channels.computeIfAbsent(new ChannelKey(source, destination, tag), key -> new Channel());
    }

    private void checkRank(final String context,
                           final int rank)
            throws TransportException {
        if ((rank < 0) || (rank >= size)) {
            throw new TransportException(TransportException.ERR_RANK,
                                         context + " rank " + rank + " is outside of range [0, " + size + ")");
        }
    }

    private class Channel {

        private final Deque<byte[]> messages = new ArrayDeque<>();
        private final Deque<CompletableFuture<byte[]>> pendingReceives = new ArrayDeque<>();

        void deliver(final byte[] payload) {
            boolean delivered = false;
            while (! delivered) {
                final CompletableFuture<byte[]> pendingReceive;
                synchronized (this) {
                    pendingReceive = pendingReceives.poll();
                    if (pendingReceive == null) {
                        messages.add(payload);
                        return;
                    }
                }
                // a cancelled receive does not consume the message
                delivered = pendingReceive.complete(payload);
            }
        }

        CompletableFuture<byte[]> postReceive() {
            final CompletableFuture<byte[]> pendingReceive = new CompletableFuture<>();
            synchronized (this) {
                final byte[] payload = messages.poll();
                if (payload != null) {
                    pendingReceive.complete(payload);
                } else if (abortException != null) {
                    pendingReceive.completeExceptionally(abortException);
                } else {
                    pendingReceives.add(pendingReceive);
                }
            }
            return pendingReceive;
        }

        void failPendingReceives() {
            final List<CompletableFuture<byte[]>> failed;
            synchronized (this) {
                failed = new ArrayList<>(pendingReceives);
                pendingReceives.clear();
            }
            for (final CompletableFuture<byte[]> pendingReceive : failed) {
                pendingReceive.completeExceptionally(abortException);
            }
        }
    }

    private static final class ChannelKey {

        private final int source;
        private final int destination;
        private final MessageTag tag;

        private ChannelKey(final int source,
                           final int destination,
                           final MessageTag tag) {
            this.source = source;
            this.destination = destination;
            this.tag = tag;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (! (o instanceof ChannelKey)) {
                return false;
            }
            final ChannelKey that = (ChannelKey) o;
            return (source == that.source) && (destination == that.destination) && (tag == that.tag);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, destination, tag);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(InProcessTransport.class);
}
