package com.pantheon.dispatch.monitor.reader;

import com.pantheon.dispatch.monitor.transport.DatagramEndpoint;
import com.pantheon.dispatch.monitor.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * UdpTagReportReader
 * =============================================================================
 * {@link ReaderDriver} for a reader gateway that forwards tag reports as UDP
 * datagrams.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → TagReportDecoder
 *            → TagIngestionSink.onTagsObserved(...)
 * </pre>
 *
 * <p>Undecodable datagrams are dropped here and never reach the monitor. The
 * reader counts as active while the endpoint is up.</p>
 *
 * <h2>Re-synchronisation</h2>
 * When a control address is configured, {@link #resynchronize()} sends a
 * {@code RESYNC} datagram there, asking the gateway to flush its tag cache and
 * report every tag in the field again. Without one, re-synchronisation is a
 * no-op.
 */
public final class UdpTagReportReader implements ReaderDriver, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpTagReportReader.class);

    static final byte[] RESYNC_COMMAND = "RESYNC\n".getBytes(StandardCharsets.US_ASCII);

    private final DatagramEndpoint endpoint;
    private final TagReportDecoder decoder;
    private final SocketAddress controlAddress;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private volatile TagIngestionSink sink;

    /**
     * @param endpoint       transport the reports arrive on
     * @param decoder        report decoder
     * @param controlAddress where to send re-synchronisation requests; may be {@code null}
     */
    public UdpTagReportReader(DatagramEndpoint endpoint,
                              TagReportDecoder decoder,
                              SocketAddress controlAddress)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.controlAddress = controlAddress;

        this.endpoint.setListener(this);
    }

    @Override
    public void setTagSink(TagIngestionSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void start() {
        if (sink == null) {
            throw new IllegalStateException("TagIngestionSink must be set before start()");
        }
        endpoint.start();
    }

    @Override
    public void stop() {
        endpoint.stop();
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public void resynchronize() {
        if (controlAddress == null) {
            log.debug("Reader re-synchronisation requested; no control address configured");
            return;
        }
        log.info("Requesting reader re-synchronisation from {}", controlAddress);
        endpoint.send(controlAddress, RESYNC_COMMAND.clone());
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        if (active.compareAndSet(false, true)) {
            log.info("RFID reader transport up");
        }
    }

    @Override
    public void onTransportDown(Throwable cause) {
        boolean wasActive = active.getAndSet(false);
        if (cause != null) {
            log.warn("RFID reader transport failed", cause);
        }
        else if (wasActive) {
            log.info("RFID reader transport down");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        Optional<Set<String>> tagIds = decoder.decode(payload);
        if (tagIds.isEmpty()) {
            log.debug("Dropping tag report without valid identifiers from {}", remote);
            return;
        }

        TagIngestionSink s = sink;
        if (s != null) {
            s.onTagsObserved(tagIds.get());
        }
    }
}
