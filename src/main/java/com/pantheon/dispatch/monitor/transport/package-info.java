/**
 * Transport ports between the reader driver and a concrete networking stack.
 *
 * <p>Everything above these interfaces sees raw {@code byte[]} payloads,
 * standard {@link java.net.SocketAddress}es and up/down notifications. Netty
 * types stay inside {@code transport.udp.netty}.</p>
 */
package com.pantheon.dispatch.monitor.transport;
