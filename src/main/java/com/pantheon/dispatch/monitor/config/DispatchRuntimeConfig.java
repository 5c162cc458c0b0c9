package com.pantheon.dispatch.monitor.config;

import com.pantheon.dispatch.monitor.internal.exec.DispatchTimingPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the dispatch monitor runtime.
 *
 * @param timingPolicy          decision and countdown timing
 * @param readerBindAddress     local address the RFID reader gateway reports to
 * @param readerControlAddress  where re-synchronisation requests are sent; empty disables them
 */
public record DispatchRuntimeConfig(
    DispatchTimingPolicy timingPolicy,
    InetSocketAddress readerBindAddress,
    Optional<InetSocketAddress> readerControlAddress
) {
    public DispatchRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(readerBindAddress, "readerBindAddress");
        Objects.requireNonNull(readerControlAddress, "readerControlAddress");
    }

    public static DispatchRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DispatchTimingPolicy timingPolicy = DispatchTimingPolicy.defaults();
        private InetSocketAddress readerBindAddress = new InetSocketAddress(0);
        private InetSocketAddress readerControlAddress;

        public Builder withTimingPolicy(DispatchTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withReaderBindAddress(InetSocketAddress address) {
            this.readerBindAddress = address;
            return this;
        }

        public Builder withReaderControlAddress(InetSocketAddress address) {
            this.readerControlAddress = address;
            return this;
        }

        public DispatchRuntimeConfig build() {
            return new DispatchRuntimeConfig(
                    timingPolicy,
                    readerBindAddress,
                    Optional.ofNullable(readerControlAddress));
        }
    }
}
