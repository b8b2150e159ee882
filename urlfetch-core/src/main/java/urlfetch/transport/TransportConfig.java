/*
 * Copyright (c) 2024-2026 VMware, Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package urlfetch.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Locale;
import java.util.Objects;

import reactor.util.annotation.Nullable;
import urlfetch.tcp.SslProvider;

/**
 * Everything that decides which channel can serve a request: destination, TLS material,
 * proxy and wire logging. Two equal configurations share the same connection pool.
 */
public final class TransportConfig {

	/**
	 * Create a new {@link TransportConfig}.
	 *
	 * @param host the destination host
	 * @param port the destination port
	 * @param sslProvider the TLS configuration, null for plain connections
	 * @param proxyProvider the proxy to tunnel through, null to connect directly
	 * @param wiretap true to log the traffic through a Netty {@code LoggingHandler}
	 * @return a new {@link TransportConfig}
	 */
	public static TransportConfig of(String host, int port, @Nullable SslProvider sslProvider,
			@Nullable ProxyProvider proxyProvider, boolean wiretap) {
		return new TransportConfig(host, port, sslProvider, proxyProvider, wiretap);
	}

	final String        host;
	final int           port;
	final SslProvider   sslProvider;
	final ProxyProvider proxyProvider;
	final boolean       wiretap;

	TransportConfig(String host, int port, @Nullable SslProvider sslProvider,
			@Nullable ProxyProvider proxyProvider, boolean wiretap) {
		this.host = Objects.requireNonNull(host, "host");
		if (port < 0 || port > 65535) {
			throw new IllegalArgumentException("Invalid port: " + port);
		}
		this.port = port;
		this.sslProvider = sslProvider;
		this.proxyProvider = proxyProvider;
		this.wiretap = wiretap;
	}

	public String host() {
		return host;
	}

	public int port() {
		return port;
	}

	@Nullable
	public SslProvider sslProvider() {
		return sslProvider;
	}

	@Nullable
	public ProxyProvider proxyProvider() {
		return proxyProvider;
	}

	public boolean isSecure() {
		return sslProvider != null;
	}

	public boolean isWiretap() {
		return wiretap;
	}

	/**
	 * Return the address to connect to. The address is left unresolved so that the
	 * bootstrap, or the proxy when one is configured, resolves the destination.
	 *
	 * @return the address to connect to
	 */
	public SocketAddress remoteAddress() {
		return InetSocketAddress.createUnresolved(host, port);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TransportConfig)) {
			return false;
		}
		TransportConfig that = (TransportConfig) o;
		return port == that.port &&
				wiretap == that.wiretap &&
				host.equalsIgnoreCase(that.host) &&
				Objects.equals(sslProvider, that.sslProvider) &&
				Objects.equals(proxyProvider, that.proxyProvider);
	}

	@Override
	public int hashCode() {
		int result = 1;
		result = 31 * result + host.toLowerCase(Locale.ROOT).hashCode();
		result = 31 * result + port;
		result = 31 * result + Objects.hashCode(sslProvider);
		result = 31 * result + Objects.hashCode(proxyProvider);
		result = 31 * result + Boolean.hashCode(wiretap);
		return result;
	}

	@Override
	public String toString() {
		return "TransportConfig{" +
				(sslProvider != null ? "https://" : "http://") + host + ':' + port +
				(proxyProvider != null ? ", proxy=" + proxyProvider : "") +
				'}';
	}
}
