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
package urlfetch.resources;

import java.time.Duration;
import java.util.Objects;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import urlfetch.Connection;
import urlfetch.UrlFetch;
import urlfetch.transport.TransportConfig;

/**
 * A {@link ConnectionProvider} will produce {@link Connection}.
 * <p>
 * The returned {@link Connection} is only emitted once the channel is connected and its
 * proxy and TLS handshakes, if any, have succeeded.
 */
@FunctionalInterface
public interface ConnectionProvider extends Disposable {

	/**
	 * Default max connections per {@link TransportConfig}. Fallback to
	 * 2 * available number of processors (but with a minimum value of 16).
	 */
	int DEFAULT_POOL_MAX_CONNECTIONS =
			Integer.parseInt(System.getProperty(UrlFetch.POOL_MAX_CONNECTIONS,
			"" + Math.max(Runtime.getRuntime().availableProcessors(), 8) * 2));

	/**
	 * Default acquisition timeout (milliseconds) before error. If -1 will wait for a
	 * connection without limit. Fallback 45 seconds.
	 */
	long DEFAULT_POOL_ACQUIRE_TIMEOUT = Long.parseLong(System.getProperty(
			UrlFetch.POOL_ACQUIRE_TIMEOUT,
			"" + 45000));

	/**
	 * Default max number of acquisitions waiting for a connection, fallback to
	 * 2 * max connections.
	 */
	int DEFAULT_POOL_PENDING_ACQUIRE_MAX_COUNT = Integer.parseInt(System.getProperty(
			UrlFetch.POOL_PENDING_ACQUIRE_MAX_COUNT,
			"" + 2 * DEFAULT_POOL_MAX_CONNECTIONS));

	/**
	 * Creates a builder for {@link ConnectionProvider}.
	 *
	 * @param name {@link ConnectionProvider} name
	 * @return a new ConnectionProvider builder
	 */
	static Builder builder(String name) {
		return new Builder(name);
	}

	/**
	 * Return a {@link ConnectionProvider} that will always create a new
	 * {@link Connection}, closed on release.
	 *
	 * @return a {@link ConnectionProvider} that will always create a new
	 * {@link Connection}.
	 */
	static ConnectionProvider newConnection() {
		return NewConnectionProvider.INSTANCE;
	}

	/**
	 * Create a new {@link ConnectionProvider} to cache and reuse up to
	 * {@link #DEFAULT_POOL_MAX_CONNECTIONS} {@link Connection} per {@link TransportConfig}.
	 *
	 * @param name the connection pool name
	 * @return a new pooling {@link ConnectionProvider}
	 */
	static ConnectionProvider create(String name) {
		return builder(name).build();
	}

	/**
	 * Create a new {@link ConnectionProvider} to cache and reuse a fixed maximum
	 * number of {@link Connection} per {@link TransportConfig}.
	 *
	 * @param name the connection pool name
	 * @param maxConnections the maximum number of connections before starting pending
	 * acquisition on existing ones
	 * @return a new pooling {@link ConnectionProvider}
	 */
	static ConnectionProvider create(String name, int maxConnections) {
		return builder(name).maxConnections(maxConnections)
		                    .pendingAcquireMaxCount(2 * maxConnections)
		                    .build();
	}

	/**
	 * Return an existing or new {@link Connection} on subscribe. Cancelling the returned
	 * {@link Mono} gives back a channel acquired afterwards.
	 *
	 * @param config the transport configuration, also the pool key
	 * @param loops the event loops new channels are registered with
	 * @return an existing or new {@link Mono} of {@link Connection}
	 */
	Mono<Connection> acquire(TransportConfig config, LoopResources loops);

	@Override
	default void dispose() {
		disposeLater().subscribe();
	}

	/**
	 * Returns a Mono that triggers the disposal of the ConnectionProvider when subscribed to.
	 *
	 * @return a Mono representing the completion of the ConnectionProvider disposal.
	 **/
	default Mono<Void> disposeLater() {
		//noop default
		return Mono.empty();
	}

	/**
	 * Returns the maximum number of connections per pool, or -1 when connections are not pooled.
	 *
	 * @return the maximum number of connections per pool
	 */
	default int maxConnections() {
		return -1;
	}

	/**
	 * Build a pooling {@link ConnectionProvider}.
	 */
	final class Builder {

		final String name;
		int      maxConnections         = DEFAULT_POOL_MAX_CONNECTIONS;
		int      pendingAcquireMaxCount = DEFAULT_POOL_PENDING_ACQUIRE_MAX_COUNT;
		Duration pendingAcquireTimeout  = Duration.ofMillis(DEFAULT_POOL_ACQUIRE_TIMEOUT);

		Builder(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		/**
		 * Set the options to use for configuring {@link ConnectionProvider} maximum connections
		 * per {@link TransportConfig}. Default to {@link #DEFAULT_POOL_MAX_CONNECTIONS}.
		 *
		 * @param maxConnections the maximum number of connections (per connection pool) before start pending
		 * @return {@literal this}
		 * @throws IllegalArgumentException if maxConnections is negative
		 */
		public Builder maxConnections(int maxConnections) {
			if (maxConnections <= 0) {
				throw new IllegalArgumentException("Max Connections value must be strictly positive");
			}
			this.maxConnections = maxConnections;
			return this;
		}

		/**
		 * Set the maximum number of acquisitions waiting for a connection. Further
		 * acquisitions fail immediately.
		 *
		 * @param pendingAcquireMaxCount the maximum number of registered requests for acquire
		 * @return {@literal this}
		 * @throws IllegalArgumentException if pendingAcquireMaxCount is not strictly positive
		 */
		public Builder pendingAcquireMaxCount(int pendingAcquireMaxCount) {
			if (pendingAcquireMaxCount <= 0) {
				throw new IllegalArgumentException("Pending acquire max count must be strictly positive");
			}
			this.pendingAcquireMaxCount = pendingAcquireMaxCount;
			return this;
		}

		/**
		 * Set the maximum time to wait for a connection. A negative duration waits
		 * without limit.
		 *
		 * @param pendingAcquireTimeout the maximum time to wait
		 * @return {@literal this}
		 */
		public Builder pendingAcquireTimeout(Duration pendingAcquireTimeout) {
			this.pendingAcquireTimeout = Objects.requireNonNull(pendingAcquireTimeout, "pendingAcquireTimeout");
			return this;
		}

		/**
		 * Builds new ConnectionProvider.
		 *
		 * @return builds new ConnectionProvider
		 */
		public ConnectionProvider build() {
			return new PooledConnectionProvider(this);
		}
	}
}
