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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.Channel;
import io.netty.channel.pool.ChannelHealthChecker;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.FixedChannelPool;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.util.Logger;
import reactor.util.Loggers;
import urlfetch.Connection;
import urlfetch.transport.TransportConfig;

import static urlfetch.UrlFetch.format;

/**
 * A {@link ConnectionProvider} keeping one {@link FixedChannelPool} per
 * {@link TransportConfig}. Channels are leased first in, first out and checked for
 * activity both when acquired and when released, so a closed channel never goes back
 * into circulation.
 */
final class PooledConnectionProvider implements ConnectionProvider {

	static final AttributeKey<Boolean> REUSED = AttributeKey.valueOf("urlfetch.reused");

	final String   name;
	final int      maxConnections;
	final int      pendingAcquireMaxCount;
	final Duration pendingAcquireTimeout;

	final ConcurrentMap<TransportConfig, FixedChannelPool> channelPools = new ConcurrentHashMap<>();

	volatile boolean disposed;

	PooledConnectionProvider(ConnectionProvider.Builder builder) {
		this.name = builder.name;
		this.maxConnections = builder.maxConnections;
		this.pendingAcquireMaxCount = builder.pendingAcquireMaxCount;
		this.pendingAcquireTimeout = builder.pendingAcquireTimeout;
	}

	@Override
	public Mono<Connection> acquire(TransportConfig config, LoopResources loops) {
		return Mono.create(sink -> {
			if (disposed) {
				sink.error(new IllegalStateException("Connection provider [" + name + "] has been disposed"));
				return;
			}
			FixedChannelPool pool = channelPools.computeIfAbsent(config, key -> {
				if (log.isDebugEnabled()) {
					log.debug("Creating a new [{}] client pool for [{}]", name, key);
				}
				return newPool(key, loops);
			});
			PendingAcquire pending = new PendingAcquire(pool, sink);
			sink.onCancel(pending);
			pool.acquire().addListener(pending);
		});
	}

	FixedChannelPool newPool(TransportConfig config, LoopResources loops) {
		long acquireTimeoutMillis = pendingAcquireTimeout.isNegative() ? -1 : pendingAcquireTimeout.toMillis();
		return new FixedChannelPool(ConnectionSetup.bootstrap(config, loops),
				new PoolHandler(config),
				ChannelHealthChecker.ACTIVE,
				acquireTimeoutMillis == -1 ? null : FixedChannelPool.AcquireTimeoutAction.FAIL,
				acquireTimeoutMillis,
				maxConnections,
				pendingAcquireMaxCount,
				true,
				false);
	}

	@Override
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			disposed = true;
			List<Mono<Void>> closes = new ArrayList<>();
			channelPools.forEach((config, pool) -> {
				if (channelPools.remove(config, pool)) {
					closes.add(Mono.<Void>create(sink -> pool.closeAsync().addListener(f -> {
						if (log.isDebugEnabled()) {
							log.debug("Disposed [{}] client pool for [{}]", name, config);
						}
						sink.success();
					})));
				}
			});
			return Mono.when(closes);
		});
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public int maxConnections() {
		return maxConnections;
	}

	@Override
	public String toString() {
		return "PooledConnectionProvider{name=" + name + ", maxConnections=" + maxConnections +
				", pendingAcquireMaxCount=" + pendingAcquireMaxCount +
				", pendingAcquireTimeout=" + pendingAcquireTimeout + '}';
	}

	static final class PoolHandler implements ChannelPoolHandler {

		final TransportConfig config;

		PoolHandler(TransportConfig config) {
			this.config = config;
		}

		@Override
		public void channelCreated(Channel ch) {
			if (log.isDebugEnabled()) {
				log.debug(format(ch, "Created a new pooled channel for {}"), config);
			}
			ConnectionSetup.initChannel(ch, config);
		}

		@Override
		public void channelAcquired(Channel ch) {
			if (log.isDebugEnabled()) {
				log.debug(format(ch, "Channel acquired from the pool for {}"), config);
			}
		}

		@Override
		public void channelReleased(Channel ch) {
			ch.attr(REUSED).set(Boolean.TRUE);
			if (log.isDebugEnabled()) {
				log.debug(format(ch, "Channel released, active: {}"), ch.isActive());
			}
		}
	}

	/**
	 * One acquisition. Exactly one of delivery and cancellation wins; a channel arriving
	 * after cancellation is given back to the pool.
	 */
	static final class PendingAcquire implements GenericFutureListener<Future<Channel>>, Disposable,
			ConnectionSetup.ReadyListener {

		static final int PENDING   = 0;
		static final int DELIVERED = 1;
		static final int CANCELLED = 2;

		final FixedChannelPool pool;
		final MonoSink<Connection> sink;
		final AtomicInteger state = new AtomicInteger(PENDING);

		PendingAcquire(FixedChannelPool pool, MonoSink<Connection> sink) {
			this.pool = pool;
			this.sink = sink;
		}

		@Override
		public void operationComplete(Future<Channel> future) {
			if (!future.isSuccess()) {
				if (state.compareAndSet(PENDING, DELIVERED)) {
					sink.error(future.cause());
				}
				return;
			}
			Channel channel = future.getNow();
			if (state.get() == CANCELLED) {
				release(channel);
				return;
			}
			ConnectionSetup.whenReady(channel, this);
		}

		@Override
		public void onReady(Channel channel, Duration lookup, Duration connect) {
			boolean reused = Boolean.TRUE.equals(channel.attr(REUSED).get());
			Connection connection = Connection.from(channel, reused,
					reused ? Duration.ZERO : lookup,
					reused ? Duration.ZERO : connect,
					this::release);
			if (state.compareAndSet(PENDING, DELIVERED)) {
				sink.success(connection);
			}
			else {
				if (log.isDebugEnabled()) {
					log.debug(format(channel, "Acquisition cancelled, releasing the channel"));
				}
				connection.release();
			}
		}

		@Override
		public void onFailure(Channel channel, Throwable cause) {
			release(channel);
			if (state.compareAndSet(PENDING, DELIVERED)) {
				sink.error(cause);
			}
		}

		@SuppressWarnings("FutureReturnValueIgnored")
		void release(Channel channel) {
			//"FutureReturnValueIgnored" this is deliberate
			pool.release(channel);
		}

		@Override
		public void dispose() {
			state.compareAndSet(PENDING, CANCELLED);
		}

		@Override
		public boolean isDisposed() {
			return state.get() != PENDING;
		}
	}

	static final Logger log = Loggers.getLogger(PooledConnectionProvider.class);
}
