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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;
import urlfetch.UrlFetch;

/**
 * Owns the NIO event loop group the client channels run on. The group is created lazily on
 * first use and shut down by {@link #dispose()} or {@link #disposeLater()}.
 */
public final class LoopResources implements Disposable {

	/**
	 * Default worker thread count, fallback to available processor
	 * (but with a minimum value of 4).
	 */
	public static final int DEFAULT_IO_WORKER_COUNT = Integer.parseInt(System.getProperty(
			UrlFetch.IO_WORKER_COUNT,
			"" + Math.max(Runtime.getRuntime().availableProcessors(), 4)));

	/**
	 * Default quiet period that guarantees that the disposal of the underlying group
	 * will not happen.
	 */
	public static final Duration DEFAULT_SHUTDOWN_QUIET_PERIOD = Duration.ofSeconds(2);

	/**
	 * Default maximum amount of time to wait until the disposal of the underlying group
	 * regardless if a task was submitted during the quiet period.
	 */
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(15);

	/**
	 * Create a {@link LoopResources} with daemon threads named after the given prefix.
	 *
	 * @param prefix the thread name prefix
	 * @return a new {@link LoopResources}
	 */
	public static LoopResources create(String prefix) {
		return create(prefix, DEFAULT_IO_WORKER_COUNT);
	}

	/**
	 * Create a {@link LoopResources} with daemon threads named after the given prefix.
	 *
	 * @param prefix the thread name prefix
	 * @param workerCount number of worker threads
	 * @return a new {@link LoopResources}
	 */
	public static LoopResources create(String prefix, int workerCount) {
		Objects.requireNonNull(prefix, "prefix");
		if (workerCount < 1) {
			throw new IllegalArgumentException("Must provide a strictly positive worker threads number, was: " + workerCount);
		}
		return new LoopResources(prefix, workerCount);
	}

	final String prefix;
	final int workerCount;
	final AtomicReference<EventLoopGroup> clientLoops = new AtomicReference<>();

	volatile boolean disposed;

	LoopResources(String prefix, int workerCount) {
		this.prefix = prefix;
		this.workerCount = workerCount;
	}

	/**
	 * Return the event loop group, creating it on first call.
	 *
	 * @return the event loop group
	 */
	public EventLoopGroup onClient() {
		if (disposed) {
			throw new IllegalStateException("LoopResources [" + prefix + "] has been disposed");
		}
		EventLoopGroup group = clientLoops.get();
		if (group == null) {
			EventLoopGroup newGroup = new NioEventLoopGroup(workerCount,
					new DefaultThreadFactory(prefix + "-nio", true));
			if (clientLoops.compareAndSet(null, newGroup)) {
				if (log.isDebugEnabled()) {
					log.debug("Created event loop group [{}] with {} threads", prefix, workerCount);
				}
				group = newGroup;
			}
			else {
				newGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
				group = clientLoops.get();
			}
		}
		return group;
	}

	/**
	 * Return the channel type matching {@link #onClient()}.
	 *
	 * @return the channel type matching {@link #onClient()}
	 */
	public Class<? extends SocketChannel> onChannel() {
		return NioSocketChannel.class;
	}

	@Override
	public void dispose() {
		disposeLater().subscribe();
	}

	/**
	 * Returns a Mono that triggers the disposal of the underlying group when subscribed to.
	 *
	 * @return a Mono representing the completion of the group disposal
	 */
	public Mono<Void> disposeLater() {
		return Mono.defer(() -> {
			disposed = true;
			EventLoopGroup group = clientLoops.getAndSet(null);
			if (group == null) {
				return Mono.empty();
			}
			Future<?> future = group.shutdownGracefully(DEFAULT_SHUTDOWN_QUIET_PERIOD.toMillis(),
					DEFAULT_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
			return Mono.<Void>create(sink -> future.addListener(f -> {
				if (f.isSuccess()) {
					sink.success();
				}
				else {
					sink.error(f.cause());
				}
			}));
		});
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public String toString() {
		return "LoopResources{prefix=" + prefix + ", workerCount=" + workerCount + '}';
	}

	static final Logger log = Loggers.getLogger(LoopResources.class);
}
