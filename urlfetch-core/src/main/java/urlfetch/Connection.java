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
package urlfetch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.netty.channel.Channel;
import reactor.core.Disposable;
import reactor.util.Logger;
import reactor.util.Loggers;

import static urlfetch.UrlFetch.format;

/**
 * Exclusive ownership of a transport channel, acquired from a
 * {@link urlfetch.resources.ConnectionProvider}.
 * <p>
 * The owner gives the channel back with {@link #release()}: a persistent, still active
 * channel returns to its pool, anything else is closed. {@link #dispose()} forces the close
 * so that a channel cancelled in the middle of an exchange is never reused.
 */
public final class Connection implements Disposable {

	/**
	 * Wrap a channel into a {@link Connection}.
	 *
	 * @param channel the acquired channel
	 * @param reused true if the channel was taken from a pool after a previous exchange
	 * @param lookup time spent resolving the remote host, {@link Duration#ZERO} when reused
	 * @param connect time spent connecting (including proxy and TLS handshakes), {@link Duration#ZERO} when reused
	 * @param releaser gives the channel back to its owner
	 * @return a new {@link Connection}
	 */
	public static Connection from(Channel channel, boolean reused, Duration lookup, Duration connect,
			Consumer<? super Channel> releaser) {
		return new Connection(channel, reused, lookup, connect, releaser);
	}

	final Channel                   channel;
	final boolean                   reused;
	final Duration                  lookup;
	final Duration                  connect;
	final Consumer<? super Channel> releaser;
	final AtomicBoolean             released = new AtomicBoolean();

	volatile boolean persistent = true;

	Connection(Channel channel, boolean reused, Duration lookup, Duration connect, Consumer<? super Channel> releaser) {
		this.channel = Objects.requireNonNull(channel, "channel");
		this.reused = reused;
		this.lookup = Objects.requireNonNull(lookup, "lookup");
		this.connect = Objects.requireNonNull(connect, "connect");
		this.releaser = Objects.requireNonNull(releaser, "releaser");
	}

	/**
	 * Return the underlying channel.
	 *
	 * @return the underlying channel
	 */
	public Channel channel() {
		return channel;
	}

	/**
	 * Return true if the channel served a previous exchange.
	 *
	 * @return true if the channel served a previous exchange
	 */
	public boolean isReused() {
		return reused;
	}

	/**
	 * Return the time spent resolving the remote host for this channel.
	 *
	 * @return the time spent resolving the remote host for this channel
	 */
	public Duration lookupTime() {
		return lookup;
	}

	/**
	 * Return the time spent connecting this channel, handshakes included.
	 *
	 * @return the time spent connecting this channel
	 */
	public Duration connectTime() {
		return connect;
	}

	/**
	 * Return false if the channel must be closed on release.
	 *
	 * @return false if the channel must be closed on release
	 */
	public boolean isPersistent() {
		return persistent;
	}

	/**
	 * Mark whether the channel can go back to its pool on release.
	 *
	 * @param persistent false to close the channel on release
	 * @return {@literal this}
	 */
	public Connection markPersistent(boolean persistent) {
		this.persistent = persistent;
		return this;
	}

	/**
	 * Give the channel back to its owner. Subsequent calls are no-op.
	 */
	@SuppressWarnings("FutureReturnValueIgnored")
	public void release() {
		if (!released.compareAndSet(false, true)) {
			return;
		}
		if (!persistent && channel.isActive()) {
			if (log.isDebugEnabled()) {
				log.debug(format(channel, "Closing non persistent connection"));
			}
			//"FutureReturnValueIgnored" this is deliberate
			channel.close();
		}
		else if (log.isDebugEnabled()) {
			log.debug(format(channel, "Releasing connection"));
		}
		releaser.accept(channel);
	}

	/**
	 * Close the channel and give it back to its owner.
	 */
	@Override
	public void dispose() {
		markPersistent(false);
		release();
	}

	@Override
	public boolean isDisposed() {
		return released.get();
	}

	@Override
	public String toString() {
		return "Connection{channel=" + channel + ", reused=" + reused + ", persistent=" + persistent + '}';
	}

	static final Logger log = Loggers.getLogger(Connection.class);
}
