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

import java.net.SocketAddress;
import java.util.Objects;

import io.netty.channel.Channel;

/**
 * Internal helpers and the system properties recognized by the library.
 */
public final class UrlFetch {

	/**
	 * Default worker thread count, fallback to available processor
	 * (but with a minimum value of 4).
	 */
	public static final String IO_WORKER_COUNT = "urlfetch.ioWorkerCount";

	/**
	 * Default max connections per pool key. Fallback to
	 * 2 * available number of processors (but with a minimum value of 16).
	 */
	public static final String POOL_MAX_CONNECTIONS = "urlfetch.pool.maxConnections";

	/**
	 * Default acquisition timeout (milliseconds) before error. If -1 will never wait to
	 * acquire before opening a new connection in an unbounded fashion. Fallback 45 seconds.
	 */
	public static final String POOL_ACQUIRE_TIMEOUT = "urlfetch.pool.acquireTimeout";

	/**
	 * Default max number of acquisitions waiting for a connection. Fallback to
	 * 2 * max connections.
	 */
	public static final String POOL_PENDING_ACQUIRE_MAX_COUNT = "urlfetch.pool.pendingAcquireMaxCount";

	/**
	 * Default SSL handshake timeout (milliseconds), fallback to 10 seconds.
	 */
	public static final String SSL_HANDSHAKE_TIMEOUT = "urlfetch.sslHandshakeTimeout";

	/**
	 * Append channel ID and the remote address to the provided message.
	 *
	 * @param channel the channel
	 * @param msg the message
	 * @return the formatted message
	 */
	public static String format(Channel channel, String msg) {
		Objects.requireNonNull(channel, "channel");
		Objects.requireNonNull(msg, "msg");
		StringBuilder result = new StringBuilder(48 + msg.length())
				.append('[')
				.append(channel.id().asShortText());
		SocketAddress remoteAddress = channel.remoteAddress();
		if (remoteAddress != null) {
			result.append(", R:")
			      .append(remoteAddress);
		}
		return result.append("] ")
		             .append(msg)
		             .toString();
	}

	private UrlFetch() {
	}
}
