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
package urlfetch.http.client;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Milestones of the last attempt of a request, in milliseconds since the request started.
 * Values are cumulative: {@code queuing <= dnsLookup <= connected <= requestSent <= waiting
 * <= contentDownload}. A reused connection has no lookup nor connect time.
 */
public final class Timing {

	final long queuing;
	final long dnsLookup;
	final long connected;
	final long requestSent;
	final long waiting;
	final long contentDownload;

	Timing(long queuing, long dnsLookup, long connected, long requestSent, long waiting, long contentDownload) {
		this.queuing = queuing;
		this.dnsLookup = dnsLookup;
		this.connected = connected;
		this.requestSent = requestSent;
		this.waiting = waiting;
		this.contentDownload = contentDownload;
	}

	/**
	 * Time spent waiting for a connection, before name resolution starts.
	 *
	 * @return milliseconds since the request started
	 */
	public long queuing() {
		return queuing;
	}

	/**
	 * End of the name resolution.
	 *
	 * @return milliseconds since the request started
	 */
	public long dnsLookup() {
		return dnsLookup;
	}

	/**
	 * Connection established, proxy and TLS handshakes included.
	 *
	 * @return milliseconds since the request started
	 */
	public long connected() {
		return connected;
	}

	/**
	 * Request fully written.
	 *
	 * @return milliseconds since the request started
	 */
	public long requestSent() {
		return requestSent;
	}

	/**
	 * Response headers received.
	 *
	 * @return milliseconds since the request started
	 */
	public long waiting() {
		return waiting;
	}

	/**
	 * Response body fully received.
	 *
	 * @return milliseconds since the request started
	 */
	public long contentDownload() {
		return contentDownload;
	}

	@Override
	public String toString() {
		return "Timing{queuing=" + queuing + ", dnsLookup=" + dnsLookup + ", connected=" + connected +
				", requestSent=" + requestSent + ", waiting=" + waiting +
				", contentDownload=" + contentDownload + '}';
	}

	/**
	 * Mutable monotonic marks, overwritten by each attempt.
	 */
	static final class Recorder {

		final long startNanos = System.nanoTime();

		volatile long queuingNanos;
		volatile long dnsLookupNanos;
		volatile long connectedNanos;
		volatile long requestSentNanos;
		volatile long waitingNanos;
		volatile long contentDownloadNanos;

		void connected(Duration lookup, Duration connect) {
			long now = System.nanoTime() - startNanos;
			long connectStart = Math.max(0, now - lookup.toNanos() - connect.toNanos());
			queuingNanos = connectStart;
			dnsLookupNanos = Math.min(now, connectStart + lookup.toNanos());
			connectedNanos = now;
			requestSentNanos = 0;
			waitingNanos = 0;
			contentDownloadNanos = 0;
		}

		void requestSent() {
			requestSentNanos = System.nanoTime() - startNanos;
		}

		void firstByte() {
			long now = System.nanoTime() - startNanos;
			waitingNanos = now;
			if (requestSentNanos == 0) {
				requestSentNanos = now;
			}
		}

		void contentDownloaded() {
			contentDownloadNanos = System.nanoTime() - startNanos;
		}

		Timing toTiming() {
			long contentDownload = contentDownloadNanos == 0 ? System.nanoTime() - startNanos : contentDownloadNanos;
			return new Timing(millis(queuingNanos), millis(dnsLookupNanos), millis(connectedNanos),
					millis(requestSentNanos), millis(waitingNanos), millis(contentDownload));
		}

		static long millis(long nanos) {
			return TimeUnit.NANOSECONDS.toMillis(nanos);
		}
	}
}
