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

import reactor.util.annotation.Nullable;

/**
 * A phase deadline expired. The connection in use is closed, never pooled again.
 */
public final class RequestTimeoutException extends RequestException {

	/**
	 * The phase whose deadline expired.
	 */
	public enum Phase {
		/**
		 * From connection acquisition until the request is fully sent.
		 */
		CONNECT,
		/**
		 * From the request fully sent until the response is fully received.
		 */
		RESPONSE
	}

	final Phase    phase;
	final Duration timeout;

	RequestTimeoutException(Phase phase, Duration timeout, @Nullable HttpClientResponse response) {
		super((phase == Phase.CONNECT ? "Connect" : "Response") + " timeout for " + timeout.toMillis() + "ms",
				null, response);
		this.phase = phase;
		this.timeout = timeout;
	}

	public Phase phase() {
		return phase;
	}

	public Duration timeout() {
		return timeout;
	}

	private static final long serialVersionUID = -8823617405629874511L;
}
