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
 * A logical request seen by a {@link HttpClientObserver}.
 */
public final class RequestEvent {

	final long               id;
	final String             method;
	final String             url;
	final RequestOptions     options;
	final Duration           elapsed;
	final HttpClientResponse response;
	final Throwable          error;

	RequestEvent(long id, String method, String url, RequestOptions options, Duration elapsed,
			@Nullable HttpClientResponse response, @Nullable Throwable error) {
		this.id = id;
		this.method = method;
		this.url = url;
		this.options = options;
		this.elapsed = elapsed;
		this.response = response;
		this.error = error;
	}

	/**
	 * Return the identifier of the request, unique per client.
	 *
	 * @return the identifier of the request
	 */
	public long id() {
		return id;
	}

	public String method() {
		return method;
	}

	/**
	 * Return the requested URL, before any redirect.
	 *
	 * @return the requested URL
	 */
	public String url() {
		return url;
	}

	public RequestOptions options() {
		return options;
	}

	/**
	 * Return the time since the request started, zero for {@code onRequest}.
	 *
	 * @return the time since the request started
	 */
	public Duration elapsed() {
		return elapsed;
	}

	@Nullable
	public HttpClientResponse response() {
		return response;
	}

	@Nullable
	public Throwable error() {
		return error;
	}

	@Nullable
	public Timing timing() {
		return response != null ? response.timing() : null;
	}

	@Override
	public String toString() {
		return "RequestEvent{id=" + id + ", " + method + ' ' + url +
				(response != null ? ", status=" + response.statusCode() : "") +
				(error != null ? ", error=" + error : "") + '}';
	}
}
