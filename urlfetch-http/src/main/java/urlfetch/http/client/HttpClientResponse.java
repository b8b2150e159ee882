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

import java.util.Collections;
import java.util.List;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import reactor.core.publisher.Flux;
import reactor.util.annotation.Nullable;

/**
 * Status line and headers of the last response of a request, with the redirect chain that
 * led to it.
 */
public final class HttpClientResponse {

	final HttpResponseStatus status;
	final HttpVersion        version;
	final HttpHeaders        headers;
	final List<String>       requestUrls;
	final Flux<byte[]>       body;

	volatile Timing timing;

	HttpClientResponse(HttpResponseStatus status, HttpVersion version, HttpHeaders headers,
			List<String> requestUrls, @Nullable Flux<byte[]> body) {
		this.status = status;
		this.version = version;
		this.headers = headers;
		this.requestUrls = Collections.unmodifiableList(requestUrls);
		this.body = body == null ? Flux.empty() : body;
	}

	public HttpResponseStatus status() {
		return status;
	}

	public int statusCode() {
		return status.code();
	}

	public HttpVersion version() {
		return version;
	}

	public HttpHeaders headers() {
		return headers;
	}

	/**
	 * Return the URL the response was received from.
	 *
	 * @return the URL the response was received from
	 */
	public String url() {
		return requestUrls.get(requestUrls.size() - 1);
	}

	/**
	 * Return every URL requested for this response, the original one first.
	 *
	 * @return every URL requested for this response
	 */
	public List<String> requestUrls() {
		return requestUrls;
	}

	/**
	 * Return the timing of the request when the {@code timing} option is enabled.
	 *
	 * @return the timing or null
	 */
	@Nullable
	public Timing timing() {
		return timing;
	}

	/**
	 * Return the live body of a {@code streaming} request, read on demand. The connection
	 * is released once the body completes and closed if the subscriber cancels. Empty for
	 * other requests.
	 *
	 * @return the live body
	 */
	public Flux<byte[]> body() {
		return body;
	}

	HttpClientResponse timing(@Nullable Timing timing) {
		this.timing = timing;
		return this;
	}

	@Override
	public String toString() {
		return "HttpClientResponse{status=" + status + ", url=" + url() + '}';
	}
}
