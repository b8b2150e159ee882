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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import reactor.core.publisher.Mono;
import urlfetch.resources.ConnectionProvider;

/**
 * Static entry points over a default {@link HttpClient}, created on first use.
 * <pre>
 * {@code
 * HttpRequests.request("http://localhost:8080/hello", (error, data, response) -> {
 *     if (error == null) {
 *         System.out.println(response.statusCode());
 *     }
 * });
 * }
 * </pre>
 */
public final class HttpRequests {

	/**
	 * Default timeout of each phase, in milliseconds.
	 */
	public static final long TIMEOUT = 5000;

	/**
	 * Default connect and response timeouts, in milliseconds.
	 */
	public static final List<Long> TIMEOUTS = Collections.unmodifiableList(Arrays.asList(TIMEOUT, TIMEOUT));

	public static final String VERSION = version();

	/**
	 * Default {@code User-Agent} header.
	 */
	public static final String USER_AGENT = "urlfetch/" + VERSION + " Java/" + System.getProperty("java.version") +
			" (" + System.getProperty("os.name") + ")";

	/**
	 * Return the default client.
	 *
	 * @return the default client
	 */
	public static HttpClient defaultClient() {
		return DefaultClient.INSTANCE;
	}

	public static HttpClient create() {
		return HttpClient.create();
	}

	public static HttpClient create(RequestOptions defaults) {
		return HttpClient.create(defaults);
	}

	public static HttpClient create(RequestOptions defaults, ConnectionProvider provider) {
		return HttpClient.create(defaults, provider);
	}

	/**
	 * Return the connection provider of the default client for {@code http} URLs.
	 *
	 * @return the connection provider
	 */
	public static ConnectionProvider agent() {
		return defaultClient().agent();
	}

	/**
	 * Return the connection provider of the default client for {@code https} URLs.
	 *
	 * @return the connection provider
	 */
	public static ConnectionProvider httpsAgent() {
		return defaultClient().httpsAgent();
	}

	public static Mono<HttpResult> mono(String url) {
		return defaultClient().mono(url);
	}

	public static Mono<HttpResult> mono(String url, RequestOptions options) {
		return defaultClient().mono(url, options);
	}

	public static CompletableFuture<HttpResult> request(String url) {
		return defaultClient().request(url);
	}

	public static CompletableFuture<HttpResult> request(String url, RequestOptions options) {
		return defaultClient().request(url, options);
	}

	public static void request(String url, ResponseCallback callback) {
		defaultClient().request(url, callback);
	}

	public static void request(String url, RequestOptions options, ResponseCallback callback) {
		defaultClient().request(url, options, callback);
	}

	public static void requestWithCallback(String url, ResponseCallback callback) {
		defaultClient().requestWithCallback(url, callback);
	}

	public static void requestWithCallback(String url, RequestOptions options, ResponseCallback callback) {
		defaultClient().requestWithCallback(url, options, callback);
	}

	public static CompletableFuture<HttpResult> curl(String url) {
		return defaultClient().curl(url);
	}

	public static CompletableFuture<HttpResult> curl(String url, RequestOptions options) {
		return defaultClient().curl(url, options);
	}

	public static void curl(String url, ResponseCallback callback) {
		defaultClient().curl(url, callback);
	}

	public static void curl(String url, RequestOptions options, ResponseCallback callback) {
		defaultClient().curl(url, options, callback);
	}

	public static Consumer<ResponseCallback> requestThunk(String url) {
		return defaultClient().requestThunk(url);
	}

	public static Consumer<ResponseCallback> requestThunk(String url, RequestOptions options) {
		return defaultClient().requestThunk(url, options);
	}

	static String version() {
		String version = HttpRequests.class.getPackage().getImplementationVersion();
		return version != null ? version : "1.0.0";
	}

	static final class DefaultClient {
		static final HttpClient INSTANCE = HttpClient.create();
	}

	private HttpRequests() {
	}
}
