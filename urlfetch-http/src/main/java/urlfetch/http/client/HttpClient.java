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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.resources.ConnectionProvider;
import urlfetch.resources.LoopResources;

/**
 * An HTTP/1.1 client with connection pooling, redirects, Basic and Digest authentication,
 * proxies, phased timeouts and response decoding.
 * <p>
 * Every entry point adapts {@link #mono(String, RequestOptions)}:
 * <pre>
 * {@code
 * HttpClient client = HttpClient.create(RequestOptions.builder()
 *                                                     .dataType(DataType.JSON)
 *                                                     .build());
 *
 * client.request("https://example.com/api", RequestOptions.builder()
 *                                                         .method("POST")
 *                                                         .contentType("json")
 *                                                         .data(Map.of("hello", "world"))
 *                                                         .build())
 *       .thenAccept(result -> System.out.println(result.dataAsJson()));
 * }
 * </pre>
 * A request fails with a {@link RequestException}; a response with an error status is a
 * successful outcome.
 */
public final class HttpClient implements Disposable {

	/**
	 * Create a client with the library defaults and its own connection pools.
	 *
	 * @return a new {@link HttpClient}
	 */
	public static HttpClient create() {
		return create(RequestOptions.EMPTY);
	}

	/**
	 * Create a client whose requests start from the given options.
	 *
	 * @param defaults the options every request inherits
	 * @return a new {@link HttpClient}
	 */
	public static HttpClient create(RequestOptions defaults) {
		return new HttpClient(defaults, null);
	}

	/**
	 * Create a client whose requests start from the given options and use the given
	 * connection provider for {@code http} and {@code https} URLs. The provider is not
	 * disposed with the client.
	 *
	 * @param defaults the options every request inherits
	 * @param provider the connection provider
	 * @return a new {@link HttpClient}
	 */
	public static HttpClient create(RequestOptions defaults, ConnectionProvider provider) {
		return new HttpClient(defaults, Objects.requireNonNull(provider, "provider"));
	}

	static final LoopResources DEFAULT_LOOPS = LoopResources.create("urlfetch");

	final RequestOptions           defaults;
	final ConnectionProvider       agent;
	final ConnectionProvider       httpsAgent;
	final boolean                  ownsProviders;
	final LoopResources            loops;
	final DigestAuthCache          digestCache = new DigestAuthCache();
	final AtomicLong               ids = new AtomicLong();
	final List<HttpClientObserver> observers = new CopyOnWriteArrayList<>();

	volatile boolean disposed;

	HttpClient(RequestOptions defaults, @Nullable ConnectionProvider provider) {
		this.defaults = Objects.requireNonNull(defaults, "defaults");
		if (provider != null) {
			this.agent = provider;
			this.httpsAgent = provider;
			this.ownsProviders = false;
		}
		else {
			this.agent = ConnectionProvider.create("http");
			this.httpsAgent = ConnectionProvider.create("https");
			this.ownsProviders = true;
		}
		this.loops = DEFAULT_LOOPS;
	}

	/**
	 * Return the connection provider used for {@code http} URLs without an {@code agent}
	 * option.
	 *
	 * @return the connection provider
	 */
	public ConnectionProvider agent() {
		return agent;
	}

	/**
	 * Return the connection provider used for {@code https} URLs without an
	 * {@code httpsAgent} option.
	 *
	 * @return the connection provider
	 */
	public ConnectionProvider httpsAgent() {
		return httpsAgent;
	}

	public RequestOptions defaults() {
		return defaults;
	}

	ConnectionProvider provider(boolean secure) {
		return secure ? httpsAgent : agent;
	}

	/**
	 * Prepare a request, sent on subscription.
	 *
	 * @param url the URL
	 * @return the outcome of the request
	 */
	public Mono<HttpResult> mono(String url) {
		return mono(url, RequestOptions.EMPTY);
	}

	/**
	 * Prepare a request, sent on each subscription. Invalid options fail the returned
	 * {@link Mono} with an {@link InvalidOptionException}; cancelling the subscription
	 * closes the connection of the request in flight.
	 *
	 * @param url the URL
	 * @param options the request options, merged over the client defaults
	 * @return the outcome of the request
	 */
	public Mono<HttpResult> mono(String url, RequestOptions options) {
		Objects.requireNonNull(url, "url");
		Objects.requireNonNull(options, "options");
		return Mono.defer(() -> {
			if (disposed) {
				return Mono.error(new IllegalStateException("HttpClient has been disposed"));
			}
			long id = ids.incrementAndGet();
			long start = System.nanoTime();
			RequestPlan plan;
			try {
				plan = OptionNormalizer.normalize(url, defaults, options);
			}
			catch (RequestException e) {
				String method = options.method != null ? options.method : defaults.method != null ? defaults.method : "GET";
				notifyObservers(new RequestEvent(id, method, url, options, Duration.ZERO, null, e));
				return Mono.error(e);
			}
			notifyObservers(new RequestEvent(id, plan.method, url, plan.options, Duration.ZERO, null, null));
			return new HttpClientExecution(this, plan)
					.execute()
					.doOnNext(result -> notifyObservers(new RequestEvent(id, plan.method, url, plan.options,
							Duration.ofNanos(System.nanoTime() - start), result.response, null)))
					.doOnError(error -> notifyObservers(new RequestEvent(id, plan.method, url, plan.options,
							Duration.ofNanos(System.nanoTime() - start),
							error instanceof RequestException ? ((RequestException) error).response() : null,
							error)));
		});
	}

	public CompletableFuture<HttpResult> request(String url) {
		return request(url, RequestOptions.EMPTY);
	}

	/**
	 * Send a request.
	 *
	 * @param url the URL
	 * @param options the request options, merged over the client defaults
	 * @return a future completed with the outcome of the request
	 */
	public CompletableFuture<HttpResult> request(String url, RequestOptions options) {
		return mono(url, options).toFuture();
	}

	public void request(String url, ResponseCallback callback) {
		request(url, RequestOptions.EMPTY, callback);
	}

	/**
	 * Send a request and invoke the callback exactly once with its outcome. Exceptions
	 * thrown by the callback are logged.
	 *
	 * @param url the URL
	 * @param options the request options, merged over the client defaults
	 * @param callback the callback
	 */
	public void request(String url, RequestOptions options, ResponseCallback callback) {
		Objects.requireNonNull(callback, "callback");
		AtomicBoolean delivered = new AtomicBoolean();
		mono(url, options).subscribe(
				result -> deliver(callback, delivered, null, result.data, result.response),
				error -> deliver(callback, delivered, error, null,
						error instanceof RequestException ? ((RequestException) error).response() : null));
	}

	/**
	 * Alias of {@link #request(String)}.
	 */
	public CompletableFuture<HttpResult> curl(String url) {
		return request(url);
	}

	/**
	 * Alias of {@link #request(String, RequestOptions)}.
	 */
	public CompletableFuture<HttpResult> curl(String url, RequestOptions options) {
		return request(url, options);
	}

	/**
	 * Alias of {@link #request(String, ResponseCallback)}.
	 */
	public void curl(String url, ResponseCallback callback) {
		request(url, callback);
	}

	/**
	 * Alias of {@link #request(String, RequestOptions, ResponseCallback)}.
	 */
	public void curl(String url, RequestOptions options, ResponseCallback callback) {
		request(url, options, callback);
	}

	/**
	 * Alias of {@link #request(String, ResponseCallback)}.
	 */
	public void requestWithCallback(String url, ResponseCallback callback) {
		request(url, callback);
	}

	/**
	 * Alias of {@link #request(String, RequestOptions, ResponseCallback)}.
	 */
	public void requestWithCallback(String url, RequestOptions options, ResponseCallback callback) {
		request(url, options, callback);
	}

	public Consumer<ResponseCallback> requestThunk(String url) {
		return requestThunk(url, RequestOptions.EMPTY);
	}

	/**
	 * Prepare a request sent each time the returned function is given a callback.
	 *
	 * @param url the URL
	 * @param options the request options, merged over the client defaults
	 * @return a function sending the request
	 */
	public Consumer<ResponseCallback> requestThunk(String url, RequestOptions options) {
		Objects.requireNonNull(url, "url");
		Objects.requireNonNull(options, "options");
		return callback -> request(url, options, callback);
	}

	/**
	 * Register an observer of the requests of this client.
	 *
	 * @param observer the observer
	 * @return a {@link Disposable} unregistering the observer
	 */
	public Disposable observe(HttpClientObserver observer) {
		Objects.requireNonNull(observer, "observer");
		observers.add(observer);
		return () -> observers.remove(observer);
	}

	/**
	 * Close the connection pools created by this client. Connection providers given by
	 * the caller are left open.
	 */
	@Override
	public void dispose() {
		if (!disposed) {
			disposed = true;
			observers.clear();
			if (ownsProviders) {
				agent.dispose();
				httpsAgent.dispose();
			}
		}
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	void notifyObservers(RequestEvent event) {
		for (HttpClientObserver observer : observers) {
			try {
				if (event.error != null) {
					observer.onError(event);
				}
				else if (event.response != null) {
					observer.onResponse(event);
				}
				else {
					observer.onRequest(event);
				}
			}
			catch (RuntimeException e) {
				log.error("Observer {} failed on {}", observer, event, e);
			}
		}
	}

	static void deliver(ResponseCallback callback, AtomicBoolean delivered, @Nullable Throwable error,
			@Nullable Object data, @Nullable HttpClientResponse response) {
		if (!delivered.compareAndSet(false, true)) {
			if (log.isDebugEnabled()) {
				log.debug("Outcome already delivered, dropping {}", error != null ? error : response);
			}
			return;
		}
		try {
			callback.onComplete(error, data, response);
		}
		catch (RuntimeException e) {
			log.error("ResponseCallback failed", e);
		}
	}

	static final Logger log = Loggers.getLogger(HttpClient.class);
}
