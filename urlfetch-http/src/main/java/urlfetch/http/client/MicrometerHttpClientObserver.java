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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * {@link HttpClientObserver} recording the response time and the errors of requests into
 * a Micrometer {@link MeterRegistry}.
 * <p>
 * Meters are tagged with the method, the host and, for the response time, the status.
 */
public final class MicrometerHttpClientObserver implements HttpClientObserver {

	public static final String RESPONSE_TIME = "urlfetch.http.client.response.time";

	public static final String ERRORS = "urlfetch.http.client.errors";

	static final String METHOD = "method";
	static final String HOST = "host";
	static final String STATUS = "status";
	static final String EXCEPTION = "exception";
	static final String NA = "na";

	final MeterRegistry registry;

	final ConcurrentMap<List<String>, Timer> responseTimeCache = new ConcurrentHashMap<>();

	final ConcurrentMap<List<String>, Counter> errorsCache = new ConcurrentHashMap<>();

	public MicrometerHttpClientObserver(MeterRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry");
	}

	@Override
	public void onResponse(RequestEvent event) {
		String method = event.method();
		String host = host(event.url());
		String status = event.response() != null ? Integer.toString(event.response().statusCode()) : NA;
		Timer timer = responseTimeCache.computeIfAbsent(Arrays.asList(method, host, status),
				key -> Timer.builder(RESPONSE_TIME)
				            .description("Time from the start of a request to its response")
				            .tags(METHOD, method, HOST, host, STATUS, status)
				            .register(registry));
		timer.record(event.elapsed());
	}

	@Override
	public void onError(RequestEvent event) {
		String method = event.method();
		String host = host(event.url());
		String exception = event.error() != null ? event.error().getClass().getSimpleName() : NA;
		Counter counter = errorsCache.computeIfAbsent(Arrays.asList(method, host, exception),
				key -> Counter.builder(ERRORS)
				              .description("Number of failed requests")
				              .tags(METHOD, method, HOST, host, EXCEPTION, exception)
				              .register(registry));
		counter.increment();
	}

	static String host(String url) {
		try {
			return UriEndpoint.create(url).host();
		}
		catch (IllegalArgumentException e) {
			return NA;
		}
	}
}
