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

import java.util.ArrayList;
import java.util.List;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.resources.ConnectionProvider;
import urlfetch.transport.TransportConfig;

/**
 * Drives the attempts of one logical request: the Digest retry, the redirect chain and
 * the decoding of the final response.
 */
final class HttpClientExecution implements HttpClientAttempt.ResponseHandling {

	final HttpClient      client;
	final RequestPlan     plan;
	final Timing.Recorder timing = new Timing.Recorder();
	final List<String>    requestUrls = new ArrayList<>();

	int     attempts;
	int     redirects;
	boolean digestRetried;
	boolean digestDisabled;

	HttpClientExecution(HttpClient client, RequestPlan plan) {
		this.client = client;
		this.plan = plan;
	}

	Mono<HttpResult> execute() {
		return attempt(plan.method, plan.endpoint, plan.headers, plan.body, false);
	}

	Mono<HttpResult> attempt(String method, UriEndpoint endpoint, HttpHeaders headers, BodySource body,
			boolean retry) {
		return Mono.defer(() -> {
			HttpHeaders attemptHeaders = headers.copy();
			attemptHeaders.set(HttpHeaderNames.HOST, endpoint.getHostHeader());
			HttpClientAttempt attempt = new HttpClientAttempt(plan, ++attempts, method, endpoint, attemptHeaders,
					body, timing);
			try {
				if (plan.beforeRequest != null) {
					plan.beforeRequest.accept(attempt);
				}
			}
			catch (IllegalArgumentException e) {
				return Mono.error(new InvalidOptionException("Invalid request from beforeRequest: " + e.getMessage(), e));
			}
			catch (RuntimeException e) {
				return Mono.error(new RequestException("beforeRequest failed: " + e.getMessage(), e));
			}
			if (plan.auth instanceof AuthMode.Digest && !digestDisabled) {
				AuthMode.Digest digest = (AuthMode.Digest) plan.auth;
				String authorization = client.digestCache.authorize(attempt.endpoint.host(), attempt.method,
						attempt.endpoint.getRawUri(), digest.username, digest.password);
				if (authorization != null) {
					attempt.headers.set(HttpHeaderNames.AUTHORIZATION, authorization);
				}
			}
			if (!retry || requestUrls.isEmpty()) {
				requestUrls.add(attempt.uri());
			}

			UriEndpoint target = attempt.endpoint;
			TransportConfig config = TransportConfig.of(target.host(), target.port(),
					target.isSecure() ? plan.sslProvider : null, plan.proxyFor(target), plan.wiretap);
			ConnectionProvider provider = plan.agentFor(target);
			if (provider == null) {
				provider = client.provider(target.isSecure());
			}
			return attempt.execute(provider, client.loops, config, this)
			              .flatMap(result -> onResult(attempt, result));
		});
	}

	@Override
	public HttpClientAttempt.Mode select(HttpResponse head) {
		if (RedirectFollower.isFollowed(plan, head) || isDigestChallenge(head.status().code(), head.headers())) {
			return HttpClientAttempt.Mode.DISCARD;
		}
		if (plan.streaming) {
			return HttpClientAttempt.Mode.STREAM;
		}
		if (plan.hasWriteStream()) {
			return HttpClientAttempt.Mode.PIPE;
		}
		return HttpClientAttempt.Mode.BUFFER;
	}

	@Override
	public HttpClientResponse toResponse(HttpResponse head, @Nullable Flux<byte[]> body) {
		return new HttpClientResponse(head.status(), head.protocolVersion(), head.headers(),
				new ArrayList<>(requestUrls), body);
	}

	Mono<HttpResult> onResult(HttpClientAttempt attempt, HttpClientAttempt.Result result) {
		HttpClientResponse response = result.response;
		try {
			if (result.mode == HttpClientAttempt.Mode.DISCARD) {
				if (isDigestChallenge(response.statusCode(), response.headers())) {
					return digestRetry(attempt, response);
				}
				RedirectFollower.Hop hop = RedirectFollower.next(plan, response, attempt.method, attempt.endpoint,
						attempt.body, attempt.headers, redirects);
				if (hop != null) {
					redirects++;
					digestRetried = false;
					if (hop.crossHost) {
						digestDisabled = true;
					}
					return attempt(hop.method, hop.endpoint, hop.headers, hop.body, false);
				}
			}
			Object data = result.mode == HttpClientAttempt.Mode.BUFFER ?
					ResponseDecoder.decode(plan, response, result.body) : null;
			if (plan.timing) {
				response.timing(timing.toTiming());
			}
			if (log.isDebugEnabled()) {
				log.debug("{} {} completed with status {} after {} attempt(s)", plan.method, plan.endpoint,
						response.statusCode(), attempts);
			}
			return Mono.just(new HttpResult(data, response));
		}
		catch (RequestException e) {
			return Mono.error(e.response(response));
		}
	}

	boolean isDigestChallenge(int status, HttpHeaders headers) {
		return plan.auth instanceof AuthMode.Digest &&
				!digestRetried &&
				!digestDisabled &&
				status == HttpResponseStatus.UNAUTHORIZED.code() &&
				AuthHeaders.hasDigestChallenge(headers.getAll(HttpHeaderNames.WWW_AUTHENTICATE));
	}

	Mono<HttpResult> digestRetry(HttpClientAttempt attempt, HttpClientResponse response) throws RequestException {
		DigestChallenge challenge = DigestChallenge.parse(response.headers().getAll(HttpHeaderNames.WWW_AUTHENTICATE));
		if (!attempt.body.isReplayable()) {
			throw new StreamReplayException(response);
		}
		client.digestCache.put(attempt.endpoint.host(), challenge);
		digestRetried = true;
		if (log.isDebugEnabled()) {
			log.debug("Digest challenge from {} (realm {}), retrying {} {}", attempt.endpoint.host(),
					challenge.realm, attempt.method, attempt.endpoint);
		}
		return attempt(attempt.method, attempt.endpoint, attempt.headers, attempt.body, true);
	}

	static final Logger log = Loggers.getLogger(HttpClientExecution.class);
}
