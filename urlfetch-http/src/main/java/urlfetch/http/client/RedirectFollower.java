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

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponse;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

/**
 * Computes the request that follows a redirect response.
 */
final class RedirectFollower {

	/**
	 * The request following a redirect.
	 */
	static final class Hop {

		final String      method;
		final UriEndpoint endpoint;
		final BodySource  body;
		final HttpHeaders headers;
		final boolean     crossHost;

		Hop(String method, UriEndpoint endpoint, BodySource body, HttpHeaders headers, boolean crossHost) {
			this.method = method;
			this.endpoint = endpoint;
			this.body = body;
			this.headers = headers;
			this.crossHost = crossHost;
		}
	}

	static boolean isRedirect(int status) {
		return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
	}

	/**
	 * Return true if the response is a redirect this plan follows, or fails on.
	 *
	 * @param plan the request plan
	 * @param head the response headers
	 * @return true if the response leads to another attempt or to a redirect error
	 */
	static boolean isFollowed(RequestPlan plan, HttpResponse head) {
		return plan.followRedirect && isRedirect(head.status().code()) &&
				head.headers().contains(HttpHeaderNames.LOCATION);
	}

	/**
	 * Compute the next request.
	 *
	 * @param plan the request plan
	 * @param response the redirect response
	 * @param method the method of the redirected request
	 * @param current the redirected URL
	 * @param body the body of the redirected request
	 * @param headers the headers of the redirected request
	 * @param redirects the redirects already followed
	 * @return the next request, or null when the response is final
	 * @throws RequestException when the redirect cannot be followed
	 */
	@Nullable
	static Hop next(RequestPlan plan, HttpClientResponse response, String method, UriEndpoint current,
			BodySource body, HttpHeaders headers, int redirects) throws RequestException {
		int status = response.statusCode();
		String location = response.headers().get(HttpHeaderNames.LOCATION);
		if (!plan.followRedirect || !isRedirect(status) || location == null) {
			return null;
		}
		if (redirects >= plan.maxRedirects) {
			throw new TooManyRedirectsException(plan.maxRedirects, response);
		}

		UriEndpoint target;
		try {
			target = plan.formatRedirectUrl != null ?
					UriEndpoint.create(plan.formatRedirectUrl.apply(current.toExternalForm(), location)) :
					current.redirect(location);
		}
		catch (IllegalArgumentException e) {
			throw new RequestException("Invalid redirect location " + location + ": " + e.getMessage(), e, response);
		}

		String nextMethod = method;
		BodySource nextBody = body;
		if (status == 303) {
			if (!"HEAD".equals(method)) {
				nextMethod = "GET";
			}
			nextBody = BodySource.NONE;
		}
		else if (status == 301 || status == 302) {
			if ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method) || "DELETE".equals(method)) {
				nextMethod = "GET";
				nextBody = BodySource.NONE;
			}
		}
		if (nextBody == body && !body.isReplayable()) {
			throw new StreamReplayException(response);
		}

		HttpHeaders nextHeaders = headers.copy();
		if (nextBody == BodySource.NONE) {
			nextHeaders.remove(HttpHeaderNames.CONTENT_LENGTH)
			           .remove(HttpHeaderNames.CONTENT_TYPE)
			           .remove(HttpHeaderNames.TRANSFER_ENCODING);
		}
		boolean crossHost = !current.isSameHost(target);
		if (crossHost) {
			nextHeaders.remove(HttpHeaderNames.AUTHORIZATION)
			           .remove(HttpHeaderNames.COOKIE)
			           .remove(HttpHeaderNames.PROXY_AUTHORIZATION);
		}
		nextHeaders.set(HttpHeaderNames.HOST, target.getHostHeader());

		if (log.isDebugEnabled()) {
			log.debug("{} redirect #{} from {} {} to {} {}", status, redirects + 1, method, current, nextMethod, target);
		}
		return new Hop(nextMethod, target, nextBody, nextHeaders, crossHost);
	}

	static final Logger log = Loggers.getLogger(RedirectFollower.class);

	private RedirectFollower() {
	}
}
