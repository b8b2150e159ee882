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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import javax.net.ssl.SSLException;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.tcp.SslProvider;
import urlfetch.transport.ProxyProvider;

/**
 * Resolves the options of a call into a {@link RequestPlan}. Call options win over client
 * defaults, which win over the library defaults.
 */
final class OptionNormalizer {

	static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(HttpRequests.TIMEOUT);

	static final int DEFAULT_MAX_REDIRECTS = 10;

	static final Pattern TOKEN = Pattern.compile("[!#$%&'*+.^_`|~0-9A-Za-z-]+");

	/**
	 * Merge two option sets. Options that belong together are taken as a group from the
	 * call when the call sets any of them: the body ({@code data}, {@code content},
	 * {@code stream}), the credentials, the proxy, each agent and the JSON repair.
	 * Headers are merged, call headers replacing default headers of the same name.
	 *
	 * @param defaults the client defaults
	 * @param call the call options
	 * @return the merged options
	 */
	static RequestOptions merge(RequestOptions defaults, RequestOptions call) {
		if (call == RequestOptions.EMPTY) {
			return defaults;
		}
		if (defaults == RequestOptions.EMPTY) {
			return call;
		}
		RequestOptions.Builder b = defaults.mutate();
		if (call.method != null) {
			b.method = call.method;
		}
		if (call.data != null || call.content != null || call.stream != null) {
			b.data = call.data;
			b.content = call.content;
			b.stream = call.stream;
		}
		if (call.dataAsQueryString != null) {
			b.dataAsQueryString = call.dataAsQueryString;
		}
		if (call.nestedQuerystring != null) {
			b.nestedQuerystring = call.nestedQuerystring;
		}
		if (call.contentType != null) {
			b.contentType = call.contentType;
		}
		if (call.dataType != null) {
			b.dataType = call.dataType;
		}
		b.headers(call.headers);
		if (call.connectTimeout != null) {
			b.connectTimeout = call.connectTimeout;
		}
		if (call.responseTimeout != null) {
			b.responseTimeout = call.responseTimeout;
		}
		if (call.auth != null || call.digestAuth != null) {
			b.auth = call.auth;
			b.digestAuth = call.digestAuth;
		}
		if (call.followRedirect != null) {
			b.followRedirect = call.followRedirect;
		}
		if (call.maxRedirects != null) {
			b.maxRedirects = call.maxRedirects;
		}
		if (call.formatRedirectUrl != null) {
			b.formatRedirectUrl = call.formatRedirectUrl;
		}
		if (call.beforeRequest != null) {
			b.beforeRequest = call.beforeRequest;
		}
		if (call.gzip != null) {
			b.gzip = call.gzip;
		}
		if (call.streaming != null) {
			b.streaming = call.streaming;
		}
		if (call.writeStream != null) {
			b.writeStream = call.writeStream;
		}
		if (call.consumeWriteStream != null) {
			b.consumeWriteStream = call.consumeWriteStream;
		}
		if (call.fixJSONCtlChars != null) {
			b.fixJSONCtlChars = call.fixJSONCtlChars;
			b.fixJSONCtlCharsFunction = call.fixJSONCtlCharsFunction;
		}
		if (call.timing != null) {
			b.timing = call.timing;
		}
		if (call.proxy != null || call.proxyProvider != null) {
			b.proxy = call.proxy;
			b.proxyProvider = call.proxyProvider;
		}
		if (call.enableProxy != null) {
			b.enableProxy = call.enableProxy;
		}
		if (call.agentEnabled != null) {
			b.agent = call.agent;
			b.agentEnabled = call.agentEnabled;
		}
		if (call.httpsAgentEnabled != null) {
			b.httpsAgent = call.httpsAgent;
			b.httpsAgentEnabled = call.httpsAgentEnabled;
		}
		if (call.ca != null) {
			b.ca = call.ca;
		}
		if (call.pfx != null) {
			b.pfx = call.pfx;
		}
		if (call.key != null) {
			b.key = call.key;
		}
		if (call.cert != null) {
			b.cert = call.cert;
		}
		if (call.passphrase != null) {
			b.passphrase = call.passphrase;
		}
		if (call.ciphers != null) {
			b.ciphers = call.ciphers;
		}
		if (call.secureProtocol != null) {
			b.secureProtocol = call.secureProtocol;
		}
		if (call.rejectUnauthorized != null) {
			b.rejectUnauthorized = call.rejectUnauthorized;
		}
		if (call.wiretap != null) {
			b.wiretap = call.wiretap;
		}
		return b.build();
	}

	/**
	 * Resolve the options of a call.
	 *
	 * @param url the request URL
	 * @param defaults the client defaults
	 * @param call the call options
	 * @return the request plan
	 * @throws RequestException when an option is invalid
	 */
	static RequestPlan normalize(String url, RequestOptions defaults, RequestOptions call) throws RequestException {
		RequestOptions options = merge(defaults, call);
		RequestPlan.Builder draft = new RequestPlan.Builder();
		draft.options = options;
		draft.url = url;

		draft.method = method(options.method);

		draft.dataType = DataType.of(options.dataType);
		draft.connectTimeout = timeout("connect", options.connectTimeout);
		draft.responseTimeout = timeout("response", options.responseTimeout);
		draft.followRedirect = Boolean.TRUE.equals(options.followRedirect);
		int maxRedirects = options.maxRedirects != null ? options.maxRedirects : DEFAULT_MAX_REDIRECTS;
		if (maxRedirects < 0) {
			throw new InvalidOptionException("maxRedirects must be positive or zero, was " + maxRedirects);
		}
		draft.maxRedirects = maxRedirects;
		draft.formatRedirectUrl = options.formatRedirectUrl;
		draft.beforeRequest = options.beforeRequest;
		draft.gzip = Boolean.TRUE.equals(options.gzip);
		draft.writeStream = options.writeStream;
		draft.streaming = options.writeStream == null && Boolean.TRUE.equals(options.streaming);
		draft.consumeWriteStream = !Boolean.FALSE.equals(options.consumeWriteStream);
		if (Boolean.TRUE.equals(options.fixJSONCtlChars)) {
			draft.fixJsonCtlChars = options.fixJSONCtlCharsFunction != null ?
					options.fixJSONCtlCharsFunction : JsonControlChars::escape;
		}
		draft.timing = Boolean.TRUE.equals(options.timing);
		draft.wiretap = Boolean.TRUE.equals(options.wiretap);

		HttpHeaders headers = draft.headers;
		headers.set(HttpHeaderNames.USER_AGENT, HttpRequests.USER_AGENT);
		if (draft.dataType == DataType.JSON) {
			headers.set(HttpHeaderNames.ACCEPT, BodyEncoder.APPLICATION_JSON);
		}
		if (draft.gzip) {
			headers.set(HttpHeaderNames.ACCEPT_ENCODING, HttpHeaderValues.GZIP);
		}
		draft.auth = auth(options);
		if (draft.auth instanceof AuthMode.Basic) {
			headers.set(HttpHeaderNames.AUTHORIZATION, ((AuthMode.Basic) draft.auth).authorization);
		}

		HttpHeaders callerHeaders = new DefaultHttpHeaders();
		for (Map.Entry<String, String> header : options.headers.entrySet()) {
			callerHeaders.set(header.getKey(), header.getValue());
		}
		BodyEncoder.encode(draft, options.data, options.content, options.stream, options.contentType,
				Boolean.TRUE.equals(options.nestedQuerystring), Boolean.TRUE.equals(options.dataAsQueryString),
				callerHeaders);
		headers.setAll(callerHeaders);

		try {
			draft.endpoint = UriEndpoint.create(draft.url);
		}
		catch (IllegalArgumentException e) {
			throw new InvalidOptionException(e.getMessage(), e);
		}

		draft.sslProvider = sslProvider(options);
		proxy(draft, options);
		draft.agent = options.agent;
		draft.agentEnabled = !Boolean.FALSE.equals(options.agentEnabled);
		draft.httpsAgent = options.httpsAgent;
		draft.httpsAgentEnabled = !Boolean.FALSE.equals(options.httpsAgentEnabled);

		RequestPlan plan = draft.build();
		if (log.isDebugEnabled()) {
			log.debug("Resolved {}", plan);
		}
		return plan;
	}

	static String method(@Nullable String method) throws InvalidOptionException {
		if (method == null) {
			return "GET";
		}
		if (!TOKEN.matcher(method).matches()) {
			throw new InvalidOptionException("Invalid method: " + method);
		}
		return method.toUpperCase(Locale.ROOT);
	}

	static Duration timeout(String phase, @Nullable Duration timeout) throws InvalidOptionException {
		if (timeout == null) {
			return DEFAULT_TIMEOUT;
		}
		if (timeout.isNegative()) {
			throw new InvalidOptionException("The " + phase + " timeout must be positive or zero, was " + timeout);
		}
		return timeout;
	}

	static AuthMode auth(RequestOptions options) throws RequestException {
		if (options.auth != null && options.digestAuth != null) {
			throw new InvalidOptionException("auth and digestAuth cannot be used together");
		}
		if (options.auth != null) {
			return new AuthMode.Basic(AuthHeaders.basic(options.auth));
		}
		if (options.digestAuth != null) {
			return AuthHeaders.digest(options.digestAuth);
		}
		return AuthMode.NONE;
	}

	static SslProvider sslProvider(RequestOptions options) throws InvalidOptionException {
		if (!options.hasTlsOptions()) {
			return SslProvider.defaultClientProvider();
		}
		SslProvider.Builder builder = SslProvider.builder()
		                                         .pfx(options.pfx)
		                                         .key(options.key)
		                                         .cert(options.cert)
		                                         .passphrase(options.passphrase)
		                                         .ciphers(options.ciphers)
		                                         .secureProtocol(options.secureProtocol);
		if (options.ca != null) {
			builder.ca(options.ca);
		}
		if (options.rejectUnauthorized != null) {
			builder.rejectUnauthorized(options.rejectUnauthorized);
		}
		try {
			return builder.build();
		}
		catch (SSLException | IllegalArgumentException e) {
			throw new InvalidOptionException("Invalid TLS options: " + e.getMessage(), e);
		}
	}

	static void proxy(RequestPlan.Builder draft, RequestOptions options) throws InvalidOptionException {
		if (Boolean.FALSE.equals(options.enableProxy)) {
			return;
		}
		if (options.proxyProvider != null) {
			draft.proxy = options.proxyProvider;
		}
		else if (options.proxy != null) {
			try {
				draft.proxy = ProxyProvider.fromUri(options.proxy);
			}
			catch (IllegalArgumentException e) {
				throw new InvalidOptionException("Invalid proxy: " + e.getMessage(), e);
			}
		}
		else {
			draft.systemProxy = Boolean.TRUE.equals(options.enableProxy);
		}
	}

	static final Logger log = Loggers.getLogger(OptionNormalizer.class);

	private OptionNormalizer() {
	}
}
