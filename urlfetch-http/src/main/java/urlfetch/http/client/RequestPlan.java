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

import java.io.OutputStream;
import java.time.Duration;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import reactor.util.annotation.Nullable;
import urlfetch.resources.ConnectionProvider;
import urlfetch.tcp.SslProvider;
import urlfetch.transport.ProxyProvider;

/**
 * Fully resolved description of a request, built once by {@link OptionNormalizer} and
 * never mutated afterwards.
 */
final class RequestPlan {

	final RequestOptions                      options;
	final String                              method;
	final UriEndpoint                         endpoint;
	final HttpHeaders                         headers;
	final BodySource                          body;
	final DataType                            dataType;
	final boolean                             gzip;
	final UnaryOperator<String>               fixJsonCtlChars;
	final boolean                             streaming;
	final OutputStream                        writeStream;
	final boolean                             consumeWriteStream;
	final Duration                            connectTimeout;
	final Duration                            responseTimeout;
	final boolean                             followRedirect;
	final int                                 maxRedirects;
	final BiFunction<String, String, String>  formatRedirectUrl;
	final Consumer<? super HttpClientRequest> beforeRequest;
	final AuthMode                            auth;
	final boolean                             timing;
	final SslProvider                         sslProvider;
	final ProxyProvider                       proxy;
	final boolean                             systemProxy;
	final ConnectionProvider                  agent;
	final boolean                             agentEnabled;
	final ConnectionProvider                  httpsAgent;
	final boolean                             httpsAgentEnabled;
	final boolean                             wiretap;

	RequestPlan(Builder b) {
		this.options = b.options;
		this.method = b.method;
		this.endpoint = b.endpoint;
		this.headers = b.headers.copy();
		this.body = b.body;
		this.dataType = b.dataType;
		this.gzip = b.gzip;
		this.fixJsonCtlChars = b.fixJsonCtlChars;
		this.streaming = b.streaming;
		this.writeStream = b.writeStream;
		this.consumeWriteStream = b.consumeWriteStream;
		this.connectTimeout = b.connectTimeout;
		this.responseTimeout = b.responseTimeout;
		this.followRedirect = b.followRedirect;
		this.maxRedirects = b.maxRedirects;
		this.formatRedirectUrl = b.formatRedirectUrl;
		this.beforeRequest = b.beforeRequest;
		this.auth = b.auth;
		this.timing = b.timing;
		this.sslProvider = b.sslProvider;
		this.proxy = b.proxy;
		this.systemProxy = b.systemProxy;
		this.agent = b.agent;
		this.agentEnabled = b.agentEnabled;
		this.httpsAgent = b.httpsAgent;
		this.httpsAgentEnabled = b.httpsAgentEnabled;
		this.wiretap = b.wiretap;
	}

	/**
	 * Return the proxy to use for the given target, null to connect directly.
	 *
	 * @param target the request target
	 * @return the proxy or null
	 */
	@Nullable
	ProxyProvider proxyFor(UriEndpoint target) {
		ProxyProvider candidate = proxy;
		if (candidate == null && systemProxy) {
			candidate = ProxyProvider.createFrom(System.getProperties(), target.isSecure());
		}
		if (candidate != null && candidate.shouldProxy(target.host())) {
			return candidate;
		}
		return null;
	}

	/**
	 * Return the caller connection provider for the given target, null for the client
	 * default. A disabled agent maps to {@link ConnectionProvider#newConnection()}.
	 *
	 * @param target the request target
	 * @return the connection provider or null
	 */
	@Nullable
	ConnectionProvider agentFor(UriEndpoint target) {
		boolean enabled = target.isSecure() ? httpsAgentEnabled : agentEnabled;
		if (!enabled) {
			return ConnectionProvider.newConnection();
		}
		return target.isSecure() ? httpsAgent : agent;
	}

	boolean hasWriteStream() {
		return writeStream != null;
	}

	@Override
	public String toString() {
		return "RequestPlan{" + method + ' ' + endpoint + ", body=" + body + '}';
	}

	/**
	 * Draft of a {@link RequestPlan}, filled by {@link OptionNormalizer} and
	 * {@link BodyEncoder}.
	 */
	static final class Builder {

		RequestOptions                      options;
		String                              method;
		UriEndpoint                         endpoint;
		String                              url;
		final HttpHeaders                   headers = new DefaultHttpHeaders();
		BodySource                          body = BodySource.NONE;
		DataType                            dataType = DataType.BUFFER;
		boolean                             gzip;
		UnaryOperator<String>               fixJsonCtlChars;
		boolean                             streaming;
		OutputStream                        writeStream;
		boolean                             consumeWriteStream = true;
		Duration                            connectTimeout;
		Duration                            responseTimeout;
		boolean                             followRedirect;
		int                                 maxRedirects;
		BiFunction<String, String, String>  formatRedirectUrl;
		Consumer<? super HttpClientRequest> beforeRequest;
		AuthMode                            auth = AuthMode.NONE;
		boolean                             timing;
		SslProvider                         sslProvider;
		ProxyProvider                       proxy;
		boolean                             systemProxy;
		ConnectionProvider                  agent;
		boolean                             agentEnabled = true;
		ConnectionProvider                  httpsAgent;
		boolean                             httpsAgentEnabled = true;
		boolean                             wiretap;

		RequestPlan build() {
			return new RequestPlan(this);
		}
	}
}
