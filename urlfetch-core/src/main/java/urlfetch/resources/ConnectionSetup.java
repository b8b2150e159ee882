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
package urlfetch.resources;

import java.net.SocketAddress;
import java.time.Duration;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.proxy.ProxyHandler;
import io.netty.handler.ssl.SslHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import io.netty.resolver.NoopAddressResolverGroup;
import io.netty.util.concurrent.Future;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.UrlFetchPipeline;
import urlfetch.tcp.SslProvider;
import urlfetch.transport.ProxyProvider;
import urlfetch.transport.TransportConfig;

import static urlfetch.UrlFetch.format;

/**
 * Bootstrap and pipeline setup shared by the connection providers.
 */
final class ConnectionSetup {

	static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 30000;

	static final LoggingHandler WIRETAP = new LoggingHandler("urlfetch.wiretap", LogLevel.DEBUG);

	static Bootstrap bootstrap(TransportConfig config, LoopResources loops) {
		Bootstrap bootstrap = new Bootstrap()
				.group(loops.onClient())
				.channel(loops.onChannel())
				.option(ChannelOption.TCP_NODELAY, true)
				.option(ChannelOption.SO_KEEPALIVE, true)
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, DEFAULT_CONNECT_TIMEOUT_MILLIS)
				.remoteAddress(config.remoteAddress());
		if (config.proxyProvider() != null) {
			// the proxy resolves the destination
			bootstrap.resolver(NoopAddressResolverGroup.INSTANCE);
		}
		else {
			bootstrap.resolver(DefaultAddressResolverGroup.INSTANCE);
		}
		return bootstrap;
	}

	/**
	 * Install the transport handlers of a newly created channel, see {@link UrlFetchPipeline}.
	 */
	static void initChannel(Channel channel, TransportConfig config) {
		ChannelPipeline pipeline = channel.pipeline();
		pipeline.addFirst(UrlFetchPipeline.ConnectMetricsHandler, new ConnectTimingHandler());
		if (config.isWiretap()) {
			pipeline.addFirst(UrlFetchPipeline.LoggingHandler, WIRETAP);
		}
		ProxyProvider proxy = config.proxyProvider();
		if (proxy != null) {
			proxy.addProxyHandler(channel);
		}
		SslProvider ssl = config.sslProvider();
		if (ssl != null) {
			ssl.addSslHandler(channel, config.host(), config.port());
		}
		if (log.isDebugEnabled()) {
			log.debug(format(channel, "Initialized pipeline {}"), pipeline.names());
		}
	}

	/**
	 * Invoke the listener once the proxy and TLS handshakes of the channel are complete.
	 * Channels that already completed them are ready immediately.
	 */
	static void whenReady(Channel channel, ReadyListener listener) {
		ChannelHandler proxyHandler = channel.pipeline().get(UrlFetchPipeline.ProxyHandler);
		if (proxyHandler instanceof ProxyHandler) {
			Future<Channel> tunnel = ((ProxyHandler) proxyHandler).connectFuture();
			if (!tunnel.isDone()) {
				tunnel.addListener(f -> {
					if (f.isSuccess()) {
						whenSecured(channel, listener);
					}
					else {
						notifyFailure(channel, listener, f.cause());
					}
				});
				return;
			}
			if (!tunnel.isSuccess()) {
				notifyFailure(channel, listener, tunnel.cause());
				return;
			}
		}
		whenSecured(channel, listener);
	}

	static void whenSecured(Channel channel, ReadyListener listener) {
		SslHandler sslHandler = channel.pipeline().get(SslHandler.class);
		if (sslHandler == null) {
			notifyReady(channel, listener);
			return;
		}
		Future<Channel> handshake = sslHandler.handshakeFuture();
		if (handshake.isDone()) {
			if (handshake.isSuccess()) {
				notifyReady(channel, listener);
			}
			else {
				notifyFailure(channel, listener, handshake.cause());
			}
			return;
		}
		handshake.addListener(f -> {
			if (f.isSuccess()) {
				notifyReady(channel, listener);
			}
			else {
				notifyFailure(channel, listener, f.cause());
			}
		});
	}

	static void notifyReady(Channel channel, ReadyListener listener) {
		ChannelHandler handler = channel.pipeline().get(UrlFetchPipeline.ConnectMetricsHandler);
		if (handler instanceof ConnectTimingHandler) {
			ConnectTimingHandler timing = (ConnectTimingHandler) handler;
			channel.pipeline().remove(handler);
			listener.onReady(channel, timing.lookupTime(), timing.connectTime(System.nanoTime()));
		}
		else {
			listener.onReady(channel, Duration.ZERO, Duration.ZERO);
		}
	}

	@SuppressWarnings("FutureReturnValueIgnored")
	static void notifyFailure(Channel channel, ReadyListener listener, Throwable cause) {
		if (log.isDebugEnabled()) {
			log.debug(format(channel, "Channel setup failed"), cause);
		}
		//"FutureReturnValueIgnored" this is deliberate
		channel.close();
		listener.onFailure(channel, cause);
	}

	interface ReadyListener {

		void onReady(Channel channel, Duration lookup, Duration connect);

		void onFailure(Channel channel, Throwable cause);
	}

	/**
	 * Records when the channel was created and when the connect operation started, the
	 * address being resolved in between.
	 */
	static final class ConnectTimingHandler extends ChannelOutboundHandlerAdapter {

		final long createdNanos = System.nanoTime();

		volatile long connectNanos;

		@Override
		public void connect(ChannelHandlerContext ctx, SocketAddress remoteAddress,
				@Nullable SocketAddress localAddress, ChannelPromise promise) throws Exception {
			connectNanos = System.nanoTime();
			super.connect(ctx, remoteAddress, localAddress, promise);
		}

		Duration lookupTime() {
			long connect = connectNanos;
			return connect == 0 ? Duration.ZERO : Duration.ofNanos(connect - createdNanos);
		}

		Duration connectTime(long nowNanos) {
			long connect = connectNanos;
			return Duration.ofNanos(nowNanos - (connect == 0 ? createdNanos : connect));
		}
	}

	static final Logger log = Loggers.getLogger(ConnectionSetup.class);

	private ConnectionSetup() {
	}
}
