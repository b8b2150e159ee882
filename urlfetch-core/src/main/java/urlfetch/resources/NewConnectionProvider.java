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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;
import urlfetch.Connection;
import urlfetch.transport.TransportConfig;

import static urlfetch.UrlFetch.format;

/**
 * {@link ConnectionProvider} that always establishes a new connection, closed on release.
 */
final class NewConnectionProvider implements ConnectionProvider {

	static final Logger log = Loggers.getLogger(NewConnectionProvider.class);

	static final NewConnectionProvider INSTANCE = new NewConnectionProvider();

	static final int PENDING   = 0;
	static final int DELIVERED = 1;
	static final int CANCELLED = 2;

	@Override
	@SuppressWarnings("FutureReturnValueIgnored")
	public Mono<Connection> acquire(TransportConfig config, LoopResources loops) {
		return Mono.create(sink -> {
			AtomicInteger state = new AtomicInteger(PENDING);
			Bootstrap bootstrap = ConnectionSetup.bootstrap(config, loops)
					.handler(new ChannelInitializer<Channel>() {
						@Override
						protected void initChannel(Channel ch) {
							ConnectionSetup.initChannel(ch, config);
						}
					});
			ChannelFuture connect = bootstrap.connect();
			sink.onCancel(() -> {
				if (state.compareAndSet(PENDING, CANCELLED)) {
					if (log.isDebugEnabled()) {
						log.debug(format(connect.channel(), "Connect cancelled, closing the channel"));
					}
					//"FutureReturnValueIgnored" this is deliberate
					connect.channel().close();
				}
			});
			connect.addListener(f -> {
				if (!f.isSuccess()) {
					if (state.compareAndSet(PENDING, DELIVERED)) {
						sink.error(f.cause());
					}
					return;
				}
				ConnectionSetup.whenReady(connect.channel(), new ConnectionSetup.ReadyListener() {
					@Override
					public void onReady(Channel channel, Duration lookup, Duration connectTime) {
						Connection connection = Connection.from(channel, false, lookup, connectTime, Channel::close)
						                                  .markPersistent(false);
						if (state.compareAndSet(PENDING, DELIVERED)) {
							sink.success(connection);
						}
						else {
							connection.dispose();
						}
					}

					@Override
					public void onFailure(Channel channel, Throwable cause) {
						if (state.compareAndSet(PENDING, DELIVERED)) {
							sink.error(cause);
						}
					}
				});
			});
		});
	}

	@Override
	public String toString() {
		return "NewConnectionProvider";
	}
}
