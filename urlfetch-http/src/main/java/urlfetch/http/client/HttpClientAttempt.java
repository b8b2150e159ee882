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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpChunkedInput;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpStatusClass;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.stream.ChunkedStream;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.util.ReferenceCountUtil;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.Connection;
import urlfetch.UrlFetchPipeline;
import urlfetch.resources.ConnectionProvider;
import urlfetch.resources.LoopResources;
import urlfetch.transport.TransportConfig;

import static urlfetch.UrlFetch.format;

/**
 * One request/response exchange on one connection. Single use.
 * <p>
 * The returned {@link Mono} completes once the response is handled according to the
 * {@link Mode} chosen from its status line: fully read for {@link Mode#BUFFER},
 * {@link Mode#PIPE} and {@link Mode#DISCARD}, at the headers for {@link Mode#STREAM}.
 * Exactly one of completion, failure, timeout and cancellation takes effect; the
 * connection goes back to its pool only after a complete exchange and is closed otherwise.
 */
final class HttpClientAttempt implements HttpClientRequest {

	/**
	 * What to do with the response body.
	 */
	enum Mode {
		/**
		 * Read and drop, for responses followed by another attempt.
		 */
		DISCARD,
		/**
		 * Aggregate in memory.
		 */
		BUFFER,
		/**
		 * Write to the {@code writeStream} of the plan.
		 */
		PIPE,
		/**
		 * Hand over as a live {@link Flux}, read on demand.
		 */
		STREAM
	}

	/**
	 * Decisions taken by the execution when the response headers arrive.
	 */
	interface ResponseHandling {

		Mode select(HttpResponse head);

		HttpClientResponse toResponse(HttpResponse head, @Nullable Flux<byte[]> body);
	}

	/**
	 * A handled response.
	 */
	static final class Result {

		final HttpClientResponse response;
		final Mode               mode;
		final byte[]             body;

		Result(HttpClientResponse response, Mode mode, @Nullable byte[] body) {
			this.response = response;
			this.mode = mode;
			this.body = body;
		}
	}

	final RequestPlan      plan;
	final int              number;
	final BodySource       body;
	final HttpHeaders      headers;
	final Timing.Recorder  timing;
	final AtomicBoolean    terminated = new AtomicBoolean();

	String      method;
	UriEndpoint endpoint;

	MonoSink<Result>  sink;
	ResponseHandling  handling;
	PhaseTimeouts     timeouts;
	volatile Connection connection;
	volatile Disposable acquisition;

	// event loop confined
	HttpResponse                head;
	HttpClientResponse          response;
	Mode                        mode;
	boolean                     informational;
	boolean                     requestWritten;
	boolean                     finished;
	ByteArrayOutputStream       buffer;
	ResponseDecoder.Inflater    inflater;
	Sinks.Many<byte[]>          streamSink;
	final AtomicLong            demand = new AtomicLong();

	HttpClientAttempt(RequestPlan plan, int number, String method, UriEndpoint endpoint, HttpHeaders headers,
			BodySource body, Timing.Recorder timing) {
		this.plan = plan;
		this.number = number;
		this.method = method;
		this.endpoint = endpoint;
		this.headers = headers;
		this.body = body;
		this.timing = timing;
	}

	@Override
	public String method() {
		return method;
	}

	@Override
	public HttpClientRequest method(String method) {
		this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
		return this;
	}

	@Override
	public String uri() {
		return endpoint.toExternalForm();
	}

	@Override
	public HttpClientRequest uri(String uri) {
		this.endpoint = UriEndpoint.create(uri);
		headers.set(HttpHeaderNames.HOST, endpoint.getHostHeader());
		return this;
	}

	@Override
	public HttpHeaders requestHeaders() {
		return headers;
	}

	@Override
	public HttpClientRequest header(CharSequence name, CharSequence value) {
		headers.set(name, value);
		return this;
	}

	@Override
	public int attempt() {
		return number;
	}

	/**
	 * Execute the exchange.
	 *
	 * @param provider the connection provider
	 * @param loops the event loops
	 * @param config the transport configuration
	 * @param handling the decisions taken at the response headers
	 * @return the handled response
	 */
	Mono<Result> execute(ConnectionProvider provider, LoopResources loops, TransportConfig config,
			ResponseHandling handling) {
		return Mono.create(sink -> {
			this.sink = sink;
			this.handling = handling;
			this.timeouts = new PhaseTimeouts(loops.onClient().next(), plan.connectTimeout,
					plan.responseTimeout, this::onTimeout);
			sink.onCancel(this::cancel);
			timeouts.startConnectPhase();
			if (log.isDebugEnabled()) {
				log.debug("Attempt #{} {} {} via {}", number, method, endpoint, config);
			}
			acquisition = provider.acquire(config, loops)
			                      .subscribe(this::onConnection, this::onConnectError);
		});
	}

	void onConnectError(Throwable error) {
		if (terminate()) {
			sink.error(new ConnectFailedException("Connect to " + endpoint.getHostHeader() + " failed: " +
					error.getMessage(), error));
		}
	}

	void onConnection(Connection connection) {
		if (terminated.get()) {
			connection.dispose();
			return;
		}
		this.connection = connection;
		if (terminated.get()) {
			// cancelled or timed out concurrently
			connection.dispose();
			return;
		}
		timing.connected(connection.lookupTime(), connection.connectTime());
		Channel channel = connection.channel();
		channel.eventLoop().execute(() -> sendRequest(channel));
	}

	@SuppressWarnings("FutureReturnValueIgnored")
	void sendRequest(Channel channel) {
		if (terminated.get()) {
			return;
		}
		ChannelPipeline pipeline = channel.pipeline();
		if (pipeline.get(UrlFetchPipeline.HttpCodec) == null) {
			pipeline.addLast(UrlFetchPipeline.HttpCodec, new HttpClientCodec());
		}
		if (pipeline.get(UrlFetchPipeline.ChunkedWriter) == null) {
			pipeline.addLast(UrlFetchPipeline.ChunkedWriter, new ChunkedWriteHandler());
		}
		if (pipeline.get(UrlFetchPipeline.ResponseHandler) != null) {
			pipeline.remove(UrlFetchPipeline.ResponseHandler);
		}
		pipeline.addLast(UrlFetchPipeline.ResponseHandler, new ResponseHandler());

		HttpMethod httpMethod = HttpMethod.valueOf(method);
		HttpHeaders requestHeaders = headers.copy();
		ChannelFuture lastWrite;
		if (body instanceof BodySource.Stream) {
			InputStream stream = ((BodySource.Stream) body).take();
			if (stream == null) {
				fail(new RequestException("The request stream was already consumed"));
				return;
			}
			HttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, httpMethod, endpoint.getRawUri(),
					requestHeaders);
			HttpUtil.setTransferEncodingChunked(request, true);
			channel.write(request);
			lastWrite = channel.writeAndFlush(new HttpChunkedInput(new ChunkedStream(stream)));
		}
		else {
			ByteBuf content = body instanceof BodySource.Buffer ?
					Unpooled.wrappedBuffer(((BodySource.Buffer) body).bytes) :
					Unpooled.EMPTY_BUFFER;
			lastWrite = channel.writeAndFlush(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, httpMethod,
					endpoint.getRawUri(), content, requestHeaders, EmptyHttpHeaders.INSTANCE));
		}
		if (log.isDebugEnabled()) {
			log.debug(format(channel, "Sending {} {} (attempt #{})"), method, endpoint, number);
		}
		lastWrite.addListener(f -> {
			if (f.isSuccess()) {
				requestWritten = true;
				timing.requestSent();
				timeouts.startResponsePhase();
			}
			else {
				fail(new RequestException("Failed to send " + method + ' ' + endpoint + ": " +
						f.cause().getMessage(), f.cause()));
			}
		});
	}

	void onHead(ChannelHandlerContext ctx, HttpResponse head) {
		if (finished) {
			return;
		}
		HttpResponseStatus status = head.status();
		if (status.codeClass() == HttpStatusClass.INFORMATIONAL &&
				status.code() != HttpResponseStatus.SWITCHING_PROTOCOLS.code()) {
			informational = true;
			return;
		}
		timing.firstByte();
		timeouts.startResponsePhase();
		this.head = head;
		try {
			this.mode = handling.select(head);
			if (mode != Mode.DISCARD && ResponseDecoder.isGzip(plan, head.headers())) {
				inflater = new ResponseDecoder.Inflater();
			}
			switch (mode) {
				case BUFFER:
					buffer = new ByteArrayOutputStream();
					response = handling.toResponse(head, null);
					break;
				case STREAM:
					streamSink = Sinks.many().unicast().onBackpressureBuffer();
					ctx.channel().config().setAutoRead(false);
					Flux<byte[]> live = streamSink.asFlux()
					                              .doOnRequest(n -> onStreamRequest(ctx, n))
					                              .doOnNext(bytes -> demand.decrementAndGet())
					                              .doOnCancel(this::onStreamCancel);
					response = handling.toResponse(head, live);
					if (terminate()) {
						if (log.isDebugEnabled()) {
							log.debug(format(ctx.channel(), "Response headers received, streaming the body"));
						}
						sink.success(new Result(response, mode, null));
					}
					break;
				default:
					response = handling.toResponse(head, null);
			}
		}
		catch (RuntimeException e) {
			fail(e);
		}
	}

	void onContent(HttpContent content) {
		if (finished || informational || head == null || mode == Mode.DISCARD) {
			return;
		}
		ByteBuf data = content.content();
		if (!data.isReadable()) {
			return;
		}
		try {
			byte[] bytes = inflater != null ? inflater.inflate(data.retain()) : ByteBufUtil.getBytes(data);
			deliver(bytes);
		}
		catch (RuntimeException e) {
			fail(new RequestException("Failed to decode the response body of " + endpoint + ": " + e.getMessage(), e));
		}
	}

	void deliver(byte[] bytes) {
		if (bytes.length == 0 || finished) {
			return;
		}
		switch (mode) {
			case BUFFER:
				buffer.write(bytes, 0, bytes.length);
				break;
			case PIPE:
				try {
					plan.writeStream.write(bytes);
				}
				catch (IOException e) {
					fail(new RequestException("Failed to write the response body to writeStream", e));
				}
				break;
			case STREAM:
				streamSink.tryEmitNext(bytes);
				break;
			default:
		}
	}

	void onLast(ChannelHandlerContext ctx) {
		if (finished) {
			return;
		}
		if (informational) {
			informational = false;
			return;
		}
		if (head == null) {
			return;
		}
		if (inflater != null) {
			try {
				deliver(inflater.finish());
			}
			catch (RuntimeException e) {
				fail(new RequestException("Failed to decode the response body of " + endpoint + ": " + e.getMessage(), e));
				return;
			}
		}
		if (finished) {
			return;
		}
		finished = true;
		timing.contentDownloaded();
		Channel channel = ctx.channel();
		Connection connection = this.connection;
		boolean persistent = requestWritten && HttpUtil.isKeepAlive(head) &&
				!headers.containsValue(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE, true);
		ChannelPipeline pipeline = channel.pipeline();
		if (pipeline.get(UrlFetchPipeline.ResponseHandler) != null) {
			pipeline.remove(UrlFetchPipeline.ResponseHandler);
		}
		channel.config().setAutoRead(true);
		connection.markPersistent(persistent);
		if (log.isDebugEnabled()) {
			log.debug(format(channel, "Received last HTTP packet, status {}, persistent {}"),
					head.status().code(), persistent);
		}

		switch (mode) {
			case STREAM:
				connection.release();
				streamSink.tryEmitComplete();
				return;
			case PIPE:
				try {
					if (plan.consumeWriteStream) {
						plan.writeStream.close();
					}
					else {
						plan.writeStream.flush();
					}
				}
				catch (IOException e) {
					connection.release();
					if (terminate()) {
						sink.error(new RequestException("Failed to close writeStream", e).response(response));
					}
					return;
				}
				complete(connection, null);
				return;
			case BUFFER:
				complete(connection, buffer.toByteArray());
				return;
			default:
				complete(connection, null);
		}
	}

	void complete(Connection connection, @Nullable byte[] bytes) {
		if (terminate()) {
			connection.release();
			sink.success(new Result(response, mode, bytes));
		}
		else {
			connection.dispose();
		}
	}

	void onInactive() {
		if (finished) {
			return;
		}
		fail(new PrematureCloseException(head == null ?
				"Connection prematurely closed BEFORE response" :
				"Connection prematurely closed DURING response"));
	}

	void onTimeout(RequestTimeoutException.Phase phase) {
		if (log.isDebugEnabled()) {
			log.debug("{} phase timeout of {} {} after {}", phase, method, endpoint, timeouts.timeout(phase));
		}
		fail(new RequestTimeoutException(phase, timeouts.timeout(phase), response));
	}

	/**
	 * Fail the exchange, or the live body once the exchange was handed over. The
	 * connection is closed.
	 */
	void fail(Throwable error) {
		if (error instanceof RequestException && response != null) {
			((RequestException) error).response(response);
		}
		if (terminate()) {
			finished = true;
			releaseResources();
			sink.error(error);
		}
		else if (streamSink != null && !finished) {
			finished = true;
			releaseResources();
			streamSink.tryEmitError(error);
		}
	}

	void cancel() {
		if (terminate()) {
			if (log.isDebugEnabled()) {
				log.debug("Attempt #{} {} {} cancelled", number, method, endpoint);
			}
			releaseResources();
		}
	}

	void onStreamRequest(ChannelHandlerContext ctx, long n) {
		if (n == Long.MAX_VALUE) {
			demand.set(Long.MAX_VALUE);
		}
		else {
			demand.accumulateAndGet(n, (current, add) -> current == Long.MAX_VALUE ? current :
					Math.min(Long.MAX_VALUE - 1, current + add));
		}
		ctx.channel().eventLoop().execute(() -> {
			if (!finished) {
				ctx.read();
			}
		});
	}

	void onStreamCancel() {
		Channel channel = connection.channel();
		channel.eventLoop().execute(() -> {
			if (!finished) {
				finished = true;
				if (log.isDebugEnabled()) {
					log.debug(format(channel, "Response body cancelled, closing the connection"));
				}
				releaseResources();
			}
		});
	}

	void onReadComplete(ChannelHandlerContext ctx) {
		if (mode == Mode.STREAM && !finished && demand.get() > 0) {
			ctx.read();
		}
	}

	boolean terminate() {
		if (terminated.compareAndSet(false, true)) {
			PhaseTimeouts timeouts = this.timeouts;
			if (timeouts != null) {
				timeouts.cancel();
			}
			return true;
		}
		return false;
	}

	void releaseResources() {
		Disposable acquisition = this.acquisition;
		if (acquisition != null) {
			acquisition.dispose();
		}
		Connection connection = this.connection;
		if (connection != null) {
			connection.dispose();
		}
		ResponseDecoder.Inflater inflater = this.inflater;
		if (inflater != null) {
			connection = this.connection;
			if (connection != null) {
				connection.channel().eventLoop().execute(inflater::close);
			}
			else {
				inflater.close();
			}
		}
	}

	final class ResponseHandler extends ChannelInboundHandlerAdapter {

		@Override
		public void channelRead(ChannelHandlerContext ctx, Object msg) {
			try {
				if (msg instanceof HttpResponse) {
					onHead(ctx, (HttpResponse) msg);
				}
				if (msg instanceof HttpContent) {
					onContent((HttpContent) msg);
				}
				if (msg instanceof LastHttpContent) {
					onLast(ctx);
				}
			}
			finally {
				ReferenceCountUtil.release(msg);
			}
		}

		@Override
		public void channelReadComplete(ChannelHandlerContext ctx) {
			onReadComplete(ctx);
			ctx.fireChannelReadComplete();
		}

		@Override
		public void channelInactive(ChannelHandlerContext ctx) {
			onInactive();
			ctx.fireChannelInactive();
		}

		@Override
		public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
			if (log.isDebugEnabled()) {
				log.debug(format(ctx.channel(), "Exchange failed"), cause);
			}
			if (cause instanceof IOException) {
				fail(new PrematureCloseException("Connection error: " + cause.getMessage(), cause));
			}
			else {
				fail(new RequestException("Invalid response from " + endpoint + ": " + cause.getMessage(), cause));
			}
		}
	}

	static final Logger log = Loggers.getLogger(HttpClientAttempt.class);
}
