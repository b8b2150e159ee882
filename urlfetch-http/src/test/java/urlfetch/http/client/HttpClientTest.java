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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.tcp.TcpServer;
import reactor.test.StepVerifier;
import urlfetch.BaseHttpTest;
import urlfetch.resources.ConnectionProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class HttpClientTest extends BaseHttpTest {

	static final byte[] GZIPPED = gzip("compressed hello, compressed hello");

	static final String DIGEST_CHALLENGE = "Digest realm=\"testrealm\", nonce=\"dcd98b7102dd2f0e\", qop=\"auth\", opaque=\"5ccc069c\"";

	final AtomicInteger digestHits = new AtomicInteger();

	HttpClient client;

	@BeforeEach
	void setUp() {
		disposableServer =
				createServer()
				        .route(routes ->
				            routes.get("/hello", (req, res) -> res.sendString(Mono.just("hello")))
				                  .get("/json", (req, res) ->
				                      res.header(HttpHeaderNames.CONTENT_TYPE, "application/json")
				                         .sendString(Mono.just("{\"name\":\"urlfetch\",\"tags\":[\"http\",\"client\"]}")))
				                  .get("/json-ctl", (req, res) ->
				                      res.header(HttpHeaderNames.CONTENT_TYPE, "application/json")
				                         .sendString(Mono.just("{\"text\":\"tab\there\"}")))
				                  .get("/redirect/{n}", (req, res) -> {
				                      int n = Integer.parseInt(req.param("n"));
				                      return n == 0 ? res.sendString(Mono.just("landed")) :
				                              res.sendRedirect("/redirect/" + (n - 1));
				                  })
				                  .get("/loop", (req, res) -> res.sendRedirect("/loop"))
				                  .get("/elsewhere", (req, res) -> res.sendRedirect(req.requestHeaders().get("X-Target")))
				                  .post("/moved", (req, res) ->
				                      req.receive().then(res.status(301).header(HttpHeaderNames.LOCATION, "/echo/moved").send()))
				                  .post("/see-other", (req, res) ->
				                      req.receive().then(res.status(303).header(HttpHeaderNames.LOCATION, "/echo/other").send()))
				                  .post("/temporary", (req, res) ->
				                      req.receive().then(res.status(307).header(HttpHeaderNames.LOCATION, "/echo/temporary").send()))
				                  .get("/digest", (req, res) -> {
				                      digestHits.incrementAndGet();
				                      String authorization = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
				                      if (authorization != null && authorization.startsWith("Digest ") &&
				                              authorization.contains("username=\"user\"")) {
				                          return res.sendString(Mono.just(authorization));
				                      }
				                      return res.status(401)
				                                .header(HttpHeaderNames.WWW_AUTHENTICATE, DIGEST_CHALLENGE)
				                                .send();
				                  })
				                  .get("/gzip", (req, res) ->
				                      res.header(HttpHeaderNames.CONTENT_ENCODING, "gzip")
				                         .header("X-Accept-Encoding",
				                                 req.requestHeaders().get(HttpHeaderNames.ACCEPT_ENCODING, "none"))
				                         .sendByteArray(Mono.just(GZIPPED)))
				                  .get("/stream", (req, res) ->
				                      res.sendString(Flux.just("a", "b", "c").delayElements(Duration.ofMillis(20))))
				                  .get("/slow", (req, res) ->
				                      res.sendString(Mono.delay(Duration.ofSeconds(2)).map(l -> "slow")))
				                  .route(req -> req.uri().startsWith("/echo"), HttpClientTest::echo))
				        .bindNow();
		client = HttpClient.create();
	}

	@AfterEach
	void disposeClient() {
		client.dispose();
	}

	static Publisher<Void> echo(HttpServerRequest req, HttpServerResponse res) {
		HttpHeaders headers = req.requestHeaders();
		return res.header("X-Method", req.method().name())
		          .header("X-Uri", req.uri())
		          .header("X-Host", headers.get(HttpHeaderNames.HOST, "none"))
		          .header("X-Content-Type", headers.get(HttpHeaderNames.CONTENT_TYPE, "none"))
		          .header("X-Content-Length", headers.get(HttpHeaderNames.CONTENT_LENGTH, "none"))
		          .header("X-Transfer-Encoding", headers.get(HttpHeaderNames.TRANSFER_ENCODING, "none"))
		          .header("X-Authorization", headers.get(HttpHeaderNames.AUTHORIZATION, "none"))
		          .header("X-User-Agent", headers.get(HttpHeaderNames.USER_AGENT, "none"))
		          .header("X-Accept", headers.get(HttpHeaderNames.ACCEPT, "none"))
		          .sendString(req.receive()
		                         .aggregate()
		                         .asString()
		                         .defaultIfEmpty(""));
	}

	static byte[] gzip(String text) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
			gzip.write(text.getBytes(StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out.toByteArray();
	}

	HttpResult send(String path, RequestOptions options) throws Exception {
		return client.request(url(path), options)
		             .get(5, TimeUnit.SECONDS);
	}

	@Test
	void getReturnsTheBodyAsBytes() throws Exception {
		HttpResult result = send("/hello", RequestOptions.EMPTY);

		assertThat(result.status()).isEqualTo(200);
		assertThat(result.data()).isInstanceOf(byte[].class);
		assertThat(result.dataAsString()).isEqualTo("hello");
		assertThat(result.response().requestUrls()).containsExactly(url("/hello"));
		assertThat(result.response().url()).isEqualTo(url("/hello"));
		assertThat(result.response().timing()).isNull();
	}

	@Test
	void defaultRequestHeaders() throws Exception {
		HttpResult result = send("/echo", RequestOptions.EMPTY);

		HttpHeaders headers = result.response().headers();
		assertThat(headers.get("X-Method")).isEqualTo("GET");
		assertThat(headers.get("X-User-Agent")).isEqualTo(HttpRequests.USER_AGENT);
		assertThat(headers.get("X-Host")).isEqualTo("127.0.0.1:" + disposableServer.port());
		assertThat(headers.get("X-Content-Length")).isEqualTo("none");
	}

	@Test
	void errorStatusIsAnOutcome() throws Exception {
		HttpResult result = send("/missing", RequestOptions.EMPTY);

		assertThat(result.status()).isEqualTo(404);
	}

	@Test
	void textDataType() throws Exception {
		assertThat(send("/hello", RequestOptions.builder().dataType("text").build()).data()).isEqualTo("hello");
	}

	@Test
	void jsonDataType() throws Exception {
		HttpResult result = send("/json", RequestOptions.builder().dataType(DataType.JSON).build());

		JsonNode json = result.dataAsJson();
		assertThat(json).isNotNull();
		assertThat(json.get("name").asText()).isEqualTo("urlfetch");
		assertThat(json.get("tags").get(1).asText()).isEqualTo("client");
	}

	@Test
	void jsonControlCharacters() throws Exception {
		StepVerifier.create(client.mono(url("/json-ctl"), RequestOptions.builder().dataType("json").build()))
		            .expectErrorSatisfies(e -> {
		                assertThat(e).isInstanceOf(ResponseJsonParseException.class);
		                assertThat(((ResponseJsonParseException) e).body()).isEqualTo("{\"text\":\"tab\there\"}");
		                assertThat(((ResponseJsonParseException) e).response().statusCode()).isEqualTo(200);
		            })
		            .verify(Duration.ofSeconds(5));

		HttpResult result = send("/json-ctl", RequestOptions.builder()
		                                                    .dataType("json")
		                                                    .fixJSONCtlChars(true)
		                                                    .build());

		assertThat(result.dataAsJson().get("text").asText()).isEqualTo("tab\there");
	}

	@Test
	void postJson() throws Exception {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("name", "urlfetch");
		data.put("tags", Collections.singletonList("http"));

		HttpResult result = send("/echo", RequestOptions.builder()
		                                                .method("post")
		                                                .contentType("json")
		                                                .dataType("json")
		                                                .data(data)
		                                                .build());

		HttpHeaders headers = result.response().headers();
		assertThat(headers.get("X-Method")).isEqualTo("POST");
		assertThat(headers.get("X-Content-Type")).isEqualTo("application/json");
		assertThat(headers.get("X-Accept")).isEqualTo("application/json");
		assertThat(result.dataAsJson().get("tags").get(0).asText()).isEqualTo("http");
	}

	@Test
	void getDataIsSentInTheQuery() throws Exception {
		HttpResult result = send("/echo?lang=en", RequestOptions.builder()
		                                                        .data(Collections.singletonMap("q", "urlfetch"))
		                                                        .build());

		assertThat(result.response().headers().get("X-Uri")).isEqualTo("/echo?lang=en&q=urlfetch");
		assertThat(result.response().url()).isEqualTo(url("/echo?lang=en&q=urlfetch"));
	}

	@Test
	void streamedRequestBody() throws Exception {
		HttpResult result = send("/echo", RequestOptions.builder()
		                                                .method("PUT")
		                                                .stream(new ByteArrayInputStream("streamed body".getBytes(StandardCharsets.UTF_8)))
		                                                .build());

		assertThat(result.response().headers().get("X-Transfer-Encoding")).isEqualTo("chunked");
		assertThat(result.dataAsString()).isEqualTo("streamed body");
	}

	@Test
	void headRequest() throws Exception {
		HttpResult result = send("/echo", RequestOptions.builder().method("HEAD").build());

		assertThat(result.status()).isEqualTo(200);
		assertThat(result.response().headers().get("X-Method")).isEqualTo("HEAD");
		assertThat(result.dataAsBytes()).isEmpty();
	}

	@Test
	void basicAuthentication() throws Exception {
		HttpResult result = send("/echo", RequestOptions.builder().auth("user:secret").build());

		assertThat(result.response().headers().get("X-Authorization")).isEqualTo("Basic dXNlcjpzZWNyZXQ=");
	}

	@Test
	void callerHeadersKeepTheComputedOnes() throws Exception {
		HttpResult result = send("/echo/json", RequestOptions.builder()
		                                                     .method("POST")
		                                                     .header("X-Trace", "abc")
		                                                     .data(Collections.singletonMap("a", 1))
		                                                     .contentType("json")
		                                                     .dataType("json")
		                                                     .auth("user:secret")
		                                                     .build());

		HttpHeaders headers = result.response().headers();
		assertThat(headers.get("X-Authorization")).isEqualTo("Basic dXNlcjpzZWNyZXQ=");
		assertThat(headers.get("X-User-Agent")).isEqualTo(HttpRequests.USER_AGENT);
		assertThat(headers.get("X-Accept")).isEqualTo("application/json");
		assertThat(headers.get("X-Content-Type")).startsWith("application/json");
		assertThat(headers.get("X-Content-Length")).isEqualTo("7");
		assertThat(result.dataAsJson().get("a").asInt()).isEqualTo(1);
	}

	@Test
	void bodyDoesNotLeakIntoTheNextRequestOnAPooledConnection() throws Exception {
		ConnectionProvider provider = ConnectionProvider.create("bodyFraming", 1);
		HttpClient pooled = HttpClient.create(RequestOptions.EMPTY, provider);
		try {
			for (int i = 0; i < 2; i++) {
				HttpResult result = pooled.request(url("/echo/framed"), RequestOptions.builder()
				                                                                  .method("POST")
				                                                                  .header("X-Trace", "abc")
				                                                                  .content("payload")
				                                                                  .build())
				                          .get(5, TimeUnit.SECONDS);

				assertThat(result.response().headers().get("X-Method")).isEqualTo("POST");
				assertThat(result.dataAsString()).isEqualTo("payload");
			}
		}
		finally {
			pooled.dispose();
			provider.disposeLater()
			        .block(Duration.ofSeconds(5));
		}
	}

	@Test
	void redirectsAreNotFollowedByDefault() throws Exception {
		HttpResult result = send("/redirect/2", RequestOptions.EMPTY);

		assertThat(result.status()).isEqualTo(302);
		assertThat(result.response().headers().get(HttpHeaderNames.LOCATION)).isEqualTo("/redirect/1");
		assertThat(result.response().requestUrls()).hasSize(1);
	}

	@Test
	void redirectChain() throws Exception {
		HttpResult result = send("/redirect/2", RequestOptions.builder()
		                                                      .followRedirect(true)
		                                                      .dataType("text")
		                                                      .build());

		assertThat(result.status()).isEqualTo(200);
		assertThat(result.data()).isEqualTo("landed");
		assertThat(result.response().requestUrls())
				.containsExactly(url("/redirect/2"), url("/redirect/1"), url("/redirect/0"));
	}

	@Test
	void tooManyRedirects() {
		StepVerifier.create(client.mono(url("/loop"), RequestOptions.builder()
		                                                          .followRedirect(true)
		                                                          .maxRedirects(3)
		                                                          .build()))
		            .expectErrorSatisfies(e -> {
		                assertThat(e).isInstanceOf(TooManyRedirectsException.class);
		                HttpClientResponse response = ((TooManyRedirectsException) e).response();
		                assertThat(response).isNotNull();
		                assertThat(response.statusCode()).isEqualTo(302);
		                assertThat(response.requestUrls()).hasSize(4);
		            })
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void zeroMaxRedirects() {
		StepVerifier.create(client.mono(url("/redirect/1"), RequestOptions.builder()
		                                                                .followRedirect(true)
		                                                                .maxRedirects(0)
		                                                                .build()))
		            .expectError(TooManyRedirectsException.class)
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void postBecomesGetOn301() throws Exception {
		HttpResult result = send("/moved", RequestOptions.builder()
		                                                 .method("POST")
		                                                 .content("payload")
		                                                 .followRedirect(true)
		                                                 .build());

		HttpHeaders headers = result.response().headers();
		assertThat(headers.get("X-Method")).isEqualTo("GET");
		assertThat(headers.get("X-Content-Length")).isEqualTo("none");
		assertThat(result.dataAsString()).isEmpty();
		assertThat(result.response().requestUrls()).containsExactly(url("/moved"), url("/echo/moved"));
	}

	@Test
	void postBecomesGetOn303() throws Exception {
		HttpResult result = send("/see-other", RequestOptions.builder()
		                                                     .method("POST")
		                                                     .content("payload")
		                                                     .followRedirect(true)
		                                                     .build());

		assertThat(result.response().headers().get("X-Method")).isEqualTo("GET");
		assertThat(result.dataAsString()).isEmpty();
	}

	@Test
	void methodAndBodyAreKeptOn307() throws Exception {
		HttpResult result = send("/temporary", RequestOptions.builder()
		                                                     .method("POST")
		                                                     .content("payload")
		                                                     .followRedirect(true)
		                                                     .build());

		assertThat(result.response().headers().get("X-Method")).isEqualTo("POST");
		assertThat(result.dataAsString()).isEqualTo("payload");
	}

	@Test
	void streamCannotBeReplayedOn307() {
		StepVerifier.create(client.mono(url("/temporary"), RequestOptions.builder()
		                                                                .method("POST")
		                                                                .stream(new ByteArrayInputStream(new byte[]{1, 2, 3}))
		                                                                .followRedirect(true)
		                                                                .build()))
		            .expectErrorSatisfies(e -> {
		                assertThat(e).isInstanceOf(StreamReplayException.class);
		                assertThat(((StreamReplayException) e).response().statusCode()).isEqualTo(307);
		            })
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void streamCannotBeReplayedWhenA302KeepsTheMethod() {
		StepVerifier.create(client.mono(url("/redirect/1"), RequestOptions.builder()
		                                                                .stream(new ByteArrayInputStream(new byte[]{1, 2, 3}))
		                                                                .followRedirect(true)
		                                                                .build()))
		            .expectErrorSatisfies(e -> {
		                assertThat(e).isInstanceOf(StreamReplayException.class);
		                assertThat(((StreamReplayException) e).response().statusCode()).isEqualTo(302);
		            })
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void digestAuthentication() throws Exception {
		HttpResult result = send("/digest", RequestOptions.builder()
		                                                  .digestAuth("user:secret")
		                                                  .dataType("text")
		                                                  .build());

		assertThat(result.status()).isEqualTo(200);
		assertThat((String) result.data()).contains("realm=\"testrealm\"")
		                                  .contains("nonce=\"dcd98b7102dd2f0e\"")
		                                  .contains("uri=\"/digest\"")
		                                  .contains("nc=00000001")
		                                  .contains("opaque=\"5ccc069c\"");
		assertThat(result.response().requestUrls()).containsExactly(url("/digest"));
		assertThat(digestHits.get()).isEqualTo(2);

		HttpResult second = send("/digest", RequestOptions.builder()
		                                                  .digestAuth("user:secret")
		                                                  .dataType("text")
		                                                  .build());

		assertThat(second.status()).isEqualTo(200);
		assertThat((String) second.data()).contains("nc=00000002");
		assertThat(digestHits.get()).isEqualTo(3);
	}

	@Test
	void digestCredentialsAreNotSentAfterACrossHostRedirect() throws Exception {
		AtomicInteger hits = new AtomicInteger();
		List<String> authorizations = new CopyOnWriteArrayList<>();
		DisposableServer other =
				createServer().host("localhost")
				              .handle((req, res) -> {
				                  hits.incrementAndGet();
				                  String authorization = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
				                  if (authorization != null) {
				                      authorizations.add(authorization);
				                  }
				                  return res.status(401)
				                            .header(HttpHeaderNames.WWW_AUTHENTICATE,
				                                    "Digest realm=\"other\", nonce=\"0a4f113b\", qop=\"auth\"")
				                            .send();
				              })
				              .bindNow();
		try {
			HttpResult result = send("/elsewhere", RequestOptions.builder()
			                                                     .header("X-Target", "http://localhost:" + other.port() + "/digest")
			                                                     .digestAuth("user:secret")
			                                                     .followRedirect(true)
			                                                     .build());

			assertThat(result.status()).isEqualTo(401);
			assertThat(hits.get()).isEqualTo(1);
			assertThat(authorizations).isEmpty();
		}
		finally {
			other.disposeNow();
		}
	}

	@Test
	void rejectedDigestCredentials() throws Exception {
		HttpResult result = send("/digest", RequestOptions.builder().digestAuth("other:secret").build());

		assertThat(result.status()).isEqualTo(401);
		assertThat(digestHits.get()).isEqualTo(2);
	}

	@Test
	void gzipResponse() throws Exception {
		HttpResult result = send("/gzip", RequestOptions.builder().gzip(true).dataType("text").build());

		assertThat(result.response().headers().get("X-Accept-Encoding")).isEqualTo("gzip");
		assertThat(result.data()).isEqualTo("compressed hello, compressed hello");

		HttpResult raw = send("/gzip", RequestOptions.EMPTY);

		assertThat(raw.response().headers().get("X-Accept-Encoding")).isEqualTo("none");
		assertThat(raw.dataAsBytes()).isEqualTo(GZIPPED);
	}

	@Test
	void gzipStreaming() throws Exception {
		HttpResult result = send("/gzip", RequestOptions.builder().gzip(true).streaming(true).build());

		String body = result.response()
		                    .body()
		                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
		                    .collect(Collectors.joining())
		                    .block(Duration.ofSeconds(5));

		assertThat(body).isEqualTo("compressed hello, compressed hello");
	}

	@Test
	void streamingResponse() throws Exception {
		HttpResult result = send("/stream", RequestOptions.builder().customResponse(true).build());

		assertThat(result.data()).isNull();
		assertThat(result.status()).isEqualTo(200);

		StepVerifier.create(result.response()
		                          .body()
		                          .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
		                          .collect(Collectors.joining()))
		            .expectNext("abc")
		            .expectComplete()
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void cancelledStreamClosesTheConnection() throws Exception {
		HttpResult result = send("/stream", RequestOptions.builder().streaming(true).build());

		StepVerifier.create(result.response().body(), 1)
		            .expectNextCount(1)
		            .thenCancel()
		            .verify(Duration.ofSeconds(5));

		assertThat(send("/hello", RequestOptions.EMPTY).dataAsString()).isEqualTo("hello");
	}

	@Test
	void writeStreamIsClosed() throws Exception {
		TrackingOutputStream out = new TrackingOutputStream();

		HttpResult result = send("/hello", RequestOptions.builder().writeStream(out).build());

		assertThat(result.data()).isNull();
		assertThat(out.toString(StandardCharsets.UTF_8.name())).isEqualTo("hello");
		assertThat(out.closed).isTrue();
	}

	@Test
	void writeStreamIsKeptOpen() throws Exception {
		TrackingOutputStream out = new TrackingOutputStream();

		send("/hello", RequestOptions.builder().writeStream(out).consumeWriteStream(false).build());
		send("/hello", RequestOptions.builder().writeStream(out).consumeWriteStream(false).build());

		assertThat(out.toString(StandardCharsets.UTF_8.name())).isEqualTo("hellohello");
		assertThat(out.closed).isFalse();
	}

	@Test
	void responseTimeout() {
		StepVerifier.create(client.mono(url("/slow"), RequestOptions.builder().timeout(5000, 200).build()))
		            .expectErrorSatisfies(e -> {
		                assertThat(e).isInstanceOf(RequestTimeoutException.class);
		                RequestTimeoutException timeout = (RequestTimeoutException) e;
		                assertThat(timeout.phase()).isEqualTo(RequestTimeoutException.Phase.RESPONSE);
		                assertThat(timeout.timeout()).isEqualTo(Duration.ofMillis(200));
		                assertThat(timeout.response()).isNull();
		            })
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void timedOutConnectionIsClosedAndNotPooled() throws Exception {
		CountDownLatch closed = new CountDownLatch(1);
		DisposableServer server =
				createServer().handle((req, res) -> {
				                  String remote = String.valueOf(req.remoteAddress());
				                  if (req.uri().startsWith("/slow")) {
				                      req.withConnection(c -> c.onDispose(closed::countDown));
				                      return res.sendString(Mono.delay(Duration.ofSeconds(2)).map(l -> remote));
				                  }
				                  return res.sendString(Mono.just(remote));
				              })
				              .bindNow();
		ConnectionProvider provider = ConnectionProvider.create("responseTimeout", 1);
		HttpClient pooled = HttpClient.create(RequestOptions.EMPTY, provider);
		String base = "http://127.0.0.1:" + server.port();
		try {
			String first = pooled.request(base + "/").get(5, TimeUnit.SECONDS).dataAsString();

			StepVerifier.create(pooled.mono(base + "/slow", RequestOptions.builder().timeout(5000, 200).build()))
			            .expectError(RequestTimeoutException.class)
			            .verify(Duration.ofSeconds(5));

			assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
			String next = pooled.request(base + "/").get(5, TimeUnit.SECONDS).dataAsString();
			assertThat(next).isNotEqualTo(first);
		}
		finally {
			server.disposeNow();
			pooled.dispose();
			provider.disposeLater()
			        .block(Duration.ofSeconds(5));
		}
	}

	@Test
	void connectTimeoutCoversThePendingAcquisition() {
		ConnectionProvider provider = ConnectionProvider.create("connectTimeout", 1);
		HttpClient limited = HttpClient.create(RequestOptions.EMPTY, provider);
		Disposable slow = limited.mono(url("/slow"))
		                         .subscribe(null, e -> { });
		try {
			StepVerifier.create(limited.mono(url("/hello"), RequestOptions.builder().timeout(100, 5000).build()))
			            .expectErrorSatisfies(e -> {
			                assertThat(e).isInstanceOf(RequestTimeoutException.class);
			                assertThat(((RequestTimeoutException) e).phase()).isEqualTo(RequestTimeoutException.Phase.CONNECT);
			            })
			            .verify(Duration.ofSeconds(5));
		}
		finally {
			slow.dispose();
			limited.dispose();
			provider.disposeLater()
			        .block(Duration.ofSeconds(5));
		}
	}

	@Test
	void zeroTimeoutDisablesThePhase() throws Exception {
		HttpResult result = send("/hello", RequestOptions.builder().timeout(0).build());

		assertThat(result.dataAsString()).isEqualTo("hello");
	}

	@Test
	void connectionRefused() {
		DisposableServer closed = createServer().handle((req, res) -> res.send()).bindNow();
		int port = closed.port();
		closed.disposeNow();

		StepVerifier.create(client.mono("http://127.0.0.1:" + port + "/"))
		            .expectError(ConnectFailedException.class)
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void connectionClosedBeforeResponse() {
		DisposableServer server =
				TcpServer.create()
				         .host("127.0.0.1")
				         .port(0)
				         .handle((in, out) -> in.receive()
				                                .next()
				                                .doOnNext(b -> in.withConnection(Connection::dispose))
				                                .then())
				         .bindNow();
		try {
			StepVerifier.create(client.mono("http://127.0.0.1:" + server.port() + "/"))
			            .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(PrematureCloseException.class)
			                                                    .hasMessageContaining("BEFORE response"))
			            .verify(Duration.ofSeconds(5));
		}
		finally {
			server.disposeNow();
		}
	}

	@Test
	void connectionClosedDuringResponse() {
		DisposableServer server =
				TcpServer.create()
				         .host("127.0.0.1")
				         .port(0)
				         .handle((in, out) -> in.receive()
				                                .next()
				                                .flatMap(b -> out.sendString(Mono.just("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\nabc"))
				                                                 .then())
				                                .doOnTerminate(() -> in.withConnection(Connection::dispose)))
				         .bindNow();
		try {
			StepVerifier.create(client.mono("http://127.0.0.1:" + server.port() + "/"))
			            .expectErrorSatisfies(e -> {
			                assertThat(e).isInstanceOf(PrematureCloseException.class)
			                             .hasMessageContaining("DURING response");
			                assertThat(((PrematureCloseException) e).response()).isNotNull();
			            })
			            .verify(Duration.ofSeconds(5));
		}
		finally {
			server.disposeNow();
		}
	}

	@Test
	void beforeRequestCustomizesTheAttempt() throws Exception {
		HttpResult result = send("/echo", RequestOptions.builder()
		                                                .beforeRequest(request ->
		                                                        request.header(HttpHeaderNames.AUTHORIZATION, "Bearer " + request.attempt())
		                                                               .uri(url("/echo/changed")))
		                                                .build());

		HttpHeaders headers = result.response().headers();
		assertThat(headers.get("X-Authorization")).isEqualTo("Bearer 1");
		assertThat(headers.get("X-Uri")).isEqualTo("/echo/changed");
		assertThat(result.response().requestUrls()).containsExactly(url("/echo/changed"));
	}

	@Test
	void failingBeforeRequest() {
		StepVerifier.create(client.mono(url("/echo"), RequestOptions.builder()
		                                                          .beforeRequest(request -> {
		                                                              throw new IllegalStateException("boom");
		                                                          })
		                                                          .build()))
		            .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(RequestException.class)
		                                                    .hasMessageContaining("boom"))
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void timing() throws Exception {
		HttpResult result = send("/hello", RequestOptions.builder().timing(true).build());

		Timing timing = result.response().timing();
		assertThat(timing).isNotNull();
		assertThat(timing.connected()).isGreaterThanOrEqualTo(timing.dnsLookup());
		assertThat(timing.requestSent()).isGreaterThanOrEqualTo(timing.connected());
		assertThat(timing.waiting()).isGreaterThanOrEqualTo(timing.requestSent());
		assertThat(timing.contentDownload()).isGreaterThanOrEqualTo(timing.waiting());
	}

	@Test
	void callbackIsInvokedOnce() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		AtomicReference<Object> data = new AtomicReference<>();
		AtomicReference<HttpClientResponse> response = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		client.request(url("/hello"), RequestOptions.builder().dataType("text").build(), (error, body, res) -> {
			calls.incrementAndGet();
			data.set(body);
			response.set(res);
			latch.countDown();
		});

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(calls.get()).isEqualTo(1);
		assertThat(data.get()).isEqualTo("hello");
		assertThat(response.get().statusCode()).isEqualTo(200);
	}

	@Test
	void callbackReceivesTheError() throws Exception {
		AtomicReference<Throwable> error = new AtomicReference<>();
		AtomicReference<HttpClientResponse> response = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		client.curl(url("/hello"), RequestOptions.builder().method("not a method").build(), (e, body, res) -> {
			error.set(e);
			response.set(res);
			latch.countDown();
		});

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(error.get()).isInstanceOf(InvalidOptionException.class);
		assertThat(response.get()).isNull();
	}

	@Test
	void requestThunkSendsOnEachCall() throws Exception {
		Consumer<ResponseCallback> thunk = client.requestThunk(url("/hello"), RequestOptions.builder().dataType("text").build());
		List<Object> results = new CopyOnWriteArrayList<>();
		CountDownLatch latch = new CountDownLatch(2);
		ResponseCallback callback = (error, data, response) -> {
			results.add(data);
			latch.countDown();
		};

		thunk.accept(callback);
		thunk.accept(callback);

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(results).containsExactly("hello", "hello");
	}

	@Test
	void curlIsAnAliasOfRequest() throws Exception {
		assertThat(client.curl(url("/hello")).get(5, TimeUnit.SECONDS).dataAsString()).isEqualTo("hello");
	}

	@Test
	void requestWithCallbackIsAnAliasOfRequest() throws Exception {
		AtomicReference<Object> data = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		client.requestWithCallback(url("/hello"), RequestOptions.builder().dataType("text").build(),
				(error, body, response) -> {
					data.set(body);
					latch.countDown();
				});

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(data.get()).isEqualTo("hello");
	}

	@Test
	void invalidOptionsFailTheFuture() {
		assertThatExceptionOfType(ExecutionException.class)
				.isThrownBy(() -> client.request(url("/hello"), RequestOptions.builder().timeout(-1).build())
				                        .get(5, TimeUnit.SECONDS))
				.withCauseInstanceOf(InvalidOptionException.class);
	}

	@Test
	void clientDefaultsApplyToEveryRequest() throws Exception {
		HttpClient defaulted = HttpClient.create(RequestOptions.builder()
		                                                       .header("Authorization", "Bearer defaults")
		                                                       .dataType("text")
		                                                       .build());
		try {
			HttpResult result = defaulted.request(url("/echo"), RequestOptions.builder()
			                                                                .method("POST")
			                                                                .content("x")
			                                                                .build())
			                             .get(5, TimeUnit.SECONDS);

			assertThat(result.response().headers().get("X-Authorization")).isEqualTo("Bearer defaults");
			assertThat(result.data()).isEqualTo("x");
		}
		finally {
			defaulted.dispose();
		}
	}

	@Test
	void observersSeeTheRequestLifecycle() throws Exception {
		List<String> seen = new CopyOnWriteArrayList<>();
		List<RequestEvent> events = new CopyOnWriteArrayList<>();
		Disposable registration = client.observe(new HttpClientObserver() {
			@Override
			public void onRequest(RequestEvent event) {
				seen.add("request");
				events.add(event);
			}

			@Override
			public void onResponse(RequestEvent event) {
				seen.add("response");
				events.add(event);
			}

			@Override
			public void onError(RequestEvent event) {
				seen.add("error");
				events.add(event);
			}
		});

		send("/hello", RequestOptions.EMPTY);

		assertThat(seen).containsExactly("request", "response");
		assertThat(events.get(0).id()).isEqualTo(events.get(1).id());
		assertThat(events.get(1).method()).isEqualTo("GET");
		assertThat(events.get(1).url()).isEqualTo(url("/hello"));
		assertThat(events.get(1).response().statusCode()).isEqualTo(200);
		assertThat(events.get(1).elapsed()).isPositive();

		assertThatExceptionOfType(ExecutionException.class)
				.isThrownBy(() -> send("/hello", RequestOptions.builder().maxRedirects(-1).build()));
		assertThat(seen).containsExactly("request", "response", "error");
		assertThat(events.get(2).error()).isInstanceOf(InvalidOptionException.class);

		registration.dispose();
		send("/hello", RequestOptions.EMPTY);
		assertThat(seen).hasSize(3);
	}

	@Test
	void failingObserverDoesNotFailTheRequest() throws Exception {
		client.observe(new HttpClientObserver() {
			@Override
			public void onResponse(RequestEvent event) {
				throw new IllegalStateException("observer failure");
			}
		});

		assertThat(send("/hello", RequestOptions.EMPTY).dataAsString()).isEqualTo("hello");
	}

	@Test
	void micrometerObserver() throws Exception {
		SimpleMeterRegistry registry = new SimpleMeterRegistry();
		client.observe(new MicrometerHttpClientObserver(registry));

		send("/hello", RequestOptions.EMPTY);
		send("/missing", RequestOptions.EMPTY);
		assertThatExceptionOfType(ExecutionException.class)
				.isThrownBy(() -> send("/slow", RequestOptions.builder().timeout(5000, 100).build()));

		Timer ok = registry.find(MicrometerHttpClientObserver.RESPONSE_TIME)
		                   .tags("method", "GET", "host", "127.0.0.1", "status", "200")
		                   .timer();
		assertThat(ok).isNotNull();
		assertThat(ok.count()).isEqualTo(1);

		Timer notFound = registry.find(MicrometerHttpClientObserver.RESPONSE_TIME)
		                         .tag("status", "404")
		                         .timer();
		assertThat(notFound).isNotNull();
		assertThat(notFound.count()).isEqualTo(1);

		Counter errors = registry.find(MicrometerHttpClientObserver.ERRORS)
		                         .tag("exception", "RequestTimeoutException")
		                         .counter();
		assertThat(errors).isNotNull();
		assertThat(errors.count()).isEqualTo(1.0);
	}

	@Test
	void disposedClientRejectsRequests() {
		client.dispose();

		assertThat(client.isDisposed()).isTrue();
		StepVerifier.create(client.mono(url("/hello")))
		            .expectError(IllegalStateException.class)
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void connectionsAreReused() throws Exception {
		ConnectionProvider provider = ConnectionProvider.create("reuse", 1);
		HttpClient pooled = HttpClient.create(RequestOptions.EMPTY, provider);
		List<String> locals = new CopyOnWriteArrayList<>();
		DisposableServer server =
				createServer().handle((req, res) -> res.sendString(Mono.just(String.valueOf(req.remoteAddress()))))
				              .bindNow();
		try {
			for (int i = 0; i < 3; i++) {
				locals.add(pooled.request("http://127.0.0.1:" + server.port() + "/")
				                 .get(5, TimeUnit.SECONDS)
				                 .dataAsString());
			}
			assertThat(locals).hasSize(3);
			assertThat(locals.stream().distinct()).hasSize(1);
		}
		finally {
			server.disposeNow();
			pooled.dispose();
			provider.disposeLater()
			        .block(Duration.ofSeconds(5));
		}
	}

	static final class TrackingOutputStream extends ByteArrayOutputStream {

		volatile boolean closed;

		@Override
		public void close() throws IOException {
			closed = true;
			super.close();
		}
	}
}
