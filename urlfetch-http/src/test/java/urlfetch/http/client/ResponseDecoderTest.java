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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class ResponseDecoderTest {

	static RequestPlan plan(RequestOptions options) throws RequestException {
		return OptionNormalizer.normalize("http://example.com/data", RequestOptions.EMPTY, options);
	}

	static HttpClientResponse response(HttpHeaders headers) {
		return new HttpClientResponse(HttpResponseStatus.OK, HttpVersion.HTTP_1_1, headers,
				Collections.singletonList("http://example.com/data"), null);
	}

	static HttpClientResponse response() {
		return response(new DefaultHttpHeaders());
	}

	@Test
	void bufferIsReturnedAsIs() throws RequestException {
		byte[] body = {1, 2, 3};

		assertThat(ResponseDecoder.decode(plan(RequestOptions.EMPTY), response(), body)).isSameAs(body);
	}

	@Test
	void textUsesTheResponseCharset() throws RequestException {
		HttpHeaders headers = new DefaultHttpHeaders().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=ISO-8859-1");
		byte[] body = "café".getBytes(StandardCharsets.ISO_8859_1);

		assertThat(ResponseDecoder.decode(plan(RequestOptions.builder().dataType("text").build()), response(headers), body))
				.isEqualTo("café");
	}

	@Test
	void textDefaultsToUtf8() throws RequestException {
		byte[] body = "café".getBytes(StandardCharsets.UTF_8);

		assertThat(ResponseDecoder.decode(plan(RequestOptions.builder().dataType("text").build()), response(), body))
				.isEqualTo("café");
	}

	@Test
	void json() throws RequestException {
		Object data = ResponseDecoder.decode(plan(RequestOptions.builder().dataType("json").build()), response(),
				"{\"name\":\"urlfetch\",\"tags\":[1,2]}".getBytes(StandardCharsets.UTF_8));

		assertThat(data).isInstanceOf(JsonNode.class);
		JsonNode node = (JsonNode) data;
		assertThat(node.get("name").asText()).isEqualTo("urlfetch");
		assertThat(node.get("tags").size()).isEqualTo(2);
	}

	@Test
	void emptyJsonIsNull() throws RequestException {
		assertThat(ResponseDecoder.decode(plan(RequestOptions.builder().dataType("json").build()), response(),
				" \n".getBytes(StandardCharsets.UTF_8))).isNull();
	}

	@Test
	void invalidJson() throws RequestException {
		RequestPlan plan = plan(RequestOptions.builder().dataType("json").build());
		String body = "{\"a\":\n  x}";

		assertThatExceptionOfType(ResponseJsonParseException.class)
				.isThrownBy(() -> ResponseDecoder.decode(plan, response(), body.getBytes(StandardCharsets.UTF_8)))
				.withMessageContaining("http://example.com/data")
				.satisfies(e -> {
					assertThat(e.body()).isEqualTo(body);
					assertThat(e.line()).isEqualTo(2);
					assertThat(e.column()).isPositive();
					assertThat(e.response()).isNotNull();
				});
	}

	@Test
	void controlCharactersFailWithoutRepair() throws RequestException {
		RequestPlan plan = plan(RequestOptions.builder().dataType("json").build());

		assertThatExceptionOfType(ResponseJsonParseException.class)
				.isThrownBy(() -> ResponseDecoder.decode(plan, response(),
						"{\"a\":\"line\u0001\"}".getBytes(StandardCharsets.UTF_8)));
	}

	@Test
	void controlCharactersAreRepaired() throws RequestException {
		RequestPlan plan = plan(RequestOptions.builder().dataType("json").fixJSONCtlChars(true).build());

		Object data = ResponseDecoder.decode(plan, response(), "{\"a\":\"line\u0001\"}".getBytes(StandardCharsets.UTF_8));

		assertThat(((JsonNode) data).get("a").asText()).isEqualTo("line\u0001");
	}

	@Test
	void gzipOnlyWhenRequested() throws RequestException {
		HttpHeaders headers = new DefaultHttpHeaders().set(HttpHeaderNames.CONTENT_ENCODING, "gzip");

		assertThat(ResponseDecoder.isGzip(plan(RequestOptions.builder().gzip(true).build()), headers)).isTrue();
		assertThat(ResponseDecoder.isGzip(plan(RequestOptions.EMPTY), headers)).isFalse();
		assertThat(ResponseDecoder.isGzip(plan(RequestOptions.builder().gzip(true).build()), new DefaultHttpHeaders()))
				.isFalse();
	}

	@Test
	void inflateChunks() throws IOException {
		byte[] text = "hello gzip, hello gzip, hello gzip".getBytes(StandardCharsets.UTF_8);
		ByteArrayOutputStream compressed = new ByteArrayOutputStream();
		try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
			gzip.write(text);
		}
		byte[] bytes = compressed.toByteArray();
		int half = bytes.length / 2;

		ResponseDecoder.Inflater inflater = new ResponseDecoder.Inflater();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			out.write(inflater.inflate(Unpooled.wrappedBuffer(Arrays.copyOfRange(bytes, 0, half))));
			out.write(inflater.inflate(Unpooled.wrappedBuffer(Arrays.copyOfRange(bytes, half, bytes.length))));
			out.write(inflater.finish());
		}
		finally {
			inflater.close();
		}

		assertThat(out.toByteArray()).isEqualTo(text);
	}
}
