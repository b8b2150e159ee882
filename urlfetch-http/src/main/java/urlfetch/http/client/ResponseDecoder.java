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
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.compression.ZlibCodecFactory;
import io.netty.handler.codec.compression.ZlibWrapper;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpUtil;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

/**
 * Turns a response body into the data of the outcome according to the {@link DataType},
 * and inflates gzip bodies.
 */
final class ResponseDecoder {

	static final ObjectMapper MAPPER = new ObjectMapper();

	/**
	 * Return true if the response body must be inflated.
	 *
	 * @param plan the request plan
	 * @param headers the response headers
	 * @return true if gzip is enabled and the body is gzip encoded
	 */
	static boolean isGzip(RequestPlan plan, HttpHeaders headers) {
		if (!plan.gzip) {
			return false;
		}
		String encoding = headers.get(HttpHeaderNames.CONTENT_ENCODING);
		return encoding != null && encoding.toLowerCase(Locale.ROOT).contains("gzip");
	}

	/**
	 * Decode a buffered body.
	 *
	 * @param plan the request plan
	 * @param response the response
	 * @param body the body, already inflated
	 * @return the decoded body, null for an empty JSON body
	 * @throws ResponseJsonParseException if the JSON body cannot be parsed
	 */
	@Nullable
	static Object decode(RequestPlan plan, HttpClientResponse response, byte[] body) throws ResponseJsonParseException {
		switch (plan.dataType) {
			case TEXT:
				return new String(body, charset(response.headers()));
			case JSON:
				return parseJson(new String(body, charset(response.headers())), plan.fixJsonCtlChars, response);
			default:
				return body;
		}
	}

	static Charset charset(HttpHeaders headers) {
		String contentType = headers.get(HttpHeaderNames.CONTENT_TYPE);
		if (contentType == null) {
			return StandardCharsets.UTF_8;
		}
		return HttpUtil.getCharset(contentType, StandardCharsets.UTF_8);
	}

	@Nullable
	static JsonNode parseJson(String text, @Nullable UnaryOperator<String> fixJsonCtlChars,
			HttpClientResponse response) throws ResponseJsonParseException {
		if (text.trim().isEmpty()) {
			return null;
		}
		String json = fixJsonCtlChars != null ? fixJsonCtlChars.apply(text) : text;
		try {
			return MAPPER.readTree(json);
		}
		catch (JsonProcessingException e) {
			JsonLocation location = e.getLocation();
			int line = location != null ? location.getLineNr() : -1;
			int column = location != null ? location.getColumnNr() : -1;
			long offset = location != null ? location.getCharOffset() : -1;
			if (log.isDebugEnabled()) {
				log.debug("Failed to parse JSON body of {} at line {} column {}", response.url(), line, column);
			}
			ResponseJsonParseException error = new ResponseJsonParseException(
					"Unexpected JSON from " + response.url() + ": " + e.getOriginalMessage(),
					e, text, line, column, offset);
			error.response(response);
			throw error;
		}
	}

	/**
	 * Streaming gzip inflater over a Netty {@code ZlibDecoder}.
	 */
	static final class Inflater {

		final EmbeddedChannel channel = new EmbeddedChannel(ZlibCodecFactory.newZlibDecoder(ZlibWrapper.GZIP));

		/**
		 * Inflate a chunk. Takes ownership of the buffer.
		 *
		 * @param compressed the compressed chunk
		 * @return the inflated bytes, possibly empty
		 */
		byte[] inflate(ByteBuf compressed) {
			channel.writeInbound(compressed);
			return drain();
		}

		/**
		 * Release the inflater and return the remaining bytes.
		 *
		 * @return the remaining inflated bytes
		 */
		byte[] finish() {
			channel.finish();
			return drain();
		}

		byte[] drain() {
			ByteArrayOutputStream out = null;
			ByteBuf buf;
			while ((buf = channel.readInbound()) != null) {
				try {
					if (out == null) {
						out = new ByteArrayOutputStream(buf.readableBytes());
					}
					byte[] bytes = ByteBufUtil.getBytes(buf);
					out.write(bytes, 0, bytes.length);
				}
				finally {
					buf.release();
				}
			}
			return out == null ? EMPTY : out.toByteArray();
		}

		void close() {
			channel.finishAndReleaseAll();
		}
	}

	static final byte[] EMPTY = new byte[0];

	static final Logger log = Loggers.getLogger(ResponseDecoder.class);

	private ResponseDecoder() {
	}
}
