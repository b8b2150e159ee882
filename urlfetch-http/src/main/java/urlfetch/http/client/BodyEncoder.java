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

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.http.QueryStrings;

/**
 * Turns {@code data}, {@code content} and {@code stream} into the request body, the query
 * string and the content headers of a {@link RequestPlan.Builder}. At most one body source
 * is kept: stream, then content, then data.
 */
final class BodyEncoder {

	static final ObjectMapper MAPPER = new ObjectMapper();

	static final String APPLICATION_JSON = "application/json";

	static void encode(RequestPlan.Builder draft,
			@Nullable Object data,
			@Nullable Object content,
			@Nullable InputStream stream,
			@Nullable String contentType,
			boolean nestedQuerystring,
			boolean dataAsQueryString,
			HttpHeaders callerHeaders) throws InvalidOptionException {
		HttpHeaders headers = draft.headers;
		if (contentType != null) {
			headers.set(HttpHeaderNames.CONTENT_TYPE,
					"json".equalsIgnoreCase(contentType) ? APPLICATION_JSON : contentType);
		}
		boolean json = isJson(contentType) || isJson(callerHeaders.get(HttpHeaderNames.CONTENT_TYPE));

		boolean getOrHead = HttpMethod.GET.name().equals(draft.method) || HttpMethod.HEAD.name().equals(draft.method);
		if (data != null && (getOrHead || dataAsQueryString)) {
			draft.url = QueryStrings.appendQuery(draft.url, query(data, nestedQuerystring));
			data = null;
		}

		if (stream != null) {
			draft.body = BodySource.stream(stream);
			headers.remove(HttpHeaderNames.CONTENT_LENGTH);
			headers.set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
		}
		else if (content != null) {
			draft.body = BodySource.buffer(bytes(content));
		}
		else if (data != null) {
			if (json) {
				draft.body = BodySource.buffer(json(data));
				if (!headers.contains(HttpHeaderNames.CONTENT_TYPE)) {
					headers.set(HttpHeaderNames.CONTENT_TYPE, APPLICATION_JSON);
				}
			}
			else if (data instanceof String || data instanceof byte[]) {
				draft.body = BodySource.buffer(bytes(data));
			}
			else {
				draft.body = BodySource.buffer(query(data, nestedQuerystring).getBytes(StandardCharsets.UTF_8));
				if (!headers.contains(HttpHeaderNames.CONTENT_TYPE)) {
					headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED);
				}
			}
		}

		if (draft.body instanceof BodySource.Buffer) {
			headers.set(HttpHeaderNames.CONTENT_LENGTH, ((BodySource.Buffer) draft.body).bytes.length);
		}
		else if (draft.body == BodySource.NONE && expectsBody(draft.method)) {
			headers.set(HttpHeaderNames.CONTENT_LENGTH, 0);
		}

		if (log.isDebugEnabled()) {
			log.debug("Encoded {} {} with body {}", draft.method, draft.url, draft.body);
		}
	}

	static boolean isJson(@Nullable String contentType) {
		return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
	}

	static boolean expectsBody(String method) {
		return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
	}

	static String query(Object data, boolean nested) throws InvalidOptionException {
		if (data instanceof String) {
			return (String) data;
		}
		if (data instanceof byte[]) {
			return new String((byte[]) data, StandardCharsets.UTF_8);
		}
		Map<?, ?> map = asMap(data);
		return nested ? QueryStrings.encodeNested(map) : QueryStrings.encodeFlat(map);
	}

	static Map<?, ?> asMap(Object data) throws InvalidOptionException {
		if (data instanceof Map) {
			return (Map<?, ?>) data;
		}
		try {
			return MAPPER.convertValue(data, Map.class);
		}
		catch (IllegalArgumentException e) {
			throw new InvalidOptionException("Cannot serialize data of type " + data.getClass().getName(), e);
		}
	}

	static byte[] json(Object data) throws InvalidOptionException {
		if (data instanceof String || data instanceof byte[]) {
			return bytes(data);
		}
		try {
			return MAPPER.writeValueAsBytes(data);
		}
		catch (JsonProcessingException e) {
			throw new InvalidOptionException("Cannot serialize data as JSON: " + e.getOriginalMessage(), e);
		}
	}

	static byte[] bytes(Object content) {
		if (content instanceof byte[]) {
			return (byte[]) content;
		}
		return content.toString().getBytes(StandardCharsets.UTF_8);
	}

	static final Logger log = Loggers.getLogger(BodyEncoder.class);

	private BodyEncoder() {
	}
}
