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

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.util.annotation.Nullable;

/**
 * Successful outcome of a request: the decoded body and the response.
 */
public final class HttpResult {

	final Object             data;
	final HttpClientResponse response;

	HttpResult(@Nullable Object data, HttpClientResponse response) {
		this.data = data;
		this.response = response;
	}

	/**
	 * Return the decoded body: {@code byte[]}, {@link String} or {@link JsonNode} depending
	 * on the {@link DataType}. Null when the body was empty JSON, piped or streamed.
	 *
	 * @return the decoded body
	 */
	@Nullable
	public Object data() {
		return data;
	}

	public HttpClientResponse response() {
		return response;
	}

	public int status() {
		return response.statusCode();
	}

	@Nullable
	public String dataAsString() {
		if (data == null) {
			return null;
		}
		if (data instanceof byte[]) {
			return new String((byte[]) data, StandardCharsets.UTF_8);
		}
		return data.toString();
	}

	@Nullable
	public JsonNode dataAsJson() {
		return (JsonNode) data;
	}

	@Nullable
	public byte[] dataAsBytes() {
		if (data == null || data instanceof byte[]) {
			return (byte[]) data;
		}
		return dataAsString().getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public String toString() {
		return "HttpResult{response=" + response + '}';
	}
}
