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

import io.netty.handler.codec.http.HttpHeaders;

/**
 * The outgoing request as seen by the {@code beforeRequest} hook, before each attempt.
 * Changes apply to that attempt only.
 */
public interface HttpClientRequest {

	/**
	 * Return the request method.
	 *
	 * @return the request method
	 */
	String method();

	/**
	 * Change the request method.
	 *
	 * @param method the new method
	 * @return {@literal this}
	 */
	HttpClientRequest method(String method);

	/**
	 * Return the absolute request URL.
	 *
	 * @return the absolute request URL
	 */
	String uri();

	/**
	 * Change the request URL.
	 *
	 * @param uri the new absolute URL
	 * @return {@literal this}
	 */
	HttpClientRequest uri(String uri);

	/**
	 * Return the mutable request headers.
	 *
	 * @return the mutable request headers
	 */
	HttpHeaders requestHeaders();

	/**
	 * Set a request header, replacing any previous value.
	 *
	 * @param name the header name
	 * @param value the header value
	 * @return {@literal this}
	 */
	HttpClientRequest header(CharSequence name, CharSequence value);

	/**
	 * Return the number of the attempt, {@code 1} for the first.
	 *
	 * @return the number of the attempt
	 */
	int attempt();
}
