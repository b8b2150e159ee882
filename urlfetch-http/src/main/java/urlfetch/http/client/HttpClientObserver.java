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

/**
 * Listener of the requests of a {@link HttpClient}. Exceptions thrown by a listener are
 * logged and do not affect the request.
 *
 * @see HttpClient#observe(HttpClientObserver)
 */
public interface HttpClientObserver {

	/**
	 * Invoked before the first attempt of a request.
	 *
	 * @param event the request
	 */
	default void onRequest(RequestEvent event) {
	}

	/**
	 * Invoked when a request completes with a response, whatever its status.
	 *
	 * @param event the request, with its response
	 */
	default void onResponse(RequestEvent event) {
	}

	/**
	 * Invoked when a request fails.
	 *
	 * @param event the request, with its error
	 */
	default void onError(RequestEvent event) {
	}
}
