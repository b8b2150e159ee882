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
 * The response body is not valid JSON.
 */
public final class ResponseJsonParseException extends RequestException {

	final String body;
	final int    line;
	final int    column;
	final long   offset;

	ResponseJsonParseException(String message, Throwable cause, String body, int line, int column, long offset) {
		super(message, cause);
		this.body = body;
		this.line = line;
		this.column = column;
		this.offset = offset;
	}

	/**
	 * Return the raw body, as text.
	 *
	 * @return the raw body
	 */
	public String body() {
		return body;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	/**
	 * Return the character offset of the failure, -1 when unknown.
	 *
	 * @return the character offset of the failure
	 */
	public long offset() {
		return offset;
	}

	private static final long serialVersionUID = 1902374610298374123L;
}
