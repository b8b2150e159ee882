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

import java.util.Locale;

/**
 * How the response body is handed to the caller.
 */
public enum DataType {

	/**
	 * Decoded with the charset declared by the response, UTF-8 by default.
	 */
	TEXT,

	/**
	 * Parsed into a Jackson {@link com.fasterxml.jackson.databind.JsonNode}.
	 */
	JSON,

	/**
	 * Raw {@code byte[]}.
	 */
	BUFFER;

	/**
	 * Case-insensitive lookup, {@code buffer} when null.
	 *
	 * @param name the data type name
	 * @return the matching {@link DataType}
	 * @throws InvalidOptionException if the name is unknown
	 */
	static DataType of(String name) throws InvalidOptionException {
		if (name == null) {
			return BUFFER;
		}
		switch (name.toLowerCase(Locale.ROOT)) {
			case "text":
				return TEXT;
			case "json":
				return JSON;
			case "buffer":
				return BUFFER;
			default:
				throw new InvalidOptionException("Unknown dataType: " + name);
		}
	}
}
