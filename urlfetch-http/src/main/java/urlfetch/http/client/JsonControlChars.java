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
 * Escapes the raw control characters U+0000 to U+001F found inside JSON strings, which
 * strict parsers reject. Characters between tokens are left alone.
 */
final class JsonControlChars {

	static final char[] HEX = "0123456789abcdef".toCharArray();

	static String escape(String json) {
		StringBuilder result = null;
		boolean inString = false;
		boolean escaped = false;
		for (int i = 0; i < json.length(); i++) {
			char c = json.charAt(i);
			if (inString) {
				if (c < 0x20) {
					// a control character cannot be escaped by a backslash, the backslash stays literal
					escaped = false;
					if (result == null) {
						result = new StringBuilder(json.length() + 16).append(json, 0, i);
					}
					appendEscaped(result, c);
					continue;
				}
				if (escaped) {
					escaped = false;
				}
				else if (c == '\\') {
					escaped = true;
				}
				else if (c == '"') {
					inString = false;
				}
			}
			else if (c == '"') {
				inString = true;
			}
			if (result != null) {
				result.append(c);
			}
		}
		return result == null ? json : result.toString();
	}

	static void appendEscaped(StringBuilder sb, char c) {
		switch (c) {
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\b':
				sb.append("\\b");
				break;
			case '\f':
				sb.append("\\f");
				break;
			default:
				sb.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
		}
	}

	private JsonControlChars() {
	}
}
