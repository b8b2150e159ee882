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
package urlfetch.http;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.QueryStringEncoder;

/**
 * Query string and form body serializers.
 * <p>
 * The flat form writes {@code a=1&b=2}, repeating the key for each element of a collection
 * or array. Nested maps are not representable in the flat form: they are written with
 * {@link String#valueOf(Object)} and cannot be read back.
 * <p>
 * The nested form uses the bracket notation ({@code a[b]=1&list[0]=x}) and is read back by
 * {@link #decodeNested(String)}.
 */
public final class QueryStrings {

	/**
	 * Encode a map into a flat query string.
	 *
	 * @param data the values
	 * @return the encoded query string, without leading {@code ?}
	 */
	public static String encodeFlat(Map<?, ?> data) {
		Objects.requireNonNull(data, "data");
		QueryStringEncoder encoder = new QueryStringEncoder("");
		for (Map.Entry<?, ?> entry : data.entrySet()) {
			String name = String.valueOf(entry.getKey());
			Object value = entry.getValue();
			if (value instanceof Iterable) {
				for (Object element : (Iterable<?>) value) {
					encoder.addParam(name, scalar(element));
				}
			}
			else if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
				for (int i = 0; i < Array.getLength(value); i++) {
					encoder.addParam(name, scalar(Array.get(value, i)));
				}
			}
			else {
				encoder.addParam(name, scalar(value));
			}
		}
		return strip(encoder.toString());
	}

	/**
	 * Encode a map into a query string using the bracket notation for nested maps,
	 * collections and arrays.
	 *
	 * @param data the values
	 * @return the encoded query string, without leading {@code ?}
	 */
	public static String encodeNested(Map<?, ?> data) {
		Objects.requireNonNull(data, "data");
		QueryStringEncoder encoder = new QueryStringEncoder("");
		for (Map.Entry<?, ?> entry : data.entrySet()) {
			addNested(encoder, String.valueOf(entry.getKey()), entry.getValue());
		}
		return strip(encoder.toString());
	}

	/**
	 * Decode a query string written in the bracket notation. Containers whose keys are
	 * exactly {@code 0..n-1} become lists, repeated plain keys become lists of values and
	 * every leaf is a {@link String}.
	 *
	 * @param query the query string, with or without leading {@code ?}
	 * @return the decoded values
	 */
	public static Map<String, Object> decodeNested(String query) {
		Objects.requireNonNull(query, "query");
		String raw = query.startsWith("?") ? query.substring(1) : query;
		Map<String, List<String>> parameters = new QueryStringDecoder(raw, false).parameters();
		Map<String, Object> root = new LinkedHashMap<>();
		parameters.forEach((name, values) -> {
			List<String> path = segments(name);
			Object value = values.size() == 1 ? values.get(0) : new ArrayList<>(values);
			insert(root, path, 0, value);
		});
		Map<String, Object> result = new LinkedHashMap<>();
		root.forEach((key, value) -> result.put(key, listify(value)));
		return result;
	}

	/**
	 * Append an encoded query to a URL which may already carry a query.
	 *
	 * @param url the URL
	 * @param query the encoded query, without leading {@code ?}
	 * @return the URL with the query appended
	 */
	public static String appendQuery(String url, String query) {
		if (query.isEmpty()) {
			return url;
		}
		int fragment = url.indexOf('#');
		String base = fragment == -1 ? url : url.substring(0, fragment);
		String suffix = fragment == -1 ? "" : url.substring(fragment);
		if (base.indexOf('?') == -1) {
			return base + '?' + query + suffix;
		}
		if (base.endsWith("?") || base.endsWith("&")) {
			return base + query + suffix;
		}
		return base + '&' + query + suffix;
	}

	static void addNested(QueryStringEncoder encoder, String name, Object value) {
		if (value instanceof Map) {
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				addNested(encoder, name + '[' + entry.getKey() + ']', entry.getValue());
			}
		}
		else if (value instanceof Iterable) {
			int index = 0;
			for (Object element : (Iterable<?>) value) {
				addNested(encoder, name + '[' + index++ + ']', element);
			}
		}
		else if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
			for (int i = 0; i < Array.getLength(value); i++) {
				addNested(encoder, name + '[' + i + ']', Array.get(value, i));
			}
		}
		else {
			encoder.addParam(name, scalar(value));
		}
	}

	static String scalar(Object value) {
		if (value == null) {
			return "";
		}
		return String.valueOf(value);
	}

	static String strip(String encoded) {
		return encoded.startsWith("?") ? encoded.substring(1) : encoded;
	}

	static List<String> segments(String name) {
		List<String> path = new ArrayList<>();
		int open = name.indexOf('[');
		if (open <= 0 || !name.endsWith("]")) {
			path.add(name);
			return path;
		}
		path.add(name.substring(0, open));
		int i = open;
		while (i < name.length() && name.charAt(i) == '[') {
			int close = name.indexOf(']', i);
			if (close == -1) {
				// unbalanced, keep the remainder as a plain key
				path.set(path.size() - 1, path.get(path.size() - 1) + name.substring(i));
				return path;
			}
			path.add(name.substring(i + 1, close));
			i = close + 1;
		}
		return path;
	}

	@SuppressWarnings("unchecked")
	static void insert(Map<String, Object> node, List<String> path, int index, Object value) {
		String key = path.get(index);
		if (index == path.size() - 1) {
			node.put(key, value);
			return;
		}
		Object child = node.get(key);
		if (!(child instanceof Map)) {
			child = new LinkedHashMap<String, Object>();
			node.put(key, child);
		}
		insert((Map<String, Object>) child, path, index + 1, value);
	}

	static Object listify(Object node) {
		if (!(node instanceof Map)) {
			return node;
		}
		Map<?, ?> map = (Map<?, ?>) node;
		Map<String, Object> converted = new LinkedHashMap<>();
		boolean sequential = !map.isEmpty();
		int expected = 0;
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			String key = String.valueOf(entry.getKey());
			converted.put(key, listify(entry.getValue()));
			if (sequential && !key.equals(Integer.toString(expected++))) {
				sequential = false;
			}
		}
		if (sequential) {
			return new ArrayList<>(converted.values());
		}
		return converted;
	}

	private QueryStrings() {
	}
}
