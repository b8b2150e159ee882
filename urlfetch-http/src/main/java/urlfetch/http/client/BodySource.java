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
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The request body: none, a buffer replayable on redirects, or a single-use stream.
 */
abstract class BodySource {

	static final BodySource NONE = new None();

	static BodySource buffer(byte[] bytes) {
		return new Buffer(bytes);
	}

	static BodySource stream(InputStream stream) {
		return new Stream(stream);
	}

	/**
	 * Return true if the body can be sent again.
	 *
	 * @return true if the body can be sent again
	 */
	abstract boolean isReplayable();

	static final class None extends BodySource {

		@Override
		boolean isReplayable() {
			return true;
		}

		@Override
		public String toString() {
			return "none";
		}
	}

	static final class Buffer extends BodySource {

		final byte[] bytes;

		Buffer(byte[] bytes) {
			this.bytes = Objects.requireNonNull(bytes, "bytes");
		}

		@Override
		boolean isReplayable() {
			return true;
		}

		@Override
		public String toString() {
			return "buffer[" + bytes.length + "]";
		}
	}

	static final class Stream extends BodySource {

		final InputStream   stream;
		final AtomicBoolean consumed = new AtomicBoolean();

		Stream(InputStream stream) {
			this.stream = Objects.requireNonNull(stream, "stream");
		}

		/**
		 * Hand the stream out, once.
		 *
		 * @return the stream, or null when it was already handed out
		 */
		InputStream take() {
			return consumed.compareAndSet(false, true) ? stream : null;
		}

		@Override
		boolean isReplayable() {
			return !consumed.get();
		}

		@Override
		public String toString() {
			return "stream";
		}
	}
}
