/*******************************************************************************
 * Copyright 2013 EMBL-EBI
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 ******************************************************************************/
package net.sf.cramcodec.io;

import java.io.EOFException;
import java.io.IOException;

/**
 * Bit reader over an in-memory core block. A read that would run past the end
 * of the buffer fails with {@link EOFException} and consumes nothing.
 */
public class DefaultBitInputStream implements BitInputStream {
	private final byte[] data;
	private final int offset;
	private final long limit;
	private long position = 0;

	public DefaultBitInputStream(byte[] data) {
		this(data, 0, data.length);
	}

	public DefaultBitInputStream(byte[] data, int offset, int length) {
		if (offset < 0 || length < 0 || offset + length > data.length)
			throw new IllegalArgumentException("Invalid range: offset=" + offset + ", length=" + length);

		this.data = data;
		this.offset = offset;
		this.limit = 8L * length;
	}

	@Override
	public final boolean readBit() throws IOException {
		ensureAvailable(1);
		return nextBit() == 1;
	}

	@Override
	public final int readBits(int length) throws IOException {
		if (length < 0 || length > 32)
			throw new IllegalArgumentException("Can read 0 to 32 bits at once, requested " + length);
		if (length == 0)
			return 0;

		ensureAvailable(length);
		int value = 0;
		for (int i = 0; i < length; i++)
			value = (value << 1) | nextBit();
		return value;
	}

	@Override
	public final long readLongBits(int length) throws IOException {
		if (length < 0 || length > 64)
			throw new IllegalArgumentException("Can read 0 to 64 bits at once, requested " + length);
		if (length == 0)
			return 0;

		ensureAvailable(length);
		long value = 0;
		for (int i = 0; i < length; i++)
			value = (value << 1) | nextBit();
		return value;
	}

	@Override
	public long getPosition() {
		return position;
	}

	public long remaining() {
		return limit - position;
	}

	@Override
	public boolean endOfStream() {
		return position >= limit;
	}

	private void ensureAvailable(int nofBits) throws EOFException {
		if (position + nofBits > limit)
			throw new EOFException(String.format("End of core data stream: requested %d bits at bit %d of %d.",
					nofBits, position, limit));
	}

	private int nextBit() {
		int b = data[offset + (int) (position >>> 3)];
		int shift = 7 - (int) (position & 7);
		position++;
		return (b >>> shift) & 1;
	}
}
