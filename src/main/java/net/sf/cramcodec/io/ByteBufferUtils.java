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

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * ITF8 and raw byte helpers for external blocks and parameter blocks. Every
 * read checks the remaining bytes and fails with {@link EOFException} rather
 * than letting a {@link java.nio.BufferUnderflowException} escape.
 */
public class ByteBufferUtils {

	public static final int readUnsignedITF8(ByteBuffer buf) throws EOFException {
		int b1 = readUnsignedByte(buf);

		if ((b1 & 128) == 0)
			return b1;

		if ((b1 & 64) == 0)
			return ((b1 & 127) << 8) | readUnsignedByte(buf);

		if ((b1 & 32) == 0) {
			int b2 = readUnsignedByte(buf);
			int b3 = readUnsignedByte(buf);
			return ((b1 & 63) << 16) | b2 << 8 | b3;
		}

		if ((b1 & 16) == 0) {
			int b2 = readUnsignedByte(buf);
			int b3 = readUnsignedByte(buf);
			int b4 = readUnsignedByte(buf);
			return ((b1 & 31) << 24) | b2 << 16 | b3 << 8 | b4;
		}

		int b2 = readUnsignedByte(buf);
		int b3 = readUnsignedByte(buf);
		int b4 = readUnsignedByte(buf);
		int b5 = readUnsignedByte(buf);
		return ((b1 & 15) << 28) | b2 << 20 | b3 << 12 | b4 << 4 | (15 & b5);
	}

	public static final int readUnsignedITF8(byte[] data) throws EOFException {
		return readUnsignedITF8(ByteBuffer.wrap(data));
	}

	/**
	 * @return number of bits written
	 */
	public static final int writeUnsignedITF8(int value, OutputStream os) throws IOException {
		if ((value >>> 7) == 0) {
			os.write(value);
			return 8;
		}

		if ((value >>> 14) == 0) {
			os.write(((value >> 8) | 128));
			os.write((value & 0xFF));
			return 16;
		}

		if ((value >>> 21) == 0) {
			os.write(((value >> 16) | 192));
			os.write(((value >> 8) & 0xFF));
			os.write((value & 0xFF));
			return 24;
		}

		if ((value >>> 28) == 0) {
			os.write(((value >> 24) | 224));
			os.write(((value >> 16) & 0xFF));
			os.write(((value >> 8) & 0xFF));
			os.write((value & 0xFF));
			return 32;
		}

		os.write((((value >>> 28) & 15) | 240));
		os.write(((value >> 20) & 0xFF));
		os.write(((value >> 12) & 0xFF));
		os.write(((value >> 4) & 0xFF));
		os.write((value & 0x0F));
		return 40;
	}

	public static final byte[] writeUnsignedITF8(int value) {
		ByteArrayOutputStream baos = new ByteArrayOutputStream(5);
		try {
			writeUnsignedITF8(value, baos);
		} catch (IOException e) {
			// ByteArrayOutputStream does not throw:
			throw new IllegalStateException(e);
		}
		return baos.toByteArray();
	}

	public static final int readUnsignedByte(ByteBuffer buf) throws EOFException {
		if (!buf.hasRemaining())
			throw new EOFException("End of buffer at position " + buf.position());
		return buf.get() & 0xFF;
	}

	public static final void readFully(ByteBuffer buf, byte[] array, int offset, int length) throws EOFException {
		if (buf.remaining() < length)
			throw new EOFException(String.format("Requested %d bytes but only %d remain.", length, buf.remaining()));
		buf.get(array, offset, length);
	}

	public static final byte[] readFully(ByteBuffer buf, int length) throws EOFException {
		if (buf.remaining() < length)
			throw new EOFException(String.format("Requested %d bytes but only %d remain.", length, buf.remaining()));
		byte[] array = new byte[length];
		readFully(buf, array, 0, length);
		return array;
	}
}
