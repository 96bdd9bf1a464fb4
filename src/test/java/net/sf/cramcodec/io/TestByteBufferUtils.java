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

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.EOFException;
import java.nio.ByteBuffer;

import org.junit.Test;

public class TestByteBufferUtils {

	private static byte[] bytes(int... values) {
		byte[] array = new byte[values.length];
		for (int i = 0; i < values.length; i++)
			array[i] = (byte) values[i];
		return array;
	}

	private static void assertITF8(int value, byte[] expected) throws EOFException {
		assertThat(ByteBufferUtils.writeUnsignedITF8(value), equalTo(expected));

		ByteBuffer buf = ByteBuffer.wrap(expected);
		assertThat(ByteBufferUtils.readUnsignedITF8(buf), is(value));
		assertThat(buf.hasRemaining(), is(false));
	}

	@Test
	public void test_ITF8_1_byte() throws EOFException {
		assertITF8(0, bytes(0));
		assertITF8(13, bytes(0x0d));
		assertITF8(127, bytes(0x7F));
	}

	@Test
	public void test_ITF8_2_bytes() throws EOFException {
		assertITF8(128, bytes(0x80, 0x80));
		assertITF8(16383, bytes(0xBF, 0xFF));
	}

	@Test
	public void test_ITF8_3_bytes() throws EOFException {
		assertITF8(16384, bytes(0xC0, 0x40, 0x00));
		assertITF8(0x1FFFFF, bytes(0xDF, 0xFF, 0xFF));
	}

	@Test
	public void test_ITF8_4_bytes() throws EOFException {
		assertITF8(0x200000, bytes(0xE0, 0x20, 0x00, 0x00));
		assertITF8(0x0FFFFFFF, bytes(0xEF, 0xFF, 0xFF, 0xFF));
	}

	@Test
	public void test_ITF8_5_bytes() throws EOFException {
		assertITF8(0x10000000, bytes(0xF1, 0x00, 0x00, 0x00, 0x00));
		assertITF8(Integer.MAX_VALUE, bytes(0xF7, 0xFF, 0xFF, 0xFF, 0x0F));
	}

	@Test
	public void test_ITF8_negative() throws EOFException {
		assertITF8(-1, bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F));
		assertITF8(Integer.MIN_VALUE, bytes(0xF8, 0x00, 0x00, 0x00, 0x00));
	}

	@Test
	public void test_sequence() throws EOFException {
		ByteBuffer buf = ByteBuffer.wrap(bytes(0x01, 0x80, 0x80, 0x7F));
		assertThat(ByteBufferUtils.readUnsignedITF8(buf), is(1));
		assertThat(ByteBufferUtils.readUnsignedITF8(buf), is(128));
		assertThat(ByteBufferUtils.readUnsignedITF8(buf), is(127));
	}

	@Test(expected = EOFException.class)
	public void test_truncated_ITF8() throws EOFException {
		ByteBufferUtils.readUnsignedITF8(bytes(0xC0, 0x40));
	}

	@Test(expected = EOFException.class)
	public void test_empty_buffer() throws EOFException {
		ByteBufferUtils.readUnsignedByte(ByteBuffer.wrap(new byte[0]));
	}

	@Test
	public void test_readFully() throws EOFException {
		ByteBuffer buf = ByteBuffer.wrap("abcdef".getBytes());
		assertThat(new String(ByteBufferUtils.readFully(buf, 4)), is("abcd"));

		try {
			ByteBufferUtils.readFully(buf, 3);
		} catch (EOFException e) {
			// nothing consumed:
			assertThat(buf.remaining(), is(2));
			return;
		}
		throw new AssertionError("Expected EOFException");
	}

	@Test
	public void test_readFully_huge_length() {
		ByteBuffer buf = ByteBuffer.wrap("abc".getBytes());
		try {
			ByteBufferUtils.readFully(buf, Integer.MAX_VALUE);
		} catch (EOFException e) {
			assertThat(buf.remaining(), is(3));
			return;
		}
		throw new AssertionError("Expected EOFException");
	}
}
