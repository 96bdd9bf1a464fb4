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
package net.sf.cramcodec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import htsjdk.samtools.util.StringUtil;

/**
 * An auxiliary field of a record: two character key, BAM value type and the
 * decoded value.
 * <p>
 * Values are {@link Character} for 'A', {@link Integer} for 'c', 'C', 's',
 * 'S' and 'i', {@link Long} for 'I', {@link Float} for 'f', {@link String}
 * for 'Z' and 'H', and a primitive array for 'B'.
 */
public class ReadTag implements Comparable<ReadTag> {
	// non-null
	private final String key;
	private final char type;
	private final Object value;

	public ReadTag(String key, char type, Object value) {
		if (key == null)
			throw new NullPointerException("Tag key cannot be null.");
		if (value == null)
			throw new NullPointerException("Tag value cannot be null.");
		if (key.length() != 2)
			throw new IllegalArgumentException("Tag key must be 2 char long: " + key);

		this.key = key;
		this.type = type;
		this.value = value;
	}

	public String getKey() {
		return key;
	}

	public char getType() {
		return type;
	}

	public Object getValue() {
		return value;
	}

	public String getKeyAndType() {
		return key + ":" + type;
	}

	@Override
	public int compareTo(ReadTag o) {
		return key.compareTo(o.key);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ReadTag))
			return false;

		ReadTag foe = (ReadTag) obj;
		if (!key.equals(foe.key) || type != foe.type)
			return false;

		if (value.getClass().isArray())
			return Arrays.deepEquals(new Object[] { value }, new Object[] { foe.value });

		return value.equals(foe.value);
	}

	@Override
	public int hashCode() {
		return 31 * key.hashCode() + type;
	}

	@Override
	public String toString() {
		String valueString;
		if (value instanceof byte[])
			valueString = Arrays.toString((byte[]) value);
		else if (value instanceof short[])
			valueString = Arrays.toString((short[]) value);
		else if (value instanceof int[])
			valueString = Arrays.toString((int[]) value);
		else if (value instanceof float[])
			valueString = Arrays.toString((float[]) value);
		else
			valueString = String.valueOf(value);
		return key + ":" + type + ":" + valueString;
	}

	public static Object restoreValueFromByteArray(char type, byte[] array) throws InvalidDataException {
		return restoreValueFromByteArray(type, array, 0, array.length);
	}

	/**
	 * Reads a value in the BAM binary layout, little endian.
	 * 
	 * @throws InvalidDataException
	 *             if the type is unknown or the bytes end before the value
	 */
	public static Object restoreValueFromByteArray(char type, byte[] array, int offset, int length)
			throws InvalidDataException {
		ByteBuffer buf = ByteBuffer.wrap(array, offset, length).order(ByteOrder.LITTLE_ENDIAN);
		switch (type) {
		case 'A':
			require(buf, 1, type);
			return (char) (buf.get() & 0xFF);
		case 'c':
			require(buf, 1, type);
			return (int) buf.get();
		case 'C':
			require(buf, 1, type);
			return buf.get() & 0xFF;
		case 's':
			require(buf, 2, type);
			return (int) buf.getShort();
		case 'S':
			require(buf, 2, type);
			return buf.getShort() & 0xFFFF;
		case 'i':
			require(buf, 4, type);
			return buf.getInt();
		case 'I':
			require(buf, 4, type);
			return buf.getInt() & 0xFFFFFFFFL;
		case 'f':
			require(buf, 4, type);
			return buf.getFloat();
		case 'Z':
		case 'H':
			int end = offset;
			while (end < offset + length && array[end] != 0)
				end++;
			return StringUtil.bytesToString(array, offset, end - offset);
		case 'B':
			return readArray(buf);

		default:
			throw new InvalidDataException("Unknown tag type: " + type);
		}
	}

	private static Object readArray(ByteBuffer buf) throws InvalidDataException {
		require(buf, 5, 'B');
		char subtype = (char) (buf.get() & 0xFF);
		int count = buf.getInt();
		if (count < 0)
			throw new InvalidDataException("Negative tag array length: " + count);

		switch (subtype) {
		case 'c':
		case 'C':
			require(buf, count, subtype);
			byte[] bytes = new byte[count];
			buf.get(bytes);
			return bytes;
		case 's':
		case 'S':
			require(buf, 2L * count, subtype);
			short[] shorts = new short[count];
			for (int i = 0; i < count; i++)
				shorts[i] = buf.getShort();
			return shorts;
		case 'i':
		case 'I':
			require(buf, 4L * count, subtype);
			int[] ints = new int[count];
			for (int i = 0; i < count; i++)
				ints[i] = buf.getInt();
			return ints;
		case 'f':
			require(buf, 4L * count, subtype);
			float[] floats = new float[count];
			for (int i = 0; i < count; i++)
				floats[i] = buf.getFloat();
			return floats;

		default:
			throw new InvalidDataException("Unknown tag array type: " + subtype);
		}
	}

	private static void require(ByteBuffer buf, long bytes, char type) throws InvalidDataException {
		if (buf.remaining() < bytes)
			throw new InvalidDataException(String.format("Truncated tag value of type %c: %d of %d bytes.", type,
					buf.remaining(), bytes));
	}
}
