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
package net.sf.cramcodec.encoding;

import java.io.EOFException;
import java.nio.ByteBuffer;

import net.sf.cramcodec.CodecNotImplementedException;
import net.sf.cramcodec.CramException;
import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.encoding.huffman.HuffmanByteCodec;
import net.sf.cramcodec.encoding.huffman.HuffmanIntegerCodec;
import net.sf.cramcodec.io.ByteBufferUtils;

/**
 * Builds encodings from their compression header form: a codec id and a
 * block of serialized parameters.
 */
public class EncodingFactory {

	@SuppressWarnings("unchecked")
	public <T> Encoding<T> createEncoding(DataSeriesType valueType, EncodingParams params) throws CramException {
		if (params.id == EncodingID.NULL)
			throw new CodecNotImplementedException(EncodingID.NULL, "decode");

		ByteBuffer buf = ByteBuffer.wrap(params.params);
		BitCodec<?> codec;
		try {
			codec = createCodec(valueType, params.id, buf);
		} catch (EOFException e) {
			throw new InvalidDataException("Truncated parameters for " + params, e);
		} catch (IllegalArgumentException e) {
			throw new InvalidDataException("Invalid parameters for " + params + ": " + e.getMessage(), e);
		}

		if (buf.hasRemaining())
			throw new InvalidDataException(String.format("%d unused parameter bytes for %s.", buf.remaining(), params));

		return new Encoding<T>((BitCodec<T>) codec);
	}

	public Encoding<Integer> createIntEncoding(EncodingParams params) throws CramException {
		return createEncoding(DataSeriesType.INT, params);
	}

	public Encoding<Byte> createByteEncoding(EncodingParams params) throws CramException {
		return createEncoding(DataSeriesType.BYTE, params);
	}

	public Encoding<byte[]> createByteArrayEncoding(EncodingParams params) throws CramException {
		return createEncoding(DataSeriesType.BYTE_ARRAY, params);
	}

	private BitCodec<?> createCodec(DataSeriesType valueType, EncodingID id, ByteBuffer buf) throws EOFException,
			CramException {
		switch (valueType) {
		case INT:
			switch (id) {
			case EXTERNAL:
				return new ExternalIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf));
			case HUFFMAN:
				int[] values = readIntArray(buf);
				return new HuffmanIntegerCodec(values, readIntArray(buf));
			case BETA:
				return new BetaIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf), ByteBufferUtils.readUnsignedITF8(buf));
			case GAMMA:
				return new GammaIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf));
			case SUBEXP:
				return new SubexpIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf),
						ByteBufferUtils.readUnsignedITF8(buf));
			case GOLOMB:
				return new GolombIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf),
						ByteBufferUtils.readUnsignedITF8(buf));
			case GOLOMB_RICE:
				return new GolombRiceIntegerCodec(ByteBufferUtils.readUnsignedITF8(buf),
						ByteBufferUtils.readUnsignedITF8(buf));

			default:
				break;
			}
			break;

		case BYTE:
			switch (id) {
			case EXTERNAL:
				return new ExternalByteCodec(ByteBufferUtils.readUnsignedITF8(buf));
			case HUFFMAN:
				int[] values = readIntArray(buf);
				byte[] symbols = new byte[values.length];
				for (int i = 0; i < values.length; i++) {
					if (values[i] < 0 || values[i] > 255)
						throw new InvalidDataException("Huffman byte symbol out of range: " + values[i]);
					symbols[i] = (byte) values[i];
				}
				return new HuffmanByteCodec(symbols, readIntArray(buf));

			default:
				break;
			}
			break;

		case BYTE_ARRAY:
			switch (id) {
			case BYTE_ARRAY_LEN:
				Encoding<Integer> lenEncoding = createIntEncoding(readNested(buf));
				Encoding<Byte> byteEncoding = createByteEncoding(readNested(buf));
				return new ByteArrayLenCodec(lenEncoding, byteEncoding);
			case BYTE_ARRAY_STOP:
				byte stopByte = (byte) ByteBufferUtils.readUnsignedByte(buf);
				return new ByteArrayStopCodec(stopByte, ByteBufferUtils.readUnsignedITF8(buf));

			default:
				break;
			}
			break;

		default:
			break;
		}

		throw new InvalidDataException(String.format("Codec %s cannot produce %s values.", id.name(), valueType.name()));
	}

	/**
	 * Parses a codec id and length-prefixed parameter block nested inside
	 * another codec's parameters.
	 */
	public static EncodingParams readNested(ByteBuffer buf) throws EOFException, InvalidDataException {
		int codecId = ByteBufferUtils.readUnsignedITF8(buf);
		EncodingID id = EncodingID.byId(codecId);
		if (id == null)
			throw new InvalidDataException("Unknown codec id: " + codecId);

		int size = ByteBufferUtils.readUnsignedITF8(buf);
		if (size < 0)
			throw new InvalidDataException("Negative parameter size: " + size);

		return new EncodingParams(id, ByteBufferUtils.readFully(buf, size));
	}

	private static int[] readIntArray(ByteBuffer buf) throws EOFException, InvalidDataException {
		int size = ByteBufferUtils.readUnsignedITF8(buf);
		if (size < 0 || size > buf.remaining())
			throw new InvalidDataException("Invalid array size in codec parameters: " + size);

		int[] array = new int[size];
		for (int i = 0; i < size; i++)
			array[i] = ByteBufferUtils.readUnsignedITF8(buf);
		return array;
	}
}
