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

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import net.sf.cramcodec.CodecNotImplementedException;
import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * A length followed by that many bytes, each part with its own encoding.
 */
public class ByteArrayLenCodec extends AbstractBitCodec<byte[]> {
	private final Encoding<Integer> lenEncoding;
	private final Encoding<Byte> byteEncoding;

	public ByteArrayLenCodec(Encoding<Integer> lenEncoding, Encoding<Byte> byteEncoding) {
		this.lenEncoding = lenEncoding;
		this.byteEncoding = byteEncoding;
	}

	public Encoding<Integer> getLenEncoding() {
		return lenEncoding;
	}

	public Encoding<Byte> getByteEncoding() {
		return byteEncoding;
	}

	@Override
	public EncodingID id() {
		return EncodingID.BYTE_ARRAY_LEN;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.BYTE_ARRAY;
	}

	@Override
	public byte[] toByteArray() {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		try {
			writeNested(lenEncoding.toParams(), baos);
			writeNested(byteEncoding.toParams(), baos);
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
		return baos.toByteArray();
	}

	private static void writeNested(EncodingParams params, ByteArrayOutputStream baos) throws IOException {
		ByteBufferUtils.writeUnsignedITF8(params.id.getId(), baos);
		ByteBufferUtils.writeUnsignedITF8(params.params.length, baos);
		baos.write(params.params);
	}

	@Override
	public byte[] read(BitInputStream core, ExternalDataReaders external) throws IOException {
		int length = lenEncoding.decode(core, external);
		if (length < 0)
			throw new InvalidDataException("Negative byte array length: " + length);

		return byteEncoding.decodeArray(core, external, length);
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, byte[] value) throws IOException {
		throw new CodecNotImplementedException(id(), "write");
	}
}
