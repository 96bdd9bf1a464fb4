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
package net.sf.cramcodec.encoding.huffman;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.encoding.AbstractBitCodec;
import net.sf.cramcodec.encoding.DataSeriesType;
import net.sf.cramcodec.encoding.EncodingID;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

public class HuffmanIntegerCodec extends AbstractBitCodec<Integer> {
	private final int[] values;
	private final int[] bitLengths;
	private final CanonicalHuffmanDecoder decoder;

	/**
	 * @throws IllegalArgumentException
	 *             if the table is not a valid canonical code
	 */
	public HuffmanIntegerCodec(int[] values, int[] bitLengths) {
		this.values = values.clone();
		this.bitLengths = bitLengths.clone();
		this.decoder = new CanonicalHuffmanDecoder(this.values, this.bitLengths);
	}

	@Override
	public EncodingID id() {
		return EncodingID.HUFFMAN;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toParams(values, bitLengths);
	}

	static byte[] toParams(int[] values, int[] bitLengths) {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		try {
			ByteBufferUtils.writeUnsignedITF8(values.length, baos);
			for (int value : values)
				ByteBufferUtils.writeUnsignedITF8(value, baos);

			ByteBufferUtils.writeUnsignedITF8(bitLengths.length, baos);
			for (int len : bitLengths)
				ByteBufferUtils.writeUnsignedITF8(len, baos);
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
		return baos.toByteArray();
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		return decoder.decode(core);
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		HuffmanBitCode code = decoder.codeFor(value);
		if (code == null)
			throw new InvalidDataException("Value is not in the Huffman alphabet: " + value);

		core.write(code.bitCode, code.bitLength);
	}
}
