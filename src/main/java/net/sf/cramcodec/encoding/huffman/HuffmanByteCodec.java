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

import java.io.IOException;
import java.util.Arrays;

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.encoding.AbstractBitCodec;
import net.sf.cramcodec.encoding.DataSeriesType;
import net.sf.cramcodec.encoding.EncodingID;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * Huffman code over byte symbols. Symbols are kept as unsigned values 0 to
 * 255 in the parameters and returned as signed Java bytes.
 */
public class HuffmanByteCodec extends AbstractBitCodec<Byte> {
	private static final int INITIAL_ARRAY_SIZE = 1024;

	private final int[] values;
	private final int[] bitLengths;
	private final CanonicalHuffmanDecoder decoder;

	public HuffmanByteCodec(byte[] values, int[] bitLengths) {
		this.values = new int[values.length];
		for (int i = 0; i < values.length; i++)
			this.values[i] = values[i] & 0xFF;
		this.bitLengths = bitLengths.clone();
		this.decoder = new CanonicalHuffmanDecoder(this.values, this.bitLengths);
	}

	@Override
	public EncodingID id() {
		return EncodingID.HUFFMAN;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.BYTE;
	}

	@Override
	public byte[] toByteArray() {
		return HuffmanIntegerCodec.toParams(values, bitLengths);
	}

	@Override
	public Byte read(BitInputStream core, ExternalDataReaders external) throws IOException {
		return (byte) decoder.decode(core);
	}

	@Override
	public byte[] readArray(BitInputStream core, ExternalDataReaders external, int length) throws IOException {
		// grow as symbols arrive, the length may be corrupt:
		byte[] array = new byte[Math.min(length, INITIAL_ARRAY_SIZE)];
		for (int i = 0; i < length; i++) {
			if (i == array.length)
				array = Arrays.copyOf(array, (int) Math.min(length, 2L * array.length));
			array[i] = (byte) decoder.decode(core);
		}
		return array;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Byte value) throws IOException {
		HuffmanBitCode code = decoder.codeFor(value & 0xFF);
		if (code == null)
			throw new InvalidDataException("Byte is not in the Huffman alphabet: " + (value & 0xFF));

		core.write(code.bitCode, code.bitLength);
	}
}
