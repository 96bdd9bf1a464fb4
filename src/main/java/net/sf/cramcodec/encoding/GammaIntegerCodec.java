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

import java.io.IOException;

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * Elias gamma: <code>n</code> zero bits, a one bit, then the low
 * <code>n</code> bits of the value. Encoded values must be at least 1 after
 * the offset is added.
 */
public class GammaIntegerCodec extends AbstractBitCodec<Integer> {
	// longer prefixes overflow an int:
	private static final int MAX_PREFIX_LENGTH = 30;

	private final int offset;

	public GammaIntegerCodec(int offset) {
		this.offset = offset;
	}

	@Override
	public EncodingID id() {
		return EncodingID.GAMMA;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(offset);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		int n = 0;
		while (!core.readBit()) {
			if (++n > MAX_PREFIX_LENGTH)
				throw new InvalidDataException("Gamma prefix is longer than " + MAX_PREFIX_LENGTH + " bits.");
		}

		int m = core.readBits(n);
		return (1 << n) + m - offset;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		int newValue = value + offset;
		if (newValue < 1)
			throw new InvalidDataException(String.format("Gamma codes values of 1 or more, got %d with offset %d.",
					value, offset));

		int n = 31 - Integer.numberOfLeadingZeros(newValue);
		core.write(false, n);
		// the leading one bit of the value doubles as the prefix terminator:
		core.write(newValue, n + 1);
	}
}
