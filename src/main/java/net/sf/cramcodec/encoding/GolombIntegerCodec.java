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
 * Golomb code with modulus <code>m</code>: the quotient in unary (one bits
 * closed by a zero bit), the remainder in truncated binary.
 */
public class GolombIntegerCodec extends AbstractBitCodec<Integer> {
	private final int offset;
	private final int m;
	private final int b;
	private final int cutoff;

	public GolombIntegerCodec(int offset, int m) {
		if (m < 1)
			throw new IllegalArgumentException("Golomb modulus must be positive: " + m);

		this.offset = offset;
		this.m = m;
		this.b = 32 - Integer.numberOfLeadingZeros(m - 1);
		this.cutoff = (int) ((1L << b) - m);
	}

	@Override
	public EncodingID id() {
		return EncodingID.GOLOMB;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(offset, m);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		long quotient = 0;
		while (core.readBit())
			quotient++;

		int remainder = 0;
		if (b > 0) {
			remainder = core.readBits(b - 1);
			if (remainder >= cutoff)
				remainder = ((remainder << 1) | (core.readBit() ? 1 : 0)) - cutoff;
		}

		long value = quotient * m + remainder;
		if (value > Integer.MAX_VALUE)
			throw new InvalidDataException("Golomb value overflows 32 bits: " + value);

		return (int) value - offset;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		int newValue = value + offset;
		if (newValue < 0)
			throw new InvalidDataException(String.format("Golomb codes non-negative values, got %d with offset %d.",
					value, offset));

		int quotient = newValue / m;
		int remainder = newValue % m;

		core.write(true, quotient);
		core.write(false);

		if (b > 0) {
			if (remainder < cutoff)
				core.write(remainder, b - 1);
			else
				core.write(remainder + cutoff, b);
		}
	}
}
