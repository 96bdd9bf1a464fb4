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
 * Golomb code with a power of two modulus, the remainder is a plain
 * <code>log2m</code> bit number.
 */
public class GolombRiceIntegerCodec extends AbstractBitCodec<Integer> {
	private final int offset;
	private final int log2m;
	private final int mask;

	public GolombRiceIntegerCodec(int offset, int log2m) {
		if (log2m < 0 || log2m > 30)
			throw new IllegalArgumentException("Golomb-Rice log2m must be 0 to 30: " + log2m);

		this.offset = offset;
		this.log2m = log2m;
		this.mask = (1 << log2m) - 1;
	}

	@Override
	public EncodingID id() {
		return EncodingID.GOLOMB_RICE;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(offset, log2m);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		long quotient = 0;
		while (core.readBit())
			quotient++;

		long value = (quotient << log2m) | core.readBits(log2m);
		if (value > Integer.MAX_VALUE)
			throw new InvalidDataException("Golomb-Rice value overflows 32 bits: " + value);

		return (int) value - offset;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		int newValue = value + offset;
		if (newValue < 0)
			throw new InvalidDataException(String.format(
					"Golomb-Rice codes non-negative values, got %d with offset %d.", value, offset));

		core.write(true, newValue >>> log2m);
		core.write(false);
		core.write(newValue & mask, log2m);
	}
}
