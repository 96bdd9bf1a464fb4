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
 * Sub-exponential code with parameter <code>k</code>: values below 2^k are
 * written as a zero bit and k bits, larger values as a unary bucket number
 * followed by the value without its leading bit.
 */
public class SubexpIntegerCodec extends AbstractBitCodec<Integer> {
	private final int offset;
	private final int k;

	public SubexpIntegerCodec(int offset, int k) {
		if (k < 0 || k > 30)
			throw new IllegalArgumentException("Subexp k must be 0 to 30: " + k);

		this.offset = offset;
		this.k = k;
	}

	@Override
	public EncodingID id() {
		return EncodingID.SUBEXP;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(offset, k);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		int u = 0;
		while (core.readBit())
			u++;

		int n;
		if (u == 0)
			n = core.readBits(k);
		else {
			int b = u + k - 1;
			if (b > 30)
				throw new InvalidDataException("Subexp value is wider than 31 bits: unary prefix " + u);
			n = (1 << b) | core.readBits(b);
		}

		return n - offset;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		int newValue = value + offset;
		if (newValue < 0)
			throw new InvalidDataException(String.format("Subexp codes non-negative values, got %d with offset %d.",
					value, offset));

		int b, u;
		if (newValue < (1 << k)) {
			b = k;
			u = 0;
		} else {
			b = 31 - Integer.numberOfLeadingZeros(newValue);
			u = b - k + 1;
		}

		core.write(true, u);
		core.write(false);
		core.write(newValue, b);
	}
}
