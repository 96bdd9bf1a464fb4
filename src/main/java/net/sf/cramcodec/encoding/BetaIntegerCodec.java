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
 * Fixed width binary: exactly <code>nofBits</code> core bits, minus the offset.
 */
public class BetaIntegerCodec extends AbstractBitCodec<Integer> {
	private final int offset;
	private final int nofBits;

	public BetaIntegerCodec(int offset, int nofBits) {
		if (nofBits < 0 || nofBits > 32)
			throw new IllegalArgumentException("Beta bit length must be 0 to 32: " + nofBits);

		this.offset = offset;
		this.nofBits = nofBits;
	}

	@Override
	public EncodingID id() {
		return EncodingID.BETA;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(offset, nofBits);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		return core.readBits(nofBits) - offset;
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		int newValue = value + offset;
		if (nofBits < 32 && (newValue >>> nofBits) != 0)
			throw new InvalidDataException(String.format("Value %d with offset %d does not fit into %d bits.", value,
					offset, nofBits));

		core.write(newValue, nofBits);
	}
}
