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
package net.sf.cramcodec.io;

import java.io.IOException;
import java.io.OutputStream;

public class DefaultBitOutputStream implements BitOutputStream {
	private final OutputStream out;
	private int bufferByte = 0;
	private int bufferedNumberOfBits = 0;

	public DefaultBitOutputStream(OutputStream out) {
		this.out = out;
	}

	@Override
	public void write(int bitContainer, int nofBitsToWrite) throws IOException {
		if (nofBitsToWrite < 0 || nofBitsToWrite > 32)
			throw new IllegalArgumentException("Can write 0 to 32 bits at once, requested " + nofBitsToWrite);

		for (int i = nofBitsToWrite - 1; i >= 0; i--)
			writeBit((bitContainer >>> i) & 1);
	}

	@Override
	public void write(long bitContainer, int nofBitsToWrite) throws IOException {
		if (nofBitsToWrite < 0 || nofBitsToWrite > 64)
			throw new IllegalArgumentException("Can write 0 to 64 bits at once, requested " + nofBitsToWrite);

		for (int i = nofBitsToWrite - 1; i >= 0; i--)
			writeBit((int) ((bitContainer >>> i) & 1));
	}

	@Override
	public void write(boolean bit) throws IOException {
		writeBit(bit ? 1 : 0);
	}

	@Override
	public void write(boolean bit, long repeat) throws IOException {
		for (long i = 0; i < repeat; i++)
			writeBit(bit ? 1 : 0);
	}

	@Override
	public void flush() throws IOException {
		if (bufferedNumberOfBits > 0) {
			out.write(bufferByte << (8 - bufferedNumberOfBits));
			bufferByte = 0;
			bufferedNumberOfBits = 0;
		}
		out.flush();
	}

	@Override
	public void close() throws IOException {
		flush();
		out.close();
	}

	private void writeBit(int bit) throws IOException {
		bufferByte = (bufferByte << 1) | bit;
		if (++bufferedNumberOfBits == 8) {
			out.write(bufferByte);
			bufferByte = 0;
			bufferedNumberOfBits = 0;
		}
	}
}
