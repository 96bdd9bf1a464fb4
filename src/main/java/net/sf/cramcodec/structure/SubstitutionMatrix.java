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
package net.sf.cramcodec.structure;

import java.util.Arrays;

/**
 * Maps a reference base and a 2-bit substitution code to the read base.
 * <p>
 * The matrix is stored as 5 bytes, one per reference base in ACGTN order.
 * Each byte holds the codes of the four other bases, again in ACGTN order,
 * two bits per base starting from the high bits.
 */
public class SubstitutionMatrix {
	public static final byte[] BASES = new byte[] { 'A', 'C', 'G', 'T', 'N' };
	public static final byte[] BASES_LC = new byte[] { 'a', 'c', 'g', 't', 'n' };

	private static final byte[] DEFAULT = new byte[] { 0x1B, 0x1B, 0x1B, 0x1B, 0x1B };

	private final byte[] bytes;
	private final byte[][] codes = new byte[256][256];
	private final byte[][] bases = new byte[256][4];

	public SubstitutionMatrix() {
		this(DEFAULT);
	}

	public SubstitutionMatrix(byte[] matrix) {
		if (matrix.length != BASES.length)
			throw new IllegalArgumentException("Substitution matrix must have 5 bytes: " + matrix.length);

		this.bytes = matrix.clone();

		for (int i = 0; i < bases.length; i++)
			Arrays.fill(bases[i], (byte) 'N');

		for (int i = 0; i < BASES.length; i++) {
			int shift = 6;
			for (int j = 0; j < BASES.length; j++) {
				if (i == j)
					continue;
				byte code = (byte) ((bytes[i] >>> shift) & 3);
				shift -= 2;

				codes[BASES[i]][BASES[j]] = code;
				codes[BASES_LC[i]][BASES[j]] = code;
				bases[BASES[i]][code] = BASES[j];
				bases[BASES_LC[i]][code] = BASES[j];
			}
		}
	}

	public byte[] getEncodedMatrix() {
		return bytes.clone();
	}

	/**
	 * @return the code of the substitution or 0 if the bases are equal or not
	 *         in ACGTN
	 */
	public byte code(byte refBase, byte readBase) {
		return codes[refBase & 0xFF][Character.toUpperCase(readBase & 0xFF)];
	}

	/**
	 * @return the read base, 'N' for a reference base outside ACGTN
	 */
	public byte base(byte refBase, byte code) {
		return bases[refBase & 0xFF][code & 3];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < BASES.length; i++) {
			if (i > 0)
				sb.append(' ');
			sb.append((char) BASES[i]).append(':');
			for (int c = 0; c < 4; c++)
				sb.append((char) bases[BASES[i]][c]);
		}
		return sb.toString();
	}
}
