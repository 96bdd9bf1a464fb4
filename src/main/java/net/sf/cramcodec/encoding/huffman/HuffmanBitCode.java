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

public class HuffmanBitCode {
	public final int value;
	public final int bitCode;
	public final int bitLength;

	HuffmanBitCode(int value, int bitCode, int bitLength) {
		this.value = value;
		this.bitCode = bitCode;
		this.bitLength = bitLength;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = bitLength - 1; i >= 0; i--)
			sb.append((bitCode >>> i) & 1);
		return value + ":\t" + sb + " " + bitCode;
	}
}
