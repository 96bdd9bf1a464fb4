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
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.io.BitInputStream;

/**
 * Canonical Huffman code table built from symbols and their code lengths.
 * Codes are assigned in order of length and then symbol value, each code
 * being the previous one plus one, shifted left by the length difference.
 * <p>
 * Decoding reads one bit at a time and compares the accumulated code against
 * the first code and code count of the current length, so no tree is kept.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class CanonicalHuffmanDecoder {
	public static final int MAX_CODE_LENGTH = 31;

	private final HuffmanBitCode[] sortedCodes;
	private final Map<Integer, HuffmanBitCode> codesBySymbol;
	private final int maxLength;

	// indexed by code length:
	private final int[] firstCode;
	private final int[] count;
	private final int[] firstIndex;

	/**
	 * @throws IllegalArgumentException
	 *             if the table is empty, the arrays differ in length, a
	 *             symbol repeats, a length is out of range or the lengths
	 *             over-subscribe the code space
	 */
	public CanonicalHuffmanDecoder(int[] alphabet, int[] bitLengths) {
		if (alphabet.length != bitLengths.length)
			throw new IllegalArgumentException(String.format("Huffman alphabet size %d does not match %d bit lengths.",
					alphabet.length, bitLengths.length));
		if (alphabet.length == 0)
			throw new IllegalArgumentException("Empty Huffman alphabet.");

		codesBySymbol = new HashMap<Integer, HuffmanBitCode>();

		if (alphabet.length == 1) {
			if (bitLengths[0] < 0 || bitLengths[0] > MAX_CODE_LENGTH)
				throw new IllegalArgumentException("Invalid Huffman code length: " + bitLengths[0]);

			// the only symbol needs no bits at all:
			HuffmanBitCode code = new HuffmanBitCode(alphabet[0], 0, 0);
			sortedCodes = new HuffmanBitCode[] { code };
			codesBySymbol.put(alphabet[0], code);
			maxLength = 0;
			firstCode = new int[1];
			count = new int[1];
			firstIndex = new int[1];
			return;
		}

		Integer[] order = new Integer[alphabet.length];
		int max = 0;
		for (int i = 0; i < alphabet.length; i++) {
			int len = bitLengths[i];
			if (len < 1 || len > MAX_CODE_LENGTH)
				throw new IllegalArgumentException(String.format("Invalid Huffman code length %d for symbol %d.", len,
						alphabet[i]));
			max = Math.max(max, len);
			order[i] = i;
		}
		maxLength = max;

		final int[] values = alphabet;
		final int[] lens = bitLengths;
		Arrays.sort(order, new Comparator<Integer>() {
			@Override
			public int compare(Integer a, Integer b) {
				if (lens[a] != lens[b])
					return lens[a] < lens[b] ? -1 : 1;
				return Integer.compare(values[a], values[b]);
			}
		});

		sortedCodes = new HuffmanBitCode[alphabet.length];
		firstCode = new int[maxLength + 1];
		count = new int[maxLength + 1];
		firstIndex = new int[maxLength + 1];

		long code = -1;
		int codeLength = 0;
		for (int k = 0; k < order.length; k++) {
			int i = order[k];
			int len = lens[i];

			code = (code + 1) << (len - codeLength);
			codeLength = len;
			if (code >= (1L << len))
				throw new IllegalArgumentException("Huffman code lengths over-subscribe the code space at symbol "
						+ values[i]);

			HuffmanBitCode bitCode = new HuffmanBitCode(values[i], (int) code, len);
			if (codesBySymbol.put(values[i], bitCode) != null)
				throw new IllegalArgumentException("Duplicate Huffman symbol: " + values[i]);

			if (count[len]++ == 0) {
				firstCode[len] = (int) code;
				firstIndex[len] = k;
			}
			sortedCodes[k] = bitCode;
		}
	}

	/**
	 * Reads bits until they form a complete code and returns its symbol.
	 * 
	 * @throws InvalidDataException
	 *             if no code of the table matches
	 */
	public int decode(BitInputStream bis) throws IOException {
		if (maxLength == 0)
			return sortedCodes[0].value;

		int code = 0;
		for (int len = 1; len <= maxLength; len++) {
			code = (code << 1) | (bis.readBit() ? 1 : 0);
			if (count[len] > 0 && code >= firstCode[len] && code - firstCode[len] < count[len])
				return sortedCodes[firstIndex[len] + code - firstCode[len]].value;
		}

		throw new InvalidDataException("Bit pattern does not match any Huffman code: " + code);
	}

	/**
	 * @return the code for the symbol or null if the symbol is not in the
	 *         alphabet
	 */
	public HuffmanBitCode codeFor(int symbol) {
		return codesBySymbol.get(symbol);
	}

	public int getMaxCodeLength() {
		return maxLength;
	}
}
