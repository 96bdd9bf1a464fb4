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

/**
 * Codec identifiers as they appear in a compression header.
 */
public enum EncodingID {
	NULL(0), EXTERNAL(1), GOLOMB(2), HUFFMAN(3), BYTE_ARRAY_LEN(4), BYTE_ARRAY_STOP(5), BETA(6), SUBEXP(7), GOLOMB_RICE(
			8), GAMMA(9);

	private final int id;

	private EncodingID(int id) {
		this.id = id;
	}

	public int getId() {
		return id;
	}

	/**
	 * @return the codec with the given id or null if the id is unknown
	 */
	public static EncodingID byId(int id) {
		for (EncodingID e : values())
			if (e.id == id)
				return e;
		return null;
	}
}
