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
package net.sf.cramcodec.encoding.read_features;

/**
 * Skipped region of the reference, an intron for spliced reads.
 */
public class RefSkip extends AbstractReadFeature {
	private static final long serialVersionUID = 425618391372875949L;

	public static final byte operator = 'N';

	private final int length;

	public RefSkip(int position, int length) {
		super(position);
		this.length = length;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public int getLength() {
		return length;
	}

	@Override
	protected Object getValue() {
		return length;
	}

	@Override
	protected String valueToString() {
		return "length=" + length;
	}
}
