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
 * Bases clipped from the read and not stored.
 */
public class HardClip extends AbstractReadFeature {
	private static final long serialVersionUID = 741603196579171982L;

	public static final byte operator = 'H';

	private final int length;

	public HardClip(int position, int length) {
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
