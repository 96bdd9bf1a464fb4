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
 * A single inserted base.
 */
public class InsertBase extends AbstractReadFeature {
	private static final long serialVersionUID = 398850076270813899L;

	public static final byte operator = 'i';

	private final byte base;

	public InsertBase(int position, byte base) {
		super(position);
		this.base = base;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte getBase() {
		return base;
	}

	@Override
	protected Object getValue() {
		return base;
	}

	@Override
	protected String valueToString() {
		return "base=" + (char) base;
	}
}
