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

import htsjdk.samtools.util.StringUtil;

/**
 * A stretch of read bases stored verbatim.
 */
public class Bases extends AbstractReadFeature {
	private static final long serialVersionUID = 890212053992506125L;

	public static final byte operator = 'b';

	private final byte[] bases;

	public Bases(int position, byte[] bases) {
		super(position);
		this.bases = bases;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte[] getBases() {
		return bases;
	}

	@Override
	protected Object getValue() {
		return bases;
	}

	@Override
	protected String valueToString() {
		return "bases=" + StringUtil.bytesToString(bases);
	}
}
