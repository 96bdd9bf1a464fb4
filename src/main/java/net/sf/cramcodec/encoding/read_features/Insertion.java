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

public class Insertion extends AbstractReadFeature {
	private static final long serialVersionUID = 228345518567732889L;

	public static final byte operator = 'I';

	private final byte[] sequence;

	public Insertion(int position, byte[] sequence) {
		super(position);
		this.sequence = sequence;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte[] getSequence() {
		return sequence;
	}

	@Override
	protected Object getValue() {
		return sequence;
	}

	@Override
	protected String valueToString() {
		return "sequence=" + StringUtil.bytesToString(sequence);
	}
}
