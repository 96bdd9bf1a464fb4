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
 * A single read base together with its quality score.
 */
public class ReadBase extends AbstractReadFeature {
	private static final long serialVersionUID = 23178071561580584L;

	public static final byte operator = 'B';

	private final byte base;
	private final byte qualityScore;

	public ReadBase(int position, byte base, byte qualityScore) {
		super(position);
		this.base = base;
		this.qualityScore = qualityScore;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte getBase() {
		return base;
	}

	public byte getQualityScore() {
		return qualityScore;
	}

	@Override
	protected Object getValue() {
		return new byte[] { base, qualityScore };
	}

	@Override
	protected String valueToString() {
		return "base=" + (char) base + "; qualityScore=" + qualityScore;
	}
}
