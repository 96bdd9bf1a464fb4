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

public class BaseQualityScore extends AbstractReadFeature {
	private static final long serialVersionUID = 595266436563170686L;

	public static final byte operator = 'Q';

	private final byte qualityScore;

	public BaseQualityScore(int position, byte qualityScore) {
		super(position);
		this.qualityScore = qualityScore;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte getQualityScore() {
		return qualityScore;
	}

	@Override
	protected Object getValue() {
		return qualityScore;
	}

	@Override
	protected String valueToString() {
		return "qualityScore=" + qualityScore;
	}
}
