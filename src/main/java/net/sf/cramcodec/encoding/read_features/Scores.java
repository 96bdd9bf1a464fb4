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

import java.util.Arrays;

/**
 * A stretch of quality scores stored verbatim.
 */
public class Scores extends AbstractReadFeature {
	private static final long serialVersionUID = 687118738780629229L;

	public static final byte operator = 'q';

	private final byte[] scores;

	public Scores(int position, byte[] scores) {
		super(position);
		this.scores = scores;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte[] getScores() {
		return scores;
	}

	@Override
	protected Object getValue() {
		return scores;
	}

	@Override
	protected String valueToString() {
		return "scores=" + Arrays.toString(scores);
	}
}
