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

import net.sf.cramcodec.structure.SubstitutionMatrix;

/**
 * A read base that differs from the reference, stored as a substitution
 * code. The base itself depends on the reference base and the substitution
 * matrix of the container.
 */
public class Substitution extends AbstractReadFeature {
	private static final long serialVersionUID = 299276172394195470L;

	public static final byte operator = 'X';

	private final byte code;

	public Substitution(int position, byte code) {
		super(position);
		this.code = code;
	}

	@Override
	public byte getOperator() {
		return operator;
	}

	public byte getCode() {
		return code;
	}

	/**
	 * @return the read base this code stands for at the given reference base
	 */
	public byte getBase(byte referenceBase, SubstitutionMatrix matrix) {
		return matrix.base(referenceBase, code);
	}

	@Override
	protected Object getValue() {
		return code;
	}

	@Override
	protected String valueToString() {
		return "code=" + code;
	}
}
