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

import java.io.Serializable;
import java.util.Arrays;

/**
 * Base of the decoded read features: a position and one payload value.
 * Features are equal when they are of the same class, at the same position
 * and carry equal payloads.
 */
public abstract class AbstractReadFeature implements ReadFeature, Serializable {
	private static final long serialVersionUID = -4426135217716317413L;

	private final int position;

	protected AbstractReadFeature(int position) {
		this.position = position;
	}

	@Override
	public int getPosition() {
		return position;
	}

	/**
	 * @return the payload, arrays are compared by content
	 */
	protected abstract Object getValue();

	protected String valueToString() {
		return String.valueOf(getValue());
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != getClass())
			return false;

		AbstractReadFeature f = (AbstractReadFeature) obj;
		return position == f.position && Arrays.deepEquals(new Object[] { getValue() }, new Object[] { f.getValue() });
	}

	@Override
	public int hashCode() {
		return 31 * position + Arrays.deepHashCode(new Object[] { getValue() });
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[position=" + position + "; " + valueToString() + "]";
	}
}
