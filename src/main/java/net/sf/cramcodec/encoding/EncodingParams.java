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
package net.sf.cramcodec.encoding;

import java.util.Arrays;

/**
 * A codec id with its serialized parameters, as stored in the compression
 * header.
 */
public class EncodingParams {
	public final EncodingID id;
	public final byte[] params;

	public EncodingParams(EncodingID id, byte[] params) {
		this.id = id;
		this.params = params;
	}

	@Override
	public String toString() {
		return id.name() + ":" + Arrays.toString(params);
	}
}
