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
package net.sf.cramcodec;

import net.sf.cramcodec.encoding.EncodingID;

/**
 * The codec is declared by the format but the requested operation is not
 * supported for it.
 */
public class CodecNotImplementedException extends CramException {
	private static final long serialVersionUID = 1380645163549170893L;
	private final EncodingID encodingId;

	public CodecNotImplementedException(EncodingID encodingId, String operation) {
		super("Not implemented: " + operation + " for codec " + encodingId.name());
		this.encodingId = encodingId;
	}

	public EncodingID getEncodingId() {
		return encodingId;
	}
}
