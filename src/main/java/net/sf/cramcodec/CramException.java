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

import java.io.IOException;

/**
 * Base class for all CRAM decoding failures other than a plain end of stream,
 * which is reported as {@link java.io.EOFException}. Decoding is deterministic
 * so none of these are worth retrying: the caller should abandon the current
 * slice.
 */
public class CramException extends IOException {
	private static final long serialVersionUID = 7453101219851562045L;

	public CramException(String message) {
		super(message);
	}

	public CramException(String message, Throwable cause) {
		super(message, cause);
	}
}
