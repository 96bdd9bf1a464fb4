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

public class MissingExternalBlockException extends CramException {
	private static final long serialVersionUID = -6050335337468405720L;
	private final int contentId;

	public MissingExternalBlockException(int contentId) {
		super("Missing external block: content id " + contentId);
		this.contentId = contentId;
	}

	public int getContentId() {
		return contentId;
	}
}
