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
package net.sf.cramcodec.structure;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.TreeMap;

import net.sf.cramcodec.MissingExternalBlockException;

/**
 * One independent byte cursor per external block of a slice. Cursors only
 * move forward.
 */
public class ExternalDataReaders {
	private final Map<Integer, ByteBuffer> buffers = new TreeMap<Integer, ByteBuffer>();

	public ExternalDataReaders put(int contentId, byte[] data) {
		buffers.put(contentId, ByteBuffer.wrap(data));
		return this;
	}

	public boolean contains(int contentId) {
		return buffers.containsKey(contentId);
	}

	public ByteBuffer get(int contentId) throws MissingExternalBlockException {
		ByteBuffer buf = buffers.get(contentId);
		if (buf == null)
			throw new MissingExternalBlockException(contentId);
		return buf;
	}
}
