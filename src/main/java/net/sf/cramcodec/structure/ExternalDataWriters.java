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

import java.io.ByteArrayOutputStream;
import java.util.Map;
import java.util.TreeMap;

import net.sf.cramcodec.MissingExternalBlockException;

/**
 * Byte sinks for external blocks, the writing side of
 * {@link ExternalDataReaders}.
 */
public class ExternalDataWriters {
	private final Map<Integer, ByteArrayOutputStream> streams = new TreeMap<Integer, ByteArrayOutputStream>();

	public ExternalDataWriters add(int contentId) {
		if (!streams.containsKey(contentId))
			streams.put(contentId, new ByteArrayOutputStream());
		return this;
	}

	public ByteArrayOutputStream get(int contentId) throws MissingExternalBlockException {
		ByteArrayOutputStream os = streams.get(contentId);
		if (os == null)
			throw new MissingExternalBlockException(contentId);
		return os;
	}

	public byte[] toByteArray(int contentId) throws MissingExternalBlockException {
		return get(contentId).toByteArray();
	}

	public Map<Integer, byte[]> toByteArrays() {
		Map<Integer, byte[]> map = new TreeMap<Integer, byte[]>();
		for (Map.Entry<Integer, ByteArrayOutputStream> entry : streams.entrySet())
			map.put(entry.getKey(), entry.getValue().toByteArray());
		return map;
	}
}
