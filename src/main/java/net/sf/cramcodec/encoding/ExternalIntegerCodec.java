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

import java.io.IOException;

import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.BitOutputStream;
import net.sf.cramcodec.io.ByteBufferUtils;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ExternalDataWriters;

/**
 * ITF8 values in the external block with the given content id. Never touches
 * the core stream.
 */
public class ExternalIntegerCodec extends AbstractBitCodec<Integer> {
	private final int contentId;

	public ExternalIntegerCodec(int contentId) {
		this.contentId = contentId;
	}

	public int getContentId() {
		return contentId;
	}

	@Override
	public EncodingID id() {
		return EncodingID.EXTERNAL;
	}

	@Override
	public DataSeriesType valueType() {
		return DataSeriesType.INT;
	}

	@Override
	public byte[] toByteArray() {
		return toITF8Params(contentId);
	}

	@Override
	public Integer read(BitInputStream core, ExternalDataReaders external) throws IOException {
		return ByteBufferUtils.readUnsignedITF8(external.get(contentId));
	}

	@Override
	public void write(BitOutputStream core, ExternalDataWriters external, Integer value) throws IOException {
		ByteBufferUtils.writeUnsignedITF8(value, external.get(contentId));
	}
}
