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

import htsjdk.samtools.util.Log;

import java.util.Map;
import java.util.TreeMap;

import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.io.DefaultBitInputStream;

/**
 * The decompressed content of one slice: its reference context, the number
 * of records, the core block and the external blocks by content id.
 */
public class Slice {
	private static final Log log = Log.getInstance(Slice.class);

	public ReferenceSequenceContext referenceContext = ReferenceSequenceContext.none();
	public int nofRecords = 0;
	public long globalRecordCounter = 0;

	public byte[] coreBlock = new byte[0];
	public Map<Integer, byte[]> external = new TreeMap<Integer, byte[]>();

	public Slice() {
	}

	public Slice(ReferenceSequenceContext referenceContext, int nofRecords, long globalRecordCounter,
			byte[] coreBlock, Map<Integer, byte[]> external) {
		if (nofRecords < 0)
			throw new IllegalArgumentException("Negative record count: " + nofRecords);

		this.referenceContext = referenceContext;
		this.nofRecords = nofRecords;
		this.globalRecordCounter = globalRecordCounter;
		this.coreBlock = coreBlock;
		this.external = new TreeMap<Integer, byte[]>(external);
	}

	/**
	 * @return fresh cursors positioned at the start of every external block
	 */
	public ExternalDataReaders createExternalDataReaders() {
		ExternalDataReaders readers = new ExternalDataReaders();
		for (Map.Entry<Integer, byte[]> entry : external.entrySet())
			readers.put(entry.getKey(), entry.getValue());

		log.debug(String.format("Slice %s: %d records, core %d bytes, external blocks %s", referenceContext,
				nofRecords, coreBlock.length, external.keySet()));
		return readers;
	}

	public BitInputStream createCoreDataReader() {
		return new DefaultBitInputStream(coreBlock);
	}

	@Override
	public String toString() {
		return String.format("slice: context=%s, records=%d, global record counter=%d, external=%s",
				referenceContext, nofRecords, globalRecordCounter, external.keySet());
	}
}
