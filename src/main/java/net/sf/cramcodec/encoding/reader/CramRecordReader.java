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
package net.sf.cramcodec.encoding.reader;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import net.sf.cramcodec.CramRecord;
import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.MissingTagEncodingException;
import net.sf.cramcodec.MissingTagSetException;
import net.sf.cramcodec.ReadTag;
import net.sf.cramcodec.encoding.Encoding;
import net.sf.cramcodec.encoding.read_features.BaseQualityScore;
import net.sf.cramcodec.encoding.read_features.Bases;
import net.sf.cramcodec.encoding.read_features.Deletion;
import net.sf.cramcodec.encoding.read_features.HardClip;
import net.sf.cramcodec.encoding.read_features.InsertBase;
import net.sf.cramcodec.encoding.read_features.Insertion;
import net.sf.cramcodec.encoding.read_features.Padding;
import net.sf.cramcodec.encoding.read_features.ReadBase;
import net.sf.cramcodec.encoding.read_features.ReadFeature;
import net.sf.cramcodec.encoding.read_features.RefSkip;
import net.sf.cramcodec.encoding.read_features.Scores;
import net.sf.cramcodec.encoding.read_features.SoftClip;
import net.sf.cramcodec.encoding.read_features.Substitution;
import net.sf.cramcodec.io.BitInputStream;
import net.sf.cramcodec.structure.CompressionHeader;
import net.sf.cramcodec.structure.DataSeries;
import net.sf.cramcodec.structure.DataSeriesEncodings;
import net.sf.cramcodec.structure.ExternalDataReaders;
import net.sf.cramcodec.structure.ReferenceSequenceContext;
import net.sf.cramcodec.structure.Slice;
import net.sf.cramcodec.structure.TagKey;

/**
 * Decodes the records of one slice, one record per call. The reader holds
 * the core and external cursors of the slice and the state carried from one
 * record to the next: the record counter and the previous alignment start.
 * <p>
 * Not thread safe. Any exception leaves the cursors at an undefined position
 * and the remaining records of the slice should be abandoned.
 */
public class CramRecordReader {
	private static final Log log = Log.getInstance(CramRecordReader.class);

	private static final int MISSING_ID = -1;
	private static final int MISSING_MAPPING_QUALITY = 255;
	private static final byte MISSING_QUALITY_SCORE = (byte) 0xFF;

	public Charset charset = Charset.forName("UTF8");

	private final CompressionHeader header;
	private final DataSeriesEncodings encodings;
	private final ReferenceSequenceContext referenceContext;
	private final BitInputStream core;
	private final ExternalDataReaders external;
	private final int recordCount;

	private long nextId;
	private int prevAlignmentStart;
	private int recordsRead = 0;

	public CramRecordReader(CompressionHeader header, Slice slice) {
		this(header, slice.referenceContext, slice.createCoreDataReader(), slice.createExternalDataReaders(),
				slice.nofRecords, slice.globalRecordCounter);
	}

	public CramRecordReader(CompressionHeader header, ReferenceSequenceContext referenceContext, BitInputStream core,
			ExternalDataReaders external, int recordCount, long initialId) {
		this.header = header;
		this.encodings = header.getDataSeriesEncodings();
		this.referenceContext = referenceContext;
		this.core = core;
		this.external = external;
		this.recordCount = recordCount;
		this.nextId = initialId;

		if (referenceContext.getKind() == ReferenceSequenceContext.Kind.SOME)
			prevAlignmentStart = referenceContext.getAlignmentStart();
		else
			prevAlignmentStart = 0;
	}

	/**
	 * Decodes the next record of the slice into the given record, replacing
	 * all of its content.
	 * 
	 * @return 1 if a record was read, 0 if all records of the slice have
	 *         already been read
	 */
	public int readRecord(CramRecord r) throws IOException {
		if (recordsRead >= recordCount)
			return 0;

		try {
			r.reset();
			r.setId(nextId);

			r.setFlags(readBamFlags());
			r.setCramFlags(readCramFlags());

			readPositions(r);

			if (header.isReadNamesIncluded())
				r.setReadName(readName());

			readMate(r);
			readTags(r);

			if (r.isSegmentUnmapped())
				readUnmappedRead(r);
			else
				readMappedRead(r);
		} catch (IOException e) {
			log.error(String.format("Failed to read record %d of %d, id %d: %s", recordsRead + 1, recordCount, nextId,
					e.getMessage()));
			throw e;
		}

		Integer start = r.getAlignmentStart();
		prevAlignmentStart = start == null ? 0 : start;
		nextId++;
		recordsRead++;
		return 1;
	}

	/**
	 * @return the id the next decoded record will get
	 */
	public long getNextId() {
		return nextId;
	}

	public int getRecordsRead() {
		return recordsRead;
	}

	public boolean hasNext() {
		return recordsRead < recordCount;
	}

	/**
	 * Iterates over the records not read yet. Each call to next decodes into
	 * a new {@link CramRecord}. Decoding failures surface as
	 * {@link RuntimeIOException}.
	 */
	public Iterator<CramRecord> iterator() {
		return new Iterator<CramRecord>() {

			@Override
			public boolean hasNext() {
				return CramRecordReader.this.hasNext();
			}

			@Override
			public CramRecord next() {
				if (!hasNext())
					throw new NoSuchElementException();

				CramRecord record = new CramRecord();
				try {
					readRecord(record);
				} catch (IOException e) {
					throw new RuntimeIOException(e);
				}
				return record;
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	private int readBamFlags() throws IOException {
		int flags = decodeInt(DataSeries.BF_BamFlags);
		if (flags < 0 || flags > 0xFFFF)
			throw new InvalidDataException("BAM flags out of range: " + flags);
		return flags;
	}

	private int readCramFlags() throws IOException {
		int flags = decodeInt(DataSeries.CF_CramFlags);
		if (flags < 0 || flags > 0xFF)
			throw new InvalidDataException("CRAM flags out of range: " + flags);
		return flags;
	}

	private void readPositions(CramRecord r) throws IOException {
		switch (referenceContext.getKind()) {
		case SOME:
			r.setReferenceSequenceId(referenceContext.getReferenceSequenceId());
			break;
		case NONE:
			r.setReferenceSequenceId(null);
			break;
		case MANY:
			r.setReferenceSequenceId(readOptionalId(DataSeries.RI_ReferenceSequenceId));
			break;
		}

		int readLength = decodeInt(DataSeries.RL_ReadLength);
		if (readLength < 0)
			throw new InvalidDataException("Negative read length: " + readLength);
		r.setReadLength(readLength);

		r.setAlignmentStart(readAlignmentStart(r.isSegmentUnmapped()));
		r.setReadGroupId(readOptionalId(DataSeries.RG_ReadGroup));
	}

	private Integer readAlignmentStart(boolean unmapped) throws IOException {
		int value = decodeInt(DataSeries.AP_AlignmentStart);

		long start = header.isApDelta() ? (long) prevAlignmentStart + value : value;
		if (start < 0 || start > Integer.MAX_VALUE)
			throw new InvalidDataException(String.format("Invalid alignment start %d (stored value %d).", start, value));

		if (start == 0) {
			if (!unmapped)
				throw new InvalidDataException("Alignment start 0 for a mapped record.");
			return null;
		}

		return (int) start;
	}

	/**
	 * Decodes an id where -1 stands for none.
	 */
	private Integer readOptionalId(DataSeries series) throws IOException {
		int id = decodeInt(series);
		if (id == MISSING_ID)
			return null;
		if (id < 0)
			throw new InvalidDataException(String.format("Invalid %s: %d", series.name(), id));
		return id;
	}

	private String readName() throws IOException {
		byte[] name = decodeByteArray(DataSeries.RN_ReadName);

		int length = name.length;
		if (length > 0 && name[length - 1] == 0)
			length--;

		if (length == 1 && name[0] == '*')
			return null;

		return new String(name, 0, length, charset);
	}

	private void readMate(CramRecord r) throws IOException {
		if (r.isDetached()) {
			int mateFlags = decodeInt(DataSeries.MF_MateFlags);
			r.setMateFlags(mateFlags);
			if ((mateFlags & CramFlags.MATE_NEG_STRAND_FLAG) != 0)
				r.setFlags(r.getFlags() | BamFlags.MATE_STRAND_FLAG);
			if ((mateFlags & CramFlags.MATE_UNMAPPED_FLAG) != 0)
				r.setFlags(r.getFlags() | BamFlags.MATE_UNMAPPED_FLAG);

			if (!header.isReadNamesIncluded())
				r.setReadName(readName());

			r.setMateReferenceSequenceId(readOptionalId(DataSeries.NS_MateReferenceSequenceId));

			int mateStart = decodeInt(DataSeries.NP_MateAlignmentStart);
			if (mateStart < 0)
				throw new InvalidDataException("Negative mate alignment start: " + mateStart);
			r.setMateAlignmentStart(mateStart == 0 ? null : mateStart);

			r.setTemplateLength(decodeInt(DataSeries.TS_TemplateLength));
		} else if (r.isHasMateDownStream()) {
			int distance = decodeInt(DataSeries.NF_MateDistance);
			if (distance < 0)
				throw new InvalidDataException("Negative mate distance: " + distance);
			r.setMateDistance(distance);
		}
	}

	private void readTags(CramRecord r) throws IOException {
		int tagSetId = decodeInt(DataSeries.TL_TagSetId);
		List<TagKey> keys = header.getTagSet(tagSetId);
		if (keys == null)
			throw new MissingTagSetException(tagSetId);

		List<ReadTag> tags = new ArrayList<ReadTag>(keys.size());
		for (TagKey key : keys) {
			Encoding<byte[]> encoding = header.getTagEncoding(key.getContentId());
			if (encoding == null)
				throw new MissingTagEncodingException(key);

			byte[] data = encoding.decode(core, external);
			tags.add(new ReadTag(key.getTag(), key.getType(), ReadTag.restoreValueFromByteArray(key.getType(), data)));
		}
		r.setTags(tags);
	}

	private void readMappedRead(CramRecord r) throws IOException {
		int size = decodeInt(DataSeries.FN_FeatureCount);
		if (size < 0)
			throw new InvalidDataException("Negative feature count: " + size);

		List<ReadFeature> rf = new ArrayList<ReadFeature>();
		// 0-based offset into the read, features are stored as deltas:
		long offset = 0;
		for (int i = 0; i < size; i++) {
			byte operator = this.<Byte> decode(DataSeries.FC_FeatureCode);

			int delta = decodeInt(DataSeries.FP_FeaturePositionDelta);
			if (delta < 0)
				throw new InvalidDataException("Negative feature position delta: " + delta);
			offset += delta;
			if (offset + 1 > Integer.MAX_VALUE)
				throw new InvalidDataException("Feature position out of range: " + (offset + 1));

			rf.add(readFeature(operator, (int) (offset + 1)));
		}
		r.setReadFeatures(rf);

		int mappingQuality = decodeInt(DataSeries.MQ_MappingQuality);
		if (mappingQuality < 0 || mappingQuality > 0xFF)
			throw new InvalidDataException("Mapping quality out of range: " + mappingQuality);
		r.setMappingQuality(mappingQuality == MISSING_MAPPING_QUALITY ? null : mappingQuality);

		if (r.isForcePreserveQualityScores())
			r.setQualityScores(readQualityScores(r.getReadLength()));
	}

	private ReadFeature readFeature(byte operator, int pos) throws IOException {
		switch (operator) {
		case Bases.operator:
			return new Bases(pos, decodeByteArray(DataSeries.BB_StretchesOfBases));
		case Scores.operator:
			return new Scores(pos, decodeByteArray(DataSeries.QQ_StretchesOfQualityScores));
		case ReadBase.operator:
			byte base = decodeByte(DataSeries.BA_Base);
			return new ReadBase(pos, base, decodeByte(DataSeries.QS_QualityScore));
		case Substitution.operator:
			return new Substitution(pos, decodeByte(DataSeries.BS_BaseSubstitutionCode));
		case Insertion.operator:
			return new Insertion(pos, decodeByteArray(DataSeries.IN_Insertion));
		case Deletion.operator:
			return new Deletion(pos, readLength(DataSeries.DL_DeletionLength));
		case InsertBase.operator:
			return new InsertBase(pos, decodeByte(DataSeries.BA_Base));
		case BaseQualityScore.operator:
			return new BaseQualityScore(pos, decodeByte(DataSeries.QS_QualityScore));
		case RefSkip.operator:
			return new RefSkip(pos, readLength(DataSeries.RS_ReferenceSkipLength));
		case SoftClip.operator:
			return new SoftClip(pos, decodeByteArray(DataSeries.SC_SoftClip));
		case Padding.operator:
			return new Padding(pos, readLength(DataSeries.PD_PaddingLength));
		case HardClip.operator:
			return new HardClip(pos, readLength(DataSeries.HC_HardClipLength));

		default:
			throw new InvalidDataException(String.format("Unknown read feature code: %c (0x%02x)",
					(char) (operator & 0xFF), operator & 0xFF));
		}
	}

	private int readLength(DataSeries series) throws IOException {
		int length = decodeInt(series);
		if (length < 0)
			throw new InvalidDataException(String.format("Negative %s: %d", series.name(), length));
		return length;
	}

	private void readUnmappedRead(CramRecord r) throws IOException {
		Encoding<Byte> encoding = encodings.getRequired(DataSeries.BA_Base);
		r.setReadBases(encoding.decodeArray(core, external, r.getReadLength()));

		if (r.isForcePreserveQualityScores())
			r.setQualityScores(readQualityScores(r.getReadLength()));
	}

	/**
	 * @return the scores or an empty array if all of them are 0xFF
	 */
	private byte[] readQualityScores(int readLength) throws IOException {
		Encoding<Byte> encoding = encodings.getRequired(DataSeries.QS_QualityScore);
		byte[] scores = encoding.decodeArray(core, external, readLength);

		for (byte score : scores)
			if (score != MISSING_QUALITY_SCORE)
				return scores;
		return new byte[0];
	}

	private <T> T decode(DataSeries series) throws IOException {
		Encoding<T> encoding = encodings.getRequired(series);
		return encoding.decode(core, external);
	}

	private int decodeInt(DataSeries series) throws IOException {
		return this.<Integer> decode(series);
	}

	private byte decodeByte(DataSeries series) throws IOException {
		return this.<Byte> decode(series);
	}

	private byte[] decodeByteArray(DataSeries series) throws IOException {
		return this.<byte[]> decode(series);
	}
}
