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

import static net.sf.cramcodec.structure.DataSeries.AP_AlignmentStart;
import static net.sf.cramcodec.structure.DataSeries.BA_Base;
import static net.sf.cramcodec.structure.DataSeries.BB_StretchesOfBases;
import static net.sf.cramcodec.structure.DataSeries.BF_BamFlags;
import static net.sf.cramcodec.structure.DataSeries.BS_BaseSubstitutionCode;
import static net.sf.cramcodec.structure.DataSeries.CF_CramFlags;
import static net.sf.cramcodec.structure.DataSeries.DL_DeletionLength;
import static net.sf.cramcodec.structure.DataSeries.FC_FeatureCode;
import static net.sf.cramcodec.structure.DataSeries.FN_FeatureCount;
import static net.sf.cramcodec.structure.DataSeries.FP_FeaturePositionDelta;
import static net.sf.cramcodec.structure.DataSeries.HC_HardClipLength;
import static net.sf.cramcodec.structure.DataSeries.IN_Insertion;
import static net.sf.cramcodec.structure.DataSeries.MF_MateFlags;
import static net.sf.cramcodec.structure.DataSeries.MQ_MappingQuality;
import static net.sf.cramcodec.structure.DataSeries.NF_MateDistance;
import static net.sf.cramcodec.structure.DataSeries.NP_MateAlignmentStart;
import static net.sf.cramcodec.structure.DataSeries.NS_MateReferenceSequenceId;
import static net.sf.cramcodec.structure.DataSeries.PD_PaddingLength;
import static net.sf.cramcodec.structure.DataSeries.QQ_StretchesOfQualityScores;
import static net.sf.cramcodec.structure.DataSeries.QS_QualityScore;
import static net.sf.cramcodec.structure.DataSeries.RG_ReadGroup;
import static net.sf.cramcodec.structure.DataSeries.RI_ReferenceSequenceId;
import static net.sf.cramcodec.structure.DataSeries.RL_ReadLength;
import static net.sf.cramcodec.structure.DataSeries.RN_ReadName;
import static net.sf.cramcodec.structure.DataSeries.RS_ReferenceSkipLength;
import static net.sf.cramcodec.structure.DataSeries.SC_SoftClip;
import static net.sf.cramcodec.structure.DataSeries.TL_TagSetId;
import static net.sf.cramcodec.structure.DataSeries.TS_TemplateLength;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import htsjdk.samtools.util.RuntimeIOException;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import net.sf.cramcodec.CramRecord;
import net.sf.cramcodec.InvalidDataException;
import net.sf.cramcodec.MissingDataSeriesEncodingException;
import net.sf.cramcodec.MissingExternalBlockException;
import net.sf.cramcodec.MissingTagEncodingException;
import net.sf.cramcodec.MissingTagSetException;
import net.sf.cramcodec.encoding.Encoding;
import net.sf.cramcodec.encoding.huffman.HuffmanIntegerCodec;
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
import net.sf.cramcodec.structure.CompressionHeader;
import net.sf.cramcodec.structure.DataSeries;
import net.sf.cramcodec.structure.ReferenceSequenceContext;
import net.sf.cramcodec.structure.Slice;
import net.sf.cramcodec.structure.TagKey;

import org.junit.Test;

public class TestCramRecordReader {

	private static final ReferenceSequenceContext ON_CHR1 = ReferenceSequenceContext.some(0, 100, 1000);

	/**
	 * Writes a mapped, attached record without features, tags or quality
	 * scores.
	 */
	private static void writeMapped(SliceFixture f, int readLength, int ap, String name) throws IOException {
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, readLength).writeInt(AP_AlignmentStart, ap).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, name);
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 60);
	}

	private static List<CramRecord> readAll(CramRecordReader reader) throws IOException {
		List<CramRecord> records = new ArrayList<CramRecord>();
		CramRecord record = new CramRecord();
		while (reader.readRecord(record) == 1) {
			records.add(record);
			record = new CramRecord();
		}
		return records;
	}

	@Test
	public void test_alignment_start_delta() throws IOException {
		SliceFixture f = new SliceFixture();
		for (int delta : new int[] { 100, 5, -3 }) {
			f.writeInt(RI_ReferenceSequenceId, 0);
			writeMapped(f, 10, delta, "r");
		}

		CramRecordReader reader = new CramRecordReader(f.buildHeader(), f.buildSlice(
				ReferenceSequenceContext.many(), 3, 0));
		List<CramRecord> records = readAll(reader);

		assertThat(records.size(), is(3));
		assertThat(records.get(0).getAlignmentStart(), is(100));
		assertThat(records.get(1).getAlignmentStart(), is(105));
		assertThat(records.get(2).getAlignmentStart(), is(102));
		for (int i = 0; i < 3; i++) {
			assertThat(records.get(i).getId(), is((long) i));
			assertThat(records.get(i).getReferenceSequenceId(), is(0));
			assertThat(records.get(i).getReadGroupId(), nullValue());
			assertThat(records.get(i).getMappingQuality(), is(60));
			assertThat(records.get(i).getCigar().toString(), is("10M"));
		}
		assertFalse(reader.hasNext());
	}

	@Test
	public void test_alignment_start_delta_from_slice_start() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 7, "r");

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record);
		assertThat(record.getAlignmentStart(), is(107));
		assertThat(record.getReferenceSequenceId(), is(0));
		assertThat(record.getAlignmentEnd(), is(116));
	}

	@Test
	public void test_absolute_alignment_start() throws IOException {
		SliceFixture f = new SliceFixture();
		f.header().apDelta(false);
		writeMapped(f, 10, 500, "a");
		writeMapped(f, 10, 450, "b");

		List<CramRecord> records = readAll(new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 2, 0)));
		assertThat(records.get(0).getAlignmentStart(), is(500));
		assertThat(records.get(1).getAlignmentStart(), is(450));
	}

	@Test
	public void test_negative_alignment_start() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(RI_ReferenceSequenceId, 0);
		writeMapped(f, 10, 10, "ok");
		f.writeInt(RI_ReferenceSequenceId, 0);
		writeMapped(f, 10, -20, "bad");

		CramRecordReader reader = new CramRecordReader(f.buildHeader(), f.buildSlice(
				ReferenceSequenceContext.many(), 2, 0));
		CramRecord first = new CramRecord();
		assertThat(reader.readRecord(first), is(1));

		try {
			reader.readRecord(new CramRecord());
			fail("Expecting invalid data.");
		} catch (InvalidDataException e) {
			assertThat(first.getAlignmentStart(), is(10));
			assertThat(first.getReadName(), is("ok"));
			assertThat(reader.getNextId(), is(1L));
			assertThat(reader.getRecordsRead(), is(1));
		}
	}

	@Test(expected = InvalidDataException.class)
	public void test_mapped_record_at_zero() throws IOException {
		SliceFixture f = new SliceFixture();
		f.header().apDelta(false);
		writeMapped(f, 10, 0, "r");
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test
	public void test_unmapped_record() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, BamFlags.READ_UNMAPPED_FLAG).writeInt(CF_CramFlags, CramFlags.FORCE_PRESERVE_QS_FLAG);
		f.writeInt(RL_ReadLength, 4).writeInt(AP_AlignmentStart, 0).writeInt(RG_ReadGroup, 2);
		f.writeBytes(RN_ReadName, "u1\0");
		f.writeInt(TL_TagSetId, 0);
		for (byte b : "ACGT".getBytes())
			f.writeByte(BA_Base, b);
		for (int q : new int[] { 30, 31, 32, 33 })
			f.writeByte(QS_QualityScore, q);

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ReferenceSequenceContext.none(), 1, 0))
				.readRecord(record);

		assertTrue(record.isSegmentUnmapped());
		assertThat(record.getReferenceSequenceId(), nullValue());
		assertThat(record.getAlignmentStart(), nullValue());
		assertThat(record.getReadGroupId(), is(2));
		assertThat(record.getReadName(), is("u1"));
		assertThat(new String(record.getReadBases()), is("ACGT"));
		assertThat(record.getQualityScores(), equalTo(new byte[] { 30, 31, 32, 33 }));
		assertThat(record.getMappingQuality(), nullValue());
	}

	@Test
	public void test_missing_read_name() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 1, "*");
		writeMapped(f, 10, 1, "*\0");

		List<CramRecord> records = readAll(new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 2, 0)));
		assertThat(records.get(0).getReadName(), nullValue());
		assertThat(records.get(1).getReadName(), nullValue());
	}

	@Test
	public void test_feature_positions() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 20).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "f");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 3);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, 3);
		f.writeByte(BS_BaseSubstitutionCode, 1);
		f.writeByte(FC_FeatureCode, Insertion.operator).writeInt(FP_FeaturePositionDelta, 0);
		f.writeBytes(IN_Insertion, "CA");
		f.writeByte(FC_FeatureCode, Deletion.operator).writeInt(FP_FeaturePositionDelta, 7);
		f.writeInt(DL_DeletionLength, 2);
		f.writeInt(MQ_MappingQuality, 255);

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record);

		List<ReadFeature> features = record.getReadFeatures();
		assertThat(features.size(), is(3));
		assertThat(features.get(0).getPosition(), is(4));
		assertThat(features.get(1).getPosition(), is(4));
		assertThat(features.get(2).getPosition(), is(11));
		assertThat(((Substitution) features.get(0)).getCode(), is((byte) 1));
		assertThat(new String(((Insertion) features.get(1)).getSequence()), is("CA"));
		assertThat(((Deletion) features.get(2)).getLength(), is(2));
		assertThat(record.getMappingQuality(), nullValue());
	}

	@Test(expected = InvalidDataException.class)
	public void test_negative_feature_position_delta() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 20).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "f");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 1);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, -1);
		f.writeByte(BS_BaseSubstitutionCode, 1);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test
	public void test_all_feature_codes() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 30).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "all");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 12);

		f.writeByte(FC_FeatureCode, Bases.operator).writeInt(FP_FeaturePositionDelta, 0);
		f.writeBytes(BB_StretchesOfBases, "AC");
		f.writeByte(FC_FeatureCode, Scores.operator).writeInt(FP_FeaturePositionDelta, 0);
		f.writeBytes(QQ_StretchesOfQualityScores, new byte[] { 10, 11 });
		f.writeByte(FC_FeatureCode, ReadBase.operator).writeInt(FP_FeaturePositionDelta, 2);
		f.writeByte(BA_Base, 'G').writeByte(QS_QualityScore, 20);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeByte(BS_BaseSubstitutionCode, 3);
		f.writeByte(FC_FeatureCode, Insertion.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeBytes(IN_Insertion, "TT");
		f.writeByte(FC_FeatureCode, Deletion.operator).writeInt(FP_FeaturePositionDelta, 2);
		f.writeInt(DL_DeletionLength, 4);
		f.writeByte(FC_FeatureCode, InsertBase.operator).writeInt(FP_FeaturePositionDelta, 0);
		f.writeByte(BA_Base, 'C');
		f.writeByte(FC_FeatureCode, BaseQualityScore.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeByte(QS_QualityScore, 30);
		f.writeByte(FC_FeatureCode, RefSkip.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeInt(RS_ReferenceSkipLength, 100);
		f.writeByte(FC_FeatureCode, SoftClip.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeBytes(SC_SoftClip, "GGG");
		f.writeByte(FC_FeatureCode, Padding.operator).writeInt(FP_FeaturePositionDelta, 3);
		f.writeInt(PD_PaddingLength, 2);
		f.writeByte(FC_FeatureCode, HardClip.operator).writeInt(FP_FeaturePositionDelta, 0);
		f.writeInt(HC_HardClipLength, 5);
		f.writeInt(MQ_MappingQuality, 60);

		CramRecordReader reader = new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0));
		CramRecord record = new CramRecord();
		assertThat(reader.readRecord(record), is(1));

		List<ReadFeature> expected = Arrays.<ReadFeature> asList(new Bases(1, "AC".getBytes("ASCII")), new Scores(1,
				new byte[] { 10, 11 }), new ReadBase(3, (byte) 'G', (byte) 20), new Substitution(4, (byte) 3),
				new Insertion(5, "TT".getBytes("ASCII")), new Deletion(7, 4), new InsertBase(7, (byte) 'C'),
				new BaseQualityScore(8, (byte) 30), new RefSkip(9, 100), new SoftClip(10, "GGG".getBytes("ASCII")),
				new Padding(13, 2), new HardClip(13, 5));
		assertThat(record.getReadFeatures(), equalTo(expected));
		assertThat(record.getMappingQuality(), is(60));
		assertFalse(reader.hasNext());
	}

	@Test(expected = InvalidDataException.class)
	public void test_feature_position_overflow() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 20).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "f");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 2);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, 5);
		f.writeByte(BS_BaseSubstitutionCode, 1);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, Integer.MAX_VALUE);
		f.writeByte(BS_BaseSubstitutionCode, 1);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test(expected = EOFException.class)
	public void test_feature_count_larger_than_data() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 20).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "f");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, Integer.MAX_VALUE);
		f.writeByte(FC_FeatureCode, Substitution.operator).writeInt(FP_FeaturePositionDelta, 1);
		f.writeByte(BS_BaseSubstitutionCode, 1);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test(expected = EOFException.class)
	public void test_read_length_larger_than_data() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, BamFlags.READ_UNMAPPED_FLAG).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, Integer.MAX_VALUE).writeInt(AP_AlignmentStart, 0).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "u");
		f.writeInt(TL_TagSetId, 0);
		for (byte b : "ACGT".getBytes("ASCII"))
			f.writeByte(BA_Base, b);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ReferenceSequenceContext.none(), 1, 0))
				.readRecord(new CramRecord());
	}

	@Test
	public void test_missing_quality_scores() throws IOException {
		SliceFixture f = new SliceFixture();
		for (int i = 0; i < 2; i++) {
			f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, CramFlags.FORCE_PRESERVE_QS_FLAG);
			f.writeInt(RL_ReadLength, 4).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
			f.writeBytes(RN_ReadName, "q");
			f.writeInt(TL_TagSetId, 0);
			f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 0);
		}
		for (int score : new int[] { 0xFF, 0xFF, 0xFF, 0xFF, 40, 0xFF, 0xFF, 0xFF })
			f.writeByte(QS_QualityScore, score);

		List<CramRecord> records = readAll(new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 2, 0)));
		assertThat(records.get(0).getQualityScores().length, is(0));
		assertThat(records.get(1).getQualityScores(), equalTo(new byte[] { 40, -1, -1, -1 }));
		assertThat(records.get(1).getMappingQuality(), is(0));
	}

	@Test
	public void test_missing_data_series_encoding() throws IOException {
		SliceFixture f = new SliceFixture(FC_FeatureCode);
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 20).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "f");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 1);

		CramRecordReader reader = new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0));
		try {
			reader.readRecord(new CramRecord());
			fail("Expecting a missing encoding.");
		} catch (MissingDataSeriesEncodingException e) {
			assertThat(e.getDataSeries(), is(FC_FeatureCode));
			assertThat(reader.getNextId(), is(0L));
			assertThat(reader.getRecordsRead(), is(0));
		}
	}

	@Test
	public void test_unused_data_series_may_be_missing() throws IOException {
		SliceFixture f = new SliceFixture(FC_FeatureCode, MF_MateFlags, NF_MateDistance, BA_Base, QS_QualityScore);
		writeMapped(f, 10, 1, "r");

		CramRecord record = new CramRecord();
		assertThat(new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record), is(1));
		assertThat(record.getReadName(), is("r"));
	}

	@Test(expected = MissingExternalBlockException.class)
	public void test_missing_external_block() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 1, "r");

		Slice slice = f.buildSlice(ON_CHR1, 1, 0);
		slice.external.remove(SliceFixture.contentId(RL_ReadLength));
		new CramRecordReader(f.buildHeader(), slice).readRecord(new CramRecord());
	}

	@Test
	public void test_deterministic() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 5, "a");
		writeMapped(f, 12, 9, "b");
		CompressionHeader header = f.buildHeader();
		Slice slice = f.buildSlice(ON_CHR1, 2, 0);

		List<CramRecord> first = readAll(new CramRecordReader(header, slice));
		List<CramRecord> second = readAll(new CramRecordReader(header, slice));

		assertThat(second.size(), is(first.size()));
		for (int i = 0; i < first.size(); i++)
			assertThat(second.get(i).toString(), is(first.get(i).toString()));
		assertThat(second.get(1).getAlignmentStart(), is(114));
	}

	@Test
	public void test_detached_mate() throws IOException {
		SliceFixture f = new SliceFixture();
		f.header().readNamesIncluded(false);
		f.writeInt(BF_BamFlags, BamFlags.READ_PAIRED_FLAG).writeInt(CF_CramFlags, CramFlags.DETACHED_FLAG);
		f.writeInt(RL_ReadLength, 5).writeInt(AP_AlignmentStart, 50).writeInt(RG_ReadGroup, 0);
		f.writeInt(MF_MateFlags, CramFlags.MATE_NEG_STRAND_FLAG | CramFlags.MATE_UNMAPPED_FLAG);
		f.writeBytes(RN_ReadName, "pair1");
		f.writeInt(NS_MateReferenceSequenceId, 2).writeInt(NP_MateAlignmentStart, 0);
		f.writeInt(TS_TemplateLength, -150);
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 20);

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record);

		assertThat(record.getFlags(), is(BamFlags.READ_PAIRED_FLAG | BamFlags.MATE_STRAND_FLAG
				| BamFlags.MATE_UNMAPPED_FLAG));
		assertTrue(record.isMateNegativeStrand());
		assertTrue(record.isMateUnmapped());
		assertThat(record.getReadName(), is("pair1"));
		assertThat(record.getMateReferenceSequenceId(), is(2));
		assertThat(record.getMateAlignmentStart(), nullValue());
		assertThat(record.getTemplateLength(), is(-150));
		assertThat(record.getAlignmentStart(), is(150));
	}

	@Test
	public void test_mate_downstream() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, BamFlags.READ_PAIRED_FLAG).writeInt(CF_CramFlags, CramFlags.HAS_MATE_DOWNSTREAM_FLAG);
		f.writeInt(RL_ReadLength, 5).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "m");
		f.writeInt(NF_MateDistance, 2);
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 20);

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record);
		assertThat(record.getMateDistance(), is(2));
		assertThat(record.getMateReferenceSequenceId(), nullValue());
	}

	@Test(expected = InvalidDataException.class)
	public void test_negative_mate_distance() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, CramFlags.HAS_MATE_DOWNSTREAM_FLAG);
		f.writeInt(RL_ReadLength, 5).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "m");
		f.writeInt(NF_MateDistance, -1);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test
	public void test_tags() throws IOException {
		SliceFixture f = new SliceFixture();
		TagKey nm = new TagKey("NM", 'C');
		TagKey md = new TagKey("MD", 'Z');
		int tagSet = f.tagSet(nm, md);

		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 10).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "t");
		f.writeInt(TL_TagSetId, tagSet);
		f.writeTag(nm, new byte[] { 5 });
		f.writeTag(md, "10A5\0".getBytes());
		f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 60);

		CramRecord record = new CramRecord();
		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(record);

		assertThat(record.getTags().size(), is(2));
		assertThat(record.getTag("NM").getValue(), equalTo((Object) 5));
		assertThat(record.getTag("MD").getValue(), equalTo((Object) "10A5"));
		assertThat(record.getTag("MD").getType(), is('Z'));
	}

	@Test(expected = MissingTagSetException.class)
	public void test_missing_tag_set() throws IOException {
		SliceFixture f = new SliceFixture();
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 10).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "t");
		f.writeInt(TL_TagSetId, 7);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test(expected = MissingTagEncodingException.class)
	public void test_missing_tag_encoding() throws IOException {
		SliceFixture f = new SliceFixture();
		List<TagKey> keys = new ArrayList<TagKey>();
		keys.add(new TagKey("XX", 'i'));
		List<List<TagKey>> dictionary = new ArrayList<List<TagKey>>();
		dictionary.add(keys);
		f.header().tagIdDictionary(dictionary);

		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 10).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "t");
		f.writeInt(TL_TagSetId, 0);

		new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 0)).readRecord(new CramRecord());
	}

	@Test
	public void test_core_bit_encoding() throws IOException {
		SliceFixture f = new SliceFixture();
		f.use(MQ_MappingQuality, new Encoding<Integer>(new HuffmanIntegerCodec(new int[] { 60, 0, 255 }, new int[] {
				1, 2, 2 })));
		writeMapped(f, 10, 1, "a");
		f.writeInt(BF_BamFlags, 0).writeInt(CF_CramFlags, 0);
		f.writeInt(RL_ReadLength, 10).writeInt(AP_AlignmentStart, 1).writeInt(RG_ReadGroup, -1);
		f.writeBytes(RN_ReadName, "b");
		f.writeInt(TL_TagSetId, 0);
		f.writeInt(FN_FeatureCount, 0).writeInt(MQ_MappingQuality, 255);

		Slice slice = f.buildSlice(ON_CHR1, 2, 0);
		// 0 then 11
		assertThat(slice.coreBlock, equalTo(new byte[] { 0x60 }));

		List<CramRecord> records = readAll(new CramRecordReader(f.buildHeader(), slice));
		assertThat(records.get(0).getMappingQuality(), is(60));
		assertThat(records.get(1).getMappingQuality(), nullValue());
	}

	@Test
	public void test_exhausted_slice() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 1, "r");

		CramRecordReader reader = new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 1, 1000));
		CramRecord record = new CramRecord();
		assertThat(reader.readRecord(record), is(1));
		assertThat(record.getId(), is(1000L));
		assertThat(reader.readRecord(record), is(0));
		assertThat(reader.readRecord(record), is(0));
		assertThat(reader.getNextId(), is(1001L));
	}

	@Test
	public void test_iterator() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 1, "a");
		writeMapped(f, 10, 1, "b");

		Iterator<CramRecord> it = new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 2, 42)).iterator();
		List<String> names = new ArrayList<String>();
		List<Long> ids = new ArrayList<Long>();
		while (it.hasNext()) {
			CramRecord record = it.next();
			names.add(record.getReadName());
			ids.add(record.getId());
		}
		assertThat(names.toString(), is("[a, b]"));
		assertThat(ids.toString(), is("[42, 43]"));
	}

	@Test(expected = RuntimeIOException.class)
	public void test_iterator_failure() throws IOException {
		SliceFixture f = new SliceFixture();
		writeMapped(f, 10, 1, "a");

		Iterator<CramRecord> it = new CramRecordReader(f.buildHeader(), f.buildSlice(ON_CHR1, 2, 0)).iterator();
		it.next();
		it.next();
	}

	@Test
	public void test_data_series_keys() {
		for (DataSeries series : DataSeries.values())
			assertThat(DataSeries.byKey(series.getKey()), is(series));
	}
}
