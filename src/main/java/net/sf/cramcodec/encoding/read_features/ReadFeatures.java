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
package net.sf.cramcodec.encoding.read_features;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;

import java.util.ArrayList;
import java.util.List;

public class ReadFeatures {

	/**
	 * Builds the alignment of a read from its features. Read bases not
	 * covered by any feature are matches.
	 * 
	 * @param features
	 *            features in read order
	 * @param readLength
	 *            number of bases in the read
	 */
	public static Cigar toCigar(List<ReadFeature> features, int readLength) {
		List<CigarElement> elements = new ArrayList<CigarElement>();
		if (features == null || features.isEmpty()) {
			if (readLength > 0)
				elements.add(new CigarElement(readLength, CigarOperator.M));
			return new Cigar(elements);
		}

		// 1-based position of the next read base not yet in the cigar:
		int readPos = 1;
		for (ReadFeature feature : features) {
			int gap = feature.getPosition() - readPos;
			if (gap > 0) {
				add(elements, CigarOperator.M, gap);
				readPos += gap;
			}

			switch (feature.getOperator()) {
			case ReadBase.operator:
			case Substitution.operator:
				add(elements, CigarOperator.M, 1);
				readPos++;
				break;
			case Bases.operator:
				int basesLength = ((Bases) feature).getBases().length;
				add(elements, CigarOperator.M, basesLength);
				readPos += basesLength;
				break;
			case Insertion.operator:
				int insertionLength = ((Insertion) feature).getSequence().length;
				add(elements, CigarOperator.I, insertionLength);
				readPos += insertionLength;
				break;
			case InsertBase.operator:
				add(elements, CigarOperator.I, 1);
				readPos++;
				break;
			case SoftClip.operator:
				int clipLength = ((SoftClip) feature).getSequence().length;
				add(elements, CigarOperator.S, clipLength);
				readPos += clipLength;
				break;
			case Deletion.operator:
				add(elements, CigarOperator.D, ((Deletion) feature).getLength());
				break;
			case RefSkip.operator:
				add(elements, CigarOperator.N, ((RefSkip) feature).getLength());
				break;
			case Padding.operator:
				add(elements, CigarOperator.P, ((Padding) feature).getLength());
				break;
			case HardClip.operator:
				add(elements, CigarOperator.H, ((HardClip) feature).getLength());
				break;
			case Scores.operator:
			case BaseQualityScore.operator:
				break;

			default:
				throw new IllegalArgumentException("Unknown read feature: " + feature);
			}
		}

		if (readPos <= readLength)
			add(elements, CigarOperator.M, readLength - readPos + 1);

		return new Cigar(elements);
	}

	/**
	 * @return number of reference bases the features and the read span
	 */
	public static int getReferenceLength(List<ReadFeature> features, int readLength) {
		return toCigar(features, readLength).getReferenceLength();
	}

	private static void add(List<CigarElement> elements, CigarOperator operator, int length) {
		if (length == 0)
			return;

		if (!elements.isEmpty()) {
			CigarElement last = elements.get(elements.size() - 1);
			if (last.getOperator() == operator) {
				elements.set(elements.size() - 1, new CigarElement(last.getLength() + length, operator));
				return;
			}
		}
		elements.add(new CigarElement(length, operator));
	}
}
