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

/**
 * Which reference sequences the records of a slice are placed on.
 */
public class ReferenceSequenceContext {
	public static final int MULTIPLE_REFERENCES_ID = -2;
	public static final int UNMAPPED_ID = -1;

	public enum Kind {
		/**
		 * All records are on one reference sequence.
		 */
		SOME,
		/**
		 * All records are unplaced.
		 */
		NONE,
		/**
		 * Each record carries its own reference sequence id.
		 */
		MANY
	}

	private static final ReferenceSequenceContext NONE = new ReferenceSequenceContext(Kind.NONE, UNMAPPED_ID, 0, 0);
	private static final ReferenceSequenceContext MANY = new ReferenceSequenceContext(Kind.MANY,
			MULTIPLE_REFERENCES_ID, 0, 0);

	private final Kind kind;
	private final int referenceSequenceId;
	private final int alignmentStart;
	private final int alignmentSpan;

	private ReferenceSequenceContext(Kind kind, int referenceSequenceId, int alignmentStart, int alignmentSpan) {
		this.kind = kind;
		this.referenceSequenceId = referenceSequenceId;
		this.alignmentStart = alignmentStart;
		this.alignmentSpan = alignmentSpan;
	}

	public static ReferenceSequenceContext some(int referenceSequenceId, int alignmentStart, int alignmentSpan) {
		if (referenceSequenceId < 0)
			throw new IllegalArgumentException("Reference sequence id must not be negative: " + referenceSequenceId);
		return new ReferenceSequenceContext(Kind.SOME, referenceSequenceId, alignmentStart, alignmentSpan);
	}

	public static ReferenceSequenceContext none() {
		return NONE;
	}

	public static ReferenceSequenceContext many() {
		return MANY;
	}

	/**
	 * Maps the fields of a slice header: id -2 is many references, -1 is
	 * unmapped, anything else a single reference.
	 */
	public static ReferenceSequenceContext fromSliceHeader(int referenceSequenceId, int alignmentStart,
			int alignmentSpan) {
		switch (referenceSequenceId) {
		case MULTIPLE_REFERENCES_ID:
			return MANY;
		case UNMAPPED_ID:
			return NONE;
		default:
			return some(referenceSequenceId, alignmentStart, alignmentSpan);
		}
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the reference id for {@link Kind#SOME}, otherwise -1 or -2
	 */
	public int getReferenceSequenceId() {
		return referenceSequenceId;
	}

	public int getAlignmentStart() {
		return alignmentStart;
	}

	public int getAlignmentSpan() {
		return alignmentSpan;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ReferenceSequenceContext))
			return false;
		ReferenceSequenceContext c = (ReferenceSequenceContext) obj;
		return kind == c.kind && referenceSequenceId == c.referenceSequenceId && alignmentStart == c.alignmentStart
				&& alignmentSpan == c.alignmentSpan;
	}

	@Override
	public int hashCode() {
		int result = kind.hashCode();
		result = 31 * result + referenceSequenceId;
		result = 31 * result + alignmentStart;
		return 31 * result + alignmentSpan;
	}

	@Override
	public String toString() {
		if (kind == Kind.SOME)
			return String.format("SOME(%d, %d, %d)", referenceSequenceId, alignmentStart, alignmentSpan);
		return kind.name();
	}
}
