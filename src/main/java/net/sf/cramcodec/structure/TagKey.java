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
 * A two character tag name with its one character BAM value type. The
 * content id of the tag's encoding is the three characters packed into an
 * int.
 */
public class TagKey {
	private final String tag;
	private final char type;

	public TagKey(String tag, char type) {
		if (tag == null || tag.length() != 2)
			throw new IllegalArgumentException("Tag name must be two characters: " + tag);
		this.tag = tag;
		this.type = type;
	}

	public static TagKey fromContentId(int contentId) {
		char c0 = (char) ((contentId >> 16) & 0xFF);
		char c1 = (char) ((contentId >> 8) & 0xFF);
		char type = (char) (contentId & 0xFF);
		return new TagKey(new String(new char[] { c0, c1 }), type);
	}

	/**
	 * @param bytes
	 *            three bytes: the tag name followed by the type
	 */
	public static TagKey fromBytes(byte[] bytes, int offset) {
		return new TagKey(new String(new char[] { (char) (bytes[offset] & 0xFF), (char) (bytes[offset + 1] & 0xFF) }),
				(char) (bytes[offset + 2] & 0xFF));
	}

	public String getTag() {
		return tag;
	}

	public char getType() {
		return type;
	}

	public int getContentId() {
		return (tag.charAt(0) & 0xFF) << 16 | (tag.charAt(1) & 0xFF) << 8 | (type & 0xFF);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TagKey))
			return false;
		TagKey k = (TagKey) obj;
		return type == k.type && tag.equals(k.tag);
	}

	@Override
	public int hashCode() {
		return getContentId();
	}

	@Override
	public String toString() {
		return tag + ":" + type;
	}
}
