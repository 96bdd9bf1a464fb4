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

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

public class TestSubstitutionMatrix {

	@Test
	public void test_default_matrix() {
		SubstitutionMatrix m = new SubstitutionMatrix();

		// 0x1B = 00 01 10 11: codes follow ACGTN order
		assertThat(m.base((byte) 'A', (byte) 0), is((byte) 'C'));
		assertThat(m.base((byte) 'A', (byte) 1), is((byte) 'G'));
		assertThat(m.base((byte) 'A', (byte) 2), is((byte) 'T'));
		assertThat(m.base((byte) 'A', (byte) 3), is((byte) 'N'));

		assertThat(m.base((byte) 'C', (byte) 0), is((byte) 'A'));
		assertThat(m.base((byte) 'C', (byte) 1), is((byte) 'G'));
		assertThat(m.base((byte) 'N', (byte) 3), is((byte) 'T'));

		assertThat(m.code((byte) 'G', (byte) 'T'), is((byte) 2));
		assertThat(m.getEncodedMatrix(), equalTo(new byte[] { 0x1B, 0x1B, 0x1B, 0x1B, 0x1B }));
	}

	@Test
	public void test_custom_matrix() {
		// A: C=3, G=2, T=1, N=0
		SubstitutionMatrix m = new SubstitutionMatrix(new byte[] { (byte) 0xE4, 0x1B, 0x1B, 0x1B, 0x1B });
		assertThat(m.base((byte) 'A', (byte) 0), is((byte) 'N'));
		assertThat(m.base((byte) 'A', (byte) 3), is((byte) 'C'));
		assertThat(m.code((byte) 'A', (byte) 'G'), is((byte) 2));
		assertThat(m.base((byte) 'C', (byte) 0), is((byte) 'A'));
	}

	@Test
	public void test_lower_case_reference() {
		SubstitutionMatrix m = new SubstitutionMatrix();
		assertThat(m.base((byte) 't', (byte) 0), is((byte) 'A'));
		assertThat(m.code((byte) 'a', (byte) 'c'), is((byte) 0));
	}

	@Test
	public void test_unknown_reference_base() {
		assertThat(new SubstitutionMatrix().base((byte) 'R', (byte) 1), is((byte) 'N'));
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_wrong_size() {
		new SubstitutionMatrix(new byte[4]);
	}
}
