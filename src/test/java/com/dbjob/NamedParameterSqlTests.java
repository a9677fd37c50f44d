/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dbjob;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Types;
import java.util.List;
import java.util.stream.Collectors;

@ThreadSafe
public class NamedParameterSqlTests {
	@Test
	public void testPositionalPlaceholdersAreRejected() {
		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> NamedParameterSql.parse("SELECT * FROM car WHERE id = ?"));

		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
	}

	@Test
	public void testPlaceholdersInsideLiteralsAndCommentsAreIgnored() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse(
				"SELECT ':not_a_param', \"col:umn\", x::text -- :comment ?\n FROM t /* :block ? */ WHERE a = :a AND b = ':b'");

		Assertions.assertEquals(List.of("a"), namedParameterSql.getDistinctParameterNames());

		NamedParameterSql.Expansion expansion = namedParameterSql.expand(new JobParameters().add("a", 1));

		Assertions.assertTrue(expansion.getSql().endsWith("WHERE a = ? AND b = ':b'"), expansion.getSql());
		Assertions.assertTrue(expansion.getSql().contains("x::text"), "Casts must survive expansion");
		Assertions.assertEquals(1, expansion.getValues().size());
	}

	@Test
	public void testRepeatedPlaceholders() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse("SELECT * FROM t WHERE a = :id OR b = :ID OR c = :other");

		Assertions.assertEquals(List.of("id", "other"), namedParameterSql.getDistinctParameterNames());

		NamedParameterSql.Expansion expansion = namedParameterSql.expand(new JobParameters().add("id", 7).add("other", "x"));

		Assertions.assertEquals("SELECT * FROM t WHERE a = ? OR b = ? OR c = ?", expansion.getSql());
		Assertions.assertEquals(List.of(7, 7, "x"), expansion.getValues().stream()
				.map(NamedParameterSql.PositionalValue::getValue)
				.collect(Collectors.toList()));
	}

	@Test
	public void testInListExpansion() {
		NamedParameterSql.Expansion expansion = NamedParameterSql.parse("SELECT * FROM t WHERE id IN (:ids) AND kind = :kind")
				.expand(new JobParameters()
						.add("ids", Parameters.inList(new long[]{1L, 2L, 3L}))
						.add("kind", "car"));

		Assertions.assertEquals("SELECT * FROM t WHERE id IN (?, ?, ?) AND kind = ?", expansion.getSql());
		Assertions.assertEquals(4, expansion.getValues().size());
	}

	@Test
	public void testEmptyInList() {
		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () ->
				NamedParameterSql.parse("SELECT * FROM t WHERE id IN (:ids)")
						.expand(new JobParameters().add("ids", Parameters.inList(List.of()))));

		Assertions.assertEquals(ErrorKind.PARAMETER_BINDING, e.getErrorKind());
	}

	@Test
	public void testMissingParameters() {
		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () ->
				NamedParameterSql.parse("SELECT * FROM t WHERE a = :a AND b = :b")
						.expand(new JobParameters().add("a", 1)));

		Assertions.assertEquals(ErrorKind.PARAMETER_BINDING, e.getErrorKind());
		Assertions.assertTrue(e.getMessage().contains("[b]"), e.getMessage());
	}

	@Test
	public void testOutputParametersAreRejectedInText() {
		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () ->
				NamedParameterSql.parse("SELECT :out")
						.expand(new JobParameters().addOutput("out", Types.INTEGER)));

		Assertions.assertEquals(ErrorKind.PARAMETER_BINDING, e.getErrorKind());
	}
}
