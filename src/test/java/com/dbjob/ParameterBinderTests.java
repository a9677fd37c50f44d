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

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@ThreadSafe
public class ParameterBinderTests {
	public record Person(Long id, String name, Optional<String> nickname) {}

	public static class Ticket {
		@Nonnull
		public Long getTicketId() {
			return 99L;
		}

		@Nonnull
		public String getTitle() {
			return "Broken build";
		}
	}

	@Test
	public void testMapSource() {
		Map<String, Object> source = new LinkedHashMap<>();
		source.put("id", 1L);
		source.put("name", null);

		JobParameters parameters = ParameterBinder.bind(source, BindingRestrictions.none());

		Assertions.assertEquals(2, parameters.size());
		Assertions.assertEquals(Optional.of(1L), parameters.getValue("ID"), "Lookup should ignore case");
		Assertions.assertTrue(parameters.contains("name"));
		Assertions.assertEquals(Optional.empty(), parameters.getValue("name"));
	}

	@Test
	public void testRecordSource() {
		JobParameters parameters = ParameterBinder.bind(new Person(5L, "Ada", Optional.empty()), BindingRestrictions.none());

		Assertions.assertEquals(List.of("id", "name", "nickname"), parameters.asList().stream().map(JobParameter::getName).toList());
		Assertions.assertEquals(Optional.of("Ada"), parameters.getValue("name"));
		Assertions.assertEquals(Optional.empty(), parameters.getValue("nickname"), "Optional values should be unwrapped");
	}

	@Test
	public void testBeanSource() {
		JobParameters parameters = ParameterBinder.bind(new Ticket(), BindingRestrictions.none());

		Assertions.assertEquals(Set.of("ticketId", "title"), parameters.asList().stream().map(JobParameter::getName).collect(Collectors.toSet()));
		Assertions.assertEquals(Optional.of(99L), parameters.getValue("ticketId"));
	}

	@Test
	public void testRestrictions() {
		BindingRestrictions excludeName = BindingRestrictions.builder().exclude("NAME").build();
		JobParameters excluded = ParameterBinder.bind(new Person(5L, "Ada", Optional.of("A")), excludeName);

		Assertions.assertFalse(excluded.contains("name"));
		Assertions.assertEquals(2, excluded.size());

		BindingRestrictions decorated = BindingRestrictions.builder().includeOnly("id").prefix("p_").suffix("_v").build();
		JobParameters included = ParameterBinder.bind(new Person(5L, "Ada", Optional.of("A")), decorated);

		Assertions.assertEquals(1, included.size());
		Assertions.assertEquals(Optional.of(5L), included.getValue("p_id_v"));
	}

	@Test
	public void testFlatValueBindsToSinglePlaceholder() {
		JobParameters parameters = ParameterBinder.bind(42, BindingRestrictions.none(), List.of("id"));

		Assertions.assertEquals(Optional.of(42), parameters.getValue("id"));

		UnsupportedParameterShapeException e = Assertions.assertThrows(UnsupportedParameterShapeException.class,
				() -> ParameterBinder.bind(42, BindingRestrictions.none(), List.of("id", "name")));

		Assertions.assertEquals(ErrorKind.PARAMETER_BINDING, e.getErrorKind());
		Assertions.assertEquals(Integer.class, e.getSourceType());
	}

	@Test
	public void testSequencesAreRejected() {
		Assertions.assertThrows(UnsupportedParameterShapeException.class,
				() -> ParameterBinder.bind(List.of(1, 2, 3), BindingRestrictions.none(), List.of("ids")));
		Assertions.assertThrows(UnsupportedParameterShapeException.class,
				() -> ParameterBinder.bind(new int[]{1, 2}, BindingRestrictions.none(), List.of("ids")));
		Assertions.assertThrows(UnsupportedParameterShapeException.class,
				() -> ParameterBinder.bind(Stream.of(1), BindingRestrictions.none()));
	}

	@Test
	public void testInListBindsAsNamedValue() {
		JobParameters parameters = ParameterBinder.bind(Map.of("ids", Parameters.inList(List.of(1, 2))), BindingRestrictions.none());

		Assertions.assertTrue(parameters.getValue("ids").orElseThrow() instanceof InListParameter);
	}

	@Test
	public void testDuplicateNames() {
		Map<String, Object> source = new LinkedHashMap<>();
		source.put("id", 1);
		source.put("ID", 2);

		DuplicateParameterNameException e = Assertions.assertThrows(DuplicateParameterNameException.class,
				() -> ParameterBinder.bind(source, BindingRestrictions.none()));

		Assertions.assertEquals("ID", e.getParameterName());
	}

	@Test
	public void testJobParametersInstancesAreKept() {
		JobParameters source = new JobParameters()
				.add("a", 21)
				.addOutput("b", Types.INTEGER);

		JobParameters bound = ParameterBinder.bind(source, BindingRestrictions.none());

		Assertions.assertSame(source.get("b").orElseThrow(), bound.get("b").orElseThrow(),
				"Output parameters must stay the caller's instances");
	}

	@Test
	public void testRenamedOutputParametersWriteBackToCaller() {
		JobParameters source = new JobParameters()
				.addOutput("total", Types.INTEGER);

		JobParameters bound = ParameterBinder.bind(source, BindingRestrictions.builder().prefix("p_").build());
		JobParameter renamed = bound.get("p_total").orElseThrow();

		Assertions.assertNotSame(source.get("total").orElseThrow(), renamed);

		// What the command does once the procedure call returns
		renamed.setValue(7);

		Assertions.assertEquals(Optional.of(7), source.getValue("total"), "Output value did not reach the caller's parameter");
	}

	@Test
	public void testNullSourceBindsNothing() {
		Assertions.assertTrue(ParameterBinder.bind(null, BindingRestrictions.none()).isEmpty());
		Assertions.assertTrue(ParameterBinder.bind(Optional.empty(), BindingRestrictions.none()).isEmpty());
	}
}
