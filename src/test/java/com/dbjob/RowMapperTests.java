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
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.sql.Types;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.dbjob.InMemoryRowCursor.segment;

@ThreadSafe
public class RowMapperTests {
	public record Employee(Long employeeId, String displayName, Boolean active) {}

	public record Account(Long id, long balance) {}

	public record Address(String address1, String postalCode) {}

	public enum Status {
		ACTIVE,
		RETIRED
	}

	public static class Car {
		@DatabaseColumn({"vehicle_color", "colour"})
		private String color;
		private Integer wheelCount;
		private Status status;

		@Nullable
		public String getColor() {
			return this.color;
		}

		public void setColor(@Nullable String color) {
			this.color = color;
		}

		@Nullable
		public Integer getWheelCount() {
			return this.wheelCount;
		}

		public void setWheelCount(@Nullable Integer wheelCount) {
			this.wheelCount = wheelCount;
		}

		@Nullable
		public Status getStatus() {
			return this.status;
		}

		public void setStatus(@Nullable Status status) {
			this.status = status;
		}
	}

	public static class Setting implements Mappable {
		private String key;
		private BigDecimal amount;

		@Nonnull
		@Override
		public List<String> fieldNames() {
			return List.of("key", "amount");
		}

		@Nonnull
		@Override
		public Class<?> fieldType(@Nonnull String fieldName) {
			return "amount".equals(fieldName) ? BigDecimal.class : String.class;
		}

		@Override
		public void setField(@Nonnull String fieldName,
												 @Nullable Object value) {
			if ("key".equals(fieldName))
				this.key = (String) value;
			else
				this.amount = (BigDecimal) value;
		}
	}

	@Test
	public void testRecordWithSnakeCaseColumns() {
		List<Employee> employees = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("EMPLOYEE_ID", "display_name", "active"), new Object[]{7, "Ada", "yes"})), jobContext(), Employee.class);

		Assertions.assertEquals(List.of(new Employee(7L, "Ada", true)), employees);
	}

	@Test
	public void testNumberedSnakeCaseColumn() {
		List<Address> addresses = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("address_1", "postal_code"), new Object[]{"1 Main St", "02134"})), jobContext(), Address.class);

		Assertions.assertEquals(new Address("1 Main St", "02134"), addresses.get(0));
	}

	@Test
	public void testBeanWithDatabaseColumnAlias() {
		List<Car> cars = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("colour", "wheel_count", "status"), new Object[]{"blue", 4L, "RETIRED"})), jobContext(), Car.class);

		Car car = cars.get(0);

		Assertions.assertEquals("blue", car.getColor(), "Alias from @DatabaseColumn was not applied");
		Assertions.assertEquals(4, car.getWheelCount());
		Assertions.assertEquals(Status.RETIRED, car.getStatus());
	}

	@Test
	public void testFirstMatchingColumnWins() {
		List<Car> cars = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("color", "color"), new Object[]{"red", "green"})), jobContext(), Car.class);

		Assertions.assertEquals("red", cars.get(0).getColor());
	}

	@Test
	public void testColumnMapRenameAndConvert() {
		ColumnMap columnMap = ColumnMap.builder()
				.rename("emp_no", "employeeId")
				.rename("full_name", "displayName")
				.convert("full_name", value -> value.toString().toUpperCase(Locale.ROOT))
				.build();

		List<Employee> employees = materializer(columnMap).list(new InMemoryRowCursor(
				segment(List.of("emp_no", "full_name", "active"), new Object[]{3L, "grace", 0})), jobContext(), Employee.class);

		Assertions.assertEquals(new Employee(3L, "GRACE", false), employees.get(0));
	}

	@Test
	public void testMissingColumnsLeaveDefaults() {
		List<Account> accounts = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("id"), new Object[]{1L})), jobContext(), Account.class);

		Assertions.assertEquals(new Account(1L, 0L), accounts.get(0));
	}

	@Test
	public void testNullIntoPrimitive() {
		ColumnTypeMismatchException e = Assertions.assertThrows(ColumnTypeMismatchException.class, () ->
				materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
						segment(List.of("id", "balance"), new Object[]{1L, null})), jobContext(), Account.class));

		Assertions.assertEquals(ErrorKind.MAPPING, e.getErrorKind());
		Assertions.assertEquals("balance", e.getColumnLabel());
		Assertions.assertEquals(long.class, e.getFieldType());
	}

	@Test
	public void testImpossibleConversion() {
		ColumnTypeMismatchException e = Assertions.assertThrows(ColumnTypeMismatchException.class, () ->
				materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
						segment(List.of("id", "balance"), new Object[]{1L, UUID.randomUUID()})), jobContext(), Account.class));

		Assertions.assertEquals("balance", e.getFieldName());
	}

	@Test
	public void testCustomColumnConverter() {
		ColumnConverter yenConverter = new ColumnConverter() {
			@Nonnull
			@Override
			public ConversionResult convert(@Nonnull JobContext jobContext,
																			@Nonnull DbColumn column,
																			@Nonnull Object value,
																			@Nonnull Class<?> targetType) {
				if (!"amount".equals(column.getName()))
					return ConversionResult.fallback();

				return ConversionResult.of(new BigDecimal(value.toString().replace("¥", "")));
			}

			@Nonnull
			@Override
			public Boolean appliesTo(@Nonnull Class<?> targetType) {
				return BigDecimal.class.equals(targetType);
			}
		};

		ResultMaterializer resultMaterializer = new ResultMaterializer(RowMapper.withColumnConverters(List.of(yenConverter)).build(),
				new InstanceProvider() {}, ColumnMap.empty(), CancellationToken.none());

		List<Setting> settings = resultMaterializer.list(new InMemoryRowCursor(
				segment(List.of("key", "amount"), new Object[]{"limit", "¥1500"})), jobContext(), Setting.class);

		Assertions.assertEquals("limit", settings.get(0).key, "Mappable field was not populated");
		Assertions.assertEquals(new BigDecimal("1500"), settings.get(0).amount);
	}

	@Test
	public void testScalarCoercion() {
		List<Long> values = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("total"), new Object[]{42}, new Object[]{new BigDecimal("43")}, new Object[]{null})), jobContext(), Long.class);

		Assertions.assertEquals(3, values.size());
		Assertions.assertEquals(42L, values.get(0));
		Assertions.assertEquals(43L, values.get(1));
		Assertions.assertNull(values.get(2));
	}

	@Test
	public void testNarrowingConversionsFailInsteadOfTruncating() {
		ColumnTypeMismatchException overflow = Assertions.assertThrows(ColumnTypeMismatchException.class, () ->
				materializer(ColumnMap.empty()).scalar(new InMemoryRowCursor(
						segment(List.of("total"), new Object[]{5_000_000_000L})), jobContext(), Integer.class));

		Assertions.assertEquals(ErrorKind.MAPPING, overflow.getErrorKind());
		Assertions.assertTrue(overflow.getCause() instanceof ArithmeticException, "Overflow should be reported, not truncated");

		Assertions.assertThrows(ColumnTypeMismatchException.class, () ->
				materializer(ColumnMap.empty()).scalar(new InMemoryRowCursor(
						segment(List.of("total"), new Object[]{300L})), jobContext(), Byte.class));

		Assertions.assertThrows(ColumnTypeMismatchException.class, () ->
				materializer(ColumnMap.empty()).scalar(new InMemoryRowCursor(
						segment(List.of("total"), new Object[]{2.9d})), jobContext(), Integer.class));

		// Values that fit still convert
		Assertions.assertEquals(Optional.of((byte) 127), materializer(ColumnMap.empty()).scalar(new InMemoryRowCursor(
				segment(List.of("total"), new Object[]{127L})), jobContext(), Byte.class));
		Assertions.assertEquals(Optional.of(3), materializer(ColumnMap.empty()).scalar(new InMemoryRowCursor(
				segment(List.of("total"), new Object[]{new BigDecimal("3.00")})), jobContext(), Integer.class));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testMapKeepsLastDuplicate() {
		List<Map> rows = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("id", "name", "name"), new Object[]{1L, "first", "second"})), jobContext(), Map.class);

		Map<String, Object> row = rows.get(0);

		Assertions.assertEquals(2, row.size());
		Assertions.assertEquals("second", row.get("name"));
	}

	@Test
	public void testDbRowTarget() {
		List<DbRow> rows = materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
				segment(List.of("id", "name"), new Object[]{1L, "a"})), jobContext(), DbRow.class);

		Assertions.assertEquals(new DbValue.TextValue("a"), rows.get(0).get(1));
	}

	@Test
	public void testUnsupportedTargets() {
		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () ->
				materializer(ColumnMap.empty()).list(new InMemoryRowCursor(
						segment(List.of("id"), new Object[]{1L})), jobContext(), Runnable.class));

		Assertions.assertEquals(ErrorKind.MAPPING, e.getErrorKind());
	}

	@Test
	public void testPlanCacheReusesPlans() {
		RowMapper rowMapper = RowMapper.withPlanCacheCapacity(16).build();
		List<DbColumn> columns = List.of(new DbColumn(0, "id", Types.BIGINT, null, null),
				new DbColumn(1, "display_name", Types.VARCHAR, null, null));

		MappingPlan<Employee> first = rowMapper.planFor(columns, Employee.class, ColumnMap.empty());
		MappingPlan<Employee> second = rowMapper.planFor(List.copyOf(columns), Employee.class, ColumnMap.empty());
		MappingPlan<Employee> renamed = rowMapper.planFor(columns, Employee.class, ColumnMap.builder().rename("id", "employeeId").build());

		Assertions.assertSame(first, second, "Same shape should reuse the cached plan");
		Assertions.assertNotSame(first, renamed, "A different column map needs its own plan");
	}

	@Nonnull
	protected ResultMaterializer materializer(@Nonnull ColumnMap columnMap) {
		return new ResultMaterializer(RowMapper.withDefaultConfiguration(), new InstanceProvider() {}, columnMap, CancellationToken.none());
	}

	@Nonnull
	protected JobContext jobContext() {
		return JobContext.with(1L, "SELECT 1", ZoneId.of("UTC")).build();
	}
}
