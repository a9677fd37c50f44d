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
import java.time.ZoneId;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.dbjob.InMemoryRowCursor.segment;

@ThreadSafe
public class ResultMaterializerTests {
	public record Product(Long id, String name) {}

	public record Order(Long id, Long productId, Integer quantity) {}

	public record Customer(Long id, String email) {}

	@Test
	public void testListAndFirstAgreeOnFirstElement() {
		InMemoryRowCursor.Segment products = segment(List.of("id", "name"),
				new Object[]{1L, "Widget"}, new Object[]{2L, "Gadget"});

		List<Product> list = materializer().list(new InMemoryRowCursor(products), jobContext(), Product.class);
		Product first = materializer().first(new InMemoryRowCursor(products), jobContext(), Product.class);

		Assertions.assertEquals(2, list.size(), "Wrong number of rows");
		Assertions.assertEquals(list.get(0), first, "list and first disagree on the first row");
	}

	@Test
	public void testFirstOnEmptySegment() {
		InMemoryRowCursor.Segment empty = segment(List.of("id", "name"));

		Assertions.assertThrows(EmptyResultException.class,
				() -> materializer().first(new InMemoryRowCursor(empty), jobContext(), Product.class));
		Assertions.assertEquals(Optional.empty(),
				materializer().firstOrDefault(new InMemoryRowCursor(empty), jobContext(), Product.class));
	}

	@Test
	public void testFirstWithNoSegments() {
		Assertions.assertThrows(EmptyResultException.class,
				() -> materializer().first(new InMemoryRowCursor(), jobContext(), Product.class));
		Assertions.assertTrue(materializer().scalar(new InMemoryRowCursor(), jobContext(), Long.class).isEmpty());
	}

	@Test
	public void testSingleCardinality() {
		InMemoryRowCursor.Segment none = segment(List.of("id", "name"));
		InMemoryRowCursor.Segment one = segment(List.of("id", "name"), new Object[]{1L, "Widget"});
		InMemoryRowCursor.Segment two = segment(List.of("id", "name"), new Object[]{1L, "Widget"}, new Object[]{2L, "Gadget"});

		Assertions.assertEquals(new Product(1L, "Widget"),
				materializer().single(new InMemoryRowCursor(one), jobContext(), Product.class));

		DatabaseException empty = Assertions.assertThrows(EmptyResultException.class,
				() -> materializer().single(new InMemoryRowCursor(none), jobContext(), Product.class));
		Assertions.assertEquals(ErrorKind.CARDINALITY, empty.getErrorKind());

		DatabaseException multiple = Assertions.assertThrows(MultipleRowsFoundException.class,
				() -> materializer().single(new InMemoryRowCursor(two), jobContext(), Product.class));
		Assertions.assertEquals(ErrorKind.CARDINALITY, multiple.getErrorKind());

		Assertions.assertTrue(materializer().singleOrDefault(new InMemoryRowCursor(none), jobContext(), Product.class).isEmpty());
		Assertions.assertThrows(MultipleRowsFoundException.class,
				() -> materializer().singleOrDefault(new InMemoryRowCursor(two), jobContext(), Product.class));
	}

	@Test
	public void testTwoSegmentsIntoTwoAndThreeSlots() {
		InMemoryRowCursor.Segment products = segment(List.of("id", "name"), new Object[]{1L, "Widget"});
		InMemoryRowCursor.Segment orders = segment(List.of("id", "product_id", "quantity"),
				new Object[]{10L, 1L, 3}, new Object[]{11L, 1L, 5});

		ResultSlot<Product> productSlot = ResultSlot.of(Product.class);
		ResultSlot<Order> orderSlot = ResultSlot.of(Order.class);
		ResultSlot<Customer> customerSlot = ResultSlot.of(Customer.class);

		MultiResult pair = materializer().multiple(new InMemoryRowCursor(products, orders), jobContext(), List.of(productSlot, orderSlot));

		Assertions.assertEquals(List.of(new Product(1L, "Widget")), pair.get(productSlot));
		Assertions.assertEquals(List.of(new Order(10L, 1L, 3), new Order(11L, 1L, 5)), pair.get(orderSlot),
				"Snake-case column should map to camel-case component");

		MultiResult triple = materializer().multiple(new InMemoryRowCursor(products, orders), jobContext(),
				List.of(productSlot, orderSlot, customerSlot));

		Assertions.assertEquals(3, triple.size());
		Assertions.assertEquals(2, triple.get(1, Order.class).size());
		Assertions.assertEquals(List.of(), triple.get(customerSlot), "Missing segment should yield an empty slot");
	}

	@Test
	public void testExtraSegmentsAreIgnored() {
		InMemoryRowCursor.Segment products = segment(List.of("id", "name"), new Object[]{1L, "Widget"});
		InMemoryRowCursor.Segment customers = segment(List.of("id", "email"), new Object[]{7L, "a@example.com"});

		ResultSlot<Product> productSlot = ResultSlot.of(Product.class);
		MultiResult multiResult = materializer().multiple(new InMemoryRowCursor(products, customers), jobContext(), List.of(productSlot));

		Assertions.assertEquals(1, multiResult.size());
		Assertions.assertEquals(1, multiResult.get(productSlot).size());
	}

	@Test
	public void testRequiredSlotWithoutSegment() {
		InMemoryRowCursor.Segment products = segment(List.of("id", "name"), new Object[]{1L, "Widget"});

		Assertions.assertThrows(EmptyResultException.class, () -> materializer().multiple(new InMemoryRowCursor(products), jobContext(),
				List.of(ResultSlot.of(Product.class), ResultSlot.required(Customer.class))));
	}

	@Test
	public void testSlotCountLimits() {
		List<ResultSlot<?>> tooMany = List.of(ResultSlot.of(Product.class), ResultSlot.of(Product.class), ResultSlot.of(Product.class),
				ResultSlot.of(Product.class), ResultSlot.of(Product.class), ResultSlot.of(Product.class), ResultSlot.of(Product.class),
				ResultSlot.of(Product.class), ResultSlot.of(Product.class));

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> materializer().multiple(new InMemoryRowCursor(), jobContext(), tooMany));
		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
	}

	@Test
	public void testCancellationDuringMultiResultIsNotFatal() {
		CancellationToken cancellationToken = CancellationToken.create();
		InMemoryRowCursor rowCursor = new InMemoryRowCursor(
				segment(List.of("id", "name"), new Object[]{1L, "Widget"}, new Object[]{2L, "Gadget"}, new Object[]{3L, "Gizmo"}),
				segment(List.of("id", "product_id", "quantity"), new Object[]{10L, 1L, 3}))
				.cancelAfterRows(cancellationToken, 2);

		ResultSlot<Product> productSlot = ResultSlot.of(Product.class);
		ResultSlot<Order> orderSlot = ResultSlot.of(Order.class);

		MultiResult multiResult = Assertions.assertDoesNotThrow(() ->
				materializer(cancellationToken).multiple(rowCursor, jobContext(), List.of(productSlot, orderSlot)));

		Assertions.assertEquals(2, multiResult.get(productSlot).size(), "Rows read before cancellation should be kept");
		Assertions.assertEquals(List.of(), multiResult.get(orderSlot), "Slots after cancellation should be empty");
	}

	@Test
	public void testCanceledFirstDoesNotThrow() {
		CancellationToken cancellationToken = CancellationToken.create();
		cancellationToken.cancel();

		Product product = Assertions.assertDoesNotThrow(() -> materializer(cancellationToken)
				.first(new InMemoryRowCursor(segment(List.of("id", "name"))), jobContext(), Product.class));

		Assertions.assertNull(product);
	}

	@Test
	public void testTableRoundTripKeepsSchemaAndDuplicates() {
		InMemoryRowCursor.Segment segment = segment(List.of("id", "name", "name"),
				new Object[]{1L, "first", "second"}, new Object[]{2, null, "x"});

		DbTable table = materializer().table(new InMemoryRowCursor(segment), jobContext());

		Assertions.assertEquals(List.of("id", "name", "name"), table.getColumns().stream().map(DbColumn::getName).toList());
		Assertions.assertEquals(2, table.getRowCount());

		DbRow firstRow = table.getRows().get(0);
		Assertions.assertEquals(new DbValue.TextValue("first"), firstRow.get(1));
		Assertions.assertEquals(new DbValue.TextValue("second"), firstRow.get(2));
		Assertions.assertEquals(Optional.of(new DbValue.TextValue("first")), firstRow.get("NAME"), "Name lookup should find the first match");

		DbRow secondRow = table.getRows().get(1);
		Assertions.assertEquals(new DbValue.IntegerValue(2L), secondRow.get(0));
		Assertions.assertTrue(secondRow.get(1).isNull());
	}

	@Test
	public void testTableSetReadsEverySegment() {
		DbTableSet tableSet = materializer().tableSet(new InMemoryRowCursor(
				segment(List.of("a"), new Object[]{1}),
				segment(List.of("b", "c")),
				segment(List.of("d"), new Object[]{"x"}, new Object[]{"y"})), jobContext());

		Assertions.assertEquals(3, tableSet.size());
		Assertions.assertEquals(0, tableSet.getTable(1).getRowCount());
		Assertions.assertEquals(2, tableSet.getTable(1).getColumns().size());
		Assertions.assertEquals(2, tableSet.getTable(2).getRowCount());
	}

	@Test
	public void testLazySequenceCompletesOnExhaustion() {
		AtomicInteger completions = new AtomicInteger();
		AtomicReference<DatabaseException> completionFailure = new AtomicReference<>();

		RowSequence<Product> rowSequence = materializer().lazy(new InMemoryRowCursor(
						segment(List.of("id", "name"), new Object[]{1L, "Widget"}, new Object[]{2L, "Gadget"})), jobContext(), Product.class,
				failure -> {
					completions.incrementAndGet();
					completionFailure.set(failure);
				});

		Assertions.assertTrue(rowSequence.isLazy());
		Assertions.assertEquals(0, completions.get(), "Completion must wait for the consumer");
		Assertions.assertEquals(2, rowSequence.toList().size());
		Assertions.assertEquals(1, completions.get(), "Completion should happen exactly once");
		Assertions.assertNull(completionFailure.get());
	}

	@Test
	public void testLazySequenceAfterCloseIsDisposed() {
		AtomicInteger completions = new AtomicInteger();

		RowSequence<Product> rowSequence = materializer().lazy(new InMemoryRowCursor(
						segment(List.of("id", "name"), new Object[]{1L, "Widget"}, new Object[]{2L, "Gadget"})), jobContext(), Product.class,
				failure -> completions.incrementAndGet());

		Iterator<Product> iterator = rowSequence.iterator();
		Assertions.assertEquals(new Product(1L, "Widget"), iterator.next());

		rowSequence.close();
		rowSequence.close();

		Assertions.assertEquals(1, completions.get());
		Assertions.assertThrows(CursorDisposedException.class, iterator::hasNext);
		Assertions.assertThrows(IllegalStateException.class, rowSequence::iterator, "Sequences are single-pass");
	}

	@Test
	public void testLazySequenceMappingFailureCompletesWithFailure() {
		AtomicReference<DatabaseException> completionFailure = new AtomicReference<>();

		RowSequence<Order> rowSequence = materializer().lazy(new InMemoryRowCursor(
						segment(List.of("id", "product_id", "quantity"), new Object[]{1L, 1L, "many"})), jobContext(), Order.class,
				completionFailure::set);

		ColumnTypeMismatchException e = Assertions.assertThrows(ColumnTypeMismatchException.class, () -> rowSequence.iterator().hasNext());
		Assertions.assertSame(e, completionFailure.get());
	}

	@Nonnull
	protected ResultMaterializer materializer() {
		return materializer(CancellationToken.none());
	}

	@Nonnull
	protected ResultMaterializer materializer(@Nonnull CancellationToken cancellationToken) {
		return new ResultMaterializer(RowMapper.withDefaultConfiguration(), new InstanceProvider() {}, ColumnMap.empty(), cancellationToken);
	}

	@Nonnull
	protected JobContext jobContext() {
		return JobContext.with(1L, "SELECT 1", ZoneId.of("UTC")).build();
	}
}
