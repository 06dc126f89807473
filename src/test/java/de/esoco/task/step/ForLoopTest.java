//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
// This file is a part of the 'task-builder' project.
// Copyright 2018 Elmar Sonnenschein, esoco GmbH, Flensburg, Germany
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//	  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
package de.esoco.task.step;

import de.esoco.task.ManualAwaitable;
import de.esoco.task.Tasks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;


/********************************************************************
 * Test of {@link ForLoop}.
 *
 * @author eso
 */
public class ForLoopTest
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Test that an iterator that is {@link AutoCloseable} is closed after the
	 * loop.
	 */
	@Test
	public void testCloseableIterator()
	{
		AtomicBoolean aClosed = new AtomicBoolean(false);
		List<String>  aSeen   = new ArrayList<>();

		Iterable<String> rSequence =
			() -> new CloseableIterator(aClosed, "a", "b");

		CompletableFuture<Void> fResult =
			Tasks.task(
				b ->
					b.forLoop(
						rSequence,
						s ->
						{
							aSeen.add(s);

							return b.zero();
						}));

		assertTrue(fResult.isDone());
		assertEquals(Arrays.asList("a", "b"), aSeen);
		assertTrue(aClosed.get());
	}

	/***************************************
	 * Test of a loop where every element is awaited, summing the results.
	 */
	@Test
	public void testSuspendingLoop()
	{
		List<ManualAwaitable<Integer>> aPending  = new ArrayList<>();
		AtomicInteger				   aSum		 = new AtomicInteger();
		AtomicInteger				   aHasNext  = new AtomicInteger();
		List<Integer>				   rElements = Arrays.asList(1, 2, 3);

		Iterable<Integer> rCounting =
			() -> new Iterator<Integer>()
			{
				Iterator<Integer> rIterator = rElements.iterator();

				@Override
				public boolean hasNext()
				{
					aHasNext.incrementAndGet();

					return rIterator.hasNext();
				}

				@Override
				public Integer next()
				{
					return rIterator.next();
				}
			};

		CompletableFuture<Integer> fResult =
			Tasks.task(
				b ->
					b.combine(
						b.forLoop(
							rCounting,
							i ->
								b.bind(
									ManualAwaitable.<Integer>pending(aPending),
									v ->
									{
										aSum.addAndGet(v);

										return b.zero();
									})),
						() -> b.ret(aSum.get())));

		for (int i = 0; i < rElements.size(); i++)
		{
			assertFalse(fResult.isDone());
			assertEquals(i + 1, aPending.size());
			aPending.get(i).complete(rElements.get(i));
		}

		assertEquals(6, fResult.join());
		assertEquals(4, aHasNext.get());
	}

	/***************************************
	 * Test of a large sequence that is processed without suspensions.
	 */
	@Test
	public void testLargeSequence()
	{
		List<Integer> aElements = new ArrayList<>();
		AtomicInteger aSum	    = new AtomicInteger();

		for (int i = 1; i <= 10_000; i++)
		{
			aElements.add(i);
		}

		CompletableFuture<Integer> fResult =
			Tasks.task(
				b ->
					b.combine(
						b.forLoop(
							aElements,
							i ->
								b.bind(
									ManualAwaitable.completed(i),
									v ->
									{
										aSum.addAndGet(v);

										return b.zero();
									})),
						() -> b.ret(aSum.get())));

		assertTrue(fResult.isDone());
		assertEquals(50_005_000, fResult.join());
	}

	/***************************************
	 * Test that a stream is closed after the loop.
	 */
	@Test
	public void testStream()
	{
		AtomicBoolean aClosed = new AtomicBoolean(false);
		List<Integer> aSeen   = new ArrayList<>();

		CompletableFuture<Void> fResult =
			Tasks.task(
				b ->
					b.forLoop(
						Arrays.asList(3, 2, 1)
							  .stream()
							  .onClose(() -> aClosed.set(true)),
						i ->
						{
							aSeen.add(i);

							return b.zero();
						}));

		assertTrue(fResult.isDone());
		assertEquals(Arrays.asList(3, 2, 1), aSeen);
		assertTrue(aClosed.get());
	}

	//~ Inner Classes ----------------------------------------------------------

	/********************************************************************
	 * An iterator over fixed values that records when it is closed.
	 *
	 * @author eso
	 */
	static class CloseableIterator implements Iterator<String>, AutoCloseable
	{
		//~ Instance fields ----------------------------------------------------

		private final AtomicBoolean rClosed;
		private final String[]		rValues;
		private int					nNext = 0;

		//~ Constructors -------------------------------------------------------

		/***************************************
		 * Creates a new instance.
		 *
		 * @param rClosed The flag to set on closing
		 * @param rValues The values to iterate
		 */
		CloseableIterator(AtomicBoolean rClosed, String... rValues)
		{
			this.rClosed = rClosed;
			this.rValues = rValues;
		}

		//~ Methods ------------------------------------------------------------

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public void close()
		{
			rClosed.set(true);
		}

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public boolean hasNext()
		{
			return nNext < rValues.length;
		}

		/***************************************
		 * {@inheritDoc}
		 */
		@Override
		public String next()
		{
			return rValues[nNext++];
		}
	}
}
