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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;


/********************************************************************
 * Test of {@link WhileLoop}.
 *
 * @author eso
 */
public class WhileLoopTest
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Test of a loop that fails in the condition.
	 */
	@Test
	public void testConditionFailure()
	{
		int[] aCount = { 0 };

		CompletableFuture<Void> fResult =
			Tasks.task(
				b ->
					b.whileLoop(
						() ->
						{
							if (aCount[0] == 2)
							{
								throw new IllegalStateException("TEST");
							}

							return true;
						},
						() ->
						{
							aCount[0]++;

							return b.zero();
						}));

		CompletionException e =
			assertThrows(CompletionException.class, fResult::join);

		assertTrue(e.getCause() instanceof IllegalStateException);
		assertEquals(2, aCount[0]);
	}

	/***************************************
	 * Test of a loop without suspensions.
	 */
	@Test
	public void testSynchronousLoop()
	{
		List<Integer> aIterations = new ArrayList<>();

		CompletableFuture<Integer> fResult =
			Tasks.task(
				b ->
					b.combine(
						b.whileLoop(
							() -> aIterations.size() < 5,
							() ->
							{
								aIterations.add(aIterations.size());

								return b.zero();
							}),
						() -> b.ret(aIterations.size())));

		assertTrue(fResult.isDone());
		assertEquals(5, fResult.join());
		assertEquals(List.of(0, 1, 2, 3, 4), aIterations);
	}

	/***************************************
	 * Test that the body is invoked once per iteration independent of the
	 * number of suspensions in each iteration.
	 */
	@Test
	public void testSuspendingLoop()
	{
		List<ManualAwaitable<Integer>> aPending    = new ArrayList<>();
		int[]						   aBodyCalls  = { 0 };
		int[]						   aIterations = { 0 };

		CompletableFuture<Void> fResult =
			Tasks.task(
				b ->
					b.whileLoop(
						() -> aIterations[0] < 3,
						() ->
						{
							aBodyCalls[0]++;

							return b.bind(
								ManualAwaitable.pending(aPending),
								i ->
									b.bind(
										ManualAwaitable.pending(aPending),
										j ->
										{
											aIterations[0]++;

											return b.zero();
										}));
						}));

		int nResumes = 0;

		while (!aPending.isEmpty())
		{
			assertFalse(fResult.isDone());
			aPending.remove(0).complete(nResumes++);
		}

		assertTrue(fResult.isDone());
		assertEquals(6, nResumes);
		assertEquals(3, aBodyCalls[0]);
		assertEquals(3, aIterations[0]);
	}

	/***************************************
	 * Test that many synchronous iterations don't grow the stack, including
	 * iterations after a suspension.
	 */
	@Test
	public void testManySynchronousIterations()
	{
		ManualAwaitable<Integer> aStart	   = new ManualAwaitable<>();
		int[]					 aIterations = { 0 };

		CompletableFuture<Integer> fResult =
			Tasks.task(
				b ->
					b.bind(
						aStart,
						n ->
							b.combine(
								b.whileLoop(
									() -> aIterations[0] < n,
									() ->
									{
										aIterations[0]++;

										return b.zero();
									}),
								() -> b.ret(aIterations[0]))));

		aStart.complete(100_000);

		assertEquals(100_000, fResult.join());
	}
}
